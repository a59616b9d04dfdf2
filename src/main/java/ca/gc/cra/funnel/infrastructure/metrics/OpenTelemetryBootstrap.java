package ca.gc.cra.funnel.infrastructure.metrics;

import ca.gc.cra.funnel.config.MetricsSettings;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.MeterProvider;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.lang.management.ManagementFactory;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the OpenTelemetry meter provider selected by the {@code metrics} configuration section.
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  static final String INSTRUMENTATION_SCOPE = "ca.gc.cra.funnel";
  private static final Duration EXPORT_INTERVAL = Duration.ofSeconds(30);
  private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
  private static final AttributeKey<String> SERVICE_INSTANCE_ID = AttributeKey.stringKey("service.instance.id");

  private OpenTelemetryBootstrap() {
    // Utility class
  }

  static BootstrapResult initialize(MetricsSettings settings) {
    Objects.requireNonNull(settings, "settings");
    if (settings.exporter() == MetricsSettings.Exporter.NONE) {
      return BootstrapResult.noop();
    }
    try {
      OtlpGrpcMetricExporter exporter =
          OtlpGrpcMetricExporter.builder().setEndpoint(settings.endpoint()).build();
      MetricReader reader = PeriodicMetricReader.builder(exporter).setInterval(EXPORT_INTERVAL).build();
      BootstrapResult result = build(reader);
      log.info("OpenTelemetry metrics exporting to {}", settings.endpoint());
      return result;
    } catch (RuntimeException ex) {
      log.error("Failed to initialize OpenTelemetry metrics; metrics disabled", ex);
      return BootstrapResult.noop();
    }
  }

  static BootstrapResult forTesting(MetricReader reader) {
    return build(Objects.requireNonNull(reader, "reader"));
  }

  private static BootstrapResult build(MetricReader reader) {
    Attributes attributes = Attributes.of(
        SERVICE_NAME, "log-funnel",
        SERVICE_INSTANCE_ID, ManagementFactory.getRuntimeMXBean().getName());
    SdkMeterProvider provider = SdkMeterProvider.builder()
        .setResource(Resource.getDefault().merge(Resource.create(attributes)))
        .registerMetricReader(reader)
        .build();
    Meter meter = provider.get(INSTRUMENTATION_SCOPE);
    return BootstrapResult.active(provider, meter);
  }

  static final class BootstrapResult implements AutoCloseable {
    private final Meter meter;
    private final SdkMeterProvider provider;

    private BootstrapResult(Meter meter, SdkMeterProvider provider) {
      this.meter = meter;
      this.provider = provider;
    }

    static BootstrapResult noop() {
      return new BootstrapResult(MeterProvider.noop().get(INSTRUMENTATION_SCOPE), null);
    }

    static BootstrapResult active(SdkMeterProvider provider, Meter meter) {
      return new BootstrapResult(meter, provider);
    }

    Meter meter() {
      return meter;
    }

    boolean isNoop() {
      return provider == null;
    }

    void forceFlush() {
      if (provider == null) {
        return;
      }
      CompletableResultCode result = provider.forceFlush().join(5, TimeUnit.SECONDS);
      if (!result.isSuccess()) {
        log.warn("OpenTelemetry metrics flush did not complete within timeout");
      }
    }

    @Override
    public void close() {
      if (provider == null) {
        return;
      }
      try {
        CompletableResultCode shutdown = provider.shutdown().join(5, TimeUnit.SECONDS);
        if (!shutdown.isSuccess()) {
          log.warn("Timed out waiting for OpenTelemetry meter provider shutdown");
        }
      } catch (RuntimeException ex) {
        log.warn("Failed to close OpenTelemetry meter provider cleanly", ex);
      }
    }
  }
}
