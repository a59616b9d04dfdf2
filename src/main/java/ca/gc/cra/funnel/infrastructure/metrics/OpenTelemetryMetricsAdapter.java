package ca.gc.cra.funnel.infrastructure.metrics;

import ca.gc.cra.funnel.application.port.MetricsPort;
import ca.gc.cra.funnel.config.MetricsSettings;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * <strong>What:</strong> {@link MetricsPort} forwarding pipeline counters and observations to OpenTelemetry.
 * <p><strong>Role:</strong> Created by the facade when {@code metrics.exporter} is {@code otlp}; closed on
 * {@code stop()}.</p>
 * <p><strong>Thread-safety:</strong> Instruments are created lazily in concurrent maps; safe from any thread.</p>
 *
 * @since 0.1.0
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private final OpenTelemetryBootstrap.BootstrapResult bootstrap;
  private final Meter meter;
  private final ConcurrentMap<String, LongCounter> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, LongHistogram> histograms = new ConcurrentHashMap<>();

  /**
   * Creates an adapter exporting according to {@code settings}.
   *
   * @param settings exporter selection and endpoint
   */
  public OpenTelemetryMetricsAdapter(MetricsSettings settings) {
    this(OpenTelemetryBootstrap.initialize(settings));
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    this.meter = bootstrap.meter();
  }

  /**
   * Returns the metrics port for {@code settings}: {@link MetricsPort#NO_OP} when no exporter is configured.
   *
   * @param settings metrics settings
   * @return metrics port; close it with {@link #closeQuietly(MetricsPort)}
   */
  public static MetricsPort create(MetricsSettings settings) {
    if (settings.exporter() == MetricsSettings.Exporter.NONE) {
      return MetricsPort.NO_OP;
    }
    return new OpenTelemetryMetricsAdapter(settings);
  }

  /**
   * Releases {@code port} when it is an OpenTelemetry adapter.
   *
   * @param port port returned by {@link #create(MetricsSettings)}
   */
  public static void closeQuietly(MetricsPort port) {
    if (port instanceof OpenTelemetryMetricsAdapter adapter) {
      adapter.close();
    }
  }

  @Override
  public void increment(String key) {
    Objects.requireNonNull(key, "key");
    counters.computeIfAbsent(key, name -> meter.counterBuilder(name)
            .setUnit("1")
            .setDescription("Log funnel counter " + name)
            .build())
        .add(1);
  }

  @Override
  public void observe(String key, long value) {
    Objects.requireNonNull(key, "key");
    histograms.computeIfAbsent(key, name -> meter.histogramBuilder(name)
            .ofLongs()
            .setDescription("Log funnel observation " + name)
            .build())
        .record(value);
  }

  boolean isNoop() {
    return bootstrap.isNoop();
  }

  void forceFlush() {
    bootstrap.forceFlush();
  }

  @Override
  public void close() {
    bootstrap.close();
  }
}
