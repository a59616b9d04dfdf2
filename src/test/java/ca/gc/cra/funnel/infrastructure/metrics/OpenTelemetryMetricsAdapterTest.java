package ca.gc.cra.funnel.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.funnel.application.port.MetricsPort;
import ca.gc.cra.funnel.config.MetricsSettings;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader));
  }

  @AfterEach
  void tearDown() {
    adapter.close();
  }

  @Test
  void incrementExportsCounter() {
    adapter.increment("funnel.channel.sent");
    adapter.increment("funnel.channel.sent");
    adapter.increment("funnel.channel.dropped");
    adapter.forceFlush();

    Collection<MetricData> metrics = reader.collectAllMetrics();
    MetricData sent = find(metrics, "funnel.channel.sent");
    assertEquals(MetricDataType.LONG_SUM, sent.getType());
    LongPointData point = sent.getLongSumData().getPoints().iterator().next();
    assertEquals(2L, point.getValue());
    assertEquals(1L, find(metrics, "funnel.channel.dropped").getLongSumData().getPoints().iterator().next().getValue());

    assertEquals("log-funnel", sent.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    String instance = sent.getResource().getAttribute(AttributeKey.stringKey("service.instance.id"));
    assertTrue(instance != null && !instance.isBlank(), "Service instance id should be provided");
    assertEquals(OpenTelemetryBootstrap.INSTRUMENTATION_SCOPE, sent.getInstrumentationScopeInfo().getName());
  }

  @Test
  void observeExportsHistogram() {
    adapter.observe("funnel.channel.depth", 3);
    adapter.observe("funnel.channel.depth", 7);

    MetricData depth = find(reader.collectAllMetrics(), "funnel.channel.depth");
    assertEquals(MetricDataType.HISTOGRAM, depth.getType());
    HistogramPointData point = depth.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(10.0d, point.getSum());
    assertEquals(7.0d, point.getMax());
  }

  @Test
  void disabledSettingsYieldNoop() {
    assertSame(MetricsPort.NO_OP, OpenTelemetryMetricsAdapter.create(MetricsSettings.disabled()));

    try (OpenTelemetryMetricsAdapter disabled = new OpenTelemetryMetricsAdapter(MetricsSettings.disabled())) {
      assertTrue(disabled.isNoop());
      disabled.increment("funnel.channel.sent");
      disabled.forceFlush();
    }
  }

  private static MetricData find(Collection<MetricData> metrics, String name) {
    return metrics.stream()
        .filter(metric -> metric.getName().equals(name))
        .findFirst()
        .orElseThrow(() -> new AssertionError("Expected metric " + name));
  }
}
