package ca.gc.cra.funnel.application.port;

/**
 * <strong>What:</strong> Port abstracting metrics emission for the logging pipeline.
 * <p><strong>Why:</strong> Lets the channel, collector, and sinks record counters and queue depths without
 * binding to a vendor SDK.</p>
 * <p><strong>Role:</strong> Output port implemented by adapters such as {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Expose counter increments for events like dropped records or sink write failures.</li>
 *   <li>Record numeric observations such as channel depth.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent updates from producer threads
 * and the collector thread.</p>
 * <p><strong>Performance:</strong> Calls sit on the {@code emit} path; they must not block.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code funnel.channel.dropped}).</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key metric identifier using dotted naming (e.g., {@code funnel.sink.write.error}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram/gauge style metric.
   *
   * @param key metric identifier using dotted naming; must not be {@code null}
   * @param value observed value; semantics defined by the caller
   */
  void observe(String key, long value);

  /**
   * Metrics implementation that ignores all updates.
   *
   * <p><strong>Concurrency:</strong> Thread-safe.</p>
   * <p><strong>Observability:</strong> Drops all metrics; the default when no exporter is configured.</p>
   */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
