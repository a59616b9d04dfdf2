package ca.gc.cra.funnel.application.dispatch;

import ca.gc.cra.funnel.application.port.MetricsPort;
import ca.gc.cra.funnel.application.port.SinkWriteException;
import ca.gc.cra.funnel.domain.log.LogRecord;
import ca.gc.cra.funnel.logging.Logs;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Writes a record to every sink its channel routes to.
 * <p><strong>Why:</strong> One failing sink must not stop the others or reach the producer.</p>
 * <p><strong>Role:</strong> Called on the caller thread in standalone mode and on the collector thread
 * otherwise.</p>
 * <p><strong>Observability:</strong> Emits {@code funnel.sink.write.error} and
 * {@code funnel.collector.dispatch.error}; failures are logged at {@code WARN} with the sink name.</p>
 * <p><strong>Thread-safety:</strong> Thread-safe; per-sink serialization lives in {@link SinkBinding}.</p>
 *
 * @since 0.1.0
 */
public final class RecordDispatcher {
  private static final Logger log = LoggerFactory.getLogger(RecordDispatcher.class);
  private static final int MAX_REPORTED_MESSAGE_BYTES = 256;

  private final ChannelRegistry registry;
  private final MetricsPort metrics;

  /**
   * @param registry channel tree used for routing
   * @param metrics metrics sink; {@link MetricsPort#NO_OP} when disabled
   */
  public RecordDispatcher(ChannelRegistry registry, MetricsPort metrics) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
  }

  /**
   * Writes {@code record} to each routed sink whose own level accepts it.
   *
   * <p>The channel's effective level is not re-checked here; producers filter before sending.</p>
   *
   * @param record record to write
   * @return number of sinks that wrote the record
   */
  public int dispatch(LogRecord record) {
    int written = 0;
    for (SinkBinding binding : registry.route(record.channelName())) {
      if (!binding.accepts(record.severity())) {
        continue;
      }
      try {
        binding.publish(record);
        written++;
      } catch (SinkWriteException ex) {
        metrics.increment("funnel.sink.write.error");
        log.warn("Sink {} failed to write record from channel {} ({}): {}",
            binding.name(), record.channelName(),
            Logs.truncate(record.message(), MAX_REPORTED_MESSAGE_BYTES),
            ex.getCause() == null ? ex.getMessage() : ex.getCause().toString());
      } catch (RuntimeException ex) {
        metrics.increment("funnel.collector.dispatch.error");
        log.warn("Unexpected failure dispatching record from channel {} to sink {}",
            record.channelName(), binding.name(), ex);
      }
    }
    return written;
  }
}
