package ca.gc.cra.funnel.application.port;

import ca.gc.cra.funnel.domain.log.LogRecord;

/**
 * <strong>What:</strong> Producer side of the shared record channel.
 * <p><strong>Why:</strong> Workers must be able to submit records without ever seeing the consumer side or the
 * sinks behind it.</p>
 * <p><strong>Role:</strong> Handle passed from the aggregation owner to worker threads or, through a pipe, to
 * worker processes.</p>
 * <p><strong>Thread-safety:</strong> Implementations accept concurrent {@link #send} calls; records from the same
 * producer thread are delivered in submission order.</p>
 *
 * @since 0.1.0
 * @see RecordChannel
 */
public interface ChannelHandle {
  /**
   * Submits a record to the collector.
   *
   * @param record record to enqueue; must not be {@code null}
   * @return {@link SendResult#ACCEPTED} when enqueued, otherwise the reason it was discarded
   */
  SendResult send(LogRecord record);

  /**
   * Reports whether the channel refuses new records.
   *
   * @return {@code true} once the channel has been closed
   */
  boolean isClosed();
}
