package ca.gc.cra.funnel.application.port;

import ca.gc.cra.funnel.domain.log.LogRecord;
import java.util.Optional;

/**
 * <strong>What:</strong> Conduit between record producers and the single collector.
 * <p><strong>Why:</strong> It is the only mutable structure shared between producers and the sink owner, so all
 * cross-thread coordination is encapsulated here.</p>
 * <p><strong>Role:</strong> Owned by the aggregation owner; producers only ever receive
 * {@link #producerHandle()}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Accept records from many producers without blocking them under normal operation.</li>
 *   <li>Hand records to exactly one consumer, FIFO per producer.</li>
 *   <li>Refuse new records once closed while keeping queued records available until drained.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> {@link #send} is safe from any thread; {@link #receive()} must be called by
 * the collector thread only.</p>
 *
 * @since 0.1.0
 */
public interface RecordChannel extends ChannelHandle {
  /**
   * Waits for the next record.
   *
   * @return next record, or empty once the channel is closed and fully drained
   * @throws InterruptedException if the waiting thread is interrupted
   */
  Optional<LogRecord> receive() throws InterruptedException;

  /**
   * Closes the channel; subsequent sends return {@link SendResult#CLOSED}. Idempotent.
   */
  void close();

  /**
   * Returns the number of records waiting for the collector.
   *
   * @return current depth
   */
  int size();

  /**
   * Returns a send-only view safe to hand to workers.
   *
   * @return handle that cannot be used to receive or close
   */
  ChannelHandle producerHandle();
}
