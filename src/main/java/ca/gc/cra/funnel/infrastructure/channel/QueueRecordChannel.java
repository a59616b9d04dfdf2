package ca.gc.cra.funnel.infrastructure.channel;

import ca.gc.cra.funnel.application.port.ChannelHandle;
import ca.gc.cra.funnel.application.port.MetricsPort;
import ca.gc.cra.funnel.application.port.RecordChannel;
import ca.gc.cra.funnel.application.port.SendResult;
import ca.gc.cra.funnel.config.OverflowPolicy;
import ca.gc.cra.funnel.config.QueueSettings;
import ca.gc.cra.funnel.domain.log.LogRecord;
import java.util.ArrayDeque;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * <strong>What:</strong> In-memory {@link RecordChannel} backed by a lock-guarded deque.
 * <p><strong>Capacity:</strong> Unbounded when {@code capacity < 0}. When bounded, a full channel either blocks
 * the sender until space frees up or the channel closes ({@link OverflowPolicy#BLOCK}) or drops the record
 * ({@link OverflowPolicy#DROP}).</p>
 * <p><strong>Ordering:</strong> FIFO; records from one producer thread keep their relative order.</p>
 * <p><strong>Observability:</strong> Emits {@code funnel.channel.sent}, {@code funnel.channel.dropped},
 * {@code funnel.channel.closed}, and the {@code funnel.channel.depth} observation.</p>
 * <p><strong>Thread-safety:</strong> Any thread may send; one collector thread receives.</p>
 *
 * @since 0.1.0
 */
public final class QueueRecordChannel implements RecordChannel {
  private final ArrayDeque<LogRecord> queue = new ArrayDeque<>();
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition notEmpty = lock.newCondition();
  private final Condition notFull = lock.newCondition();
  private final int capacity;
  private final OverflowPolicy overflow;
  private final MetricsPort metrics;
  private final ChannelHandle producerView;
  private boolean closed;

  /**
   * @param capacity maximum queued records; negative for unbounded, {@code 0} is rejected
   * @param overflow behaviour of {@link #send} when the channel is full
   * @param metrics metrics sink
   */
  public QueueRecordChannel(int capacity, OverflowPolicy overflow, MetricsPort metrics) {
    if (capacity == 0) {
      throw new IllegalArgumentException("capacity must be positive or negative for unbounded");
    }
    this.capacity = capacity;
    this.overflow = Objects.requireNonNull(overflow, "overflow");
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
    this.producerView = new ProducerHandle(this);
  }

  /**
   * Creates a channel from queue settings.
   *
   * @param settings capacity and overflow policy
   * @param metrics metrics sink
   * @return new open channel
   */
  public static QueueRecordChannel from(QueueSettings settings, MetricsPort metrics) {
    return new QueueRecordChannel(settings.capacity(), settings.overflow(), metrics);
  }

  /** Unbounded channel without metrics. */
  public static QueueRecordChannel unbounded() {
    return new QueueRecordChannel(QueueSettings.UNBOUNDED, OverflowPolicy.BLOCK, MetricsPort.NO_OP);
  }

  @Override
  public SendResult send(LogRecord record) {
    Objects.requireNonNull(record, "record");
    SendResult result = enqueue(record);
    switch (result) {
      case ACCEPTED -> metrics.increment("funnel.channel.sent");
      case DROPPED -> metrics.increment("funnel.channel.dropped");
      case CLOSED -> metrics.increment("funnel.channel.closed");
    }
    return result;
  }

  private SendResult enqueue(LogRecord record) {
    lock.lock();
    try {
      while (!closed && full()) {
        if (overflow == OverflowPolicy.DROP) {
          return SendResult.DROPPED;
        }
        try {
          notFull.await();
        } catch (InterruptedException ex) {
          Thread.currentThread().interrupt();
          return SendResult.DROPPED;
        }
      }
      if (closed) {
        return SendResult.CLOSED;
      }
      queue.addLast(record);
      metrics.observe("funnel.channel.depth", queue.size());
      notEmpty.signal();
      return SendResult.ACCEPTED;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public Optional<LogRecord> receive() throws InterruptedException {
    lock.lockInterruptibly();
    try {
      while (queue.isEmpty()) {
        if (closed) {
          return Optional.empty();
        }
        notEmpty.await();
      }
      LogRecord next = queue.removeFirst();
      notFull.signal();
      return Optional.of(next);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void close() {
    lock.lock();
    try {
      closed = true;
      notEmpty.signalAll();
      notFull.signalAll();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public boolean isClosed() {
    lock.lock();
    try {
      return closed;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public int size() {
    lock.lock();
    try {
      return queue.size();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public ChannelHandle producerHandle() {
    return producerView;
  }

  private boolean full() {
    return capacity > 0 && queue.size() >= capacity;
  }

  @Override
  public String toString() {
    return "QueueRecordChannel(capacity=" + (capacity < 0 ? "unbounded" : capacity) + ", overflow=" + overflow + ")";
  }

  private record ProducerHandle(ChannelHandle delegate) implements ChannelHandle {
    @Override
    public SendResult send(LogRecord record) {
      return delegate.send(record);
    }

    @Override
    public boolean isClosed() {
      return delegate.isClosed();
    }
  }
}
