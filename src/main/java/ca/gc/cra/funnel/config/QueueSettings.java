package ca.gc.cra.funnel.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Record channel tuning for the aggregation owner.
 *
 * @param capacity maximum queued records; {@link #UNBOUNDED} for no limit
 * @param overflow behaviour when a bounded channel is full
 * @param shutdownTimeout how long pipe readers get to reach end of stream on stop, and the interval at which a
 *     collector still draining its backlog is reported; the drain itself is never cut short
 * @since 0.1.0
 */
public record QueueSettings(int capacity, OverflowPolicy overflow, Duration shutdownTimeout) {
  /** Capacity sentinel meaning the channel never fills. */
  public static final int UNBOUNDED = -1;
  /** Default drain timeout. */
  public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

  public QueueSettings {
    if (capacity != UNBOUNDED && capacity < 1) {
      throw new IllegalArgumentException("queue.size must be -1 (unbounded) or positive (was " + capacity + ")");
    }
    overflow = Objects.requireNonNullElse(overflow, OverflowPolicy.BLOCK);
    shutdownTimeout = Objects.requireNonNullElse(shutdownTimeout, DEFAULT_SHUTDOWN_TIMEOUT);
    if (shutdownTimeout.isNegative() || shutdownTimeout.isZero()) {
      throw new IllegalArgumentException("queue.shutdown_timeout_ms must be positive");
    }
  }

  /**
   * Returns unbounded, blocking settings with the default timeout.
   *
   * @return default queue settings
   */
  public static QueueSettings defaults() {
    return new QueueSettings(UNBOUNDED, OverflowPolicy.BLOCK, DEFAULT_SHUTDOWN_TIMEOUT);
  }

  /**
   * Returns a copy with another capacity.
   *
   * @param newCapacity capacity or {@link #UNBOUNDED}
   * @return updated settings
   */
  public QueueSettings withCapacity(int newCapacity) {
    return new QueueSettings(newCapacity, overflow, shutdownTimeout);
  }

  /**
   * Reports whether the channel has a capacity limit.
   *
   * @return {@code true} when bounded
   */
  public boolean bounded() {
    return capacity != UNBOUNDED;
  }

  static QueueSettings fromSection(Section section) {
    int capacity = section.intValue("size", UNBOUNDED, UNBOUNDED, Integer.MAX_VALUE);
    OverflowPolicy overflow = OverflowPolicy.fromString(section.string("overflow", null));
    long timeoutMs = section.longValue(
        "shutdown_timeout_ms", DEFAULT_SHUTDOWN_TIMEOUT.toMillis(), 1, Duration.ofHours(1).toMillis());
    return new QueueSettings(capacity, overflow, Duration.ofMillis(timeoutMs));
  }
}
