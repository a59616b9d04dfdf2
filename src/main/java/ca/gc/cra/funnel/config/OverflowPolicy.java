package ca.gc.cra.funnel.config;

import java.util.Locale;

/**
 * <strong>What:</strong> Behaviour of a bounded record channel when it is full.
 * <p><strong>Why:</strong> Callers must choose explicitly between backpressure and loss; the unbounded default
 * never reaches either.</p>
 *
 * @since 0.1.0
 */
public enum OverflowPolicy {
  /** The producer waits for free capacity, or until the channel closes. */
  BLOCK,
  /** The record is discarded and the producer is told via {@code SendResult.DROPPED}. */
  DROP;

  /**
   * Parses a policy name, defaulting to {@link #BLOCK} when blank.
   *
   * @param value textual policy such as {@code "drop"}
   * @return parsed policy
   * @throws IllegalArgumentException if the name is unknown
   */
  public static OverflowPolicy fromString(String value) {
    if (value == null || value.isBlank()) {
      return BLOCK;
    }
    try {
      return OverflowPolicy.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unknown queue overflow policy: " + value, ex);
    }
  }
}
