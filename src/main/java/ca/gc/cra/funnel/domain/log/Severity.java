package ca.gc.cra.funnel.domain.log;

import java.util.Locale;

/**
 * <strong>What:</strong> Ordered severity levels used to filter log records.
 * <p><strong>Why:</strong> Channels and sinks compare a record's severity against their configured minimum.</p>
 * <p><strong>Role:</strong> Domain enum shared by producers, the collector, and configuration parsing.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum Severity {
  /** Diagnostic detail. */
  DEBUG(10),
  /** Normal operational messages. */
  INFO(20),
  /** Unexpected but recoverable conditions. */
  WARNING(30),
  /** Failures of a single operation. */
  ERROR(40),
  /** Failures that threaten the whole process. */
  CRITICAL(50);

  private final int value;

  Severity(int value) {
    this.value = value;
  }

  /**
   * Returns the numeric level used by {@code %(levelno)d} format fields.
   *
   * @return numeric level, multiples of ten starting at {@code 10}
   */
  public int value() {
    return value;
  }

  /**
   * Tests whether this severity passes a minimum threshold.
   *
   * @param threshold minimum severity; must not be {@code null}
   * @return {@code true} when this severity is at least {@code threshold}
   */
  public boolean isAtLeast(Severity threshold) {
    return value >= threshold.value;
  }

  /**
   * Parses a textual or numeric severity.
   *
   * <p>Accepts constant names case-insensitively, the aliases {@code WARN} and {@code FATAL}, and
   * numeric values; numbers are rounded down to the nearest defined level.</p>
   *
   * @param raw textual severity such as {@code "info"} or {@code "30"}
   * @return parsed severity
   * @throws IllegalArgumentException if the value is blank or unknown
   */
  public static Severity parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("severity must not be blank");
    }
    String normalized = raw.trim().toUpperCase(Locale.ROOT);
    switch (normalized) {
      case "WARN":
        return WARNING;
      case "FATAL":
        return CRITICAL;
      default:
        break;
    }
    if (!normalized.isEmpty() && Character.isDigit(normalized.charAt(0))) {
      return fromValue(Integer.parseInt(normalized));
    }
    try {
      return Severity.valueOf(normalized);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unknown severity: " + raw, ex);
    }
  }

  /**
   * Maps a numeric level to the highest severity not above it.
   *
   * @param numeric numeric level; values below {@code 10} map to {@link #DEBUG}
   * @return matching severity
   */
  public static Severity fromValue(int numeric) {
    Severity match = DEBUG;
    for (Severity candidate : values()) {
      if (candidate.value <= numeric) {
        match = candidate;
      }
    }
    return match;
  }
}
