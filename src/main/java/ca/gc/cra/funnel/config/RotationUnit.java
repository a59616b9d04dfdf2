package ca.gc.cra.funnel.config;

import java.time.DayOfWeek;
import java.util.Locale;

/**
 * <strong>What:</strong> Rotation schedule units for time-rotating sinks.
 * <p><strong>Role:</strong> Parsed from the {@code when} key; also fixes the backup file suffix pattern.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum RotationUnit {
  SECONDS("%Y-%m-%d_%H-%M-%S", "\\d{4}-\\d{2}-\\d{2}_\\d{2}-\\d{2}-\\d{2}"),
  MINUTES("%Y-%m-%d_%H-%M", "\\d{4}-\\d{2}-\\d{2}_\\d{2}-\\d{2}"),
  HOURS("%Y-%m-%d_%H", "\\d{4}-\\d{2}-\\d{2}_\\d{2}"),
  DAYS("%Y-%m-%d", "\\d{4}-\\d{2}-\\d{2}"),
  MIDNIGHT("%Y-%m-%d", "\\d{4}-\\d{2}-\\d{2}"),
  WEEKDAY_0("%Y-%m-%d", "\\d{4}-\\d{2}-\\d{2}"),
  WEEKDAY_1("%Y-%m-%d", "\\d{4}-\\d{2}-\\d{2}"),
  WEEKDAY_2("%Y-%m-%d", "\\d{4}-\\d{2}-\\d{2}"),
  WEEKDAY_3("%Y-%m-%d", "\\d{4}-\\d{2}-\\d{2}"),
  WEEKDAY_4("%Y-%m-%d", "\\d{4}-\\d{2}-\\d{2}"),
  WEEKDAY_5("%Y-%m-%d", "\\d{4}-\\d{2}-\\d{2}"),
  WEEKDAY_6("%Y-%m-%d", "\\d{4}-\\d{2}-\\d{2}");

  private final String suffixPattern;
  private final String suffixRegex;

  RotationUnit(String suffixPattern, String suffixRegex) {
    this.suffixPattern = suffixPattern;
    this.suffixRegex = suffixRegex;
  }

  /**
   * Returns the strftime pattern appended to rotated file names.
   *
   * @return suffix pattern such as {@code %Y-%m-%d}
   */
  public String suffixPattern() {
    return suffixPattern;
  }

  /**
   * Returns a regular expression matching suffixes produced by {@link #suffixPattern()}.
   *
   * @return suffix regex
   */
  public String suffixRegex() {
    return suffixRegex;
  }

  /**
   * Reports whether this unit rolls on a weekday boundary.
   *
   * @return {@code true} for {@code W0..W6}
   */
  public boolean weekly() {
    return ordinal() >= WEEKDAY_0.ordinal();
  }

  /**
   * Returns the rollover weekday for weekly units ({@code W0} is Monday).
   *
   * @return weekday of rollover
   * @throws IllegalStateException if this unit is not weekly
   */
  public DayOfWeek dayOfWeek() {
    if (!weekly()) {
      throw new IllegalStateException(this + " is not a weekly unit");
    }
    return DayOfWeek.of(ordinal() - WEEKDAY_0.ordinal() + 1);
  }

  /**
   * Parses the {@code when} value ({@code S, M, H, D, MIDNIGHT, W0..W6}), defaulting to {@link #MIDNIGHT}.
   *
   * @param value textual unit
   * @return parsed unit
   * @throws IllegalArgumentException if the value is unknown
   */
  public static RotationUnit fromString(String value) {
    if (value == null || value.isBlank()) {
      return MIDNIGHT;
    }
    String normalized = value.trim().toUpperCase(Locale.ROOT);
    return switch (normalized) {
      case "S" -> SECONDS;
      case "M" -> MINUTES;
      case "H" -> HOURS;
      case "D" -> DAYS;
      case "MIDNIGHT" -> MIDNIGHT;
      case "W0", "W1", "W2", "W3", "W4", "W5", "W6" ->
          values()[WEEKDAY_0.ordinal() + (normalized.charAt(1) - '0')];
      default -> throw new IllegalArgumentException("Unknown rotation unit: " + value);
    };
  }
}
