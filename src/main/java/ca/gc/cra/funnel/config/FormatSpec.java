package ca.gc.cra.funnel.config;

import java.util.Objects;

/**
 * Line template and date pattern of a sink's formatter.
 *
 * @param template {@code %(field)s}-style line template
 * @param datePattern strftime-style pattern for {@code %(asctime)s}
 * @since 0.1.0
 */
public record FormatSpec(String template, String datePattern) {
  /** Template used when a handler declares no {@code format}. */
  public static final String DEFAULT_TEMPLATE = "%(asctime)s - %(name)s - %(levelname)s - %(message)s";
  /** Date pattern used when a handler declares no {@code datefmt}. */
  public static final String DEFAULT_DATE_PATTERN = "%Y-%m-%d %H:%M:%S";

  public FormatSpec {
    template = Objects.requireNonNullElse(template, DEFAULT_TEMPLATE);
    datePattern = Objects.requireNonNullElse(datePattern, DEFAULT_DATE_PATTERN);
  }

  /**
   * Returns the default format.
   *
   * @return format using {@link #DEFAULT_TEMPLATE} and {@link #DEFAULT_DATE_PATTERN}
   */
  public static FormatSpec defaults() {
    return new FormatSpec(DEFAULT_TEMPLATE, DEFAULT_DATE_PATTERN);
  }

  /**
   * Returns a format using {@code template} and the default date pattern.
   *
   * @param template line template
   * @return format spec
   */
  public static FormatSpec of(String template) {
    return new FormatSpec(template, DEFAULT_DATE_PATTERN);
  }
}
