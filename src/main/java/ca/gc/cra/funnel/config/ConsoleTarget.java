package ca.gc.cra.funnel.config;

import java.util.Locale;

/**
 * Standard stream a console sink writes to.
 *
 * @since 0.1.0
 */
public enum ConsoleTarget {
  STDERR,
  STDOUT;

  /**
   * Parses {@code stderr}/{@code stdout} (also {@code ext://sys.stderr} style), defaulting to {@link #STDERR}.
   *
   * @param value textual target
   * @return parsed target
   * @throws IllegalArgumentException if the value names another stream
   */
  public static ConsoleTarget fromString(String value) {
    if (value == null || value.isBlank()) {
      return STDERR;
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    if (normalized.endsWith("stderr")) {
      return STDERR;
    }
    if (normalized.endsWith("stdout")) {
      return STDOUT;
    }
    throw new IllegalArgumentException("Unknown console stream: " + value);
  }
}
