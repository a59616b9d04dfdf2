package ca.gc.cra.funnel.config;

import java.util.Locale;

/**
 * <strong>What:</strong> Kinds of sinks the factory can build.
 * <p><strong>Role:</strong> Configuration enum mapping the {@code type} tag of a handler entry.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum SinkKind {
  /** Standard error or standard output. */
  CONSOLE("stream"),
  /** Plain file opened in append or truncate mode. */
  FILE("file"),
  /** File rotated once it exceeds a byte threshold. */
  ROTATING_BY_SIZE("rotating_file"),
  /** File rotated on a wall-clock schedule. */
  ROTATING_BY_TIME("timed_rotating_file");

  private final String configTag;

  SinkKind(String configTag) {
    this.configTag = configTag;
  }

  /**
   * Returns the tag used in configuration documents.
   *
   * @return tag such as {@code rotating_file}
   */
  public String configTag() {
    return configTag;
  }

  /**
   * Reports whether sinks of this kind write to a file path.
   *
   * @return {@code true} for every kind except {@link #CONSOLE}
   */
  public boolean fileBased() {
    return this != CONSOLE;
  }

  /**
   * Parses a configuration tag, defaulting to {@link #CONSOLE} when blank.
   *
   * <p>Accepts the configuration tags ({@code stream}, {@code file}, {@code rotating_file},
   * {@code timed_rotating_file}) and the descriptive names ({@code console}, {@code rotating-by-size},
   * {@code rotating-by-time}).</p>
   *
   * @param value textual kind
   * @return parsed kind
   * @throws IllegalArgumentException if the tag is unknown
   */
  public static SinkKind fromTag(String value) {
    if (value == null || value.isBlank()) {
      return CONSOLE;
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
    return switch (normalized) {
      case "stream", "console" -> CONSOLE;
      case "file" -> FILE;
      case "rotating_file", "rotating_by_size" -> ROTATING_BY_SIZE;
      case "timed_rotating_file", "rotating_by_time" -> ROTATING_BY_TIME;
      default -> throw new IllegalArgumentException("Unknown handler type: " + value);
    };
  }
}
