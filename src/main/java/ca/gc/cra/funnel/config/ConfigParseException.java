package ca.gc.cra.funnel.config;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Signals that a logging configuration could not be loaded or is invalid.
 *
 * <p>Raised at facade construction only; it is fatal for the facade being built.</p>
 *
 * @since 0.1.0
 */
public final class ConfigParseException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final transient Path source;

  /**
   * Creates an exception for a configuration document.
   *
   * @param source configuration file, or {@code null} for programmatic documents
   * @param message description of the problem
   * @param cause underlying parser or validation failure; may be {@code null}
   */
  public ConfigParseException(Path source, String message, Throwable cause) {
    super(source == null ? message : message + " (" + source + ")", cause);
    this.source = source;
  }

  /**
   * Returns the offending configuration file.
   *
   * @return file path when the document came from disk
   */
  public Optional<Path> source() {
    return Optional.ofNullable(source);
  }
}
