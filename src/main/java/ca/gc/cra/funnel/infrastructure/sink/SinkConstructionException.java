package ca.gc.cra.funnel.infrastructure.sink;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Raised when a configured sink cannot be built, for example because its parent directory is missing.
 *
 * <p>Failures are isolated per sink: the facade reports the exception and keeps building the others.</p>
 *
 * @since 0.1.0
 */
public final class SinkConstructionException extends Exception {
  private static final long serialVersionUID = 1L;

  private final String sinkName;
  private final transient Path path;

  /**
   * Creates an exception for sink {@code sinkName}.
   *
   * @param sinkName handler name from the configuration
   * @param path target path; {@code null} for console sinks
   * @param message description of the failure
   * @param cause underlying failure; may be {@code null}
   */
  public SinkConstructionException(String sinkName, Path path, String message, Throwable cause) {
    super(message, cause);
    this.sinkName = sinkName;
    this.path = path;
  }

  /**
   * Returns the handler name of the failed sink.
   *
   * @return sink name
   */
  public String sinkName() {
    return sinkName;
  }

  /**
   * Returns the target path of the failed sink.
   *
   * @return path, or empty for console sinks
   */
  public Optional<Path> path() {
    return Optional.ofNullable(path);
  }
}
