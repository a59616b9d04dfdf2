package ca.gc.cra.funnel.application.port;

import java.io.IOException;

/**
 * Wraps an {@link IOException} raised while a named sink was writing or flushing.
 *
 * @since 0.1.0
 */
public final class SinkWriteException extends Exception {
  private static final long serialVersionUID = 1L;

  private final String sinkName;

  /**
   * @param sinkName handler name of the failing sink
   * @param cause underlying I/O failure
   */
  public SinkWriteException(String sinkName, IOException cause) {
    super("Sink '" + sinkName + "' failed: " + cause.getMessage(), cause);
    this.sinkName = sinkName;
  }

  /**
   * Returns the handler name of the failing sink.
   *
   * @return sink name
   */
  public String sinkName() {
    return sinkName;
  }
}
