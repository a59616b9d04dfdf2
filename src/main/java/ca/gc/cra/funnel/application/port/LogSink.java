package ca.gc.cra.funnel.application.port;

import ca.gc.cra.funnel.domain.log.Severity;
import java.io.IOException;

/**
 * <strong>What:</strong> Terminal destination for formatted log lines.
 * <p><strong>Why:</strong> Decouples dispatch from the console, file, and rotating-file implementations.</p>
 * <p><strong>Role:</strong> Output port built by {@code SinkFactory} and owned exclusively by one dispatcher.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; callers serialize access (see {@code SinkBinding}).</p>
 *
 * @since 0.1.0
 */
public interface LogSink extends AutoCloseable {
  /**
   * Writes one formatted line; the sink appends the line terminator.
   *
   * @param line formatted record without trailing newline
   * @param severity severity of the originating record
   * @throws IOException if the underlying stream rejects the write
   */
  void write(String line, Severity severity) throws IOException;

  /**
   * Flushes buffered bytes to the destination.
   *
   * @throws IOException if flushing fails
   */
  void flush() throws IOException;

  /**
   * Releases the destination. Sinks that do not own their stream only flush.
   *
   * @throws IOException if closing fails
   */
  @Override
  void close() throws IOException;
}
