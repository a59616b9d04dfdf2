package ca.gc.cra.funnel.infrastructure.sink;

import ca.gc.cra.funnel.application.port.LogSink;
import ca.gc.cra.funnel.domain.log.Severity;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Objects;

/**
 * {@link LogSink} writing to a console stream.
 * <p>The stream is not owned: {@link #close()} only flushes it.</p>
 *
 * @since 0.1.0
 */
public final class ConsoleSink implements LogSink {
  private final PrintStream stream;

  /**
   * @param stream target stream, usually {@link System#err}
   */
  public ConsoleSink(PrintStream stream) {
    this.stream = Objects.requireNonNull(stream, "stream");
  }

  @Override
  public void write(String line, Severity severity) throws IOException {
    stream.print(line);
    stream.print('\n');
    stream.flush();
    if (stream.checkError()) {
      throw new IOException("console stream reported a write error");
    }
  }

  @Override
  public void flush() {
    stream.flush();
  }

  @Override
  public void close() {
    stream.flush();
  }
}
