package ca.gc.cra.funnel.application.dispatch;

import ca.gc.cra.funnel.application.port.LogSink;
import ca.gc.cra.funnel.application.port.RecordFormatter;
import ca.gc.cra.funnel.application.port.SinkWriteException;
import ca.gc.cra.funnel.domain.log.LogRecord;
import ca.gc.cra.funnel.domain.log.Severity;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.IOException;
import java.util.Objects;

/**
 * <strong>What:</strong> A built sink together with its name, minimum severity, and formatter.
 * <p><strong>Role:</strong> Unit of fan-out held by {@link ChannelRegistry} nodes and written by
 * {@link RecordDispatcher}.</p>
 * <p><strong>Thread-safety:</strong> {@link #publish(LogRecord)} is synchronized so concurrent standalone
 * callers never interleave lines; in aggregation mode only the collector thread calls it.</p>
 *
 * @since 0.1.0
 */
public final class SinkBinding {
  private final String name;
  private final LogSink sink;
  private final Severity level;
  private final RecordFormatter formatter;

  /**
   * @param name handler name
   * @param sink built sink; ownership passes to this binding
   * @param level minimum severity written
   * @param formatter line formatter
   */
  @SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "The binding takes ownership of the open sink.")
  public SinkBinding(String name, LogSink sink, Severity level, RecordFormatter formatter) {
    this.name = Objects.requireNonNull(name, "name");
    this.sink = Objects.requireNonNull(sink, "sink");
    this.level = Objects.requireNonNull(level, "level");
    this.formatter = Objects.requireNonNull(formatter, "formatter");
  }

  public String name() {
    return name;
  }

  public Severity level() {
    return level;
  }

  /**
   * Tests the sink's own severity threshold.
   *
   * @param severity record severity
   * @return {@code true} when the sink writes records of this severity
   */
  public boolean accepts(Severity severity) {
    return severity.isAtLeast(level);
  }

  /**
   * Formats and writes one record.
   *
   * @param record record to write
   * @throws SinkWriteException if the sink rejects the line
   */
  public synchronized void publish(LogRecord record) throws SinkWriteException {
    String line = formatter.format(record);
    try {
      sink.write(line, record.severity());
    } catch (IOException ex) {
      throw new SinkWriteException(name, ex);
    }
  }

  synchronized void close() throws SinkWriteException {
    try {
      sink.close();
    } catch (IOException ex) {
      throw new SinkWriteException(name, ex);
    }
  }

  @Override
  public String toString() {
    return "SinkBinding(" + name + ", " + level + ")";
  }
}
