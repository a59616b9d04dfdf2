package ca.gc.cra.funnel.infrastructure.sink;

import ca.gc.cra.funnel.application.port.LogSink;
import ca.gc.cra.funnel.domain.log.Severity;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * {@link LogSink} appending encoded lines to a single file.
 * <p>Each write is flushed so lines survive an abrupt exit. Not thread-safe; callers serialize access.</p>
 *
 * @since 0.1.0
 */
public class FileSink implements LogSink {
  private final Path path;
  private final Charset encoding;
  private OutputStream out;
  private long size;

  /**
   * Opens {@code path}, creating the file but never its directory.
   *
   * @param path target file
   * @param encoding charset used to encode lines
   * @param append {@code true} to keep existing content, {@code false} to truncate
   * @throws IOException if the file cannot be opened
   */
  public FileSink(Path path, Charset encoding, boolean append) throws IOException {
    this.path = Objects.requireNonNull(path, "path");
    this.encoding = Objects.requireNonNull(encoding, "encoding");
    open(append);
  }

  @Override
  public void write(String line, Severity severity) throws IOException {
    byte[] bytes = (line + '\n').getBytes(encoding);
    beforeWrite(bytes.length);
    ensureOpen().write(bytes);
    out.flush();
    size += bytes.length;
  }

  /**
   * Hook invoked before {@code length} bytes are written; rotating subclasses roll the file here.
   *
   * @param length encoded length of the pending line
   * @throws IOException if rolling fails
   */
  protected void beforeWrite(int length) throws IOException {}

  @Override
  public void flush() throws IOException {
    if (out != null) {
      out.flush();
    }
  }

  @Override
  public void close() throws IOException {
    if (out != null) {
      try {
        out.flush();
      } finally {
        out.close();
        out = null;
      }
    }
  }

  /** Path of the active file. */
  protected final Path path() {
    return path;
  }

  /** Bytes in the active file, including content present before it was opened in append mode. */
  protected final long currentSize() {
    return size;
  }

  /**
   * Closes the active file so subclasses can rename it, then reopens an empty one.
   *
   * @param rename action run between close and reopen
   * @throws IOException if closing, renaming, or reopening fails
   */
  protected final void reopen(IoAction rename) throws IOException {
    close();
    rename.run();
    open(false);
  }

  private void open(boolean append) throws IOException {
    StandardOpenOption mode = append ? StandardOpenOption.APPEND : StandardOpenOption.TRUNCATE_EXISTING;
    out = new BufferedOutputStream(
        Files.newOutputStream(path, StandardOpenOption.CREATE, StandardOpenOption.WRITE, mode));
    size = append ? Files.size(path) : 0L;
  }

  private OutputStream ensureOpen() throws IOException {
    if (out == null) {
      throw new IOException("sink for " + path + " is closed");
    }
    return out;
  }

  /** File operation run while the sink has no open stream. */
  @FunctionalInterface
  protected interface IoAction {
    void run() throws IOException;
  }
}
