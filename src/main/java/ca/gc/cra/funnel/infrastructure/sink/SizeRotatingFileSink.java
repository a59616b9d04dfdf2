package ca.gc.cra.funnel.infrastructure.sink;

import ca.gc.cra.funnel.util.PathUtils;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * File sink that rolls once the next line would push the file past {@code maxBytes}.
 *
 * <p>Backups are named {@code f.1 .. f.backupCount}, {@code f.1} being the most recent. A line is written
 * wholly to one file. With {@code maxBytes == 0} or {@code backupCount == 0} the file grows without rolling.</p>
 *
 * @since 0.1.0
 */
public final class SizeRotatingFileSink extends FileSink {
  private final long maxBytes;
  private final int backupCount;

  /**
   * @param path active file
   * @param encoding charset for lines
   * @param append keep existing content of {@code path}
   * @param maxBytes size threshold in bytes; {@code 0} disables rolling
   * @param backupCount number of backups kept; {@code 0} disables rolling
   * @throws IOException if the file cannot be opened
   */
  public SizeRotatingFileSink(Path path, Charset encoding, boolean append, long maxBytes, int backupCount)
      throws IOException {
    super(path, encoding, append);
    this.maxBytes = maxBytes;
    this.backupCount = backupCount;
  }

  @Override
  protected void beforeWrite(int length) throws IOException {
    if (maxBytes <= 0 || backupCount <= 0) {
      return;
    }
    if (currentSize() > 0 && currentSize() + length > maxBytes) {
      reopen(this::shiftBackups);
    }
  }

  private void shiftBackups() throws IOException {
    Path active = path();
    for (int index = backupCount - 1; index >= 1; index--) {
      Path source = backup(active, index);
      if (Files.exists(source)) {
        PathUtils.moveReplacing(source, backup(active, index + 1));
      }
    }
    if (Files.exists(active)) {
      PathUtils.moveReplacing(active, backup(active, 1));
    }
  }

  static Path backup(Path active, int index) {
    return active.resolveSibling(active.getFileName() + "." + index);
  }
}
