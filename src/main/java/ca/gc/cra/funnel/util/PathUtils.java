package ca.gc.cra.funnel.util;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Null-safe helpers for {@link Path} handling.
 *
 * @since 0.1.0
 */
public final class PathUtils {
  private PathUtils() {}

  /**
   * Returns the last name element of {@code path}.
   *
   * @param path path to inspect; may be {@code null}
   * @return file name, or empty for {@code null} paths and file system roots
   */
  public static Optional<String> fileName(Path path) {
    if (path == null) {
      return Optional.empty();
    }
    Path name = path.getFileName();
    return name == null ? Optional.empty() : Optional.of(name.toString());
  }

  /**
   * Returns the directory containing {@code path}, resolving relative paths against the working directory.
   *
   * @param path file path; must not be {@code null}
   * @return absolute parent directory
   */
  public static Path parentDirectory(Path path) {
    Path absolute = path.toAbsolutePath().normalize();
    Path parent = absolute.getParent();
    return parent == null ? absolute.getRoot() : parent;
  }

  /**
   * Moves {@code source} onto {@code target}, replacing it, atomically when the file system allows.
   *
   * @param source existing file
   * @param target destination; replaced when present
   * @throws IOException if the move fails
   */
  public static void moveReplacing(Path source, Path target) throws IOException {
    try {
      Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (AtomicMoveNotSupportedException ex) {
      Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }
}
