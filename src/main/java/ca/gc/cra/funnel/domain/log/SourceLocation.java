package ca.gc.cra.funnel.domain.log;

import java.util.Objects;

/**
 * Call-site metadata attached to a {@link LogRecord}.
 *
 * @param file source file name (for example {@code OrderService.java}); never {@code null}
 * @param line line number, or {@code 0} when unknown
 * @param method method name; empty when unknown
 * @since 0.1.0
 */
public record SourceLocation(String file, int line, String method) {
  private static final String UNKNOWN_FILE = "(unknown file)";

  /** Placeholder used when the call site cannot be determined. */
  public static final SourceLocation UNKNOWN = new SourceLocation(UNKNOWN_FILE, 0, "");

  public SourceLocation {
    file = Objects.requireNonNullElse(file, UNKNOWN_FILE);
    method = Objects.requireNonNullElse(method, "");
    if (line < 0) {
      throw new IllegalArgumentException("line must not be negative (was " + line + ")");
    }
  }

  /**
   * Returns the file name without its extension, used for the {@code %(module)s} format field.
   *
   * @return module name derived from {@link #file()}
   */
  public String module() {
    int dot = file.lastIndexOf('.');
    return dot > 0 ? file.substring(0, dot) : file;
  }
}
