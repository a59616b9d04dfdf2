package ca.gc.cra.funnel.config;

import ca.gc.cra.funnel.domain.log.Severity;
import ca.gc.cra.funnel.validation.Strings;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable description of one configured sink.
 * <p><strong>Why:</strong> Captures everything {@code SinkFactory} needs so sinks can be built without re-reading
 * the configuration document.</p>
 * <p><strong>Role:</strong> Part of {@link LoggingConfig}; held only by processes that own sinks.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param name handler name from the configuration
 * @param kind sink kind
 * @param level minimum severity written by the sink
 * @param format formatter settings
 * @param target console stream; only meaningful for {@link SinkKind#CONSOLE}
 * @param path target file; {@code null} for console sinks
 * @param append {@code true} for mode {@code a}, {@code false} for mode {@code w}
 * @param encoding character set used to encode lines
 * @param maxBytes size threshold for {@link SinkKind#ROTATING_BY_SIZE}; {@code 0} disables rotation
 * @param backupCount number of rotated files kept
 * @param when rotation unit for {@link SinkKind#ROTATING_BY_TIME}
 * @param interval number of {@code when} units between rotations
 * @param utc whether time rotation and backup suffixes use UTC instead of the local zone
 * @since 0.1.0
 */
public record SinkSpec(
    String name,
    SinkKind kind,
    Severity level,
    FormatSpec format,
    ConsoleTarget target,
    Path path,
    boolean append,
    Charset encoding,
    long maxBytes,
    int backupCount,
    RotationUnit when,
    int interval,
    boolean utc) {

  /** Default file name for file-based handlers that omit {@code filename}. */
  public static final String DEFAULT_FILENAME = "app.log";
  /** Default {@code max_bytes} of size-rotating handlers (10 MiB). */
  public static final long DEFAULT_MAX_BYTES = 10L * 1024 * 1024;
  /** Default {@code backup_count} of size-rotating handlers. */
  public static final int DEFAULT_SIZE_BACKUPS = 5;
  /** Default {@code backup_count} of time-rotating handlers. */
  public static final int DEFAULT_TIME_BACKUPS = 7;

  public SinkSpec {
    name = Strings.requireNonBlank("handler name", name);
    kind = Objects.requireNonNull(kind, "kind");
    level = Objects.requireNonNullElse(level, Severity.INFO);
    format = Objects.requireNonNullElse(format, FormatSpec.defaults());
    target = Objects.requireNonNullElse(target, ConsoleTarget.STDERR);
    encoding = Objects.requireNonNullElse(encoding, StandardCharsets.UTF_8);
    when = Objects.requireNonNullElse(when, RotationUnit.MIDNIGHT);
    if (kind.fileBased()) {
      path = Objects.requireNonNullElse(path, Path.of(DEFAULT_FILENAME));
    }
    if (maxBytes < 0) {
      throw new IllegalArgumentException("handlers." + name + ".max_bytes must not be negative");
    }
    if (backupCount < 0) {
      throw new IllegalArgumentException("handlers." + name + ".backup_count must not be negative");
    }
    if (interval < 1) {
      throw new IllegalArgumentException("handlers." + name + ".interval must be at least 1");
    }
  }

  /**
   * Builds a console sink spec writing to standard error.
   *
   * @param name handler name
   * @param level minimum severity
   * @return console spec with default format
   */
  public static SinkSpec console(String name, Severity level) {
    return new SinkSpec(name, SinkKind.CONSOLE, level, null, ConsoleTarget.STDERR, null, true, null,
        0L, 0, null, 1, false);
  }

  /**
   * Builds an append-mode file sink spec.
   *
   * @param name handler name
   * @param path target file
   * @return file spec with default level and format
   */
  public static SinkSpec file(String name, Path path) {
    return new SinkSpec(name, SinkKind.FILE, Severity.INFO, null, null, path, true, null, 0L, 0, null, 1, false);
  }

  /**
   * Builds a size-rotating file sink spec.
   *
   * @param name handler name
   * @param path active file
   * @param maxBytes rotation threshold in bytes
   * @param backupCount rotated files kept
   * @return size-rotating spec
   */
  public static SinkSpec rotatingBySize(String name, Path path, long maxBytes, int backupCount) {
    return new SinkSpec(name, SinkKind.ROTATING_BY_SIZE, Severity.INFO, null, null, path, true, null,
        maxBytes, backupCount, null, 1, false);
  }

  /**
   * Builds a time-rotating file sink spec.
   *
   * @param name handler name
   * @param path active file
   * @param when rotation unit
   * @param interval units between rotations
   * @param backupCount rotated files kept
   * @return time-rotating spec
   */
  public static SinkSpec rotatingByTime(String name, Path path, RotationUnit when, int interval, int backupCount) {
    return new SinkSpec(name, SinkKind.ROTATING_BY_TIME, Severity.INFO, null, null, path, true, null,
        0L, backupCount, when, interval, false);
  }

  /**
   * Returns a copy with another minimum severity.
   *
   * @param newLevel minimum severity
   * @return updated spec
   */
  public SinkSpec withLevel(Severity newLevel) {
    return new SinkSpec(name, kind, newLevel, format, target, path, append, encoding, maxBytes, backupCount,
        when, interval, utc);
  }

  /**
   * Returns a copy with another formatter.
   *
   * @param newFormat formatter settings
   * @return updated spec
   */
  public SinkSpec withFormat(FormatSpec newFormat) {
    return new SinkSpec(name, kind, level, newFormat, target, path, append, encoding, maxBytes, backupCount,
        when, interval, utc);
  }

  /**
   * Returns a copy writing in truncate ({@code false}) or append ({@code true}) mode.
   *
   * @param newAppend append flag
   * @return updated spec
   */
  public SinkSpec withAppend(boolean newAppend) {
    return new SinkSpec(name, kind, level, format, target, path, newAppend, encoding, maxBytes, backupCount,
        when, interval, utc);
  }

  static SinkSpec fromSection(String name, Section section) {
    SinkKind kind = SinkKind.fromTag(section.string("type", SinkKind.CONSOLE.configTag()));
    Severity level = section.severity("level", Severity.INFO);
    Section formatter = section.section("formatter");
    FormatSpec format = new FormatSpec(
        formatter.string("format", FormatSpec.DEFAULT_TEMPLATE),
        formatter.string("datefmt", FormatSpec.DEFAULT_DATE_PATTERN));
    ConsoleTarget target = ConsoleTarget.fromString(section.string("stream", null));
    Path path = kind.fileBased() ? parsePath(section, section.string("filename", DEFAULT_FILENAME)) : null;
    boolean append = parseMode(section, section.string("mode", "a"));
    Charset encoding = parseCharset(section, section.string("encoding", "utf-8"));
    long maxBytes = section.longValue("max_bytes", DEFAULT_MAX_BYTES, 0, Long.MAX_VALUE);
    int defaultBackups = kind == SinkKind.ROTATING_BY_TIME ? DEFAULT_TIME_BACKUPS : DEFAULT_SIZE_BACKUPS;
    int backupCount = section.intValue("backup_count", defaultBackups, 0, 100_000);
    RotationUnit when = RotationUnit.fromString(section.string("when", null));
    int interval = section.intValue("interval", 1, 1, Integer.MAX_VALUE);
    boolean utc = section.bool("utc", false);
    return new SinkSpec(name, kind, level, format, target, path, append, encoding, maxBytes, backupCount,
        when, interval, utc);
  }

  private static Path parsePath(Section section, String raw) {
    if (raw.isBlank() || raw.indexOf('\0') >= 0) {
      throw new IllegalArgumentException(section.path() + ".filename is not a valid path: '" + raw + "'");
    }
    try {
      return Path.of(raw.trim());
    } catch (RuntimeException ex) {
      throw new IllegalArgumentException(section.path() + ".filename is not a valid path: " + raw, ex);
    }
  }

  private static boolean parseMode(Section section, String raw) {
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "a" -> true;
      case "w" -> false;
      default -> throw new IllegalArgumentException(section.path() + ".mode must be 'a' or 'w' (was '" + raw + "')");
    };
  }

  private static Charset parseCharset(Section section, String raw) {
    try {
      return Charset.forName(raw.trim());
    } catch (IllegalCharsetNameException | UnsupportedCharsetException ex) {
      throw new IllegalArgumentException(section.path() + ".encoding is not supported: " + raw, ex);
    }
  }
}
