package ca.gc.cra.funnel.infrastructure.sink;

import ca.gc.cra.funnel.application.dispatch.SinkBinding;
import ca.gc.cra.funnel.application.port.ClockPort;
import ca.gc.cra.funnel.application.port.LogSink;
import ca.gc.cra.funnel.config.SinkSpec;
import ca.gc.cra.funnel.infrastructure.format.PatternRecordFormatter;
import ca.gc.cra.funnel.util.PathUtils;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneId;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Builds {@link LogSink}s and their bindings from {@link SinkSpec}s.
 * <p><strong>Why:</strong> Keeps file system checks and sink-kind selection in one place.</p>
 * <p><strong>Role:</strong> Used only by processes that own sinks (standalone and aggregation owner).</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject file-based specs whose parent directory does not exist; directories are never created.</li>
 *   <li>Wrap open failures in {@link SinkConstructionException} carrying the path.</li>
 *   <li>Compile each sink's format template.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless apart from its immutable collaborators.</p>
 *
 * @since 0.1.0
 */
public final class SinkFactory {
  private static final Logger log = LoggerFactory.getLogger(SinkFactory.class);

  private final ClockPort clock;
  private final ZoneId zone;
  private final Supplier<PrintStream> stdout;
  private final Supplier<PrintStream> stderr;

  /**
   * @param clock time source for time-based rotation
   * @param zone zone used to render {@code %(asctime)s}
   * @param stdout supplier of the standard output stream
   * @param stderr supplier of the standard error stream
   */
  public SinkFactory(ClockPort clock, ZoneId zone, Supplier<PrintStream> stdout, Supplier<PrintStream> stderr) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.zone = Objects.requireNonNull(zone, "zone");
    this.stdout = Objects.requireNonNull(stdout, "stdout");
    this.stderr = Objects.requireNonNull(stderr, "stderr");
  }

  /**
   * Builds the sink described by {@code spec}.
   *
   * @param spec sink description
   * @return open sink
   * @throws SinkConstructionException if the target cannot be opened
   */
  public LogSink build(SinkSpec spec) throws SinkConstructionException {
    Objects.requireNonNull(spec, "spec");
    if (!spec.kind().fileBased()) {
      return new ConsoleSink(switch (spec.target()) {
        case STDOUT -> stdout.get();
        case STDERR -> stderr.get();
      });
    }
    Path path = spec.path();
    Path parent = PathUtils.parentDirectory(path);
    if (!Files.isDirectory(parent)) {
      throw new SinkConstructionException(
          spec.name(), path, "Directory " + parent + " does not exist for sink '" + spec.name() + "'", null);
    }
    try {
      LogSink sink = switch (spec.kind()) {
        case FILE -> new FileSink(path, spec.encoding(), spec.append());
        case ROTATING_BY_SIZE -> new SizeRotatingFileSink(
            path, spec.encoding(), spec.append(), spec.maxBytes(), spec.backupCount());
        case ROTATING_BY_TIME -> new TimeRotatingFileSink(
            path, spec.encoding(), spec.append(), spec.when(), spec.interval(), spec.backupCount(), spec.utc(), clock);
        default -> throw new IllegalStateException("Unhandled sink kind " + spec.kind());
      };
      log.debug("Opened {} sink {} at {}", spec.kind().configTag(), spec.name(), path);
      return sink;
    } catch (IOException ex) {
      throw new SinkConstructionException(
          spec.name(), path, "Cannot open " + path + " for sink '" + spec.name() + "': " + ex.getMessage(), ex);
    }
  }

  /**
   * Builds the sink and pairs it with its level and compiled formatter.
   *
   * @param spec sink description
   * @return binding ready for dispatch
   * @throws SinkConstructionException if the sink cannot be opened or its template is invalid
   */
  public SinkBinding bind(SinkSpec spec) throws SinkConstructionException {
    PatternRecordFormatter formatter;
    try {
      formatter = new PatternRecordFormatter(spec.format(), zone);
    } catch (IllegalArgumentException ex) {
      throw new SinkConstructionException(spec.name(), spec.path(), ex.getMessage(), ex);
    }
    return new SinkBinding(spec.name(), build(spec), spec.level(), formatter);
  }
}
