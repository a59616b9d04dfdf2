package ca.gc.cra.funnel.infrastructure.format;

import ca.gc.cra.funnel.application.port.RecordFormatter;
import ca.gc.cra.funnel.config.FormatSpec;
import ca.gc.cra.funnel.domain.log.LogRecord;
import ca.gc.cra.funnel.domain.log.Severity;
import ca.gc.cra.funnel.domain.log.SourceLocation;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.IllegalFormatException;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> {@link RecordFormatter} driven by {@code %(field)s} templates.
 * <p><strong>Role:</strong> Default formatter attached to every sink by {@code SinkFactory}.</p>
 * <p><strong>Supported fields:</strong> {@code asctime, created, msecs, name, levelname, levelno, message,
 * filename, lineno, funcName, module, threadName, process, processName}. Conversions accept printf-style flags,
 * width and precision ({@code %(levelname)-8s}, {@code %(msecs)03d}).</p>
 * <p><strong>Thread-safety:</strong> Immutable after construction; safe to share.</p>
 *
 * @since 0.1.0
 */
public final class PatternRecordFormatter implements RecordFormatter {
  private static final Pattern PLACEHOLDER =
      Pattern.compile("%%|%\\(([A-Za-z_]+)\\)([-#0 +]*)(\\d+)?(?:\\.(\\d+))?([sdifrxXeEgG])");
  private static final Set<String> FIELDS = Set.of(
      "asctime", "created", "msecs", "name", "levelname", "levelno", "message",
      "filename", "lineno", "funcName", "module", "threadName", "process", "processName");

  private static final LogRecord SAMPLE = new LogRecord(0L, "root", Severity.INFO, "", SourceLocation.UNKNOWN,
      "main", 0L, "MainProcess", null);

  private final List<Segment> segments;
  private final DateTimeFormatter dateFormatter;

  /**
   * Compiles the template of {@code spec}.
   *
   * @param spec template and date pattern
   * @param zone zone used for {@code %(asctime)s}
   * @throws IllegalArgumentException if the template references an unknown field or uses a flag combination
   *     that cannot be rendered
   */
  public PatternRecordFormatter(FormatSpec spec, ZoneId zone) {
    Objects.requireNonNull(spec, "spec");
    this.dateFormatter = StrftimeTranslator.toFormatter(spec.datePattern(), Objects.requireNonNull(zone, "zone"));
    this.segments = compile(spec.template());
    try {
      format(SAMPLE);
    } catch (IllegalFormatException ex) {
      throw new IllegalArgumentException(
          "Invalid conversion in format template '" + spec.template() + "': " + ex.getMessage(), ex);
    }
  }

  @Override
  public String format(LogRecord record) {
    StringBuilder out = new StringBuilder(128);
    for (Segment segment : segments) {
      segment.appendTo(out, record, this);
    }
    record.thrownText().ifPresent(trace -> out.append('\n').append(trace));
    return out.toString();
  }

  private Object valueOf(String field, LogRecord record) {
    SourceLocation location = record.sourceLocation().orElse(SourceLocation.UNKNOWN);
    return switch (field) {
      case "asctime" -> dateFormatter.format(Instant.ofEpochMilli(record.timestampMillis()));
      case "created" -> record.timestampMillis() / 1000.0d;
      case "msecs" -> record.timestampMillis() % 1000L;
      case "name" -> record.channelName();
      case "levelname" -> record.severity().name();
      case "levelno" -> record.severity().value();
      case "message" -> record.message();
      case "filename" -> location.file();
      case "lineno" -> location.line();
      case "funcName" -> location.method();
      case "module" -> location.module();
      case "threadName" -> record.threadName();
      case "process" -> record.processId();
      case "processName" -> record.processName();
      default -> throw new IllegalStateException("unreachable field " + field);
    };
  }

  private static List<Segment> compile(String template) {
    List<Segment> compiled = new ArrayList<>();
    Matcher matcher = PLACEHOLDER.matcher(template);
    int last = 0;
    while (matcher.find()) {
      if (matcher.start() > last) {
        compiled.add(new Literal(template.substring(last, matcher.start())));
      }
      if (matcher.group(1) == null) {
        compiled.add(new Literal("%"));
      } else {
        String field = matcher.group(1);
        if (!FIELDS.contains(field)) {
          throw new IllegalArgumentException("Unknown format field '" + field + "' in template: " + template);
        }
        compiled.add(Field.of(field, matcher.group(2), matcher.group(3), matcher.group(4), matcher.group(5).charAt(0)));
      }
      last = matcher.end();
    }
    if (last < template.length()) {
      compiled.add(new Literal(template.substring(last)));
    }
    return List.copyOf(compiled);
  }

  private interface Segment {
    void appendTo(StringBuilder out, LogRecord record, PatternRecordFormatter formatter);
  }

  private record Literal(String text) implements Segment {
    @Override
    public void appendTo(StringBuilder out, LogRecord record, PatternRecordFormatter formatter) {
      out.append(text);
    }
  }

  private record Field(String name, String flags, String width, String precision, char conversion)
      implements Segment {
    static Field of(String name, String flags, String width, String precision, char conversion) {
      char normalized = switch (conversion) {
        case 'i' -> 'd';
        case 'r' -> 's';
        default -> conversion;
      };
      return new Field(name, flags == null ? "" : flags, width, precision, normalized);
    }

    @Override
    public void appendTo(StringBuilder out, LogRecord record, PatternRecordFormatter formatter) {
      Object value = formatter.valueOf(name, record);
      char conv = conversion;
      Object argument;
      if ((conv == 'd' || conv == 'x' || conv == 'X') && value instanceof Number number) {
        argument = number.longValue();
      } else if ("feEgG".indexOf(conv) >= 0 && value instanceof Number number) {
        argument = number.doubleValue();
      } else {
        conv = 's';
        argument = String.valueOf(value);
      }
      if (flags.isEmpty() && width == null && precision == null) {
        out.append(argument);
        return;
      }
      out.append(String.format(Locale.ROOT, javaSpec(conv) + conv, argument));
    }

    private String javaSpec(char conv) {
      String effective = flags;
      if (conv == 's') {
        effective = effective.replace("0", "").replace("+", "").replace(" ", "").replace("#", "");
      }
      if (width == null) {
        effective = effective.replace("-", "").replace("0", "");
      }
      StringBuilder spec = new StringBuilder("%").append(effective);
      if (width != null) {
        spec.append(width);
      }
      if (precision != null && conv != 'd' && conv != 'x' && conv != 'X') {
        spec.append('.').append(precision);
      }
      return spec.toString();
    }
  }
}
