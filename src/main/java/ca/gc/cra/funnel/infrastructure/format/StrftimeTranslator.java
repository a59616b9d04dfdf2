package ca.gc.cra.funnel.infrastructure.format;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.util.Locale;
import java.util.Objects;

/**
 * Converts strftime-style date patterns ({@code %Y-%m-%d %H:%M:%S}) into {@link DateTimeFormatter}s.
 *
 * <p>Unknown directives are emitted literally. Month and day names use {@link Locale#ENGLISH}.</p>
 *
 * @since 0.1.0
 */
public final class StrftimeTranslator {
  private StrftimeTranslator() {}

  /**
   * Builds a formatter for {@code pattern} bound to {@code zone}.
   *
   * @param pattern strftime pattern
   * @param zone zone used to render instants
   * @return thread-safe formatter
   */
  public static DateTimeFormatter toFormatter(String pattern, ZoneId zone) {
    Objects.requireNonNull(pattern, "pattern");
    Objects.requireNonNull(zone, "zone");
    DateTimeFormatterBuilder builder = new DateTimeFormatterBuilder();
    StringBuilder literal = new StringBuilder();
    for (int i = 0; i < pattern.length(); i++) {
      char c = pattern.charAt(i);
      if (c != '%' || i + 1 >= pattern.length()) {
        literal.append(c);
        continue;
      }
      char directive = pattern.charAt(++i);
      String javaPattern = javaPatternFor(directive);
      if (javaPattern == null) {
        literal.append(directive == '%' ? "%" : "%" + directive);
        continue;
      }
      if (literal.length() > 0) {
        builder.appendLiteral(literal.toString());
        literal.setLength(0);
      }
      builder.appendPattern(javaPattern);
    }
    if (literal.length() > 0) {
      builder.appendLiteral(literal.toString());
    }
    return builder.toFormatter(Locale.ENGLISH).withZone(zone);
  }

  private static String javaPatternFor(char directive) {
    return switch (directive) {
      case 'Y' -> "uuuu";
      case 'y' -> "uu";
      case 'm' -> "MM";
      case 'd' -> "dd";
      case 'H' -> "HH";
      case 'I' -> "hh";
      case 'M' -> "mm";
      case 'S' -> "ss";
      case 'f' -> "SSSSSS";
      case 'p' -> "a";
      case 'b' -> "MMM";
      case 'B' -> "MMMM";
      case 'a' -> "EEE";
      case 'A' -> "EEEE";
      case 'j' -> "DDD";
      case 'z' -> "xx";
      case 'Z' -> "zzz";
      default -> null;
    };
  }
}
