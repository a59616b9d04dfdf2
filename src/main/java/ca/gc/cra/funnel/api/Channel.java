package ca.gc.cra.funnel.api;

import ca.gc.cra.funnel.domain.log.Severity;
import ca.gc.cra.funnel.domain.log.SourceLocation;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.helpers.FormattingTuple;
import org.slf4j.helpers.MessageFormatter;

/**
 * <strong>What:</strong> Named logging endpoint handed out by {@link LoggerFacade#getChannel(String)}.
 * <p><strong>Messages:</strong> {@code {}} placeholders are filled from the arguments; a trailing
 * {@link Throwable} argument is rendered as a stack trace after the line.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from its name; safe to share.</p>
 *
 * @since 0.1.0
 */
public final class Channel {
  private static final Set<String> INTERNAL_FRAMES = Set.of(Channel.class.getName(), LoggerFacade.class.getName());
  private static final StackWalker WALKER = StackWalker.getInstance();

  private final LoggerFacade facade;
  private final String name;

  Channel(LoggerFacade facade, String name) {
    this.facade = Objects.requireNonNull(facade, "facade");
    this.name = Objects.requireNonNull(name, "name");
  }

  public String name() {
    return name;
  }

  /**
   * Tests whether a record of {@code severity} would be emitted on this channel.
   *
   * @param severity severity to test
   * @return {@code true} if it passes the effective level
   */
  public boolean isEnabledFor(Severity severity) {
    return facade.isEnabled(name, severity);
  }

  /** Effective level after inheritance from ancestors. */
  public Severity effectiveLevel() {
    return facade.effectiveLevel(name);
  }

  public void debug(String message, Object... args) {
    log(Severity.DEBUG, message, args);
  }

  public void info(String message, Object... args) {
    log(Severity.INFO, message, args);
  }

  public void warning(String message, Object... args) {
    log(Severity.WARNING, message, args);
  }

  public void error(String message, Object... args) {
    log(Severity.ERROR, message, args);
  }

  public void critical(String message, Object... args) {
    log(Severity.CRITICAL, message, args);
  }

  /**
   * Logs {@code message} at {@code ERROR} with the stack trace of {@code thrown}.
   *
   * @param message message text
   * @param thrown failure to render
   */
  public void exception(String message, Throwable thrown) {
    if (!isEnabledFor(Severity.ERROR)) {
      return;
    }
    facade.emit(name, Severity.ERROR, Objects.requireNonNullElse(message, "null"), callSite(), thrown);
  }

  /**
   * Logs at an explicit severity.
   *
   * @param severity record severity
   * @param message message pattern with {@code {}} placeholders
   * @param args placeholder values, optionally followed by a {@link Throwable}
   */
  public void log(Severity severity, String message, Object... args) {
    Objects.requireNonNull(severity, "severity");
    if (!isEnabledFor(severity)) {
      return;
    }
    String text;
    Throwable thrown = null;
    if (args == null || args.length == 0) {
      text = String.valueOf(message);
    } else {
      FormattingTuple tuple = MessageFormatter.arrayFormat(message, args);
      text = tuple.getMessage();
      thrown = tuple.getThrowable();
    }
    facade.emit(name, severity, text, callSite(), thrown);
  }

  private static SourceLocation callSite() {
    Optional<StackWalker.StackFrame> frame = WALKER.walk(frames -> frames
        .filter(f -> !INTERNAL_FRAMES.contains(f.getClassName()))
        .findFirst());
    return frame
        .map(f -> new SourceLocation(f.getFileName(), Math.max(0, f.getLineNumber()), f.getMethodName()))
        .orElse(SourceLocation.UNKNOWN);
  }

  @Override
  public String toString() {
    return "Channel(" + name + ")";
  }
}
