package ca.gc.cra.funnel.application.port;

import ca.gc.cra.funnel.domain.log.LogRecord;

/**
 * Renders a {@link LogRecord} into a single line of text (plus an optional stack trace).
 *
 * <p>Implementations must be thread-safe; one formatter may be shared by several sinks.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface RecordFormatter {
  /**
   * Formats the record.
   *
   * @param record record to render; never {@code null}
   * @return formatted text without a trailing line terminator
   */
  String format(LogRecord record);
}
