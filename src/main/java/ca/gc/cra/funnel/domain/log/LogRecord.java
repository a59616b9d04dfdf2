package ca.gc.cra.funnel.domain.log;

import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Immutable log event created at the call site.
 * <p><strong>Why:</strong> Carries everything a sink needs so that formatting can be deferred to the
 * process that owns the sinks.</p>
 * <p><strong>Role:</strong> Domain value travelling from producers through a
 * {@link ca.gc.cra.funnel.application.port.ChannelHandle} to the collector.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share across threads.</p>
 *
 * @param timestampMillis creation time in epoch milliseconds
 * @param channelName dotted channel name; {@code "root"} for the root channel
 * @param severity record severity
 * @param message fully rendered message text
 * @param location call-site metadata; {@code null} when not captured
 * @param threadName name of the producing thread
 * @param processId identifier of the producing process
 * @param processName label of the producing process (for example {@code "worker-3"})
 * @param thrown rendered stack trace of an attached throwable; {@code null} when absent
 * @since 0.1.0
 */
public record LogRecord(
    long timestampMillis,
    String channelName,
    Severity severity,
    String message,
    SourceLocation location,
    String threadName,
    long processId,
    String processName,
    String thrown) {

  public LogRecord {
    channelName = Objects.requireNonNull(channelName, "channelName");
    severity = Objects.requireNonNull(severity, "severity");
    message = Objects.requireNonNullElse(message, "");
    threadName = Objects.requireNonNullElse(threadName, "");
    processName = Objects.requireNonNullElse(processName, "");
  }

  /**
   * Returns the call-site metadata when it was captured.
   *
   * @return optional source location
   */
  public Optional<SourceLocation> sourceLocation() {
    return Optional.ofNullable(location);
  }

  /**
   * Returns the rendered throwable when one was attached.
   *
   * @return optional stack trace text
   */
  public Optional<String> thrownText() {
    return Optional.ofNullable(thrown);
  }
}
