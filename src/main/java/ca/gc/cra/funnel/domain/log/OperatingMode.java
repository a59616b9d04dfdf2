package ca.gc.cra.funnel.domain.log;

/**
 * <strong>What:</strong> Process topology a {@code LoggerFacade} runs under.
 * <p><strong>Why:</strong> Decides whether records are written directly, collected from a shared
 * channel, or forwarded to another process.</p>
 * <p><strong>Role:</strong> Closed set of variants resolved once at facade construction and never changed
 * afterwards; components switch on the constant rather than on subclasses.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.funnel.application.mode.ModeResolver
 */
public enum OperatingMode {
  /** Single process; sinks are written on the caller thread and no channel exists. */
  STANDALONE,
  /** Creates the shared channel and runs the collector; the only process holding sinks. */
  AGGREGATION_OWNER,
  /** Forwards every record to a channel supplied by the aggregation owner; holds no sinks. */
  WORKER;

  /**
   * Reports whether this mode builds and owns sinks.
   *
   * @return {@code true} for {@link #STANDALONE} and {@link #AGGREGATION_OWNER}
   */
  public boolean ownsSinks() {
    return this != WORKER;
  }

  /**
   * Reports whether records leave the caller thread through a channel.
   *
   * @return {@code true} for {@link #AGGREGATION_OWNER} and {@link #WORKER}
   */
  public boolean usesChannel() {
    return this != STANDALONE;
  }
}
