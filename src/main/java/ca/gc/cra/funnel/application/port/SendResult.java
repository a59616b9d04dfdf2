package ca.gc.cra.funnel.application.port;

/**
 * Outcome of {@link ChannelHandle#send}.
 *
 * <p>Sending never throws; a closed or saturated channel is an expected condition the producer may
 * ignore or act on.</p>
 *
 * @since 0.1.0
 */
public enum SendResult {
  /** The record was enqueued and will reach the collector. */
  ACCEPTED,
  /** The channel was closed before the record could be enqueued; the record is discarded. */
  CLOSED,
  /** The channel was full under the {@code DROP} overflow policy; the record is discarded. */
  DROPPED;

  /**
   * Reports whether the record was enqueued.
   *
   * @return {@code true} only for {@link #ACCEPTED}
   */
  public boolean accepted() {
    return this == ACCEPTED;
  }
}
