package ca.gc.cra.funnel.application.pipeline;

/**
 * Lifecycle of a {@link CollectorLoop}. Transitions only move forward:
 * {@code NOT_STARTED -> RUNNING -> DRAINING -> STOPPED}, or {@code NOT_STARTED -> STOPPED} when stopped before
 * starting.
 *
 * @since 0.1.0
 */
public enum CollectorState {
  NOT_STARTED,
  /** Receiving and dispatching records. */
  RUNNING,
  /** Channel closed; remaining records are being written. */
  DRAINING,
  /** All records written or abandoned and every sink closed. */
  STOPPED
}
