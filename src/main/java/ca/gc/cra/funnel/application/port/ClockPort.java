package ca.gc.cra.funnel.application.port;

/**
 * <strong>What:</strong> Port supplying wall-clock timestamps.
 * <p><strong>Why:</strong> Record timestamps and time-based rotation read the same clock, and tests swap in a
 * controllable one.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe; producers and the collector read it
 * concurrently.</p>
 *
 * @implNote Default implementation delegates to {@link System#currentTimeMillis()}.
 * @since 0.1.0
 */
@FunctionalInterface
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z; subject to system clock adjustments
   */
  long nowMillis();

  /** Default {@link ClockPort} using {@link System#currentTimeMillis()}. */
  ClockPort SYSTEM = System::currentTimeMillis;
}
