package ca.gc.cra.relay.application.port;

/**
 * <strong>What:</strong> Port supplying wall-clock timestamps to event construction.
 * <p><strong>Why:</strong> Lets tests pin event timestamps and ids with a deterministic clock.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe; producers may create events from
 * many threads.</p>
 *
 * @implNote Default implementation delegates to {@link System#currentTimeMillis()}.
 * @since 0.1.0
 * @see ca.gc.cra.relay.infrastructure.time.SystemClockAdapter
 */
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
