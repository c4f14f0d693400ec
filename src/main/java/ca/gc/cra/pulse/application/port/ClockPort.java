package ca.gc.cra.pulse.application.port;

/**
 * <strong>What:</strong> Port supplying wall-clock timestamps for phase timing statistics.
 * <p><strong>Why:</strong> Lets tests drive timing deterministically.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 *
 * @since 0.1.0
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();

  /** Default {@link ClockPort} using {@link System#currentTimeMillis()}. */
  ClockPort SYSTEM = System::currentTimeMillis;
}
