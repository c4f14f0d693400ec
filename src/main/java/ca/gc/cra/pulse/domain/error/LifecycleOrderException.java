package ca.gc.cra.pulse.domain.error;

/**
 * Describes a lifecycle event for an unknown test or a phase reported twice. Logged, not thrown,
 * by the aggregator.
 *
 * @since 0.1.0
 */
public final class LifecycleOrderException extends RuntimeException {
  /**
   * Creates a lifecycle ordering error.
   *
   * @param msg human-readable error
   */
  public LifecycleOrderException(String msg) {
    super(msg);
  }
}
