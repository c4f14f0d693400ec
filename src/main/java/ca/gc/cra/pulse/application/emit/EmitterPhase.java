package ca.gc.cra.pulse.application.emit;

/**
 * Producer-side view of where the engine is in its lifecycle, inferred from callback order.
 *
 * @since 0.1.0
 */
public enum EmitterPhase {
  /** Configured, no collection yet. */
  INIT,
  /** Collecting tests. */
  COLLECTING,
  /** Running tests; {@code start_run_phase} has been sent. */
  RUNNING,
  /** Session finished. */
  DONE
}
