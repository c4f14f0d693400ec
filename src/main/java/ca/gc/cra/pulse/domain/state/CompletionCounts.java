package ca.gc.cra.pulse.domain.state;

/**
 * Number of finished tests against the number of known tests.
 *
 * @param finished tests whose teardown report arrived
 * @param total tests currently registered
 * @since 0.1.0
 */
public record CompletionCounts(int finished, int total) {
  /** Fraction finished in {@code [0, 1]}; {@code 0} when no tests are known. */
  public double fraction() {
    return total == 0 ? 0d : Math.min(1d, (double) finished / total);
  }
}
