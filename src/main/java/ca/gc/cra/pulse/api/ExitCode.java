package ca.gc.cra.pulse.api;

/**
 * <strong>What:</strong> Canonical exit codes shared by PULSE command-line tools.
 * <p><strong>Why:</strong> Lets scripts tell "tests failed" apart from "the engine or the tool broke".</p>
 * <p><strong>Role:</strong> Adapter-facing enum returned by CLI entry points.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and thread-safe.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** The run completed and every test passed. */
  SUCCESS(0),
  /** The run completed and at least one test failed. */
  TESTS_FAILED(1),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** IO failure occurred while running the CLI, such as an unreadable wire file. */
  IO_ERROR(3),
  /** Configuration was missing or malformed. */
  CONFIG_ERROR(4),
  /** The engine died, closed its output early or exited with an unexpected status. */
  RUNTIME_FAILURE(5),
  /** Process was interrupted (e.g., SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value encoded by this exit code.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
