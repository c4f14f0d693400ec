package ca.gc.cra.pulse.domain.state;

import ca.gc.cra.pulse.domain.error.ChildProcessException;
import java.util.Optional;

/**
 * Final outcome of consuming one engine process.
 *
 * @param exitCode exit status of the engine process, or {@code -1} when unknown
 * @param sessionEnded whether a {@code session_end} message was received
 * @param failure describes an abnormal exit or an abrupt stream closure
 * @since 0.1.0
 */
public record RunResult(int exitCode, boolean sessionEnded, Optional<ChildProcessException> failure) {
  /** Engine exit status reported when all tests passed. */
  public static final int EXIT_OK = 0;
  /** Engine exit status reported when some tests failed. */
  public static final int EXIT_TESTS_FAILED = 1;

  public RunResult {
    failure = failure == null ? Optional.empty() : failure;
  }

  /**
   * Classifies an engine exit.
   *
   * @param exitCode exit status
   * @param sessionEnded whether the session end message arrived
   * @return run result, with a failure unless the exit was clean
   */
  public static RunResult of(int exitCode, boolean sessionEnded) {
    if (!sessionEnded) {
      return new RunResult(exitCode, false, Optional.of(new ChildProcessException(
          "engine stream closed before the session ended (exit " + exitCode + ")", exitCode)));
    }
    if (exitCode != EXIT_OK && exitCode != EXIT_TESTS_FAILED) {
      return new RunResult(exitCode, true, Optional.of(new ChildProcessException(
          "engine exited with status " + exitCode, exitCode)));
    }
    return new RunResult(exitCode, true, Optional.empty());
  }

  /** Returns {@code true} when the session ended and the engine exited with 0 or 1. */
  public boolean cleanExit() {
    return failure.isEmpty();
  }
}
