package ca.gc.cra.pulse.domain.error;

/**
 * Checked exception describing an engine process that exited abnormally or closed its stream
 * before the session ended.
 *
 * @since 0.1.0
 */
public final class ChildProcessException extends Exception {
  private final int exitCode;

  /**
   * Creates a child process failure.
   *
   * @param msg human-readable error
   * @param exitCode exit status of the child, or {@code -1} when unknown
   */
  public ChildProcessException(String msg, int exitCode) {
    super(msg);
    this.exitCode = exitCode;
  }

  /**
   * Creates a child process failure with an underlying cause.
   *
   * @param msg human-readable error
   * @param exitCode exit status of the child, or {@code -1} when unknown
   * @param cause underlying failure
   */
  public ChildProcessException(String msg, int exitCode, Throwable cause) {
    super(msg, cause);
    this.exitCode = exitCode;
  }

  public int exitCode() {
    return exitCode;
  }
}
