package ca.gc.cra.pulse.domain.error;

/**
 * Raised for frames that name an unknown message or carry the wrong arguments. Never fatal; the
 * dispatcher logs it and moves on.
 *
 * @since 0.1.0
 */
public final class ProtocolViolationException extends RuntimeException {
  /**
   * Creates a protocol violation.
   *
   * @param msg human-readable error
   */
  public ProtocolViolationException(String msg) {
    super(msg);
  }
}
