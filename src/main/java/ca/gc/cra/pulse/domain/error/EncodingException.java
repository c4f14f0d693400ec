package ca.gc.cra.pulse.domain.error;

/**
 * Checked exception raised when a value has no representation on the wire.
 *
 * @since 0.1.0
 */
public final class EncodingException extends Exception {
  private final String typeName;

  /**
   * Creates an exception for an unrepresentable value.
   *
   * @param typeName simple type name of the value
   * @param msg human-readable error
   */
  public EncodingException(String typeName, String msg) {
    super(msg);
    this.typeName = typeName;
  }

  /** Simple type name of the value that could not be encoded. */
  public String typeName() {
    return typeName;
  }
}
