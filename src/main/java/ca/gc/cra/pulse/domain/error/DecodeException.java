package ca.gc.cra.pulse.domain.error;

/**
 * Checked exception raised when a payload token cannot be decoded.
 *
 * <p>Carries the offset of the first offending character and the text on either side of it, since
 * two byte streams sharing one channel is the usual cause of corruption.</p>
 *
 * @since 0.1.0
 */
public final class DecodeException extends Exception {
  private final int offset;
  private final String before;
  private final String after;

  /**
   * Creates an exception pinpointing the corrupt region of a payload.
   *
   * @param msg human-readable error
   * @param payload full encoded token
   * @param offset offset of the first bad character, or {@code -1} when unknown
   * @param cause underlying parser failure; may be {@code null}
   */
  public DecodeException(String msg, String payload, int offset, Throwable cause) {
    super(msg + (offset >= 0 ? " at offset " + offset : ""), cause);
    String text = payload == null ? "" : payload;
    int split = offset < 0 ? text.length() : Math.min(offset, text.length());
    this.offset = offset;
    this.before = text.substring(0, split);
    this.after = text.substring(split);
  }

  /** Offset of the first bad character, or {@code -1} when unknown. */
  public int offset() {
    return offset;
  }

  /** Payload text before {@link #offset()}. */
  public String before() {
    return before;
  }

  /** Payload text from {@link #offset()} onward. */
  public String after() {
    return after;
  }
}
