package ca.gc.cra.pulse.logging;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * <strong>What:</strong> Logging hygiene helpers for protocol diagnostics.
 * <p><strong>Why:</strong> Encoded payloads can be arbitrarily large; operator logs should carry a bounded
 * excerpt plus enough context to locate corruption.</p>
 * <p><strong>Role:</strong> Cross-cutting utility used by the codec, dispatcher and emitter.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Truncate UTF-8 text to a byte budget while preserving readability.</li>
 *   <li>Split a corrupt payload into fixed-width rows around the failure offset.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless utilities safe for concurrent use.</p>
 *
 * @implNote Decoding uses {@link CodingErrorAction#IGNORE} to avoid exceptions when truncating mid-codepoint.
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  /** Row width used when dumping payload excerpts. */
  public static final int ROW_WIDTH = 60;

  private static final String NULL_PLACEHOLDER = "<null>";

  private Logs() {
    // Utility
  }

  /**
   * Truncates a string to the requested UTF-8 byte length, appending the original length metadata.
   *
   * @param value string to truncate; {@code null} results in {@code "<null>"}
   * @param maxBytes maximum number of bytes to retain; must be positive
   * @return truncated string when the input exceeds {@code maxBytes}; otherwise the original value
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    if (bytes.length <= maxBytes) {
      return value;
    }
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.IGNORE)
        .onUnmappableCharacter(CodingErrorAction.IGNORE);
    try {
      CharBuffer buffer = decoder.decode(ByteBuffer.wrap(bytes, 0, maxBytes));
      return buffer + "? (truncated, " + maxBytes + " of " + bytes.length + ")";
    } catch (CharacterCodingException ex) {
      String utf16Safe = new String(bytes, 0, maxBytes, StandardCharsets.UTF_8);
      return utf16Safe + "? (truncated)";
    }
  }

  /**
   * Splits text into rows of {@link #ROW_WIDTH} characters.
   *
   * @param text text to split; {@code null} yields no rows
   * @return rows in order; the last row may be shorter
   */
  public static List<String> rows(String text) {
    List<String> rows = new ArrayList<>();
    if (text == null) {
      return rows;
    }
    for (int i = 0; i < text.length(); i += ROW_WIDTH) {
      rows.add(text.substring(i, Math.min(text.length(), i + ROW_WIDTH)));
    }
    return rows;
  }

  /**
   * Renders the two halves of a corrupt payload as an indented, multi-line block.
   *
   * @param before text preceding the failure offset
   * @param after text from the failure offset onwards
   * @return block starting with a newline, suitable as a trailing log argument
   */
  public static String excerpt(String before, String after) {
    StringBuilder sb = new StringBuilder();
    sb.append(System.lineSeparator()).append("  Before:");
    for (String row : rows(before)) {
      sb.append(System.lineSeparator()).append("    ").append(row);
    }
    sb.append(System.lineSeparator()).append("  After:");
    for (String row : rows(after)) {
      sb.append(System.lineSeparator()).append("    ").append(row);
    }
    return sb.toString();
  }
}
