package ca.gc.cra.pulse.domain.protocol;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Line framing of protocol messages: {@code <sentinel> <name> <arg1> <arg2> ...}.
 *
 * <p>Any line not starting with the sentinel token is passthrough text. Argument tokens are hex
 * and never contain whitespace.</p>
 *
 * @since 0.1.0
 */
public final class FrameFormat {
  /** Sentinel used when none is configured. */
  public static final String DEFAULT_SENTINEL = "<<--PULSE-PIPE-->>:";

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private final String sentinel;

  /**
   * Creates a framing helper.
   *
   * @param sentinel leading token; must be non-blank and free of whitespace
   */
  public FrameFormat(String sentinel) {
    Objects.requireNonNull(sentinel, "sentinel");
    if (sentinel.isBlank() || WHITESPACE.matcher(sentinel).find()) {
      throw new IllegalArgumentException("sentinel must be a single non-blank token");
    }
    this.sentinel = sentinel;
  }

  /** Framing with {@link #DEFAULT_SENTINEL}. */
  public static FrameFormat defaults() {
    return new FrameFormat(DEFAULT_SENTINEL);
  }

  public String sentinel() {
    return sentinel;
  }

  /**
   * Renders a message as a single line, without the trailing newline.
   *
   * @param message message to frame
   * @return framed line
   */
  public String frame(Message message) {
    StringBuilder sb = new StringBuilder(sentinel.length() + message.name().length() + 64);
    sb.append(sentinel).append(' ').append(message.name());
    for (String arg : message.args()) {
      sb.append(' ').append(arg);
    }
    return sb.toString();
  }

  /**
   * Checks whether a line is a protocol frame.
   *
   * @param line received line
   * @return {@code true} when the first token is the sentinel
   */
  public boolean isFrame(String line) {
    if (line == null || !line.startsWith(sentinel)) {
      return false;
    }
    return line.length() == sentinel.length()
        || Character.isWhitespace(line.charAt(sentinel.length()));
  }

  /**
   * Splits a protocol frame into name and argument tokens.
   *
   * @param line received line
   * @return parsed message, or empty when the line is passthrough text or names no message
   */
  public Optional<Message> parse(String line) {
    if (!isFrame(line)) {
      return Optional.empty();
    }
    String body = line.substring(sentinel.length()).trim();
    if (body.isEmpty()) {
      return Optional.empty();
    }
    String[] tokens = WHITESPACE.split(body);
    List<String> args = new ArrayList<>(tokens.length - 1);
    for (int i = 1; i < tokens.length; i++) {
      args.add(tokens[i]);
    }
    return Optional.of(new Message(tokens[0], args));
  }
}
