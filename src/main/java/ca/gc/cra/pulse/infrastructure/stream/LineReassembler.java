package ca.gc.cra.pulse.infrastructure.stream;

import ca.gc.cra.pulse.infrastructure.buffer.GrowableBuffer;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Rebuilds complete text lines from arbitrarily chunked child-process output.
 * <p><strong>Why:</strong> Pipe reads split lines (and multi-byte characters) at any byte boundary; frames can
 * only be recognised on whole lines.</p>
 * <p><strong>Role:</strong> Infrastructure stage between the engine's output stream and the dispatcher.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Buffer the partial tail until its terminating newline arrives.</li>
 *   <li>Decode UTF-8, dropping malformed sequences, and strip trailing whitespace.</li>
 *   <li>Flush an unterminated tail when the stream ends.</li>
 *   <li>Drop a line that grows past the length limit, up to and including its newline.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; owned by the single reading thread.</p>
 *
 * @since 0.1.0
 */
public final class LineReassembler {
  private static final byte NEWLINE = '\n';

  /** Longest line kept by default; longer lines are dropped. */
  public static final int DEFAULT_MAX_LINE_BYTES = 16 * 1024 * 1024;
  private static final int MAX_LINE_LIMIT = 32 * 1024 * 1024;

  private final GrowableBuffer buffer;
  private final int maxLineBytes;
  private int scanned;
  private boolean discarding;
  private long droppedLines;

  /** Creates a reassembler with the default buffer size and line limit. */
  public LineReassembler() {
    this(DEFAULT_MAX_LINE_BYTES);
  }

  /**
   * Creates a reassembler with a custom line limit.
   *
   * @param maxLineBytes longest line kept, in bytes; at most 32 MiB
   */
  public LineReassembler(int maxLineBytes) {
    if (maxLineBytes <= 0 || maxLineBytes > MAX_LINE_LIMIT) {
      throw new IllegalArgumentException("maxLineBytes must be in [1, " + MAX_LINE_LIMIT + "]");
    }
    this.maxLineBytes = maxLineBytes;
    this.buffer = new GrowableBuffer();
  }

  /**
   * Appends a chunk and returns every line it completes.
   *
   * @param chunk bytes read from the stream
   * @param length number of valid bytes in {@code chunk}
   * @return completed lines in order; empty when the chunk completed none
   */
  public List<String> feed(byte[] chunk, int length) {
    Objects.requireNonNull(chunk, "chunk");
    if (length < 0 || length > chunk.length) {
      throw new IndexOutOfBoundsException("invalid length: " + length);
    }
    List<String> lines = new ArrayList<>();
    int offset = 0;
    while (offset < length) {
      int end = offset + Math.min(length - offset, maxLineBytes);
      if (discarding) {
        int newline = indexOf(chunk, offset, end);
        if (newline < 0) {
          offset = end;
          continue;
        }
        discarding = false;
        offset = newline + 1;
        continue;
      }
      buffer.write(chunk, offset, end - offset);
      offset = end;
      drainLines(lines);
      if (buffer.readableBytes() > maxLineBytes) {
        buffer.discard(buffer.readableBytes());
        scanned = 0;
        discarding = true;
        droppedLines++;
      }
    }
    return lines;
  }

  /**
   * Flushes the unterminated tail, if any, at end of stream.
   *
   * @return final partial line, when bytes were pending
   */
  public Optional<String> finish() {
    scanned = 0;
    discarding = false;
    if (buffer.readableBytes() == 0) {
      return Optional.empty();
    }
    byte[] raw = buffer.copyAll();
    return Optional.of(decode(raw, raw.length));
  }

  /** Bytes buffered awaiting a newline. */
  public int pendingBytes() {
    return buffer.readableBytes();
  }

  /** Number of lines dropped for exceeding the line limit. */
  public long droppedLines() {
    return droppedLines;
  }

  private void drainLines(List<String> lines) {
    int idx;
    while ((idx = buffer.indexOf(NEWLINE, scanned)) >= 0) {
      byte[] raw = buffer.copy(idx + 1);
      lines.add(decode(raw, raw.length - 1));
      scanned = 0;
    }
    scanned = buffer.readableBytes();
  }

  private static int indexOf(byte[] chunk, int from, int to) {
    for (int i = from; i < to; i++) {
      if (chunk[i] == NEWLINE) {
        return i;
      }
    }
    return -1;
  }

  static String decode(byte[] raw, int length) {
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.IGNORE)
        .onUnmappableCharacter(CodingErrorAction.IGNORE);
    String text;
    try {
      text = decoder.decode(ByteBuffer.wrap(raw, 0, length)).toString();
    } catch (CharacterCodingException ex) {
      text = new String(raw, 0, length, StandardCharsets.UTF_8);
    }
    return stripTrailing(text);
  }

  private static String stripTrailing(String text) {
    int end = text.length();
    while (end > 0 && Character.isWhitespace(text.charAt(end - 1))) {
      end--;
    }
    return text.substring(0, end);
  }
}
