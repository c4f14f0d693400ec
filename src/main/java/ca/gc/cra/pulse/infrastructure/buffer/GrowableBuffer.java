package ca.gc.cra.pulse.infrastructure.buffer;

import java.util.Objects;

/**
 * Expandable byte buffer backed by a single array with manual read/write indices.
 * <p>Supports amortized O(1) appends with exponential growth; consumed bytes are compacted away lazily.
 */
public final class GrowableBuffer {
  private static final int DEFAULT_CAPACITY = 2048;
  private static final int MAX_CAPACITY = 64 * 1024 * 1024; // 64 MiB safety guard

  private byte[] data;
  private int readIndex;
  private int writeIndex;

  /** Creates a buffer using the default initial capacity. */
  public GrowableBuffer() {
    this(DEFAULT_CAPACITY);
  }

  /**
   * Creates a buffer with a caller-supplied initial capacity.
   *
   * @param initialCapacity minimum backing array size
   * @throws IllegalArgumentException when {@code initialCapacity} is not positive
   */
  public GrowableBuffer(int initialCapacity) {
    if (initialCapacity <= 0) {
      throw new IllegalArgumentException("initialCapacity must be positive");
    }
    data = new byte[Math.min(MAX_CAPACITY, align(initialCapacity))];
  }

  /**
   * Appends a region of the provided array into the buffer, growing it if required.
   *
   * @param src source array; must not be {@code null}
   * @param offset starting offset within {@code src}
   * @param length number of bytes to append
   */
  public void write(byte[] src, int offset, int length) {
    Objects.requireNonNull(src, "src");
    if (length <= 0) {
      return;
    }
    if (offset < 0 || offset + length > src.length) {
      throw new IndexOutOfBoundsException("invalid offset/length");
    }
    ensureWritable(length);
    System.arraycopy(src, offset, data, writeIndex, length);
    writeIndex += length;
  }

  /** Returns the number of readable bytes. */
  public int readableBytes() {
    return writeIndex - readIndex;
  }

  /**
   * Finds the first occurrence of {@code value} at or after {@code fromRelative}.
   *
   * @param value byte to search for
   * @param fromRelative offset relative to the reader index to start at
   * @return relative index or {@code -1} when not found
   */
  public int indexOf(byte value, int fromRelative) {
    for (int i = readIndex + Math.max(0, fromRelative); i < writeIndex; i++) {
      if (data[i] == value) {
        return i - readIndex;
      }
    }
    return -1;
  }

  /**
   * Copies {@code length} readable bytes into a fresh array and consumes them.
   *
   * @param length number of bytes
   * @return copied bytes
   */
  public byte[] copy(int length) {
    if (length < 0 || length > readableBytes()) {
      throw new IllegalArgumentException("length out of bounds: " + length);
    }
    byte[] out = new byte[length];
    System.arraycopy(data, readIndex, out, 0, length);
    discard(length);
    return out;
  }

  /** Copies and consumes all readable bytes. */
  public byte[] copyAll() {
    return copy(readableBytes());
  }

  /**
   * Advances the reader index by {@code length} bytes.
   *
   * @param length bytes to drop
   */
  public void discard(int length) {
    if (length < 0 || length > readableBytes()) {
      throw new IllegalArgumentException("length out of bounds: " + length);
    }
    readIndex += length;
    if (readIndex == writeIndex) {
      readIndex = 0;
      writeIndex = 0;
    }
  }

  private void ensureWritable(int minWritableBytes) {
    if (data.length - writeIndex >= minWritableBytes) {
      return;
    }
    int readable = readableBytes();
    if (readIndex > 0) {
      System.arraycopy(data, readIndex, data, 0, readable);
      readIndex = 0;
      writeIndex = readable;
      if (data.length - writeIndex >= minWritableBytes) {
        return;
      }
    }
    int required = readable + minWritableBytes;
    int newCapacity = data.length;
    while (newCapacity < required && newCapacity < MAX_CAPACITY) {
      newCapacity <<= 1;
    }
    if (newCapacity < required || newCapacity > MAX_CAPACITY) {
      throw new IllegalStateException("buffer would exceed max capacity: " + required);
    }
    byte[] next = new byte[newCapacity];
    System.arraycopy(data, 0, next, 0, readable);
    data = next;
  }

  private static int align(int value) {
    int n = 1;
    while (n < value) {
      n <<= 1;
    }
    return n;
  }
}
