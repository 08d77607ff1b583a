package com.codeheadsystems.pbkdf2.common;

/**
 * A byte buffer holding secret-derived material that is zero-filled when closed.
 * <p>
 * Intended for try-with-resources so the wipe happens on every exit path, including exceptions.
 * {@link #bytes()} exposes the backing array without copying; callers must not retain it past
 * the scope.
 */
public final class SensitiveBytes implements AutoCloseable {

  private final byte[] bytes;
  private boolean closed;

  private SensitiveBytes(byte[] bytes) {
    this.bytes = bytes;
  }

  /**
   * Takes ownership of the given array. It is wiped on close.
   *
   * @param bytes the bytes
   * @return the sensitive bytes
   */
  public static SensitiveBytes wrap(byte[] bytes) {
    if (bytes == null) {
      throw new IllegalArgumentException("bytes must not be null");
    }
    return new SensitiveBytes(bytes);
  }

  /**
   * Allocates a zeroed buffer of the given length.
   *
   * @param length the length
   * @return the sensitive bytes
   */
  public static SensitiveBytes allocate(int length) {
    if (length < 0) {
      throw new IllegalArgumentException("length must not be negative: " + length);
    }
    return new SensitiveBytes(new byte[length]);
  }

  /**
   * UTF-8 encodes the text into a new buffer.
   *
   * @param text the text
   * @return the sensitive bytes
   */
  public static SensitiveBytes utf8(String text) {
    return new SensitiveBytes(ByteUtils.utf8(text));
  }

  /**
   * The backing array.
   *
   * @return the byte [ ]
   * @throws IllegalStateException once closed
   */
  public byte[] bytes() {
    if (closed) {
      throw new IllegalStateException("SensitiveBytes already closed");
    }
    return bytes;
  }

  public int length() {
    return bytes.length;
  }

  public boolean isClosed() {
    return closed;
  }

  @Override
  public void close() {
    ByteUtils.wipe(bytes);
    closed = true;
  }

  @Override
  public String toString() {
    return "SensitiveBytes[length=" + bytes.length + "]";
  }
}
