package com.codeheadsystems.sqrl.storage.common;

import com.codeheadsystems.sqrl.storage.exception.BlockParseException;

/**
 * Forward-only reader over a byte array. Every read either consumes exactly the requested
 * number of bytes or throws {@link BlockParseException} without advancing.
 */
public class ByteCursor {

  private final byte[] data;
  private final int end;
  private int position;

  /**
   * Instantiates a new cursor over the whole array.
   *
   * @param data the data
   */
  public ByteCursor(byte[] data) {
    this(data, 0, data.length);
  }

  /**
   * Instantiates a new cursor over {@code data[offset, offset + length)}.
   *
   * @param data   the data
   * @param offset the first readable index
   * @param length the number of readable bytes
   */
  public ByteCursor(byte[] data, int offset, int length) {
    if (offset < 0 || length < 0 || offset + length > data.length) {
      throw new IllegalArgumentException("Cursor window out of bounds: offset=" + offset
          + " length=" + length + " size=" + data.length);
    }
    this.data = data;
    this.position = offset;
    this.end = offset + length;
  }

  /**
   * Bytes left to read.
   *
   * @return the int
   */
  public int remaining() {
    return end - position;
  }

  /**
   * Reads the next {@code length} bytes.
   *
   * @param length the length
   * @return a copy of the bytes read
   * @throws BlockParseException if fewer than {@code length} bytes remain
   */
  public byte[] next(int length) {
    require(length);
    byte[] out = new byte[length];
    System.arraycopy(data, position, out, 0, length);
    position += length;
    return out;
  }

  /**
   * Reads one unsigned byte.
   *
   * @return the int
   */
  public int nextU8() {
    require(1);
    return data[position++] & 0xFF;
  }

  /**
   * Reads a little-endian unsigned 16-bit integer.
   *
   * @return the int
   */
  public int nextU16() {
    require(2);
    int value = (data[position] & 0xFF) | (data[position + 1] & 0xFF) << 8;
    position += 2;
    return value;
  }

  /**
   * Reads a little-endian unsigned 32-bit integer.
   *
   * @return the long
   */
  public long nextU32() {
    require(4);
    long value = 0;
    for (int i = 3; i >= 0; i--) {
      value = (value << 8) | (data[position + i] & 0xFF);
    }
    position += 4;
    return value;
  }

  private void require(int length) {
    if (length < 0 || remaining() < length) {
      throw new BlockParseException("Insufficient data: needed " + length
          + " bytes but only " + remaining() + " remain");
    }
  }
}
