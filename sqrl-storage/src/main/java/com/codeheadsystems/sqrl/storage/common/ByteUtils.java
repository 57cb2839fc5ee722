package com.codeheadsystems.sqrl.storage.common;

import java.util.Arrays;

/**
 * Utility methods for the little-endian integer encoding and byte array handling used by the
 * S4 storage format.
 */
public class ByteUtils {

  private ByteUtils() {
  }

  /**
   * Converts a non-negative integer to a little-endian octet string of the specified length.
   * S4 stores every multi-byte integer least significant byte first.
   *
   * @param value  the value
   * @param length the length
   * @return the byte [ ]
   */
  public static byte[] toLittleEndian(long value, int length) {
    if (value < 0 || (length < 8 && value >= (1L << (8 * length)))) {
      throw new IllegalArgumentException("Value too large for specified length");
    }
    byte[] result = new byte[length];
    for (int i = 0; i < length; i++) {
      result[i] = (byte) (value & 0xFF);
      value >>= 8;
    }
    return result;
  }

  /**
   * Concatenates multiple byte arrays into a single array.
   *
   * @param arrays the arrays
   * @return the byte [ ]
   */
  public static byte[] concat(byte[]... arrays) {
    int totalLength = 0;
    for (byte[] arr : arrays) {
      totalLength += arr.length;
    }
    byte[] result = new byte[totalLength];
    int offset = 0;
    for (byte[] arr : arrays) {
      System.arraycopy(arr, 0, result, offset, arr.length);
      offset += arr.length;
    }
    return result;
  }

  /**
   * XOR two byte arrays of equal length.
   *
   * @param a the a
   * @param b the b
   * @return the byte [ ]
   */
  public static byte[] xor(byte[] a, byte[] b) {
    if (a.length != b.length) {
      throw new IllegalArgumentException("XOR arrays must have equal length: " + a.length + " vs " + b.length);
    }
    byte[] out = new byte[a.length];
    for (int i = 0; i < a.length; i++) {
      out[i] = (byte) (a[i] ^ b[i]);
    }
    return out;
  }

  /**
   * Returns true when every byte is zero. Runs over the whole array regardless of content.
   *
   * @param bytes the bytes
   * @return true if all bytes are zero
   */
  public static boolean isAllZero(byte[] bytes) {
    int acc = 0;
    for (byte b : bytes) {
      acc |= b;
    }
    return acc == 0;
  }

  /**
   * Overwrites the array with zeros. Null is ignored.
   *
   * @param bytes the bytes
   */
  public static void wipe(byte[] bytes) {
    if (bytes != null) {
      Arrays.fill(bytes, (byte) 0);
    }
  }

  /**
   * Checks the array has exactly the expected length without copying it.
   *
   * @param bytes    the bytes
   * @param expected the expected length
   * @param name     the field name, for the error message
   * @return the same array
   * @throws IllegalArgumentException if the array is null or has the wrong length
   */
  public static byte[] requireLength(byte[] bytes, int expected, String name) {
    if (bytes == null || bytes.length != expected) {
      throw new IllegalArgumentException(name + " must be exactly " + expected + " bytes, got "
          + (bytes == null ? "null" : bytes.length));
    }
    return bytes;
  }

  /**
   * Returns a copy of the array after checking it has exactly the expected length.
   *
   * @param bytes    the bytes
   * @param expected the expected length
   * @param name     the field name, for the error message
   * @return a defensive copy
   * @throws IllegalArgumentException if the array is null or has the wrong length
   */
  public static byte[] copyOfExactLength(byte[] bytes, int expected, String name) {
    return requireLength(bytes, expected, name).clone();
  }
}
