package com.codeheadsystems.cipherkit.common;

import java.security.MessageDigest;
import java.util.Arrays;

/**
 * Byte array helpers shared by the engines: integer encoding, concatenation, slicing, XOR and
 * constant-time comparison.
 */
public class ByteUtils {

  private ByteUtils() {
  }

  /**
   * Integer to Octet String Primitive (I2OSP) from RFC 8017.
   * Encodes a non-negative integer as a big-endian octet string of the given length.
   *
   * @param value  the value
   * @param length the length
   * @return the byte [ ]
   */
  public static byte[] I2OSP(long value, int length) {
    if (value < 0 || (length < 8 && value >= (1L << (8 * length)))) {
      throw new IllegalArgumentException("Value too large for specified length");
    }
    byte[] result = new byte[length];
    for (int i = length - 1; i >= 0; i--) {
      result[i] = (byte) (value & 0xFF);
      value >>= 8;
    }
    return result;
  }

  /**
   * Concatenates multiple byte arrays into a single array. Null arrays count as empty.
   *
   * @param arrays the arrays
   * @return the byte [ ]
   */
  public static byte[] concat(byte[]... arrays) {
    int totalLength = 0;
    for (byte[] arr : arrays) {
      if (arr != null) {
        totalLength += arr.length;
      }
    }
    byte[] result = new byte[totalLength];
    int offset = 0;
    for (byte[] arr : arrays) {
      if (arr != null) {
        System.arraycopy(arr, 0, result, offset, arr.length);
        offset += arr.length;
      }
    }
    return result;
  }

  /**
   * Copies {@code [from, to)} out of the source array.
   *
   * @param source the source
   * @param from   inclusive start
   * @param to     exclusive end
   * @return the byte [ ]
   */
  public static byte[] slice(byte[] source, int from, int to) {
    if (from < 0 || to > source.length || from > to) {
      throw new IllegalArgumentException(
          "Invalid slice [" + from + ", " + to + ") of array with length " + source.length);
    }
    return Arrays.copyOfRange(source, from, to);
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
   * Compares two arrays in time that depends only on their lengths, never on the position of the
   * first differing byte.
   *
   * @param a the a
   * @param b the b
   * @return true when both arrays hold the same bytes
   */
  public static boolean constantTimeEquals(byte[] a, byte[] b) {
    return MessageDigest.isEqual(a, b);
  }

  /**
   * Returns a defensive copy, or an empty array for null.
   *
   * @param bytes the bytes
   * @return the byte [ ]
   */
  public static byte[] copyOrEmpty(byte[] bytes) {
    return bytes == null ? new byte[0] : bytes.clone();
  }
}
