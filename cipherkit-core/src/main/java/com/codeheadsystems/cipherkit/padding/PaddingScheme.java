package com.codeheadsystems.cipherkit.padding;

import com.codeheadsystems.cipherkit.exception.InvalidPaddingException;

/**
 * Block padding schemes. Each operates on a single block; the array length is the block size and
 * {@code offset} is where content ends and padding begins.
 */
public enum PaddingScheme {

  /**
   * Zero bytes. A block whose content ends in zero bytes cannot be told apart from padding;
   * {@link #count} treats the whole trailing zero run as padding.
   */
  ZERO_BYTE {
    @Override
    void fill(byte[] block, int offset) {
      for (int i = offset; i < block.length; i++) {
        block[i] = 0;
      }
    }

    @Override
    int padCount(byte[] block) {
      int count = 0;
      for (int i = block.length - 1; i >= 0 && block[i] == 0; i--) {
        count++;
      }
      return count;
    }
  },

  /**
   * PKCS#7: every padding byte holds the number of padding bytes.
   */
  PKCS7 {
    @Override
    void fill(byte[] block, int offset) {
      int padLength = block.length - offset;
      if (padLength > MAX_PKCS7_PAD) {
        throw new IllegalArgumentException("PKCS7 cannot encode " + padLength + " padding bytes");
      }
      byte code = (byte) padLength;
      for (int i = offset; i < block.length; i++) {
        block[i] = code;
      }
    }

    @Override
    int padCount(byte[] block) {
      if (block.length == 0) {
        throw new InvalidPaddingException("pad block corrupted");
      }
      int count = block[block.length - 1] & 0xFF;
      if (count == 0 || count > block.length) {
        throw new InvalidPaddingException("pad block corrupted");
      }
      // every byte is inspected so the check does not stop at the first mismatch
      int diff = 0;
      for (int i = block.length - count; i < block.length; i++) {
        diff |= (block[i] & 0xFF) ^ count;
      }
      if (diff != 0) {
        throw new InvalidPaddingException("pad block corrupted");
      }
      return count;
    }
  },

  /**
   * Trailing-bit-complement: padding is all 0xFF when the last content bit is 0, all 0x00 when it
   * is 1. At offset 0 the last byte of the block stands in for the missing content byte.
   */
  TBC {
    @Override
    void fill(byte[] block, int offset) {
      int reference = offset > 0 ? block[offset - 1] : block[block.length - 1];
      byte code = (reference & 0x01) == 0 ? (byte) 0xFF : (byte) 0x00;
      for (int i = offset; i < block.length; i++) {
        block[i] = code;
      }
    }

    @Override
    int padCount(byte[] block) {
      if (block.length == 0) {
        return 0;
      }
      byte code = block[block.length - 1];
      int index = block.length - 1;
      while (index > 0 && block[index - 1] == code) {
        index--;
      }
      return block.length - index;
    }
  };

  private static final int MAX_PKCS7_PAD = 255;

  /**
   * Writes padding into {@code block[offset..]}.
   */
  abstract void fill(byte[] block, int offset);

  /**
   * Number of padding bytes at the end of the block.
   */
  abstract int padCount(byte[] block);

  /**
   * Whether padding always adds at least one byte, which makes it removable without an offset.
   *
   * @return the boolean
   */
  public boolean isUnambiguous() {
    return this != ZERO_BYTE;
  }
}
