package com.codeheadsystems.cipherkit.padding;

import com.codeheadsystems.cipherkit.common.ByteUtils;
import com.codeheadsystems.cipherkit.exception.InvalidPaddingException;
import java.util.Arrays;

/**
 * Pad, unpad and count operations over single blocks, plus message-level helpers used by the
 * CBC-based schemes.
 * <p>
 * {@link #padInPlace} takes ownership of the caller's buffer and returns it mutated;
 * {@link #pad} never touches its input and allocates the result.
 */
public final class Padding {

  private Padding() {
  }

  /**
   * Writes padding into {@code block} from {@code offset} to the end.
   *
   * @param block  the block, mutated
   * @param offset where content ends
   * @param scheme the scheme
   * @return the same {@code block} reference
   */
  public static byte[] padInPlace(byte[] block, int offset, PaddingScheme scheme) {
    checkOffset(block, offset);
    scheme.fill(block, offset);
    return block;
  }

  /**
   * Returns a padded copy of {@code block}.
   *
   * @param block  the block, untouched
   * @param offset where content ends
   * @param scheme the scheme
   * @return a new array
   */
  public static byte[] pad(byte[] block, int offset, PaddingScheme scheme) {
    return padInPlace(block.clone(), offset, scheme);
  }

  /**
   * Counts the padding bytes at the end of the block.
   *
   * @param block  the block
   * @param scheme the scheme
   * @return the count
   * @throws InvalidPaddingException for malformed PKCS7 padding
   */
  public static int count(byte[] block, PaddingScheme scheme) {
    return scheme.padCount(block);
  }

  /**
   * Returns the content of a block whose padding is known to start at {@code offset}. The tail is
   * compared with the padding the scheme would write there.
   *
   * @param block  the block
   * @param offset where content ends
   * @param scheme the scheme
   * @return a copy of {@code block[0..offset)}
   * @throws InvalidPaddingException if the tail is not exactly that padding
   */
  public static byte[] unpad(byte[] block, int offset, PaddingScheme scheme) {
    checkOffset(block, offset);
    // a block of pure padding has no content byte to derive the expected padding from
    boolean valid = offset == 0 && block.length > 0
        ? scheme.padCount(block) == block.length
        : ByteUtils.constantTimeEquals(pad(block, offset, scheme), block);
    if (!valid) {
      throw new InvalidPaddingException(scheme + " padding does not start at offset " + offset);
    }
    return Arrays.copyOf(block, offset);
  }

  /**
   * Strips padding located with {@link #count}.
   *
   * @param block  the block
   * @param scheme the scheme
   * @return a copy of the content
   */
  public static byte[] unpad(byte[] block, PaddingScheme scheme) {
    int count = scheme.padCount(block);
    return Arrays.copyOf(block, block.length - count);
  }

  /**
   * Pads a whole message to a multiple of {@code blockSize}. PKCS7 and TBC always append between
   * 1 and {@code blockSize} bytes; ZERO_BYTE appends nothing to a message that is already aligned.
   *
   * @param message   the message, untouched
   * @param blockSize the block size
   * @param scheme    the scheme
   * @return the padded message
   */
  public static byte[] padMessage(byte[] message, int blockSize, PaddingScheme scheme) {
    checkBlockSize(blockSize);
    int tail = message.length % blockSize;
    if (tail == 0 && !scheme.isUnambiguous()) {
      return message.clone();
    }
    int fullBlocks = message.length - tail;
    byte[] lastBlock = new byte[blockSize];
    System.arraycopy(message, fullBlocks, lastBlock, 0, tail);
    padInPlace(lastBlock, tail, scheme);
    byte[] padded = Arrays.copyOf(message, fullBlocks + blockSize);
    System.arraycopy(lastBlock, 0, padded, fullBlocks, blockSize);
    return padded;
  }

  /**
   * Removes the padding from the final block of a padded message.
   *
   * @param padded    the padded message, a non-empty multiple of {@code blockSize}
   * @param blockSize the block size
   * @param scheme    the scheme
   * @return the message
   * @throws InvalidPaddingException when the length is wrong or the padding is malformed
   */
  public static byte[] unpadMessage(byte[] padded, int blockSize, PaddingScheme scheme) {
    checkBlockSize(blockSize);
    if (padded.length == 0 || padded.length % blockSize != 0) {
      throw new InvalidPaddingException("Padded message length " + padded.length
          + " is not a positive multiple of " + blockSize);
    }
    byte[] lastBlock = Arrays.copyOfRange(padded, padded.length - blockSize, padded.length);
    int count = scheme.padCount(lastBlock);
    return Arrays.copyOf(padded, padded.length - count);
  }

  private static void checkOffset(byte[] block, int offset) {
    if (offset < 0 || offset > block.length) {
      throw new IllegalArgumentException("offset " + offset + " outside block of " + block.length + " bytes");
    }
  }

  private static void checkBlockSize(int blockSize) {
    if (blockSize <= 0 || blockSize > 255) {
      throw new IllegalArgumentException("blockSize must be between 1 and 255");
    }
  }
}
