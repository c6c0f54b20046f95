package com.codeheadsystems.cipherkit.engine;

/**
 * A keyed block permutation with no mode of operation. Modes are layered on top in
 * {@code com.codeheadsystems.cipherkit.cipher}.
 */
public interface RawBlockCipher {

  BlockCipherAlgorithm algorithm();

  default int blockSize() {
    return algorithm().blockSize();
  }

  void init(Direction direction, byte[] key);

  /**
   * Transforms exactly one block from {@code in} into {@code out}.
   *
   * @param in        the input
   * @param inOffset  the input offset
   * @param out       the output
   * @param outOffset the output offset
   */
  void processBlock(byte[] in, int inOffset, byte[] out, int outOffset);

  default byte[] processBlock(byte[] in) {
    byte[] out = new byte[blockSize()];
    processBlock(in, 0, out, 0);
    return out;
  }

  /**
   * Drops the key; {@link #init} is required before the next block.
   */
  void reset();
}
