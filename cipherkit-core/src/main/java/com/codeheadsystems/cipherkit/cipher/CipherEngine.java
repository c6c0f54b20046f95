package com.codeheadsystems.cipherkit.cipher;

import com.codeheadsystems.cipherkit.engine.Direction;

/**
 * A keyed cipher in a fixed mode.
 * <p>
 * Lifecycle: a new engine is uninitialized; {@link #init} makes it ready and may be called again
 * at any time to start over with new key material; {@link #reset} returns it to uninitialized.
 * Processing an uninitialized engine throws
 * {@link com.codeheadsystems.cipherkit.exception.EngineNotInitializedException}.
 * <p>
 * Instances are not thread safe.
 */
public interface CipherEngine {

  CipherAlgorithm algorithm();

  /**
   * Keys the engine.
   *
   * @param direction the direction
   * @param key       the key, sized per {@link CipherAlgorithm#keySizes()}
   * @param iv        the IV or nonce, sized per {@link CipherAlgorithm#ivSize()}
   * @throws com.codeheadsystems.cipherkit.exception.InvalidKeyMaterialException on a size mismatch
   */
  void init(Direction direction, byte[] key, byte[] iv);

  boolean isInitialized();

  default int blockSize() {
    return algorithm().blockSize();
  }

  /**
   * Upper bound on the output produced by processing {@code inputLength} more bytes and, for
   * AEAD engines, finishing.
   *
   * @param inputLength the input length
   * @return the output size
   */
  int outputSize(int inputLength);

  /**
   * Processes input. CBC needs whole blocks; every other mode takes any length and carries its
   * keystream position into the next call. AEAD engines decrypting return nothing here and release
   * the plaintext from {@code doFinal}.
   *
   * @param input  the input
   * @param offset the offset
   * @param length the length
   * @return the output produced by this call
   */
  byte[] processBytes(byte[] input, int offset, int length);

  default byte[] processBytes(byte[] input) {
    return processBytes(input, 0, input.length);
  }

  /**
   * Processes exactly one block.
   *
   * @param block the block
   * @return the output produced by this call
   */
  default byte[] processBlock(byte[] block) {
    if (block.length != blockSize()) {
      throw new IllegalArgumentException("block must be " + blockSize() + " bytes, was " + block.length);
    }
    return processBytes(block, 0, block.length);
  }

  void reset();
}
