package com.codeheadsystems.cipherkit.cipher;

import com.codeheadsystems.cipherkit.engine.Direction;
import com.codeheadsystems.cipherkit.engine.RawBlockCipher;
import java.util.Arrays;

/**
 * Cipher block chaining. Input must be a whole number of blocks; padding is the caller's job.
 */
class CbcModeEngine extends AbstractCipherEngine {

  private final RawBlockCipher cipher;
  private final int blockSize;
  private byte[] chain;

  CbcModeEngine(CipherAlgorithm algorithm, RawBlockCipher cipher) {
    super(algorithm);
    this.cipher = cipher;
    this.blockSize = cipher.blockSize();
  }

  @Override
  protected void engineInit(Direction direction, byte[] key, byte[] iv) {
    cipher.init(direction, key);
    chain = iv.clone();
  }

  @Override
  protected byte[] engineProcess(byte[] input, int offset, int length) {
    if (length % blockSize != 0) {
      throw new IllegalArgumentException(algorithm().algorithmName() + " input must be a multiple of "
          + blockSize + " bytes, was " + length);
    }
    byte[] out = new byte[length];
    byte[] block = new byte[blockSize];
    for (int pos = 0; pos < length; pos += blockSize) {
      if (direction() == Direction.ENCRYPT) {
        for (int i = 0; i < blockSize; i++) {
          block[i] = (byte) (input[offset + pos + i] ^ chain[i]);
        }
        cipher.processBlock(block, 0, out, pos);
        System.arraycopy(out, pos, chain, 0, blockSize);
      } else {
        cipher.processBlock(input, offset + pos, out, pos);
        for (int i = 0; i < blockSize; i++) {
          out[pos + i] ^= chain[i];
        }
        System.arraycopy(input, offset + pos, chain, 0, blockSize);
      }
    }
    return out;
  }

  @Override
  protected void engineReset() {
    cipher.reset();
    Arrays.fill(chain, (byte) 0);
  }
}
