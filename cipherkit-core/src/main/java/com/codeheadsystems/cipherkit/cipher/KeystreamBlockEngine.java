package com.codeheadsystems.cipherkit.cipher;

import com.codeheadsystems.cipherkit.engine.Direction;
import com.codeheadsystems.cipherkit.engine.RawBlockCipher;
import java.util.Arrays;

/**
 * Block-cipher modes that act as stream ciphers: the cipher only ever runs forward to produce
 * keystream blocks, which are XORed with the data. Unused keystream carries over between calls.
 */
abstract class KeystreamBlockEngine extends AbstractCipherEngine {

  protected final RawBlockCipher cipher;
  private byte[] keystream;
  private int keystreamPosition;

  KeystreamBlockEngine(CipherAlgorithm algorithm, RawBlockCipher cipher) {
    super(algorithm);
    this.cipher = cipher;
  }

  @Override
  protected void engineInit(Direction direction, byte[] key, byte[] iv) {
    cipher.init(Direction.ENCRYPT, key);
    keystream = new byte[cipher.blockSize()];
    keystreamPosition = keystream.length;
    startKeystream(iv);
  }

  @Override
  protected byte[] engineProcess(byte[] input, int offset, int length) {
    byte[] out = new byte[length];
    for (int i = 0; i < length; i++) {
      if (keystreamPosition == keystream.length) {
        nextKeystreamBlock(keystream);
        keystreamPosition = 0;
      }
      out[i] = (byte) (input[offset + i] ^ keystream[keystreamPosition++]);
    }
    return out;
  }

  @Override
  protected void engineReset() {
    cipher.reset();
    Arrays.fill(keystream, (byte) 0);
  }

  protected abstract void startKeystream(byte[] iv);

  /**
   * Writes the next keystream block into {@code out}.
   */
  protected abstract void nextKeystreamBlock(byte[] out);
}
