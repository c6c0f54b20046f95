package com.codeheadsystems.cipherkit.cipher;

import com.codeheadsystems.cipherkit.engine.RawBlockCipher;

/**
 * Counter mode (SIC). The IV is the initial counter block; the whole block is incremented as a
 * big-endian integer, wrapping to zero.
 */
class CtrModeEngine extends KeystreamBlockEngine {

  private byte[] counter;

  CtrModeEngine(CipherAlgorithm algorithm, RawBlockCipher cipher) {
    super(algorithm, cipher);
  }

  static void increment(byte[] counter, int from) {
    for (int i = counter.length - 1; i >= from; i--) {
      if (++counter[i] != 0) {
        return;
      }
    }
  }

  @Override
  protected void startKeystream(byte[] iv) {
    counter = iv.clone();
  }

  @Override
  protected void nextKeystreamBlock(byte[] out) {
    cipher.processBlock(counter, 0, out, 0);
    increment(counter, 0);
  }
}
