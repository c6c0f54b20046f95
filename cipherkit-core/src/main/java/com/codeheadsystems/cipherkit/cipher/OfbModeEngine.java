package com.codeheadsystems.cipherkit.cipher;

import com.codeheadsystems.cipherkit.engine.RawBlockCipher;

/**
 * Output feedback: each keystream block is the encryption of the previous one, starting from the
 * IV.
 */
class OfbModeEngine extends KeystreamBlockEngine {

  private byte[] register;

  OfbModeEngine(CipherAlgorithm algorithm, RawBlockCipher cipher) {
    super(algorithm, cipher);
  }

  @Override
  protected void startKeystream(byte[] iv) {
    register = iv.clone();
  }

  @Override
  protected void nextKeystreamBlock(byte[] out) {
    cipher.processBlock(register, 0, out, 0);
    System.arraycopy(out, 0, register, 0, register.length);
  }
}
