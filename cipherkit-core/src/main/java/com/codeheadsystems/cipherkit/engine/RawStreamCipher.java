package com.codeheadsystems.cipherkit.engine;

/**
 * A keyed keystream generator. Encryption and decryption are the same XOR.
 */
public interface RawStreamCipher {

  StreamCipherAlgorithm algorithm();

  void init(Direction direction, byte[] key, byte[] iv);

  void processBytes(byte[] in, int inOffset, int length, byte[] out, int outOffset);

  default byte[] processBytes(byte[] in) {
    byte[] out = new byte[in.length];
    processBytes(in, 0, in.length, out, 0);
    return out;
  }

  /**
   * Drops the key; {@link #init} is required before the next call.
   */
  void reset();
}
