package com.codeheadsystems.cipherkit.cipher;

/**
 * A cipher engine that authenticates. Associated data goes in before any message bytes, and
 * {@link #doFinal()} completes the operation: on encrypt it returns the tag, on decrypt it
 * verifies the tag and returns the whole plaintext. Either way the engine is uninitialized
 * afterwards, so a key/nonce pair is never reused by accident.
 */
public interface AeadCipherEngine extends CipherEngine {

  int tagSize();

  /**
   * Adds associated data.
   *
   * @param aad    the associated data
   * @param offset the offset
   * @param length the length
   * @throws IllegalStateException once message bytes have been processed
   */
  void updateAad(byte[] aad, int offset, int length);

  default void updateAad(byte[] aad) {
    updateAad(aad, 0, aad.length);
  }

  /**
   * Finishes the operation.
   *
   * @return the tag on encrypt, the plaintext on decrypt
   * @throws com.codeheadsystems.cipherkit.exception.AuthenticationFailureException on a tag mismatch
   */
  byte[] doFinal();
}
