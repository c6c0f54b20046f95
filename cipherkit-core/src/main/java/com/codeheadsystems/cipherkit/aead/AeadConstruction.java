package com.codeheadsystems.cipherkit.aead;

/**
 * One way of building authenticated encryption. Envelopes are {@code ciphertext || tag}.
 */
interface AeadConstruction {

  byte[] encrypt(byte[] key, byte[] iv, byte[] plaintext, byte[] aad);

  /**
   * Authenticates then decrypts.
   *
   * @throws com.codeheadsystems.cipherkit.exception.AuthenticationFailureException if the envelope
   *                                                                                is malformed or forged
   */
  byte[] decrypt(byte[] key, byte[] iv, byte[] envelope, byte[] aad);
}
