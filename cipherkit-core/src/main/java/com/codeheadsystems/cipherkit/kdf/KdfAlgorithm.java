package com.codeheadsystems.cipherkit.kdf;

import com.codeheadsystems.cipherkit.engine.AlgorithmNames;

/**
 * Supported key derivation functions.
 */
public enum KdfAlgorithm {

  /**
   * RFC 5869 extract-then-expand over HMAC.
   */
  HKDF("hkdf"),
  /**
   * ISO 18033-2 KDF1: digest of key, 32-bit counter from 0 and optional salt.
   */
  KDF1("kdf1"),
  /**
   * ISO 18033-2 KDF2: as KDF1 with the counter starting at 1.
   */
  KDF2("kdf2"),
  /**
   * NIST SP 800-108 counter mode.
   */
  CMKDF("cmkdf"),
  /**
   * NIST SP 800-108 feedback mode with counter.
   */
  FMKDF("fmkdf"),
  /**
   * NIST SP 800-108 double-pipeline iteration mode with counter.
   */
  DPIMKDF("dpimkdf"),
  /**
   * RFC 8018 PBKDF2 over HMAC. Fixed output, not a stream.
   */
  PBKDF2("pbkdf2");

  private final String algorithmName;

  KdfAlgorithm(String algorithmName) {
    this.algorithmName = algorithmName;
  }

  public static KdfAlgorithm fromName(String name) {
    return AlgorithmNames.resolve(KdfAlgorithm.class, name, KdfAlgorithm::algorithmName);
  }

  public String algorithmName() {
    return algorithmName;
  }

  /**
   * True for every algorithm whose successive reads continue one keystream; false for PBKDF2,
   * which returns the same bytes on every read.
   *
   * @return the boolean
   */
  public boolean isStreaming() {
    return this != PBKDF2;
  }

  /**
   * True for the NIST SP 800-108 modes, which accept any nonce-free MAC as their PRF.
   *
   * @return the boolean
   */
  public boolean usesMacPrf() {
    return this == CMKDF || this == FMKDF || this == DPIMKDF;
  }
}
