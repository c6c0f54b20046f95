package com.codeheadsystems.cipherkit.cipher;

/**
 * How a {@link CipherAlgorithm} turns its primitive into a cipher.
 */
public enum CipherMode {
  CBC(false),
  CTR(false),
  OFB(false),
  GCM(true),
  /**
   * A raw stream cipher, used as is.
   */
  STREAM(false),
  /**
   * A stream cipher paired with Poly1305 per RFC 8439.
   */
  STREAM_POLY1305(true);

  private final boolean aead;

  CipherMode(boolean aead) {
    this.aead = aead;
  }

  public boolean isAead() {
    return aead;
  }
}
