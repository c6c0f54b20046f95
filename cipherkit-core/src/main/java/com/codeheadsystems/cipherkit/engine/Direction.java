package com.codeheadsystems.cipherkit.engine;

/**
 * Which way a cipher engine processes data.
 */
public enum Direction {
  ENCRYPT,
  DECRYPT;

  public boolean forEncryption() {
    return this == ENCRYPT;
  }
}
