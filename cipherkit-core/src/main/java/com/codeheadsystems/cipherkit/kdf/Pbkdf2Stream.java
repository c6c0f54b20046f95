package com.codeheadsystems.cipherkit.kdf;

import com.codeheadsystems.cipherkit.common.ByteUtils;
import com.codeheadsystems.cipherkit.engine.Mac;

/**
 * PBKDF2 per RFC 8018 §5.2. Unlike the other streams this one keeps no cursor: every
 * {@link #getBytes} recomputes the derived key from the start, so the same length always yields
 * the same bytes.
 */
class Pbkdf2Stream implements KdfStream {

  private final Mac hmac;
  private final byte[] salt;
  private final int iterations;

  Pbkdf2Stream(Mac keyedHmac, byte[] salt, int iterations) {
    this.hmac = keyedHmac;
    this.salt = salt.clone();
    this.iterations = iterations;
  }

  @Override
  public KdfAlgorithm algorithm() {
    return KdfAlgorithm.PBKDF2;
  }

  @Override
  public byte[] getBytes(int length) {
    if (length < 0) {
      throw new IllegalArgumentException("length must be >= 0");
    }
    int hashLength = hmac.macSize();
    byte[] out = new byte[length];
    int filled = 0;
    for (long block = 1; filled < length; block++) {
      byte[] t = blockF(block);
      int take = Math.min(hashLength, length - filled);
      System.arraycopy(t, 0, out, filled, take);
      filled += take;
    }
    return out;
  }

  private byte[] blockF(long blockIndex) {
    hmac.reset();
    hmac.update(salt);
    hmac.update(ByteUtils.I2OSP(blockIndex, 4));
    byte[] u = hmac.doFinal();
    byte[] t = u.clone();
    for (int i = 1; i < iterations; i++) {
      hmac.reset();
      hmac.update(u);
      u = hmac.doFinal();
      for (int j = 0; j < t.length; j++) {
        t[j] ^= u[j];
      }
    }
    return t;
  }
}
