package com.codeheadsystems.cipherkit.kdf;

import com.codeheadsystems.cipherkit.engine.Mac;
import java.util.Arrays;

/**
 * HKDF per RFC 5869. Extract runs once at construction; expand rounds are produced on demand.
 */
class HkdfStream extends RoundBasedKdfStream {

  // RFC 5869 §2.3: the counter is a single octet, so at most 255 rounds exist
  private static final int MAX_ROUNDS = 255;

  private final Mac hmac;
  private final byte[] info;
  private byte[] previous = new byte[0];

  HkdfStream(Mac hmac, byte[] key, byte[] salt, byte[] info) {
    super(KdfAlgorithm.HKDF);
    this.hmac = hmac;
    this.info = info.clone();
    byte[] actualSalt = salt.length == 0 ? new byte[hmac.macSize()] : salt;
    hmac.init(actualSalt);
    hmac.update(key);
    byte[] prk = hmac.doFinal();
    hmac.init(prk);
    Arrays.fill(prk, (byte) 0);
  }

  @Override
  protected byte[] nextRound(long index) {
    if (index > MAX_ROUNDS) {
      throw new IllegalStateException("HKDF may only produce " + MAX_ROUNDS + " * HashLen bytes");
    }
    hmac.reset();
    hmac.update(previous);
    hmac.update(info);
    hmac.update((byte) index);
    previous = hmac.doFinal();
    return previous;
  }
}
