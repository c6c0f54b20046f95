package com.codeheadsystems.cipherkit.common;

import java.nio.ByteBuffer;
import java.security.SecureRandom;

/**
 * Encapsulates a {@link SecureRandom} instance for injectable random byte generation.
 * Used for IV generation by the AEAD layer and for salts and nonces by callers.
 */
public record RandomProvider(SecureRandom random) {

  /**
   * Smallest nonce {@link #randomNonce(int)} will produce; the timestamp prefix takes 8 bytes.
   */
  public static final int MIN_NONCE_LENGTH = 8;

  /**
   * Creates a RandomProvider with a default {@link SecureRandom}.
   */
  public RandomProvider() {
    this(new SecureRandom());
  }

  /**
   * Fills the whole buffer with random bytes.
   *
   * @param buffer the buffer to fill
   */
  public void fill(byte[] buffer) {
    random.nextBytes(buffer);
  }

  /**
   * Generates a random byte array of the given length.
   *
   * @param len the number of random bytes to generate
   * @return a new byte array filled with random bytes
   */
  public byte[] randomBytes(int len) {
    if (len < 0) {
      throw new IllegalArgumentException("len must be >= 0");
    }
    byte[] out = new byte[len];
    fill(out);
    return out;
  }

  /**
   * Generates a nonce whose first 8 bytes are the current time in milliseconds (big-endian) and
   * whose remainder is random.
   *
   * @param len the nonce length, at least {@value #MIN_NONCE_LENGTH}
   * @return the nonce
   */
  public byte[] randomNonce(int len) {
    if (len < MIN_NONCE_LENGTH) {
      throw new IllegalArgumentException("nonce length must be >= " + MIN_NONCE_LENGTH + ", was " + len);
    }
    byte[] out = randomBytes(len);
    ByteBuffer.wrap(out).putLong(System.currentTimeMillis());
    return out;
  }
}
