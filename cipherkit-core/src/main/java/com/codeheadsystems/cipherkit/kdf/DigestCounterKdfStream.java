package com.codeheadsystems.cipherkit.kdf;

import com.codeheadsystems.cipherkit.engine.Digest;

/**
 * ISO 18033-2 KDF1 and KDF2: {@code T(i) = Hash(key || counter || salt)}. The two differ only
 * in the first counter value, 0 for KDF1 and 1 for KDF2.
 */
class DigestCounterKdfStream extends RoundBasedKdfStream {

  static final long KDF1_COUNTER_START = 0;
  static final long KDF2_COUNTER_START = 1;

  private final Digest digest;
  private final byte[] key;
  private final byte[] salt;
  private final long counterStart;

  DigestCounterKdfStream(KdfAlgorithm algorithm, Digest digest, byte[] key, byte[] salt) {
    super(algorithm);
    this.digest = digest;
    this.key = key.clone();
    this.salt = salt.clone();
    this.counterStart = algorithm == KdfAlgorithm.KDF1 ? KDF1_COUNTER_START : KDF2_COUNTER_START;
  }

  @Override
  protected byte[] nextRound(long index) {
    digest.reset();
    digest.update(key);
    digest.update(counter(counterStart + index - 1));
    digest.update(salt);
    return digest.digest();
  }
}
