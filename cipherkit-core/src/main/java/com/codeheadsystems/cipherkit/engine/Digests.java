package com.codeheadsystems.cipherkit.engine;

import com.codeheadsystems.cipherkit.engine.bc.BouncyCastleEngineProvider;
import com.codeheadsystems.cipherkit.engine.source.MessageSource;

/**
 * One-shot hashing, implemented on the streaming {@link Digest} engine.
 */
public final class Digests {

  private Digests() {
  }

  public static byte[] digest(DigestAlgorithm algorithm, byte[] data) {
    return digest(BouncyCastleEngineProvider.INSTANCE, algorithm, MessageSource.of(data));
  }

  public static byte[] digest(DigestAlgorithm algorithm, MessageSource source) {
    return digest(BouncyCastleEngineProvider.INSTANCE, algorithm, source);
  }

  /**
   * Hashes the whole source with a fresh engine from the provider.
   *
   * @param provider  the provider
   * @param algorithm the algorithm
   * @param source    the source
   * @return the digest
   */
  public static byte[] digest(EngineProvider provider, DigestAlgorithm algorithm, MessageSource source) {
    Digest digest = provider.digest(algorithm);
    source.feedInto(digest);
    return digest.digest();
  }
}
