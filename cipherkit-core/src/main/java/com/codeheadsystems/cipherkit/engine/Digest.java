package com.codeheadsystems.cipherkit.engine;

/**
 * Streaming hash engine. Ready on creation; {@link #digest()} finalizes it and further updates
 * fail until {@link #reset()} is called.
 * <p>
 * Instances are not thread safe.
 */
public interface Digest extends Updatable {

  DigestAlgorithm algorithm();

  default int digestSize() {
    return algorithm().digestSize();
  }

  /**
   * Completes the hash and returns it. The engine is consumed afterwards.
   *
   * @return the digest
   */
  byte[] digest();

  /**
   * Discards absorbed input and makes the engine usable again.
   */
  void reset();
}
