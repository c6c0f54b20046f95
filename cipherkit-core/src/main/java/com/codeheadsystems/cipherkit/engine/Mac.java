package com.codeheadsystems.cipherkit.engine;

/**
 * Streaming MAC engine with the lifecycle init, update*, doFinal. After {@link #doFinal()} the
 * engine must be re-initialized with {@link #init} or {@link #reset()} (same key) before reuse.
 * <p>
 * Instances are not thread safe.
 */
public interface Mac extends Updatable {

  MacAlgorithm algorithm();

  default int macSize() {
    return algorithm().macSize();
  }

  /**
   * Keys the engine, discarding any previous state.
   *
   * @param key the key
   */
  default void init(byte[] key) {
    init(key, null);
  }

  /**
   * Keys the engine with a nonce, for MACs that need one.
   *
   * @param key the key
   * @param iv  the nonce, or null
   */
  void init(byte[] key, byte[] iv);

  /**
   * Completes the MAC computation.
   *
   * @return the tag
   */
  byte[] doFinal();

  /**
   * Discards absorbed input, keeping the current key.
   */
  void reset();
}
