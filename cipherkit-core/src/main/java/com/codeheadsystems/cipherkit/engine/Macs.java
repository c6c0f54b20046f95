package com.codeheadsystems.cipherkit.engine;

import com.codeheadsystems.cipherkit.common.ByteUtils;
import com.codeheadsystems.cipherkit.engine.bc.BouncyCastleEngineProvider;
import com.codeheadsystems.cipherkit.engine.source.MessageSource;

/**
 * One-shot MAC computation and verification, implemented on the streaming {@link Mac} engine.
 */
public final class Macs {

  private Macs() {
  }

  public static byte[] mac(MacAlgorithm algorithm, byte[] key, byte[] data) {
    return mac(BouncyCastleEngineProvider.INSTANCE, algorithm, key, null, MessageSource.of(data));
  }

  public static byte[] mac(MacAlgorithm algorithm, byte[] key, MessageSource source) {
    return mac(BouncyCastleEngineProvider.INSTANCE, algorithm, key, null, source);
  }

  /**
   * Computes the MAC of the whole source with a fresh engine from the provider.
   *
   * @param provider  the provider
   * @param algorithm the algorithm
   * @param key       the key
   * @param iv        nonce for MACs that need one, otherwise null
   * @param source    the source
   * @return the tag
   */
  public static byte[] mac(EngineProvider provider, MacAlgorithm algorithm, byte[] key, byte[] iv,
                           MessageSource source) {
    Mac mac = provider.mac(algorithm);
    mac.init(key, iv);
    source.feedInto(mac);
    return mac.doFinal();
  }

  /**
   * Recomputes the MAC and compares it to {@code expected} in constant time.
   *
   * @param algorithm the algorithm
   * @param key       the key
   * @param data      the data
   * @param expected  the expected tag
   * @return true when the tags match
   */
  public static boolean verify(MacAlgorithm algorithm, byte[] key, byte[] data, byte[] expected) {
    return ByteUtils.constantTimeEquals(mac(algorithm, key, data), expected);
  }
}
