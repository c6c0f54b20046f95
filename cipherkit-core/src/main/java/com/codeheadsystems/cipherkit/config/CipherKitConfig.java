package com.codeheadsystems.cipherkit.config;

import com.codeheadsystems.cipherkit.common.RandomProvider;
import com.codeheadsystems.cipherkit.engine.EngineProvider;
import com.codeheadsystems.cipherkit.engine.bc.BouncyCastleEngineProvider;

/**
 * Binds the primitive provider and the random source used by KDF streams, cipher engines and the
 * AEAD layer.
 */
public record CipherKitConfig(EngineProvider engineProvider, RandomProvider randomProvider) {

  /**
   * BouncyCastle engines and a default {@link java.security.SecureRandom}.
   */
  public static final CipherKitConfig DEFAULT = new CipherKitConfig(
      BouncyCastleEngineProvider.INSTANCE,
      new RandomProvider()
  );

  public CipherKitConfig {
    if (engineProvider == null) {
      throw new IllegalArgumentException("engineProvider must not be null");
    }
    if (randomProvider == null) {
      throw new IllegalArgumentException("randomProvider must not be null");
    }
  }

  /**
   * Returns a new config identical to this one but using the given {@link RandomProvider}.
   */
  public CipherKitConfig withRandomProvider(RandomProvider randomProvider) {
    return new CipherKitConfig(engineProvider, randomProvider);
  }

  /**
   * Returns a new config identical to this one but using the given {@link EngineProvider}.
   */
  public CipherKitConfig withEngineProvider(EngineProvider engineProvider) {
    return new CipherKitConfig(engineProvider, randomProvider);
  }
}
