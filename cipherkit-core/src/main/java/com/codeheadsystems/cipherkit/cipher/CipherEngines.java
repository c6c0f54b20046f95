package com.codeheadsystems.cipherkit.cipher;

import com.codeheadsystems.cipherkit.config.CipherKitConfig;
import com.codeheadsystems.cipherkit.engine.EngineProvider;
import com.codeheadsystems.cipherkit.engine.MacAlgorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Composes cipher engines from the primitives of an {@link EngineProvider}.
 */
public final class CipherEngines {

  private static final Logger log = LoggerFactory.getLogger(CipherEngines.class);

  private CipherEngines() {
  }

  public static CipherEngine create(CipherAlgorithm algorithm) {
    return create(algorithm, CipherKitConfig.DEFAULT);
  }

  /**
   * Creates an uninitialized engine.
   *
   * @param algorithm the algorithm
   * @param config    the config supplying primitives
   * @return the engine; an {@link AeadCipherEngine} when {@link CipherAlgorithm#isAead()}
   */
  public static CipherEngine create(CipherAlgorithm algorithm, CipherKitConfig config) {
    EngineProvider provider = config.engineProvider();
    CipherEngine engine = switch (algorithm.mode()) {
      case CBC -> new CbcModeEngine(algorithm, provider.blockCipher(algorithm.blockCipher()));
      case CTR -> new CtrModeEngine(algorithm, provider.blockCipher(algorithm.blockCipher()));
      case OFB -> new OfbModeEngine(algorithm, provider.blockCipher(algorithm.blockCipher()));
      case GCM -> new GcmModeEngine(algorithm, provider.blockCipher(algorithm.blockCipher()));
      case STREAM -> new StreamCipherEngine(algorithm, provider.streamCipher(algorithm.streamCipher()));
      case STREAM_POLY1305 -> new ChaCha20Poly1305Engine(algorithm,
          provider.streamCipher(algorithm.streamCipher()), provider.mac(MacAlgorithm.POLY1305));
    };
    log.debug("create({})", algorithm);
    return engine;
  }

  /**
   * Creates an uninitialized AEAD engine.
   *
   * @param algorithm an algorithm with {@link CipherAlgorithm#isAead()}
   * @param config    the config
   * @return the engine
   */
  public static AeadCipherEngine createAead(CipherAlgorithm algorithm, CipherKitConfig config) {
    if (!algorithm.isAead()) {
      throw new IllegalArgumentException(algorithm.algorithmName() + " is not an AEAD algorithm");
    }
    return (AeadCipherEngine) create(algorithm, config);
  }
}
