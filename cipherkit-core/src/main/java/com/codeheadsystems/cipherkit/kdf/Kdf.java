package com.codeheadsystems.cipherkit.kdf;

import com.codeheadsystems.cipherkit.config.CipherKitConfig;
import com.codeheadsystems.cipherkit.engine.DigestAlgorithm;
import com.codeheadsystems.cipherkit.engine.EngineProvider;
import com.codeheadsystems.cipherkit.engine.Mac;
import com.codeheadsystems.cipherkit.engine.MacAlgorithm;
import com.codeheadsystems.cipherkit.exception.InvalidKeyMaterialException;
import com.codeheadsystems.cipherkit.exception.UnsupportedAlgorithmException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds {@link KdfStream}s. All configuration checks (digest/MAC pairing, key presence, MAC key
 * sizes) happen here, before any output is produced.
 */
public final class Kdf {

  private static final Logger log = LoggerFactory.getLogger(Kdf.class);

  private Kdf() {
  }

  /**
   * Creates a stream with the default provider.
   *
   * @param params the params
   * @return the kdf stream
   */
  public static KdfStream engine(KdfParameters params) {
    return engine(params, CipherKitConfig.DEFAULT);
  }

  /**
   * Creates a stream whose primitives come from the configured provider.
   *
   * @param params the params
   * @param config the config
   * @return the kdf stream
   * @throws UnsupportedAlgorithmException for a digest/MAC the algorithm cannot use
   * @throws InvalidKeyMaterialException   for a missing key or a key the MAC rejects
   */
  public static KdfStream engine(KdfParameters params, CipherKitConfig config) {
    if (params.key() == null) {
      throw new InvalidKeyMaterialException(params.algorithm().algorithmName() + " requires a key");
    }
    EngineProvider provider = config.engineProvider();
    KdfStream stream = switch (params.algorithm()) {
      case HKDF -> new HkdfStream(provider.mac(hmac(params)), params.key(), params.salt(), params.info());
      case KDF1, KDF2 -> new DigestCounterKdfStream(params.algorithm(),
          provider.digest(requireDigest(params)), params.key(), params.salt());
      case CMKDF -> {
        Mac prf = keyedPrf(provider, params);
        int declared = params.declaredLength() == 0 ? prf.macSize() : params.declaredLength();
        yield new CounterModeKdfStream(prf, params.label(), params.context(), declared);
      }
      case FMKDF -> new FeedbackModeKdfStream(keyedPrf(provider, params), params.iv(), params.label(),
          params.context());
      case DPIMKDF -> new DoublePipelineKdfStream(keyedPrf(provider, params), params.label(), params.context());
      case PBKDF2 -> {
        Mac hmac = provider.mac(hmac(params));
        hmac.init(params.key());
        yield new Pbkdf2Stream(hmac, params.salt(), params.iterations());
      }
    };
    log.debug("engine({}, digest={}, mac={})", params.algorithm(), params.digest(), params.mac());
    return stream;
  }

  /**
   * One-shot derivation: the first {@code length} bytes of a fresh stream.
   *
   * @param params the params
   * @param length the length
   * @return the bytes
   */
  public static byte[] derive(KdfParameters params, int length) {
    return engine(params).getBytes(length);
  }

  private static DigestAlgorithm requireDigest(KdfParameters params) {
    if (params.digest() == null) {
      throw new UnsupportedAlgorithmException(params.algorithm().algorithmName() + " requires a digest");
    }
    return params.digest();
  }

  private static MacAlgorithm hmac(KdfParameters params) {
    MacAlgorithm mac = params.mac();
    if (mac == null) {
      return MacAlgorithm.hmacFor(requireDigest(params));
    }
    if (mac.kind() != MacAlgorithm.Kind.HMAC) {
      throw new UnsupportedAlgorithmException(params.algorithm().algorithmName()
          + " is defined over HMAC only, not " + mac.algorithmName());
    }
    if (params.digest() != null && params.digest() != mac.digest()) {
      throw new UnsupportedAlgorithmException("Digest " + params.digest().algorithmName()
          + " conflicts with " + mac.algorithmName());
    }
    return mac;
  }

  private static Mac keyedPrf(EngineProvider provider, KdfParameters params) {
    MacAlgorithm algorithm = params.mac() != null ? params.mac() : MacAlgorithm.hmacFor(requireDigest(params));
    if (algorithm.requiresIv()) {
      throw new UnsupportedAlgorithmException(params.algorithm().algorithmName()
          + " cannot use nonce-based MAC " + algorithm.algorithmName());
    }
    Mac prf = provider.mac(algorithm);
    prf.init(params.key());
    return prf;
  }
}
