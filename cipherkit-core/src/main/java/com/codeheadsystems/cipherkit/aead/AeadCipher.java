package com.codeheadsystems.cipherkit.aead;

import com.codeheadsystems.cipherkit.config.CipherKitConfig;
import com.codeheadsystems.cipherkit.exception.AuthenticationFailureException;
import java.util.EnumMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * AEAD encryption bound to a {@link CipherKitConfig}. Stateless between calls and safe to share;
 * each call builds its own engines.
 */
public class AeadCipher {

  private static final Logger log = LoggerFactory.getLogger(AeadCipher.class);

  private final CipherKitConfig config;
  private final Map<AeadScheme, AeadConstruction> constructions = new EnumMap<>(AeadScheme.class);

  public AeadCipher(CipherKitConfig config) {
    if (config == null) {
      throw new IllegalArgumentException("config must not be null");
    }
    this.config = config;
    for (AeadScheme scheme : AeadScheme.values()) {
      constructions.put(scheme, scheme.isEncryptThenMac()
          ? new EncryptThenMac(scheme, config)
          : new NativeAead(scheme, config));
    }
  }

  public CipherKitConfig config() {
    return config;
  }

  /**
   * Encrypts and authenticates.
   *
   * @param plaintext the plaintext
   * @param key       the key, {@link AeadScheme#keySize()} bytes
   * @param iv        the IV, {@link AeadScheme#ivSize()} bytes, never reused with the same key
   * @param scheme    the scheme
   * @param aad       associated data, may be null
   * @return {@code ciphertext || tag}
   */
  public byte[] encrypt(byte[] plaintext, byte[] key, byte[] iv, AeadScheme scheme, byte[] aad) {
    log.trace("encrypt({})", scheme);
    return constructions.get(scheme).encrypt(key, iv, plaintext, aadOrEmpty(aad));
  }

  /**
   * Verifies then decrypts.
   *
   * @param envelope {@code ciphertext || tag}
   * @param key      the key
   * @param iv       the IV used to encrypt
   * @param scheme   the scheme
   * @param aad      associated data, may be null
   * @return the plaintext
   * @throws AuthenticationFailureException when verification fails; no plaintext is released
   */
  public byte[] decrypt(byte[] envelope, byte[] key, byte[] iv, AeadScheme scheme, byte[] aad) {
    log.trace("decrypt({})", scheme);
    try {
      return constructions.get(scheme).decrypt(key, iv, envelope, aadOrEmpty(aad));
    } catch (AuthenticationFailureException e) {
      log.debug("decrypt({}) failed authentication", scheme);
      throw e;
    }
  }

  /**
   * Draws a fresh random IV of the scheme's size.
   *
   * @param scheme the scheme
   * @return the iv
   */
  public byte[] generateIv(AeadScheme scheme) {
    return config.randomProvider().randomBytes(scheme.ivSize());
  }

  private static byte[] aadOrEmpty(byte[] aad) {
    return aad == null ? new byte[0] : aad;
  }
}
