package com.codeheadsystems.cipherkit.aead;

import com.codeheadsystems.cipherkit.config.CipherKitConfig;

/**
 * Static AEAD entry points over {@link CipherKitConfig#DEFAULT}. Use {@link #with} for another
 * provider or random source.
 */
public final class Aead {

  private static final AeadCipher DEFAULT = new AeadCipher(CipherKitConfig.DEFAULT);

  private Aead() {
  }

  public static AeadCipher with(CipherKitConfig config) {
    return new AeadCipher(config);
  }

  public static byte[] encrypt(byte[] plaintext, byte[] key, byte[] iv, AeadScheme scheme) {
    return DEFAULT.encrypt(plaintext, key, iv, scheme, null);
  }

  public static byte[] encrypt(byte[] plaintext, byte[] key, byte[] iv, AeadScheme scheme, byte[] aad) {
    return DEFAULT.encrypt(plaintext, key, iv, scheme, aad);
  }

  public static byte[] decrypt(byte[] envelope, byte[] key, byte[] iv, AeadScheme scheme) {
    return DEFAULT.decrypt(envelope, key, iv, scheme, null);
  }

  public static byte[] decrypt(byte[] envelope, byte[] key, byte[] iv, AeadScheme scheme, byte[] aad) {
    return DEFAULT.decrypt(envelope, key, iv, scheme, aad);
  }

  public static byte[] generateIv(AeadScheme scheme) {
    return DEFAULT.generateIv(scheme);
  }
}
