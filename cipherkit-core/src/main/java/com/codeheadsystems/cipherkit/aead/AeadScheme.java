package com.codeheadsystems.cipherkit.aead;

import com.codeheadsystems.cipherkit.cipher.CipherAlgorithm;
import com.codeheadsystems.cipherkit.engine.AlgorithmNames;
import com.codeheadsystems.cipherkit.engine.MacAlgorithm;

/**
 * AEAD schemes. The CBC-HMAC schemes are the composite AES_CBC_HMAC_SHA2 family of RFC 7518
 * §5.2; the rest are native AEAD modes.
 */
public enum AeadScheme {

  AES128_CBC_HMAC_SHA256("aes128-cbc-hmac-sha256", CipherAlgorithm.AES_128_CBC, MacAlgorithm.HMAC_SHA256, 32, 16),
  AES192_CBC_HMAC_SHA384("aes192-cbc-hmac-sha384", CipherAlgorithm.AES_192_CBC, MacAlgorithm.HMAC_SHA384, 48, 24),
  AES256_CBC_HMAC_SHA512("aes256-cbc-hmac-sha512", CipherAlgorithm.AES_256_CBC, MacAlgorithm.HMAC_SHA512, 64, 32),
  AES128_GCM("aes128-gcm", CipherAlgorithm.AES_128_GCM, null, 16, 16),
  AES192_GCM("aes192-gcm", CipherAlgorithm.AES_192_GCM, null, 24, 16),
  AES256_GCM("aes256-gcm", CipherAlgorithm.AES_256_GCM, null, 32, 16),
  CHACHA20_POLY1305("chacha20-poly1305", CipherAlgorithm.CHACHA20_POLY1305, null, 32, 16);

  private final String schemeName;
  private final CipherAlgorithm cipher;
  private final MacAlgorithm mac;
  private final int keySize;
  private final int tagSize;

  AeadScheme(String schemeName, CipherAlgorithm cipher, MacAlgorithm mac, int keySize, int tagSize) {
    this.schemeName = schemeName;
    this.cipher = cipher;
    this.mac = mac;
    this.keySize = keySize;
    this.tagSize = tagSize;
  }

  public static AeadScheme fromName(String name) {
    return AlgorithmNames.resolve(AeadScheme.class, name, AeadScheme::schemeName);
  }

  public String schemeName() {
    return schemeName;
  }

  public CipherAlgorithm cipher() {
    return cipher;
  }

  /**
   * The MAC of an encrypt-then-MAC scheme, null for native AEAD.
   *
   * @return the mac algorithm
   */
  public MacAlgorithm mac() {
    return mac;
  }

  /**
   * Total key length. For encrypt-then-MAC this is the MAC key and the cipher key together.
   *
   * @return the key size
   */
  public int keySize() {
    return keySize;
  }

  public int ivSize() {
    return cipher.ivSize();
  }

  public int tagSize() {
    return tagSize;
  }

  public boolean isEncryptThenMac() {
    return mac != null;
  }
}
