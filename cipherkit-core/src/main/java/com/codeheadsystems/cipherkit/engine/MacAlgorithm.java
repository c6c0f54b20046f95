package com.codeheadsystems.cipherkit.engine;

import com.codeheadsystems.cipherkit.exception.InvalidKeyMaterialException;
import com.codeheadsystems.cipherkit.exception.UnsupportedAlgorithmException;

/**
 * Supported MAC constructions, each bound to its underlying digest or block cipher.
 */
public enum MacAlgorithm {

  HMAC_SHA1("hmac-sha1", Kind.HMAC, DigestAlgorithm.SHA1, null),
  HMAC_SHA224("hmac-sha224", Kind.HMAC, DigestAlgorithm.SHA224, null),
  HMAC_SHA256("hmac-sha256", Kind.HMAC, DigestAlgorithm.SHA256, null),
  HMAC_SHA384("hmac-sha384", Kind.HMAC, DigestAlgorithm.SHA384, null),
  HMAC_SHA512("hmac-sha512", Kind.HMAC, DigestAlgorithm.SHA512, null),
  HMAC_SHA3_256("hmac-sha3-256", Kind.HMAC, DigestAlgorithm.SHA3_256, null),
  HMAC_SHA3_384("hmac-sha3-384", Kind.HMAC, DigestAlgorithm.SHA3_384, null),
  HMAC_SHA3_512("hmac-sha3-512", Kind.HMAC, DigestAlgorithm.SHA3_512, null),
  CMAC_AES("cmac-aes", Kind.CMAC, null, BlockCipherAlgorithm.AES),
  POLY1305("poly1305", Kind.POLY1305, null, null),
  POLY1305_AES("poly1305-aes", Kind.POLY1305, null, BlockCipherAlgorithm.AES);

  private static final int POLY1305_KEY_LENGTH = 32;
  private static final int POLY1305_NONCE_LENGTH = 16;
  private static final int POLY1305_TAG_LENGTH = 16;

  private final String algorithmName;
  private final Kind kind;
  private final DigestAlgorithm digest;
  private final BlockCipherAlgorithm cipher;

  MacAlgorithm(String algorithmName, Kind kind, DigestAlgorithm digest, BlockCipherAlgorithm cipher) {
    this.algorithmName = algorithmName;
    this.kind = kind;
    this.digest = digest;
    this.cipher = cipher;
  }

  /**
   * Looks up a MAC by name, e.g. "hmac-sha256".
   *
   * @param name the name
   * @return the mac algorithm
   */
  public static MacAlgorithm fromName(String name) {
    return AlgorithmNames.resolve(MacAlgorithm.class, name, MacAlgorithm::algorithmName);
  }

  /**
   * The HMAC constructed over the given digest.
   *
   * @param digest the digest
   * @return the mac algorithm
   * @throws UnsupportedAlgorithmException if no HMAC is defined over that digest
   */
  public static MacAlgorithm hmacFor(DigestAlgorithm digest) {
    for (MacAlgorithm candidate : values()) {
      if (candidate.kind == Kind.HMAC && candidate.digest == digest) {
        return candidate;
      }
    }
    throw new UnsupportedAlgorithmException("No HMAC defined over " + digest.algorithmName());
  }

  public String algorithmName() {
    return algorithmName;
  }

  public Kind kind() {
    return kind;
  }

  /**
   * Underlying digest for HMAC, null otherwise.
   *
   * @return the digest algorithm
   */
  public DigestAlgorithm digest() {
    return digest;
  }

  /**
   * Underlying block cipher for CMAC and Poly1305-AES, null otherwise.
   *
   * @return the block cipher algorithm
   */
  public BlockCipherAlgorithm cipher() {
    return cipher;
  }

  /**
   * Tag length in bytes.
   *
   * @return the int
   */
  public int macSize() {
    return switch (kind) {
      case HMAC -> digest.digestSize();
      case CMAC -> cipher.blockSize();
      case POLY1305 -> POLY1305_TAG_LENGTH;
    };
  }

  /**
   * True when {@link Mac#init(byte[], byte[])} needs a nonce.
   *
   * @return the boolean
   */
  public boolean requiresIv() {
    return this == POLY1305_AES;
  }

  /**
   * Validates key and nonce lengths for this MAC.
   *
   * @param key the key
   * @param iv  the nonce, null when none is given
   */
  public void validate(byte[] key, byte[] iv) {
    switch (kind) {
      case HMAC -> {
        if (key == null) {
          throw new InvalidKeyMaterialException(algorithmName + " requires a key");
        }
      }
      case CMAC -> cipher.validateKey(key);
      case POLY1305 -> KeyMaterial.requireKeyLength(algorithmName, key, POLY1305_KEY_LENGTH);
      default -> throw new IllegalStateException("Unhandled MAC kind " + kind);
    }
    if (requiresIv()) {
      KeyMaterial.requireIvLength(algorithmName, iv, POLY1305_NONCE_LENGTH);
    } else if (iv != null && iv.length > 0) {
      throw new InvalidKeyMaterialException(algorithmName + " does not take an IV");
    }
  }

  /**
   * MAC families.
   */
  public enum Kind {
    HMAC,
    CMAC,
    POLY1305
  }
}
