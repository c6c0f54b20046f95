package com.codeheadsystems.cipherkit.engine;

/**
 * Supported hash functions. Variable-length digests appear once per output size so every
 * identifier has a single fixed size.
 */
public enum DigestAlgorithm {

  SHA1("sha1", 20, 64),
  SHA224("sha224", 28, 64),
  SHA256("sha256", 32, 64),
  SHA384("sha384", 48, 128),
  SHA512("sha512", 64, 128),
  SHA3_256("sha3-256", 32, 136),
  SHA3_384("sha3-384", 48, 104),
  SHA3_512("sha3-512", 64, 72),
  BLAKE2B_256("blake2b-256", 32, 128),
  BLAKE2B_512("blake2b-512", 64, 128);

  private final String algorithmName;
  private final int digestSize;
  private final int blockSize;

  DigestAlgorithm(String algorithmName, int digestSize, int blockSize) {
    this.algorithmName = algorithmName;
    this.digestSize = digestSize;
    this.blockSize = blockSize;
  }

  /**
   * Looks up a digest by name, e.g. "sha256" or "SHA-256".
   *
   * @param name the name
   * @return the digest algorithm
   */
  public static DigestAlgorithm fromName(String name) {
    return AlgorithmNames.resolve(DigestAlgorithm.class, name, DigestAlgorithm::algorithmName);
  }

  public String algorithmName() {
    return algorithmName;
  }

  /**
   * Output length in bytes.
   *
   * @return the int
   */
  public int digestSize() {
    return digestSize;
  }

  /**
   * Internal block length in bytes.
   *
   * @return the int
   */
  public int blockSize() {
    return blockSize;
  }
}
