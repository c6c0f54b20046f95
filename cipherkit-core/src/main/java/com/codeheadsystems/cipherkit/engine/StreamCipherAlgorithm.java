package com.codeheadsystems.cipherkit.engine;

/**
 * Raw stream ciphers available from the provider.
 */
public enum StreamCipherAlgorithm {

  /**
   * ChaCha20 with the RFC 7539 96-bit nonce and 32-bit block counter starting at zero.
   */
  CHACHA20("chacha20", new int[]{32}, 12),
  SALSA20("salsa20", new int[]{16, 32}, 8),
  XSALSA20("xsalsa20", new int[]{32}, 24);

  private final String algorithmName;
  private final int[] keySizes;
  private final int ivSize;

  StreamCipherAlgorithm(String algorithmName, int[] keySizes, int ivSize) {
    this.algorithmName = algorithmName;
    this.keySizes = keySizes;
    this.ivSize = ivSize;
  }

  public static StreamCipherAlgorithm fromName(String name) {
    return AlgorithmNames.resolve(StreamCipherAlgorithm.class, name, StreamCipherAlgorithm::algorithmName);
  }

  public String algorithmName() {
    return algorithmName;
  }

  public int[] keySizes() {
    return keySizes.clone();
  }

  public int ivSize() {
    return ivSize;
  }

  public void validate(byte[] key, byte[] iv) {
    KeyMaterial.requireKeyLength(algorithmName, key, keySizes);
    KeyMaterial.requireIvLength(algorithmName, iv, ivSize);
  }
}
