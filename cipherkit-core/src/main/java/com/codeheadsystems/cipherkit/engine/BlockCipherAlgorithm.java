package com.codeheadsystems.cipherkit.engine;

/**
 * Raw block ciphers available from the provider.
 */
public enum BlockCipherAlgorithm {

  AES("aes", 16, new int[]{16, 24, 32}),
  TWOFISH("twofish", 16, new int[]{16, 24, 32});

  private final String algorithmName;
  private final int blockSize;
  private final int[] keySizes;

  BlockCipherAlgorithm(String algorithmName, int blockSize, int[] keySizes) {
    this.algorithmName = algorithmName;
    this.blockSize = blockSize;
    this.keySizes = keySizes;
  }

  public static BlockCipherAlgorithm fromName(String name) {
    return AlgorithmNames.resolve(BlockCipherAlgorithm.class, name, BlockCipherAlgorithm::algorithmName);
  }

  public String algorithmName() {
    return algorithmName;
  }

  public int blockSize() {
    return blockSize;
  }

  public int[] keySizes() {
    return keySizes.clone();
  }

  public void validateKey(byte[] key) {
    KeyMaterial.requireKeyLength(algorithmName, key, keySizes);
  }
}
