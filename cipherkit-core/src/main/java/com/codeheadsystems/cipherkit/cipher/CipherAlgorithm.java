package com.codeheadsystems.cipherkit.cipher;

import com.codeheadsystems.cipherkit.engine.AlgorithmNames;
import com.codeheadsystems.cipherkit.engine.BlockCipherAlgorithm;
import com.codeheadsystems.cipherkit.engine.KeyMaterial;
import com.codeheadsystems.cipherkit.engine.StreamCipherAlgorithm;

/**
 * Composed cipher identifiers: primitive, mode and the key, IV and tag sizes they demand.
 */
public enum CipherAlgorithm {

  AES_128_CBC("aes-128-cbc", CipherMode.CBC, BlockCipherAlgorithm.AES, null, new int[]{16}, 16, 0),
  AES_192_CBC("aes-192-cbc", CipherMode.CBC, BlockCipherAlgorithm.AES, null, new int[]{24}, 16, 0),
  AES_256_CBC("aes-256-cbc", CipherMode.CBC, BlockCipherAlgorithm.AES, null, new int[]{32}, 16, 0),
  AES_128_CTR("aes-128-ctr", CipherMode.CTR, BlockCipherAlgorithm.AES, null, new int[]{16}, 16, 0),
  AES_192_CTR("aes-192-ctr", CipherMode.CTR, BlockCipherAlgorithm.AES, null, new int[]{24}, 16, 0),
  AES_256_CTR("aes-256-ctr", CipherMode.CTR, BlockCipherAlgorithm.AES, null, new int[]{32}, 16, 0),
  AES_128_OFB("aes-128-ofb", CipherMode.OFB, BlockCipherAlgorithm.AES, null, new int[]{16}, 16, 0),
  AES_192_OFB("aes-192-ofb", CipherMode.OFB, BlockCipherAlgorithm.AES, null, new int[]{24}, 16, 0),
  AES_256_OFB("aes-256-ofb", CipherMode.OFB, BlockCipherAlgorithm.AES, null, new int[]{32}, 16, 0),
  AES_128_GCM("aes-128-gcm", CipherMode.GCM, BlockCipherAlgorithm.AES, null, new int[]{16}, 12, 16),
  AES_192_GCM("aes-192-gcm", CipherMode.GCM, BlockCipherAlgorithm.AES, null, new int[]{24}, 12, 16),
  AES_256_GCM("aes-256-gcm", CipherMode.GCM, BlockCipherAlgorithm.AES, null, new int[]{32}, 12, 16),
  TWOFISH_256_CBC("twofish-256-cbc", CipherMode.CBC, BlockCipherAlgorithm.TWOFISH, null, new int[]{32}, 16, 0),
  TWOFISH_256_CTR("twofish-256-ctr", CipherMode.CTR, BlockCipherAlgorithm.TWOFISH, null, new int[]{32}, 16, 0),
  CHACHA20("chacha20", CipherMode.STREAM, null, StreamCipherAlgorithm.CHACHA20, new int[]{32}, 12, 0),
  SALSA20("salsa20", CipherMode.STREAM, null, StreamCipherAlgorithm.SALSA20, new int[]{16, 32}, 8, 0),
  XSALSA20("xsalsa20", CipherMode.STREAM, null, StreamCipherAlgorithm.XSALSA20, new int[]{32}, 24, 0),
  CHACHA20_POLY1305("chacha20-poly1305", CipherMode.STREAM_POLY1305, null, StreamCipherAlgorithm.CHACHA20,
      new int[]{32}, 12, 16);

  // ChaCha20, Salsa20 and XSalsa20 all generate keystream in 64-byte blocks
  private static final int STREAM_BLOCK_SIZE = 64;

  private final String algorithmName;
  private final CipherMode mode;
  private final BlockCipherAlgorithm blockCipher;
  private final StreamCipherAlgorithm streamCipher;
  private final int[] keySizes;
  private final int ivSize;
  private final int tagSize;

  CipherAlgorithm(String algorithmName, CipherMode mode, BlockCipherAlgorithm blockCipher,
                  StreamCipherAlgorithm streamCipher, int[] keySizes, int ivSize, int tagSize) {
    this.algorithmName = algorithmName;
    this.mode = mode;
    this.blockCipher = blockCipher;
    this.streamCipher = streamCipher;
    this.keySizes = keySizes;
    this.ivSize = ivSize;
    this.tagSize = tagSize;
  }

  public static CipherAlgorithm fromName(String name) {
    return AlgorithmNames.resolve(CipherAlgorithm.class, name, CipherAlgorithm::algorithmName);
  }

  public String algorithmName() {
    return algorithmName;
  }

  public CipherMode mode() {
    return mode;
  }

  /**
   * The underlying block cipher, or null for stream-cipher based algorithms.
   *
   * @return the block cipher algorithm
   */
  public BlockCipherAlgorithm blockCipher() {
    return blockCipher;
  }

  /**
   * The underlying stream cipher, or null for block-cipher based algorithms.
   *
   * @return the stream cipher algorithm
   */
  public StreamCipherAlgorithm streamCipher() {
    return streamCipher;
  }

  public int[] keySizes() {
    return keySizes.clone();
  }

  public int ivSize() {
    return ivSize;
  }

  /**
   * Tag length in bytes, 0 for algorithms without authentication.
   *
   * @return the tag size
   */
  public int tagSize() {
    return tagSize;
  }

  public int blockSize() {
    return blockCipher != null ? blockCipher.blockSize() : STREAM_BLOCK_SIZE;
  }

  public boolean isAead() {
    return mode.isAead();
  }

  public void validate(byte[] key, byte[] iv) {
    KeyMaterial.requireKeyLength(algorithmName, key, keySizes);
    KeyMaterial.requireIvLength(algorithmName, iv, ivSize);
  }
}
