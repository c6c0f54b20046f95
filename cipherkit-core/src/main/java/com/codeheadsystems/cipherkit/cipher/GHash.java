package com.codeheadsystems.cipherkit.cipher;

import com.codeheadsystems.cipherkit.common.ByteUtils;
import java.util.Arrays;
import org.bouncycastle.crypto.modes.gcm.GCMMultiplier;
import org.bouncycastle.crypto.modes.gcm.Tables4kGCMMultiplier;

/**
 * GHASH from NIST SP 800-38D §6.4, fed incrementally. Field multiplication by H is delegated to
 * BouncyCastle's table-driven multiplier.
 */
class GHash {

  static final int BLOCK_SIZE = 16;

  private final GCMMultiplier multiplier = new Tables4kGCMMultiplier();
  private final byte[] state = new byte[BLOCK_SIZE];
  private final byte[] partial = new byte[BLOCK_SIZE];
  private int partialLength;

  GHash(byte[] hashSubkey) {
    multiplier.init(hashSubkey);
  }

  void update(byte[] input, int offset, int length) {
    for (int i = 0; i < length; i++) {
      partial[partialLength++] = input[offset + i];
      if (partialLength == BLOCK_SIZE) {
        absorb(partial);
        partialLength = 0;
      }
    }
  }

  /**
   * Zero-pads and absorbs any partial block, so the next input starts block aligned.
   */
  void padToBlock() {
    if (partialLength > 0) {
      Arrays.fill(partial, partialLength, BLOCK_SIZE, (byte) 0);
      absorb(partial);
      partialLength = 0;
    }
  }

  /**
   * Absorbs the length block and returns the hash.
   *
   * @param aadLength        associated data length in bytes
   * @param ciphertextLength ciphertext length in bytes
   * @return the hash
   */
  byte[] finish(long aadLength, long ciphertextLength) {
    padToBlock();
    absorb(ByteUtils.concat(ByteUtils.I2OSP(aadLength * 8, 8), ByteUtils.I2OSP(ciphertextLength * 8, 8)));
    return state.clone();
  }

  void clear() {
    Arrays.fill(state, (byte) 0);
    Arrays.fill(partial, (byte) 0);
    partialLength = 0;
  }

  private void absorb(byte[] block) {
    for (int i = 0; i < BLOCK_SIZE; i++) {
      state[i] ^= block[i];
    }
    multiplier.multiplyH(state);
  }
}
