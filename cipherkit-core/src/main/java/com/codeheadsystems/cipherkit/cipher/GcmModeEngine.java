package com.codeheadsystems.cipherkit.cipher;

import com.codeheadsystems.cipherkit.common.ByteUtils;
import com.codeheadsystems.cipherkit.engine.Direction;
import com.codeheadsystems.cipherkit.engine.RawBlockCipher;
import java.util.Arrays;

/**
 * Galois/Counter mode with a 96-bit IV and a full 128-bit tag.
 * <p>
 * {@code J0 = IV || 0x00000001}; data is encrypted with GCTR starting at {@code inc32(J0)} and the
 * tag is {@code E(K, J0) xor GHASH(H, A, C)} with {@code H = E(K, 0^128)}.
 */
class GcmModeEngine extends AbstractAeadEngine {

  private static final int COUNTER_BYTES = 4;

  private final RawBlockCipher cipher;
  private GHash ghash;
  private byte[] tagMask;
  private byte[] counter;
  private final byte[] keystream = new byte[GHash.BLOCK_SIZE];
  private int keystreamPosition;
  private long aadLength;
  private long ciphertextLength;
  private boolean aadClosed;

  GcmModeEngine(CipherAlgorithm algorithm, RawBlockCipher cipher) {
    super(algorithm);
    this.cipher = cipher;
  }

  @Override
  protected void aeadInit(byte[] key, byte[] iv) {
    cipher.init(Direction.ENCRYPT, key);
    ghash = new GHash(cipher.processBlock(new byte[GHash.BLOCK_SIZE]));
    byte[] j0 = ByteUtils.concat(iv, ByteUtils.I2OSP(1, COUNTER_BYTES));
    tagMask = cipher.processBlock(j0);
    counter = j0;
    keystreamPosition = GHash.BLOCK_SIZE;
    aadLength = 0;
    ciphertextLength = 0;
    aadClosed = false;
  }

  @Override
  protected void authenticateAad(byte[] aad, int offset, int length) {
    ghash.update(aad, offset, length);
    aadLength += length;
  }

  @Override
  protected byte[] transform(byte[] input, int offset, int length) {
    byte[] out = new byte[length];
    for (int i = 0; i < length; i++) {
      if (keystreamPosition == GHash.BLOCK_SIZE) {
        CtrModeEngine.increment(counter, counter.length - COUNTER_BYTES);
        cipher.processBlock(counter, 0, keystream, 0);
        keystreamPosition = 0;
      }
      out[i] = (byte) (input[offset + i] ^ keystream[keystreamPosition++]);
    }
    return out;
  }

  @Override
  protected void authenticateCiphertext(byte[] ciphertext, int offset, int length) {
    closeAad();
    ghash.update(ciphertext, offset, length);
    ciphertextLength += length;
  }

  @Override
  protected byte[] computeTag() {
    closeAad();
    return ByteUtils.xor(ghash.finish(aadLength, ciphertextLength), tagMask);
  }

  @Override
  protected void aeadReset() {
    cipher.reset();
    ghash.clear();
    Arrays.fill(tagMask, (byte) 0);
    Arrays.fill(keystream, (byte) 0);
  }

  private void closeAad() {
    if (!aadClosed) {
      ghash.padToBlock();
      aadClosed = true;
    }
  }
}
