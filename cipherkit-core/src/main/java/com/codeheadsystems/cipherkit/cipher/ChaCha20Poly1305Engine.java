package com.codeheadsystems.cipherkit.cipher;

import com.codeheadsystems.cipherkit.engine.Direction;
import com.codeheadsystems.cipherkit.engine.Mac;
import com.codeheadsystems.cipherkit.engine.RawStreamCipher;
import java.util.Arrays;
import org.bouncycastle.util.Pack;

/**
 * ChaCha20-Poly1305 per RFC 8439 §2.8. The one-time Poly1305 key is the first 32 bytes of
 * keystream block 0; data is encrypted from block 1 on. The MAC covers
 * {@code aad || pad16 || ciphertext || pad16 || le64(len(aad)) || le64(len(ciphertext))}.
 */
class ChaCha20Poly1305Engine extends AbstractAeadEngine {

  private static final int KEYSTREAM_BLOCK = 64;
  private static final int POLY_KEY_LENGTH = 32;
  private static final int PAD_BOUNDARY = 16;

  private final RawStreamCipher chacha;
  private final Mac poly1305;
  private long aadLength;
  private long ciphertextLength;
  private boolean aadClosed;

  ChaCha20Poly1305Engine(CipherAlgorithm algorithm, RawStreamCipher chacha, Mac poly1305) {
    super(algorithm);
    this.chacha = chacha;
    this.poly1305 = poly1305;
  }

  @Override
  protected void aeadInit(byte[] key, byte[] iv) {
    chacha.init(Direction.ENCRYPT, key, iv);
    byte[] block0 = chacha.processBytes(new byte[KEYSTREAM_BLOCK]);
    byte[] polyKey = Arrays.copyOf(block0, POLY_KEY_LENGTH);
    poly1305.init(polyKey);
    Arrays.fill(block0, (byte) 0);
    Arrays.fill(polyKey, (byte) 0);
    aadLength = 0;
    ciphertextLength = 0;
    aadClosed = false;
  }

  @Override
  protected void authenticateAad(byte[] aad, int offset, int length) {
    poly1305.update(aad, offset, length);
    aadLength += length;
  }

  @Override
  protected byte[] transform(byte[] input, int offset, int length) {
    byte[] out = new byte[length];
    chacha.processBytes(input, offset, length, out, 0);
    return out;
  }

  @Override
  protected void authenticateCiphertext(byte[] ciphertext, int offset, int length) {
    closeAad();
    poly1305.update(ciphertext, offset, length);
    ciphertextLength += length;
  }

  @Override
  protected byte[] computeTag() {
    closeAad();
    padTo16(ciphertextLength);
    poly1305.update(Pack.longToLittleEndian(aadLength));
    poly1305.update(Pack.longToLittleEndian(ciphertextLength));
    return poly1305.doFinal();
  }

  @Override
  protected void aeadReset() {
    chacha.reset();
  }

  private void closeAad() {
    if (!aadClosed) {
      padTo16(aadLength);
      aadClosed = true;
    }
  }

  private void padTo16(long length) {
    int remainder = (int) (length % PAD_BOUNDARY);
    if (remainder != 0) {
      poly1305.update(new byte[PAD_BOUNDARY - remainder]);
    }
  }
}
