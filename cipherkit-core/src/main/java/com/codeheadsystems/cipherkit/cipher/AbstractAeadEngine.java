package com.codeheadsystems.cipherkit.cipher;

import com.codeheadsystems.cipherkit.common.ByteUtils;
import com.codeheadsystems.cipherkit.engine.Direction;
import com.codeheadsystems.cipherkit.exception.AuthenticationFailureException;
import java.io.ByteArrayOutputStream;
import java.util.Arrays;

/**
 * Shared encrypt/decrypt flow for stream-style AEAD modes. Encryption transforms data as it
 * arrives and authenticates the ciphertext. Decryption buffers everything, authenticates the
 * ciphertext, compares tags in constant time, and only then transforms.
 */
abstract class AbstractAeadEngine extends AbstractCipherEngine implements AeadCipherEngine {

  private final ByteArrayOutputStream decryptBuffer = new ByteArrayOutputStream();
  private boolean dataStarted;

  AbstractAeadEngine(CipherAlgorithm algorithm) {
    super(algorithm);
  }

  @Override
  public int tagSize() {
    return algorithm().tagSize();
  }

  @Override
  public int outputSize(int inputLength) {
    if (direction() == Direction.DECRYPT) {
      return Math.max(0, decryptBuffer.size() + inputLength - tagSize());
    }
    return inputLength + tagSize();
  }

  @Override
  protected final void engineInit(Direction direction, byte[] key, byte[] iv) {
    decryptBuffer.reset();
    dataStarted = false;
    aeadInit(key, iv);
  }

  @Override
  public void updateAad(byte[] aad, int offset, int length) {
    requireReady();
    if (dataStarted) {
      throw new IllegalStateException("associated data must be supplied before any message bytes");
    }
    authenticateAad(aad, offset, length);
  }

  @Override
  protected final byte[] engineProcess(byte[] input, int offset, int length) {
    dataStarted = true;
    if (direction() == Direction.DECRYPT) {
      decryptBuffer.write(input, offset, length);
      return new byte[0];
    }
    byte[] out = transform(input, offset, length);
    authenticateCiphertext(out, 0, out.length);
    return out;
  }

  @Override
  public byte[] doFinal() {
    requireReady();
    try {
      return direction() == Direction.ENCRYPT ? computeTag() : verifyThenDecrypt();
    } finally {
      reset();
    }
  }

  @Override
  protected final void engineReset() {
    decryptBuffer.reset();
    dataStarted = false;
    aeadReset();
  }

  private byte[] verifyThenDecrypt() {
    byte[] envelope = decryptBuffer.toByteArray();
    int tagSize = tagSize();
    if (envelope.length < tagSize) {
      throw new AuthenticationFailureException();
    }
    int ciphertextLength = envelope.length - tagSize;
    authenticateCiphertext(envelope, 0, ciphertextLength);
    byte[] expected = computeTag();
    byte[] received = Arrays.copyOfRange(envelope, ciphertextLength, envelope.length);
    if (!ByteUtils.constantTimeEquals(expected, received)) {
      throw new AuthenticationFailureException();
    }
    return transform(envelope, 0, ciphertextLength);
  }

  protected abstract void aeadInit(byte[] key, byte[] iv);

  protected abstract void authenticateAad(byte[] aad, int offset, int length);

  /**
   * Applies the keystream; the same operation encrypts and decrypts.
   */
  protected abstract byte[] transform(byte[] input, int offset, int length);

  protected abstract void authenticateCiphertext(byte[] ciphertext, int offset, int length);

  /**
   * Closes authentication and returns the tag. Called once per operation.
   */
  protected abstract byte[] computeTag();

  protected abstract void aeadReset();
}
