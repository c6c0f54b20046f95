package com.codeheadsystems.cipherkit.cipher;

import com.codeheadsystems.cipherkit.engine.Direction;
import com.codeheadsystems.cipherkit.engine.RawStreamCipher;

// Raw ChaCha20, Salsa20 and XSalsa20 behind the engine lifecycle.
class StreamCipherEngine extends AbstractCipherEngine {

  private final RawStreamCipher cipher;

  StreamCipherEngine(CipherAlgorithm algorithm, RawStreamCipher cipher) {
    super(algorithm);
    this.cipher = cipher;
  }

  @Override
  protected void engineInit(Direction direction, byte[] key, byte[] iv) {
    cipher.init(direction, key, iv);
  }

  @Override
  protected byte[] engineProcess(byte[] input, int offset, int length) {
    byte[] out = new byte[length];
    cipher.processBytes(input, offset, length, out, 0);
    return out;
  }

  @Override
  protected void engineReset() {
    cipher.reset();
  }
}
