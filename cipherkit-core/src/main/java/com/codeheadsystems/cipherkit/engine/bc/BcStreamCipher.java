package com.codeheadsystems.cipherkit.engine.bc;

import com.codeheadsystems.cipherkit.engine.Direction;
import com.codeheadsystems.cipherkit.engine.RawStreamCipher;
import com.codeheadsystems.cipherkit.engine.StreamCipherAlgorithm;
import com.codeheadsystems.cipherkit.exception.EngineNotInitializedException;
import org.bouncycastle.crypto.StreamCipher;
import org.bouncycastle.crypto.params.KeyParameter;
import org.bouncycastle.crypto.params.ParametersWithIV;

// Not thread safe.
class BcStreamCipher implements RawStreamCipher {

  private final StreamCipherAlgorithm algorithm;
  private final StreamCipher delegate;
  private boolean initialized;

  BcStreamCipher(StreamCipherAlgorithm algorithm, StreamCipher delegate) {
    this.algorithm = algorithm;
    this.delegate = delegate;
  }

  @Override
  public StreamCipherAlgorithm algorithm() {
    return algorithm;
  }

  @Override
  public void init(Direction direction, byte[] key, byte[] iv) {
    algorithm.validate(key, iv);
    delegate.init(direction.forEncryption(), new ParametersWithIV(new KeyParameter(key), iv));
    initialized = true;
  }

  @Override
  public void processBytes(byte[] in, int inOffset, int length, byte[] out, int outOffset) {
    if (!initialized) {
      throw new EngineNotInitializedException(algorithm.algorithmName() + " used before init()");
    }
    delegate.processBytes(in, inOffset, length, out, outOffset);
  }

  @Override
  public void reset() {
    initialized = false;
  }
}
