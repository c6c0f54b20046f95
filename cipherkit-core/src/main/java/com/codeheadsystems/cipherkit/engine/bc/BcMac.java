package com.codeheadsystems.cipherkit.engine.bc;

import com.codeheadsystems.cipherkit.engine.Mac;
import com.codeheadsystems.cipherkit.engine.MacAlgorithm;
import com.codeheadsystems.cipherkit.exception.EngineNotInitializedException;
import com.codeheadsystems.cipherkit.exception.InvalidKeyMaterialException;
import org.bouncycastle.crypto.CipherParameters;
import org.bouncycastle.crypto.params.KeyParameter;
import org.bouncycastle.crypto.params.ParametersWithIV;

// Not thread safe.
class BcMac implements Mac {

  private final MacAlgorithm algorithm;
  private final org.bouncycastle.crypto.Mac delegate;
  private State state = State.UNINITIALIZED;

  BcMac(MacAlgorithm algorithm, org.bouncycastle.crypto.Mac delegate) {
    this.algorithm = algorithm;
    this.delegate = delegate;
  }

  @Override
  public MacAlgorithm algorithm() {
    return algorithm;
  }

  @Override
  public void init(byte[] key, byte[] iv) {
    algorithm.validate(key, iv);
    CipherParameters params = algorithm.requiresIv()
        ? new ParametersWithIV(new KeyParameter(key), iv)
        : new KeyParameter(key);
    try {
      delegate.init(params);
    } catch (IllegalArgumentException e) {
      throw new InvalidKeyMaterialException(algorithm.algorithmName() + " rejected the key", e);
    }
    state = State.READY;
  }

  @Override
  public void update(byte[] input, int offset, int length) {
    ensureReady();
    delegate.update(input, offset, length);
  }

  @Override
  public byte[] doFinal() {
    ensureReady();
    byte[] out = new byte[delegate.getMacSize()];
    delegate.doFinal(out, 0);
    state = State.FINALIZED;
    return out;
  }

  @Override
  public void reset() {
    if (state == State.UNINITIALIZED) {
      throw new EngineNotInitializedException(algorithm.algorithmName() + " has no key to reset to; call init()");
    }
    delegate.reset();
    state = State.READY;
  }

  private void ensureReady() {
    switch (state) {
      case UNINITIALIZED -> throw new EngineNotInitializedException(algorithm.algorithmName() + " used before init()");
      case FINALIZED -> throw new EngineNotInitializedException(algorithm.algorithmName() + " already finalized; call reset() or init()");
      default -> {
      }
    }
  }

  private enum State {
    UNINITIALIZED,
    READY,
    FINALIZED
  }
}
