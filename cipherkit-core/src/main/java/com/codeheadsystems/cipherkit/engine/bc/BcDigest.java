package com.codeheadsystems.cipherkit.engine.bc;

import com.codeheadsystems.cipherkit.engine.Digest;
import com.codeheadsystems.cipherkit.engine.DigestAlgorithm;
import com.codeheadsystems.cipherkit.exception.EngineNotInitializedException;

// Not thread safe. BouncyCastle digests reset themselves on doFinal; the finalized flag keeps the
// consumed-until-reset contract anyway.
class BcDigest implements Digest {

  private final DigestAlgorithm algorithm;
  private final org.bouncycastle.crypto.Digest delegate;
  private boolean finalized;

  BcDigest(DigestAlgorithm algorithm, org.bouncycastle.crypto.Digest delegate) {
    this.algorithm = algorithm;
    this.delegate = delegate;
  }

  @Override
  public DigestAlgorithm algorithm() {
    return algorithm;
  }

  @Override
  public void update(byte[] input, int offset, int length) {
    ensureUsable();
    delegate.update(input, offset, length);
  }

  @Override
  public byte[] digest() {
    ensureUsable();
    byte[] out = new byte[delegate.getDigestSize()];
    delegate.doFinal(out, 0);
    finalized = true;
    return out;
  }

  @Override
  public void reset() {
    delegate.reset();
    finalized = false;
  }

  private void ensureUsable() {
    if (finalized) {
      throw new EngineNotInitializedException(algorithm.algorithmName() + " digest already finalized; call reset()");
    }
  }
}
