package com.codeheadsystems.cipherkit.kdf;

import com.codeheadsystems.cipherkit.common.ByteUtils;
import com.codeheadsystems.cipherkit.engine.Mac;

/**
 * SP 800-108 feedback mode: {@code T(i) = PRF(key, T(i-1) || [i]_32 || label || context)} with
 * {@code T(0) = iv}.
 */
class FeedbackModeKdfStream extends RoundBasedKdfStream {

  private final Mac prf;
  private final byte[] fixedInput;
  private byte[] previous;

  FeedbackModeKdfStream(Mac keyedPrf, byte[] iv, byte[] label, byte[] context) {
    super(KdfAlgorithm.FMKDF);
    this.prf = keyedPrf;
    this.previous = iv.clone();
    this.fixedInput = ByteUtils.concat(label, context);
  }

  @Override
  protected byte[] nextRound(long index) {
    prf.reset();
    prf.update(previous);
    prf.update(counter(index));
    prf.update(fixedInput);
    previous = prf.doFinal();
    return previous;
  }
}
