package com.codeheadsystems.cipherkit.kdf;

import com.codeheadsystems.cipherkit.common.ByteUtils;
import com.codeheadsystems.cipherkit.engine.Mac;

/**
 * SP 800-108 counter mode: {@code T(i) = PRF(key, [i]_32 || label || context || [L]_32)} with
 * {@code L} the declared output length in bits.
 */
class CounterModeKdfStream extends RoundBasedKdfStream {

  private final Mac prf;
  private final byte[] fixedInput;

  CounterModeKdfStream(Mac keyedPrf, byte[] label, byte[] context, int declaredLengthBytes) {
    super(KdfAlgorithm.CMKDF);
    this.prf = keyedPrf;
    long lengthInBits = 8L * declaredLengthBytes;
    this.fixedInput = ByteUtils.concat(label, context, ByteUtils.I2OSP(lengthInBits, 4));
  }

  @Override
  protected byte[] nextRound(long index) {
    prf.reset();
    prf.update(counter(index));
    prf.update(fixedInput);
    return prf.doFinal();
  }
}
