package com.codeheadsystems.cipherkit.kdf;

import com.codeheadsystems.cipherkit.common.ByteUtils;
import com.codeheadsystems.cipherkit.engine.Mac;

/**
 * SP 800-108 double-pipeline iteration mode. The first pipeline advances
 * {@code A(i) = PRF(key, A(i-1))} from {@code A(0) = label || context}; the second emits
 * {@code T(i) = PRF(key, A(i) || [i]_32 || label || context)}.
 */
class DoublePipelineKdfStream extends RoundBasedKdfStream {

  private final Mac prf;
  private final byte[] fixedInput;
  private byte[] chain;

  DoublePipelineKdfStream(Mac keyedPrf, byte[] label, byte[] context) {
    super(KdfAlgorithm.DPIMKDF);
    this.prf = keyedPrf;
    this.fixedInput = ByteUtils.concat(label, context);
    this.chain = fixedInput;
  }

  @Override
  protected byte[] nextRound(long index) {
    prf.reset();
    prf.update(chain);
    chain = prf.doFinal();

    prf.reset();
    prf.update(chain);
    prf.update(counter(index));
    prf.update(fixedInput);
    return prf.doFinal();
  }
}
