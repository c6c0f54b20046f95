package com.codeheadsystems.cipherkit.kdf;

import com.codeheadsystems.cipherkit.common.ByteUtils;
import java.io.ByteArrayOutputStream;
import java.util.Arrays;

/**
 * Cursor over a sequence of PRF rounds. Bytes left over from a round are kept for the next read,
 * so no output is ever skipped.
 */
abstract class RoundBasedKdfStream implements KdfStream {

  private static final long MAX_COUNTER = 0xFFFFFFFFL;

  private final KdfAlgorithm algorithm;
  private byte[] buffered = new byte[0];
  private int position;
  private long roundsProduced;

  RoundBasedKdfStream(KdfAlgorithm algorithm) {
    this.algorithm = algorithm;
  }

  @Override
  public KdfAlgorithm algorithm() {
    return algorithm;
  }

  @Override
  public final byte[] getBytes(int length) {
    if (length < 0) {
      throw new IllegalArgumentException("length must be >= 0");
    }
    if (buffered.length - position < length) {
      fill(length);
    }
    byte[] out = Arrays.copyOfRange(buffered, position, position + length);
    position += length;
    return out;
  }

  // Rounds produced before a failing round stay buffered, so a refused request consumes nothing.
  private void fill(int length) {
    ByteArrayOutputStream pending = new ByteArrayOutputStream();
    pending.write(buffered, position, buffered.length - position);
    try {
      while (pending.size() < length) {
        byte[] round = nextRound(roundsProduced + 1);
        roundsProduced++;
        pending.write(round, 0, round.length);
      }
    } finally {
      buffered = pending.toByteArray();
      position = 0;
    }
  }

  /**
   * Computes round {@code index}, counting from 1.
   *
   * @param index the round index
   * @return the round output
   */
  protected abstract byte[] nextRound(long index);

  /**
   * Encodes a 32-bit big-endian counter.
   *
   * @throws IllegalStateException once the counter would wrap
   */
  protected byte[] counter(long value) {
    if (value > MAX_COUNTER) {
      throw new IllegalStateException(algorithm.algorithmName() + " counter exhausted");
    }
    return ByteUtils.I2OSP(value, 4);
  }
}
