package com.codeheadsystems.cipherkit.engine;

/**
 * Anything that absorbs input incrementally: digests and MACs.
 */
public interface Updatable {

  void update(byte[] input, int offset, int length);

  default void update(byte[] input) {
    update(input, 0, input.length);
  }

  default void update(byte input) {
    update(new byte[]{input}, 0, 1);
  }
}
