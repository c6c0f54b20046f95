package com.codeheadsystems.cipherkit.kdf;

/**
 * Output side of a key derivation function.
 * <p>
 * For every algorithm except PBKDF2 the stream is an unbounded keystream: successive calls return
 * successive, non-overlapping segments, and {@code getBytes(a)} followed by {@code getBytes(b)}
 * yields the same bytes as one {@code getBytes(a + b)} on a fresh stream. PBKDF2 is a fixed-output
 * function: every call recomputes from the parameters, so equal lengths return equal bytes.
 * <p>
 * Streams are not thread safe; concurrent callers must serialize access.
 */
public interface KdfStream {

  KdfAlgorithm algorithm();

  /**
   * Reads the next {@code length} bytes.
   *
   * @param length number of bytes, zero or more
   * @return the bytes
   */
  byte[] getBytes(int length);
}
