package com.codeheadsystems.cipherkit.engine.source;

import com.codeheadsystems.cipherkit.engine.Updatable;

/**
 * In-memory source; the array is read, never copied.
 */
public record ByteArraySource(byte[] bytes, int offset, int length) implements MessageSource {

  public ByteArraySource {
    if (bytes == null) {
      throw new IllegalArgumentException("bytes must not be null");
    }
    if (offset < 0 || length < 0 || length > bytes.length - offset) {
      throw new IllegalArgumentException("Invalid range at offset " + offset + " of length " + length);
    }
  }

  public ByteArraySource(byte[] bytes) {
    this(bytes, 0, bytes == null ? 0 : bytes.length);
  }

  @Override
  public void feedInto(Updatable engine) {
    engine.update(bytes, offset, length);
  }
}
