package com.codeheadsystems.cipherkit.engine.source;

import com.codeheadsystems.cipherkit.engine.Updatable;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

/**
 * Streams input in fixed-size chunks, so large inputs are never held in memory. The stream is
 * read to its end but not closed; the caller owns it.
 */
public record InputStreamSource(InputStream inputStream, int chunkSize) implements MessageSource {

  public static final int DEFAULT_CHUNK_SIZE = 8192;

  public InputStreamSource {
    if (inputStream == null) {
      throw new IllegalArgumentException("inputStream must not be null");
    }
    if (chunkSize <= 0) {
      throw new IllegalArgumentException("chunkSize must be > 0");
    }
  }

  public InputStreamSource(InputStream inputStream) {
    this(inputStream, DEFAULT_CHUNK_SIZE);
  }

  @Override
  public void feedInto(Updatable engine) {
    byte[] chunk = new byte[chunkSize];
    try {
      int read;
      while ((read = inputStream.read(chunk)) != -1) {
        engine.update(chunk, 0, read);
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Failed reading message source", e);
    }
  }
}
