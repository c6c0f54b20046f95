package com.codeheadsystems.cipherkit.engine.source;

import com.codeheadsystems.cipherkit.engine.Updatable;
import java.io.InputStream;

/**
 * Input for a digest or MAC. Each variant knows how to push itself through an engine with
 * repeated {@code update} calls, so engines never need to know where bytes come from.
 */
public interface MessageSource {

  static MessageSource of(byte[] bytes) {
    return new ByteArraySource(bytes);
  }

  static MessageSource of(InputStream inputStream) {
    return new InputStreamSource(inputStream);
  }

  /**
   * Feeds every byte of this source into the engine.
   *
   * @param engine the engine
   */
  void feedInto(Updatable engine);
}
