package com.codeheadsystems.cipherkit.engine;

import com.codeheadsystems.cipherkit.exception.UnsupportedAlgorithmException;
import java.util.Locale;
import java.util.function.Function;

/**
 * Name lookup shared by the algorithm identifier enums. Names compare case-insensitively and
 * ignore '-' and '_' so "aes128-cbc-hmac-sha256", "AES128_CBC_HMAC_SHA256" and "sha-256" all
 * resolve.
 */
public final class AlgorithmNames {

  private AlgorithmNames() {
  }

  static String normalize(String name) {
    return name.toLowerCase(Locale.ROOT).replace("-", "").replace("_", "");
  }

  /**
   * Resolves a name against the constants of an identifier enum.
   *
   * @param type      the enum type
   * @param name      the requested name
   * @param canonical maps a constant to its canonical name
   * @param <E>       the enum
   * @return the matching constant
   * @throws UnsupportedAlgorithmException when nothing matches
   */
  public static <E extends Enum<E>> E resolve(Class<E> type, String name, Function<E, String> canonical) {
    if (name == null || name.isBlank()) {
      throw new UnsupportedAlgorithmException("Missing " + type.getSimpleName() + " name");
    }
    String wanted = normalize(name);
    for (E constant : type.getEnumConstants()) {
      if (normalize(canonical.apply(constant)).equals(wanted) || normalize(constant.name()).equals(wanted)) {
        return constant;
      }
    }
    throw new UnsupportedAlgorithmException("Unknown " + type.getSimpleName() + ": " + name);
  }
}
