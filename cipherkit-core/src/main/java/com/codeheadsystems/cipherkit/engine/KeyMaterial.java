package com.codeheadsystems.cipherkit.engine;

import com.codeheadsystems.cipherkit.exception.InvalidKeyMaterialException;
import java.util.Arrays;

/**
 * Length checks for keys and IVs. Messages carry lengths only, never the bytes.
 */
public final class KeyMaterial {

  private KeyMaterial() {
  }

  /**
   * Requires the key to be present and one of the allowed lengths.
   *
   * @param algorithm algorithm name used in the message
   * @param key       the key
   * @param allowed   allowed lengths in bytes
   */
  public static void requireKeyLength(String algorithm, byte[] key, int... allowed) {
    if (key == null) {
      throw new InvalidKeyMaterialException(algorithm + " requires a key");
    }
    if (!contains(allowed, key.length)) {
      throw new InvalidKeyMaterialException(algorithm + " key must be " + describe(allowed)
          + " bytes, was " + key.length);
    }
  }

  /**
   * Requires the IV to be present and exactly the expected length.
   *
   * @param algorithm algorithm name used in the message
   * @param iv        the iv
   * @param expected  required length in bytes
   */
  public static void requireIvLength(String algorithm, byte[] iv, int expected) {
    if (iv == null) {
      throw new InvalidKeyMaterialException(algorithm + " requires a " + expected + "-byte IV");
    }
    if (iv.length != expected) {
      throw new InvalidKeyMaterialException(algorithm + " IV must be " + expected
          + " bytes, was " + iv.length);
    }
  }

  private static boolean contains(int[] allowed, int length) {
    for (int candidate : allowed) {
      if (candidate == length) {
        return true;
      }
    }
    return false;
  }

  private static String describe(int[] allowed) {
    if (allowed.length == 1) {
      return Integer.toString(allowed[0]);
    }
    return "one of " + Arrays.toString(allowed);
  }
}
