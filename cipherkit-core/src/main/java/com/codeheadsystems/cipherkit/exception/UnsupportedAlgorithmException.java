package com.codeheadsystems.cipherkit.exception;

/**
 * Unknown algorithm identifier, or a combination of primitives that cannot be composed.
 * Raised at construction time, never partway through processing.
 */
public class UnsupportedAlgorithmException extends CipherKitException {

  /**
   * Instantiates a new Unsupported algorithm exception.
   *
   * @param message the message
   */
  public UnsupportedAlgorithmException(final String message) {
    super(message);
  }
}
