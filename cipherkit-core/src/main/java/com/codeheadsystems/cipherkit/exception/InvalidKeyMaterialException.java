package com.codeheadsystems.cipherkit.exception;

/**
 * Key or IV length does not match the size class of the chosen algorithm.
 */
public class InvalidKeyMaterialException extends CipherKitException {

  /**
   * Instantiates a new Invalid key material exception.
   *
   * @param message the message
   */
  public InvalidKeyMaterialException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Invalid key material exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public InvalidKeyMaterialException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
