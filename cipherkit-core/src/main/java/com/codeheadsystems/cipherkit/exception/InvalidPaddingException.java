package com.codeheadsystems.cipherkit.exception;

/**
 * Malformed padding found while unpadding.
 */
public class InvalidPaddingException extends CipherKitException {

  /**
   * Instantiates a new Invalid padding exception.
   *
   * @param message the message
   */
  public InvalidPaddingException(final String message) {
    super(message);
  }
}
