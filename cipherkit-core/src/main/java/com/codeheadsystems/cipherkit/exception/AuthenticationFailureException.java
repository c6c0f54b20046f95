package com.codeheadsystems.cipherkit.exception;

/**
 * MAC or tag mismatch on decrypt. The message is fixed and never carries plaintext, tag values or
 * the position of a mismatch.
 */
public class AuthenticationFailureException extends CipherKitException {

  private static final String MESSAGE = "Authentication failed";

  /**
   * Instantiates a new Authentication failure exception.
   */
  public AuthenticationFailureException() {
    super(MESSAGE);
  }
}
