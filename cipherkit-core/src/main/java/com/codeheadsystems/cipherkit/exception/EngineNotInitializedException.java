package com.codeheadsystems.cipherkit.exception;

/**
 * An engine was used before {@code init}, or after it was finalized without being re-initialized.
 */
public class EngineNotInitializedException extends CipherKitException {

  /**
   * Instantiates a new Engine not initialized exception.
   *
   * @param message the message
   */
  public EngineNotInitializedException(final String message) {
    super(message);
  }
}
