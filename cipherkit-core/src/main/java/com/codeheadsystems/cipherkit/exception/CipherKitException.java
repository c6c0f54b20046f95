package com.codeheadsystems.cipherkit.exception;

/**
 * Base type of every failure raised by the composition layer. Subclasses are distinct so callers
 * can react to each failure kind separately.
 */
public class CipherKitException extends RuntimeException {

  /**
   * Instantiates a new CipherKit exception.
   *
   * @param message the message
   */
  public CipherKitException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new CipherKit exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public CipherKitException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
