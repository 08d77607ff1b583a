package com.codeheadsystems.pbkdf2.exceptions;

/**
 * Thrown when the key derivation backend cannot produce its output. Fatal for the call;
 * retrying with the same inputs will not succeed.
 */
public class Pbkdf2OperationException extends RuntimeException {
  /**
   * Instantiates a new Pbkdf2 operation exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public Pbkdf2OperationException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
