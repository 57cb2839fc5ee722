package com.codeheadsystems.sqrl.storage.exception;

/**
 * Base exception for identity storage failures. Carries a human-readable message and, when the
 * failure came from a collaborator, the original cause.
 */
public class SqrlException extends RuntimeException {

  /**
   * Instantiates a new Sqrl exception.
   *
   * @param message the message
   */
  public SqrlException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Sqrl exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public SqrlException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
