package com.codeheadsystems.sqrl.storage.exception;

/**
 * The AEAD tag did not verify: the rescue code is wrong or the block was modified.
 * Callers may prompt for the rescue code again; the block is left untouched.
 */
public class RescueCodeAuthenticationException extends SqrlException {

  /**
   * Instantiates a new Rescue code authentication exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public RescueCodeAuthenticationException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
