package com.codeheadsystems.sqrl.storage.exception;

/**
 * Structural decode failure: truncated input or a malformed fixed-width field.
 */
public class BlockParseException extends SqrlException {

  /**
   * Instantiates a new Block parse exception.
   *
   * @param message the message
   */
  public BlockParseException(final String message) {
    super(message);
  }
}
