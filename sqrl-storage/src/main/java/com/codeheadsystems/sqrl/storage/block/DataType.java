package com.codeheadsystems.sqrl.storage.block;

import com.codeheadsystems.sqrl.storage.exception.BlockParseException;

/**
 * S4 block type registry. The type is written as a little-endian 16-bit value after the
 * block length.
 */
public enum DataType {
  /**
   * Password-protected identity keys.
   */
  USER_ACCESS(1),
  /**
   * Rescue-code-protected identity unlock key.
   */
  RESCUE_CODE(2),
  /**
   * Previous identity unlock keys.
   */
  PREVIOUS_IDENTITY_KEYS(3);

  private final int code;

  DataType(int code) {
    this.code = code;
  }

  /**
   * Wire value.
   *
   * @return the int
   */
  public int code() {
    return code;
  }

  /**
   * Looks up a block type by its wire value.
   *
   * @param code the code
   * @return the data type
   * @throws BlockParseException for unknown values
   */
  public static DataType fromCode(int code) {
    return switch (code) {
      case 1 -> USER_ACCESS;
      case 2 -> RESCUE_CODE;
      case 3 -> PREVIOUS_IDENTITY_KEYS;
      default -> throw new BlockParseException("Unknown block type: " + code);
    };
  }
}
