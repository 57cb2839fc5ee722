package com.codeheadsystems.sqrl.storage.block;

import com.codeheadsystems.sqrl.storage.common.ByteCursor;
import com.codeheadsystems.sqrl.storage.common.ByteUtils;

/**
 * The four bytes that frame every S4 block: declared length (2, LE) || type (2, LE).
 * The declared length counts the header itself.
 *
 * @param length the declared block length
 * @param type   the block type
 */
public record DataBlockHeader(int length, DataType type) {

  /**
   * Header size in bytes.
   */
  public static final int SIZE = 4;

  /**
   * Reads a header from the cursor.
   *
   * @param cursor the cursor
   * @return the data block header
   */
  public static DataBlockHeader read(ByteCursor cursor) {
    int length = cursor.nextU16();
    DataType type = DataType.fromCode(cursor.nextU16());
    return new DataBlockHeader(length, type);
  }

  /**
   * Serializes the header.
   *
   * @return the byte [ ]
   */
  public byte[] serialize() {
    return ByteUtils.concat(
        ByteUtils.toLittleEndian(length, 2),
        ByteUtils.toLittleEndian(type.code(), 2));
  }
}
