package com.codeheadsystems.sqrl.storage.block;

import com.codeheadsystems.sqrl.storage.common.ByteUtils;

/**
 * A block of the S4 identity container. The container owns the framing; implementations
 * supply the type, the fixed declared length and the body.
 */
public interface DataBlock {

  /**
   * Block type written in the frame header.
   *
   * @return the data type
   */
  DataType type();

  /**
   * Declared length, header included.
   *
   * @return the int
   */
  int length();

  /**
   * Body bytes, without the frame header.
   *
   * @return the byte [ ]
   */
  byte[] encodeBody();

  /**
   * Frame header for this block.
   *
   * @return the data block header
   */
  default DataBlockHeader header() {
    return new DataBlockHeader(length(), type());
  }

  /**
   * Complete framed block: header followed by body.
   *
   * @return the byte [ ]
   */
  default byte[] toBinary() {
    return ByteUtils.concat(header().serialize(), encodeBody());
  }
}
