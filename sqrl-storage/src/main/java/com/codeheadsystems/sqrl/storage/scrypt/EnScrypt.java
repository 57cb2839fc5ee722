package com.codeheadsystems.sqrl.storage.scrypt;

import com.codeheadsystems.sqrl.storage.common.ByteUtils;
import com.codeheadsystems.sqrl.storage.exception.SqrlException;
import org.bouncycastle.crypto.generators.SCrypt;

/**
 * SQRL EnScrypt: chained scrypt invocations whose outputs are XORed together.
 * The first invocation is salted with the configured salt; each following invocation is salted
 * with the previous invocation's output.
 * <p>
 * Block size and parallelism are not stored in the block, so every reader of a block must use the
 * same instance parameters as its writer. SQRL fixes them at r=256, p=1.
 */
public class EnScrypt implements KeyStretchingFunction {

  /**
   * SQRL block size.
   */
  public static final int SQRL_BLOCK_SIZE = 256;

  /**
   * SQRL parallelism.
   */
  public static final int SQRL_PARALLELISM = 1;

  /**
   * Upper bound on the scrypt working set ({@code 128 * r * N} bytes) of a single derivation.
   */
  public static final long MAX_MEMORY_BYTES = 256L * 1024 * 1024;

  private final int blockSize;
  private final int parallelism;

  /**
   * Instantiates EnScrypt with the SQRL block size and parallelism.
   */
  public EnScrypt() {
    this(SQRL_BLOCK_SIZE, SQRL_PARALLELISM);
  }

  /**
   * Instantiates EnScrypt with explicit scrypt r and p.
   *
   * @param blockSize   scrypt r
   * @param parallelism scrypt p
   */
  public EnScrypt(int blockSize, int parallelism) {
    if (blockSize < 1 || parallelism < 1) {
      throw new IllegalArgumentException("blockSize and parallelism must be positive");
    }
    this.blockSize = blockSize;
    this.parallelism = parallelism;
  }

  public int blockSize() {
    return blockSize;
  }

  public int parallelism() {
    return parallelism;
  }

  @Override
  public byte[] stretch(byte[] secret, ScryptConfig costs) {
    long memory = 128L * blockSize * costs.n();
    if (memory > MAX_MEMORY_BYTES) {
      throw new SqrlException("EnScrypt key derivation failed: N=" + costs.n() + ", r=" + blockSize
          + " needs " + memory + " bytes, limit is " + MAX_MEMORY_BYTES);
    }
    try {
      byte[] output = SCrypt.generate(secret, costs.salt(), costs.n(), blockSize, parallelism, KEY_LENGTH);
      byte[] result = output.clone();
      for (long i = 1; i < costs.iterationCount(); i++) {
        output = SCrypt.generate(secret, output, costs.n(), blockSize, parallelism, KEY_LENGTH);
        byte[] next = ByteUtils.xor(result, output);
        ByteUtils.wipe(result);
        result = next;
      }
      ByteUtils.wipe(output);
      return result;
    } catch (RuntimeException e) {
      throw new SqrlException("EnScrypt key derivation failed: " + e.getMessage(), e);
    }
  }
}
