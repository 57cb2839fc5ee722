package com.codeheadsystems.sqrl.storage.scrypt;

import com.codeheadsystems.sqrl.storage.common.ByteCursor;
import com.codeheadsystems.sqrl.storage.common.ByteUtils;
import com.codeheadsystems.sqrl.storage.common.RandomProvider;
import com.codeheadsystems.sqrl.storage.exception.BlockParseException;
import java.util.Arrays;
import org.bouncycastle.util.encoders.Hex;

/**
 * EnScrypt cost parameters stored alongside every password- or rescue-code-protected block.
 * Wire format (21 bytes): salt (16) || log2(N) (1) || iteration count (4, little-endian).
 *
 * @param salt           the 16-byte salt
 * @param logNFactor     scrypt N as a power of two
 * @param iterationCount number of chained scrypt invocations
 */
public record ScryptConfig(byte[] salt, int logNFactor, long iterationCount) {

  /**
   * Salt length in bytes.
   */
  public static final int SALT_LENGTH = 16;

  /**
   * Encoded length in bytes. Part of the block length; changing it breaks the format.
   */
  public static final int ENCODED_LENGTH = SALT_LENGTH + 1 + 4;

  /**
   * Largest accepted log2(N). Blocks are read before their tag can be checked, so the cost
   * fields are bounded to keep a corrupted block from demanding unbounded memory.
   */
  public static final int MAX_LOG_N_FACTOR = 20;

  /**
   * Largest accepted iteration count. Bounds the time spent deriving a key for a corrupted block.
   */
  public static final long MAX_ITERATION_COUNT = 0xFFFF;

  /**
   * Validates the fields and copies the salt.
   */
  public ScryptConfig {
    salt = ByteUtils.copyOfExactLength(salt, SALT_LENGTH, "salt");
    if (logNFactor < 1 || logNFactor > MAX_LOG_N_FACTOR) {
      throw new IllegalArgumentException("logNFactor out of range: " + logNFactor);
    }
    if (iterationCount < 1 || iterationCount > MAX_ITERATION_COUNT) {
      throw new IllegalArgumentException("iterationCount out of range: " + iterationCount);
    }
  }

  /**
   * Creates a configuration with a fresh random salt.
   *
   * @param randomProvider the random provider
   * @param logNFactor     the log n factor
   * @param iterationCount the iteration count
   * @return the scrypt config
   */
  public static ScryptConfig generate(RandomProvider randomProvider, int logNFactor, long iterationCount) {
    return new ScryptConfig(randomProvider.randomBytes(SALT_LENGTH), logNFactor, iterationCount);
  }

  /**
   * Reads the 21-byte encoding from the cursor.
   *
   * @param cursor the cursor
   * @return the scrypt config
   * @throws BlockParseException if the input is short or a cost value is out of range
   */
  public static ScryptConfig fromBinary(ByteCursor cursor) {
    byte[] salt = cursor.next(SALT_LENGTH);
    int logN = cursor.nextU8();
    long iterations = cursor.nextU32();
    try {
      return new ScryptConfig(salt, logN, iterations);
    } catch (IllegalArgumentException e) {
      throw new BlockParseException("Malformed scrypt parameters: " + e.getMessage());
    }
  }

  /**
   * scrypt N parameter.
   *
   * @return the int
   */
  public int n() {
    return 1 << logNFactor;
  }

  @Override
  public byte[] salt() {
    return salt.clone();
  }

  /**
   * Serializes to the 21-byte wire format.
   *
   * @return the byte [ ]
   */
  public byte[] serialize() {
    return ByteUtils.concat(
        salt,
        ByteUtils.toLittleEndian(logNFactor, 1),
        ByteUtils.toLittleEndian(iterationCount, 4));
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof ScryptConfig other
        && Arrays.equals(salt, other.salt)
        && logNFactor == other.logNFactor
        && iterationCount == other.iterationCount;
  }

  @Override
  public int hashCode() {
    return 31 * (31 * Arrays.hashCode(salt) + logNFactor) + Long.hashCode(iterationCount);
  }

  @Override
  public String toString() {
    return "ScryptConfig[salt=" + Hex.toHexString(salt) + ", logNFactor=" + logNFactor
        + ", iterationCount=" + iterationCount + "]";
  }
}
