package com.codeheadsystems.sqrl.storage.block;

import com.codeheadsystems.sqrl.storage.common.ByteCursor;
import com.codeheadsystems.sqrl.storage.common.ByteUtils;
import com.codeheadsystems.sqrl.storage.exception.BlockParseException;
import com.codeheadsystems.sqrl.storage.scrypt.ScryptConfig;
import java.util.Arrays;
import java.util.Objects;

/**
 * S4 type 2 block: the identity unlock key encrypted under a key derived from the rescue code.
 * <p>
 * Wire format (73 bytes):
 * <pre>
 *   length (2, LE) = 73 || type (2, LE) = 2 || scrypt config (21)
 *     || encrypted identity unlock key (32) || verification tag (16)
 * </pre>
 * The first 25 bytes are the AEAD associated data. Instances are immutable; a rotation produces
 * a replacement block.
 */
public final class IdentityUnlock implements DataBlock {

  /**
   * Length of the identity unlock key and of its ciphertext.
   */
  public static final int KEY_LENGTH = 32;

  /**
   * Length of the GCM verification tag.
   */
  public static final int TAG_LENGTH = 16;

  /**
   * Declared block length, header included.
   */
  public static final int BLOCK_LENGTH =
      DataBlockHeader.SIZE + ScryptConfig.ENCODED_LENGTH + KEY_LENGTH + TAG_LENGTH;

  /**
   * Whether the block protects a key yet.
   */
  public enum State {
    /**
     * Fresh block, ciphertext and tag are all zero.
     */
    UNINITIALIZED,
    /**
     * The block holds an encrypted identity unlock key.
     */
    PROTECTED
  }

  private final ScryptConfig scryptConfig;
  private final byte[] encryptedIdentityUnlockKey;
  private final byte[] verificationTag;
  private final State state;

  private IdentityUnlock(ScryptConfig scryptConfig, byte[] encryptedIdentityUnlockKey,
                         byte[] verificationTag, State state) {
    this.scryptConfig = Objects.requireNonNull(scryptConfig, "scryptConfig");
    this.encryptedIdentityUnlockKey =
        ByteUtils.copyOfExactLength(encryptedIdentityUnlockKey, KEY_LENGTH, "encryptedIdentityUnlockKey");
    this.verificationTag = ByteUtils.copyOfExactLength(verificationTag, TAG_LENGTH, "verificationTag");
    this.state = state;
  }

  /**
   * Creates a block that protects nothing yet.
   *
   * @param scryptConfig the scrypt config
   * @return the identity unlock
   */
  public static IdentityUnlock uninitialized(ScryptConfig scryptConfig) {
    return new IdentityUnlock(scryptConfig, new byte[KEY_LENGTH], new byte[TAG_LENGTH], State.UNINITIALIZED);
  }

  /**
   * Creates a block holding a sealed identity unlock key.
   *
   * @param scryptConfig               the scrypt config the key was derived with
   * @param encryptedIdentityUnlockKey the 32-byte ciphertext
   * @param verificationTag            the 16-byte tag
   * @return the identity unlock
   */
  public static IdentityUnlock sealed(ScryptConfig scryptConfig, byte[] encryptedIdentityUnlockKey,
                                      byte[] verificationTag) {
    return new IdentityUnlock(scryptConfig, encryptedIdentityUnlockKey, verificationTag, State.PROTECTED);
  }

  /**
   * Reads the block body (no frame header) from the cursor.
   * The wire format has no state flag, so an all-zero ciphertext decodes as uninitialized.
   *
   * @param cursor the cursor
   * @return the identity unlock
   * @throws BlockParseException if the input is truncated or malformed
   */
  public static IdentityUnlock fromBinary(ByteCursor cursor) {
    ScryptConfig scryptConfig = ScryptConfig.fromBinary(cursor);
    byte[] encrypted = cursor.next(KEY_LENGTH);
    byte[] tag = cursor.next(TAG_LENGTH);
    State state = ByteUtils.isAllZero(encrypted) ? State.UNINITIALIZED : State.PROTECTED;
    return new IdentityUnlock(scryptConfig, encrypted, tag, state);
  }

  /**
   * Reads a complete framed block, checking its declared length and type.
   *
   * @param cursor the cursor
   * @return the identity unlock
   * @throws BlockParseException if the frame is not a 73-byte rescue code block
   */
  public static IdentityUnlock fromFrame(ByteCursor cursor) {
    DataBlockHeader header = DataBlockHeader.read(cursor);
    if (header.type() != DataType.RESCUE_CODE) {
      throw new BlockParseException("Expected a " + DataType.RESCUE_CODE + " block but found " + header.type());
    }
    if (header.length() != BLOCK_LENGTH) {
      throw new BlockParseException("Rescue code block must declare " + BLOCK_LENGTH
          + " bytes, declared " + header.length());
    }
    return fromBinary(cursor);
  }

  @Override
  public DataType type() {
    return DataType.RESCUE_CODE;
  }

  @Override
  public int length() {
    return BLOCK_LENGTH;
  }

  @Override
  public byte[] encodeBody() {
    return ByteUtils.concat(scryptConfig.serialize(), encryptedIdentityUnlockKey, verificationTag);
  }

  /**
   * Associated data binding the header to the ciphertext: declared length (2, LE) || type (2, LE)
   * || scrypt config.
   *
   * @return the byte [ ]
   */
  public byte[] buildAad() {
    return buildAad(scryptConfig);
  }

  /**
   * Associated data for a block of this type carrying the given scrypt config.
   *
   * @param scryptConfig the scrypt config
   * @return the byte [ ]
   */
  public static byte[] buildAad(ScryptConfig scryptConfig) {
    return ByteUtils.concat(
        new DataBlockHeader(BLOCK_LENGTH, DataType.RESCUE_CODE).serialize(),
        scryptConfig.serialize());
  }

  public ScryptConfig scryptConfig() {
    return scryptConfig;
  }

  public byte[] encryptedIdentityUnlockKey() {
    return encryptedIdentityUnlockKey.clone();
  }

  public byte[] verificationTag() {
    return verificationTag.clone();
  }

  public State state() {
    return state;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof IdentityUnlock other
        && scryptConfig.equals(other.scryptConfig)
        && Arrays.equals(encryptedIdentityUnlockKey, other.encryptedIdentityUnlockKey)
        && Arrays.equals(verificationTag, other.verificationTag)
        && state == other.state;
  }

  @Override
  public int hashCode() {
    return Objects.hash(scryptConfig, Arrays.hashCode(encryptedIdentityUnlockKey),
        Arrays.hashCode(verificationTag), state);
  }

  @Override
  public String toString() {
    return "IdentityUnlock[state=" + state + ", " + scryptConfig + "]";
  }
}
