package com.codeheadsystems.sqrl.storage.internal;

import com.codeheadsystems.sqrl.storage.block.IdentityUnlock;
import com.codeheadsystems.sqrl.storage.common.ByteUtils;
import com.codeheadsystems.sqrl.storage.config.RescueCodeConfig;
import com.codeheadsystems.sqrl.storage.exception.RescueCodeAuthenticationException;
import com.codeheadsystems.sqrl.storage.exception.SqrlException;
import com.codeheadsystems.sqrl.storage.rescue.RescueCode;
import com.codeheadsystems.sqrl.storage.scrypt.KeyStretchingFunction;
import com.codeheadsystems.sqrl.storage.scrypt.ScryptConfig;
import org.bouncycastle.crypto.InvalidCipherTextException;
import org.bouncycastle.crypto.engines.AESEngine;
import org.bouncycastle.crypto.modes.GCMBlockCipher;
import org.bouncycastle.crypto.modes.GCMModeCipher;
import org.bouncycastle.crypto.params.AEADParameters;

/**
 * Key derivation and AES-256-GCM operations protecting the identity unlock key.
 * <p>
 * The GCM nonce is the all-zero 96-bit value. This is sound only because every seal uses a key
 * derived from a newly generated rescue code and a newly generated salt, and because a
 * {@link DerivedKey} refuses a second use.
 */
public class IdentityUnlockCrypto {

  /**
   * GCM tag size in bits.
   */
  static final int TAG_BITS = IdentityUnlock.TAG_LENGTH * 8;

  /**
   * Canonical all-zero GCM nonce (12 bytes).
   */
  private static final int NONCE_LENGTH = 12;

  private IdentityUnlockCrypto() {
  }

  /**
   * Derives the key for a new seal. A fresh scrypt config (new salt, iteration count of
   * {@code baseIterations * effortMultiplier}) is generated; the caller must store it with the
   * ciphertext, since it is what recovery will replay.
   *
   * @param rescueCode the newly generated rescue code
   * @param config     the rescue code config
   * @return the sealing key and the scrypt config it was derived with
   */
  public static SealingKey deriveSealingKey(RescueCode rescueCode, RescueCodeConfig config) {
    ScryptConfig scryptConfig = ScryptConfig.generate(
        config.randomProvider(), config.logNFactor(), config.sealingIterations());
    return new SealingKey(scryptConfig, stretch(config.ksf(), rescueCode, scryptConfig));
  }

  /**
   * Derives the key that opens a block sealed with the given scrypt config.
   *
   * @param rescueCode   the rescue code supplied by the user
   * @param scryptConfig the scrypt config stored in the block
   * @param ksf          the key stretching function
   * @return the derived key
   */
  public static DerivedKey deriveRecoveryKey(RescueCode rescueCode, ScryptConfig scryptConfig,
                                             KeyStretchingFunction ksf) {
    return stretch(ksf, rescueCode, scryptConfig);
  }

  /**
   * Encrypts the 32-byte identity unlock key. Consumes the key.
   *
   * @param key       the derived key
   * @param plaintext the identity unlock key
   * @param aad       the block header
   * @return the ciphertext and tag
   */
  public static SealResult seal(DerivedKey key, byte[] plaintext, byte[] aad) {
    ByteUtils.requireLength(plaintext, IdentityUnlock.KEY_LENGTH, "identity unlock key");
    GCMModeCipher cipher = GCMBlockCipher.newInstance(AESEngine.newInstance());
    cipher.init(true, new AEADParameters(key.consume(), TAG_BITS, new byte[NONCE_LENGTH], aad));
    byte[] out = new byte[cipher.getOutputSize(plaintext.length)];
    try {
      int len = cipher.processBytes(plaintext, 0, plaintext.length, out, 0);
      cipher.doFinal(out, len);
    } catch (InvalidCipherTextException e) {
      throw new SqrlException("AES-GCM encryption failed", e);
    }
    byte[] ciphertext = new byte[IdentityUnlock.KEY_LENGTH];
    byte[] tag = new byte[IdentityUnlock.TAG_LENGTH];
    System.arraycopy(out, 0, ciphertext, 0, ciphertext.length);
    System.arraycopy(out, ciphertext.length, tag, 0, tag.length);
    return new SealResult(ciphertext, tag);
  }

  /**
   * Decrypts and verifies the identity unlock key. Consumes the key.
   *
   * @param key        the derived key
   * @param ciphertext the 32-byte ciphertext
   * @param tag        the 16-byte tag
   * @param aad        the block header
   * @return the identity unlock key
   * @throws RescueCodeAuthenticationException if the tag does not verify
   */
  public static byte[] open(DerivedKey key, byte[] ciphertext, byte[] tag, byte[] aad) {
    byte[] input = ByteUtils.concat(
        ByteUtils.copyOfExactLength(ciphertext, IdentityUnlock.KEY_LENGTH, "ciphertext"),
        ByteUtils.copyOfExactLength(tag, IdentityUnlock.TAG_LENGTH, "tag"));
    GCMModeCipher cipher = GCMBlockCipher.newInstance(AESEngine.newInstance());
    cipher.init(false, new AEADParameters(key.consume(), TAG_BITS, new byte[NONCE_LENGTH], aad));
    byte[] out = new byte[cipher.getOutputSize(input.length)];
    try {
      int len = cipher.processBytes(input, 0, input.length, out, 0);
      cipher.doFinal(out, len);
    } catch (InvalidCipherTextException e) {
      ByteUtils.wipe(out);
      throw new RescueCodeAuthenticationException("Decryption failed. Check your rescue code!", e);
    }
    return out;
  }

  private static DerivedKey stretch(KeyStretchingFunction ksf, RescueCode rescueCode, ScryptConfig scryptConfig) {
    byte[] material = rescueCode.keyMaterial();
    try {
      return new DerivedKey(ksf.stretch(material, scryptConfig));
    } finally {
      ByteUtils.wipe(material);
    }
  }

  /**
   * A sealing key and the scrypt config it was derived with.
   */
  public record SealingKey(ScryptConfig scryptConfig, DerivedKey key) {
  }

  /**
   * Output of {@link #seal}.
   */
  public record SealResult(byte[] ciphertext, byte[] tag) {
  }
}
