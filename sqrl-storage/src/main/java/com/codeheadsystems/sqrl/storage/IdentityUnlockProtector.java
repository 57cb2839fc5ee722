package com.codeheadsystems.sqrl.storage;

import com.codeheadsystems.sqrl.storage.block.IdentityUnlock;
import com.codeheadsystems.sqrl.storage.common.ByteUtils;
import com.codeheadsystems.sqrl.storage.config.RescueCodeConfig;
import com.codeheadsystems.sqrl.storage.exception.RescueCodeAuthenticationException;
import com.codeheadsystems.sqrl.storage.internal.DerivedKey;
import com.codeheadsystems.sqrl.storage.internal.IdentityUnlockCrypto;
import com.codeheadsystems.sqrl.storage.model.InitializeResult;
import com.codeheadsystems.sqrl.storage.model.RotationResult;
import com.codeheadsystems.sqrl.storage.rescue.RescueCode;
import com.codeheadsystems.sqrl.storage.scrypt.ScryptConfig;

/**
 * Rescue code protection public API. Stateless; takes RescueCodeConfig at construction time.
 * <p>
 * Blocks are immutable, so every failure leaves the caller's block exactly as it was.
 */
public class IdentityUnlockProtector {

  private final RescueCodeConfig config;

  /**
   * Instantiates a new Identity unlock protector.
   *
   * @param config the config
   */
  public IdentityUnlockProtector(RescueCodeConfig config) {
    this.config = config;
  }

  /**
   * Creates a block that protects nothing yet, with a freshly generated scrypt config.
   *
   * @return the identity unlock
   */
  public IdentityUnlock createUninitialized() {
    return IdentityUnlock.uninitialized(
        ScryptConfig.generate(config.randomProvider(), config.logNFactor(), config.sealingIterations()));
  }

  /**
   * Protects an identity unlock key in a new block.
   *
   * @param identityUnlockKey the 32-byte identity unlock key
   * @return the block and its rescue code
   */
  public InitializeResult initialize(byte[] identityUnlockKey) {
    RotationResult rotation = rotate(createUninitialized(), null, identityUnlockKey);
    return new InitializeResult(rotation.identityUnlock(), rotation.rescueCode());
  }

  /**
   * Replaces the protected identity unlock key and issues a new rescue code.
   * <ol>
   *   <li>A protected block is opened with {@code currentRescueCode} first; an uninitialized
   *       block has no previous key and ignores it.</li>
   *   <li>A new rescue code and a new scrypt config are generated and the new key is sealed.</li>
   * </ol>
   *
   * @param identityUnlock       the current block
   * @param currentRescueCode    the rescue code of the current block; may be null when uninitialized
   * @param newIdentityUnlockKey the 32-byte key to protect
   * @return the replacement block, the new rescue code and the previous key
   * @throws RescueCodeAuthenticationException if the current rescue code does not open the block
   */
  public RotationResult rotate(IdentityUnlock identityUnlock, RescueCode currentRescueCode,
                               byte[] newIdentityUnlockKey) {
    byte[] newKey = ByteUtils.copyOfExactLength(newIdentityUnlockKey, IdentityUnlock.KEY_LENGTH,
        "identity unlock key");
    byte[] previous = identityUnlock.state() == IdentityUnlock.State.PROTECTED
        ? recover(identityUnlock, currentRescueCode)
        : new byte[IdentityUnlock.KEY_LENGTH];

    RescueCode rescueCode = RescueCode.generate(config.randomProvider());
    IdentityUnlockCrypto.SealingKey sealingKey = IdentityUnlockCrypto.deriveSealingKey(rescueCode, config);
    ScryptConfig scryptConfig = sealingKey.scryptConfig();
    try {
      IdentityUnlockCrypto.SealResult sealed = IdentityUnlockCrypto.seal(
          sealingKey.key(), newKey, IdentityUnlock.buildAad(scryptConfig));
      IdentityUnlock replacement = IdentityUnlock.sealed(scryptConfig, sealed.ciphertext(), sealed.tag());
      return new RotationResult(replacement, rescueCode, previous);
    } finally {
      ByteUtils.wipe(newKey);
    }
  }

  /**
   * Recovers the identity unlock key protected by the block.
   *
   * @param identityUnlock the block
   * @param rescueCode     the rescue code issued by the block's last rotation
   * @return the 32-byte identity unlock key
   * @throws IllegalStateException             if the block is uninitialized
   * @throws IllegalArgumentException          if no rescue code is given
   * @throws RescueCodeAuthenticationException if the rescue code is wrong or the block was altered
   */
  public byte[] recover(IdentityUnlock identityUnlock, RescueCode rescueCode) {
    if (identityUnlock.state() != IdentityUnlock.State.PROTECTED) {
      throw new IllegalStateException("Block does not protect an identity unlock key");
    }
    if (rescueCode == null) {
      throw new IllegalArgumentException("A rescue code is required to open a protected block");
    }
    DerivedKey key = IdentityUnlockCrypto.deriveRecoveryKey(
        rescueCode, identityUnlock.scryptConfig(), config.ksf());
    return IdentityUnlockCrypto.open(key, identityUnlock.encryptedIdentityUnlockKey(),
        identityUnlock.verificationTag(), identityUnlock.buildAad());
  }
}
