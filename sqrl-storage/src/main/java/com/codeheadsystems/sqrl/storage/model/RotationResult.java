package com.codeheadsystems.sqrl.storage.model;

import com.codeheadsystems.sqrl.storage.block.IdentityUnlock;
import com.codeheadsystems.sqrl.storage.rescue.RescueCode;

/**
 * Outcome of a rotation.
 *
 * @param identityUnlock            the replacement block
 * @param rescueCode                the new rescue code; the previous one no longer opens anything
 * @param previousIdentityUnlockKey the key that was protected before, or 32 zero bytes if the
 *                                  block was uninitialized
 */
public record RotationResult(IdentityUnlock identityUnlock, RescueCode rescueCode,
                             byte[] previousIdentityUnlockKey) {
}
