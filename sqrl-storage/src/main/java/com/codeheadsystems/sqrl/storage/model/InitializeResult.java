package com.codeheadsystems.sqrl.storage.model;

import com.codeheadsystems.sqrl.storage.block.IdentityUnlock;
import com.codeheadsystems.sqrl.storage.rescue.RescueCode;

/**
 * A newly protected identity unlock key: the block to persist and the rescue code to show the
 * user exactly once.
 *
 * @param identityUnlock the block
 * @param rescueCode     the rescue code
 */
public record InitializeResult(IdentityUnlock identityUnlock, RescueCode rescueCode) {
}
