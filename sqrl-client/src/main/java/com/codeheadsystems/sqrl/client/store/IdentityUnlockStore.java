package com.codeheadsystems.sqrl.client.store;

import java.util.Optional;

/**
 * Storage abstraction for framed rescue code blocks.
 * <p>
 * Implementations must be thread-safe. Typical production implementations write the block into
 * the user's S4 identity file or a key-value database.
 */
public interface IdentityUnlockStore {

  /**
   * Stores or replaces the framed block for the given identity.
   *
   * @param identityId identifies the identity the block belongs to
   * @param block      the complete 73-byte block, header included
   */
  void store(String identityId, byte[] block);

  /**
   * Retrieves the framed block for the given identity.
   *
   * @param identityId identifies the identity the block belongs to
   * @return the stored block, or empty if the identity has none
   */
  Optional<byte[]> load(String identityId);

  /**
   * Removes the block for the given identity, if present.
   *
   * @param identityId identifies the identity the block belongs to
   */
  void delete(String identityId);
}
