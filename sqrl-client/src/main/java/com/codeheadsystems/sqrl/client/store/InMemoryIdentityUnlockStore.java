package com.codeheadsystems.sqrl.client.store;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link IdentityUnlockStore} backed by a {@link ConcurrentHashMap}.
 * <p>
 * All blocks are lost on restart. Suitable for development and testing only.
 */
public class InMemoryIdentityUnlockStore implements IdentityUnlockStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryIdentityUnlockStore.class);

  private final ConcurrentHashMap<String, byte[]> store = new ConcurrentHashMap<>();

  public InMemoryIdentityUnlockStore() {
    log.warn("Using InMemoryIdentityUnlockStore; rescue code blocks will NOT survive restarts.");
  }

  @Override
  public void store(String identityId, byte[] block) {
    store.put(identityId, block.clone());
    log.debug("Stored rescue code block for identity {} ({} bytes)", identityId, block.length);
  }

  @Override
  public Optional<byte[]> load(String identityId) {
    return Optional.ofNullable(store.get(identityId)).map(byte[]::clone);
  }

  @Override
  public void delete(String identityId) {
    store.remove(identityId);
  }
}
