package com.codeheadsystems.sqrl.client.manager;

import com.codeheadsystems.sqrl.client.config.IdentityUnlockClientConfig;
import com.codeheadsystems.sqrl.client.store.IdentityUnlockStore;
import com.codeheadsystems.sqrl.storage.IdentityUnlockProtector;
import com.codeheadsystems.sqrl.storage.block.IdentityUnlock;
import com.codeheadsystems.sqrl.storage.common.ByteCursor;
import com.codeheadsystems.sqrl.storage.exception.BlockParseException;
import com.codeheadsystems.sqrl.storage.model.InitializeResult;
import com.codeheadsystems.sqrl.storage.model.RotationResult;
import com.codeheadsystems.sqrl.storage.rescue.RescueCode;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * High-level orchestrator for rescue code protection of identity unlock keys.
 * <p>
 * Loads framed blocks from the {@link IdentityUnlockStore}, runs the protocol through the
 * {@link IdentityUnlockProtector} and writes the replacement block back only after the protocol
 * step succeeded. Read-modify-write operations on one identity are serialized.
 * <p>
 * EnScrypt is deliberately slow. Request-serving callers should use the {@code *Async} variants,
 * which run derivations on this manager's worker pool.
 * <p>
 * <strong>Exception contract:</strong>
 * <ul>
 *   <li>{@link com.codeheadsystems.sqrl.storage.exception.RescueCodeAuthenticationException}: wrong
 *       rescue code; the stored block is unchanged</li>
 *   <li>{@link BlockParseException}: the stored block is corrupt</li>
 *   <li>{@link IllegalArgumentException}: malformed rescue code text or key length</li>
 *   <li>{@link IllegalStateException}: unknown identity, or identity already protected</li>
 * </ul>
 */
@Singleton
public class IdentityUnlockManager {

  private static final Logger log = LoggerFactory.getLogger(IdentityUnlockManager.class);

  // Identities share a fixed set of locks, so lock memory does not grow with the identity count.
  static final int LOCK_STRIPES = 64;

  private final IdentityUnlockProtector protector;
  private final IdentityUnlockStore store;
  private final ExecutorService derivationExecutor;
  private final Object[] identityLocks = new Object[LOCK_STRIPES];

  /**
   * Instantiates a new Identity unlock manager with its own worker pool.
   *
   * @param config the config
   * @param store  the store
   */
  @Inject
  public IdentityUnlockManager(final IdentityUnlockClientConfig config, final IdentityUnlockStore store) {
    this(new IdentityUnlockProtector(config.toRescueCodeConfig()), store,
        Executors.newFixedThreadPool(config.derivationThreads(), derivationThreadFactory()));
  }

  /**
   * Instantiates a new Identity unlock manager.
   *
   * @param protector          the protector
   * @param store              the store
   * @param derivationExecutor runs asynchronous operations; shut down by {@link #shutdown()}
   */
  public IdentityUnlockManager(final IdentityUnlockProtector protector,
                               final IdentityUnlockStore store,
                               final ExecutorService derivationExecutor) {
    log.info("IdentityUnlockManager()");
    this.protector = protector;
    this.store = store;
    this.derivationExecutor = derivationExecutor;
    for (int i = 0; i < LOCK_STRIPES; i++) {
      identityLocks[i] = new Object();
    }
  }

  /**
   * Protects the identity's unlock key for the first time and stores the block.
   *
   * @param identityId        the identity
   * @param identityUnlockKey the 32-byte identity unlock key
   * @return the rescue code to show the user
   * @throws IllegalStateException if the identity already has a block
   */
  public RescueCode create(final String identityId, final byte[] identityUnlockKey) {
    log.debug("create(identityId={})", identityId);
    synchronized (lockFor(identityId)) {
      if (store.load(identityId).isPresent()) {
        throw new IllegalStateException("Identity already has a rescue code block: " + identityId);
      }
      InitializeResult result = protector.initialize(identityUnlockKey);
      store.store(identityId, result.identityUnlock().toBinary());
      return result.rescueCode();
    }
  }

  /**
   * Rotates the identity's unlock key. The previous key is returned so the caller can re-protect
   * it wherever else it is referenced.
   *
   * @param identityId           the identity
   * @param currentRescueCode    the rescue code from the last rotation, as typed by the user
   * @param newIdentityUnlockKey the new 32-byte identity unlock key
   * @return the rotation result
   */
  public RotationResult rotate(final String identityId, final String currentRescueCode,
                               final byte[] newIdentityUnlockKey) {
    log.debug("rotate(identityId={})", identityId);
    RescueCode rescueCode = currentRescueCode == null ? null : RescueCode.parse(currentRescueCode);
    synchronized (lockFor(identityId)) {
      IdentityUnlock current = loadRequired(identityId);
      RotationResult result = protector.rotate(current, rescueCode, newIdentityUnlockKey);
      store.store(identityId, result.identityUnlock().toBinary());
      log.info("Rotated rescue code block for identity {}", identityId);
      return result;
    }
  }

  /**
   * Recovers the identity unlock key with the rescue code.
   *
   * @param identityId the identity
   * @param rescueCode the rescue code as typed by the user
   * @return the 32-byte identity unlock key
   */
  public byte[] recover(final String identityId, final String rescueCode) {
    log.debug("recover(identityId={})", identityId);
    RescueCode parsed = RescueCode.parse(rescueCode);
    return protector.recover(loadRequired(identityId), parsed);
  }

  /**
   * Runs {@link #rotate} on the worker pool.
   *
   * @param identityId           the identity
   * @param currentRescueCode    the current rescue code
   * @param newIdentityUnlockKey the new identity unlock key
   * @return the future rotation result
   */
  public CompletableFuture<RotationResult> rotateAsync(final String identityId,
                                                       final String currentRescueCode,
                                                       final byte[] newIdentityUnlockKey) {
    return CompletableFuture.supplyAsync(
        () -> rotate(identityId, currentRescueCode, newIdentityUnlockKey), derivationExecutor);
  }

  /**
   * Runs {@link #recover} on the worker pool.
   *
   * @param identityId the identity
   * @param rescueCode the rescue code
   * @return the future identity unlock key
   */
  public CompletableFuture<byte[]> recoverAsync(final String identityId, final String rescueCode) {
    return CompletableFuture.supplyAsync(() -> recover(identityId, rescueCode), derivationExecutor);
  }

  /**
   * Decodes the identity's stored block.
   *
   * @param identityId the identity
   * @return the block, or empty if none is stored
   * @throws BlockParseException if the stored bytes are not a valid rescue code block
   */
  public Optional<IdentityUnlock> load(final String identityId) {
    return store.load(identityId).map(bytes -> {
      ByteCursor cursor = new ByteCursor(bytes);
      IdentityUnlock block = IdentityUnlock.fromFrame(cursor);
      if (cursor.remaining() != 0) {
        throw new BlockParseException(cursor.remaining() + " trailing bytes after rescue code block");
      }
      return block;
    });
  }

  /**
   * Removes the identity's block.
   *
   * @param identityId the identity
   */
  public void delete(final String identityId) {
    log.debug("delete(identityId={})", identityId);
    synchronized (lockFor(identityId)) {
      store.delete(identityId);
    }
  }

  /**
   * Shuts down the worker pool. Pending asynchronous operations still complete.
   */
  public void shutdown() {
    derivationExecutor.shutdown();
  }

  private IdentityUnlock loadRequired(final String identityId) {
    return load(identityId).orElseThrow(() ->
        new IllegalStateException("No rescue code block for identity: " + identityId));
  }

  Object lockFor(final String identityId) {
    return identityLocks[Math.floorMod(identityId.hashCode(), LOCK_STRIPES)];
  }

  private static ThreadFactory derivationThreadFactory() {
    AtomicInteger counter = new AtomicInteger();
    return r -> {
      Thread t = new Thread(r, "enscrypt-worker-" + counter.incrementAndGet());
      t.setDaemon(true);
      return t;
    };
  }
}
