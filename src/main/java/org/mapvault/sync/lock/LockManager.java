/* Copyright 2026 The MapVault Project
 * See LICENSE for licensing information */

package org.mapvault.sync.lock;

import org.mapvault.sync.model.Lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.UUID;

/**
 * Vault-level mutual exclusion around full reconciliation. A lock is taken
 * with a single compare-and-set on the lock store; expired locks count as
 * absent and are taken over.
 */
public class LockManager {

  private static final Logger logger = LoggerFactory.getLogger(
      LockManager.class);

  private final LockStore store;

  private final Clock clock;

  private final String owner;

  /**
   * Create a lock manager.
   *
   * @param store Where lock records live.
   * @param clock Clock for acquisition and expiry times.
   * @param owner Device name written into acquired locks.
   */
  public LockManager(LockStore store, Clock clock, String owner) {
    this.store = store;
    this.clock = clock;
    this.owner = owner;
  }

  /**
   * Acquire the lock of a vault.
   *
   * @param timeoutMillis Lifetime of the lock.
   * @throws LockHeldException Thrown if an unexpired lock exists or another
   *     client won the race.
   * @throws IOException Thrown if the lock store cannot be reached.
   */
  public Lock acquire(String vaultId, String operation, long timeoutMillis)
      throws LockHeldException, IOException {
    long now = this.clock.millis();
    Lock current = this.store.read(vaultId);
    if (null != current && !current.isExpired(now)) {
      throw new LockHeldException("Vault " + vaultId + " is locked by "
          + current.getOwner() + " until " + current.getExpiresAt() + ".",
          current);
    }
    if (null != current) {
      logger.info("Taking over expired lock {} of vault {}.", current,
          vaultId);
    }
    Lock lock = Lock.of(UUID.randomUUID().toString(), vaultId, this.owner,
        now, now + timeoutMillis, operation);
    if (!this.store.compareAndSet(vaultId,
        null == current ? null : current.getLockId(), lock)) {
      throw new LockHeldException("Lost race for the lock of vault "
          + vaultId + ".", this.store.read(vaultId));
    }
    logger.debug("Acquired lock {}.", lock);
    return lock;
  }

  /** Release a lock; a no-op if someone else took it over meanwhile. */
  public void release(Lock lock) throws IOException {
    this.store.delete(lock.getVaultId(), lock.getLockId());
    logger.debug("Released lock {}.", lock);
  }

  /** Advisory check whether a vault is locked right now. */
  public LockStatus isLocked(String vaultId) throws IOException {
    Lock current = this.store.read(vaultId);
    return new LockStatus(null != current
        && !current.isExpired(this.clock.millis()), current);
  }
}
