/* Copyright 2026 The MapVault Project
 * See LICENSE for licensing information */

package org.mapvault.sync.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Time-boxed marker serializing full-vault reconciliation. A lock is treated
 * as absent once its expiry time has passed.
 */
@JsonPropertyOrder({ "lock_id", "vault_id", "owner", "acquired_at",
    "expires_at", "operation" })
public class Lock {

  private String lockId;

  private String vaultId;

  /** Device that acquired the lock. */
  private String owner;

  private long acquiredAt;

  private long expiresAt;

  /** What the lock holder is doing, e.g. {@code vault-open}. */
  private String operation;

  public Lock() { /* for deserialization */ }

  /** Create a lock with the given values. */
  public static Lock of(String lockId, String vaultId, String owner,
      long acquiredAt, long expiresAt, String operation) {
    Lock lock = new Lock();
    lock.lockId = lockId;
    lock.vaultId = vaultId;
    lock.owner = owner;
    lock.acquiredAt = acquiredAt;
    lock.expiresAt = expiresAt;
    lock.operation = operation;
    return lock;
  }

  public boolean isExpired(long now) {
    return now > this.expiresAt;
  }

  public String getLockId() {
    return lockId;
  }

  public String getVaultId() {
    return vaultId;
  }

  public String getOwner() {
    return owner;
  }

  public long getAcquiredAt() {
    return acquiredAt;
  }

  public long getExpiresAt() {
    return expiresAt;
  }

  public String getOperation() {
    return operation;
  }

  @Override
  public String toString() {
    return "Lock[" + lockId + " on " + vaultId + " by " + owner + " for "
        + operation + ", expires " + expiresAt + "]";
  }
}
