/* Copyright 2026 The MapVault Project
 * See LICENSE for licensing information */

package org.mapvault.sync.lock;

import org.mapvault.sync.model.Lock;

import java.io.IOException;

/** Storage of one lock record per vault. */
public interface LockStore {

  /** Return the current lock record of the vault, or {@code null}. */
  Lock read(String vaultId) throws IOException;

  /**
   * Atomically replace the lock record if its id equals the expected id,
   * where {@code null} stands for no record.
   */
  boolean compareAndSet(String vaultId, String expectedLockId, Lock lock)
      throws IOException;

  /** Delete the lock record if it still has the given id. */
  void delete(String vaultId, String lockId) throws IOException;
}
