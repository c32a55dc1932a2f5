/* Copyright 2026 The MapVault Project
 * See LICENSE for licensing information */

package org.mapvault.sync.lock;

import org.mapvault.sync.model.Lock;
import org.mapvault.sync.remote.RemoteAdapter;

import java.io.IOException;

/** Lock records kept next to the vault on the remote backend. */
public class RemoteLockStore implements LockStore {

  private final RemoteAdapter remote;

  public RemoteLockStore(RemoteAdapter remote) {
    this.remote = remote;
  }

  @Override
  public Lock read(String vaultId) throws IOException {
    return this.remote.readLock(vaultId);
  }

  @Override
  public boolean compareAndSet(String vaultId, String expectedLockId,
      Lock lock) throws IOException {
    return this.remote.compareAndSetLock(vaultId, expectedLockId, lock);
  }

  @Override
  public void delete(String vaultId, String lockId) throws IOException {
    this.remote.deleteLock(vaultId, lockId);
  }
}
