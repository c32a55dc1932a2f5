/* Copyright 2026 The MapVault Project
 * See LICENSE for licensing information */

package org.mapvault.sync.lock;

import org.mapvault.sync.model.Lock;

/** Advisory view of a vault lock at the time of the query. */
public final class LockStatus {

  private final boolean locked;

  private final Lock lock;

  LockStatus(boolean locked, Lock lock) {
    this.locked = locked;
    this.lock = lock;
  }

  /** Whether an unexpired lock exists. */
  public boolean isLocked() {
    return locked;
  }

  /** The current lock record, which may be expired, or {@code null}. */
  public Lock getLock() {
    return lock;
  }

  @Override
  public String toString() {
    return locked ? "locked by " + lock : "unlocked";
  }
}
