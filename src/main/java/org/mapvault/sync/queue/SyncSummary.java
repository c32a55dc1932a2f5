/* Copyright 2026 The MapVault Project
 * See LICENSE for licensing information */

package org.mapvault.sync.queue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Aggregate sync status at one point in time. */
public final class SyncSummary {

  private final boolean online;

  private final boolean syncing;

  private final long lastSyncTime;

  private final int pendingChanges;

  private final int syncedMaps;

  private final List<String> errors;

  SyncSummary(boolean online, boolean syncing, long lastSyncTime,
      int pendingChanges, int syncedMaps, List<String> errors) {
    this.online = online;
    this.syncing = syncing;
    this.lastSyncTime = lastSyncTime;
    this.pendingChanges = pendingChanges;
    this.syncedMaps = syncedMaps;
    this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
  }

  public boolean isOnline() {
    return online;
  }

  public boolean isSyncing() {
    return syncing;
  }

  /** End of the last completed drain, or 0 if there was none. */
  public long getLastSyncTime() {
    return lastSyncTime;
  }

  public int getPendingChanges() {
    return pendingChanges;
  }

  /** Operations completed in the last drain. */
  public int getSyncedMaps() {
    return syncedMaps;
  }

  /** Errors seen in the last drain. */
  public List<String> getErrors() {
    return errors;
  }

  @Override
  public String toString() {
    return "online=" + online + ", syncing=" + syncing + ", lastSyncTime="
        + lastSyncTime + ", pending=" + pendingChanges + ", synced="
        + syncedMaps + ", errors=" + errors.size();
  }
}
