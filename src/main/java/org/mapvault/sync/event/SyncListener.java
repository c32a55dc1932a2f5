/* Copyright 2026 The MapVault Project
 * See LICENSE for licensing information */

package org.mapvault.sync.event;

/**
 * Callbacks from the sync engine. Callbacks run on engine threads and must
 * return quickly.
 */
public interface SyncListener {

  default void onSyncStatusChanged(SyncStatusEvent event) {
  }

  default void onConflictResolved(ConflictEvent event) {
  }
}
