/* Copyright 2026 The MapVault Project
 * See LICENSE for licensing information */

package org.mapvault.sync.event;

/** Sync status of one map as seen by the caller layer. */
public enum SyncStatus {

  /** Local and remote agree. */
  CLEAN,

  /** Local edits wait for upload, possibly after a failed attempt. */
  PENDING,

  /** An upload is in flight. */
  SYNCING,

  /** The last sync replaced local edits with a newer remote version. */
  CONFLICTED
}
