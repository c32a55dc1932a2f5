/* Copyright 2026 The MapVault Project
 * See LICENSE for licensing information */

package org.mapvault.sync.conflict;

import org.mapvault.sync.model.Winner;

/** One line of the resolution log. */
public class ResolutionEntry {

  private String mapId;

  private String vaultId;

  private Winner winner;

  private String discardedBackupRef;

  private long localModifiedAt;

  private long remoteModifiedTime;

  private long resolvedAt;

  public ResolutionEntry() { /* for deserialization */ }

  /** Create a log entry. */
  public static ResolutionEntry of(String vaultId, String mapId,
      Winner winner, String discardedBackupRef, long localModifiedAt,
      long remoteModifiedTime, long resolvedAt) {
    ResolutionEntry entry = new ResolutionEntry();
    entry.vaultId = vaultId;
    entry.mapId = mapId;
    entry.winner = winner;
    entry.discardedBackupRef = discardedBackupRef;
    entry.localModifiedAt = localModifiedAt;
    entry.remoteModifiedTime = remoteModifiedTime;
    entry.resolvedAt = resolvedAt;
    return entry;
  }

  public String getMapId() {
    return mapId;
  }

  public String getVaultId() {
    return vaultId;
  }

  public Winner getWinner() {
    return winner;
  }

  public String getDiscardedBackupRef() {
    return discardedBackupRef;
  }

  public long getLocalModifiedAt() {
    return localModifiedAt;
  }

  public long getRemoteModifiedTime() {
    return remoteModifiedTime;
  }

  public long getResolvedAt() {
    return resolvedAt;
  }
}
