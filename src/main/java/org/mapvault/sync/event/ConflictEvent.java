/* Copyright 2026 The MapVault Project
 * See LICENSE for licensing information */

package org.mapvault.sync.event;

import org.mapvault.sync.model.Winner;

/** Notification that a conflict on a map was resolved. */
public final class ConflictEvent {

  private final String mapId;

  private final Winner winner;

  private final String backupRef;

  /** The backup reference is {@code null} unless the remote side won. */
  public ConflictEvent(String mapId, Winner winner, String backupRef) {
    this.mapId = mapId;
    this.winner = winner;
    this.backupRef = backupRef;
  }

  public String getMapId() {
    return mapId;
  }

  public Winner getWinner() {
    return winner;
  }

  public String getBackupRef() {
    return backupRef;
  }

  @Override
  public String toString() {
    return mapId + ": " + winner + (null == backupRef ? ""
        : " (backup " + backupRef + ")");
  }
}
