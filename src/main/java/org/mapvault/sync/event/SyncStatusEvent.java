/* Copyright 2026 The MapVault Project
 * See LICENSE for licensing information */

package org.mapvault.sync.event;

public final class SyncStatusEvent {

  private final String mapId;

  private final SyncStatus status;

  public SyncStatusEvent(String mapId, SyncStatus status) {
    this.mapId = mapId;
    this.status = status;
  }

  public String getMapId() {
    return mapId;
  }

  public SyncStatus getStatus() {
    return status;
  }

  @Override
  public String toString() {
    return mapId + ": " + status;
  }
}
