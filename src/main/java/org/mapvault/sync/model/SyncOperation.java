/* Copyright 2026 The MapVault Project
 * See LICENSE for licensing information */

package org.mapvault.sync.model;

/**
 * Local mutation awaiting propagation to the remote backend. Create and
 * update operations carry a snapshot of the map taken at enqueue time.
 */
public final class SyncOperation {

  private final OperationKind kind;

  private final String vaultId;

  private final String mapId;

  private final long enqueuedAt;

  private final MapPayload payload;

  private SyncOperation(OperationKind kind, String vaultId, String mapId,
      long enqueuedAt, MapPayload payload) {
    this.kind = kind;
    this.vaultId = vaultId;
    this.mapId = mapId;
    this.enqueuedAt = enqueuedAt;
    this.payload = payload;
  }

  public static SyncOperation create(MapDocument map, long now) {
    return new SyncOperation(OperationKind.CREATE, map.getVaultId(),
        map.getId(), now, map.toPayload());
  }

  public static SyncOperation update(MapDocument map, long now) {
    return new SyncOperation(OperationKind.UPDATE, map.getVaultId(),
        map.getId(), now, map.toPayload());
  }

  public static SyncOperation delete(String vaultId, String mapId,
      long now) {
    return new SyncOperation(OperationKind.DELETE, vaultId, mapId, now, null);
  }

  public OperationKind getKind() {
    return kind;
  }

  public String getVaultId() {
    return vaultId;
  }

  public String getMapId() {
    return mapId;
  }

  public long getEnqueuedAt() {
    return enqueuedAt;
  }

  /** Map snapshot, {@code null} for delete operations. */
  public MapPayload getPayload() {
    return payload;
  }

  @Override
  public String toString() {
    return kind + " " + vaultId + "/" + mapId + " @" + enqueuedAt;
  }
}
