/* Copyright 2026 The MapVault Project
 * See LICENSE for licensing information */

package org.mapvault.sync.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A map as kept in the local store: its content plus the sync bookkeeping
 * needed to resume after a restart.
 *
 * <p>{@code lastSyncedAt} never exceeds {@code localModifiedAt}; the map
 * has unsynchronized changes exactly when it is smaller.</p>
 */
@JsonPropertyOrder({ "id", "vault_id", "title", "local_modified_at",
    "last_synced_at", "remote_revision", "nodes", "edges" })
public class MapDocument {

  private String id;

  private String vaultId;

  private String title;

  private long localModifiedAt;

  private long lastSyncedAt;

  /** Opaque remote version marker, {@code null} until first pushed. */
  private String remoteRevision;

  private List<Node> nodes = new ArrayList<>();

  private List<Edge> edges = new ArrayList<>();

  public MapDocument() { /* for deserialization */ }

  /** Create an empty, never synced map. */
  public static MapDocument create(String id, String vaultId, String title,
      long now) {
    MapDocument map = new MapDocument();
    map.id = id;
    map.vaultId = vaultId;
    map.title = title;
    map.localModifiedAt = now;
    map.lastSyncedAt = 0L;
    return map;
  }

  /**
   * Create a clean map from remote content, stamped with the remote
   * modification time and revision.
   */
  public static MapDocument fromPayload(MapPayload payload,
      long remoteModifiedTime, String revision) {
    MapDocument map = new MapDocument();
    map.id = payload.getId();
    map.vaultId = payload.getVaultId();
    map.title = payload.getTitle();
    for (Node node : payload.getNodes()) {
      map.nodes.add(node.copy());
    }
    for (Edge edge : payload.getEdges()) {
      map.edges.add(edge.copy());
    }
    map.localModifiedAt = remoteModifiedTime;
    map.lastSyncedAt = remoteModifiedTime;
    map.remoteRevision = revision;
    return map;
  }

  /** Return a deep copy. */
  public MapDocument copy() {
    MapDocument map = new MapDocument();
    map.id = this.id;
    map.vaultId = this.vaultId;
    map.title = this.title;
    map.localModifiedAt = this.localModifiedAt;
    map.lastSyncedAt = this.lastSyncedAt;
    map.remoteRevision = this.remoteRevision;
    for (Node node : this.nodes) {
      map.nodes.add(node.copy());
    }
    for (Edge edge : this.edges) {
      map.edges.add(edge.copy());
    }
    return map;
  }

  /** Return the content that gets written to the remote backend. */
  public MapPayload toPayload() {
    return MapPayload.of(this.id, this.vaultId, this.title,
        this.localModifiedAt, this.nodes, this.edges);
  }

  /** Whether there are local changes that have not been pushed yet. */
  public boolean isDirty() {
    return this.localModifiedAt > this.lastSyncedAt;
  }

  /** Return the node with the given id, or {@code null}. */
  public Node findNode(String nodeId) {
    for (Node node : this.nodes) {
      if (node.getId().equals(nodeId)) {
        return node;
      }
    }
    return null;
  }

  /**
   * Check that node ids are unique, every parent resolves to a node of this
   * map, parent chains are acyclic, and every edge connects two nodes of
   * this map.
   *
   * @return Description of the first problem found, or {@code null} if the
   *     map is consistent.
   */
  public String checkIntegrity() {
    Map<String, String> parents = new HashMap<>();
    for (Node node : this.nodes) {
      if (null == node.getId()) {
        return "Node without id in map " + this.id;
      }
      if (parents.containsKey(node.getId())) {
        return "Duplicate node " + node.getId() + " in map " + this.id;
      }
      parents.put(node.getId(), node.getParentId());
    }
    for (Map.Entry<String, String> entry : parents.entrySet()) {
      String parent = entry.getValue();
      if (null != parent && !parents.containsKey(parent)) {
        return "Parent " + parent + " of node " + entry.getKey()
            + " is not in map " + this.id;
      }
      Set<String> seen = new HashSet<>();
      String current = entry.getKey();
      while (null != current) {
        if (!seen.add(current)) {
          return "Cycle in parent chain of node " + entry.getKey()
              + " in map " + this.id;
        }
        current = parents.get(current);
      }
    }
    for (Edge edge : this.edges) {
      if (!parents.containsKey(edge.getSourceId())
          || !parents.containsKey(edge.getTargetId())) {
        return "Edge " + edge.getId() + " does not connect two nodes of map "
            + this.id;
      }
    }
    return null;
  }

  public String getId() {
    return id;
  }

  public String getVaultId() {
    return vaultId;
  }

  public String getTitle() {
    return title;
  }

  public void setTitle(String title) {
    this.title = title;
  }

  public long getLocalModifiedAt() {
    return localModifiedAt;
  }

  public void setLocalModifiedAt(long localModifiedAt) {
    this.localModifiedAt = localModifiedAt;
  }

  public long getLastSyncedAt() {
    return lastSyncedAt;
  }

  public void setLastSyncedAt(long lastSyncedAt) {
    this.lastSyncedAt = lastSyncedAt;
  }

  public String getRemoteRevision() {
    return remoteRevision;
  }

  public void setRemoteRevision(String remoteRevision) {
    this.remoteRevision = remoteRevision;
  }

  public List<Node> getNodes() {
    return nodes;
  }

  public List<Edge> getEdges() {
    return edges;
  }

  @Override
  public String toString() {
    return "MapDocument[" + id + " in " + vaultId + ", title=" + title
        + ", modified=" + localModifiedAt + ", synced=" + lastSyncedAt
        + ", revision=" + remoteRevision + "]";
  }
}
