/* Copyright 2026 The MapVault Project
 * See LICENSE for licensing information */

package org.mapvault.sync.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Content of a map as written to the remote backend, without the
 * device-local sync bookkeeping.
 */
@JsonPropertyOrder({ "id", "vault_id", "title", "modified_at", "nodes",
    "edges" })
public class MapPayload {

  private String id;

  private String vaultId;

  private String title;

  /** Time of the last content change, used for latest-write-wins. */
  private long modifiedAt;

  private List<Node> nodes = new ArrayList<>();

  private List<Edge> edges = new ArrayList<>();

  public MapPayload() { /* for deserialization */ }

  /** Create a payload with deep copies of the given nodes and edges. */
  public static MapPayload of(String id, String vaultId, String title,
      long modifiedAt, List<Node> nodes, List<Edge> edges) {
    MapPayload payload = new MapPayload();
    payload.id = id;
    payload.vaultId = vaultId;
    payload.title = title;
    payload.modifiedAt = modifiedAt;
    for (Node node : nodes) {
      payload.nodes.add(node.copy());
    }
    for (Edge edge : edges) {
      payload.edges.add(edge.copy());
    }
    return payload;
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

  public long getModifiedAt() {
    return modifiedAt;
  }

  public List<Node> getNodes() {
    return nodes;
  }

  public List<Edge> getEdges() {
    return edges;
  }

  /**
   * Whether the other payload has the same title, nodes and edges,
   * regardless of its modification time.
   */
  public boolean sameContent(MapPayload other) {
    return null != other && Objects.equals(this.id, other.id)
        && Objects.equals(this.title, other.title)
        && Objects.equals(this.nodes, other.nodes)
        && Objects.equals(this.edges, other.edges);
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof MapPayload)) {
      return false;
    }
    MapPayload that = (MapPayload) other;
    return this.modifiedAt == that.modifiedAt
        && Objects.equals(this.vaultId, that.vaultId) && sameContent(that);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, vaultId, title, modifiedAt, nodes, edges);
  }
}
