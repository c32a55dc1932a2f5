/* Copyright 2026 The MapVault Project
 * See LICENSE for licensing information */

package org.mapvault.sync.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Link between two nodes of the same map.
 */
@JsonPropertyOrder({ "id", "source_id", "target_id", "label" })
public class Edge {

  private String id;

  private String sourceId;

  private String targetId;

  private String label;

  public Edge() { /* for deserialization */ }

  /** Create an edge with the given values. */
  public static Edge of(String id, String sourceId, String targetId,
      String label) {
    Edge edge = new Edge();
    edge.id = id;
    edge.sourceId = sourceId;
    edge.targetId = targetId;
    edge.label = label;
    return edge;
  }

  public Edge copy() {
    return of(this.id, this.sourceId, this.targetId, this.label);
  }

  public String getId() {
    return id;
  }

  public String getSourceId() {
    return sourceId;
  }

  public String getTargetId() {
    return targetId;
  }

  public String getLabel() {
    return label;
  }

  /** Whether this edge starts or ends at the given node. */
  public boolean touches(String nodeId) {
    return nodeId.equals(sourceId) || nodeId.equals(targetId);
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof Edge)) {
      return false;
    }
    Edge that = (Edge) other;
    return Objects.equals(this.id, that.id)
        && Objects.equals(this.sourceId, that.sourceId)
        && Objects.equals(this.targetId, that.targetId)
        && Objects.equals(this.label, that.label);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, sourceId, targetId, label);
  }
}
