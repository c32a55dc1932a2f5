/* Copyright 2026 The MapVault Project
 * See LICENSE for licensing information */

package org.mapvault.sync.model;

/**
 * Search result naming the matching map and, if the match was in a node,
 * that node.
 */
public final class SearchHit {

  private final String mapId;

  private final String mapTitle;

  private final String nodeId;

  private final String text;

  public SearchHit(String mapId, String mapTitle, String nodeId,
      String text) {
    this.mapId = mapId;
    this.mapTitle = mapTitle;
    this.nodeId = nodeId;
    this.text = text;
  }

  public String getMapId() {
    return mapId;
  }

  public String getMapTitle() {
    return mapTitle;
  }

  /** Matching node, or {@code null} if the map title matched. */
  public String getNodeId() {
    return nodeId;
  }

  /** Matched title or content. */
  public String getText() {
    return text;
  }

  @Override
  public String toString() {
    return "SearchHit[" + mapId + (null == nodeId ? "" : "/" + nodeId)
        + ": " + text + "]";
  }
}
