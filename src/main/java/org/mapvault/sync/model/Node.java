/* Copyright 2026 The MapVault Project
 * See LICENSE for licensing information */

package org.mapvault.sync.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * One item in a map's tree. The {@code id} stays the same across moves and
 * renames, so links to it survive edits.
 */
@JsonPropertyOrder({ "id", "parent_id", "title", "content", "order",
    "modified_at" })
public class Node {

  private String id;

  /** Parent node in the same map, or {@code null} for a top-level node. */
  private String parentId;

  private String title;

  private String content;

  /** Position among siblings. */
  private int order;

  private long modifiedAt;

  public Node() { /* for deserialization */ }

  /** Create a node with the given values. */
  public static Node of(String id, String parentId, String title,
      String content, int order, long modifiedAt) {
    Node node = new Node();
    node.id = id;
    node.parentId = parentId;
    node.title = title;
    node.content = content;
    node.order = order;
    node.modifiedAt = modifiedAt;
    return node;
  }

  public Node copy() {
    return of(this.id, this.parentId, this.title, this.content, this.order,
        this.modifiedAt);
  }

  public String getId() {
    return id;
  }

  public String getParentId() {
    return parentId;
  }

  public void setParentId(String parentId) {
    this.parentId = parentId;
  }

  public String getTitle() {
    return title;
  }

  public void setTitle(String title) {
    this.title = title;
  }

  public String getContent() {
    return content;
  }

  public void setContent(String content) {
    this.content = content;
  }

  public int getOrder() {
    return order;
  }

  public void setOrder(int order) {
    this.order = order;
  }

  public long getModifiedAt() {
    return modifiedAt;
  }

  public void setModifiedAt(long modifiedAt) {
    this.modifiedAt = modifiedAt;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof Node)) {
      return false;
    }
    Node that = (Node) other;
    return this.order == that.order && this.modifiedAt == that.modifiedAt
        && Objects.equals(this.id, that.id)
        && Objects.equals(this.parentId, that.parentId)
        && Objects.equals(this.title, that.title)
        && Objects.equals(this.content, that.content);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, parentId, title, content, order, modifiedAt);
  }

  @Override
  public String toString() {
    return "Node[" + id + ", parent=" + parentId + ", title=" + title + "]";
  }
}
