/* Copyright 2026 The MapVault Project
 * See LICENSE for licensing information */

package org.mapvault.sync.model;

/**
 * Changes to apply to one node. Unset fields stay as they are.
 */
public final class NodeUpdate {

  private String title;

  private String content;

  private boolean move;

  private String parentId;

  private Integer order;

  private NodeUpdate() {}

  public static NodeUpdate create() {
    return new NodeUpdate();
  }

  public NodeUpdate title(String title) {
    this.title = title;
    return this;
  }

  public NodeUpdate content(String content) {
    this.content = content;
    return this;
  }

  /** Move the node below the given parent, or to the top for {@code null}. */
  public NodeUpdate parent(String parentId) {
    this.move = true;
    this.parentId = parentId;
    return this;
  }

  public NodeUpdate order(int order) {
    this.order = order;
    return this;
  }

  /** Apply the changes to the given node and stamp it. */
  public void applyTo(Node node, long now) {
    if (null != this.title) {
      node.setTitle(this.title);
    }
    if (null != this.content) {
      node.setContent(this.content);
    }
    if (this.move) {
      node.setParentId(this.parentId);
    }
    if (null != this.order) {
      node.setOrder(this.order);
    }
    node.setModifiedAt(now);
  }
}
