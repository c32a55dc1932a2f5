/* Copyright 2026 The MapVault Project
 * See LICENSE for licensing information */

package org.mapvault.sync.remote;

/** Outcome of a successful remote write. */
public final class WriteResult {

  private final String revision;

  private final long modifiedTime;

  public WriteResult(String revision, long modifiedTime) {
    this.revision = revision;
    this.modifiedTime = modifiedTime;
  }

  public String getRevision() {
    return revision;
  }

  public long getModifiedTime() {
    return modifiedTime;
  }
}
