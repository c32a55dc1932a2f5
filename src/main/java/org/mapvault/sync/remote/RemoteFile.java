/* Copyright 2026 The MapVault Project
 * See LICENSE for licensing information */

package org.mapvault.sync.remote;

/** Listing entry of one map file in a remote vault folder. */
public final class RemoteFile {

  private final String fileId;

  private final long modifiedTime;

  private final String revision;

  /** Create a listing entry. */
  public RemoteFile(String fileId, long modifiedTime, String revision) {
    this.fileId = fileId;
    this.modifiedTime = modifiedTime;
    this.revision = revision;
  }

  public String getFileId() {
    return fileId;
  }

  public long getModifiedTime() {
    return modifiedTime;
  }

  public String getRevision() {
    return revision;
  }

  @Override
  public String toString() {
    return fileId + "@" + revision + " (" + modifiedTime + ")";
  }
}
