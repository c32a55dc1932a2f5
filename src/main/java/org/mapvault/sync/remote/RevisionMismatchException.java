/* Copyright 2026 The MapVault Project
 * See LICENSE for licensing information */

package org.mapvault.sync.remote;

import java.io.IOException;

/**
 * Thrown by a conditional write if the remote file no longer has the
 * expected revision.
 */
public class RevisionMismatchException extends IOException {

  private static final long serialVersionUID = 5203386441117356862L;

  private final String actualRevision;

  /** The actual revision is {@code null} if the file does not exist. */
  public RevisionMismatchException(String message, String actualRevision) {
    super(message);
    this.actualRevision = actualRevision;
  }

  public String getActualRevision() {
    return actualRevision;
  }
}
