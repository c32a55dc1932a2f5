/* Copyright 2026 The MapVault Project
 * See LICENSE for licensing information */

package org.mapvault.sync.conflict;

/** Result of handing one map to the conflict resolver. */
public final class Resolution {

  /** What happened to the map. */
  public enum Outcome {

    /** Remote and local content were already equal. */
    IN_SYNC,

    /** The local version is newer and was pushed, or is left for a push. */
    LOCAL_WON,

    /** The remote version replaced local edits, which were backed up. */
    REMOTE_WON,

    /** The local copy had no edits and was updated from remote. */
    PULLED,

    /** The local copy changed or vanished during resolution. */
    SKIPPED
  }

  private final Outcome outcome;

  private final String revision;

  private final String backupRef;

  private final long supersededModifiedAt;

  Resolution(Outcome outcome, String revision, String backupRef) {
    this(outcome, revision, backupRef, -1L);
  }

  Resolution(Outcome outcome, String revision, String backupRef,
      long supersededModifiedAt) {
    this.outcome = outcome;
    this.revision = revision;
    this.backupRef = backupRef;
    this.supersededModifiedAt = supersededModifiedAt;
  }

  /** Resolution that involved neither a backup nor a revision change. */
  public static Resolution of(Outcome outcome) {
    return new Resolution(outcome, null, null);
  }

  public Outcome getOutcome() {
    return outcome;
  }

  /** Remote revision the local copy now refers to, if changed. */
  public String getRevision() {
    return revision;
  }

  /** Reference of the backup taken, if the remote side won. */
  public String getBackupRef() {
    return backupRef;
  }

  /**
   * Modification time of the local version the remote side replaced, or -1
   * unless the remote side won. Local edits up to this time are in the
   * backup; later ones were made on top of the remote version.
   */
  public long getSupersededModifiedAt() {
    return supersededModifiedAt;
  }

  @Override
  public String toString() {
    return outcome + (null == backupRef ? "" : " (" + backupRef + ")");
  }
}
