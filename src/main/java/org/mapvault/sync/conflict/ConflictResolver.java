/* Copyright 2026 The MapVault Project
 * See LICENSE for licensing information */

package org.mapvault.sync.conflict;

import org.mapvault.sync.event.SyncEvents;
import org.mapvault.sync.event.SyncStatus;
import org.mapvault.sync.model.MapDocument;
import org.mapvault.sync.model.MapPayload;
import org.mapvault.sync.model.Winner;
import org.mapvault.sync.persist.LocalStorageException;
import org.mapvault.sync.persist.LocalStore;
import org.mapvault.sync.remote.RemoteAdapter;
import org.mapvault.sync.remote.RemoteFile;
import org.mapvault.sync.remote.WriteResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;

/**
 * Whole-document latest-write-wins between the local copy of a map and a
 * diverging remote version.
 *
 * <p>If the local copy was modified strictly later than the remote file it
 * is pushed over it, conditional on the remote revision just observed.
 * Otherwise, including ties, the local copy is backed up and replaced by the
 * remote version. Both outcomes are logged and reported to listeners.</p>
 */
public class ConflictResolver {

  private static final Logger logger = LoggerFactory.getLogger(
      ConflictResolver.class);

  private final LocalStore store;

  private final RemoteAdapter remote;

  private final BackupStore backups;

  private final ResolutionLog resolutionLog;

  private final SyncEvents events;

  private final Clock clock;

  /** Create a resolver working on the given store and remote. */
  public ConflictResolver(LocalStore store, RemoteAdapter remote,
      BackupStore backups, ResolutionLog resolutionLog, SyncEvents events,
      Clock clock) {
    this.store = store;
    this.remote = remote;
    this.backups = backups;
    this.resolutionLog = resolutionLog;
    this.events = events;
    this.clock = clock;
  }

  /**
   * Resolve the local copy of a map against a remote version.
   *
   * @param remoteFile Listing entry of the remote version.
   * @param remotePayload Content of the remote version.
   * @param pushLocal Whether a newer local version is pushed right away, or
   *     left dirty for the sync worker.
   * @throws IOException Thrown if pushing fails, including a
   *     {@link org.mapvault.sync.remote.RevisionMismatchException} if the
   *     remote changed once more.
   */
  public Resolution resolve(String vaultId, RemoteFile remoteFile,
      MapPayload remotePayload, boolean pushLocal)
      throws IOException, LocalStorageException {
    String mapId = remoteFile.getFileId();
    MapDocument local = this.store.getMap(mapId);
    if (null == local) {
      logger.debug("Map {} vanished locally during resolution.", mapId);
      return new Resolution(Resolution.Outcome.SKIPPED, null, null);
    }
    if (local.toPayload().sameContent(remotePayload)) {
      this.store.markSynced(mapId, local.getLocalModifiedAt(),
          remoteFile.getRevision());
      return new Resolution(Resolution.Outcome.IN_SYNC,
          remoteFile.getRevision(), null);
    }
    if (!local.isDirty()) {
      if (null == this.store.replaceIfUnchanged(remotePayload,
          remoteFile.getModifiedTime(), remoteFile.getRevision(),
          local.getLocalModifiedAt())) {
        return new Resolution(Resolution.Outcome.SKIPPED, null, null);
      }
      return new Resolution(Resolution.Outcome.PULLED,
          remoteFile.getRevision(), null);
    }
    if (local.getLocalModifiedAt() > remoteFile.getModifiedTime()) {
      return localWins(vaultId, local, remoteFile, pushLocal);
    }
    return remoteWins(vaultId, local, remoteFile, remotePayload);
  }

  private Resolution localWins(String vaultId, MapDocument local,
      RemoteFile remoteFile, boolean pushLocal)
      throws IOException, LocalStorageException {
    if (!pushLocal) {
      logger.debug("Local version of map {} is newer; leaving it for upload.",
          local.getId());
      return new Resolution(Resolution.Outcome.LOCAL_WON, null, null);
    }
    WriteResult result = this.remote.writeFile(vaultId, local.getId(),
        local.toPayload(), remoteFile.getRevision());
    this.store.markSynced(local.getId(), local.getLocalModifiedAt(),
        result.getRevision());
    this.resolutionLog.append(ResolutionEntry.of(vaultId, local.getId(),
        Winner.LOCAL, null, local.getLocalModifiedAt(),
        remoteFile.getModifiedTime(), this.clock.millis()));
    logger.info("Conflict on map {} resolved: local version ({}) replaced "
        + "remote version ({}).", local.getId(), local.getLocalModifiedAt(),
        remoteFile.getModifiedTime());
    this.events.conflictResolved(local.getId(), Winner.LOCAL, null);
    return new Resolution(Resolution.Outcome.LOCAL_WON, result.getRevision(),
        null);
  }

  private Resolution remoteWins(String vaultId, MapDocument local,
      RemoteFile remoteFile, MapPayload remotePayload)
      throws LocalStorageException {
    String backupRef = this.backups.save(local);
    if (null == this.store.replaceIfUnchanged(remotePayload,
        remoteFile.getModifiedTime(), remoteFile.getRevision(),
        local.getLocalModifiedAt())) {
      logger.debug("Map {} changed during resolution; keeping the newer "
          + "local edit.", local.getId());
      return new Resolution(Resolution.Outcome.SKIPPED, null, null);
    }
    this.resolutionLog.append(ResolutionEntry.of(vaultId, local.getId(),
        Winner.REMOTE, backupRef, local.getLocalModifiedAt(),
        remoteFile.getModifiedTime(), this.clock.millis()));
    logger.info("Conflict on map {} resolved: remote version ({}) replaced "
        + "local version ({}), backup {}.", local.getId(),
        remoteFile.getModifiedTime(), local.getLocalModifiedAt(), backupRef);
    this.events.updateStatus(local.getId(), SyncStatus.CONFLICTED);
    this.events.conflictResolved(local.getId(), Winner.REMOTE, backupRef);
    return new Resolution(Resolution.Outcome.REMOTE_WON,
        remoteFile.getRevision(), backupRef, local.getLocalModifiedAt());
  }
}
