/* Copyright 2026 The MapVault Project
 * See LICENSE for licensing information */

package org.mapvault.sync.remote;

import org.mapvault.sync.model.Lock;
import org.mapvault.sync.model.MapPayload;

import java.io.IOException;
import java.util.List;

/**
 * Access to the remote backend holding one folder per vault and one file
 * per map. Implementations signal unreachable backends with
 * {@link NetworkException} and failed preconditions with
 * {@link RevisionMismatchException}.
 */
public interface RemoteAdapter {

  /** Expected revision of a file that must not exist yet. */
  String ABSENT = "";

  /** List all map files of a vault; empty if the folder does not exist. */
  List<RemoteFile> listFiles(String vaultId) throws IOException;

  /** Read one map file, or return {@code null} if it does not exist. */
  MapPayload readFile(String vaultId, String fileId) throws IOException;

  /**
   * Write a map file.
   *
   * @param expectedRevision {@code null} for an unconditional write,
   *     {@link #ABSENT} if the file must not exist, or the revision the file
   *     must currently have.
   */
  WriteResult writeFile(String vaultId, String fileId, MapPayload payload,
      String expectedRevision) throws IOException;

  /** Delete a map file; deleting a missing file succeeds. */
  void deleteFile(String vaultId, String fileId) throws IOException;

  /**
   * Return the vault-level timestamp which advances on every remote write,
   * or 0 if the vault has never been written.
   */
  long getVaultTimestamp(String vaultId) throws IOException;

  /** Return the current vault lock, or {@code null}. */
  Lock readLock(String vaultId) throws IOException;

  /**
   * Replace the vault lock if the current lock has the expected id, or if
   * there is no lock and the expected id is {@code null}.
   *
   * @return Whether the lock was replaced.
   */
  boolean compareAndSetLock(String vaultId, String expectedLockId,
      Lock lock) throws IOException;

  /** Delete the vault lock if it still has the given id. */
  void deleteLock(String vaultId, String lockId) throws IOException;
}
