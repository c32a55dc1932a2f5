/* Copyright 2026 The MapVault Project
 * See LICENSE for licensing information */

package org.mapvault.sync.persist;

/**
 * A stored map could not be deserialized or is internally inconsistent.
 * The vault it belongs to gets re-pulled from the remote backend.
 */
public class CorruptionDetectedException extends LocalStorageException {

  private final String vaultId;

  public CorruptionDetectedException(String vaultId, String msg) {
    super(msg);
    this.vaultId = vaultId;
  }

  public CorruptionDetectedException(String vaultId, String msg,
      Exception ex) {
    super(msg, ex);
    this.vaultId = vaultId;
  }

  public String getVaultId() {
    return vaultId;
  }

}
