/* Copyright 2026 The MapVault Project
 * See LICENSE for licensing information */

package org.mapvault.sync.persist;

/**
 * Local storage failed, e.g. because the disk is full or a document could
 * not be serialized. Fatal to the single operation, never retried.
 */
public class LocalStorageException extends Exception {

  public LocalStorageException(String msg) {
    super(msg);
  }

  public LocalStorageException(String msg, Exception ex) {
    super(msg, ex);
  }

}
