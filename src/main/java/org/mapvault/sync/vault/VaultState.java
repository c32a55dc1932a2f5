/* Copyright 2026 The MapVault Project
 * See LICENSE for licensing information */

package org.mapvault.sync.vault;

/** Lifecycle of the active vault. */
public enum VaultState {

  /** No vault is open. */
  CLOSED,

  /** The local copy is being loaded and reconciled with the remote. */
  LOADING,

  /** The vault can be used; background sync continues. */
  READY
}
