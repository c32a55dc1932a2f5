/* Copyright 2026 The MapVault Project
 * See LICENSE for licensing information */

package org.mapvault.sync.model;

public enum OperationKind {

  CREATE,
  UPDATE,
  DELETE

}
