/* Copyright 2026 The MapVault Project
 * See LICENSE for licensing information */

package org.mapvault.sync.model;

/** Side whose version of a map survived a conflict. */
public enum Winner {
  LOCAL,
  REMOTE
}
