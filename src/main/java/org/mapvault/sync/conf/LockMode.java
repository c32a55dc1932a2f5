/* Copyright 2026 The MapVault Project
 * See LICENSE for licensing information */

package org.mapvault.sync.conf;

/**
 * Where vault locks are kept: on the remote backend, shared by all devices,
 * or as a local marker file for single-device bootstrap.
 */
public enum LockMode {

  Remote,
  Local

}
