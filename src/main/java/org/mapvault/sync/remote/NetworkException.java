/* Copyright 2026 The MapVault Project
 * See LICENSE for licensing information */

package org.mapvault.sync.remote;

import java.io.IOException;

/**
 * Thrown if the remote backend cannot be reached. Operations failing with
 * this exception are retried later.
 */
public class NetworkException extends IOException {

  private static final long serialVersionUID = -3914812052416437719L;

  public NetworkException(String message) {
    super(message);
  }

  public NetworkException(String message, Throwable cause) {
    super(message, cause);
  }
}
