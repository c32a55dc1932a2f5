/* Copyright 2026 The MapVault Project
 * See LICENSE for licensing information */

package org.mapvault.sync.lock;

import org.mapvault.sync.model.Lock;

/**
 * Thrown if a vault lock cannot be acquired because another client holds an
 * unexpired lock.
 */
public class LockHeldException extends Exception {

  private static final long serialVersionUID = -6120436651405887032L;

  private final transient Lock holder;

  /** The holder is {@code null} if it is unknown. */
  public LockHeldException(String message, Lock holder) {
    super(message);
    this.holder = holder;
  }

  public Lock getHolder() {
    return holder;
  }
}
