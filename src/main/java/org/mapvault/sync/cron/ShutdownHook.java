/* Copyright 2026 The MapVault Project
 * See LICENSE for licensing information */

package org.mapvault.sync.cron;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Closes the sync engine on JVM shutdown.
 */
public final class ShutdownHook extends Thread {

  private static final Logger log = LoggerFactory.getLogger(ShutdownHook.class);

  private final AutoCloseable engine;

  /** Names the shutdown thread for debugging purposes. */
  public ShutdownHook(AutoCloseable engine) {
    super("MapVault-ShutdownThread");
    this.engine = engine;
  }

  @Override
  public void run() {
    log.info("Shutdown in progress ... ");
    try {
      this.engine.close();
    } catch (Exception e) {
      log.error("Shutdown failed: " + e.getMessage(), e);
    }
    log.info("Shutdown finished. Exiting.");
  }
}
