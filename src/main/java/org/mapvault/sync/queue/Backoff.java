/* Copyright 2026 The MapVault Project
 * See LICENSE for licensing information */

package org.mapvault.sync.queue;

/** Capped exponential retry delays: initial, twice that, and so on. */
public final class Backoff {

  private final long initialMillis;

  private final long maxMillis;

  /** Create a backoff policy. */
  public Backoff(long initialMillis, long maxMillis) {
    if (initialMillis <= 0L || maxMillis < initialMillis) {
      throw new IllegalArgumentException("Invalid backoff " + initialMillis
          + "/" + maxMillis);
    }
    this.initialMillis = initialMillis;
    this.maxMillis = maxMillis;
  }

  /** Delay before the given retry, counting from 1. */
  public long delayMillis(int attempt) {
    int shift = Math.min(Math.max(attempt, 1) - 1, 30);
    return Math.min(this.initialMillis << shift, this.maxMillis);
  }
}
