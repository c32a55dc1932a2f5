/* Copyright 2026 The MapVault Project
 * See LICENSE for licensing information */

package org.mapvault.sync.queue;

import static org.junit.Assert.assertEquals;

import org.junit.Test;

public class BackoffTest {

  @Test()
  public void testDoublesUpToCap() {
    Backoff backoff = new Backoff(1_000L, 60_000L);
    long[] expected = new long[] { 1_000L, 2_000L, 4_000L, 8_000L, 16_000L,
        32_000L, 60_000L, 60_000L };
    for (int attempt = 1; attempt <= expected.length; attempt++) {
      assertEquals("attempt " + attempt, expected[attempt - 1],
          backoff.delayMillis(attempt));
    }
  }

  @Test()
  public void testLargeAttemptsStayCapped() {
    Backoff backoff = new Backoff(1_000L, 60_000L);
    assertEquals(60_000L, backoff.delayMillis(100));
    assertEquals(60_000L, backoff.delayMillis(Integer.MAX_VALUE));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testInvalidBounds() {
    new Backoff(10_000L, 1_000L);
  }
}
