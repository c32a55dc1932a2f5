/* Copyright 2026 The MapVault Project
 * See LICENSE for licensing information */

package org.mapvault.sync.remote;

import org.mapvault.sync.model.Lock;
import org.mapvault.sync.model.MapPayload;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wraps a remote adapter, counts calls, and can pretend the network is
 * down or hold up listings.
 */
public class CountingRemoteAdapter implements RemoteAdapter {

  private final RemoteAdapter delegate;

  private final AtomicBoolean reachable = new AtomicBoolean(true);

  public final AtomicInteger listCalls = new AtomicInteger();

  public final AtomicInteger readCalls = new AtomicInteger();

  public final AtomicInteger writeCalls = new AtomicInteger();

  public final AtomicInteger deleteCalls = new AtomicInteger();

  public final AtomicInteger lockWrites = new AtomicInteger();

  public final List<MapPayload> written = new CopyOnWriteArrayList<>();

  private volatile CountDownLatch listingStarted;

  private volatile CountDownLatch listingReleased;

  public CountingRemoteAdapter(RemoteAdapter delegate) {
    this.delegate = delegate;
  }

  public void setReachable(boolean reachable) {
    this.reachable.set(reachable);
  }

  /** Make the next listings wait for {@code released} after signalling. */
  public void holdListings(CountDownLatch started, CountDownLatch released) {
    this.listingStarted = started;
    this.listingReleased = released;
  }

  /** Reset all counters. */
  public void reset() {
    listCalls.set(0);
    readCalls.set(0);
    writeCalls.set(0);
    deleteCalls.set(0);
    lockWrites.set(0);
    written.clear();
  }

  private void check() throws NetworkException {
    if (!this.reachable.get()) {
      throw new NetworkException("Simulated network outage.");
    }
  }

  @Override
  public List<RemoteFile> listFiles(String vaultId) throws IOException {
    check();
    listCalls.incrementAndGet();
    CountDownLatch started = this.listingStarted;
    CountDownLatch released = this.listingReleased;
    if (null != started && null != released) {
      started.countDown();
      try {
        released.await(10L, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new NetworkException("Interrupted.", e);
      }
    }
    return delegate.listFiles(vaultId);
  }

  @Override
  public MapPayload readFile(String vaultId, String fileId)
      throws IOException {
    check();
    readCalls.incrementAndGet();
    return delegate.readFile(vaultId, fileId);
  }

  @Override
  public WriteResult writeFile(String vaultId, String fileId,
      MapPayload payload, String expectedRevision) throws IOException {
    check();
    writeCalls.incrementAndGet();
    WriteResult result = delegate.writeFile(vaultId, fileId, payload,
        expectedRevision);
    written.add(payload);
    return result;
  }

  @Override
  public void deleteFile(String vaultId, String fileId) throws IOException {
    check();
    deleteCalls.incrementAndGet();
    delegate.deleteFile(vaultId, fileId);
  }

  @Override
  public long getVaultTimestamp(String vaultId) throws IOException {
    check();
    return delegate.getVaultTimestamp(vaultId);
  }

  @Override
  public Lock readLock(String vaultId) throws IOException {
    check();
    return delegate.readLock(vaultId);
  }

  @Override
  public boolean compareAndSetLock(String vaultId, String expectedLockId,
      Lock lock) throws IOException {
    check();
    lockWrites.incrementAndGet();
    return delegate.compareAndSetLock(vaultId, expectedLockId, lock);
  }

  @Override
  public void deleteLock(String vaultId, String lockId) throws IOException {
    check();
    delegate.deleteLock(vaultId, lockId);
  }
}
