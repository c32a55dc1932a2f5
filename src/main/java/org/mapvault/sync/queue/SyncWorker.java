/* Copyright 2026 The MapVault Project
 * See LICENSE for licensing information */

package org.mapvault.sync.queue;

import org.mapvault.sync.conflict.ConflictResolver;
import org.mapvault.sync.conflict.Resolution;
import org.mapvault.sync.cron.Scheduler;
import org.mapvault.sync.event.SyncEvents;
import org.mapvault.sync.event.SyncStatus;
import org.mapvault.sync.model.MapDocument;
import org.mapvault.sync.model.MapPayload;
import org.mapvault.sync.model.OperationKind;
import org.mapvault.sync.model.SyncOperation;
import org.mapvault.sync.persist.LocalStorageException;
import org.mapvault.sync.persist.LocalStore;
import org.mapvault.sync.remote.NetworkException;
import org.mapvault.sync.remote.RemoteAdapter;
import org.mapvault.sync.remote.RemoteFile;
import org.mapvault.sync.remote.RevisionMismatchException;
import org.mapvault.sync.remote.WriteResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drains the operation queue against the remote backend.
 *
 * <p>A drain takes batches of due operations and processes the operations
 * of a batch concurrently, listing each affected vault once per batch. A
 * map is pushed with its known remote revision as precondition if the
 * remote still has that revision; otherwise the conflict resolver decides.
 * Network failures send the operation back to the queue with backoff, and a
 * wake-up is scheduled for the earliest due retry.</p>
 *
 * <p>As a {@link Runnable} the worker performs one drain and logs instead of
 * propagating failures, so that scheduled runs keep going.</p>
 */
public class SyncWorker implements Runnable {

  private static final Logger logger = LoggerFactory.getLogger(
      SyncWorker.class);

  private static final int MAX_CONFLICT_ROUNDS = 3;

  private final LocalStore store;

  private final RemoteAdapter remote;

  private final OperationQueue queue;

  private final ConflictResolver resolver;

  private final SyncEvents events;

  private final Scheduler scheduler;

  private final Clock clock;

  private final int batchSize;

  private final ExecutorService pool;

  private final AtomicBoolean online = new AtomicBoolean(true);

  private final AtomicBoolean drainRequested = new AtomicBoolean(false);

  private final Object drainLock = new Object();

  private volatile boolean syncing = false;

  private volatile long lastSyncTime = 0L;

  private volatile int syncedMaps = 0;

  private volatile List<String> errors = Collections.emptyList();

  private ScheduledFuture<?> wakeUp;

  /** Create a worker; it does nothing until a drain is requested. */
  public SyncWorker(LocalStore store, RemoteAdapter remote,
      OperationQueue queue, ConflictResolver resolver, SyncEvents events,
      Scheduler scheduler, Clock clock, int batchSize) {
    this.store = store;
    this.remote = remote;
    this.queue = queue;
    this.resolver = resolver;
    this.events = events;
    this.scheduler = scheduler;
    this.clock = clock;
    this.batchSize = batchSize;
    this.pool = Executors.newFixedThreadPool(4,
        scheduler.threadFactory("Sync"));
  }

  /**
   * Record a connectivity change. Going online makes all pending
   * operations due and triggers a drain.
   */
  public void setOnline(boolean isOnline) {
    boolean wasOnline = this.online.getAndSet(isOnline);
    if (wasOnline == isOnline) {
      return;
    }
    logger.info("Network is {}.", isOnline ? "back" : "gone");
    if (isOnline) {
      this.queue.resetBackoff();
      requestSync();
    }
  }

  public boolean isOnline() {
    return this.online.get();
  }

  /** Trigger a drain in the background unless one is requested already. */
  public void requestSync() {
    if (!this.online.get() || this.scheduler.isShutdown()) {
      return;
    }
    if (this.drainRequested.compareAndSet(false, true)) {
      this.scheduler.execute(this);
    }
  }

  @Override
  public void run() {
    this.drainRequested.set(false);
    try {
      drain();
    } catch (Throwable th) { // catch all for this scheduled run
      logger.error("Sync run failed: " + th.getMessage(), th);
    }
  }

  /**
   * Process all due operations and return the resulting summary. Drains
   * never overlap; a second caller waits for the running drain.
   */
  public SyncSummary drain() {
    synchronized (this.drainLock) {
      if (!this.online.get()) {
        logger.debug("Offline; not draining {} pending operation(s).",
            this.queue.size());
        return getSummary();
      }
      this.syncing = true;
      List<String> drainErrors = Collections.synchronizedList(
          new ArrayList<>());
      AtomicInteger synced = new AtomicInteger();
      try {
        List<SyncOperation> batch;
        while (this.online.get()
            && !(batch = this.queue.takeBatch(this.batchSize)).isEmpty()) {
          processBatch(batch, synced, drainErrors);
        }
      } finally {
        this.syncing = false;
        this.lastSyncTime = this.clock.millis();
        this.syncedMaps = synced.get();
        this.errors = new ArrayList<>(drainErrors);
      }
      if (synced.get() > 0 || !drainErrors.isEmpty()) {
        logger.info("Sync finished: {} map(s) synced, {} error(s), {} "
            + "pending.", synced.get(), drainErrors.size(),
            this.queue.size());
      }
      scheduleWakeUp();
      return getSummary();
    }
  }

  /** Current aggregate status. */
  public SyncSummary getSummary() {
    return new SyncSummary(this.online.get(), this.syncing,
        this.lastSyncTime, this.queue.size(), this.syncedMaps, this.errors);
  }

  /** Stop the worker threads. */
  public void shutdown() {
    this.pool.shutdown();
    try {
      if (!this.pool.awaitTermination(10L, TimeUnit.SECONDS)) {
        this.pool.shutdownNow();
      }
    } catch (InterruptedException e) {
      this.pool.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  private void processBatch(List<SyncOperation> batch, AtomicInteger synced,
      List<String> drainErrors) {
    Map<String, Map<String, RemoteFile>> listings = new HashMap<>();
    Map<String, IOException> listingFailures = new HashMap<>();
    List<Future<Boolean>> futures = new ArrayList<>();
    List<SyncOperation> submitted = new ArrayList<>();
    for (SyncOperation operation : batch) {
      Map<String, RemoteFile> listing = null;
      if (OperationKind.DELETE != operation.getKind()) {
        IOException failure = listingFailures.get(operation.getVaultId());
        if (null == failure) {
          try {
            listing = listing(listings, operation.getVaultId());
          } catch (IOException e) {
            listingFailures.put(operation.getVaultId(), e);
            failure = e;
          }
        }
        if (null != failure) {
          fail(operation, failure, drainErrors);
          continue;
        }
      }
      Map<String, RemoteFile> files = listing;
      futures.add(this.pool.submit(() -> process(operation, files,
          drainErrors)));
      submitted.add(operation);
    }
    for (int i = 0; i < futures.size(); i++) {
      try {
        if (futures.get(i).get()) {
          synced.incrementAndGet();
        }
      } catch (ExecutionException e) {
        logger.error("Unexpected failure syncing " + submitted.get(i) + ".",
            e.getCause());
        drainErrors.add(submitted.get(i).getMapId() + ": "
            + e.getCause().getMessage());
        this.queue.retry(submitted.get(i));
      } catch (InterruptedException e) {
        logger.warn("Interrupted while waiting for sync of {}.",
            submitted.get(i));
        this.queue.retry(submitted.get(i));
        Thread.currentThread().interrupt();
      }
    }
  }

  private Map<String, RemoteFile> listing(
      Map<String, Map<String, RemoteFile>> listings, String vaultId)
      throws IOException {
    Map<String, RemoteFile> listing = listings.get(vaultId);
    if (null == listing) {
      listing = new HashMap<>();
      for (RemoteFile file : this.remote.listFiles(vaultId)) {
        listing.put(file.getFileId(), file);
      }
      listings.put(vaultId, listing);
    }
    return listing;
  }

  private boolean process(SyncOperation operation,
      Map<String, RemoteFile> listing, List<String> drainErrors) {
    String mapId = operation.getMapId();
    try {
      if (OperationKind.DELETE == operation.getKind()) {
        this.remote.deleteFile(operation.getVaultId(), mapId);
        this.store.clearTombstone(operation.getVaultId(), mapId);
        this.queue.complete(operation);
        this.events.forget(mapId);
        logger.debug("Deleted remote copy of map {}.", mapId);
        return true;
      }
      this.events.updateStatus(mapId, SyncStatus.SYNCING);
      Resolution resolution = pushMap(operation.getVaultId(), mapId,
          listing.get(mapId));
      this.queue.complete(operation);
      if (Resolution.Outcome.REMOTE_WON == resolution.getOutcome()) {
        this.queue.discardIfNotNewer(mapId,
            resolution.getSupersededModifiedAt());
      } else {
        MapDocument map = this.store.getMap(mapId);
        this.events.updateStatus(mapId, this.queue.contains(mapId)
            || (null != map && map.isDirty()) ? SyncStatus.PENDING
            : SyncStatus.CLEAN);
      }
      return true;
    } catch (IOException e) {
      fail(operation, e, drainErrors);
      return false;
    } catch (LocalStorageException e) {
      this.queue.complete(operation);
      logger.error("Dropping sync of map " + mapId + " after local storage "
          + "failure: " + e.getMessage(), e);
      drainErrors.add(mapId + ": " + e.getMessage());
      return false;
    }
  }

  private Resolution pushMap(String vaultId, String mapId,
      RemoteFile listed) throws IOException, LocalStorageException {
    RemoteFile current = listed;
    for (int round = 1; ; round++) {
      MapDocument local = this.store.getMap(mapId);
      if (null == local) {
        logger.debug("Map {} is gone locally; nothing to push.", mapId);
        return Resolution.of(Resolution.Outcome.SKIPPED);
      }
      try {
        if (null == current) {
          if (null != local.getRemoteRevision() && !local.isDirty()) {
            logger.debug("Map {} was deleted remotely and has no local "
                + "edits; not re-creating it.", mapId);
            return Resolution.of(Resolution.Outcome.SKIPPED);
          }
          push(vaultId, local, RemoteAdapter.ABSENT);
          return Resolution.of(Resolution.Outcome.LOCAL_WON);
        }
        if (current.getRevision().equals(local.getRemoteRevision())) {
          if (local.isDirty()) {
            push(vaultId, local, current.getRevision());
          }
          return Resolution.of(Resolution.Outcome.IN_SYNC);
        }
        MapPayload remotePayload = this.remote.readFile(vaultId, mapId);
        if (null == remotePayload) {
          current = null;
          continue;
        }
        return this.resolver.resolve(vaultId, current, remotePayload, true);
      } catch (RevisionMismatchException e) {
        if (round >= MAX_CONFLICT_ROUNDS) {
          throw e;
        }
        logger.debug("Remote copy of map {} changed during sync; "
            + "refetching.", mapId);
        current = find(vaultId, mapId);
      }
    }
  }

  private void push(String vaultId, MapDocument local,
      String expectedRevision) throws IOException, LocalStorageException {
    MapPayload snapshot = local.toPayload();
    WriteResult result = this.remote.writeFile(vaultId, local.getId(),
        snapshot, expectedRevision);
    this.store.markSynced(local.getId(), snapshot.getModifiedAt(),
        result.getRevision());
    logger.debug("Pushed map {} as revision {}.", local.getId(),
        result.getRevision());
  }

  private RemoteFile find(String vaultId, String mapId) throws IOException {
    for (RemoteFile file : this.remote.listFiles(vaultId)) {
      if (file.getFileId().equals(mapId)) {
        return file;
      }
    }
    return null;
  }

  private void fail(SyncOperation operation, IOException e,
      List<String> drainErrors) {
    long delay = this.queue.retry(operation);
    if (OperationKind.DELETE != operation.getKind()) {
      this.events.updateStatus(operation.getMapId(), SyncStatus.PENDING);
    }
    drainErrors.add(operation.getMapId() + ": " + e.getMessage());
    if (e instanceof NetworkException) {
      logger.warn("Remote unreachable while syncing map {}; retrying in {} "
          + "ms: {}", operation.getMapId(), delay, e.getMessage());
    } else {
      logger.warn("Remote failure while syncing map {}; retrying in {} ms.",
          operation.getMapId(), delay, e);
    }
  }

  /** Cancel a scheduled retry wake-up, if any. */
  public synchronized void cancelWakeUp() {
    if (null != this.wakeUp) {
      this.wakeUp.cancel(false);
      this.wakeUp = null;
    }
  }

  private synchronized void scheduleWakeUp() {
    long delay = this.queue.nextReadyDelay();
    if (null != this.wakeUp) {
      this.wakeUp.cancel(false);
      this.wakeUp = null;
    }
    if (delay < 0L || !this.online.get() || this.scheduler.isShutdown()) {
      return;
    }
    this.wakeUp = this.scheduler.schedule(this::requestSync, delay);
  }
}
