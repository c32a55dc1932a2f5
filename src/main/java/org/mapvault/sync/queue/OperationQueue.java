/* Copyright 2026 The MapVault Project
 * See LICENSE for licensing information */

package org.mapvault.sync.queue;

import org.mapvault.sync.model.SyncOperation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Pending sync operations, at most one per map. A new operation for a map
 * replaces the pending one but keeps its position and retry state.
 * Operations handed out to the worker are in flight until completed or
 * retried; a map in flight is never handed out twice.
 */
public class OperationQueue {

  private static final Logger logger = LoggerFactory.getLogger(
      OperationQueue.class);

  private static final class Entry {

    private SyncOperation operation;

    private int attempts;

    private long notBefore;

    private Entry(SyncOperation operation, int attempts, long notBefore) {
      this.operation = operation;
      this.attempts = attempts;
      this.notBefore = notBefore;
    }
  }

  private final Map<String, Entry> pending = new LinkedHashMap<>();

  private final Map<String, Entry> inFlight = new HashMap<>();

  private final List<Runnable> enqueueListeners = new CopyOnWriteArrayList<>();

  private final Clock clock;

  private final Backoff backoff;

  public OperationQueue(Clock clock, Backoff backoff) {
    this.clock = clock;
    this.backoff = backoff;
  }

  /** Run the given callback after every enqueued operation. */
  public void addEnqueueListener(Runnable listener) {
    this.enqueueListeners.add(listener);
  }

  /** Add an operation, replacing a pending one for the same map. */
  public void enqueue(SyncOperation operation) {
    synchronized (this) {
      Entry entry = this.pending.get(operation.getMapId());
      if (null == entry) {
        this.pending.put(operation.getMapId(), new Entry(operation, 0, 0L));
      } else {
        logger.debug("Coalescing {} into pending operation of map {}.",
            operation.getKind(), operation.getMapId());
        entry.operation = operation;
      }
    }
    for (Runnable listener : this.enqueueListeners) {
      listener.run();
    }
  }

  /**
   * Add an operation only if there is neither a pending nor an in-flight
   * operation for the same map.
   */
  public boolean offer(SyncOperation operation) {
    synchronized (this) {
      if (this.pending.containsKey(operation.getMapId())
          || this.inFlight.containsKey(operation.getMapId())) {
        return false;
      }
      this.pending.put(operation.getMapId(), new Entry(operation, 0, 0L));
    }
    for (Runnable listener : this.enqueueListeners) {
      listener.run();
    }
    return true;
  }

  /**
   * Hand out up to {@code max} operations which are due and whose maps are
   * not in flight, in enqueue order.
   */
  public synchronized List<SyncOperation> takeBatch(int max) {
    long now = this.clock.millis();
    List<SyncOperation> batch = new ArrayList<>();
    Iterator<Map.Entry<String, Entry>> it = this.pending.entrySet()
        .iterator();
    while (it.hasNext() && batch.size() < max) {
      Map.Entry<String, Entry> e = it.next();
      if (this.inFlight.containsKey(e.getKey())
          || e.getValue().notBefore > now) {
        continue;
      }
      it.remove();
      this.inFlight.put(e.getKey(), e.getValue());
      batch.add(e.getValue().operation);
    }
    return batch;
  }

  /** Mark an in-flight operation as done. */
  public synchronized void complete(SyncOperation operation) {
    this.inFlight.remove(operation.getMapId());
  }

  /**
   * Return a failed in-flight operation to the queue with the next backoff
   * delay. If a newer operation for the map arrived meanwhile, the failed
   * one is dropped and the delay applies to the newer one.
   *
   * @return The backoff delay in milliseconds.
   */
  public synchronized long retry(SyncOperation operation) {
    Entry failed = this.inFlight.remove(operation.getMapId());
    int attempts = (null == failed ? 0 : failed.attempts) + 1;
    long delay = this.backoff.delayMillis(attempts);
    long notBefore = this.clock.millis() + delay;
    Entry newer = this.pending.get(operation.getMapId());
    if (null == newer) {
      this.pending.put(operation.getMapId(),
          new Entry(operation, attempts, notBefore));
    } else {
      newer.attempts = attempts;
      newer.notBefore = notBefore;
    }
    return delay;
  }

  /**
   * Remove the pending create or update of a map if its snapshot was
   * modified at or before {@code modifiedAt}. Deletes are kept.
   */
  public synchronized boolean discardIfNotNewer(String mapId,
      long modifiedAt) {
    Entry entry = this.pending.get(mapId);
    if (null == entry || null == entry.operation.getPayload()
        || entry.operation.getPayload().getModifiedAt() > modifiedAt) {
      return false;
    }
    this.pending.remove(mapId);
    return true;
  }

  /** Make all pending operations due right away. */
  public synchronized void resetBackoff() {
    for (Entry entry : this.pending.values()) {
      entry.attempts = 0;
      entry.notBefore = 0L;
    }
  }

  /**
   * Milliseconds until the next pending operation becomes due, 0 if one is
   * due now, or -1 if nothing can be handed out.
   */
  public synchronized long nextReadyDelay() {
    long now = this.clock.millis();
    long next = -1L;
    for (Map.Entry<String, Entry> e : this.pending.entrySet()) {
      if (this.inFlight.containsKey(e.getKey())) {
        continue;
      }
      long delay = Math.max(0L, e.getValue().notBefore - now);
      if (next < 0L || delay < next) {
        next = delay;
      }
    }
    return next;
  }

  /** Whether an operation for the map is pending. */
  public synchronized boolean contains(String mapId) {
    return this.pending.containsKey(mapId);
  }

  /** Return the pending operation of a map, or {@code null}. */
  public synchronized SyncOperation peek(String mapId) {
    Entry entry = this.pending.get(mapId);
    return null == entry ? null : entry.operation;
  }

  /** Number of maps with a pending or in-flight operation. */
  public synchronized int size() {
    int size = this.pending.size();
    for (String mapId : this.inFlight.keySet()) {
      if (!this.pending.containsKey(mapId)) {
        size++;
      }
    }
    return size;
  }
}
