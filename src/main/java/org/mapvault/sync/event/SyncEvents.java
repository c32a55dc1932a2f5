/* Copyright 2026 The MapVault Project
 * See LICENSE for licensing information */

package org.mapvault.sync.event;

import org.mapvault.sync.model.Winner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Tracks the sync status of every map and forwards status changes and
 * conflict notifications to registered listeners. A failing listener is
 * logged and does not affect the others.
 */
public class SyncEvents {

  private static final Logger logger = LoggerFactory.getLogger(
      SyncEvents.class);

  private final List<SyncListener> listeners = new CopyOnWriteArrayList<>();

  private final Map<String, SyncStatus> statuses = new ConcurrentHashMap<>();

  public void addListener(SyncListener listener) {
    this.listeners.add(listener);
  }

  public void removeListener(SyncListener listener) {
    this.listeners.remove(listener);
  }

  /** Current status of a map; maps never seen are clean. */
  public SyncStatus getStatus(String mapId) {
    return this.statuses.getOrDefault(mapId, SyncStatus.CLEAN);
  }

  /** Record a status and notify listeners if it changed. */
  public void updateStatus(String mapId, SyncStatus status) {
    SyncStatus previous = this.statuses.put(mapId, status);
    if (previous == status) {
      return;
    }
    SyncStatusEvent event = new SyncStatusEvent(mapId, status);
    for (SyncListener listener : this.listeners) {
      try {
        listener.onSyncStatusChanged(event);
      } catch (RuntimeException e) {
        logger.warn("Listener {} failed on {}.", listener, event, e);
      }
    }
  }

  /** Forget the status of a deleted map. */
  public void forget(String mapId) {
    this.statuses.remove(mapId);
  }

  /** Notify listeners of a resolved conflict. */
  public void conflictResolved(String mapId, Winner winner,
      String backupRef) {
    ConflictEvent event = new ConflictEvent(mapId, winner, backupRef);
    for (SyncListener listener : this.listeners) {
      try {
        listener.onConflictResolved(event);
      } catch (RuntimeException e) {
        logger.warn("Listener {} failed on {}.", listener, event, e);
      }
    }
  }
}
