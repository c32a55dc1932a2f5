/* Copyright 2026 The MapVault Project
 * See LICENSE for licensing information */

package org.mapvault.sync.queue;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;

import org.mapvault.sync.TestClock;
import org.mapvault.sync.conflict.BackupStore;
import org.mapvault.sync.conflict.ConflictResolver;
import org.mapvault.sync.conflict.ResolutionLog;
import org.mapvault.sync.cron.Scheduler;
import org.mapvault.sync.event.ConflictEvent;
import org.mapvault.sync.event.SyncEvents;
import org.mapvault.sync.event.SyncListener;
import org.mapvault.sync.event.SyncStatus;
import org.mapvault.sync.model.MapDocument;
import org.mapvault.sync.model.MapPayload;
import org.mapvault.sync.model.SyncOperation;
import org.mapvault.sync.persist.LocalStorageException;
import org.mapvault.sync.persist.LocalStore;
import org.mapvault.sync.remote.CountingRemoteAdapter;
import org.mapvault.sync.remote.FileSystemRemoteAdapter;
import org.mapvault.sync.remote.NetworkException;
import org.mapvault.sync.remote.RemoteAdapter;

import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.nio.file.Path;
import java.util.Collections;

public class SyncWorkerTest {

  @Rule
  public TemporaryFolder tmpf = new TemporaryFolder();

  private TestClock clock;

  private Path storePath;

  private OperationQueue queue;

  private LocalStore store;

  private RemoteAdapter shared;

  private CountingRemoteAdapter remote;

  private SyncEvents events;

  private BackupStore backups;

  private Scheduler scheduler;

  private SyncWorker worker;

  @Before
  public void setUp() throws Exception {
    clock = new TestClock(1_000L);
    storePath = tmpf.newFolder("store").toPath();
    queue = new OperationQueue(clock, new Backoff(1_000L, 60_000L));
    store = new LocalStore(storePath, clock, queue::enqueue);
    store.ensureVault("v");
    shared = new FileSystemRemoteAdapter(tmpf.newFolder("remote").toPath(),
        clock);
    remote = new CountingRemoteAdapter(shared);
    events = new SyncEvents();
    backups = new BackupStore(storePath.resolve("backups"), clock);
    /* A shut down scheduler keeps all drains on the test thread. */
    scheduler = new Scheduler("Test", 1, 0L);
    scheduler.shutdownScheduler();
    worker = newWorker(remote);
  }

  private SyncWorker newWorker(RemoteAdapter adapter) {
    ConflictResolver resolver = new ConflictResolver(store, adapter, backups,
        new ResolutionLog(storePath.resolve("resolutions.jsonl")), events,
        clock);
    return new SyncWorker(store, adapter, queue, resolver, events, scheduler,
        clock, 10);
  }

  @After
  public void tearDown() {
    worker.shutdown();
  }

  @Test()
  public void testNewMapIsPushed() throws Exception {
    MapDocument map = store.createMap("v", "Plans");
    store.createNode(map.getId(), null, "Root", "");
    assertEquals(1, queue.size());
    SyncSummary summary = worker.drain();
    assertEquals(1, remote.writeCalls.get());
    assertEquals(1, summary.getSyncedMaps());
    assertEquals(0, summary.getPendingChanges());
    assertTrue(summary.getErrors().isEmpty());
    assertEquals(1_000L, summary.getLastSyncTime());
    MapPayload pushed = shared.readFile("v", map.getId());
    assertEquals("Plans", pushed.getTitle());
    assertEquals(1, pushed.getNodes().size());
    MapDocument local = store.getMap(map.getId());
    assertFalse(local.isDirty());
    assertNotNull(local.getRemoteRevision());
    assertEquals(SyncStatus.CLEAN, events.getStatus(map.getId()));
  }

  @Test()
  public void testEditsCoalesceIntoOneWrite() throws Exception {
    MapDocument map = store.createMap("v", "v1");
    store.renameMap(map.getId(), "v2");
    store.renameMap(map.getId(), "v3");
    worker.drain();
    assertEquals(1, remote.writeCalls.get());
    assertEquals("v3", remote.written.get(0).getTitle());
  }

  @Test()
  public void testReplayedOperationIsIdempotent() throws Exception {
    MapDocument map = store.createMap("v", "Plans");
    worker.drain();
    assertTrue(queue.offer(SyncOperation.update(store.getMap(map.getId()),
        clock.millis())));
    SyncSummary summary = worker.drain();
    assertEquals(1, remote.writeCalls.get());
    assertEquals(0, summary.getPendingChanges());
    assertEquals(SyncStatus.CLEAN, events.getStatus(map.getId()));
  }

  @Test()
  public void testAlreadyAppliedWriteIsRecognized() throws Exception {
    MapDocument map = store.createMap("v", "Plans");
    shared.writeFile("v", map.getId(), map.toPayload(), RemoteAdapter.ABSENT);
    worker.drain();
    assertEquals(0, remote.writeCalls.get());
    MapDocument local = store.getMap(map.getId());
    assertFalse(local.isDirty());
    assertNotNull(local.getRemoteRevision());
  }

  @Test()
  public void testOfflineEditsArePushedOnReconnect() throws Exception {
    worker.setOnline(false);
    MapDocument map = store.createMap("v", "Offline");
    SyncSummary offline = worker.drain();
    assertFalse(offline.isOnline());
    assertEquals(1, offline.getPendingChanges());
    assertEquals(0, remote.writeCalls.get());
    worker.setOnline(true);
    SyncSummary online = worker.drain();
    assertTrue(online.isOnline());
    assertEquals(0, online.getPendingChanges());
    assertEquals("Offline", shared.readFile("v", map.getId()).getTitle());
  }

  @Test()
  public void testUnreachableRemoteBacksOff() throws Exception {
    remote.setReachable(false);
    MapDocument map = store.createMap("v", "Plans");
    SyncSummary failed = worker.drain();
    assertEquals(1, failed.getErrors().size());
    assertEquals(1, failed.getPendingChanges());
    assertEquals(SyncStatus.PENDING, events.getStatus(map.getId()));
    assertEquals(1_000L, queue.nextReadyDelay());
    remote.setReachable(true);
    worker.drain();
    assertEquals(0, remote.writeCalls.get());
    clock.advance(1_000L);
    worker.drain();
    assertEquals(1, remote.writeCalls.get());
    assertEquals(SyncStatus.CLEAN, events.getStatus(map.getId()));
  }

  @Test()
  public void testBackoffDoublesWhileRemoteIsDown() throws Exception {
    RemoteAdapter down = mock(RemoteAdapter.class);
    given(down.listFiles(anyString())).willThrow(
        new NetworkException("Connection refused"));
    worker.shutdown();
    worker = newWorker(down);
    store.createMap("v", "Plans");
    worker.drain();
    assertEquals(1_000L, queue.nextReadyDelay());
    clock.advance(1_000L);
    worker.drain();
    assertEquals(2_000L, queue.nextReadyDelay());
    clock.advance(2_000L);
    worker.drain();
    assertEquals(4_000L, queue.nextReadyDelay());
    worker.setOnline(false);
    worker.setOnline(true);
    assertEquals(0L, queue.nextReadyDelay());
  }

  @Test()
  public void testDeleteRemovesRemoteCopyAndTombstone() throws Exception {
    MapDocument map = store.createMap("v", "Plans");
    worker.drain();
    store.deleteMap(map.getId());
    assertTrue(store.isTombstoned("v", map.getId()));
    worker.drain();
    assertEquals(1, remote.deleteCalls.get());
    assertNull(shared.readFile("v", map.getId()));
    assertFalse(store.isTombstoned("v", map.getId()));
    assertEquals(0, queue.size());
  }

  @Test()
  public void testRemoteDeleteLosesAgainstLocalEdit() throws Exception {
    MapDocument map = store.createMap("v", "Plans");
    worker.drain();
    shared.deleteFile("v", map.getId());
    store.renameMap(map.getId(), "Still needed");
    worker.drain();
    assertEquals("Still needed", shared.readFile("v", map.getId())
        .getTitle());
    assertFalse(store.getMap(map.getId()).isDirty());
  }

  @Test()
  public void testRemoteDeleteOfCleanMapIsNotUndone() throws Exception {
    MapDocument map = store.createMap("v", "Plans");
    worker.drain();
    shared.deleteFile("v", map.getId());
    queue.offer(SyncOperation.update(store.getMap(map.getId()),
        clock.millis()));
    worker.drain();
    assertEquals(1, remote.writeCalls.get());
    assertNull(shared.readFile("v", map.getId()));
  }

  @Test()
  public void testNewerRemoteEditWinsConflict() throws Exception {
    MapDocument map = store.createMap("v", "Plans");
    worker.drain();
    String revision = store.getMap(map.getId()).getRemoteRevision();
    clock.set(2_000L);
    store.renameMap(map.getId(), "Local plans");
    shared.writeFile("v", map.getId(), MapPayload.of(map.getId(), "v",
        "Remote plans", 3_000L, Collections.emptyList(),
        Collections.emptyList()), revision);
    worker.drain();
    MapDocument local = store.getMap(map.getId());
    assertEquals("Remote plans", local.getTitle());
    assertFalse(local.isDirty());
    assertEquals(SyncStatus.CONFLICTED, events.getStatus(map.getId()));
    assertEquals(1, backups.list(map.getId()).size());
    assertEquals("Local plans", backups.load(backups.list(map.getId())
        .get(0)).getTitle());
    assertEquals(0, queue.size());
  }

  @Test()
  public void testEditAfterLostConflictIsPushed() throws Exception {
    MapDocument map = store.createMap("v", "Plans");
    worker.drain();
    String revision = store.getMap(map.getId()).getRemoteRevision();
    clock.set(2_000L);
    store.renameMap(map.getId(), "Local plans");
    shared.writeFile("v", map.getId(), MapPayload.of(map.getId(), "v",
        "Remote plans", 3_000L, Collections.emptyList(),
        Collections.emptyList()), revision);
    clock.set(4_000L);
    events.addListener(new SyncListener() {
      @Override
      public void onConflictResolved(ConflictEvent event) {
        try {
          store.renameMap(event.getMapId(), "Merged plans");
        } catch (LocalStorageException e) {
          throw new IllegalStateException(e);
        }
      }
    });
    worker.drain();
    assertEquals(0, queue.size());
    assertEquals("Merged plans", shared.readFile("v", map.getId())
        .getTitle());
    assertFalse(store.getMap(map.getId()).isDirty());
    assertEquals(SyncStatus.CLEAN, events.getStatus(map.getId()));
  }
}
