/* Copyright 2026 The MapVault Project
 * See LICENSE for licensing information */

package org.mapvault.sync.conflict;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.mapvault.sync.TestClock;
import org.mapvault.sync.event.ConflictEvent;
import org.mapvault.sync.event.SyncEvents;
import org.mapvault.sync.event.SyncListener;
import org.mapvault.sync.event.SyncStatus;
import org.mapvault.sync.model.MapDocument;
import org.mapvault.sync.model.MapPayload;
import org.mapvault.sync.model.Node;
import org.mapvault.sync.model.Winner;
import org.mapvault.sync.persist.LocalStore;
import org.mapvault.sync.remote.FileSystemRemoteAdapter;
import org.mapvault.sync.remote.RemoteAdapter;
import org.mapvault.sync.remote.RemoteFile;
import org.mapvault.sync.remote.RevisionMismatchException;
import org.mapvault.sync.remote.WriteResult;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class ConflictResolverTest {

  @Rule
  public TemporaryFolder tmpf = new TemporaryFolder();

  private TestClock clock;

  private LocalStore store;

  private RemoteAdapter remote;

  private BackupStore backups;

  private ResolutionLog resolutionLog;

  private SyncEvents events;

  private List<ConflictEvent> conflicts;

  private ConflictResolver resolver;

  private String baseRevision;

  @Before
  public void setUp() throws Exception {
    clock = new TestClock(1_000L);
    Path storePath = tmpf.newFolder("store").toPath();
    store = new LocalStore(storePath, clock, operation -> { });
    remote = new FileSystemRemoteAdapter(tmpf.newFolder("remote").toPath(),
        clock);
    backups = new BackupStore(storePath.resolve("backups"), clock);
    resolutionLog = new ResolutionLog(storePath.resolve("resolutions.jsonl"));
    events = new SyncEvents();
    conflicts = new ArrayList<>();
    events.addListener(new SyncListener() {
      @Override
      public void onConflictResolved(ConflictEvent event) {
        conflicts.add(event);
      }
    });
    resolver = new ConflictResolver(store, remote, backups, resolutionLog,
        events, clock);
    store.ensureVault("v");
    MapPayload base = payload("Base", 500L);
    baseRevision = remote.writeFile("v", "m", base, RemoteAdapter.ABSENT)
        .getRevision();
    store.applyRemote(base, 500L, baseRevision);
  }

  private static MapPayload payload(String title, long modifiedAt) {
    return MapPayload.of("m", "v", title, modifiedAt,
        Collections.singletonList(Node.of("root", null, "Root", "", 0,
        500L)), Collections.emptyList());
  }

  /* Simulates another device overwriting the base version. */
  private RemoteFile remoteEdit(String title, long modifiedAt)
      throws Exception {
    WriteResult result = remote.writeFile("v", "m",
        payload(title, modifiedAt), baseRevision);
    return new RemoteFile("m", modifiedAt, result.getRevision());
  }

  private void localEdit(String title, long at) throws Exception {
    clock.set(at);
    store.renameMap("m", title);
  }

  @Test()
  public void testNewerLocalVersionIsPushed() throws Exception {
    localEdit("Local", 2_000L);
    RemoteFile remoteFile = remoteEdit("Remote", 1_500L);
    Resolution resolution = resolver.resolve("v", remoteFile,
        remote.readFile("v", "m"), true);
    assertEquals(Resolution.Outcome.LOCAL_WON, resolution.getOutcome());
    assertNull(resolution.getBackupRef());
    assertEquals("Local", remote.readFile("v", "m").getTitle());
    MapDocument local = store.getMap("m");
    assertFalse(local.isDirty());
    assertEquals(resolution.getRevision(), local.getRemoteRevision());
    List<ResolutionEntry> entries = resolutionLog.readAll();
    assertEquals(1, entries.size());
    assertEquals(Winner.LOCAL, entries.get(0).getWinner());
    assertEquals(2_000L, entries.get(0).getLocalModifiedAt());
    assertEquals(1_500L, entries.get(0).getRemoteModifiedTime());
    assertEquals(1, conflicts.size());
    assertEquals(Winner.LOCAL, conflicts.get(0).getWinner());
    assertTrue(backups.list("m").isEmpty());
  }

  @Test()
  public void testNewerLocalVersionLeftForUpload() throws Exception {
    localEdit("Local", 2_000L);
    RemoteFile remoteFile = remoteEdit("Remote", 1_500L);
    Resolution resolution = resolver.resolve("v", remoteFile,
        remote.readFile("v", "m"), false);
    assertEquals(Resolution.Outcome.LOCAL_WON, resolution.getOutcome());
    assertEquals("Remote", remote.readFile("v", "m").getTitle());
    assertTrue(store.getMap("m").isDirty());
    assertTrue(conflicts.isEmpty());
  }

  @Test()
  public void testNewerRemoteVersionWins() throws Exception {
    localEdit("Local", 2_000L);
    RemoteFile remoteFile = remoteEdit("Remote", 3_000L);
    clock.set(4_000L);
    Resolution resolution = resolver.resolve("v", remoteFile,
        remote.readFile("v", "m"), true);
    assertEquals(Resolution.Outcome.REMOTE_WON, resolution.getOutcome());
    MapDocument local = store.getMap("m");
    assertEquals("Remote", local.getTitle());
    assertFalse(local.isDirty());
    assertEquals(remoteFile.getRevision(), local.getRemoteRevision());
    String backupRef = resolution.getBackupRef();
    assertNotNull(backupRef);
    assertEquals("Local", backups.load(backupRef).getTitle());
    assertEquals(SyncStatus.CONFLICTED, events.getStatus("m"));
    ResolutionEntry entry = resolutionLog.readAll().get(0);
    assertEquals(Winner.REMOTE, entry.getWinner());
    assertEquals(backupRef, entry.getDiscardedBackupRef());
    assertEquals(4_000L, entry.getResolvedAt());
    assertEquals(backupRef, conflicts.get(0).getBackupRef());
    assertEquals("Remote", remote.readFile("v", "m").getTitle());
  }

  @Test()
  public void testTieGoesToRemote() throws Exception {
    localEdit("Local", 2_000L);
    RemoteFile remoteFile = remoteEdit("Remote", 2_000L);
    Resolution resolution = resolver.resolve("v", remoteFile,
        remote.readFile("v", "m"), true);
    assertEquals(Resolution.Outcome.REMOTE_WON, resolution.getOutcome());
    assertEquals("Remote", store.getMap("m").getTitle());
  }

  @Test()
  public void testSameContentIsInSync() throws Exception {
    localEdit("Same", 2_000L);
    RemoteFile remoteFile = remoteEdit("Same", 1_800L);
    Resolution resolution = resolver.resolve("v", remoteFile,
        remote.readFile("v", "m"), true);
    assertEquals(Resolution.Outcome.IN_SYNC, resolution.getOutcome());
    assertFalse(store.getMap("m").isDirty());
    assertEquals(remoteFile.getRevision(),
        store.getMap("m").getRemoteRevision());
    assertTrue(conflicts.isEmpty());
    assertTrue(resolutionLog.readAll().isEmpty());
  }

  @Test()
  public void testCleanLocalCopyIsPulled() throws Exception {
    RemoteFile remoteFile = remoteEdit("Remote", 700L);
    Resolution resolution = resolver.resolve("v", remoteFile,
        remote.readFile("v", "m"), true);
    assertEquals(Resolution.Outcome.PULLED, resolution.getOutcome());
    assertEquals("Remote", store.getMap("m").getTitle());
    assertTrue(backups.list("m").isEmpty());
    assertTrue(conflicts.isEmpty());
  }

  @Test()
  public void testMissingLocalCopyIsSkipped() throws Exception {
    store.removeLocal("m");
    RemoteFile remoteFile = remoteEdit("Remote", 700L);
    assertEquals(Resolution.Outcome.SKIPPED, resolver.resolve("v",
        remoteFile, remote.readFile("v", "m"), true).getOutcome());
  }

  @Test(expected = RevisionMismatchException.class)
  public void testRemoteChangedAgainDuringPush() throws Exception {
    localEdit("Local", 2_000L);
    RemoteFile listed = remoteEdit("Remote", 1_500L);
    MapPayload seen = remote.readFile("v", "m");
    remote.writeFile("v", "m", payload("Third", 1_600L), listed.getRevision());
    resolver.resolve("v", listed, seen, true);
  }
}
