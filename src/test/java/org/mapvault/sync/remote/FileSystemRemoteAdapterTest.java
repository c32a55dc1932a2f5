/* Copyright 2026 The MapVault Project
 * See LICENSE for licensing information */

package org.mapvault.sync.remote;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.mapvault.sync.TestClock;
import org.mapvault.sync.model.Lock;
import org.mapvault.sync.model.MapDocument;
import org.mapvault.sync.model.MapPayload;
import org.mapvault.sync.model.Node;

import org.apache.commons.codec.digest.DigestUtils;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

public class FileSystemRemoteAdapterTest {

  @Rule
  public TemporaryFolder tmpf = new TemporaryFolder();

  private TestClock clock;

  private Path root;

  private FileSystemRemoteAdapter remote;

  @Before
  public void setUp() throws Exception {
    clock = new TestClock(10_000L);
    root = tmpf.newFolder("remote").toPath();
    remote = new FileSystemRemoteAdapter(root, clock);
  }

  private static MapPayload payload(String id, String title, long at) {
    MapDocument map = MapDocument.create(id, "v", title, at);
    map.getNodes().add(Node.of("n", null, title, "", 0, at));
    return map.toPayload();
  }

  @Test()
  public void testWriteListRead() throws Exception {
    assertTrue(remote.listFiles("v").isEmpty());
    assertNull(remote.readFile("v", "m"));
    WriteResult result = remote.writeFile("v", "m", payload("m", "Plans",
        500L), RemoteAdapter.ABSENT);
    List<RemoteFile> files = remote.listFiles("v");
    assertEquals(1, files.size());
    assertEquals("m", files.get(0).getFileId());
    assertEquals(500L, files.get(0).getModifiedTime());
    assertEquals(result.getRevision(), files.get(0).getRevision());
    assertEquals(DigestUtils.sha256Hex(Files.readAllBytes(
        root.resolve("v").resolve("m.json"))), result.getRevision());
    assertEquals("Plans", remote.readFile("v", "m").getTitle());
  }

  @Test()
  public void testEqualContentHasEqualRevision() throws Exception {
    String first = remote.writeFile("v", "m", payload("m", "Plans", 500L),
        null).getRevision();
    String second = remote.writeFile("v", "m", payload("m", "Plans", 500L),
        null).getRevision();
    assertEquals(first, second);
    String third = remote.writeFile("v", "m", payload("m", "Other", 500L),
        null).getRevision();
    assertNotEquals(first, third);
  }

  @Test()
  public void testConditionalWrite() throws Exception {
    String revision = remote.writeFile("v", "m", payload("m", "One", 1L),
        RemoteAdapter.ABSENT).getRevision();
    String next = remote.writeFile("v", "m", payload("m", "Two", 2L),
        revision).getRevision();
    try {
      remote.writeFile("v", "m", payload("m", "Three", 3L), revision);
    } catch (RevisionMismatchException e) {
      assertEquals(next, e.getActualRevision());
      assertEquals("Two", remote.readFile("v", "m").getTitle());
      return;
    }
    throw new AssertionError("Stale precondition must fail.");
  }

  @Test(expected = RevisionMismatchException.class)
  public void testAbsentPreconditionOnExistingFile() throws Exception {
    remote.writeFile("v", "m", payload("m", "One", 1L), null);
    remote.writeFile("v", "m", payload("m", "Two", 2L),
        RemoteAdapter.ABSENT);
  }

  @Test(expected = RevisionMismatchException.class)
  public void testRevisionPreconditionOnMissingFile() throws Exception {
    remote.writeFile("v", "m", payload("m", "One", 1L), "abc");
  }

  @Test()
  public void testVaultTimestampAdvances() throws Exception {
    assertEquals(0L, remote.getVaultTimestamp("v"));
    remote.writeFile("v", "a", payload("a", "A", 1L), null);
    long first = remote.getVaultTimestamp("v");
    assertEquals(10_000L, first);
    remote.writeFile("v", "b", payload("b", "B", 1L), null);
    long second = remote.getVaultTimestamp("v");
    assertTrue(second > first);
    remote.deleteFile("v", "a");
    assertTrue(remote.getVaultTimestamp("v") > second);
    long afterDelete = remote.getVaultTimestamp("v");
    remote.deleteFile("v", "a");
    assertEquals(afterDelete, remote.getVaultTimestamp("v"));
    assertEquals(1, remote.listFiles("v").size());
  }

  @Test()
  public void testUnreadableFilesAreSkipped() throws Exception {
    remote.writeFile("v", "a", payload("a", "A", 1L), null);
    Files.write(root.resolve("v").resolve("junk.json"), "not json".getBytes());
    assertEquals(1, remote.listFiles("v").size());
  }

  @Test(expected = NetworkException.class)
  public void testMissingRootIsUnreachable() throws Exception {
    new FileSystemRemoteAdapter(root.resolve("unmounted"), clock)
        .listFiles("v");
  }

  @Test()
  public void testLockCompareAndSet() throws Exception {
    assertNull(remote.readLock("v"));
    Lock first = Lock.of("l1", "v", "laptop", 1L, 100L, "reconcile");
    assertTrue(remote.compareAndSetLock("v", null, first));
    Lock second = Lock.of("l2", "v", "phone", 2L, 200L, "reconcile");
    assertFalse(remote.compareAndSetLock("v", null, second));
    assertFalse(remote.compareAndSetLock("v", "other", second));
    assertTrue(remote.compareAndSetLock("v", "l1", second));
    assertEquals("phone", remote.readLock("v").getOwner());
    remote.deleteLock("v", "l1");
    assertEquals("l2", remote.readLock("v").getLockId());
    remote.deleteLock("v", "l2");
    assertNull(remote.readLock("v"));
    assertTrue(remote.listFiles("v").isEmpty());
  }

  /* Run the tasks at once on separate threads and return their results. */
  private static List<Boolean> race(List<Callable<Boolean>> tasks)
      throws Exception {
    ExecutorService pool = Executors.newFixedThreadPool(tasks.size());
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<Boolean>> futures = new ArrayList<>();
      for (Callable<Boolean> task : tasks) {
        futures.add(pool.submit(() -> {
          start.await();
          return task.call();
        }));
      }
      start.countDown();
      List<Boolean> results = new ArrayList<>();
      for (Future<Boolean> future : futures) {
        results.add(future.get(10L, TimeUnit.SECONDS));
      }
      return results;
    } finally {
      pool.shutdownNow();
    }
  }

  @Test()
  public void testConcurrentCreatesFromSeparateAdapters() throws Exception {
    List<Callable<Boolean>> writers = new ArrayList<>();
    for (int i = 0; i < 8; i++) {
      FileSystemRemoteAdapter device = new FileSystemRemoteAdapter(root,
          clock);
      String title = "Device " + i;
      writers.add(() -> {
        try {
          device.writeFile("v", "m", payload("m", title, 500L),
              RemoteAdapter.ABSENT);
          return true;
        } catch (RevisionMismatchException e) {
          return false;
        }
      });
    }
    List<Boolean> results = race(writers);
    assertEquals(1, results.stream().filter(Boolean::booleanValue).count());
    String winner = "Device " + results.indexOf(Boolean.TRUE);
    assertEquals(winner, remote.readFile("v", "m").getTitle());
    assertEquals(1, remote.listFiles("v").size());
  }

  @Test()
  public void testConcurrentLockAcquisitionHasOneWinner() throws Exception {
    List<Callable<Boolean>> claimants = new ArrayList<>();
    for (int i = 0; i < 8; i++) {
      FileSystemRemoteAdapter device = new FileSystemRemoteAdapter(root,
          clock);
      Lock lock = Lock.of("l" + i, "v", "device" + i, 1L, 100L, "reconcile");
      claimants.add(() -> device.compareAndSetLock("v", null, lock));
    }
    List<Boolean> results = race(claimants);
    assertEquals(1, results.stream().filter(Boolean::booleanValue).count());
    assertEquals("l" + results.indexOf(Boolean.TRUE),
        remote.readLock("v").getLockId());
  }

  @Test()
  public void testConditionalUpdatesFromSeparateAdaptersHaveOneWinner()
      throws Exception {
    String base = remote.writeFile("v", "m", payload("m", "Base", 500L),
        RemoteAdapter.ABSENT).getRevision();
    List<Callable<Boolean>> writers = new ArrayList<>();
    for (int i = 0; i < 8; i++) {
      FileSystemRemoteAdapter device = new FileSystemRemoteAdapter(root,
          clock);
      String title = "Edit " + i;
      writers.add(() -> {
        try {
          device.writeFile("v", "m", payload("m", title, 600L), base);
          return true;
        } catch (RevisionMismatchException e) {
          return false;
        }
      });
    }
    List<Boolean> results = race(writers);
    assertEquals(1, results.stream().filter(Boolean::booleanValue).count());
    assertEquals("Edit " + results.indexOf(Boolean.TRUE),
        remote.readFile("v", "m").getTitle());
  }
}
