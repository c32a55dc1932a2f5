/* Copyright 2026 The MapVault Project
 * See LICENSE for licensing information */

package org.mapvault.sync.remote;

import org.mapvault.sync.model.Lock;
import org.mapvault.sync.model.MapPayload;
import org.mapvault.sync.model.Serialization;
import org.mapvault.sync.persist.PersistenceUtils;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.codec.digest.DigestUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Remote adapter storing vaults in a directory, for example a mounted
 * network share or a folder synchronized by a cloud client.
 *
 * <p>Each vault is a sub directory containing one {@code <mapId>.json} per
 * map, a {@code .vault} file with the vault timestamp, and an optional
 * {@code .lock} file. The revision of a map file is the SHA-256 hex digest
 * of its bytes; its modified time is the {@code modified_at} value of the
 * payload. A missing root directory is treated as an unreachable
 * backend.</p>
 *
 * <p>Conditional writes, deletes and lock changes hold an exclusive lock on
 * the vault's {@code .guard} file from the precondition check to the write,
 * so that processes sharing the directory cannot interleave. File locks
 * are held per JVM, so threads of one JVM are serialized on a monitor per
 * guard file first.</p>
 */
public class FileSystemRemoteAdapter implements RemoteAdapter {

  private static final Logger logger = LoggerFactory.getLogger(
      FileSystemRemoteAdapter.class);

  static final String MAP_SUFFIX = ".json";

  static final String VAULT_FILE = ".vault";

  static final String LOCK_FILE = ".lock";

  static final String GUARD_FILE = ".guard";

  private static final ConcurrentMap<Path, Object> guards
      = new ConcurrentHashMap<>();

  /** Section run while holding the guard of a vault. */
  private interface Guarded<T> {
    T run() throws IOException;
  }

  private final Path root;

  private final Clock clock;

  private final ObjectMapper objectMapper = Serialization.mapper();

  /** Use the given directory as remote root. */
  public FileSystemRemoteAdapter(Path root, Clock clock) {
    this.root = root;
    this.clock = clock;
  }

  @Override
  public synchronized List<RemoteFile> listFiles(String vaultId)
      throws IOException {
    Path folder = vaultFolder(vaultId);
    List<RemoteFile> files = new ArrayList<>();
    if (!Files.isDirectory(folder)) {
      return files;
    }
    try (DirectoryStream<Path> entries
        = Files.newDirectoryStream(folder, "*" + MAP_SUFFIX)) {
      for (Path entry : entries) {
        String name = entry.getFileName().toString();
        String fileId = name.substring(0, name.length() - MAP_SUFFIX.length());
        byte[] data = Files.readAllBytes(entry);
        try {
          MapPayload payload = this.objectMapper.readValue(data,
              MapPayload.class);
          files.add(new RemoteFile(fileId, payload.getModifiedAt(),
              DigestUtils.sha256Hex(data)));
        } catch (IOException e) {
          logger.warn("Skipping unreadable remote file {} in vault {}.",
              name, vaultId, e);
        }
      }
    }
    return files;
  }

  @Override
  public synchronized MapPayload readFile(String vaultId, String fileId)
      throws IOException {
    byte[] data = PersistenceUtils.readIfExists(mapFile(vaultId, fileId));
    return null == data ? null
        : this.objectMapper.readValue(data, MapPayload.class);
  }

  @Override
  public synchronized WriteResult writeFile(String vaultId, String fileId,
      MapPayload payload, String expectedRevision) throws IOException {
    Path file = mapFile(vaultId, fileId);
    byte[] data = this.objectMapper.writeValueAsBytes(payload);
    String revision = DigestUtils.sha256Hex(data);
    guarded(vaultId, () -> {
      if (ABSENT.equals(expectedRevision)) {
        try {
          Files.write(file, data, StandardOpenOption.CREATE_NEW,
              StandardOpenOption.WRITE);
        } catch (FileAlreadyExistsException e) {
          String currentRevision = revisionOf(file);
          throw new RevisionMismatchException("Remote file " + fileId
              + " in vault " + vaultId + " already exists with revision "
              + currentRevision + ".", currentRevision);
        }
      } else {
        if (null != expectedRevision) {
          String currentRevision = revisionOf(file);
          if (!expectedRevision.equals(currentRevision)) {
            throw new RevisionMismatchException("Remote file " + fileId
                + " in vault " + vaultId + " has revision " + currentRevision
                + " instead of " + expectedRevision + ".", currentRevision);
          }
        }
        PersistenceUtils.storeAtomically(data, file);
      }
      advanceVaultTimestamp(vaultId);
      return revision;
    });
    logger.debug("Wrote remote file {} in vault {} with revision {}.",
        fileId, vaultId, revision);
    return new WriteResult(revision, payload.getModifiedAt());
  }

  @Override
  public synchronized void deleteFile(String vaultId, String fileId)
      throws IOException {
    if (!Files.isDirectory(vaultFolder(vaultId))) {
      return;
    }
    boolean deleted = guarded(vaultId, () -> {
      if (!Files.deleteIfExists(mapFile(vaultId, fileId))) {
        return false;
      }
      advanceVaultTimestamp(vaultId);
      return true;
    });
    if (deleted) {
      logger.debug("Deleted remote file {} in vault {}.", fileId, vaultId);
    }
  }

  @Override
  public synchronized long getVaultTimestamp(String vaultId)
      throws IOException {
    byte[] data = PersistenceUtils.readIfExists(vaultFolder(vaultId)
        .resolve(VAULT_FILE));
    if (null == data) {
      return 0L;
    }
    try {
      return Long.parseLong(new String(data, StandardCharsets.UTF_8).trim());
    } catch (NumberFormatException e) {
      throw new IOException("Corrupt vault timestamp in vault " + vaultId, e);
    }
  }

  private void advanceVaultTimestamp(String vaultId) throws IOException {
    long timestamp = Math.max(this.clock.millis(),
        getVaultTimestamp(vaultId) + 1L);
    PersistenceUtils.storeAtomically(
        Long.toString(timestamp).getBytes(StandardCharsets.UTF_8),
        vaultFolder(vaultId).resolve(VAULT_FILE));
  }

  @Override
  public synchronized Lock readLock(String vaultId) throws IOException {
    byte[] data = PersistenceUtils.readIfExists(vaultFolder(vaultId)
        .resolve(LOCK_FILE));
    return null == data ? null : this.objectMapper.readValue(data, Lock.class);
  }

  @Override
  public synchronized boolean compareAndSetLock(String vaultId,
      String expectedLockId, Lock lock) throws IOException {
    Path lockFile = vaultFolder(vaultId).resolve(LOCK_FILE);
    byte[] data = this.objectMapper.writeValueAsBytes(lock);
    return guarded(vaultId, () -> {
      if (null == expectedLockId) {
        try {
          Files.write(lockFile, data, StandardOpenOption.CREATE_NEW,
              StandardOpenOption.WRITE);
          return true;
        } catch (FileAlreadyExistsException e) {
          return false;
        }
      }
      Lock current = readLock(vaultId);
      if (null == current || !expectedLockId.equals(current.getLockId())) {
        return false;
      }
      PersistenceUtils.storeAtomically(data, lockFile);
      return true;
    });
  }

  @Override
  public synchronized void deleteLock(String vaultId, String lockId)
      throws IOException {
    if (!Files.isDirectory(vaultFolder(vaultId))) {
      return;
    }
    guarded(vaultId, () -> {
      Lock current = readLock(vaultId);
      if (null != current && current.getLockId().equals(lockId)) {
        Files.deleteIfExists(vaultFolder(vaultId).resolve(LOCK_FILE));
      }
      return null;
    });
  }

  private <T> T guarded(String vaultId, Guarded<T> section)
      throws IOException {
    Path folder = vaultFolder(vaultId);
    Files.createDirectories(folder);
    Path guard = folder.resolve(GUARD_FILE).toAbsolutePath().normalize();
    synchronized (guards.computeIfAbsent(guard, path -> new Object())) {
      try (FileChannel channel = FileChannel.open(guard,
          StandardOpenOption.CREATE, StandardOpenOption.WRITE);
          FileLock lock = channel.lock()) {
        return section.run();
      }
    }
  }

  private static String revisionOf(Path file) throws IOException {
    byte[] current = PersistenceUtils.readIfExists(file);
    return null == current ? null : DigestUtils.sha256Hex(current);
  }

  private Path vaultFolder(String vaultId) throws NetworkException {
    if (!Files.isDirectory(this.root)) {
      throw new NetworkException("Remote root " + this.root
          + " is not available.");
    }
    return this.root.resolve(vaultId);
  }

  private Path mapFile(String vaultId, String fileId)
      throws NetworkException {
    return vaultFolder(vaultId).resolve(fileId + MAP_SUFFIX);
  }
}
