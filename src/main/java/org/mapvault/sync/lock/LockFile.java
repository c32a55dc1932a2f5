/* Copyright 2026 The MapVault Project
 * See LICENSE for licensing information */

package org.mapvault.sync.lock;

import org.mapvault.sync.model.Lock;
import org.mapvault.sync.model.Serialization;
import org.mapvault.sync.persist.PersistenceUtils;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Lock records kept as marker files {@code <vaultId>.lock} in a local
 * directory, for a single device bootstrapping a vault.
 */
public class LockFile implements LockStore {

  private static final Logger logger = LoggerFactory.getLogger(
      LockFile.class);

  private final Path lockDirectory;

  private final ObjectMapper objectMapper = Serialization.mapper();

  public LockFile(Path lockDirectory) {
    this.lockDirectory = lockDirectory;
  }

  @Override
  public synchronized Lock read(String vaultId) throws IOException {
    byte[] data = PersistenceUtils.readIfExists(lockPath(vaultId));
    return null == data ? null : this.objectMapper.readValue(data, Lock.class);
  }

  @Override
  public synchronized boolean compareAndSet(String vaultId,
      String expectedLockId, Lock lock) throws IOException {
    Lock current = read(vaultId);
    if (!Objects.equals(expectedLockId,
        null == current ? null : current.getLockId())) {
      logger.debug("Lock file of vault {} changed meanwhile.", vaultId);
      return false;
    }
    PersistenceUtils.storeAtomically(this.objectMapper.writeValueAsBytes(lock),
        lockPath(vaultId));
    return true;
  }

  @Override
  public synchronized void delete(String vaultId, String lockId)
      throws IOException {
    Lock current = read(vaultId);
    if (null != current && current.getLockId().equals(lockId)) {
      Files.deleteIfExists(lockPath(vaultId));
    }
  }

  private Path lockPath(String vaultId) {
    return this.lockDirectory.resolve(vaultId + ".lock");
  }
}
