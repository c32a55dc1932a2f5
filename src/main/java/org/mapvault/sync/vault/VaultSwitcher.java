/* Copyright 2026 The MapVault Project
 * See LICENSE for licensing information */

package org.mapvault.sync.vault;

import org.mapvault.sync.conflict.ConflictResolver;
import org.mapvault.sync.conflict.Resolution;
import org.mapvault.sync.cron.Scheduler;
import org.mapvault.sync.event.SyncEvents;
import org.mapvault.sync.event.SyncStatus;
import org.mapvault.sync.lock.LockHeldException;
import org.mapvault.sync.lock.LockManager;
import org.mapvault.sync.model.Lock;
import org.mapvault.sync.model.MapDocument;
import org.mapvault.sync.model.MapPayload;
import org.mapvault.sync.model.OperationKind;
import org.mapvault.sync.model.SyncOperation;
import org.mapvault.sync.model.Vault;
import org.mapvault.sync.persist.CorruptionDetectedException;
import org.mapvault.sync.persist.LocalStorageException;
import org.mapvault.sync.persist.LocalStore;
import org.mapvault.sync.queue.OperationQueue;
import org.mapvault.sync.remote.RemoteAdapter;
import org.mapvault.sync.remote.RemoteFile;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;

/**
 * Owns the active vault and drives it through
 * {@code CLOSED -> LOADING -> READY}.
 *
 * <p>Opening a vault loads its local copy and reconciles it with the remote
 * backend in the background. A vault never pulled before gets a full pull.
 * A cached vault is only reconciled if the remote vault timestamp moved,
 * under the vault lock, touching only maps whose remote revision changed.
 * If the remote is unreachable or locked, the cached state is used as is.
 * Pending local changes are handed to the operation queue afterwards;
 * opening never waits for an upload.</p>
 *
 * <p>Switching to another vault cancels a running pass, which stops between
 * two maps and releases the lock, and evicts the old vault's maps from
 * memory.</p>
 */
public class VaultSwitcher {

  private static final Logger logger = LoggerFactory.getLogger(
      VaultSwitcher.class);

  static final String LOCK_OPERATION = "reconcile";

  /** One reconciliation run of one vault. */
  private static final class Pass {

    private final String vaultId;

    private volatile boolean cancelled = false;

    private Future<VaultState> future;

    private Pass(String vaultId) {
      this.vaultId = vaultId;
    }
  }

  private final LocalStore store;

  private final RemoteAdapter remote;

  private final LockManager locks;

  private final ConflictResolver resolver;

  private final OperationQueue queue;

  private final SyncEvents events;

  private final Scheduler scheduler;

  private final Clock clock;

  private final long lockTimeoutMillis;

  private volatile VaultState state = VaultState.CLOSED;

  private Pass current;

  /** Create a switcher with no open vault. */
  public VaultSwitcher(LocalStore store, RemoteAdapter remote,
      LockManager locks, ConflictResolver resolver, OperationQueue queue,
      SyncEvents events, Scheduler scheduler, Clock clock,
      long lockTimeoutMillis) {
    this.store = store;
    this.remote = remote;
    this.locks = locks;
    this.resolver = resolver;
    this.queue = queue;
    this.events = events;
    this.scheduler = scheduler;
    this.clock = clock;
    this.lockTimeoutMillis = lockTimeoutMillis;
  }

  /**
   * Open a vault, closing the currently open one if it differs.
   *
   * @return Future completing with {@link VaultState#READY} once the vault
   *     is usable.
   */
  public synchronized Future<VaultState> openVault(String vaultId) {
    if (null != this.current) {
      if (this.current.vaultId.equals(vaultId)) {
        return this.current.future;
      }
      closeVault();
    }
    logger.info("Opening vault {}.", vaultId);
    Pass pass = new Pass(vaultId);
    this.current = pass;
    this.state = VaultState.LOADING;
    pass.future = this.scheduler.submit(() -> reconcile(pass));
    return pass.future;
  }

  /** Switch to another vault. */
  public Future<VaultState> switchVault(String vaultId) {
    return openVault(vaultId);
  }

  /**
   * Close the open vault: cancel a running pass and evict the vault's maps
   * from memory.
   */
  public synchronized void closeVault() {
    Pass pass = this.current;
    if (null == pass) {
      return;
    }
    pass.cancelled = true;
    pass.future.cancel(false);
    this.current = null;
    this.state = VaultState.CLOSED;
    this.store.evictVault(pass.vaultId);
    logger.info("Closed vault {}.", pass.vaultId);
  }

  public VaultState getState() {
    return this.state;
  }

  /** Id of the open vault, or {@code null}. */
  public synchronized String getActiveVaultId() {
    return null == this.current ? null : this.current.vaultId;
  }

  /** Future of the open vault's pass, completed if no vault is open. */
  public synchronized Future<VaultState> getOpenFuture() {
    return null == this.current
        ? CompletableFuture.completedFuture(VaultState.CLOSED)
        : this.current.future;
  }

  private VaultState reconcile(Pass pass) throws LocalStorageException {
    String vaultId = pass.vaultId;
    try {
      Vault vault = this.store.ensureVault(vaultId);
      boolean pulled = vault.getLastFullSync() > 0L;
      try {
        this.store.loadVault(vaultId);
      } catch (CorruptionDetectedException e) {
        logger.warn("Local copy of vault {} is corrupt; pulling it again: {}",
            vaultId, e.getMessage());
        this.store.wipeVault(vaultId);
        this.store.loadVault(vaultId);
        pulled = false;
      }
      this.store.touchOpened(vaultId);
      if (!pass.cancelled) {
        try {
          merge(pass, !pulled);
        } catch (LockHeldException e) {
          logger.warn("Opening vault {} from cached state: {}", vaultId,
              e.getMessage());
        } catch (IOException e) {
          logger.warn("Opening vault {} from cached state; remote not "
              + "available: {}", vaultId, e.getMessage());
        }
      }
      int requeued = 0;
      for (SyncOperation operation
          : this.store.reconstructOperations(vaultId)) {
        if (this.queue.offer(operation)) {
          if (OperationKind.DELETE != operation.getKind()) {
            this.events.updateStatus(operation.getMapId(),
                SyncStatus.PENDING);
          }
          requeued++;
        }
      }
      if (requeued > 0) {
        logger.info("Queued {} pending change(s) of vault {}.", requeued,
            vaultId);
      }
      synchronized (this) {
        if (pass != this.current) {
          return VaultState.CLOSED;
        }
        this.state = VaultState.READY;
      }
      logger.info("Vault {} is ready.", vaultId);
      return VaultState.READY;
    } catch (LocalStorageException | RuntimeException e) {
      logger.error("Cannot open vault " + vaultId + ": " + e.getMessage(), e);
      synchronized (this) {
        if (pass == this.current) {
          this.current = null;
          this.state = VaultState.CLOSED;
        }
      }
      throw e;
    } finally {
      synchronized (this) {
        if (pass.cancelled && (null == this.current
            || !this.current.vaultId.equals(vaultId))) {
          this.store.evictVault(vaultId);
        }
      }
    }
  }

  private void merge(Pass pass, boolean fullPull)
      throws IOException, LockHeldException, LocalStorageException {
    String vaultId = pass.vaultId;
    long remoteTimestamp = this.remote.getVaultTimestamp(vaultId);
    if (!fullPull && remoteTimestamp <= this.store.getVault(vaultId)
        .getRemoteTimestamp()) {
      logger.debug("Vault {} is up to date.", vaultId);
      return;
    }
    Lock lock = fullPull ? null : this.locks.acquire(vaultId,
        LOCK_OPERATION, this.lockTimeoutMillis);
    try {
      Set<String> remoteIds = new HashSet<>();
      int touched = 0;
      for (RemoteFile file : this.remote.listFiles(vaultId)) {
        remoteIds.add(file.getFileId());
        if (pass.cancelled) {
          logger.info("Reconciliation of vault {} cancelled.", vaultId);
          return;
        }
        if (mergeMap(vaultId, file)) {
          touched++;
        }
      }
      for (MapDocument local : this.store.listMaps(vaultId)) {
        if (!remoteIds.contains(local.getId())
            && null != local.getRemoteRevision() && !local.isDirty()) {
          this.store.removeLocal(local.getId());
          this.events.forget(local.getId());
          touched++;
        }
      }
      Vault vault = this.store.getVault(vaultId);
      vault.setRemoteTimestamp(remoteTimestamp);
      if (fullPull) {
        vault.setLastFullSync(this.clock.millis());
      }
      this.store.updateVault(vault);
      logger.info("{} of vault {} finished: {} map(s) updated.",
          fullPull ? "Full pull" : "Reconciliation", vaultId, touched);
    } finally {
      if (null != lock) {
        try {
          this.locks.release(lock);
        } catch (IOException e) {
          logger.warn("Cannot release lock of vault {}; it expires at {}.",
              vaultId, lock.getExpiresAt(), e);
        }
      }
    }
  }

  private boolean mergeMap(String vaultId, RemoteFile file)
      throws IOException, LocalStorageException {
    String mapId = file.getFileId();
    MapDocument local = this.store.getMap(mapId);
    if (null != local && file.getRevision().equals(
        local.getRemoteRevision())) {
      return false;
    }
    if (null == local && this.store.isTombstoned(vaultId, mapId)) {
      return false;
    }
    MapPayload payload = this.remote.readFile(vaultId, mapId);
    if (null == payload) {
      return false;
    }
    if (null == local) {
      this.store.applyRemote(payload, file.getModifiedTime(),
          file.getRevision());
      return true;
    }
    Resolution resolution = this.resolver.resolve(vaultId, file, payload,
        false);
    if (Resolution.Outcome.REMOTE_WON == resolution.getOutcome()) {
      this.queue.discardIfNotNewer(mapId,
          resolution.getSupersededModifiedAt());
    }
    return true;
  }
}
