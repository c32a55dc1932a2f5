/* Copyright 2026 The MapVault Project
 * See LICENSE for licensing information */

package org.mapvault.sync;

import org.mapvault.sync.conf.Configuration;
import org.mapvault.sync.conf.ConfigurationException;
import org.mapvault.sync.conf.Key;
import org.mapvault.sync.conf.LockMode;
import org.mapvault.sync.conflict.BackupStore;
import org.mapvault.sync.conflict.ConflictResolver;
import org.mapvault.sync.conflict.ResolutionEntry;
import org.mapvault.sync.conflict.ResolutionLog;
import org.mapvault.sync.cron.Scheduler;
import org.mapvault.sync.event.SyncEvents;
import org.mapvault.sync.event.SyncListener;
import org.mapvault.sync.event.SyncStatus;
import org.mapvault.sync.lock.LockFile;
import org.mapvault.sync.lock.LockManager;
import org.mapvault.sync.lock.LockStatus;
import org.mapvault.sync.lock.LockStore;
import org.mapvault.sync.lock.RemoteLockStore;
import org.mapvault.sync.model.Edge;
import org.mapvault.sync.model.MapDocument;
import org.mapvault.sync.model.Node;
import org.mapvault.sync.model.NodeUpdate;
import org.mapvault.sync.model.OperationKind;
import org.mapvault.sync.model.SearchHit;
import org.mapvault.sync.model.SyncOperation;
import org.mapvault.sync.model.Vault;
import org.mapvault.sync.persist.LocalStorageException;
import org.mapvault.sync.persist.LocalStore;
import org.mapvault.sync.persist.PersistenceUtils;
import org.mapvault.sync.queue.Backoff;
import org.mapvault.sync.queue.OperationQueue;
import org.mapvault.sync.queue.SyncSummary;
import org.mapvault.sync.queue.SyncWorker;
import org.mapvault.sync.remote.RemoteAdapter;
import org.mapvault.sync.vault.VaultState;
import org.mapvault.sync.vault.VaultSwitcher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledFuture;

/**
 * Local-first sync engine for vaults of maps.
 *
 * <p>All reads and edits go to the local store and return immediately.
 * Every edit queues a sync operation which the background worker pushes to
 * the remote backend while online. Opening a vault reconciles its local
 * copy with the remote in the background.</p>
 *
 * <p>Call {@link #start()} to enable background syncing and {@link #close()}
 * to stop it.</p>
 */
public class SyncEngine implements AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(
      SyncEngine.class);

  static final String BACKUPS = "backups";

  static final String RESOLUTIONS = "resolutions.jsonl";

  static final String LOCKS = "locks";

  private final Configuration config;

  private final SyncEvents events = new SyncEvents();

  private final OperationQueue queue;

  private final LocalStore store;

  private final BackupStore backups;

  private final ResolutionLog resolutionLog;

  private final LockManager locks;

  private final Scheduler scheduler;

  private final SyncWorker worker;

  private final VaultSwitcher switcher;

  private ScheduledFuture<?> periodicSync;

  private boolean started = false;

  /** Create an engine using the system clock. */
  public SyncEngine(Configuration conf, RemoteAdapter remote)
      throws ConfigurationException, LocalStorageException {
    this(conf, remote, Clock.systemUTC());
  }

  /**
   * Create an engine from the given configuration.
   *
   * @throws ConfigurationException Thrown if a property is missing or
   *     malformed.
   * @throws LocalStorageException Thrown if the local store cannot be
   *     opened.
   */
  public SyncEngine(Configuration conf, RemoteAdapter remote, Clock clock)
      throws ConfigurationException, LocalStorageException {
    this.config = new Configuration();
    this.config.putAll(conf.getPropertiesCopy());
    Path storePath = this.config.getPath(Key.StorePath);
    this.queue = new OperationQueue(clock, new Backoff(
        this.config.getLong(Key.BackoffInitialMillis),
        this.config.getLong(Key.BackoffMaxMillis)));
    this.store = new LocalStore(storePath, clock, this::recordLocalChange);
    try {
      PersistenceUtils.checkAvailableSpace(storePath);
    } catch (IOException e) {
      logger.warn("Cannot determine available space for {}.", storePath, e);
    }
    this.backups = new BackupStore(storePath.resolve(BACKUPS), clock);
    this.resolutionLog = new ResolutionLog(storePath.resolve(RESOLUTIONS));
    ConflictResolver resolver = new ConflictResolver(this.store, remote,
        this.backups, this.resolutionLog, this.events, clock);
    LockStore lockStore = LockMode.Local
        == this.config.getLockMode(Key.LockMode)
        ? new LockFile(storePath.resolve(LOCKS)) : new RemoteLockStore(remote);
    this.locks = new LockManager(lockStore, clock,
        this.config.getString(Key.DeviceId));
    this.scheduler = new Scheduler("MapVault", 4,
        this.config.getLong(Key.ShutdownGraceWaitMinutes));
    this.worker = new SyncWorker(this.store, remote, this.queue, resolver,
        this.events, this.scheduler, clock,
        this.config.getInt(Key.SyncBatchSize));
    this.switcher = new VaultSwitcher(this.store, remote, this.locks,
        resolver, this.queue, this.events, this.scheduler, clock,
        this.config.getLong(Key.LockTimeoutMillis));
  }

  /**
   * Recover pending operations of all vaults, start syncing on every edit
   * and schedule the periodic sync.
   */
  public synchronized void start()
      throws ConfigurationException, LocalStorageException {
    if (this.started) {
      return;
    }
    this.started = true;
    int recovered = 0;
    for (SyncOperation operation : this.store.reconstructOperations()) {
      if (this.queue.offer(operation)) {
        if (OperationKind.DELETE != operation.getKind()) {
          this.events.updateStatus(operation.getMapId(), SyncStatus.PENDING);
        }
        recovered++;
      }
    }
    logger.info("Recovered {} pending operation(s).", recovered);
    this.queue.addEnqueueListener(this.worker::requestSync);
    this.periodicSync = this.scheduler.schedulePeriodic(this.worker,
        this.config.getInt(Key.SyncOffsetMinutes),
        this.config.getInt(Key.SyncPeriodMinutes));
    this.worker.requestSync();
  }

  /* Publish the pending status before the worker can pick the change up. */
  private void recordLocalChange(SyncOperation operation) {
    if (OperationKind.DELETE == operation.getKind()) {
      this.events.forget(operation.getMapId());
    } else {
      this.events.updateStatus(operation.getMapId(), SyncStatus.PENDING);
    }
    this.queue.enqueue(operation);
  }

  /* Vaults. */

  public Vault createVault(String name) throws LocalStorageException {
    return this.store.createVault(name, null);
  }

  public Vault renameVault(String vaultId, String name)
      throws LocalStorageException {
    return this.store.renameVault(vaultId, name);
  }

  public Vault getVault(String vaultId) {
    return this.store.getVault(vaultId);
  }

  public List<Vault> listVaults() {
    return this.store.listVaults();
  }

  /** Delete a vault locally and, through the queue, remotely. */
  public void deleteVault(String vaultId) throws LocalStorageException {
    if (vaultId.equals(this.switcher.getActiveVaultId())) {
      this.switcher.closeVault();
    }
    this.store.deleteVault(vaultId);
  }

  /** Open a vault; the future completes when it is ready. */
  public Future<VaultState> openVault(String vaultId) {
    return this.switcher.openVault(vaultId);
  }

  public Future<VaultState> switchVault(String vaultId) {
    return this.switcher.switchVault(vaultId);
  }

  public void closeVault() {
    this.switcher.closeVault();
  }

  public VaultState getVaultState() {
    return this.switcher.getState();
  }

  public String getActiveVaultId() {
    return this.switcher.getActiveVaultId();
  }

  /* Maps. */

  public MapDocument createMap(String vaultId, String title)
      throws LocalStorageException {
    return this.store.createMap(vaultId, title);
  }

  public MapDocument renameMap(String mapId, String title)
      throws LocalStorageException {
    return this.store.renameMap(mapId, title);
  }

  public void deleteMap(String mapId) throws LocalStorageException {
    this.store.deleteMap(mapId);
  }

  public MapDocument getMap(String mapId) throws LocalStorageException {
    return this.store.getMap(mapId);
  }

  public List<MapDocument> listMaps(String vaultId)
      throws LocalStorageException {
    return this.store.listMaps(vaultId);
  }

  public List<SearchHit> search(String vaultId, String query)
      throws LocalStorageException {
    return this.store.search(vaultId, query);
  }

  public Node createNode(String mapId, String parentId, String title,
      String content) throws LocalStorageException {
    return this.store.createNode(mapId, parentId, title, content);
  }

  public MapDocument updateNode(String mapId, String nodeId,
      NodeUpdate update) throws LocalStorageException {
    return this.store.updateNode(mapId, nodeId, update);
  }

  public MapDocument deleteNode(String mapId, String nodeId)
      throws LocalStorageException {
    return this.store.deleteNode(mapId, nodeId);
  }

  public Edge addEdge(String mapId, String sourceId, String targetId,
      String label) throws LocalStorageException {
    return this.store.addEdge(mapId, sourceId, targetId, label);
  }

  public MapDocument removeEdge(String mapId, String edgeId)
      throws LocalStorageException {
    return this.store.removeEdge(mapId, edgeId);
  }

  /* Sync. */

  /** Report a network connectivity change. */
  public void setOnline(boolean online) {
    this.worker.setOnline(online);
  }

  /** Ask for a background sync. */
  public void requestSync() {
    this.worker.requestSync();
  }

  /** Sync all due operations on the calling thread. */
  public SyncSummary syncNow() {
    return this.worker.drain();
  }

  public SyncSummary getSyncSummary() {
    return this.worker.getSummary();
  }

  public SyncStatus getSyncStatus(String mapId) {
    return this.events.getStatus(mapId);
  }

  /** Advisory lock check; queries the lock backend. */
  public LockStatus isLocked(String vaultId) throws IOException {
    return this.locks.isLocked(vaultId);
  }

  /** Load a backup taken when a remote version won a conflict. */
  public MapDocument getBackup(String backupRef)
      throws LocalStorageException {
    return this.backups.load(backupRef);
  }

  public List<String> listBackups(String mapId)
      throws LocalStorageException {
    return this.backups.list(mapId);
  }

  public List<ResolutionEntry> listResolutions()
      throws LocalStorageException {
    return this.resolutionLog.readAll();
  }

  public void addListener(SyncListener listener) {
    this.events.addListener(listener);
  }

  public void removeListener(SyncListener listener) {
    this.events.removeListener(listener);
  }

  /** Close the open vault and stop all background work. */
  @Override
  public void close() {
    this.switcher.closeVault();
    if (null != this.periodicSync) {
      this.periodicSync.cancel(false);
    }
    this.worker.cancelWakeUp();
    this.scheduler.shutdownScheduler();
    this.worker.shutdown();
    logger.info("Sync engine stopped with {} pending operation(s).",
        this.queue.size());
  }
}
