/* Copyright 2026 The MapVault Project
 * See LICENSE for licensing information */

package org.mapvault.sync.persist;

import org.mapvault.sync.model.Edge;
import org.mapvault.sync.model.MapDocument;
import org.mapvault.sync.model.MapPayload;
import org.mapvault.sync.model.Node;
import org.mapvault.sync.model.NodeUpdate;
import org.mapvault.sync.model.SearchHit;
import org.mapvault.sync.model.Serialization;
import org.mapvault.sync.model.SyncOperation;
import org.mapvault.sync.model.Vault;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Embedded local store holding vault metadata and maps on disk.
 *
 * <p>Layout below the store path:</p>
 * <ul>
 *   <li>{@code vaults/<vaultId>/vault.json}: vault metadata,</li>
 *   <li>{@code vaults/<vaultId>/maps/<mapId>.json}: one map including all of
 *   its nodes and edges,</li>
 *   <li>{@code vaults/<vaultId>/maps/<mapId>.deleted}: tombstone of a map
 *   whose deletion has not reached the remote backend yet.</li>
 * </ul>
 *
 * <p>Every mutation rewrites one map file atomically, which covers the map
 * and its nodes in one step, sets {@code localModifiedAt}, and hands a
 * {@link SyncOperation} to the operation consumer. Nothing in here touches
 * the network.</p>
 *
 * <p>Maps of loaded vaults are cached in memory; maps of other vaults are
 * read from disk on demand without being cached. Vault metadata is always
 * resident.</p>
 */
public class LocalStore {

  private static final Logger logger = LoggerFactory.getLogger(
      LocalStore.class);

  static final String VAULTS = "vaults";

  static final String MAPS = "maps";

  static final String VAULT_FILE = "vault.json";

  static final String MAP_SUFFIX = ".json";

  static final String TOMBSTONE_SUFFIX = ".deleted";

  /** Change applied to a working copy of a map. */
  private interface MapMutation {
    void apply(MapDocument map, long now);
  }

  private final Path vaultsPath;

  private final Clock clock;

  private final Consumer<SyncOperation> operations;

  private final ObjectMapper objectMapper = Serialization.mapper();

  private final Map<String, Vault> vaults = new HashMap<>();

  /** Vault of every live map on disk. */
  private final Map<String, String> mapVaults = new HashMap<>();

  /** Cached maps of loaded vaults, by vault and map id. */
  private final Map<String, Map<String, MapDocument>> resident
      = new HashMap<>();

  /**
   * Open the local store at the given path, reading all vault metadata and
   * indexing map files.
   *
   * @param storePath Root directory of the store.
   * @param clock Clock for modification timestamps.
   * @param operations Receives one operation per mutation.
   * @throws LocalStorageException Thrown if the store cannot be read.
   */
  public LocalStore(Path storePath, Clock clock,
      Consumer<SyncOperation> operations) throws LocalStorageException {
    this.vaultsPath = storePath.resolve(VAULTS);
    this.clock = clock;
    this.operations = operations;
    try {
      Files.createDirectories(this.vaultsPath);
      PersistenceUtils.cleanDirectory(this.vaultsPath);
      for (String vaultId : listVaultDirectories()) {
        byte[] data = PersistenceUtils.readIfExists(
            vaultDirectory(vaultId).resolve(VAULT_FILE));
        if (null != data) {
          this.vaults.put(vaultId, readVault(vaultId, data));
        }
        for (String mapId : listFileIds(vaultId, MAP_SUFFIX)) {
          this.mapVaults.put(mapId, vaultId);
        }
      }
    } catch (IOException e) {
      throw new LocalStorageException("Cannot open local store at "
          + storePath + ". Reason: " + e.getMessage(), e);
    }
    logger.info("Opened local store at {} with {} vault(s) and {} map(s).",
        storePath, this.vaults.size(), this.mapVaults.size());
  }

  private Vault readVault(String vaultId, byte[] data) {
    try {
      return this.objectMapper.readValue(data, Vault.class);
    } catch (IOException e) {
      logger.warn("Metadata of vault {} is unreadable; the vault will be "
          + "pulled again on open.", vaultId, e);
      return Vault.of(vaultId, vaultId, vaultId);
    }
  }

  /* Vaults. */

  /** Create a new, empty vault. */
  public synchronized Vault createVault(String name, String remoteLocation)
      throws LocalStorageException {
    String id = UUID.randomUUID().toString();
    Vault vault = Vault.of(id, name, null == remoteLocation ? id
        : remoteLocation);
    storeVault(vault);
    logger.info("Created vault {} ({}).", name, id);
    return vault.copy();
  }

  /** Return the vault with the given id, creating it on first use. */
  public synchronized Vault ensureVault(String vaultId)
      throws LocalStorageException {
    Vault vault = this.vaults.get(vaultId);
    if (null == vault) {
      vault = Vault.of(vaultId, vaultId, vaultId);
      storeVault(vault);
      logger.info("Created vault {} on first use.", vaultId);
    }
    return withMapCount(vault);
  }

  /** Return the vault with the given id, or {@code null}. */
  public synchronized Vault getVault(String vaultId) {
    Vault vault = this.vaults.get(vaultId);
    return null == vault ? null : withMapCount(vault);
  }

  /** Return all vaults ordered by name. */
  public synchronized List<Vault> listVaults() {
    List<Vault> result = new ArrayList<>();
    for (Vault vault : this.vaults.values()) {
      result.add(withMapCount(vault));
    }
    result.sort(Comparator.comparing(Vault::getName,
        String.CASE_INSENSITIVE_ORDER));
    return result;
  }

  /** Store updated sync bookkeeping of a vault. */
  public synchronized void updateVault(Vault vault)
      throws LocalStorageException {
    requireVault(vault.getId());
    storeVault(withMapCount(vault));
  }

  /** Give a vault a new display name; its id and remote folder stay. */
  public synchronized Vault renameVault(String vaultId, String name)
      throws LocalStorageException {
    if (null == name || name.trim().isEmpty()) {
      throw new IllegalArgumentException("Vault name must not be blank.");
    }
    Vault vault = requireVault(vaultId).copy();
    vault.setName(name);
    storeVault(withMapCount(vault));
    logger.info("Renamed vault {} to {}.", vaultId, name);
    return withMapCount(vault);
  }

  /** Record that the given vault has just been opened. */
  public synchronized void touchOpened(String vaultId)
      throws LocalStorageException {
    Vault vault = requireVault(vaultId).copy();
    vault.setLastOpened(this.clock.millis());
    storeVault(withMapCount(vault));
  }

  /**
   * Delete a vault and all of its maps. Every map leaves a tombstone and a
   * delete operation behind, so the remote copies get removed, too.
   */
  public synchronized void deleteVault(String vaultId)
      throws LocalStorageException {
    requireVault(vaultId);
    List<String> mapIds = new ArrayList<>();
    for (Map.Entry<String, String> entry : this.mapVaults.entrySet()) {
      if (entry.getValue().equals(vaultId)) {
        mapIds.add(entry.getKey());
      }
    }
    for (String mapId : mapIds) {
      deleteMapFiles(vaultId, mapId);
    }
    try {
      Files.deleteIfExists(vaultDirectory(vaultId).resolve(VAULT_FILE));
    } catch (IOException e) {
      throw new LocalStorageException("Cannot delete vault " + vaultId
          + ". Reason: " + e.getMessage(), e);
    }
    this.vaults.remove(vaultId);
    this.resident.remove(vaultId);
    removeEmptyVaultDirectory(vaultId);
    logger.info("Deleted vault {} with {} map(s).", vaultId, mapIds.size());
  }

  /* Maps. */

  /** Create an empty map in the given vault. */
  public synchronized MapDocument createMap(String vaultId, String title)
      throws LocalStorageException {
    requireVault(vaultId);
    long now = this.clock.millis();
    MapDocument map = MapDocument.create(UUID.randomUUID().toString(),
        vaultId, title, now);
    writeMap(map);
    this.operations.accept(SyncOperation.create(map, now));
    logger.debug("Created map {} in vault {}.", map.getId(), vaultId);
    return map.copy();
  }

  /** Change the title of a map. */
  public synchronized MapDocument renameMap(String mapId, String title)
      throws LocalStorageException {
    return mutate(mapId, (map, now) -> map.setTitle(title)).copy();
  }

  /**
   * Add a node below the given parent, or at the top for {@code null}, as
   * the last of its siblings.
   */
  public synchronized Node createNode(String mapId, String parentId,
      String title, String content) throws LocalStorageException {
    String nodeId = UUID.randomUUID().toString();
    MapDocument map = mutate(mapId, (working, now) -> {
      if (null != parentId && null == working.findNode(parentId)) {
        throw new IllegalArgumentException("Unknown parent node " + parentId
            + " in map " + mapId);
      }
      int order = 0;
      for (Node node : working.getNodes()) {
        if (Objects.equals(parentId, node.getParentId())) {
          order++;
        }
      }
      working.getNodes().add(Node.of(nodeId, parentId, title, content, order,
          now));
    });
    return map.findNode(nodeId).copy();
  }

  /** Apply the given changes to one node. */
  public synchronized MapDocument updateNode(String mapId, String nodeId,
      NodeUpdate update) throws LocalStorageException {
    return mutate(mapId, (map, now) -> {
      Node node = map.findNode(nodeId);
      if (null == node) {
        throw new IllegalArgumentException("Unknown node " + nodeId
            + " in map " + mapId);
      }
      update.applyTo(node, now);
    }).copy();
  }

  /** Delete a node, its subtree, and all edges touching deleted nodes. */
  public synchronized MapDocument deleteNode(String mapId, String nodeId)
      throws LocalStorageException {
    return mutate(mapId, (map, now) -> {
      if (null == map.findNode(nodeId)) {
        throw new IllegalArgumentException("Unknown node " + nodeId
            + " in map " + mapId);
      }
      Set<String> doomed = new HashSet<>();
      doomed.add(nodeId);
      boolean grown = true;
      while (grown) {
        grown = false;
        for (Node node : map.getNodes()) {
          if (null != node.getParentId() && doomed.contains(node.getParentId())
              && doomed.add(node.getId())) {
            grown = true;
          }
        }
      }
      map.getNodes().removeIf(node -> doomed.contains(node.getId()));
      map.getEdges().removeIf(edge -> doomed.contains(edge.getSourceId())
          || doomed.contains(edge.getTargetId()));
    }).copy();
  }

  /** Link two nodes of the same map. */
  public synchronized Edge addEdge(String mapId, String sourceId,
      String targetId, String label) throws LocalStorageException {
    Edge edge = Edge.of(UUID.randomUUID().toString(), sourceId, targetId,
        label);
    mutate(mapId, (map, now) -> map.getEdges().add(edge));
    return edge.copy();
  }

  /** Remove an edge. */
  public synchronized MapDocument removeEdge(String mapId, String edgeId)
      throws LocalStorageException {
    return mutate(mapId, (map, now) -> {
      if (!map.getEdges().removeIf(edge -> edge.getId().equals(edgeId))) {
        throw new IllegalArgumentException("Unknown edge " + edgeId
            + " in map " + mapId);
      }
    }).copy();
  }

  /** Delete a map, leaving a tombstone until the remote copy is gone. */
  public synchronized void deleteMap(String mapId)
      throws LocalStorageException {
    String vaultId = this.mapVaults.get(mapId);
    if (null == vaultId) {
      throw new IllegalArgumentException("Unknown map " + mapId);
    }
    deleteMapFiles(vaultId, mapId);
    logger.debug("Deleted map {} in vault {}.", mapId, vaultId);
  }

  private void deleteMapFiles(String vaultId, String mapId)
      throws LocalStorageException {
    long now = this.clock.millis();
    try {
      PersistenceUtils.storeAtomically(
          Long.toString(now).getBytes(StandardCharsets.UTF_8),
          tombstonePath(vaultId, mapId));
      Files.deleteIfExists(mapPath(vaultId, mapId));
    } catch (IOException e) {
      throw new LocalStorageException("Cannot delete map " + mapId
          + ". Reason: " + e.getMessage(), e);
    }
    this.mapVaults.remove(mapId);
    Map<String, MapDocument> cached = this.resident.get(vaultId);
    if (null != cached) {
      cached.remove(mapId);
    }
    this.operations.accept(SyncOperation.delete(vaultId, mapId, now));
  }

  /** Return a copy of the map with the given id, or {@code null}. */
  public synchronized MapDocument getMap(String mapId)
      throws LocalStorageException {
    String vaultId = this.mapVaults.get(mapId);
    if (null == vaultId) {
      return null;
    }
    return loadMap(vaultId, mapId).copy();
  }

  /** Return copies of all maps of a vault ordered by title. */
  public synchronized List<MapDocument> listMaps(String vaultId)
      throws LocalStorageException {
    requireVault(vaultId);
    List<MapDocument> result = new ArrayList<>();
    for (MapDocument map : mapsOf(vaultId)) {
      result.add(map.copy());
    }
    result.sort(Comparator.comparing(map -> null == map.getTitle() ? ""
        : map.getTitle().toLowerCase(Locale.ROOT)));
    return result;
  }

  /**
   * Find maps and nodes of a vault whose title or content contains the
   * query, ignoring case.
   */
  public synchronized List<SearchHit> search(String vaultId, String query)
      throws LocalStorageException {
    requireVault(vaultId);
    List<SearchHit> hits = new ArrayList<>();
    if (null == query || query.trim().isEmpty()) {
      return hits;
    }
    String needle = query.trim().toLowerCase(Locale.ROOT);
    for (MapDocument map : listMaps(vaultId)) {
      if (contains(map.getTitle(), needle)) {
        hits.add(new SearchHit(map.getId(), map.getTitle(), null,
            map.getTitle()));
      }
      for (Node node : map.getNodes()) {
        if (contains(node.getTitle(), needle)) {
          hits.add(new SearchHit(map.getId(), map.getTitle(), node.getId(),
              node.getTitle()));
        } else if (contains(node.getContent(), needle)) {
          hits.add(new SearchHit(map.getId(), map.getTitle(), node.getId(),
              node.getContent()));
        }
      }
    }
    return hits;
  }

  private static boolean contains(String haystack, String needle) {
    return null != haystack
        && haystack.toLowerCase(Locale.ROOT).contains(needle);
  }

  /* Sync bookkeeping, used by the sync worker and the vault switcher. */

  /**
   * Replace the local copy of a map with remote content and mark it clean.
   * Removes a tombstone of the same map, if any.
   */
  public synchronized MapDocument applyRemote(MapPayload payload,
      long remoteModifiedTime, String revision) throws LocalStorageException {
    requireVault(payload.getVaultId());
    MapDocument map = MapDocument.fromPayload(payload, remoteModifiedTime,
        revision);
    String problem = map.checkIntegrity();
    if (null != problem) {
      throw new LocalStorageException("Refusing inconsistent remote map: "
          + problem);
    }
    writeMap(map);
    try {
      Files.deleteIfExists(tombstonePath(map.getVaultId(), map.getId()));
    } catch (IOException e) {
      throw new LocalStorageException("Cannot remove tombstone of map "
          + map.getId() + ". Reason: " + e.getMessage(), e);
    }
    return map.copy();
  }

  /**
   * Like {@link #applyRemote}, but only if the local copy still has the
   * given modification time.
   *
   * @return The replaced map, or {@code null} if the map was changed or
   *     deleted meanwhile.
   */
  public synchronized MapDocument replaceIfUnchanged(MapPayload payload,
      long remoteModifiedTime, String revision, long expectedModifiedAt)
      throws LocalStorageException {
    String vaultId = this.mapVaults.get(payload.getId());
    if (null == vaultId || loadMap(vaultId, payload.getId())
        .getLocalModifiedAt() != expectedModifiedAt) {
      return null;
    }
    return applyRemote(payload, remoteModifiedTime, revision);
  }

  /**
   * Record a successful push of the snapshot with the given modification
   * time. The map stays dirty if it was changed after the snapshot.
   *
   * @return {@code false} if the map no longer exists locally.
   */
  public synchronized boolean markSynced(String mapId,
      long snapshotModifiedAt, String revision) throws LocalStorageException {
    String vaultId = this.mapVaults.get(mapId);
    if (null == vaultId) {
      return false;
    }
    MapDocument map = loadMap(vaultId, mapId).copy();
    map.setLastSyncedAt(Math.min(snapshotModifiedAt,
        map.getLocalModifiedAt()));
    map.setRemoteRevision(revision);
    writeMap(map);
    return true;
  }

  /** Drop the local copy of a map that was deleted remotely. */
  public synchronized void removeLocal(String mapId)
      throws LocalStorageException {
    String vaultId = this.mapVaults.remove(mapId);
    if (null == vaultId) {
      return;
    }
    try {
      Files.deleteIfExists(mapPath(vaultId, mapId));
    } catch (IOException e) {
      throw new LocalStorageException("Cannot remove map " + mapId
          + ". Reason: " + e.getMessage(), e);
    }
    Map<String, MapDocument> cached = this.resident.get(vaultId);
    if (null != cached) {
      cached.remove(mapId);
    }
  }

  /** Whether a map deletion is waiting for the remote backend. */
  public synchronized boolean isTombstoned(String vaultId, String mapId) {
    return Files.exists(tombstonePath(vaultId, mapId));
  }

  /** Remove the tombstone after the remote copy has been deleted. */
  public synchronized void clearTombstone(String vaultId, String mapId)
      throws LocalStorageException {
    try {
      Files.deleteIfExists(tombstonePath(vaultId, mapId));
    } catch (IOException e) {
      throw new LocalStorageException("Cannot remove tombstone of map "
          + mapId + ". Reason: " + e.getMessage(), e);
    }
    if (!this.vaults.containsKey(vaultId)) {
      removeEmptyVaultDirectory(vaultId);
    }
  }

  /** Return copies of all maps of a vault with unsynced local edits. */
  public synchronized List<MapDocument> listUnsynced(String vaultId)
      throws LocalStorageException {
    List<MapDocument> result = new ArrayList<>();
    for (MapDocument map : mapsOf(vaultId)) {
      if (map.isDirty()) {
        result.add(map.copy());
      }
    }
    return result;
  }

  /** Return the ids of deleted maps not yet deleted remotely. */
  public synchronized SortedSet<String> listTombstones(String vaultId)
      throws LocalStorageException {
    try {
      return listFileIds(vaultId, TOMBSTONE_SUFFIX);
    } catch (IOException e) {
      throw new LocalStorageException("Cannot list tombstones of vault "
          + vaultId + ". Reason: " + e.getMessage(), e);
    }
  }

  /**
   * Reconstruct the pending operations of one vault from the store: an
   * update for every map with {@code localModifiedAt > lastSyncedAt} and a
   * delete for every tombstone.
   */
  public synchronized List<SyncOperation> reconstructOperations(
      String vaultId) throws LocalStorageException {
    List<SyncOperation> result = new ArrayList<>();
    long now = this.clock.millis();
    for (MapDocument map : listUnsynced(vaultId)) {
      result.add(null == map.getRemoteRevision()
          ? SyncOperation.create(map, now) : SyncOperation.update(map, now));
    }
    for (String mapId : listTombstones(vaultId)) {
      result.add(SyncOperation.delete(vaultId, mapId, now));
    }
    return result;
  }

  /**
   * Reconstruct the pending operations of all vaults on disk, including
   * deleted vaults with outstanding tombstones. Vaults that cannot be read
   * are skipped and logged; they get re-pulled when opened.
   */
  public synchronized List<SyncOperation> reconstructOperations()
      throws LocalStorageException {
    List<SyncOperation> result = new ArrayList<>();
    SortedSet<String> vaultIds;
    try {
      vaultIds = listVaultDirectories();
    } catch (IOException e) {
      throw new LocalStorageException("Cannot list vaults. Reason: "
          + e.getMessage(), e);
    }
    for (String vaultId : vaultIds) {
      try {
        result.addAll(reconstructOperations(vaultId));
      } catch (CorruptionDetectedException e) {
        logger.warn("Skipping pending operations of vault {}: {}", vaultId,
            e.getMessage());
      }
    }
    return result;
  }

  /** Read all maps of a vault into memory. */
  public synchronized void loadVault(String vaultId)
      throws LocalStorageException {
    requireVault(vaultId);
    Map<String, MapDocument> maps = new HashMap<>();
    try {
      for (String mapId : listFileIds(vaultId, MAP_SUFFIX)) {
        maps.put(mapId, readMap(vaultId, mapId));
      }
    } catch (IOException e) {
      throw new LocalStorageException("Cannot load vault " + vaultId
          + ". Reason: " + e.getMessage(), e);
    }
    this.resident.put(vaultId, maps);
    logger.debug("Loaded {} map(s) of vault {}.", maps.size(), vaultId);
  }

  /** Drop the cached maps of a vault; its metadata stays resident. */
  public synchronized void evictVault(String vaultId) {
    if (null != this.resident.remove(vaultId)) {
      logger.debug("Evicted maps of vault {}.", vaultId);
    }
  }

  public synchronized boolean isResident(String vaultId) {
    return this.resident.containsKey(vaultId);
  }

  /**
   * Delete all local maps and tombstones of a vault and reset its sync
   * bookkeeping, so that the next open performs a full pull.
   */
  public synchronized void wipeVault(String vaultId)
      throws LocalStorageException {
    Vault vault = requireVault(vaultId).copy();
    try {
      PersistenceUtils.deleteRecursively(vaultDirectory(vaultId)
          .resolve(MAPS));
    } catch (IOException e) {
      throw new LocalStorageException("Cannot wipe vault " + vaultId
          + ". Reason: " + e.getMessage(), e);
    }
    this.mapVaults.values().removeIf(vaultId::equals);
    if (this.resident.containsKey(vaultId)) {
      this.resident.put(vaultId, new HashMap<>());
    }
    vault.setLastFullSync(0L);
    vault.setRemoteTimestamp(0L);
    storeVault(withMapCount(vault));
    logger.warn("Wiped local copy of vault {}.", vaultId);
  }

  /* Helpers. */

  private MapDocument mutate(String mapId, MapMutation mutation)
      throws LocalStorageException {
    String vaultId = this.mapVaults.get(mapId);
    if (null == vaultId) {
      throw new IllegalArgumentException("Unknown map " + mapId);
    }
    MapDocument current = loadMap(vaultId, mapId);
    long now = Math.max(this.clock.millis(),
        current.getLocalModifiedAt() + 1L);
    MapDocument next = current.copy();
    mutation.apply(next, now);
    String problem = next.checkIntegrity();
    if (null != problem) {
      throw new IllegalArgumentException(problem);
    }
    next.setLocalModifiedAt(now);
    writeMap(next);
    this.operations.accept(null == next.getRemoteRevision()
        ? SyncOperation.create(next, now) : SyncOperation.update(next, now));
    return next;
  }

  private Vault requireVault(String vaultId) {
    Vault vault = this.vaults.get(vaultId);
    if (null == vault) {
      throw new IllegalArgumentException("Unknown vault " + vaultId);
    }
    return vault;
  }

  private Vault withMapCount(Vault vault) {
    Vault copy = vault.copy();
    int count = 0;
    for (String vaultId : this.mapVaults.values()) {
      if (vaultId.equals(vault.getId())) {
        count++;
      }
    }
    copy.setMapCount(count);
    return copy;
  }

  private List<MapDocument> mapsOf(String vaultId)
      throws LocalStorageException {
    Map<String, MapDocument> cached = this.resident.get(vaultId);
    if (null != cached) {
      return new ArrayList<>(cached.values());
    }
    List<MapDocument> maps = new ArrayList<>();
    for (Map.Entry<String, String> entry : this.mapVaults.entrySet()) {
      if (entry.getValue().equals(vaultId)) {
        maps.add(readMap(vaultId, entry.getKey()));
      }
    }
    return maps;
  }

  private MapDocument loadMap(String vaultId, String mapId)
      throws LocalStorageException {
    Map<String, MapDocument> cached = this.resident.get(vaultId);
    if (null != cached) {
      MapDocument map = cached.get(mapId);
      if (null != map) {
        return map;
      }
    }
    return readMap(vaultId, mapId);
  }

  private MapDocument readMap(String vaultId, String mapId)
      throws LocalStorageException {
    Path path = mapPath(vaultId, mapId);
    MapDocument map;
    try {
      map = this.objectMapper.readValue(path.toFile(), MapDocument.class);
    } catch (JsonProcessingException e) {
      throw new CorruptionDetectedException(vaultId, "Cannot parse map "
          + mapId + " of vault " + vaultId + ". Reason: " + e.getMessage(), e);
    } catch (IOException e) {
      throw new LocalStorageException("Cannot read map " + mapId
          + ". Reason: " + e.getMessage(), e);
    }
    String problem = map.checkIntegrity();
    if (null != problem) {
      throw new CorruptionDetectedException(vaultId, problem);
    }
    if (!mapId.equals(map.getId()) || !vaultId.equals(map.getVaultId())) {
      throw new CorruptionDetectedException(vaultId, "File of map " + mapId
          + " contains map " + map.getId() + " of vault " + map.getVaultId());
    }
    return map;
  }

  private void writeMap(MapDocument map) throws LocalStorageException {
    try {
      PersistenceUtils.storeAtomically(
          this.objectMapper.writeValueAsBytes(map),
          mapPath(map.getVaultId(), map.getId()));
    } catch (IOException e) {
      throw new LocalStorageException("Cannot store map " + map.getId()
          + ". Reason: " + e.getMessage(), e);
    }
    this.mapVaults.put(map.getId(), map.getVaultId());
    Map<String, MapDocument> cached = this.resident.get(map.getVaultId());
    if (null != cached) {
      cached.put(map.getId(), map.copy());
    }
  }

  private void storeVault(Vault vault) throws LocalStorageException {
    try {
      PersistenceUtils.storeAtomically(
          this.objectMapper.writeValueAsBytes(vault),
          vaultDirectory(vault.getId()).resolve(VAULT_FILE));
    } catch (IOException e) {
      throw new LocalStorageException("Cannot store vault " + vault.getId()
          + ". Reason: " + e.getMessage(), e);
    }
    this.vaults.put(vault.getId(), vault.copy());
  }

  private void removeEmptyVaultDirectory(String vaultId) {
    Path mapsPath = vaultDirectory(vaultId).resolve(MAPS);
    try {
      if (Files.isDirectory(mapsPath)) {
        try (DirectoryStream<Path> entries
            = Files.newDirectoryStream(mapsPath)) {
          if (entries.iterator().hasNext()) {
            return;
          }
        }
      }
      PersistenceUtils.deleteRecursively(vaultDirectory(vaultId));
    } catch (IOException e) {
      logger.warn("Cannot remove directory of deleted vault {}.", vaultId, e);
    }
  }

  private SortedSet<String> listVaultDirectories() throws IOException {
    SortedSet<String> result = new TreeSet<>();
    if (!Files.isDirectory(this.vaultsPath)) {
      return result;
    }
    try (DirectoryStream<Path> dirs
        = Files.newDirectoryStream(this.vaultsPath)) {
      for (Path dir : dirs) {
        if (Files.isDirectory(dir)) {
          result.add(dir.getFileName().toString());
        }
      }
    }
    return result;
  }

  private SortedSet<String> listFileIds(String vaultId, String suffix)
      throws IOException {
    SortedSet<String> result = new TreeSet<>();
    Path mapsPath = vaultDirectory(vaultId).resolve(MAPS);
    if (!Files.isDirectory(mapsPath)) {
      return result;
    }
    try (DirectoryStream<Path> files
        = Files.newDirectoryStream(mapsPath, "*" + suffix)) {
      for (Path file : files) {
        String name = file.getFileName().toString();
        result.add(name.substring(0, name.length() - suffix.length()));
      }
    }
    return result;
  }

  private Path vaultDirectory(String vaultId) {
    return this.vaultsPath.resolve(vaultId);
  }

  private Path mapPath(String vaultId, String mapId) {
    return vaultDirectory(vaultId).resolve(MAPS).resolve(mapId + MAP_SUFFIX);
  }

  private Path tombstonePath(String vaultId, String mapId) {
    return vaultDirectory(vaultId).resolve(MAPS).resolve(mapId
        + TOMBSTONE_SUFFIX);
  }
}
