/* Copyright 2026 The MapVault Project
 * See LICENSE for licensing information */

package org.mapvault.sync.conflict;

import org.mapvault.sync.model.MapDocument;
import org.mapvault.sync.model.Serialization;
import org.mapvault.sync.persist.LocalStorageException;
import org.mapvault.sync.persist.PersistenceUtils;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Gzip-compressed JSON snapshots of local map versions that lost a
 * conflict, stored as {@code <mapId>/<timestamp>.json.gz} and referenced as
 * {@code <mapId>/<timestamp>}.
 */
public class BackupStore {

  private static final Logger logger = LoggerFactory.getLogger(
      BackupStore.class);

  static final String SUFFIX = ".json.gz";

  private static final Pattern REF = Pattern.compile(
      "[A-Za-z0-9._-]+/[0-9]+");

  private final Path backupPath;

  private final Clock clock;

  private final ObjectMapper objectMapper = Serialization.mapper();

  public BackupStore(Path backupPath, Clock clock) {
    this.backupPath = backupPath;
    this.clock = clock;
  }

  /**
   * Store a snapshot of the given map.
   *
   * @return Reference for retrieving the snapshot.
   */
  public synchronized String save(MapDocument map)
      throws LocalStorageException {
    long timestamp = this.clock.millis();
    while (Files.exists(file(map.getId(), timestamp))) {
      timestamp++;
    }
    ByteArrayOutputStream baos = new ByteArrayOutputStream();
    try {
      try (OutputStream gzCompressed = new GzipCompressorOutputStream(baos)) {
        this.objectMapper.writeValue(gzCompressed, map);
      }
      PersistenceUtils.storeAtomically(baos.toByteArray(),
          file(map.getId(), timestamp));
    } catch (IOException e) {
      throw new LocalStorageException("Cannot back up map " + map.getId()
          + ". Reason: " + e.getMessage(), e);
    }
    String ref = map.getId() + "/" + timestamp;
    logger.info("Backed up local version of map {} as {}.", map.getId(), ref);
    return ref;
  }

  /** Load a snapshot, or return {@code null} if there is none. */
  public synchronized MapDocument load(String ref)
      throws LocalStorageException {
    if (null == ref || !REF.matcher(ref).matches()) {
      throw new IllegalArgumentException("Invalid backup reference " + ref);
    }
    Path path = this.backupPath.resolve(ref + SUFFIX);
    if (!Files.exists(path)) {
      return null;
    }
    try (InputStream in = new GzipCompressorInputStream(
        Files.newInputStream(path))) {
      return this.objectMapper.readValue(in, MapDocument.class);
    } catch (IOException e) {
      throw new LocalStorageException("Cannot read backup " + ref
          + ". Reason: " + e.getMessage(), e);
    }
  }

  /** References of all snapshots of a map, oldest first. */
  public synchronized List<String> list(String mapId)
      throws LocalStorageException {
    List<Long> timestamps = new ArrayList<>();
    Path directory = this.backupPath.resolve(mapId);
    if (Files.isDirectory(directory)) {
      try (DirectoryStream<Path> files = Files.newDirectoryStream(directory,
          "*" + SUFFIX)) {
        for (Path file : files) {
          String name = file.getFileName().toString();
          timestamps.add(Long.parseLong(name.substring(0,
              name.length() - SUFFIX.length())));
        }
      } catch (IOException | NumberFormatException e) {
        throw new LocalStorageException("Cannot list backups of map " + mapId
            + ". Reason: " + e.getMessage(), e);
      }
    }
    timestamps.sort(null);
    List<String> refs = new ArrayList<>();
    for (long timestamp : timestamps) {
      refs.add(mapId + "/" + timestamp);
    }
    return refs;
  }

  private Path file(String mapId, long timestamp) {
    return this.backupPath.resolve(mapId).resolve(timestamp + SUFFIX);
  }
}
