/* Copyright 2026 The MapVault Project
 * See LICENSE for licensing information */

package org.mapvault.sync.conflict;

import org.mapvault.sync.model.Serialization;
import org.mapvault.sync.persist.LocalStorageException;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/** Append-only log of resolved conflicts, one JSON object per line. */
public class ResolutionLog {

  private final Path logPath;

  private final ObjectMapper objectMapper = Serialization.mapper();

  public ResolutionLog(Path logPath) {
    this.logPath = logPath;
  }

  /** Append an entry. */
  public synchronized void append(ResolutionEntry entry)
      throws LocalStorageException {
    try {
      Files.createDirectories(this.logPath.getParent());
      String line = this.objectMapper.writeValueAsString(entry) + "\n";
      Files.write(this.logPath, line.getBytes(StandardCharsets.UTF_8),
          StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    } catch (IOException e) {
      throw new LocalStorageException("Cannot append to resolution log "
          + this.logPath + ". Reason: " + e.getMessage(), e);
    }
  }

  /** Read all entries, oldest first. */
  public synchronized List<ResolutionEntry> readAll()
      throws LocalStorageException {
    List<ResolutionEntry> entries = new ArrayList<>();
    if (!Files.exists(this.logPath)) {
      return entries;
    }
    try (BufferedReader br = Files.newBufferedReader(this.logPath,
        StandardCharsets.UTF_8)) {
      String line;
      while ((line = br.readLine()) != null) {
        if (!line.trim().isEmpty()) {
          entries.add(this.objectMapper.readValue(line,
              ResolutionEntry.class));
        }
      }
    } catch (IOException e) {
      throw new LocalStorageException("Cannot read resolution log "
          + this.logPath + ". Reason: " + e.getMessage(), e);
    }
    return entries;
  }
}
