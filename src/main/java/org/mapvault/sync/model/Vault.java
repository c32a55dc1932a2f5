/* Copyright 2026 The MapVault Project
 * See LICENSE for licensing information */

package org.mapvault.sync.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Named collection of maps stored under one remote folder. Vault metadata
 * stays resident for all vaults, also for those that are not open.
 */
@JsonPropertyOrder({ "id", "name", "remote_location", "last_opened",
    "last_full_sync", "remote_timestamp", "map_count" })
public class Vault {

  private String id;

  private String name;

  private String remoteLocation;

  private long lastOpened;

  /** Time of the last complete reconciliation, 0 if never pulled. */
  private long lastFullSync;

  /** Last known remote modification time of the vault as a whole. */
  private long remoteTimestamp;

  private int mapCount;

  public Vault() { /* for deserialization */ }

  /** Create a vault that has never been synchronized. */
  public static Vault of(String id, String name, String remoteLocation) {
    Vault vault = new Vault();
    vault.id = id;
    vault.name = name;
    vault.remoteLocation = remoteLocation;
    return vault;
  }

  public Vault copy() {
    Vault vault = of(this.id, this.name, this.remoteLocation);
    vault.lastOpened = this.lastOpened;
    vault.lastFullSync = this.lastFullSync;
    vault.remoteTimestamp = this.remoteTimestamp;
    vault.mapCount = this.mapCount;
    return vault;
  }

  public String getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public String getRemoteLocation() {
    return remoteLocation;
  }

  public long getLastOpened() {
    return lastOpened;
  }

  public void setLastOpened(long lastOpened) {
    this.lastOpened = lastOpened;
  }

  public long getLastFullSync() {
    return lastFullSync;
  }

  public void setLastFullSync(long lastFullSync) {
    this.lastFullSync = lastFullSync;
  }

  public long getRemoteTimestamp() {
    return remoteTimestamp;
  }

  public void setRemoteTimestamp(long remoteTimestamp) {
    this.remoteTimestamp = remoteTimestamp;
  }

  public int getMapCount() {
    return mapCount;
  }

  public void setMapCount(int mapCount) {
    this.mapCount = mapCount;
  }
}
