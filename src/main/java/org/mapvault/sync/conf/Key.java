/* Copyright 2026 The MapVault Project
 * See LICENSE for licensing information */

package org.mapvault.sync.conf;

import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;

/**
 * Enum containing all the properties keys of the configuration.
 * Specifies the key type.
 */
public enum Key {

  ShutdownGraceWaitMinutes(Long.class),
  RunOnce(Boolean.class),
  StorePath(Path.class),
  RemotePath(Path.class),
  DeviceId(String.class),
  DefaultVault(String.class),
  SyncOffsetMinutes(Integer.class),
  SyncPeriodMinutes(Integer.class),
  SyncBatchSize(Integer.class),
  BackoffInitialMillis(Long.class),
  BackoffMaxMillis(Long.class),
  LockTimeoutMillis(Long.class),
  LockMode(LockMode.class);

  private Class clazz;
  private static Set<String> keys;

  /**
   * Instantiate a new {@code Key} using the given class for the key value.
   *
   * @param clazz Class of key value.
   */
  Key(Class clazz) {
    this.clazz = clazz;
  }

  public Class keyClass() {
    return clazz;
  }

  /** Verifies, if the given string corresponds to an enum value. */
  public static boolean has(String someKey) {
    if (null == keys) {
      keys = new HashSet<>();
      for (Key key : values()) {
        keys.add(key.name());
      }
    }
    return keys.contains(someKey);
  }

}
