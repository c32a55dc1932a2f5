/* Copyright 2026 The MapVault Project
 * See LICENSE for licensing information */

package org.mapvault.sync.conf;

public class ConfigurationException extends Exception {

  public ConfigurationException() {}

  public ConfigurationException(String msg) {
    super(msg);
  }

  public ConfigurationException(String msg, Exception ex) {
    super(msg, ex);
  }

}
