/* Copyright 2026 The MapVault Project
 * See LICENSE for licensing information */

package org.mapvault.sync.conf;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Initialize configuration with defaults from mapvault.properties,
 * unless a configuration properties file is available.
 */
public class Configuration {

  public static final String CONF_FILE = "mapvault.properties";

  private final Properties props = new Properties();

  /**
   * Return a configuration holding the defaults shipped in
   * {@code mapvault.properties}.
   */
  public static Configuration defaults() throws ConfigurationException {
    Configuration conf = new Configuration();
    try (InputStream is = Configuration.class.getClassLoader()
        .getResourceAsStream(CONF_FILE)) {
      if (null == is) {
        throw new ConfigurationException("Cannot find default configuration "
            + CONF_FILE + " on the class path.");
      }
      conf.load(is);
    } catch (IOException e) {
      throw new ConfigurationException("Cannot load default configuration. "
          + "Reason: " + e.getMessage(), e);
    }
    return conf;
  }

  /**
   * Load the configuration from the given path.
   */
  public void loadAndCheckConfiguration(Path confPath) throws
      ConfigurationException {
    try (FileInputStream fis
             = new FileInputStream(confPath.toFile())) {
      this.props.load(fis);
      checkRequired();
    } catch (IOException e) {
      throw new ConfigurationException("Cannot load configuration file. "
          + "Reason: " + e.getMessage(), e);
    }
  }

  private void checkRequired() throws ConfigurationException {
    for (Key key : new Key[] { Key.StorePath, Key.RemotePath,
        Key.DefaultVault }) {
      String value = props.getProperty(key.name());
      if (null == value || value.trim().isEmpty()) {
        throw new ConfigurationException("Missing property " + key.name()
            + "!\nPlease edit " + CONF_FILE + ". Exiting.");
      }
    }
  }

  /** Return a copy of all properties. */
  public Properties getPropertiesCopy() {
    return (Properties) props.clone();
  }

  /**
   * Loads properties from the given stream.
   */
  public void load(InputStream fis) throws IOException {
    props.load(fis);
  }

  /** Retrieves the value for key. */
  public String getProperty(String key) {
    return props.getProperty(key);
  }

  /** Retrieves the value for key returning a default for non-existing keys. */
  public String getProperty(String key, String def) {
    return props.getProperty(key, def);
  }

  /** Sets the value for key. */
  public void setProperty(String key, String value) {
    props.setProperty(key, value);
  }

  /** clears all properties. */
  public void clear() {
    props.clear();
  }

  /** Add all given properties. */
  public void putAll(Properties allProps) {
    props.putAll(allProps);
  }

  /** Count of properties. */
  public int size() {
    return props.size();
  }

  private void checkClass(Key key, Class clazz) {
    if (!key.keyClass().getSimpleName().equals(clazz.getSimpleName())) {
      throw new RuntimeException("Wrong type wanted! My class is "
          + key.keyClass().getSimpleName());
    }
  }

  /**
   * Returns a trimmed {@code String} property, e.g.
   * {@code DeviceId = laptop}.
   */
  public String getString(Key key) throws ConfigurationException {
    try {
      checkClass(key, String.class);
      return props.getProperty(key.name()).trim();
    } catch (RuntimeException re) {
      throw new ConfigurationException("Corrupt property: " + key
          + " reason: " + re.getMessage(), re);
    }
  }

  /**
   * Returns a {@code boolean} property (case insensitiv), e.g.
   * {@code propertyOne = True}.
   */
  public boolean getBool(Key key) throws ConfigurationException {
    try {
      checkClass(key, Boolean.class);
      return Boolean.parseBoolean(props.getProperty(key.name()));
    } catch (RuntimeException re) {
      throw new ConfigurationException("Corrupt property: " + key
          + " reason: " + re.getMessage(), re);
    }
  }

  /**
   * Parse an integer property and translate the String
   * {@code "inf"} into Integer.MAX_VALUE.
   * Verifies that this enum is a Key for an integer value.
   */
  public int getInt(Key key) throws ConfigurationException {
    try {
      checkClass(key, Integer.class);
      String prop = props.getProperty(key.name()).trim();
      if ("inf".equals(prop)) {
        return Integer.MAX_VALUE;
      } else {
        return Integer.parseInt(prop);
      }
    } catch (RuntimeException re) {
      throw new ConfigurationException("Corrupt property: " + key
          + " reason: " + re.getMessage(), re);
    }
  }

  /**
   * Parse a long property.
   * Verifies that this enum is a Key for a Long value.
   */
  public long getLong(Key key) throws ConfigurationException {
    try {
      checkClass(key, Long.class);
      String prop = props.getProperty(key.name()).trim();
      return Long.parseLong(prop);
    } catch (RuntimeException re) {
      throw new ConfigurationException("Corrupt property: " + key
          + " reason: " + re.getMessage(), re);
    }
  }

  /**
   * Returns a {@code Path} property, e.g.
   * {@code pathProperty = /my/path/file}.
   */
  public Path getPath(Key key) throws ConfigurationException {
    try {
      checkClass(key, Path.class);
      return Paths.get(props.getProperty(key.name()).trim());
    } catch (RuntimeException re) {
      throw new ConfigurationException("Corrupt property: " + key
          + " reason: " + re.getMessage(), re);
    }
  }

  /**
   * Returns a {@code LockMode} property, e.g.
   * {@code LockMode = Remote}.
   */
  public LockMode getLockMode(Key key) throws ConfigurationException {
    try {
      checkClass(key, LockMode.class);
      return LockMode.valueOf(props.getProperty(key.name()).trim());
    } catch (RuntimeException re) {
      throw new ConfigurationException("Corrupt property: " + key
          + " reason: " + re.getMessage(), re);
    }
  }

}
