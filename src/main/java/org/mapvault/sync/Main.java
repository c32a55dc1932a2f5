/* Copyright 2026 The MapVault Project
 * See LICENSE for licensing information */

package org.mapvault.sync;

import org.mapvault.sync.conf.Configuration;
import org.mapvault.sync.conf.ConfigurationException;
import org.mapvault.sync.conf.Key;
import org.mapvault.sync.cron.ShutdownHook;
import org.mapvault.sync.persist.LocalStorageException;
import org.mapvault.sync.queue.SyncSummary;
import org.mapvault.sync.remote.FileSystemRemoteAdapter;
import org.mapvault.sync.vault.VaultState;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.concurrent.ExecutionException;

/**
 * Main class for running a sync engine against a file-system remote.
 * <br>
 * Run without arguments in order to read the usage information, i.e.
 * <br>
 * <code>java -jar mapvault-sync.jar</code>
 */
public class Main {

  private static final Logger log = LoggerFactory.getLogger(Main.class);

  /**
   * At most one argument.
   * See class description {@link Main}.
   */
  public static void main(String[] args) throws Exception {
    Path confPath;
    if (args == null || args.length == 0) {
      confPath = Paths.get(Configuration.CONF_FILE);
    } else if (args.length == 1) {
      confPath = Paths.get(args[0]);
    } else {
      printUsage("mapvault-sync takes at most one argument.");
      return;
    }
    if (!Files.exists(confPath) || Files.size(confPath) < 1L) {
      writeDefaultConfig(confPath);
      return;
    }
    SyncEngine engine;
    Configuration conf = new Configuration();
    try {
      conf.loadAndCheckConfiguration(confPath);
      Path remotePath = conf.getPath(Key.RemotePath);
      Files.createDirectories(remotePath);
      engine = new SyncEngine(conf, new FileSystemRemoteAdapter(remotePath,
          Clock.systemUTC()));
      engine.start();
    } catch (ConfigurationException ce) {
      printUsage(ce.getMessage());
      return;
    } catch (LocalStorageException lse) {
      log.error("Cannot open local store. Reason: " + lse.getMessage(), lse);
      return;
    }
    String vaultId = conf.getString(Key.DefaultVault);
    try {
      VaultState state = engine.openVault(vaultId).get();
      log.info("Vault {} opened: {}.", vaultId, state);
    } catch (ExecutionException ee) {
      log.error("Cannot open vault " + vaultId + ". Reason: "
          + ee.getCause().getMessage(), ee.getCause());
      engine.close();
      return;
    }
    if (conf.getBool(Key.RunOnce)) {
      SyncSummary summary = engine.syncNow();
      log.info("Single run finished: {}", summary);
      engine.close();
    } else {
      Runtime.getRuntime().addShutdownHook(new ShutdownHook(engine));
      /* Scheduler threads are daemons; block until the JVM shuts down. */
      Thread.currentThread().join();
    }
  }

  private static void printUsage(String msg) {
    final String usage = "Usage:\njava -jar mapvault-sync.jar "
        + "[path/to/configFile]";
    System.out.println(msg + "\n" + usage);
  }

  private static void writeDefaultConfig(Path confPath) {
    try (InputStream is = Main.class.getClassLoader()
        .getResourceAsStream(Configuration.CONF_FILE)) {
      Files.copy(is, confPath, StandardCopyOption.REPLACE_EXISTING);
      printUsage("Could not find config file. A default configuration was "
          + "written to " + confPath + ". Set " + Key.StorePath + ", "
          + Key.RemotePath + " and " + Key.DeviceId + " there and start "
          + "again.");
    } catch (IOException e) {
      log.error("Cannot write default configuration. Reason: " + e, e);
      throw new RuntimeException(e);
    }
  }

}
