/* Copyright 2026 The MapVault Project
 * See LICENSE for licensing information */

package org.mapvault.sync.persist;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;

public class PersistenceUtils {

  private static final Logger log = LoggerFactory.getLogger(
      PersistenceUtils.class);

  public static final String TEMPFIX = ".tmp";

  private static final long LIMIT_MB = 200;

  /**
   * Write the given bytes to a temporary file next to the output path and
   * move it into place, so that readers see either the old or the new
   * content, never a partial write.
   */
  public static void storeAtomically(byte[] data, Path outputPath)
      throws IOException {
    Files.createDirectories(outputPath.getParent());
    Path tmpPath = outputPath.resolveSibling(outputPath.getFileName()
        + TEMPFIX);
    Files.write(tmpPath, data);
    try {
      Files.move(tmpPath, outputPath, StandardCopyOption.ATOMIC_MOVE,
          StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException amnse) {
      log.debug("Atomic move not supported for {}, replacing instead.",
          outputPath);
      Files.move(tmpPath, outputPath, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  /** Read all bytes of the given file, or return {@code null} if absent. */
  public static byte[] readIfExists(Path path) throws IOException {
    if (!Files.exists(path)) {
      return null;
    }
    return Files.readAllBytes(path);
  }

  /** Delete left-over temporary files, e.g. after a crash. */
  public static void cleanDirectory(Path pathToClean) throws IOException {
    if (!Files.isDirectory(pathToClean)) {
      return;
    }
    SimpleFileVisitor<Path> sfv = new SimpleFileVisitor<Path>() {
      @Override
      public FileVisitResult visitFile(Path file, BasicFileAttributes attrs)
          throws IOException {
        if (file.toString().endsWith(TEMPFIX)) {
          log.info("Deleting incomplete write {}.", file);
          Files.deleteIfExists(file);
        }
        return FileVisitResult.CONTINUE;
      }
    };
    Files.walkFileTree(pathToClean, sfv);
  }

  /** Delete the given file or directory including all contents. */
  public static void deleteRecursively(Path path) throws IOException {
    if (!Files.exists(path)) {
      return;
    }
    SimpleFileVisitor<Path> sfv = new SimpleFileVisitor<Path>() {
      @Override
      public FileVisitResult visitFile(Path file, BasicFileAttributes attrs)
          throws IOException {
        Files.delete(file);
        return FileVisitResult.CONTINUE;
      }

      @Override
      public FileVisitResult postVisitDirectory(Path dir, IOException exc)
          throws IOException {
        if (null != exc) {
          throw exc;
        }
        Files.delete(dir);
        return FileVisitResult.CONTINUE;
      }
    };
    Files.walkFileTree(path, sfv);
  }

  /**
   * Logs a warning if 200 MiB or less are available on the storage the
   * given path is located on, and otherwise logs available space in TRACE
   * level.
   */
  public static void checkAvailableSpace(Path location) throws IOException {
    long megaBytes = Files.getFileStore(location.toAbsolutePath()
        .getRoot()).getUsableSpace() / 1024 / 1024;
    if (megaBytes < LIMIT_MB) {
      log.warn("Available storage critical for {}; only {} MiB left.",
          location, megaBytes);
    } else {
      log.trace("Available storage for {}: {} MiB", location, megaBytes);
    }
  }
}
