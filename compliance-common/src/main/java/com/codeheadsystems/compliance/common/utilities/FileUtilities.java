package com.codeheadsystems.compliance.common.utilities;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * File writes that never leave a half written target behind.
 */
public class FileUtilities {

  private FileUtilities() {
  }

  /**
   * Write to a sibling temp file then move it over the target.
   *
   * @param target the target
   * @param bytes  the bytes
   * @throws IOException if the write or move fails.
   */
  public static void writeAtomically(final Path target, final byte[] bytes) throws IOException {
    final Path temp = target.resolveSibling(target.getFileName() + ".tmp");
    Files.write(temp, bytes);
    try {
      Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
    } finally {
      Files.deleteIfExists(temp);
    }
  }

  /**
   * Delete a directory and everything below it. A missing directory is fine.
   *
   * @param directory the directory
   * @throws IOException if anything cannot be deleted.
   */
  public static void deleteRecursively(final Path directory) throws IOException {
    if (!Files.exists(directory)) {
      return;
    }
    final List<Path> paths;
    try (Stream<Path> walk = Files.walk(directory)) {
      paths = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
    }
    for (Path path : paths) {
      Files.deleteIfExists(path);
    }
  }

}
