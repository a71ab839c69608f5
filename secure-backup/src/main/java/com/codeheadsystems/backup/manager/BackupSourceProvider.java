package com.codeheadsystems.backup.manager;

import java.nio.file.Path;
import java.util.List;

/**
 * Supplies the files a scheduled run of a data type should back up.
 */
@FunctionalInterface
public interface BackupSourceProvider {

  /**
   * Provider that never has anything to back up.
   */
  BackupSourceProvider NONE = dataType -> List.of();

  /**
   * Sources of the data type for this run.
   *
   * @param dataType the data type
   * @return the list
   */
  List<Path> sources(String dataType);

}
