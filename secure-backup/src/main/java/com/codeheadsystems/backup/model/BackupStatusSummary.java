package com.codeheadsystems.backup.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.time.Instant;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * Backup counts of one data type.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableBackupStatusSummary.class)
@JsonDeserialize(as = ImmutableBackupStatusSummary.class)
public interface BackupStatusSummary {

  String dataType();

  int total();

  int verified();

  int failed();

  int pending();

  /**
   * Creation time of the newest verified backup.
   *
   * @return the optional
   */
  Optional<Instant> lastSuccessfulBackup();

}
