package com.codeheadsystems.backup.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.time.Duration;
import org.immutables.value.Value;

/**
 * How one data type is backed up.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableBackupConfig.class)
@JsonDeserialize(as = ImmutableBackupConfig.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface BackupConfig {

  /**
   * Data type string.
   *
   * @return the string
   */
  String dataType();

  /**
   * How long backups of this type are kept.
   *
   * @return the duration
   */
  Duration retentionPeriod();

  /**
   * Encryption required boolean.
   *
   * @return the boolean
   */
  @Value.Default
  default boolean encryptionRequired() {
    return true;
  }

  /**
   * Compression required boolean.
   *
   * @return the boolean
   */
  @Value.Default
  default boolean compressionRequired() {
    return true;
  }

  /**
   * Verify every backup right after it is written.
   *
   * @return the boolean
   */
  @Value.Default
  default boolean verificationRequired() {
    return true;
  }

  /**
   * Schedule backup schedule.
   *
   * @return the backup schedule
   */
  BackupSchedule schedule();

}
