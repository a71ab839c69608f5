package com.codeheadsystems.backup.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.LocalTime;
import java.util.Map;
import java.util.TreeMap;
import org.immutables.value.Value;

/**
 * Where backups live and how each data type is backed up.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableBackupConfiguration.class)
@JsonDeserialize(as = ImmutableBackupConfiguration.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface BackupConfiguration {

  /**
   * Phi data type.
   */
  String PHI = "PHI";
  /**
   * Audit logs data type.
   */
  String AUDIT_LOGS = "AUDIT_LOGS";
  /**
   * System config data type.
   */
  String SYSTEM_CONFIG = "SYSTEM_CONFIG";

  /**
   * The default backup table.
   *
   * @return a new mutable map.
   */
  static Map<String, BackupConfig> defaultBackupConfigs() {
    final Map<String, BackupConfig> map = new TreeMap<>();
    map.put(PHI, config(PHI, 365 * 6, 24, "02:00", 120));
    map.put(AUDIT_LOGS, config(AUDIT_LOGS, 365 * 6, 12, "00:00", 60));
    map.put(SYSTEM_CONFIG, config(SYSTEM_CONFIG, 365, 168, "01:00", 30));
    return map;
  }

  private static BackupConfig config(final String dataType,
                                     final int retentionDays,
                                     final int frequencyHours,
                                     final String startTime,
                                     final int maxMinutes) {
    return ImmutableBackupConfig.builder()
        .dataType(dataType)
        .retentionPeriod(Duration.ofDays(retentionDays))
        .schedule(ImmutableBackupSchedule.builder()
            .frequency(Duration.ofHours(frequencyHours))
            .startTime(LocalTime.parse(startTime))
            .maxDuration(Duration.ofMinutes(maxMinutes))
            .build())
        .build();
  }

  /**
   * Root directory: one subdirectory per data type, plus metadata/ and temp/.
   *
   * @return the string
   */
  String backupDirectory();

  /**
   * Backup configs map, keyed by data type.
   *
   * @return the map
   */
  @Value.Default
  default Map<String, BackupConfig> backupConfigs() {
    return defaultBackupConfigs();
  }

  /**
   * Backup path.
   *
   * @return the path
   */
  default Path backupPath() {
    return Paths.get(backupDirectory());
  }

  /**
   * Metadata path.
   *
   * @return the path
   */
  default Path metadataPath() {
    return backupPath().resolve("metadata");
  }

  /**
   * Staging and scratch files.
   *
   * @return the path
   */
  default Path tempPath() {
    return backupPath().resolve("temp");
  }

  /**
   * Every entry must be keyed by its own data type.
   */
  @Value.Check
  default void check() {
    backupConfigs().forEach((key, config) -> {
      if (!key.equals(config.dataType())) {
        throw new IllegalStateException("Backup config " + key + " declares data type " + config.dataType());
      }
    });
  }

}
