package com.codeheadsystems.keys.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import org.immutables.value.Value;

/**
 * Where keys live and how each purpose rotates.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableKeyLifecycleConfiguration.class)
@JsonDeserialize(as = ImmutableKeyLifecycleConfiguration.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface KeyLifecycleConfiguration {

  /**
   * The default rotation table.
   *
   * @return a new mutable map.
   */
  static Map<KeyPurpose, KeyRotationConfig> defaultRotationConfigs() {
    final Map<KeyPurpose, KeyRotationConfig> map = new EnumMap<>(KeyPurpose.class);
    map.put(KeyPurpose.PHI_ENCRYPTION, policy(90, 7, true));
    map.put(KeyPurpose.AUDIT_LOG_ENCRYPTION, policy(180, 14, true));
    map.put(KeyPurpose.BACKUP_ENCRYPTION, policy(365, 30, true));
    map.put(KeyPurpose.SECURE_COMMUNICATION, policy(30, 2, false));
    return map;
  }

  private static KeyRotationConfig policy(final int rotationDays, final int graceDays, final boolean backup) {
    return ImmutableKeyRotationConfig.builder()
        .rotationPeriod(Duration.ofDays(rotationDays))
        .gracePeriod(Duration.ofDays(graceDays))
        .backupRequired(backup)
        .verificationRequired(true)
        .build();
  }

  /**
   * Directory holding one JSON file per key, with backups under its backup subdirectory.
   *
   * @return the string
   */
  String keysDirectory();

  /**
   * Rotation policy per purpose. A purpose missing from the map cannot have keys.
   *
   * @return the map
   */
  @Value.Default
  default Map<KeyPurpose, KeyRotationConfig> rotationConfigs() {
    return defaultRotationConfigs();
  }

  /**
   * Keys path.
   *
   * @return the path
   */
  default Path keysPath() {
    return Paths.get(keysDirectory());
  }

}
