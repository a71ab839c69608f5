package com.codeheadsystems.backup.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

import com.codeheadsystems.compliance.common.json.ObjectMapperFactory;
import com.fasterxml.jackson.core.JsonProcessingException;
import java.time.Duration;
import java.time.LocalTime;
import java.util.Map;
import org.junit.jupiter.api.Test;

class BackupConfigurationTest {

  @Test
  void defaults() {
    final BackupConfiguration configuration = ImmutableBackupConfiguration.builder()
        .backupDirectory("/backups")
        .build();

    assertThat(configuration.backupConfigs()).containsOnlyKeys(
        BackupConfiguration.PHI, BackupConfiguration.AUDIT_LOGS, BackupConfiguration.SYSTEM_CONFIG);
    final BackupConfig phi = configuration.backupConfigs().get(BackupConfiguration.PHI);
    assertThat(phi.retentionPeriod()).isEqualTo(Duration.ofDays(365 * 6));
    assertThat(phi.encryptionRequired()).isTrue();
    assertThat(phi.compressionRequired()).isTrue();
    assertThat(phi.verificationRequired()).isTrue();
    assertThat(phi.schedule().startTime()).contains(LocalTime.of(2, 0));
    assertThat(configuration.backupConfigs().get(BackupConfiguration.SYSTEM_CONFIG).schedule().frequency())
        .isEqualTo(Duration.ofDays(7));
    assertThat(configuration.metadataPath().toString()).endsWith("metadata");
    assertThat(configuration.tempPath().toString()).endsWith("temp");
  }

  @Test
  void fromJson() throws JsonProcessingException {
    final String json = "{\"backupDirectory\":\"/b\",\"backupConfigs\":{\"LAB\":{\"dataType\":\"LAB\","
        + "\"retentionPeriod\":\"P30D\",\"compressionRequired\":false,"
        + "\"schedule\":{\"frequency\":\"PT6H\",\"startTime\":\"03:15\"}}}}";

    final BackupConfiguration configuration = ObjectMapperFactory.objectMapper()
        .readValue(json, BackupConfiguration.class);

    final Map<String, BackupConfig> configs = configuration.backupConfigs();
    assertThat(configs).containsOnlyKeys("LAB");
    assertThat(configs.get("LAB").compressionRequired()).isFalse();
    assertThat(configs.get("LAB").encryptionRequired()).isTrue();
    assertThat(configs.get("LAB").schedule().startTime()).contains(LocalTime.of(3, 15));
  }

  @Test
  void check_keyMustMatchDataType() {
    assertThatExceptionOfType(IllegalStateException.class).isThrownBy(() ->
        ImmutableBackupConfiguration.builder()
            .backupDirectory("/b")
            .putBackupConfigs("ONE", ImmutableBackupConfig.builder()
                .dataType("TWO")
                .retentionPeriod(Duration.ofDays(1))
                .schedule(ImmutableBackupSchedule.builder().frequency(Duration.ofHours(1)).build())
                .build())
            .build());
  }

}
