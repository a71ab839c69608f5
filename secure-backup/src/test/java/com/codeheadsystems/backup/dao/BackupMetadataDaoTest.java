package com.codeheadsystems.backup.dao;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

import com.codeheadsystems.backup.exception.BackupStorageException;
import com.codeheadsystems.backup.model.BackupMetadata;
import com.codeheadsystems.backup.model.ImmutableBackupConfiguration;
import com.codeheadsystems.backup.model.ImmutableBackupMetadata;
import com.codeheadsystems.backup.model.VerificationStatus;
import com.codeheadsystems.compliance.common.json.ObjectMapperFactory;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class BackupMetadataDaoTest {

  private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

  @TempDir Path directory;

  private BackupMetadataDao dao;

  @BeforeEach
  void setup() {
    dao = new BackupMetadataDao(
        ImmutableBackupConfiguration.builder().backupDirectory(directory.toString()).build(),
        ObjectMapperFactory.objectMapper());
    dao.createDirectories();
  }

  private BackupMetadata metadata(final String id, final Instant timestamp) {
    return ImmutableBackupMetadata.builder()
        .id(id)
        .timestamp(timestamp)
        .dataType("PHI")
        .size(100)
        .storedSize(80)
        .chunks(1)
        .encryptionKeyId("key-1")
        .hash("abc")
        .compressionRatio(1.25)
        .verificationStatus(VerificationStatus.PENDING)
        .artifactName("backup-" + id + ".bak")
        .build();
  }

  @Test
  void saveAndGet() {
    final BackupMetadata metadata = metadata("one", NOW);
    dao.save(metadata);

    assertThat(dao.get("one")).contains(metadata);
    assertThat(directory.resolve("metadata").resolve("one.json")).exists();
  }

  @Test
  void get_missing() {
    assertThat(dao.get("nope")).isEmpty();
  }

  @Test
  void loadAll_oldestFirst() {
    dao.save(metadata("b", NOW));
    dao.save(metadata("a", NOW.plusSeconds(5)));
    dao.save(metadata("c", NOW.minusSeconds(5)));

    assertThat(dao.loadAll()).extracting(BackupMetadata::id).containsExactly("c", "b", "a");
  }

  @Test
  void get_unreadable() throws IOException {
    Files.writeString(directory.resolve("metadata").resolve("bad.json"), "{not json");

    assertThatExceptionOfType(BackupStorageException.class)
        .isThrownBy(() -> dao.get("bad"))
        .satisfies(e -> assertThat(e.isRetryable()).isTrue());
  }

}
