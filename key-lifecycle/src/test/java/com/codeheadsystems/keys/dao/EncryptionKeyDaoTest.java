package com.codeheadsystems.keys.dao;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

import com.codeheadsystems.compliance.common.json.ObjectMapperFactory;
import com.codeheadsystems.keys.exception.KeyStorageException;
import com.codeheadsystems.keys.model.EncryptionKey;
import com.codeheadsystems.keys.model.ImmutableEncryptionKey;
import com.codeheadsystems.keys.model.ImmutableKeyLifecycleConfiguration;
import com.codeheadsystems.keys.model.ImmutableKeyMetadata;
import com.codeheadsystems.keys.model.KeyPurpose;
import com.codeheadsystems.keys.model.KeyStatus;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class EncryptionKeyDaoTest {

  private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

  @TempDir Path directory;

  private EncryptionKeyDao dao;

  @BeforeEach
  void setup() {
    dao = new EncryptionKeyDao(
        ImmutableKeyLifecycleConfiguration.builder().keysDirectory(directory.toString()).build(),
        ObjectMapperFactory.objectMapper());
    dao.createDirectories();
  }

  private EncryptionKey key(final String id) {
    return ImmutableEncryptionKey.builder()
        .id(id)
        .version(1)
        .algorithm("aes-256-gcm")
        .keyMaterial(new byte[]{1, 2, 3, 4})
        .iv(new byte[]{9, 9})
        .createdAt(NOW)
        .expiresAt(NOW.plus(Duration.ofDays(90)))
        .status(KeyStatus.ACTIVE)
        .addPurposes(KeyPurpose.PHI_ENCRYPTION)
        .metadata(ImmutableKeyMetadata.builder().hash("abc").build())
        .build();
  }

  @Test
  void saveAndGet() {
    dao.save(key("one"));

    final EncryptionKey read = dao.getKey("one").orElseThrow();
    assertThat(read.keyMaterial()).containsExactly(1, 2, 3, 4);
    assertThat(read.iv()).hasValueSatisfying(iv -> assertThat(iv).containsExactly(9, 9));
    assertThat(read.createdAt()).isEqualTo(NOW);
    assertThat(read.purposes()).containsExactly(KeyPurpose.PHI_ENCRYPTION);
    assertThat(read.metadata().hash()).isEqualTo("abc");
  }

  @Test
  void getKey_missing() {
    assertThat(dao.getKey("nope")).isEmpty();
  }

  @Test
  void save_replaces() {
    dao.save(key("one"));
    dao.save(ImmutableEncryptionKey.copyOf(key("one")).withStatus(KeyStatus.ROTATING));

    assertThat(dao.loadAll()).singleElement()
        .extracting(EncryptionKey::status)
        .isEqualTo(KeyStatus.ROTATING);
  }

  @Test
  void listKeys_ignoresOtherFiles() throws IOException {
    dao.save(key("b"));
    dao.save(key("a"));
    Files.writeString(directory.resolve("notes.txt"), "hello");

    assertThat(dao.listKeys()).containsExactly("a", "b");
  }

  @Test
  void backup_roundTrip() {
    final Path path = dao.writeBackup(key("one"), NOW);

    assertThat(path.getParent()).isEqualTo(dao.backupDirectory());
    assertThat(path.getFileName().toString()).isEqualTo("key-one-" + NOW.toEpochMilli() + ".backup");
    assertThat(dao.readBackup(path.toString()).id()).isEqualTo("one");
  }

  @Test
  void getKey_corrupt() throws IOException {
    Files.writeString(directory.resolve("key-bad.json"), "{not json");

    assertThatExceptionOfType(KeyStorageException.class)
        .isThrownBy(() -> dao.getKey("bad"))
        .satisfies(e -> assertThat(e.isRetryable()).isTrue());
  }

  @Test
  void toString_redactsMaterial() {
    assertThat(key("one").toString()).doesNotContain("[1, 2, 3, 4]");
  }

}
