package com.codeheadsystems.backup.manager;

import static com.codeheadsystems.compliance.common.alert.Alerter.details;

import com.codeheadsystems.backup.dao.BackupMetadataDao;
import com.codeheadsystems.backup.exception.BackupNotFoundException;
import com.codeheadsystems.backup.exception.BackupStageException;
import com.codeheadsystems.backup.exception.BackupStorageException;
import com.codeheadsystems.backup.exception.BackupVerificationException;
import com.codeheadsystems.backup.exception.UnknownDataTypeException;
import com.codeheadsystems.backup.model.BackupConfig;
import com.codeheadsystems.backup.model.BackupConfiguration;
import com.codeheadsystems.backup.model.BackupMetadata;
import com.codeheadsystems.backup.model.BackupStage;
import com.codeheadsystems.backup.model.BackupStatusSummary;
import com.codeheadsystems.backup.model.ImmutableBackupMetadata;
import com.codeheadsystems.backup.model.ImmutableBackupStatusSummary;
import com.codeheadsystems.backup.model.ImmutableVerificationResult;
import com.codeheadsystems.backup.model.VerificationResult;
import com.codeheadsystems.backup.model.VerificationStatus;
import com.codeheadsystems.compliance.common.alert.Alerter;
import com.codeheadsystems.compliance.common.alert.Severity;
import com.codeheadsystems.compliance.common.crypto.AesGcmCipher;
import com.codeheadsystems.compliance.common.exception.ComplianceException;
import com.codeheadsystems.compliance.common.scheduler.ScheduledTask;
import com.codeheadsystems.compliance.common.scheduler.Scheduler;
import com.codeheadsystems.compliance.common.utilities.DigestUtilities;
import com.codeheadsystems.compliance.common.utilities.FileUtilities;
import com.codeheadsystems.keys.manager.KeyLifecycleManager;
import com.codeheadsystems.keys.model.EncryptionKey;
import com.codeheadsystems.keys.model.KeyPurpose;
import com.codeheadsystems.ledger.manager.AuditLedger;
import com.codeheadsystems.ledger.model.ActionOutcome;
import com.codeheadsystems.ledger.model.ActionType;
import com.codeheadsystems.ledger.model.Actor;
import com.codeheadsystems.ledger.model.EventCategory;
import com.codeheadsystems.ledger.model.ImmutableAuditAction;
import com.codeheadsystems.ledger.model.ImmutableAuditEventRequest;
import com.codeheadsystems.ledger.model.ImmutableAuditResource;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compressed, encrypted and hashed backups of named data types, with verification and restoration
 * self-tests. Every stage that fails is alerted with its stage and data type and rethrown; every
 * completed operation is recorded in the audit ledger.
 */
@Singleton
public class SecureBackupManager {

  /**
   * Size of the chunks the artifact is digested in.
   */
  public static final int CHUNK_SIZE = 64 * 1024;
  /**
   * Allowed drift between the recorded ratio and the decompressed content, in bytes.
   */
  public static final long RATIO_TOLERANCE_BYTES = 1024;

  private static final Logger LOGGER = LoggerFactory.getLogger(SecureBackupManager.class);
  private static final String STAGE_FAILED = "BACKUP_STAGE_FAILED";

  private final BackupConfiguration configuration;
  private final BackupMetadataDao backupMetadataDao;
  private final KeyLifecycleManager keyLifecycleManager;
  private final AuditLedger auditLedger;
  private final AesGcmCipher aesGcmCipher;
  private final BackupSourceProvider backupSourceProvider;
  private final Scheduler scheduler;
  private final Clock clock;
  private final SecureRandom secureRandom;
  private final Alerter alerter;
  private final Map<String, ScheduledTask> backupSchedules = new ConcurrentHashMap<>();
  private final AtomicBoolean scheduling = new AtomicBoolean(false);

  /**
   * Instantiates a new Secure backup manager.
   *
   * @param configuration        the configuration
   * @param backupMetadataDao    the backup metadata dao
   * @param keyLifecycleManager  the key lifecycle manager
   * @param auditLedger          the audit ledger
   * @param aesGcmCipher         the aes gcm cipher
   * @param backupSourceProvider the backup source provider
   * @param scheduler            the scheduler
   * @param clock                the clock
   * @param secureRandom         the secure random
   * @param alerter              the alerter
   */
  @Inject
  public SecureBackupManager(final BackupConfiguration configuration,
                             final BackupMetadataDao backupMetadataDao,
                             final KeyLifecycleManager keyLifecycleManager,
                             final AuditLedger auditLedger,
                             final AesGcmCipher aesGcmCipher,
                             final BackupSourceProvider backupSourceProvider,
                             final Scheduler scheduler,
                             final Clock clock,
                             final SecureRandom secureRandom,
                             final Alerter alerter) {
    LOGGER.info("SecureBackupManager({}, {})", configuration.backupDirectory(),
        configuration.backupConfigs().keySet());
    this.configuration = configuration;
    this.backupMetadataDao = backupMetadataDao;
    this.keyLifecycleManager = keyLifecycleManager;
    this.auditLedger = auditLedger;
    this.aesGcmCipher = aesGcmCipher;
    this.backupSourceProvider = backupSourceProvider;
    this.scheduler = scheduler;
    this.clock = clock;
    this.secureRandom = secureRandom;
    this.alerter = alerter;
  }

  /**
   * Create the backup, metadata, temp and per data type directories.
   */
  public void initialize() {
    LOGGER.trace("initialize()");
    try {
      backupMetadataDao.createDirectories();
      try {
        Files.createDirectories(configuration.tempPath());
        for (String dataType : configuration.backupConfigs().keySet()) {
          Files.createDirectories(configuration.backupPath().resolve(dataType));
        }
      } catch (IOException e) {
        throw new BackupStorageException("Unable to create " + configuration.backupPath(), e);
      }
      record(ActionType.CREATE, ActionOutcome.SUCCESS, "backup-service", "Secure Backup Service",
          details("operation", "BACKUP_SERVICE_INIT"));
    } catch (ComplianceException e) {
      throw alerter.alerted("BACKUP_SERVICE_INIT_ERROR", Severity.HIGH, e, details());
    }
  }

  /**
   * Back up a source file.
   *
   * @param dataType the data type
   * @param source   the source
   * @return the metadata of the new backup, verified when the data type requires it.
   */
  public BackupMetadata createBackup(final String dataType, final Path source) {
    LOGGER.trace("createBackup({}, {})", dataType, source);
    final BackupConfig config = backupConfig(dataType);
    final String id = newBackupId();
    final Instant timestamp = clock.instant();
    final String artifactName = "backup-" + id + "-" + timestamp.toEpochMilli() + ".bak";
    final Path artifact = configuration.backupPath().resolve(dataType).resolve(artifactName);
    final Path staging = configuration.tempPath().resolve(artifactName + ".staging");
    boolean persisted = false;
    try {
      final long size = stage(BackupStage.SOURCE, dataType, () -> Files.size(source));
      stage(BackupStage.SOURCE, dataType, () -> Files.createDirectories(artifact.getParent()));

      Path plain = source;
      Optional<Double> compressionRatio = Optional.empty();
      if (config.compressionRequired()) {
        final long compressedSize = stage(BackupStage.COMPRESS, dataType, () -> compress(source, staging));
        compressionRatio = Optional.of((double) size / compressedSize);
        plain = staging;
      }

      Optional<String> keyId = Optional.empty();
      if (config.encryptionRequired()) {
        final Path input = plain;
        final EncryptionKey key = stage(BackupStage.ENCRYPT, dataType,
            () -> keyLifecycleManager.getActiveKey(KeyPurpose.BACKUP_ENCRYPTION));
        stage(BackupStage.ENCRYPT, dataType, () -> encrypt(key, input, artifact));
        keyId = Optional.of(key.id());
      } else {
        final Path input = plain;
        stage(BackupStage.ENCRYPT, dataType,
            () -> Files.copy(input, artifact, StandardCopyOption.REPLACE_EXISTING));
      }

      final Digest digest = stage(BackupStage.HASH, dataType, () -> digest(artifact));
      final BackupMetadata metadata = ImmutableBackupMetadata.builder()
          .id(id)
          .timestamp(timestamp)
          .dataType(dataType)
          .size(size)
          .storedSize(digest.size)
          .chunks(digest.chunks)
          .encryptionKeyId(keyId)
          .hash(digest.hash)
          .compressionRatio(compressionRatio)
          .verificationStatus(VerificationStatus.PENDING)
          .artifactName(artifactName)
          .build();
      stage(BackupStage.PERSIST, dataType, () -> {
        backupMetadataDao.save(metadata);
        return null;
      });
      persisted = true;
      LOGGER.info("Backup {} of {} written: {} bytes stored for {} source bytes", id, dataType, digest.size, size);

      if (config.verificationRequired()) {
        final VerificationResult result = verifyBackup(id);
        if (!result.valid()) {
          throw new BackupVerificationException("Backup verification failed: " + String.join(", ", result.errors()));
        }
      }
      record(ActionType.CREATE, ActionOutcome.SUCCESS, id, "Backup",
          details("operation", "CREATE_BACKUP", "backupId", id, "dataType", dataType, "size", size));
      return backupMetadataDao.get(id).orElseThrow(() -> new BackupNotFoundException(id));
    } finally {
      deleteQuietly(staging);
      if (!persisted) {
        deleteQuietly(artifact);
      }
    }
  }

  /**
   * Re-check a backup against its metadata: hash and size always, decryption and decompression when they
   * apply. The outcome is stamped on the metadata.
   *
   * @param backupId the backup id
   * @return the result
   */
  public VerificationResult verifyBackup(final String backupId) {
    LOGGER.trace("verifyBackup({})", backupId);
    final BackupMetadata metadata = metadata(backupId, "BACKUP_VERIFY_ERROR");
    final Path artifact = artifactPath(metadata);
    final Path scratch = configuration.tempPath().resolve("verify-" + backupId);
    final ImmutableVerificationResult.Builder builder = ImmutableVerificationResult.builder();
    try {
      if (!Files.isRegularFile(artifact)) {
        builder.hashMatch(false).sizeMatch(false).addErrors("Backup artifact missing");
      } else {
        final Digest digest = digest(artifact);
        builder.sizeMatch(digest.size == metadata.storedSize());
        builder.hashMatch(digest.hash.equals(metadata.hash()));
        if (digest.size != metadata.storedSize()) {
          builder.addErrors("Backup size mismatch");
        }
        if (!digest.hash.equals(metadata.hash())) {
          builder.addErrors("Backup hash mismatch");
        }
      }

      boolean readable = Files.isRegularFile(artifact);
      Path compressed = artifact;
      if (metadata.encryptionKeyId().isPresent()) {
        readable = readable && decrypt(metadata, artifact, scratch);
        builder.decryptionSuccess(readable);
        if (!readable) {
          builder.addErrors("Backup decryption failed");
        }
        compressed = scratch;
      }
      if (metadata.compressionRatio().isPresent()) {
        final boolean content = readable && contentMatches(metadata, compressed);
        builder.contentVerified(content);
        if (!content) {
          builder.addErrors("Backup decompression failed");
        }
      }
    } catch (IOException e) {
      throw alerter.alerted("BACKUP_VERIFY_ERROR", Severity.HIGH,
          new BackupStageException(BackupStage.VERIFY, metadata.dataType(), e), details("backupId", backupId));
    } finally {
      deleteQuietly(scratch);
    }

    final VerificationResult result = builder.build();
    try {
      backupMetadataDao.save(ImmutableBackupMetadata.copyOf(metadata)
          .withVerificationStatus(result.valid() ? VerificationStatus.SUCCESS : VerificationStatus.FAILURE)
          .withLastVerified(clock.instant()));
      record(ActionType.READ, result.valid() ? ActionOutcome.SUCCESS : ActionOutcome.FAILURE, backupId, "Backup",
          details("operation", "VERIFY_BACKUP", "backupId", backupId,
              "hashMatch", result.hashMatch(), "sizeMatch", result.sizeMatch(),
              "decryptionSuccess", result.decryptionSuccess().map(Object::toString).orElse("n/a"),
              "contentVerified", result.contentVerified().map(Object::toString).orElse("n/a")));
    } catch (ComplianceException e) {
      throw alerter.alerted("BACKUP_VERIFY_ERROR", Severity.HIGH, e, details("backupId", backupId));
    }
    if (!result.valid()) {
      LOGGER.warn("Backup {} failed verification: {}", backupId, result.errors());
      alerter.raise(STAGE_FAILED, Severity.HIGH, details(
          "stage", BackupStage.VERIFY, "dataType", metadata.dataType(), "backupId", backupId,
          "errors", String.join(", ", result.errors())));
    }
    return result;
  }

  /**
   * Decrypt and decompress a backup into the target, then check the restored size against the source
   * size. Verification status is left alone.
   *
   * @param backupId the backup id
   * @param target   the target
   * @return the metadata with its restoration test stamped.
   */
  public BackupMetadata testRestoration(final String backupId, final Path target) {
    LOGGER.trace("testRestoration({}, {})", backupId, target);
    final BackupMetadata metadata = metadata(backupId, "BACKUP_RESTORE_TEST_ERROR");
    final Path scratch = configuration.tempPath().resolve("restore-" + backupId);
    try {
      stage(BackupStage.RESTORE_TEST, metadata.dataType(), () -> {
        try (InputStream in = restoringStream(metadata)) {
          Files.copy(in, scratch, StandardCopyOption.REPLACE_EXISTING);
        }
        return Files.move(scratch, target, StandardCopyOption.REPLACE_EXISTING);
      });
      stage(BackupStage.RESTORE_TEST, metadata.dataType(), () -> {
        final long restored = Files.size(target);
        if (restored != metadata.size()) {
          throw new BackupVerificationException("Restored file size mismatch: " + restored + " != " + metadata.size());
        }
        return restored;
      });
    } finally {
      deleteQuietly(scratch);
    }
    final BackupMetadata tested = ImmutableBackupMetadata.copyOf(metadata).withRestorationTested(clock.instant());
    try {
      backupMetadataDao.save(tested);
      record(ActionType.READ, ActionOutcome.SUCCESS, backupId, "Backup",
          details("operation", "TEST_RESTORATION", "backupId", backupId, "targetPath", target.toString()));
    } catch (ComplianceException e) {
      throw alerter.alerted("BACKUP_RESTORE_TEST_ERROR", Severity.HIGH, e, details("backupId", backupId));
    }
    LOGGER.info("Backup {} restored to {}", backupId, target);
    return tested;
  }

  /**
   * Arm one timer per configured data type. Each run backs up what the source provider offers and is
   * re-armed for the next run whether or not it succeeded.
   */
  public void scheduleBackups() {
    LOGGER.trace("scheduleBackups()");
    scheduling.set(true);
    configuration.backupConfigs().keySet().forEach(this::arm);
  }

  /**
   * Every backup, oldest first.
   *
   * @return the list
   */
  public List<BackupMetadata> listBackups() {
    return backupMetadataDao.loadAll();
  }

  /**
   * Gets a backup.
   *
   * @param backupId the backup id
   * @return the optional
   */
  public Optional<BackupMetadata> getBackup(final String backupId) {
    return backupMetadataDao.get(backupId);
  }

  /**
   * Counts per data type, covering every configured type and any type found on disk.
   *
   * @return the map
   */
  public Map<String, BackupStatusSummary> statusSummary() {
    final Map<String, List<BackupMetadata>> byType = new TreeMap<>();
    configuration.backupConfigs().keySet().forEach(type -> byType.put(type, new ArrayList<>()));
    for (BackupMetadata metadata : backupMetadataDao.loadAll()) {
      byType.computeIfAbsent(metadata.dataType(), type -> new ArrayList<>()).add(metadata);
    }
    final Map<String, BackupStatusSummary> summaries = new TreeMap<>();
    byType.forEach((type, list) -> summaries.put(type, ImmutableBackupStatusSummary.builder()
        .dataType(type)
        .total(list.size())
        .verified(count(list, VerificationStatus.SUCCESS))
        .failed(count(list, VerificationStatus.FAILURE))
        .pending(count(list, VerificationStatus.PENDING))
        .lastSuccessfulBackup(list.stream()
            .filter(m -> m.verificationStatus() == VerificationStatus.SUCCESS)
            .map(BackupMetadata::timestamp)
            .max(Instant::compareTo))
        .build()));
    return summaries;
  }

  /**
   * Cancel every backup timer and empty the temp directory.
   */
  public void cleanup() {
    LOGGER.info("cleanup()");
    scheduling.set(false);
    backupSchedules.values().forEach(ScheduledTask::cancel);
    backupSchedules.clear();
    try {
      FileUtilities.deleteRecursively(configuration.tempPath());
      Files.createDirectories(configuration.tempPath());
    } catch (IOException e) {
      throw alerter.alerted("BACKUP_SERVICE_CLEANUP_ERROR", Severity.HIGH,
          new BackupStorageException("Unable to clear " + configuration.tempPath(), e), details());
    }
  }

  private void arm(final String dataType) {
    final BackupConfig config = configuration.backupConfigs().get(dataType);
    final Instant now = clock.instant();
    final Duration delay = Duration.between(now, config.schedule().nextRun(now));
    LOGGER.debug("Backup of {} in {}", dataType, delay);
    final ScheduledTask task = scheduler.schedule(delay, () -> runScheduledBackup(dataType));
    final ScheduledTask previous = backupSchedules.put(dataType, task);
    if (previous != null) {
      previous.cancel();
    }
  }

  private void runScheduledBackup(final String dataType) {
    try {
      for (Path source : backupSourceProvider.sources(dataType)) {
        createBackup(dataType, source);
      }
    } catch (RuntimeException e) {
      LOGGER.error("Scheduled backup of {} failed", dataType, e);
      alerter.raise("BACKUP_SCHEDULE_ERROR", Severity.HIGH, details("dataType", dataType, "error", e.getMessage()));
    } finally {
      if (scheduling.get()) {
        arm(dataType);
      }
    }
  }

  private BackupConfig backupConfig(final String dataType) {
    final BackupConfig config = configuration.backupConfigs().get(dataType);
    if (config == null) {
      throw alerter.alerted("BACKUP_CREATE_ERROR", Severity.HIGH, new UnknownDataTypeException(dataType),
          details("dataType", dataType));
    }
    return config;
  }

  private BackupMetadata metadata(final String backupId, final String alertKind) {
    try {
      return backupMetadataDao.get(backupId).orElseThrow(() -> new BackupNotFoundException(backupId));
    } catch (ComplianceException e) {
      throw alerter.alerted(alertKind, Severity.HIGH, e, details("backupId", backupId));
    }
  }

  private Path artifactPath(final BackupMetadata metadata) {
    return configuration.backupPath().resolve(metadata.dataType()).resolve(metadata.artifactName());
  }

  private long compress(final Path source, final Path staging) throws IOException {
    try (InputStream in = Files.newInputStream(source);
         OutputStream out = new GZIPOutputStream(Files.newOutputStream(staging), CHUNK_SIZE)) {
      in.transferTo(out);
    }
    return Files.size(staging);
  }

  private long encrypt(final EncryptionKey key, final Path input, final Path artifact) throws IOException {
    try (InputStream in = Files.newInputStream(input);
         OutputStream out = aesGcmCipher.encryptingStream(key.keyMaterial(), Files.newOutputStream(artifact))) {
      return in.transferTo(out);
    }
  }

  private boolean decrypt(final BackupMetadata metadata, final Path artifact, final Path scratch) {
    try {
      final EncryptionKey key = keyLifecycleManager.getKey(metadata.encryptionKeyId().orElseThrow());
      try (InputStream in = aesGcmCipher.decryptingStream(key.keyMaterial(), Files.newInputStream(artifact))) {
        Files.copy(in, scratch, StandardCopyOption.REPLACE_EXISTING);
      }
      return true;
    } catch (IOException | ComplianceException e) {
      LOGGER.warn("Decryption of backup {} failed: {}", metadata.id(), e.getMessage());
      return false;
    }
  }

  private boolean contentMatches(final BackupMetadata metadata, final Path compressed) {
    final double ratio = metadata.compressionRatio().orElseThrow();
    try {
      final long compressedSize = Files.size(compressed);
      final long decompressedSize;
      try (InputStream in = new GZIPInputStream(Files.newInputStream(compressed), CHUNK_SIZE)) {
        decompressedSize = in.transferTo(OutputStream.nullOutputStream());
      }
      return decompressedSize == metadata.size()
          && Math.abs(compressedSize * ratio - metadata.size()) <= RATIO_TOLERANCE_BYTES;
    } catch (IOException e) {
      LOGGER.warn("Decompression of backup {} failed: {}", metadata.id(), e.getMessage());
      return false;
    }
  }

  private InputStream restoringStream(final BackupMetadata metadata) throws IOException {
    InputStream in = Files.newInputStream(artifactPath(metadata));
    try {
      if (metadata.encryptionKeyId().isPresent()) {
        final EncryptionKey key = keyLifecycleManager.getKey(metadata.encryptionKeyId().get());
        in = aesGcmCipher.decryptingStream(key.keyMaterial(), in);
      }
      if (metadata.compressionRatio().isPresent()) {
        in = new GZIPInputStream(in, CHUNK_SIZE);
      }
      return in;
    } catch (IOException | RuntimeException e) {
      in.close();
      throw e;
    }
  }

  private Digest digest(final Path artifact) throws IOException {
    final MessageDigest messageDigest = DigestUtilities.newSha256();
    final byte[] buffer = new byte[CHUNK_SIZE];
    long size = 0;
    long chunks = 0;
    try (InputStream in = Files.newInputStream(artifact)) {
      int read;
      while ((read = in.readNBytes(buffer, 0, CHUNK_SIZE)) > 0) {
        messageDigest.update(buffer, 0, read);
        size += read;
        chunks++;
      }
    }
    return new Digest(DigestUtilities.encode.apply(messageDigest.digest()), size, chunks);
  }

  private <T> T stage(final BackupStage stage, final String dataType, final StageBody<T> body) {
    try {
      return body.run();
    } catch (IOException | RuntimeException e) {
      throw alerter.alerted(STAGE_FAILED, Severity.HIGH, new BackupStageException(stage, dataType, e),
          details("stage", stage, "dataType", dataType));
    }
  }

  private void record(final ActionType type,
                      final ActionOutcome outcome,
                      final String resourceId,
                      final String description,
                      final Map<String, Object> operationDetails) {
    auditLedger.append(ImmutableAuditEventRequest.builder()
        .category(EventCategory.SYSTEM_OPERATION)
        .actor(Actor.SYSTEM)
        .action(ImmutableAuditAction.builder().type(type).outcome(outcome).putAllDetails(operationDetails).build())
        .resource(ImmutableAuditResource.builder().type("SYSTEM").id(resourceId).description(description).build())
        .build());
  }

  private String newBackupId() {
    final byte[] bytes = new byte[16];
    secureRandom.nextBytes(bytes);
    return DigestUtilities.encode.apply(bytes);
  }

  private static int count(final List<BackupMetadata> list, final VerificationStatus status) {
    return (int) list.stream().filter(m -> m.verificationStatus() == status).count();
  }

  private static void deleteQuietly(final Path path) {
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      LOGGER.warn("Unable to delete {}", path, e);
    }
  }

  @FunctionalInterface
  private interface StageBody<T> {
    T run() throws IOException;
  }

  private static final class Digest {
    private final String hash;
    private final long size;
    private final long chunks;

    private Digest(final String hash, final long size, final long chunks) {
      this.hash = hash;
      this.size = size;
      this.chunks = chunks;
    }
  }

}
