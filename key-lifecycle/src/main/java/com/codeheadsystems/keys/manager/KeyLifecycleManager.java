package com.codeheadsystems.keys.manager;

import static com.codeheadsystems.compliance.common.alert.Alerter.details;

import com.codeheadsystems.compliance.common.alert.Alerter;
import com.codeheadsystems.compliance.common.alert.Severity;
import com.codeheadsystems.compliance.common.exception.ComplianceException;
import com.codeheadsystems.compliance.common.scheduler.ScheduledTask;
import com.codeheadsystems.compliance.common.scheduler.Scheduler;
import com.codeheadsystems.compliance.common.utilities.DigestUtilities;
import com.codeheadsystems.keys.dao.EncryptionKeyDao;
import com.codeheadsystems.keys.exception.KeyNotFoundException;
import com.codeheadsystems.keys.exception.KeyVerificationException;
import com.codeheadsystems.keys.exception.MissingRotationConfigException;
import com.codeheadsystems.keys.exception.NoActiveKeyException;
import com.codeheadsystems.keys.model.EncryptionKey;
import com.codeheadsystems.keys.model.ImmutableEncryptionKey;
import com.codeheadsystems.keys.model.ImmutableKeyMetadata;
import com.codeheadsystems.keys.model.KeyLifecycleConfiguration;
import com.codeheadsystems.keys.model.KeyPurpose;
import com.codeheadsystems.keys.model.KeyRotationConfig;
import com.codeheadsystems.keys.model.KeyStatus;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the ACTIVE key of every purpose. Keys are generated, rotated, backed up, verified and retired here,
 * and every change is persisted before the in-memory index sees it. Operations on one purpose are
 * serialized; different purposes proceed independently.
 */
@Singleton
public class KeyLifecycleManager {

  private static final Logger LOGGER = LoggerFactory.getLogger(KeyLifecycleManager.class);

  private final KeyLifecycleConfiguration configuration;
  private final EncryptionKeyDao encryptionKeyDao;
  private final SecureRandom secureRandom;
  private final Clock clock;
  private final Scheduler scheduler;
  private final Alerter alerter;
  private final Map<KeyPurpose, EncryptionKey> activeKeys = new ConcurrentHashMap<>();
  private final Map<KeyPurpose, ScheduledTask> rotationSchedules = new ConcurrentHashMap<>();
  private final Map<KeyPurpose, ReentrantLock> locks = new ConcurrentHashMap<>();
  private final AtomicBoolean scheduling = new AtomicBoolean(false);

  /**
   * Instantiates a new Key lifecycle manager.
   *
   * @param configuration    the configuration
   * @param encryptionKeyDao the encryption key dao
   * @param secureRandom     the secure random
   * @param clock            the clock
   * @param scheduler        the scheduler
   * @param alerter          the alerter
   */
  @Inject
  public KeyLifecycleManager(final KeyLifecycleConfiguration configuration,
                             final EncryptionKeyDao encryptionKeyDao,
                             final SecureRandom secureRandom,
                             final Clock clock,
                             final Scheduler scheduler,
                             final Alerter alerter) {
    LOGGER.info("KeyLifecycleManager({})", configuration.keysDirectory());
    this.configuration = configuration;
    this.encryptionKeyDao = encryptionKeyDao;
    this.secureRandom = secureRandom;
    this.clock = clock;
    this.scheduler = scheduler;
    this.alerter = alerter;
  }

  /**
   * Load persisted keys, make sure every configured purpose has an ACTIVE key, retire rotated keys past
   * their grace period and arm the rotation timers.
   */
  public void initialize() {
    LOGGER.trace("initialize()");
    try {
      encryptionKeyDao.createDirectories();
      final List<EncryptionKey> existing = loadExistingKeys();
      for (KeyPurpose purpose : configuration.rotationConfigs().keySet()) {
        withLock(purpose, () -> {
          if (!activeKeys.containsKey(purpose)) {
            final Optional<EncryptionKey> previous = existing.stream()
                .filter(k -> k.purposes().contains(purpose))
                .max(Comparator.comparingInt(EncryptionKey::version));
            final EncryptionKey key = generateKey(purpose, previous);
            activeKeys.put(purpose, key);
          }
          return null;
        });
      }
      expireRotatedKeys();
      scheduling.set(true);
      activeKeys.forEach(this::scheduleRotation);
      LOGGER.info("Initialized with active keys for {}", activeKeys.keySet());
    } catch (ComplianceException e) {
      throw alerter.alerted("KEY_INIT_ERROR", Severity.HIGH, e, details());
    }
  }

  /**
   * Gets the active key of a purpose.
   *
   * @param purpose the purpose
   * @return the key
   */
  public EncryptionKey getActiveKey(final KeyPurpose purpose) {
    LOGGER.trace("getActiveKey({})", purpose);
    final EncryptionKey key = activeKeys.get(purpose);
    if (key == null) {
      throw alerter.alerted("KEY_RETRIEVAL_ERROR", Severity.HIGH, new NoActiveKeyException(purpose),
          details("purpose", purpose));
    }
    return key;
  }

  /**
   * Gets any key by id, active or historical.
   *
   * @param keyId the key id
   * @return the key
   */
  public EncryptionKey getKey(final String keyId) {
    LOGGER.trace("getKey({})", keyId);
    for (EncryptionKey key : activeKeys.values()) {
      if (key.id().equals(keyId)) {
        return key;
      }
    }
    try {
      return encryptionKeyDao.getKey(keyId).orElseThrow(() -> new KeyNotFoundException(keyId));
    } catch (ComplianceException e) {
      throw alerter.alerted("KEY_RETRIEVAL_ERROR", Severity.HIGH, e, details("keyId", keyId));
    }
  }

  /**
   * Replace the active key of the purpose with a new version. The outgoing key moves to ROTATING and stays
   * readable through the grace period.
   *
   * @param purpose the purpose
   * @return the new active key.
   */
  public EncryptionKey rotateKey(final KeyPurpose purpose) {
    LOGGER.trace("rotateKey({})", purpose);
    return rotate(purpose, KeyStatus.ROTATING);
  }

  /**
   * Mark a key compromised. If it is the active key of a purpose, that purpose is rotated immediately.
   *
   * @param keyId the key id
   * @return the key as now persisted.
   */
  public EncryptionKey markCompromised(final String keyId) {
    LOGGER.trace("markCompromised({})", keyId);
    final EncryptionKey key = getKey(keyId);
    alerter.raise("KEY_COMPROMISED", Severity.CRITICAL, details("keyId", keyId, "purposes", key.purposes()));
    boolean rotated = false;
    for (KeyPurpose purpose : key.purposes()) {
      final EncryptionKey active = activeKeys.get(purpose);
      if (active != null && active.id().equals(keyId)) {
        rotate(purpose, KeyStatus.COMPROMISED);
        rotated = true;
      }
    }
    if (!rotated) {
      final EncryptionKey compromised = ImmutableEncryptionKey.copyOf(key).withStatus(KeyStatus.COMPROMISED);
      try {
        encryptionKeyDao.save(compromised);
      } catch (ComplianceException e) {
        throw alerter.alerted("KEY_ROTATION_ERROR", Severity.HIGH, e, details("keyId", keyId));
      }
    }
    return encryptionKeyDao.getKey(keyId).orElseThrow(() -> new KeyNotFoundException(keyId));
  }

  /**
   * Move ROTATING keys whose grace period has passed to EXPIRED.
   *
   * @return ids of the keys expired.
   */
  public List<String> expireRotatedKeys() {
    LOGGER.trace("expireRotatedKeys()");
    final Instant now = clock.instant();
    final List<String> expired = new ArrayList<>();
    for (EncryptionKey key : encryptionKeyDao.loadAll()) {
      if (key.status() != KeyStatus.ROTATING || key.purposes().isEmpty()) {
        continue;
      }
      final KeyPurpose purpose = key.purposes().get(0);
      final KeyRotationConfig config = configuration.rotationConfigs().get(purpose);
      if (config == null) {
        continue;
      }
      final Instant rotatedAt = key.rotatedAt().orElse(key.expiresAt());
      if (!now.isBefore(rotatedAt.plus(config.gracePeriod()))) {
        withLock(purpose, () -> {
          encryptionKeyDao.save(ImmutableEncryptionKey.copyOf(key).withStatus(KeyStatus.EXPIRED));
          return null;
        });
        LOGGER.info("Expired key {} of {}", key.id(), purpose);
        expired.add(key.id());
      }
    }
    return expired;
  }

  /**
   * Every persisted key.
   *
   * @return the list
   */
  public List<EncryptionKey> listKeys() {
    return encryptionKeyDao.loadAll();
  }

  /**
   * Snapshot of the active keys.
   *
   * @return the map
   */
  public Map<KeyPurpose, EncryptionKey> activeKeys() {
    final Map<KeyPurpose, EncryptionKey> map = new EnumMap<>(KeyPurpose.class);
    map.putAll(activeKeys);
    return map;
  }

  /**
   * Cancel every rotation timer and forget the in-memory keys. Persisted keys are untouched.
   */
  public void cleanup() {
    LOGGER.info("cleanup()");
    scheduling.set(false);
    rotationSchedules.values().forEach(ScheduledTask::cancel);
    rotationSchedules.clear();
    activeKeys.clear();
  }

  private EncryptionKey rotate(final KeyPurpose purpose, final KeyStatus outgoingStatus) {
    return withLock(purpose, () -> {
      final EncryptionKey current = activeKeys.get(purpose);
      if (current == null) {
        throw alerter.alerted("KEY_ROTATION_ERROR", Severity.HIGH, new NoActiveKeyException(purpose),
            details("purpose", purpose));
      }
      final Instant now = clock.instant();
      EncryptionKey fresh = null;
      try {
        final KeyRotationConfig config = rotationConfig(purpose);
        encryptionKeyDao.save(ImmutableEncryptionKey.copyOf(current)
            .withStatus(outgoingStatus)
            .withRotatedAt(now));
        fresh = generateKey(purpose, Optional.of(current));
        if (config.backupRequired()) {
          fresh = backupKey(fresh);
        }
        if (config.verificationRequired()) {
          fresh = verifyKey(fresh);
        }
      } catch (ComplianceException e) {
        rollback(current, fresh, e);
        throw alerter.alerted("KEY_ROTATION_ERROR", Severity.HIGH, e, details("purpose", purpose));
      }
      activeKeys.put(purpose, fresh);
      LOGGER.info("Rotated {} from version {} to {}", purpose, current.version(), fresh.version());
      if (scheduling.get()) {
        scheduleRotation(purpose, fresh);
      }
      return fresh;
    });
  }

  // Demote the new key before restoring the old one so two ACTIVE keys never exist on disk.
  private void rollback(final EncryptionKey current, final EncryptionKey fresh, final ComplianceException cause) {
    try {
      if (fresh != null) {
        encryptionKeyDao.save(ImmutableEncryptionKey.copyOf(fresh)
            .withStatus(KeyStatus.EXPIRED)
            .withRotatedAt(clock.instant()));
      }
      encryptionKeyDao.save(current);
    } catch (RuntimeException e) {
      LOGGER.error("Unable to roll back rotation of {}", current.id(), e);
      cause.addSuppressed(e);
    }
  }

  private EncryptionKey generateKey(final KeyPurpose purpose, final Optional<EncryptionKey> previous) {
    LOGGER.trace("generateKey({})", purpose);
    try {
      final KeyRotationConfig config = rotationConfig(purpose);
      final byte[] material = new byte[config.keySizeBytes()];
      secureRandom.nextBytes(material);
      final byte[] iv = new byte[config.ivSizeBytes()];
      secureRandom.nextBytes(iv);
      final Instant now = clock.instant();
      final EncryptionKey key = ImmutableEncryptionKey.builder()
          .id(UUID.randomUUID().toString())
          .version(previous.map(k -> k.version() + 1).orElse(1))
          .algorithm(config.algorithm())
          .keyMaterial(material)
          .iv(iv)
          .createdAt(now)
          .expiresAt(now.plus(config.rotationPeriod()))
          .status(KeyStatus.ACTIVE)
          .addPurposes(purpose)
          .metadata(ImmutableKeyMetadata.builder().hash(DigestUtilities.sha256.apply(material)).build())
          .build();
      encryptionKeyDao.save(key);
      return key;
    } catch (ComplianceException e) {
      throw alerter.alerted("KEY_GENERATION_ERROR", Severity.HIGH, e, details("purpose", purpose));
    }
  }

  private EncryptionKey backupKey(final EncryptionKey key) {
    try {
      final String location = encryptionKeyDao.writeBackup(key, clock.instant()).toString();
      final EncryptionKey updated = ImmutableEncryptionKey.copyOf(key)
          .withMetadata(ImmutableKeyMetadata.copyOf(key.metadata()).withBackupLocation(location));
      encryptionKeyDao.save(updated);
      return updated;
    } catch (ComplianceException e) {
      throw alerter.alerted("KEY_BACKUP_ERROR", Severity.HIGH, e, details("keyId", key.id()));
    }
  }

  private EncryptionKey verifyKey(final EncryptionKey key) {
    try {
      final EncryptionKey stored = encryptionKeyDao.getKey(key.id())
          .orElseThrow(() -> new KeyNotFoundException(key.id()));
      checkHash("key file", key, stored);
      if (key.metadata().backupLocation().isPresent()) {
        checkHash("backup", key, encryptionKeyDao.readBackup(key.metadata().backupLocation().get()));
      }
      final EncryptionKey updated = ImmutableEncryptionKey.copyOf(key)
          .withMetadata(ImmutableKeyMetadata.copyOf(key.metadata()).withLastVerified(clock.instant()));
      encryptionKeyDao.save(updated);
      return updated;
    } catch (ComplianceException e) {
      throw alerter.alerted("KEY_VERIFICATION_ERROR", Severity.CRITICAL, e, details("keyId", key.id()));
    }
  }

  private void checkHash(final String copy, final EncryptionKey expected, final EncryptionKey stored) {
    final String hash = DigestUtilities.sha256.apply(stored.keyMaterial());
    if (!hash.equals(expected.metadata().hash())) {
      throw new KeyVerificationException("Hash mismatch in " + copy + " of key " + expected.id());
    }
  }

  private List<EncryptionKey> loadExistingKeys() {
    final Instant now = clock.instant();
    final List<EncryptionKey> keys;
    try {
      keys = encryptionKeyDao.loadAll();
    } catch (ComplianceException e) {
      throw alerter.alerted("KEY_LOAD_ERROR", Severity.HIGH, e, details());
    }
    final Map<KeyPurpose, List<EncryptionKey>> candidates = new EnumMap<>(KeyPurpose.class);
    final List<EncryptionKey> active = new ArrayList<>();
    for (EncryptionKey key : keys) {
      if (key.status() != KeyStatus.ACTIVE) {
        continue;
      }
      active.add(key);
      if (!key.isDue(now)) {
        key.purposes().forEach(p -> candidates.computeIfAbsent(p, k -> new ArrayList<>()).add(key));
      }
    }
    final Set<String> chosen = new HashSet<>();
    candidates.forEach((purpose, list) -> {
      final EncryptionKey newest = list.stream().max(Comparator.comparing(EncryptionKey::createdAt)).get();
      activeKeys.put(purpose, newest);
      chosen.add(newest.id());
    });
    for (EncryptionKey key : active) {
      if (!chosen.contains(key.id())) {
        LOGGER.warn("Demoting key {} ({}) to ROTATING on load", key.id(), key.purposes());
        encryptionKeyDao.save(ImmutableEncryptionKey.copyOf(key)
            .withStatus(KeyStatus.ROTATING)
            .withRotatedAt(now));
      }
    }
    LOGGER.info("Loaded {} keys, {} active", keys.size(), activeKeys.size());
    return keys;
  }

  private void scheduleRotation(final KeyPurpose purpose, final EncryptionKey key) {
    final Duration delay = Duration.between(clock.instant(), key.expiresAt());
    LOGGER.debug("Rotation of {} in {}", purpose, delay);
    final ScheduledTask task = scheduler.schedule(delay, () -> runScheduledRotation(purpose));
    final ScheduledTask previous = rotationSchedules.put(purpose, task);
    if (previous != null) {
      previous.cancel();
    }
  }

  private void runScheduledRotation(final KeyPurpose purpose) {
    try {
      rotateKey(purpose);
    } catch (RuntimeException e) {
      rotationSchedules.remove(purpose);
      LOGGER.error("Scheduled rotation of {} failed, not re-armed", purpose, e);
      alerter.raise("KEY_ROTATION_SCHEDULE_ERROR", Severity.HIGH,
          details("purpose", purpose, "error", e.getMessage()));
    }
  }

  private KeyRotationConfig rotationConfig(final KeyPurpose purpose) {
    final KeyRotationConfig config = configuration.rotationConfigs().get(purpose);
    if (config == null) {
      throw new MissingRotationConfigException(purpose);
    }
    return config;
  }

  private <T> T withLock(final KeyPurpose purpose, final Supplier<T> supplier) {
    final ReentrantLock lock = locks.computeIfAbsent(purpose, p -> new ReentrantLock());
    lock.lock();
    try {
      return supplier.get();
    } finally {
      lock.unlock();
    }
  }

}
