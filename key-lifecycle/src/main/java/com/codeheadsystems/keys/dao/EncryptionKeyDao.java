package com.codeheadsystems.keys.dao;

import com.codeheadsystems.compliance.common.utilities.FileUtilities;
import com.codeheadsystems.keys.exception.KeyStorageException;
import com.codeheadsystems.keys.model.EncryptionKey;
import com.codeheadsystems.keys.model.KeyLifecycleConfiguration;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One JSON file per key, key-&lt;id&gt;.json, plus backup copies under backup/. Every write is atomic.
 */
@Singleton
public class EncryptionKeyDao {

  private static final Logger LOGGER = LoggerFactory.getLogger(EncryptionKeyDao.class);
  private static final String PREFIX = "key-";
  private static final String SUFFIX = ".json";
  private static final String BACKUP_DIRECTORY = "backup";

  private final Path keysDirectory;
  private final ObjectMapper objectMapper;

  /**
   * Instantiates a new Encryption key dao.
   *
   * @param configuration the configuration
   * @param objectMapper  the object mapper
   */
  @Inject
  public EncryptionKeyDao(final KeyLifecycleConfiguration configuration,
                          final ObjectMapper objectMapper) {
    this.keysDirectory = configuration.keysPath();
    this.objectMapper = objectMapper;
    LOGGER.info("EncryptionKeyDao({})", keysDirectory);
  }

  /**
   * Create the key and backup directories if missing.
   */
  public void createDirectories() {
    try {
      Files.createDirectories(backupDirectory());
    } catch (IOException e) {
      throw new KeyStorageException("Unable to create " + keysDirectory, e);
    }
  }

  /**
   * Backup directory path.
   *
   * @return the path
   */
  public Path backupDirectory() {
    return keysDirectory.resolve(BACKUP_DIRECTORY);
  }

  /**
   * Ids of every persisted key, sorted.
   *
   * @return the list
   */
  public List<String> listKeys() {
    LOGGER.trace("listKeys()");
    if (!Files.isDirectory(keysDirectory)) {
      return List.of();
    }
    try (Stream<Path> files = Files.list(keysDirectory)) {
      return files.map(p -> p.getFileName().toString())
          .filter(name -> name.startsWith(PREFIX) && name.endsWith(SUFFIX))
          .map(name -> name.substring(PREFIX.length(), name.length() - SUFFIX.length()))
          .sorted()
          .collect(Collectors.toList());
    } catch (IOException e) {
      throw new KeyStorageException("Unable to list " + keysDirectory, e);
    }
  }

  /**
   * Gets key.
   *
   * @param id the id
   * @return the key
   */
  public Optional<EncryptionKey> getKey(final String id) {
    LOGGER.trace("getKey({})", id);
    final Path path = keyPath(id);
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    return Optional.of(read(path));
  }

  /**
   * Every persisted key.
   *
   * @return the list
   */
  public List<EncryptionKey> loadAll() {
    final List<EncryptionKey> keys = new ArrayList<>();
    for (String id : listKeys()) {
      getKey(id).ifPresent(keys::add);
    }
    return keys;
  }

  /**
   * Insert or replace the key file.
   *
   * @param key the key
   */
  public void save(final EncryptionKey key) {
    LOGGER.trace("save({}, {})", key.id(), key.status());
    write(keyPath(key.id()), key);
  }

  /**
   * Write a backup copy of the key.
   *
   * @param key the key
   * @param now the now
   * @return where it was written.
   */
  public Path writeBackup(final EncryptionKey key, final Instant now) {
    LOGGER.trace("writeBackup({})", key.id());
    final Path path = backupDirectory().resolve(PREFIX + key.id() + "-" + now.toEpochMilli() + ".backup");
    write(path, key);
    return path;
  }

  /**
   * Read a backup copy.
   *
   * @param location the location
   * @return the key
   */
  public EncryptionKey readBackup(final String location) {
    LOGGER.trace("readBackup({})", location);
    return read(Path.of(location));
  }

  private Path keyPath(final String id) {
    return keysDirectory.resolve(PREFIX + id + SUFFIX);
  }

  private void write(final Path path, final EncryptionKey key) {
    try {
      FileUtilities.writeAtomically(path, objectMapper.writeValueAsBytes(key));
    } catch (IOException e) {
      throw new KeyStorageException("Unable to write " + path, e);
    }
  }

  private EncryptionKey read(final Path path) {
    try {
      return objectMapper.readValue(path.toFile(), EncryptionKey.class);
    } catch (IOException e) {
      throw new KeyStorageException("Unable to read " + path, e);
    }
  }

}
