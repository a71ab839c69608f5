package com.codeheadsystems.backup.dao;

import com.codeheadsystems.backup.exception.BackupStorageException;
import com.codeheadsystems.backup.model.BackupConfiguration;
import com.codeheadsystems.backup.model.BackupMetadata;
import com.codeheadsystems.compliance.common.utilities.FileUtilities;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One JSON file per backup, &lt;id&gt;.json, under the metadata directory. Every write is atomic.
 */
@Singleton
public class BackupMetadataDao {

  private static final Logger LOGGER = LoggerFactory.getLogger(BackupMetadataDao.class);
  private static final String SUFFIX = ".json";

  private final Path metadataDirectory;
  private final ObjectMapper objectMapper;

  /**
   * Instantiates a new Backup metadata dao.
   *
   * @param configuration the configuration
   * @param objectMapper  the object mapper
   */
  @Inject
  public BackupMetadataDao(final BackupConfiguration configuration,
                           final ObjectMapper objectMapper) {
    this.metadataDirectory = configuration.metadataPath();
    this.objectMapper = objectMapper;
    LOGGER.info("BackupMetadataDao({})", metadataDirectory);
  }

  /**
   * Create the metadata directory if missing.
   */
  public void createDirectories() {
    try {
      Files.createDirectories(metadataDirectory);
    } catch (IOException e) {
      throw new BackupStorageException("Unable to create " + metadataDirectory, e);
    }
  }

  /**
   * Insert or replace.
   *
   * @param metadata the metadata
   */
  public void save(final BackupMetadata metadata) {
    LOGGER.trace("save({}, {})", metadata.id(), metadata.verificationStatus());
    final Path path = path(metadata.id());
    try {
      FileUtilities.writeAtomically(path, objectMapper.writeValueAsBytes(metadata));
    } catch (IOException e) {
      throw new BackupStorageException("Unable to write " + path, e);
    }
  }

  /**
   * Gets a backup.
   *
   * @param id the id
   * @return the optional
   */
  public Optional<BackupMetadata> get(final String id) {
    LOGGER.trace("get({})", id);
    final Path path = path(id);
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    try {
      return Optional.of(objectMapper.readValue(path.toFile(), BackupMetadata.class));
    } catch (IOException e) {
      throw new BackupStorageException("Unable to read " + path, e);
    }
  }

  /**
   * Every backup, oldest first.
   *
   * @return the list
   */
  public List<BackupMetadata> loadAll() {
    LOGGER.trace("loadAll()");
    if (!Files.isDirectory(metadataDirectory)) {
      return List.of();
    }
    final List<String> ids;
    try (Stream<Path> files = Files.list(metadataDirectory)) {
      ids = files.map(p -> p.getFileName().toString())
          .filter(name -> name.endsWith(SUFFIX))
          .map(name -> name.substring(0, name.length() - SUFFIX.length()))
          .collect(Collectors.toList());
    } catch (IOException e) {
      throw new BackupStorageException("Unable to list " + metadataDirectory, e);
    }
    final List<BackupMetadata> list = new ArrayList<>();
    for (String id : ids) {
      get(id).ifPresent(list::add);
    }
    list.sort(Comparator.comparing(BackupMetadata::timestamp).thenComparing(BackupMetadata::id));
    return list;
  }

  private Path path(final String id) {
    return metadataDirectory.resolve(id + SUFFIX);
  }

}
