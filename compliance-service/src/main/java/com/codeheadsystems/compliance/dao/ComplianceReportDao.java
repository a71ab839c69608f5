package com.codeheadsystems.compliance.dao;

import com.codeheadsystems.compliance.common.utilities.FileUtilities;
import com.codeheadsystems.compliance.exception.ReportStorageException;
import com.codeheadsystems.compliance.model.ComplianceConfiguration;
import com.codeheadsystems.compliance.model.ComplianceReport;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reports as compliance-report-&lt;id&gt;.json under the reports directory.
 */
@Singleton
public class ComplianceReportDao {

  private static final Logger LOGGER = LoggerFactory.getLogger(ComplianceReportDao.class);

  private final Path reportsDirectory;
  private final ObjectMapper objectMapper;

  /**
   * Instantiates a new Compliance report dao.
   *
   * @param configuration the configuration
   * @param objectMapper  the object mapper
   */
  @Inject
  public ComplianceReportDao(final ComplianceConfiguration configuration,
                             final ObjectMapper objectMapper) {
    this.reportsDirectory = configuration.reportsPath();
    this.objectMapper = objectMapper;
    LOGGER.info("ComplianceReportDao({})", reportsDirectory);
  }

  /**
   * Create directories.
   */
  public void createDirectories() {
    try {
      Files.createDirectories(reportsDirectory);
    } catch (IOException e) {
      throw new ReportStorageException("Unable to create " + reportsDirectory, e);
    }
  }

  /**
   * Write the report, pretty printed.
   *
   * @param report the report
   * @return where it was written.
   */
  public Path save(final ComplianceReport report) {
    LOGGER.trace("save({})", report.id());
    final Path path = path(report.id());
    try {
      FileUtilities.writeAtomically(path, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(report));
      return path;
    } catch (IOException e) {
      throw new ReportStorageException("Unable to write " + path, e);
    }
  }

  /**
   * Read a report back.
   *
   * @param id the id
   * @return the optional
   */
  public Optional<ComplianceReport> get(final String id) {
    LOGGER.trace("get({})", id);
    final Path path = path(id);
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    try {
      return Optional.of(objectMapper.readValue(path.toFile(), ComplianceReport.class));
    } catch (IOException e) {
      throw new ReportStorageException("Unable to read " + path, e);
    }
  }

  private Path path(final String id) {
    return reportsDirectory.resolve("compliance-report-" + id + ".json");
  }

}
