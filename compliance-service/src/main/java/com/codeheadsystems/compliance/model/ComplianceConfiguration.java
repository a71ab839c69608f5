package com.codeheadsystems.compliance.model;

import com.codeheadsystems.backup.model.BackupConfiguration;
import com.codeheadsystems.keys.model.KeyLifecycleConfiguration;
import com.codeheadsystems.ledger.model.LedgerConfiguration;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.immutables.value.Value;

/**
 * Everything one process needs: the three stores and where reports go.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableComplianceConfiguration.class)
@JsonDeserialize(as = ImmutableComplianceConfiguration.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface ComplianceConfiguration {

  /**
   * Ledger ledger configuration.
   *
   * @return the ledger configuration
   */
  LedgerConfiguration ledger();

  /**
   * Keys key lifecycle configuration.
   *
   * @return the key lifecycle configuration
   */
  KeyLifecycleConfiguration keys();

  /**
   * Backups backup configuration.
   *
   * @return the backup configuration
   */
  BackupConfiguration backups();

  /**
   * Reports directory string.
   *
   * @return the string
   */
  String reportsDirectory();

  /**
   * Assessment criteria.
   *
   * @return the assessment criteria
   */
  @Value.Default
  default AssessmentCriteria assessmentCriteria() {
    return AssessmentCriteria.DEFAULT;
  }

  /**
   * Reports path.
   *
   * @return the path
   */
  default Path reportsPath() {
    return Paths.get(reportsDirectory());
  }

}
