package com.codeheadsystems.compliance.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.immutables.value.Value;

/**
 * Point-in-time compliance assessment over a reporting period.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableComplianceReport.class)
@JsonDeserialize(as = ImmutableComplianceReport.class)
public interface ComplianceReport {

  /**
   * Id string.
   *
   * @return the string
   */
  String id();

  /**
   * When the report was generated.
   *
   * @return the instant
   */
  Instant timestamp();

  /**
   * Period start instant.
   *
   * @return the instant
   */
  Instant periodStart();

  /**
   * Period end instant.
   *
   * @return the instant
   */
  Instant periodEnd();

  /**
   * Summary report summary.
   *
   * @return the report summary
   */
  ReportSummary summary();

  /**
   * Audit trails audit trail section.
   *
   * @return the audit trail section
   */
  AuditTrailSection auditTrails();

  /**
   * Retention retention section.
   *
   * @return the retention section
   */
  RetentionSection retention();

  /**
   * Access control access control section.
   *
   * @return the access control section
   */
  AccessControlSection accessControl();

  /**
   * Encryption encryption section.
   *
   * @return the encryption section
   */
  EncryptionSection encryption();

  /**
   * Recommendations list.
   *
   * @return the list
   */
  List<String> recommendations();

  /**
   * Every finding, section by section.
   *
   * @return the list
   */
  @JsonIgnore
  default List<ComplianceViolation> violations() {
    final List<ComplianceViolation> list = new ArrayList<>(auditTrails().violations());
    list.addAll(retention().violations());
    list.addAll(accessControl().violations());
    list.addAll(encryption().violations());
    return list;
  }

}
