package com.codeheadsystems.compliance.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.List;
import org.immutables.value.Value;

/**
 * Completeness of the audit trail for the period.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableAuditTrailSection.class)
@JsonDeserialize(as = ImmutableAuditTrailSection.class)
public interface AuditTrailSection {

  int totalAudits();

  /**
   * Backups of the period with no matching CREATE_BACKUP event.
   *
   * @return the int
   */
  int missingAudits();

  /**
   * Events missing actor id, actor role or resource type.
   *
   * @return the int
   */
  int incompleteAudits();

  List<ComplianceViolation> violations();

}
