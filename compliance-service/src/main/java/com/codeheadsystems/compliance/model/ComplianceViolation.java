package com.codeheadsystems.compliance.model;

import com.codeheadsystems.compliance.common.alert.Severity;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.time.Instant;
import java.util.Map;
import org.immutables.value.Value;

/**
 * A single finding of a report.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableComplianceViolation.class)
@JsonDeserialize(as = ImmutableComplianceViolation.class)
public interface ComplianceViolation {

  String id();

  Instant timestamp();

  ViolationType type();

  Severity severity();

  String description();

  /**
   * Identifiers of whatever triggered the finding. Never event content.
   *
   * @return the map
   */
  Map<String, Object> details();

  @Value.Default
  default ViolationStatus status() {
    return ViolationStatus.OPEN;
  }

  /**
   * Whether the finding is alerted when the report is generated.
   *
   * @return the boolean
   */
  @JsonIgnore
  default boolean isHighRisk() {
    return severity() == Severity.HIGH || severity() == Severity.CRITICAL;
  }

}
