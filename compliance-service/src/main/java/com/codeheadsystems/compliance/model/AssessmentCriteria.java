package com.codeheadsystems.compliance.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

/**
 * Thresholds above which a report raises a finding.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableAssessmentCriteria.class)
@JsonDeserialize(as = ImmutableAssessmentCriteria.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface AssessmentCriteria {

  /**
   * Defaults.
   */
  AssessmentCriteria DEFAULT = ImmutableAssessmentCriteria.builder().build();

  @Value.Default
  default int maxPendingArchival() {
    return 100;
  }

  @Value.Default
  default int maxPendingDeletion() {
    return 50;
  }

  /**
   * Emergency accesses tolerated before the access score drops.
   *
   * @return the int
   */
  @Value.Default
  default int maxEmergencyAccesses() {
    return 10;
  }

  @Value.Check
  default void check() {
    if (maxPendingArchival() < 0 || maxPendingDeletion() < 0 || maxEmergencyAccesses() < 0) {
      throw new IllegalStateException("Assessment thresholds must not be negative");
    }
  }

}
