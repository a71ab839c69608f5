package com.codeheadsystems.compliance.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.List;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableAccessControlSection.class)
@JsonDeserialize(as = ImmutableAccessControlSection.class)
public interface AccessControlSection {

  /**
   * READ events of the period.
   *
   * @return the int
   */
  int totalAccesses();

  int unauthorizedAccesses();

  int emergencyAccesses();

  List<ComplianceViolation> violations();

}
