package com.codeheadsystems.compliance.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableReportSummary.class)
@JsonDeserialize(as = ImmutableReportSummary.class)
public interface ReportSummary {

  int totalEvents();

  int totalViolations();

  /**
   * Weighted score between 0 and 100.
   *
   * @return the double
   */
  double complianceScore();

  RiskLevel riskLevel();

}
