package com.codeheadsystems.compliance.model;

/**
 * Overall risk derived from the compliance score.
 */
public enum RiskLevel {
  LOW,
  MEDIUM,
  HIGH,
  CRITICAL;

  /**
   * Risk level for a score between 0 and 100.
   *
   * @param score the score
   * @return the risk level
   */
  public static RiskLevel of(final double score) {
    if (score >= 95) {
      return LOW;
    } else if (score >= 85) {
      return MEDIUM;
    } else if (score >= 75) {
      return HIGH;
    }
    return CRITICAL;
  }
}
