package com.codeheadsystems.compliance.common.alert;

/**
 * Severity attached to an alert.
 */
public enum Severity {
  /**
   * Informational, no action expected.
   */
  LOW,
  /**
   * Worth a look during business hours.
   */
  MEDIUM,
  /**
   * Operator attention required.
   */
  HIGH,
  /**
   * Integrity of regulated data is in question. Page someone.
   */
  CRITICAL
}
