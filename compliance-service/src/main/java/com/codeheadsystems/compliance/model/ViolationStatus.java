package com.codeheadsystems.compliance.model;

/**
 * Remediation state of a finding. Reports only ever create OPEN findings.
 */
public enum ViolationStatus {
  OPEN,
  IN_PROGRESS,
  RESOLVED
}
