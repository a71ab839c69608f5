package com.codeheadsystems.compliance.model;

/**
 * What a finding is about.
 */
public enum ViolationType {
  MISSING_AUDIT,
  INCOMPLETE_AUDIT,
  RETENTION_VIOLATION,
  UNAUTHORIZED_ACCESS,
  EMERGENCY_ACCESS,
  UNENCRYPTED_DATA,
  KEY_ROTATION_OVERDUE,
  BACKUP_FAILURE
}
