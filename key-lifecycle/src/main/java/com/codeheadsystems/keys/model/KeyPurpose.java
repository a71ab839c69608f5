package com.codeheadsystems.keys.model;

/**
 * What a key is allowed to protect. Each purpose has its own rotation policy and at most one ACTIVE key.
 */
public enum KeyPurpose {
  PHI_ENCRYPTION,
  AUDIT_LOG_ENCRYPTION,
  BACKUP_ENCRYPTION,
  SECURE_COMMUNICATION
}
