package com.codeheadsystems.backup.model;

/**
 * Outcome of the most recent verification of a backup.
 */
public enum VerificationStatus {
  PENDING,
  SUCCESS,
  FAILURE
}
