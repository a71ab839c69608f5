package com.codeheadsystems.compliance.common.exception;

/**
 * What kind of failure a {@link ComplianceException} represents, which decides how a caller should react.
 */
public enum ErrorKind {
  /**
   * Tampering or corruption detected. Never retry.
   */
  INTEGRITY,
  /**
   * Deployment or setup defect: unknown data type, missing rotation policy, no active key.
   */
  CONFIGURATION,
  /**
   * Storage hiccup. The caller may retry.
   */
  TRANSIENT_IO,
  /**
   * A timer body failed.
   */
  SCHEDULING
}
