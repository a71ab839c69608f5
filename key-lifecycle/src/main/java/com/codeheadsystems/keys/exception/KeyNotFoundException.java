package com.codeheadsystems.keys.exception;

import com.codeheadsystems.compliance.common.exception.ComplianceException;
import com.codeheadsystems.compliance.common.exception.ErrorKind;

/**
 * No key with the requested id, in memory or on disk.
 */
public class KeyNotFoundException extends ComplianceException {

  /**
   * Instantiates a new Key not found exception.
   *
   * @param keyId the key id
   */
  public KeyNotFoundException(final String keyId) {
    super(ErrorKind.CONFIGURATION, "Key not found: " + keyId);
  }
}
