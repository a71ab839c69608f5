package com.codeheadsystems.keys.exception;

import com.codeheadsystems.compliance.common.exception.ComplianceException;
import com.codeheadsystems.compliance.common.exception.ErrorKind;

/**
 * A persisted copy of a key no longer matches the recorded hash.
 */
public class KeyVerificationException extends ComplianceException {

  /**
   * Instantiates a new Key verification exception.
   *
   * @param message the message
   */
  public KeyVerificationException(final String message) {
    super(ErrorKind.INTEGRITY, message);
  }
}
