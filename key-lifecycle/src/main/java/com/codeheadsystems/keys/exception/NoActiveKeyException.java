package com.codeheadsystems.keys.exception;

import com.codeheadsystems.compliance.common.exception.ComplianceException;
import com.codeheadsystems.compliance.common.exception.ErrorKind;
import com.codeheadsystems.keys.model.KeyPurpose;

/**
 * The purpose has no ACTIVE key.
 */
public class NoActiveKeyException extends ComplianceException {

  /**
   * Instantiates a new No active key exception.
   *
   * @param purpose the purpose
   */
  public NoActiveKeyException(final KeyPurpose purpose) {
    super(ErrorKind.CONFIGURATION, "No active key for purpose " + purpose);
  }
}
