package com.codeheadsystems.keys.exception;

import com.codeheadsystems.compliance.common.exception.ComplianceException;
import com.codeheadsystems.compliance.common.exception.ErrorKind;
import com.codeheadsystems.keys.model.KeyPurpose;

/**
 * The purpose has no rotation policy configured.
 */
public class MissingRotationConfigException extends ComplianceException {

  /**
   * Instantiates a new Missing rotation config exception.
   *
   * @param purpose the purpose
   */
  public MissingRotationConfigException(final KeyPurpose purpose) {
    super(ErrorKind.CONFIGURATION, "No rotation config for purpose " + purpose);
  }
}
