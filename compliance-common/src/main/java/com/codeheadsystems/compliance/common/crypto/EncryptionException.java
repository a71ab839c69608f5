package com.codeheadsystems.compliance.common.crypto;

import com.codeheadsystems.compliance.common.exception.ComplianceException;
import com.codeheadsystems.compliance.common.exception.ErrorKind;

/**
 * Encryption or decryption failed. A failed GCM tag check lands here, so it counts as an integrity error.
 */
public class EncryptionException extends ComplianceException {

  /**
   * Instantiates a new Encryption exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public EncryptionException(final String message, final Throwable cause) {
    super(ErrorKind.INTEGRITY, message, cause);
  }
}
