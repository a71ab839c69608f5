package com.codeheadsystems.keys.exception;

import com.codeheadsystems.compliance.common.exception.ComplianceException;
import com.codeheadsystems.compliance.common.exception.ErrorKind;

/**
 * A key file or backup could not be read or written.
 */
public class KeyStorageException extends ComplianceException {

  /**
   * Instantiates a new Key storage exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public KeyStorageException(final String message, final Throwable cause) {
    super(ErrorKind.TRANSIENT_IO, message, cause);
  }
}
