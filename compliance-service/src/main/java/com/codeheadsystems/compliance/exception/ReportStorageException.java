package com.codeheadsystems.compliance.exception;

import com.codeheadsystems.compliance.common.exception.ComplianceException;
import com.codeheadsystems.compliance.common.exception.ErrorKind;

/**
 * A report could not be written or read back. Retryable.
 */
public class ReportStorageException extends ComplianceException {

  /**
   * Instantiates a new Report storage exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public ReportStorageException(final String message, final Throwable cause) {
    super(ErrorKind.TRANSIENT_IO, message, cause);
  }
}
