package com.codeheadsystems.ledger.exception;

import com.codeheadsystems.compliance.common.exception.ComplianceException;
import com.codeheadsystems.compliance.common.exception.ErrorKind;

/**
 * A segment could not be listed, read, written or moved. Retryable.
 */
public class LedgerStorageException extends ComplianceException {

  /**
   * Instantiates a new Ledger storage exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public LedgerStorageException(final String message, final Throwable cause) {
    super(ErrorKind.TRANSIENT_IO, message, cause);
  }
}
