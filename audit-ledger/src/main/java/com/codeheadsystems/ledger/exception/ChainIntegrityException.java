package com.codeheadsystems.ledger.exception;

import com.codeheadsystems.compliance.common.exception.ComplianceException;
import com.codeheadsystems.compliance.common.exception.ErrorKind;

/**
 * The persisted ledger no longer forms an unbroken hash chain: a line was edited, removed, reordered or
 * cannot be decoded.
 */
public class ChainIntegrityException extends ComplianceException {

  /**
   * Instantiates a new Chain integrity exception.
   *
   * @param message the message
   */
  public ChainIntegrityException(final String message) {
    super(ErrorKind.INTEGRITY, message);
  }

  /**
   * Instantiates a new Chain integrity exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public ChainIntegrityException(final String message, final Throwable cause) {
    super(ErrorKind.INTEGRITY, message, cause);
  }
}
