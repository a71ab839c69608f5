package com.codeheadsystems.backup.exception;

import com.codeheadsystems.compliance.common.exception.ComplianceException;
import com.codeheadsystems.compliance.common.exception.ErrorKind;

/**
 * Backup metadata or directories could not be read or written. Retryable.
 */
public class BackupStorageException extends ComplianceException {

  /**
   * Instantiates a new Backup storage exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public BackupStorageException(final String message, final Throwable cause) {
    super(ErrorKind.TRANSIENT_IO, message, cause);
  }
}
