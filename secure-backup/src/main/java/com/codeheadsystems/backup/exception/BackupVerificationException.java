package com.codeheadsystems.backup.exception;

import com.codeheadsystems.compliance.common.exception.ComplianceException;
import com.codeheadsystems.compliance.common.exception.ErrorKind;

/**
 * A backup did not match what was recorded when it was written.
 */
public class BackupVerificationException extends ComplianceException {

  /**
   * Instantiates a new Backup verification exception.
   *
   * @param message the message
   */
  public BackupVerificationException(final String message) {
    super(ErrorKind.INTEGRITY, message);
  }
}
