package com.codeheadsystems.backup.exception;

import com.codeheadsystems.compliance.common.exception.ComplianceException;
import com.codeheadsystems.compliance.common.exception.ErrorKind;

/**
 * No metadata for the backup id.
 */
public class BackupNotFoundException extends ComplianceException {

  /**
   * Instantiates a new Backup not found exception.
   *
   * @param backupId the backup id
   */
  public BackupNotFoundException(final String backupId) {
    super(ErrorKind.CONFIGURATION, "Backup not found: " + backupId);
  }
}
