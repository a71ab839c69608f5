package com.codeheadsystems.backup.exception;

import com.codeheadsystems.backup.model.BackupStage;
import com.codeheadsystems.compliance.common.exception.ComplianceException;
import com.codeheadsystems.compliance.common.exception.ErrorKind;
import java.io.IOException;
import java.security.GeneralSecurityException;
import java.util.zip.ZipException;

/**
 * A pipeline stage failed. The kind is taken from the cause: compliance failures keep theirs, plain I/O
 * failures are transient, and failed tag checks, corrupt gzip data and anything else are integrity
 * failures.
 */
public class BackupStageException extends ComplianceException {

  private final BackupStage stage;
  private final String dataType;

  /**
   * Instantiates a new Backup stage exception.
   *
   * @param stage    the stage
   * @param dataType the data type
   * @param cause    the cause
   */
  public BackupStageException(final BackupStage stage, final String dataType, final Throwable cause) {
    super(kindOf(cause), "Backup stage " + stage + " failed for " + dataType + ": " + cause.getMessage(), cause);
    this.stage = stage;
    this.dataType = dataType;
  }

  private static ErrorKind kindOf(final Throwable cause) {
    if (cause instanceof ComplianceException) {
      return ((ComplianceException) cause).kind();
    }
    if (cause instanceof IOException
        && !(cause instanceof ZipException)
        && !(cause.getCause() instanceof GeneralSecurityException)) {
      return ErrorKind.TRANSIENT_IO;
    }
    return ErrorKind.INTEGRITY;
  }

  /**
   * Stage backup stage.
   *
   * @return the backup stage
   */
  public BackupStage stage() {
    return stage;
  }

  /**
   * Data type string.
   *
   * @return the string
   */
  public String dataType() {
    return dataType;
  }
}
