package com.codeheadsystems.backup.exception;

import com.codeheadsystems.compliance.common.exception.ComplianceException;
import com.codeheadsystems.compliance.common.exception.ErrorKind;

/**
 * No backup configuration for the data type.
 */
public class UnknownDataTypeException extends ComplianceException {

  /**
   * Instantiates a new Unknown data type exception.
   *
   * @param dataType the data type
   */
  public UnknownDataTypeException(final String dataType) {
    super(ErrorKind.CONFIGURATION, "No backup configuration found for data type: " + dataType);
  }
}
