package com.codeheadsystems.compliance.exception;

import com.codeheadsystems.compliance.common.exception.ComplianceException;
import com.codeheadsystems.compliance.common.exception.ErrorKind;

/**
 * The configuration file is missing or does not describe a valid configuration.
 */
public class InvalidConfigurationException extends ComplianceException {

  /**
   * Instantiates a new Invalid configuration exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public InvalidConfigurationException(final String message, final Throwable cause) {
    super(ErrorKind.CONFIGURATION, message, cause);
  }
}
