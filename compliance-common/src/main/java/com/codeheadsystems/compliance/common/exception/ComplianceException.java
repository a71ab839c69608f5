package com.codeheadsystems.compliance.common.exception;

/**
 * Base of every failure the compliance components surface to callers.
 */
public class ComplianceException extends RuntimeException {

  private final ErrorKind kind;

  /**
   * Instantiates a new Compliance exception.
   *
   * @param kind    the kind
   * @param message the message
   */
  public ComplianceException(final ErrorKind kind, final String message) {
    super(message);
    this.kind = kind;
  }

  /**
   * Instantiates a new Compliance exception.
   *
   * @param kind    the kind
   * @param message the message
   * @param cause   the cause
   */
  public ComplianceException(final ErrorKind kind, final String message, final Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  /**
   * Kind error kind.
   *
   * @return the error kind
   */
  public ErrorKind kind() {
    return kind;
  }

  /**
   * Only storage failures are worth retrying.
   *
   * @return true if the caller may retry.
   */
  public boolean isRetryable() {
    return kind == ErrorKind.TRANSIENT_IO;
  }
}
