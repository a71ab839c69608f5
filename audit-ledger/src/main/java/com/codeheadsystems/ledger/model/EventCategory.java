package com.codeheadsystems.ledger.model;

/**
 * Category of a regulated event. Retention policies are keyed by category.
 */
public enum EventCategory {
  DATA_ACCESS,
  DATA_MODIFICATION,
  AUTHENTICATION,
  SYSTEM_OPERATION,
  SECURITY_EVENT,
  ADMINISTRATIVE
}
