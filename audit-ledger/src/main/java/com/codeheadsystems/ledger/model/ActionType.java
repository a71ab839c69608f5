package com.codeheadsystems.ledger.model;

/**
 * The action type enum.
 */
public enum ActionType {
  CREATE,
  READ,
  UPDATE,
  DELETE,
  EXPORT,
  LOGIN,
  LOGOUT,
  EMERGENCY_ACCESS
}
