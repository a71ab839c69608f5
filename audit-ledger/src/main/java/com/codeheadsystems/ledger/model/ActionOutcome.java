package com.codeheadsystems.ledger.model;

/**
 * The action outcome enum.
 */
public enum ActionOutcome {
  SUCCESS,
  FAILURE
}
