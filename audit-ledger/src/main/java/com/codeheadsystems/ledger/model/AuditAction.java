package com.codeheadsystems.ledger.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.Map;
import org.immutables.value.Value;

/**
 * What was done and how it ended. Details is an open map; values must be JSON friendly and not null.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableAuditAction.class)
@JsonDeserialize(as = ImmutableAuditAction.class)
public interface AuditAction {

  /**
   * Type action type.
   *
   * @return the action type
   */
  ActionType type();

  /**
   * Outcome action outcome.
   *
   * @return the action outcome
   */
  ActionOutcome outcome();

  /**
   * Details map.
   *
   * @return the map
   */
  Map<String, Object> details();

}
