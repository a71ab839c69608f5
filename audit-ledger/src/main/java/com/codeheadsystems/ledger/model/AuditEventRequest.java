package com.codeheadsystems.ledger.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * What callers hand to the ledger. The ledger adds the id, timestamp and chain metadata.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableAuditEventRequest.class)
@JsonDeserialize(as = ImmutableAuditEventRequest.class)
public interface AuditEventRequest {

  /**
   * Category event category.
   *
   * @return the event category
   */
  EventCategory category();

  /**
   * Actor actor.
   *
   * @return the actor
   */
  Actor actor();

  /**
   * Action audit action.
   *
   * @return the audit action
   */
  AuditAction action();

  /**
   * Resource audit resource.
   *
   * @return the audit resource
   */
  AuditResource resource();

  /**
   * Subject optional.
   *
   * @return the optional
   */
  Optional<SubjectReference> subject();

  /**
   * Location optional.
   *
   * @return the optional
   */
  Optional<EventLocation> location();

  /**
   * Reason optional.
   *
   * @return the optional
   */
  Optional<String> reason();

}
