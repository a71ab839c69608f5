package com.codeheadsystems.ledger.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.time.Instant;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * One regulated action as stored in the ledger. Created once by the ledger, never changed.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableAuditEvent.class)
@JsonDeserialize(as = ImmutableAuditEvent.class)
public interface AuditEvent {

  /**
   * Id string.
   *
   * @return the string
   */
  String id();

  /**
   * Timestamp instant.
   *
   * @return the instant
   */
  Instant timestamp();

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
   * Free text justification.
   *
   * @return the optional
   */
  Optional<String> reason();

  /**
   * Metadata event metadata.
   *
   * @return the event metadata
   */
  EventMetadata metadata();

}
