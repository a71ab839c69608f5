package com.codeheadsystems.ledger.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

/**
 * The thing acted on. Type is free text such as PHI, USER or SYSTEM.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableAuditResource.class)
@JsonDeserialize(as = ImmutableAuditResource.class)
public interface AuditResource {

  /**
   * Type string.
   *
   * @return the string
   */
  String type();

  /**
   * Id string.
   *
   * @return the string
   */
  String id();

  /**
   * Description string.
   *
   * @return the string
   */
  String description();

}
