package com.codeheadsystems.ledger.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.time.Instant;
import org.immutables.value.Value;

/**
 * Chain links of an event. The hash covers every field of the event except itself.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableEventMetadata.class)
@JsonDeserialize(as = ImmutableEventMetadata.class)
public interface EventMetadata {

  /**
   * Encrypted at instant.
   *
   * @return the instant
   */
  Instant encryptedAt();

  /**
   * Hash string.
   *
   * @return the string
   */
  String hash();

  /**
   * Hash of the event before this one in the ledger, or the seed hash for the first event.
   *
   * @return the string
   */
  String previousHash();

}
