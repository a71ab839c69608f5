package com.codeheadsystems.ledger.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * The event location.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableEventLocation.class)
@JsonDeserialize(as = ImmutableEventLocation.class)
public interface EventLocation {

  /**
   * Facility string.
   *
   * @return the string
   */
  String facility();

  /**
   * Department optional.
   *
   * @return the optional
   */
  Optional<String> department();

}
