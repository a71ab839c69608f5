package com.codeheadsystems.ledger.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * Who performed the action.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableActor.class)
@JsonDeserialize(as = ImmutableActor.class)
public interface Actor {

  /**
   * System actor, used for the ledger's own bookkeeping and scheduled work.
   */
  Actor SYSTEM = ImmutableActor.builder().id("SYSTEM").role("SYSTEM").ipAddress("127.0.0.1").build();

  /**
   * Id string.
   *
   * @return the string
   */
  String id();

  /**
   * Role string.
   *
   * @return the string
   */
  String role();

  /**
   * Network origin of the request.
   *
   * @return the optional
   */
  Optional<String> ipAddress();

}
