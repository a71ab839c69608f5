package com.codeheadsystems.ledger.model;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * A time window, inclusive at both ends, plus optional filters that are ANDed together.
 */
@Value.Immutable
public interface AuditQuery {

  /**
   * Every event on the given UTC days.
   *
   * @param first the first day
   * @param last  the last day
   * @return a builder with the window set.
   */
  static ImmutableAuditQuery.Builder days(final LocalDate first, final LocalDate last) {
    return ImmutableAuditQuery.builder()
        .from(first.atStartOfDay().toInstant(ZoneOffset.UTC))
        .to(last.plusDays(1).atStartOfDay().toInstant(ZoneOffset.UTC).minusNanos(1));
  }

  /**
   * From instant.
   *
   * @return the instant
   */
  Instant from();

  /**
   * To instant.
   *
   * @return the instant
   */
  Instant to();

  /**
   * Category optional.
   *
   * @return the optional
   */
  Optional<EventCategory> category();

  /**
   * Action type optional.
   *
   * @return the optional
   */
  Optional<ActionType> actionType();

  /**
   * Actor id optional.
   *
   * @return the optional
   */
  Optional<String> actorId();

  /**
   * Subject id optional.
   *
   * @return the optional
   */
  Optional<String> subjectId();

  /**
   * Resource id optional.
   *
   * @return the optional
   */
  Optional<String> resourceId();

  /**
   * First UTC date of the window.
   *
   * @return the local date
   */
  default LocalDate firstDate() {
    return LocalDate.ofInstant(from(), ZoneOffset.UTC);
  }

  /**
   * Last UTC date of the window.
   *
   * @return the local date
   */
  default LocalDate lastDate() {
    return LocalDate.ofInstant(to(), ZoneOffset.UTC);
  }

  /**
   * Whether the event passes the window and every filter that is set.
   *
   * @param event the event
   * @return the boolean
   */
  default boolean matches(final AuditEvent event) {
    return !event.timestamp().isBefore(from())
        && !event.timestamp().isAfter(to())
        && category().map(c -> c == event.category()).orElse(true)
        && actionType().map(t -> t == event.action().type()).orElse(true)
        && actorId().map(id -> id.equals(event.actor().id())).orElse(true)
        && subjectId().map(id -> event.subject().map(s -> id.equals(s.id())).orElse(false)).orElse(true)
        && resourceId().map(id -> id.equals(event.resource().id())).orElse(true);
  }

  /**
   * Check.
   */
  @Value.Check
  default void check() {
    if (to().isBefore(from())) {
      throw new IllegalStateException("Query window ends before it starts");
    }
  }

}
