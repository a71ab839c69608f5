package com.codeheadsystems.ledger.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.time.Duration;
import org.immutables.value.Value;

/**
 * How long events of one category stay active, and when they may be deleted.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableRetentionPolicy.class)
@JsonDeserialize(as = ImmutableRetentionPolicy.class)
public interface RetentionPolicy {

  /**
   * Of retention policy.
   *
   * @param archiveAfterDays days until archival
   * @param deleteAfterDays  days until deletion, also the retention period
   * @return the retention policy
   */
  static RetentionPolicy of(final long archiveAfterDays, final long deleteAfterDays) {
    return ImmutableRetentionPolicy.builder()
        .retentionPeriod(Duration.ofDays(deleteAfterDays))
        .archiveAfter(Duration.ofDays(archiveAfterDays))
        .deleteAfter(Duration.ofDays(deleteAfterDays))
        .build();
  }

  /**
   * Retention period duration.
   *
   * @return the duration
   */
  Duration retentionPeriod();

  /**
   * Archive after duration.
   *
   * @return the duration
   */
  Duration archiveAfter();

  /**
   * Delete after duration.
   *
   * @return the duration
   */
  Duration deleteAfter();

}
