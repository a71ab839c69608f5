package com.codeheadsystems.ledger.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

/**
 * Segment counts as of now.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableRetentionStatus.class)
@JsonDeserialize(as = ImmutableRetentionStatus.class)
public interface RetentionStatus {

  /**
   * Active segments.
   *
   * @return the int
   */
  int activeSegments();

  /**
   * Archived segments.
   *
   * @return the int
   */
  int archivedSegments();

  /**
   * Active segments that archival would move now.
   *
   * @return the int
   */
  int segmentsPendingArchival();

  /**
   * Segments whose every event is past its deletion boundary.
   *
   * @return the int
   */
  int segmentsPendingDeletion();

}
