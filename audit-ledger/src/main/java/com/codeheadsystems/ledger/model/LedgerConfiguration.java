package com.codeheadsystems.ledger.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import org.immutables.value.Value;

/**
 * Ledger location, segmentation, retention and alerting rules.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableLedgerConfiguration.class)
@JsonDeserialize(as = ImmutableLedgerConfiguration.class)
public interface LedgerConfiguration {

  /**
   * Default segment size ceiling, 100 MiB.
   */
  long DEFAULT_MAX_SEGMENT_BYTES = 100L * 1024 * 1024;

  /**
   * Default retention map.
   *
   * @return a new mutable map.
   */
  static Map<EventCategory, RetentionPolicy> defaultRetentionPolicies() {
    final Map<EventCategory, RetentionPolicy> map = new EnumMap<>(EventCategory.class);
    map.put(EventCategory.DATA_ACCESS, RetentionPolicy.of(365, 365 * 6));
    map.put(EventCategory.DATA_MODIFICATION, RetentionPolicy.of(365, 365 * 6));
    map.put(EventCategory.SECURITY_EVENT, RetentionPolicy.of(365, 365 * 6));
    map.put(EventCategory.AUTHENTICATION, RetentionPolicy.of(180, 365 * 2));
    map.put(EventCategory.SYSTEM_OPERATION, RetentionPolicy.of(180, 365 * 2));
    map.put(EventCategory.ADMINISTRATIVE, RetentionPolicy.of(365, 365 * 6));
    return map;
  }

  /**
   * Directory of the active segments. Archived segments live in its archive subdirectory.
   *
   * @return the string
   */
  String ledgerDirectory();

  /**
   * Segment file name prefix.
   *
   * @return the string
   */
  @Value.Default
  default String segmentPrefix() {
    return "audit";
  }

  /**
   * A canonical segment at or above this size is rotated before the next append.
   *
   * @return the long
   */
  @Value.Default
  default long maxSegmentBytes() {
    return DEFAULT_MAX_SEGMENT_BYTES;
  }

  /**
   * Seal each line with the audit log encryption key.
   *
   * @return the boolean
   */
  @Value.Default
  default boolean sealSegments() {
    return false;
  }

  /**
   * Retention policies map.
   *
   * @return the map
   */
  @Value.Default
  default Map<EventCategory, RetentionPolicy> retentionPolicies() {
    return defaultRetentionPolicies();
  }

  /**
   * Categories that always raise a high risk alert.
   *
   * @return the set
   */
  @Value.Default
  default Set<EventCategory> highRiskCategories() {
    return EnumSet.of(EventCategory.DATA_ACCESS, EventCategory.DATA_MODIFICATION,
        EventCategory.AUTHENTICATION, EventCategory.SECURITY_EVENT);
  }

  /**
   * Action types that always raise a high risk alert.
   *
   * @return the set
   */
  @Value.Default
  default Set<ActionType> highRiskActions() {
    return EnumSet.of(ActionType.CREATE, ActionType.UPDATE, ActionType.DELETE, ActionType.EMERGENCY_ACCESS);
  }

  /**
   * Ledger path.
   *
   * @return the path
   */
  default Path ledgerPath() {
    return Paths.get(ledgerDirectory());
  }

  /**
   * Check.
   */
  @Value.Check
  default void check() {
    if (maxSegmentBytes() <= 0) {
      throw new IllegalStateException("maxSegmentBytes must be positive");
    }
    if (segmentPrefix().isEmpty() || segmentPrefix().contains("/")) {
      throw new IllegalStateException("Invalid segment prefix: " + segmentPrefix());
    }
  }

}
