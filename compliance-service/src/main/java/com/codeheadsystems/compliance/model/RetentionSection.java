package com.codeheadsystems.compliance.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.List;
import org.immutables.value.Value;

/**
 * Ledger segments waiting on archival or deletion.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableRetentionSection.class)
@JsonDeserialize(as = ImmutableRetentionSection.class)
public interface RetentionSection {

  int totalSegments();

  int pendingArchival();

  int pendingDeletion();

  List<ComplianceViolation> violations();

}
