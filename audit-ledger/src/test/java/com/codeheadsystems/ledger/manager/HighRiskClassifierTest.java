package com.codeheadsystems.ledger.manager;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.ledger.model.ActionOutcome;
import com.codeheadsystems.ledger.model.ActionType;
import com.codeheadsystems.ledger.model.AuditEvent;
import com.codeheadsystems.ledger.model.AuditEventRequest;
import com.codeheadsystems.ledger.model.EventCategory;
import com.codeheadsystems.ledger.model.ImmutableAuditAction;
import com.codeheadsystems.ledger.model.ImmutableAuditEvent;
import com.codeheadsystems.ledger.model.ImmutableEventMetadata;
import com.codeheadsystems.ledger.model.ImmutableLedgerConfiguration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class HighRiskClassifierTest {

  private final HighRiskClassifier classifier = new HighRiskClassifier(
      ImmutableLedgerConfiguration.builder().ledgerDirectory("/unused").build());

  private AuditEvent event(final AuditEventRequest request) {
    return ImmutableAuditEvent.builder()
        .id("id")
        .timestamp(Instant.EPOCH)
        .category(request.category())
        .actor(request.actor())
        .action(request.action())
        .resource(request.resource())
        .metadata(ImmutableEventMetadata.builder().encryptedAt(Instant.EPOCH).previousHash("p").hash("h").build())
        .build();
  }

  @Test
  void category() {
    assertThat(classifier.isHighRisk(event(Requests.request(EventCategory.DATA_ACCESS)))).isTrue();
    assertThat(classifier.isHighRisk(event(Requests.request(EventCategory.SYSTEM_OPERATION)))).isFalse();
    assertThat(classifier.isHighRisk(event(Requests.request(EventCategory.ADMINISTRATIVE)))).isFalse();
  }

  @Test
  void action() {
    assertThat(classifier.isHighRisk(event(Requests.builder(
        EventCategory.SYSTEM_OPERATION, ActionType.DELETE, ActionOutcome.SUCCESS).build()))).isTrue();
    assertThat(classifier.isHighRisk(event(Requests.builder(
        EventCategory.SYSTEM_OPERATION, ActionType.EXPORT, ActionOutcome.SUCCESS).build()))).isFalse();
  }

  @Test
  void failure() {
    assertThat(classifier.isHighRisk(event(Requests.builder(
        EventCategory.SYSTEM_OPERATION, ActionType.READ, ActionOutcome.FAILURE).build()))).isTrue();
  }

  @Test
  void emergencyDetail() {
    assertThat(classifier.isHighRisk(event(Requests.builder(
        EventCategory.ADMINISTRATIVE, ActionType.READ, ActionOutcome.SUCCESS)
        .action(ImmutableAuditAction.builder()
            .type(ActionType.READ)
            .outcome(ActionOutcome.SUCCESS)
            .putDetails("emergency", true)
            .build())
        .build()))).isTrue();
  }

}
