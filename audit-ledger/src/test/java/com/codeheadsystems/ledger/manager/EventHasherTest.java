package com.codeheadsystems.ledger.manager;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.compliance.common.json.ObjectMapperFactory;
import com.codeheadsystems.compliance.common.utilities.DigestUtilities;
import com.codeheadsystems.ledger.model.AuditEvent;
import com.codeheadsystems.ledger.model.AuditEventRequest;
import com.codeheadsystems.ledger.model.EventCategory;
import com.codeheadsystems.ledger.model.ImmutableAuditAction;
import com.codeheadsystems.ledger.model.ImmutableAuditEvent;
import com.codeheadsystems.ledger.model.ImmutableEventMetadata;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class EventHasherTest {

  private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

  private EventHasher hasher;

  @BeforeEach
  void setup() {
    hasher = new EventHasher(ObjectMapperFactory.canonicalObjectMapper());
  }

  private ImmutableAuditEvent event(final String hash) {
    final AuditEventRequest request = Requests.request(EventCategory.DATA_ACCESS);
    return ImmutableAuditEvent.builder()
        .id("abc")
        .timestamp(NOW)
        .category(request.category())
        .actor(request.actor())
        .action(request.action())
        .resource(request.resource())
        .subject(request.subject())
        .metadata(ImmutableEventMetadata.builder().encryptedAt(NOW).previousHash("prev").hash(hash).build())
        .build();
  }

  @Test
  void seedHash() {
    assertThat(hasher.seedHash()).isEqualTo(DigestUtilities.sha256("initial"));
  }

  @Test
  void hash_ignoresOwnHashField() {
    assertThat(hasher.hash(event(""))).isEqualTo(hasher.hash(event("anything")));
  }

  @Test
  void hash_coversPreviousHash() {
    final AuditEvent event = event("");
    final AuditEvent relinked = ImmutableAuditEvent.copyOf(event)
        .withMetadata(ImmutableEventMetadata.copyOf(event.metadata()).withPreviousHash("other"));
    assertThat(hasher.hash(event)).isNotEqualTo(hasher.hash(relinked));
  }

  @Test
  void hash_coversContent() {
    final ImmutableAuditEvent event = event("");
    assertThat(hasher.hash(event)).isNotEqualTo(hasher.hash(event.withReason("because")));
    assertThat(hasher.hash(event)).isNotEqualTo(hasher.hash(event.withTimestamp(NOW.plusNanos(1))));
  }

  @Test
  void hash_isHex() {
    assertThat(hasher.hash(event(""))).hasSize(64).matches("[0-9a-f]+");
  }

  @Test
  void hash_sameAfterJsonRoundTrip() throws IOException {
    final ImmutableAuditEvent event = event("");
    final AuditEvent withNumbers = event.withAction(ImmutableAuditAction.copyOf(event.action())
        .withDetails(Map.of("amount", new BigDecimal("100"), "rate", new BigDecimal("1.10"),
            "ratio", 0.5f)));
    final ObjectMapper objectMapper = ObjectMapperFactory.objectMapper();

    final AuditEvent decoded = objectMapper.readValue(objectMapper.writeValueAsString(withNumbers), AuditEvent.class);

    assertThat(decoded.action().details().get("amount")).isNotInstanceOf(BigDecimal.class);
    assertThat(hasher.hash(decoded)).isEqualTo(hasher.hash(withNumbers));
  }

}
