package com.codeheadsystems.ledger.codec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import static org.mockito.Mockito.when;

import com.codeheadsystems.compliance.common.crypto.AesGcmCipher;
import com.codeheadsystems.compliance.common.json.ObjectMapperFactory;
import com.codeheadsystems.keys.exception.KeyNotFoundException;
import com.codeheadsystems.keys.manager.KeyLifecycleManager;
import com.codeheadsystems.keys.model.EncryptionKey;
import com.codeheadsystems.keys.model.ImmutableEncryptionKey;
import com.codeheadsystems.keys.model.ImmutableKeyMetadata;
import com.codeheadsystems.keys.model.KeyPurpose;
import com.codeheadsystems.keys.model.KeyStatus;
import com.codeheadsystems.ledger.exception.ChainIntegrityException;
import com.codeheadsystems.ledger.model.ActionOutcome;
import com.codeheadsystems.ledger.model.ActionType;
import com.codeheadsystems.ledger.model.AuditEvent;
import com.codeheadsystems.ledger.model.EventCategory;
import com.codeheadsystems.ledger.model.ImmutableActor;
import com.codeheadsystems.ledger.model.ImmutableAuditAction;
import com.codeheadsystems.ledger.model.ImmutableAuditEvent;
import com.codeheadsystems.ledger.model.ImmutableAuditResource;
import com.codeheadsystems.ledger.model.ImmutableEventMetadata;
import com.codeheadsystems.ledger.model.ImmutableSubjectReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.security.SecureRandom;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SealedSegmentCodecTest {

  private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

  @Mock private KeyLifecycleManager keyLifecycleManager;

  private ObjectMapper objectMapper;
  private SealedSegmentCodec codec;
  private EncryptionKey key;
  private AuditEvent event;

  @BeforeEach
  void setup() {
    final SecureRandom random = new SecureRandom();
    final byte[] material = new byte[32];
    random.nextBytes(material);
    key = ImmutableEncryptionKey.builder()
        .id("audit-key-1")
        .version(1)
        .algorithm("aes-256-gcm")
        .keyMaterial(material)
        .createdAt(NOW)
        .expiresAt(NOW.plus(Duration.ofDays(365)))
        .status(KeyStatus.ACTIVE)
        .addPurposes(KeyPurpose.AUDIT_LOG_ENCRYPTION)
        .metadata(ImmutableKeyMetadata.builder().hash("unused").build())
        .build();
    event = ImmutableAuditEvent.builder()
        .id("0123456789abcdef")
        .timestamp(NOW)
        .category(EventCategory.DATA_ACCESS)
        .actor(ImmutableActor.builder().id("user-1").role("NURSE").build())
        .action(ImmutableAuditAction.builder().type(ActionType.READ).outcome(ActionOutcome.SUCCESS).build())
        .resource(ImmutableAuditResource.builder().type("PHI").id("record-1").description("chart").build())
        .subject(ImmutableSubjectReference.builder().id("patient-1").medicalRecordNumber("MRN-SECRET").build())
        .metadata(ImmutableEventMetadata.builder().encryptedAt(NOW).previousHash("prev").hash("this").build())
        .build();
    objectMapper = ObjectMapperFactory.objectMapper();
    codec = new SealedSegmentCodec(new JsonSegmentCodec(objectMapper), keyLifecycleManager,
        new AesGcmCipher(random), objectMapper);
  }

  private String sealed() {
    when(keyLifecycleManager.getActiveKey(KeyPurpose.AUDIT_LOG_ENCRYPTION)).thenReturn(key);
    return codec.encode(event);
  }

  @Test
  void roundTrip() {
    final String line = sealed();
    when(keyLifecycleManager.getKey("audit-key-1")).thenReturn(key);

    assertThat(codec.decode(line)).isEqualTo(event);
  }

  @Test
  void encode_hidesContent() {
    final String line = sealed();

    assertThat(line)
        .contains("audit-key-1")
        .contains("\"prev\"")
        .doesNotContain("MRN-SECRET")
        .doesNotContain("record-1")
        .doesNotContain("\n");
  }

  @Test
  void decode_tamperedPayload() throws Exception {
    final ObjectNode node = (ObjectNode) objectMapper.readTree(sealed());
    final byte[] payload = Base64.getDecoder().decode(node.get("payload").asText());
    payload[payload.length / 2] ^= 0x01;
    node.put("payload", Base64.getEncoder().encodeToString(payload));
    when(keyLifecycleManager.getKey("audit-key-1")).thenReturn(key);

    assertThatExceptionOfType(ChainIntegrityException.class)
        .isThrownBy(() -> codec.decode(objectMapper.writeValueAsString(node)));
  }

  @Test
  void decode_tamperedEnvelopeHash() throws Exception {
    final ObjectNode node = (ObjectNode) objectMapper.readTree(sealed());
    node.put("hash", "forged");
    when(keyLifecycleManager.getKey("audit-key-1")).thenReturn(key);

    assertThatExceptionOfType(ChainIntegrityException.class)
        .isThrownBy(() -> codec.decode(objectMapper.writeValueAsString(node)));
  }

  @Test
  void decode_tamperedEnvelopeId() throws Exception {
    final ObjectNode node = (ObjectNode) objectMapper.readTree(sealed());
    node.put("id", "fedcba9876543210");
    when(keyLifecycleManager.getKey("audit-key-1")).thenReturn(key);

    assertThatExceptionOfType(ChainIntegrityException.class)
        .isThrownBy(() -> codec.decode(objectMapper.writeValueAsString(node)));
  }

  @Test
  void decode_unknownEnvelopeProperty() throws Exception {
    final ObjectNode node = (ObjectNode) objectMapper.readTree(sealed());
    node.put("extra", "value");

    assertThatExceptionOfType(ChainIntegrityException.class)
        .isThrownBy(() -> codec.decode(objectMapper.writeValueAsString(node)));
  }

  @Test
  void decode_editedKeyId() throws Exception {
    final ObjectNode node = (ObjectNode) objectMapper.readTree(sealed());
    node.put("keyId", "audit-key-9");
    when(keyLifecycleManager.getKey("audit-key-9")).thenThrow(new KeyNotFoundException("audit-key-9"));

    assertThatExceptionOfType(ChainIntegrityException.class)
        .isThrownBy(() -> codec.decode(objectMapper.writeValueAsString(node)))
        .withMessageContaining("unknown key")
        .withCauseInstanceOf(KeyNotFoundException.class);
  }

}
