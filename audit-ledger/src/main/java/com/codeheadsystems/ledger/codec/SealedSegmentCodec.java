package com.codeheadsystems.ledger.codec;

import com.codeheadsystems.compliance.common.crypto.AesGcmCipher;
import com.codeheadsystems.compliance.common.exception.ComplianceException;
import com.codeheadsystems.compliance.common.exception.ErrorKind;
import com.codeheadsystems.keys.exception.KeyNotFoundException;
import com.codeheadsystems.keys.manager.KeyLifecycleManager;
import com.codeheadsystems.keys.model.EncryptionKey;
import com.codeheadsystems.keys.model.KeyPurpose;
import com.codeheadsystems.ledger.exception.ChainIntegrityException;
import com.codeheadsystems.ledger.model.AuditEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lines sealed with the active audit log encryption key. The key id travels in the envelope so lines
 * written before a rotation stay readable through the key's lookup by id.
 */
@Singleton
public class SealedSegmentCodec implements SegmentCodec {

  private static final Logger LOGGER = LoggerFactory.getLogger(SealedSegmentCodec.class);

  private final JsonSegmentCodec jsonSegmentCodec;
  private final KeyLifecycleManager keyLifecycleManager;
  private final AesGcmCipher aesGcmCipher;
  private final ObjectMapper objectMapper;
  private final ObjectReader reader;

  /**
   * Instantiates a new Sealed segment codec.
   *
   * @param jsonSegmentCodec    the json segment codec
   * @param keyLifecycleManager the key lifecycle manager
   * @param aesGcmCipher        the aes gcm cipher
   * @param objectMapper        the object mapper
   */
  @Inject
  public SealedSegmentCodec(final JsonSegmentCodec jsonSegmentCodec,
                            final KeyLifecycleManager keyLifecycleManager,
                            final AesGcmCipher aesGcmCipher,
                            final ObjectMapper objectMapper) {
    LOGGER.info("SealedSegmentCodec({})", keyLifecycleManager);
    this.jsonSegmentCodec = jsonSegmentCodec;
    this.keyLifecycleManager = keyLifecycleManager;
    this.aesGcmCipher = aesGcmCipher;
    this.objectMapper = objectMapper;
    this.reader = objectMapper.readerFor(SealedLine.class)
        .with(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
  }

  @Override
  public String encode(final AuditEvent event) {
    final EncryptionKey key = keyLifecycleManager.getActiveKey(KeyPurpose.AUDIT_LOG_ENCRYPTION);
    final byte[] sealed = aesGcmCipher.seal(key.keyMaterial(),
        jsonSegmentCodec.encode(event).getBytes(StandardCharsets.UTF_8),
        event.id().getBytes(StandardCharsets.UTF_8));
    final SealedLine line = ImmutableSealedLine.builder()
        .id(event.id())
        .hash(event.metadata().hash())
        .previousHash(event.metadata().previousHash())
        .keyId(key.id())
        .iv(Arrays.copyOfRange(sealed, 0, AesGcmCipher.GCM_IV_LENGTH))
        .payload(Arrays.copyOfRange(sealed, AesGcmCipher.GCM_IV_LENGTH, sealed.length))
        .build();
    try {
      return objectMapper.writeValueAsString(line);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Unable to encode event " + event.id(), e);
    }
  }

  @Override
  public AuditEvent decode(final String line) {
    final SealedLine sealedLine;
    try {
      sealedLine = reader.readValue(line);
    } catch (JsonProcessingException e) {
      throw new ChainIntegrityException("Undecodable sealed ledger line", e);
    }
    final EncryptionKey key;
    try {
      key = keyLifecycleManager.getKey(sealedLine.keyId());
    } catch (KeyNotFoundException e) {
      throw new ChainIntegrityException("Sealed line " + sealedLine.id() + " names an unknown key", e);
    }
    final byte[] plaintext;
    try {
      plaintext = aesGcmCipher.open(key.keyMaterial(),
          ByteBuffer.allocate(sealedLine.iv().length + sealedLine.payload().length)
              .put(sealedLine.iv())
              .put(sealedLine.payload())
              .array(),
          sealedLine.id().getBytes(StandardCharsets.UTF_8));
    } catch (ComplianceException e) {
      if (e.kind() == ErrorKind.INTEGRITY) {
        throw new ChainIntegrityException("Sealed line " + sealedLine.id() + " failed authentication", e);
      }
      throw e;
    }
    final AuditEvent event = jsonSegmentCodec.decode(new String(plaintext, StandardCharsets.UTF_8));
    if (!event.id().equals(sealedLine.id())
        || !event.metadata().hash().equals(sealedLine.hash())
        || !event.metadata().previousHash().equals(sealedLine.previousHash())) {
      throw new ChainIntegrityException("Envelope of " + sealedLine.id() + " does not match its payload");
    }
    return event;
  }

}
