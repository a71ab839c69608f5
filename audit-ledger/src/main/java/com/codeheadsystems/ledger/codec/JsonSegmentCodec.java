package com.codeheadsystems.ledger.codec;

import com.codeheadsystems.ledger.exception.ChainIntegrityException;
import com.codeheadsystems.ledger.model.AuditEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Plain JSON lines. Decoding is strict: an unknown property means the line was altered.
 */
@Singleton
public class JsonSegmentCodec implements SegmentCodec {

  private static final Logger LOGGER = LoggerFactory.getLogger(JsonSegmentCodec.class);

  private final ObjectMapper objectMapper;
  private final ObjectReader reader;

  /**
   * Instantiates a new Json segment codec.
   *
   * @param objectMapper the object mapper
   */
  @Inject
  public JsonSegmentCodec(final ObjectMapper objectMapper) {
    LOGGER.info("JsonSegmentCodec({})", objectMapper);
    this.objectMapper = objectMapper;
    this.reader = objectMapper.readerFor(AuditEvent.class)
        .with(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
  }

  @Override
  public String encode(final AuditEvent event) {
    try {
      return objectMapper.writeValueAsString(event);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Unable to encode event " + event.id(), e);
    }
  }

  @Override
  public AuditEvent decode(final String line) {
    try {
      return reader.readValue(line);
    } catch (JsonProcessingException e) {
      throw new ChainIntegrityException("Undecodable ledger line", e);
    }
  }

}
