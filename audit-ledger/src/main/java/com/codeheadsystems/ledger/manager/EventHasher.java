package com.codeheadsystems.ledger.manager;

import com.codeheadsystems.compliance.common.dagger.CommonModule;
import com.codeheadsystems.compliance.common.utilities.DigestUtilities;
import com.codeheadsystems.ledger.model.AuditEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import javax.inject.Inject;
import javax.inject.Named;
import javax.inject.Singleton;

/**
 * SHA-256 over the canonical JSON of an event with {@code metadata.hash} removed.
 *
 * <p>The tree is parsed back from the event's JSON text rather than built from the objects, so an event
 * hashes the same before it is written and after it is read back. Detail values such as a
 * {@code BigDecimal} decode as a different Java type than they were appended with.</p>
 */
@Singleton
public class EventHasher {

  /**
   * Seed constant hashed for the link of the first event.
   */
  public static final String SEED = "initial";

  private final ObjectMapper canonicalMapper;
  private final String seedHash;

  /**
   * Instantiates a new Event hasher.
   *
   * @param canonicalMapper the canonical mapper
   */
  @Inject
  public EventHasher(@Named(CommonModule.CANONICAL) final ObjectMapper canonicalMapper) {
    this.canonicalMapper = canonicalMapper;
    this.seedHash = DigestUtilities.sha256(SEED);
  }

  /**
   * Previous hash of the first event in a ledger.
   *
   * @return the string
   */
  public String seedHash() {
    return seedHash;
  }

  /**
   * Hash string.
   *
   * @param event the event
   * @return the string
   */
  public String hash(final AuditEvent event) {
    try {
      final JsonNode tree = canonicalMapper.readTree(canonicalMapper.writeValueAsString(event));
      ((ObjectNode) tree.get("metadata")).remove("hash");
      return DigestUtilities.sha256(canonicalMapper.writeValueAsString(tree));
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Unable to hash event " + event.id(), e);
    }
  }

}
