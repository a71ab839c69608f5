package com.codeheadsystems.ledger.codec;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

/**
 * Envelope of a sealed line. The chain fields stay readable; the event itself is the AES-GCM payload.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableSealedLine.class)
@JsonDeserialize(as = ImmutableSealedLine.class)
public interface SealedLine {

  /**
   * Event id, also the additional authenticated data.
   *
   * @return the string
   */
  String id();

  /**
   * Hash string.
   *
   * @return the string
   */
  String hash();

  /**
   * Previous hash string.
   *
   * @return the string
   */
  String previousHash();

  /**
   * Id of the audit log encryption key used.
   *
   * @return the string
   */
  String keyId();

  /**
   * Iv bytes.
   *
   * @return the bytes
   */
  byte[] iv();

  /**
   * Ciphertext and tag.
   *
   * @return the bytes
   */
  byte[] payload();

}
