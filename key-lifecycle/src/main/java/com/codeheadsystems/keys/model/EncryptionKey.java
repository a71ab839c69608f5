package com.codeheadsystems.keys.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * One version of a symmetric key. Key material is never changed after creation; rotation always creates a
 * new key. Binary fields are base64 in JSON and redacted from toString().
 */
@Value.Immutable
@JsonSerialize(as = ImmutableEncryptionKey.class)
@JsonDeserialize(as = ImmutableEncryptionKey.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface EncryptionKey {

  /**
   * Id string.
   *
   * @return the string
   */
  String id();

  /**
   * Increases by one with every rotation of a purpose.
   *
   * @return the int
   */
  int version();

  /**
   * Algorithm identifier, e.g. aes-256-gcm.
   *
   * @return the string
   */
  String algorithm();

  /**
   * Raw key material.
   *
   * @return the bytes
   */
  @Value.Redacted
  byte[] keyMaterial();

  /**
   * Iv optional.
   *
   * @return the optional
   */
  @Value.Redacted
  Optional<byte[]> iv();

  /**
   * Created at instant.
   *
   * @return the instant
   */
  Instant createdAt();

  /**
   * Creation time plus the purpose's rotation period.
   *
   * @return the instant
   */
  Instant expiresAt();

  /**
   * When the key stopped being ACTIVE.
   *
   * @return the optional
   */
  Optional<Instant> rotatedAt();

  /**
   * Status key status.
   *
   * @return the key status
   */
  KeyStatus status();

  /**
   * Purposes list.
   *
   * @return the list
   */
  List<KeyPurpose> purposes();

  /**
   * Metadata key metadata.
   *
   * @return the key metadata
   */
  KeyMetadata metadata();

  /**
   * A key is due for rotation once now reaches its expiry.
   *
   * @param now the now
   * @return the boolean
   */
  default boolean isDue(final Instant now) {
    return !now.isBefore(expiresAt());
  }

  /**
   * Is backed up boolean.
   *
   * @return true if a backup copy was written.
   */
  @JsonIgnore
  default boolean isBackedUp() {
    return metadata().backupLocation().isPresent();
  }

}
