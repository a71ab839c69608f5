package com.codeheadsystems.keys.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.time.Instant;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * Bookkeeping that travels with a key.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableKeyMetadata.class)
@JsonDeserialize(as = ImmutableKeyMetadata.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface KeyMetadata {

  /**
   * SHA-256 of the key material, hex encoded.
   *
   * @return the string
   */
  String hash();

  /**
   * Where the backup copy was written, if one was.
   *
   * @return the optional
   */
  Optional<String> backupLocation();

  /**
   * When the persisted copies were last checked against the hash.
   *
   * @return the optional
   */
  Optional<Instant> lastVerified();

  /**
   * Usage count.
   *
   * @return the long
   */
  @Value.Default
  default long usageCount() {
    return 0L;
  }

}
