package com.codeheadsystems.backup.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.List;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * Checks run against one backup. An absent check did not apply to the artifact.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableVerificationResult.class)
@JsonDeserialize(as = ImmutableVerificationResult.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface VerificationResult {

  /**
   * Hash match boolean.
   *
   * @return the boolean
   */
  boolean hashMatch();

  /**
   * Size match boolean.
   *
   * @return the boolean
   */
  boolean sizeMatch();

  /**
   * Decryption success optional.
   *
   * @return the optional
   */
  Optional<Boolean> decryptionSuccess();

  /**
   * Decompressed content matched the recorded sizes.
   *
   * @return the optional
   */
  Optional<Boolean> contentVerified();

  /**
   * Errors list.
   *
   * @return the list
   */
  List<String> errors();

  /**
   * True only if every check that ran passed.
   *
   * @return the boolean
   */
  @Value.Derived
  default boolean valid() {
    return hashMatch()
        && sizeMatch()
        && decryptionSuccess().orElse(true)
        && contentVerified().orElse(true)
        && errors().isEmpty();
  }

}
