package com.codeheadsystems.keys.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.time.Duration;
import org.immutables.value.Value;

/**
 * Rotation policy of one purpose.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableKeyRotationConfig.class)
@JsonDeserialize(as = ImmutableKeyRotationConfig.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface KeyRotationConfig {

  /**
   * Algorithm used by all keys of the purpose.
   */
  String AES_256_GCM = "aes-256-gcm";

  /**
   * How long a key stays ACTIVE.
   *
   * @return the duration
   */
  Duration rotationPeriod();

  /**
   * Algorithm string.
   *
   * @return the string
   */
  @Value.Default
  default String algorithm() {
    return AES_256_GCM;
  }

  /**
   * Key size in bytes.
   *
   * @return the int
   */
  @Value.Default
  default int keySizeBytes() {
    return 32;
  }

  /**
   * Iv size in bytes.
   *
   * @return the int
   */
  @Value.Default
  default int ivSizeBytes() {
    return 16;
  }

  /**
   * Write a backup copy of every new key.
   *
   * @return the boolean
   */
  boolean backupRequired();

  /**
   * Re-read and check the persisted copies after every rotation.
   *
   * @return the boolean
   */
  boolean verificationRequired();

  /**
   * How long a rotated-out key stays usable for decryption.
   *
   * @return the duration
   */
  Duration gracePeriod();

  /**
   * Sanity checks.
   */
  @Value.Check
  default void check() {
    if (keySizeBytes() <= 0 || ivSizeBytes() < 0) {
      throw new IllegalStateException("Key and iv sizes must be positive");
    }
    if (rotationPeriod().isNegative() || rotationPeriod().isZero()) {
      throw new IllegalStateException("Rotation period must be positive");
    }
  }

}
