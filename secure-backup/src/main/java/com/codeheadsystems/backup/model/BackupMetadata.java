package com.codeheadsystems.backup.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.time.Instant;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * One backup artifact. Written once the artifact is complete; afterwards only verification and
 * restoration tests change it.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableBackupMetadata.class)
@JsonDeserialize(as = ImmutableBackupMetadata.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface BackupMetadata {

  /**
   * Id string.
   *
   * @return the string
   */
  String id();

  /**
   * Creation time.
   *
   * @return the instant
   */
  Instant timestamp();

  /**
   * Data type string.
   *
   * @return the string
   */
  String dataType();

  /**
   * Size of the source in bytes.
   *
   * @return the long
   */
  long size();

  /**
   * Size of the stored artifact in bytes.
   *
   * @return the long
   */
  long storedSize();

  /**
   * Number of 64 KiB chunks the artifact was digested in.
   *
   * @return the long
   */
  long chunks();

  /**
   * Key the artifact was encrypted with, absent when stored in the clear.
   *
   * @return the optional
   */
  Optional<String> encryptionKeyId();

  /**
   * SHA-256 hex of the stored artifact.
   *
   * @return the string
   */
  String hash();

  /**
   * Original size over compressed size, absent when not compressed.
   *
   * @return the optional
   */
  Optional<Double> compressionRatio();

  /**
   * Verification status.
   *
   * @return the verification status
   */
  VerificationStatus verificationStatus();

  /**
   * Last verified optional.
   *
   * @return the optional
   */
  Optional<Instant> lastVerified();

  /**
   * Last successful restoration test.
   *
   * @return the optional
   */
  Optional<Instant> restorationTested();

  /**
   * File name of the artifact inside the data type directory.
   *
   * @return the string
   */
  String artifactName();

}
