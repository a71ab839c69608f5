package com.codeheadsystems.compliance.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.List;
import org.immutables.value.Value;

/**
 * Key and backup state as of report generation.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableEncryptionSection.class)
@JsonDeserialize(as = ImmutableEncryptionSection.class)
public interface EncryptionSection {

  int activeKeys();

  /**
   * Active keys already past their expiry.
   *
   * @return the int
   */
  int overdueKeys();

  int totalBackups();

  /**
   * Backups stored without a key although their data type requires encryption.
   *
   * @return the int
   */
  int unencryptedBackups();

  int failedBackups();

  List<ComplianceViolation> violations();

}
