package com.codeheadsystems.ledger.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * The person whose data was touched, e.g. a patient.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableSubjectReference.class)
@JsonDeserialize(as = ImmutableSubjectReference.class)
public interface SubjectReference {

  /**
   * Id string.
   *
   * @return the string
   */
  String id();

  /**
   * Medical record number.
   *
   * @return the optional
   */
  Optional<String> medicalRecordNumber();

}
