package com.codeheadsystems.backup.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * When a data type is backed up. With a start time, runs fall on that UTC time of day and every
 * frequency after it, counted from the epoch day, so a daily schedule runs at the same time every day
 * and a weekly one on the same weekday. Without a start time, runs are one frequency apart.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableBackupSchedule.class)
@JsonDeserialize(as = ImmutableBackupSchedule.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface BackupSchedule {

  /**
   * Interval between runs.
   *
   * @return the duration
   */
  Duration frequency();

  /**
   * UTC time of day of the first run.
   *
   * @return the optional
   */
  Optional<LocalTime> startTime();

  /**
   * Expected upper bound of a run. Informational.
   *
   * @return the optional
   */
  Optional<Duration> maxDuration();

  /**
   * The first run strictly after now.
   *
   * @param now the now
   * @return the instant
   */
  default Instant nextRun(final Instant now) {
    if (startTime().isEmpty()) {
      return now.plus(frequency());
    }
    final long anchor = startTime().get().toSecondOfDay() * 1000L;
    final long period = frequency().toMillis();
    final long elapsed = now.toEpochMilli() - anchor;
    final long runs = Math.floorDiv(elapsed, period) + 1;
    return Instant.ofEpochMilli(anchor + runs * period);
  }

  /**
   * Sanity checks.
   */
  @Value.Check
  default void check() {
    if (frequency().toMillis() <= 0) {
      throw new IllegalStateException("Backup frequency must be positive");
    }
  }

}
