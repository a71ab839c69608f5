package com.codeheadsystems.ledger.segment;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * One segment file. Segments of a day are the size-rotated ones in rotation order followed by the
 * canonical one.
 */
@Value.Immutable
public interface Segment {

  /**
   * Ledger order.
   */
  Comparator<Segment> LEDGER_ORDER = Comparator.comparing(Segment::date)
      .thenComparing(s -> s.rotatedAtMillis().orElse(Long.MAX_VALUE));

  /**
   * Path path.
   *
   * @return the path
   */
  Path path();

  /**
   * Date local date.
   *
   * @return the local date
   */
  LocalDate date();

  /**
   * Present for segments renamed by size rotation.
   *
   * @return the optional
   */
  Optional<Long> rotatedAtMillis();

  /**
   * Whether the segment lives in the archive directory.
   *
   * @return the boolean
   */
  boolean archived();

  /**
   * File name.
   *
   * @return the string
   */
  default String name() {
    return path().getFileName().toString();
  }

}
