package com.codeheadsystems.ledger.segment;

import com.codeheadsystems.ledger.exception.LedgerStorageException;
import com.codeheadsystems.ledger.model.LedgerConfiguration;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * File layout of the ledger: {@code <prefix>-<date>.log} per day, {@code <prefix>-<date>-<millis>.log}
 * for segments rotated out by size, and an archive subdirectory using the same names.
 */
@Singleton
public class SegmentStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(SegmentStore.class);
  private static final String ARCHIVE = "archive";
  private static final String SUFFIX = ".log";

  private final Path activeDirectory;
  private final Path archiveDirectory;
  private final String prefix;
  private final long maxSegmentBytes;
  private final Clock clock;
  private final Pattern namePattern;

  /**
   * Instantiates a new Segment store.
   *
   * @param configuration the configuration
   * @param clock         the clock
   */
  @Inject
  public SegmentStore(final LedgerConfiguration configuration,
                      final Clock clock) {
    this.activeDirectory = configuration.ledgerPath();
    this.archiveDirectory = activeDirectory.resolve(ARCHIVE);
    this.prefix = configuration.segmentPrefix();
    this.maxSegmentBytes = configuration.maxSegmentBytes();
    this.clock = clock;
    this.namePattern = Pattern.compile(
        "^" + Pattern.quote(prefix) + "-(\\d{4}-\\d{2}-\\d{2})(?:-(\\d+))?" + Pattern.quote(SUFFIX) + "$");
    LOGGER.info("SegmentStore({}, {})", activeDirectory, maxSegmentBytes);
  }

  /**
   * Create the active and archive directories.
   */
  public void createDirectories() {
    try {
      Files.createDirectories(archiveDirectory);
    } catch (IOException e) {
      throw new LedgerStorageException("Unable to create " + archiveDirectory, e);
    }
  }

  /**
   * Parse a file name, empty if it is not a segment of this ledger.
   *
   * @param path     the path
   * @param archived whether it sits in the archive
   * @return the optional
   */
  public Optional<Segment> parse(final Path path, final boolean archived) {
    final Matcher matcher = namePattern.matcher(path.getFileName().toString());
    if (!matcher.matches()) {
      return Optional.empty();
    }
    return Optional.of(ImmutableSegment.builder()
        .path(path)
        .date(LocalDate.parse(matcher.group(1)))
        .rotatedAtMillis(Optional.ofNullable(matcher.group(2)).map(Long::parseLong))
        .archived(archived)
        .build());
  }

  /**
   * Every segment, active and archived, in ledger order.
   *
   * @return the list
   */
  public List<Segment> listSegments() {
    final List<Segment> segments = new ArrayList<>(list(archiveDirectory, true));
    segments.addAll(list(activeDirectory, false));
    segments.sort(Segment.LEDGER_ORDER);
    return segments;
  }

  /**
   * The canonical segment path of a day.
   *
   * @param date the date
   * @return the path
   */
  public Path canonicalPath(final LocalDate date) {
    return activeDirectory.resolve(prefix + "-" + date + SUFFIX);
  }

  /**
   * Rename the day's canonical segment once it reaches the size ceiling. A segment that does not exist
   * yet is fine.
   *
   * @param date the date
   * @return the new path of the rotated segment, if a rotation happened.
   */
  public Optional<Path> rotateIfNeeded(final LocalDate date) {
    final Path canonical = canonicalPath(date);
    try {
      if (Files.size(canonical) < maxSegmentBytes) {
        return Optional.empty();
      }
      long millis = clock.millis();
      Path rotated = activeDirectory.resolve(prefix + "-" + date + "-" + millis + SUFFIX);
      while (Files.exists(rotated)) {
        millis++;
        rotated = activeDirectory.resolve(prefix + "-" + date + "-" + millis + SUFFIX);
      }
      Files.move(canonical, rotated);
      LOGGER.info("Rotated segment {} to {}", canonical.getFileName(), rotated.getFileName());
      return Optional.of(rotated);
    } catch (NoSuchFileException e) {
      return Optional.empty();
    } catch (IOException e) {
      throw new LedgerStorageException("Unable to rotate " + canonical, e);
    }
  }

  /**
   * Append one line to the day's canonical segment.
   *
   * @param date the date
   * @param line the line, without a newline
   */
  public void appendLine(final LocalDate date, final String line) {
    final Path canonical = canonicalPath(date);
    try {
      Files.write(canonical, (line + "\n").getBytes(StandardCharsets.UTF_8),
          StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
    } catch (IOException e) {
      throw new LedgerStorageException("Unable to append to " + canonical, e);
    }
  }

  /**
   * Non-blank lines of the segment.
   *
   * @param segment the segment
   * @return the list
   */
  public List<String> readLines(final Segment segment) {
    try {
      return Files.readAllLines(segment.path(), StandardCharsets.UTF_8).stream()
          .filter(line -> !line.isBlank())
          .collect(Collectors.toList());
    } catch (IOException e) {
      throw new LedgerStorageException("Unable to read " + segment.path(), e);
    }
  }

  /**
   * Move an active segment into the archive. The file is moved, never rewritten.
   *
   * @param segment the segment
   * @return the archived segment.
   */
  public Segment archive(final Segment segment) {
    final Path target = archiveDirectory.resolve(segment.name());
    try {
      Files.move(segment.path(), target);
    } catch (IOException e) {
      throw new LedgerStorageException("Unable to archive " + segment.path(), e);
    }
    return ImmutableSegment.copyOf(segment).withPath(target).withArchived(true);
  }

  private List<Segment> list(final Path directory, final boolean archived) {
    if (!Files.isDirectory(directory)) {
      return List.of();
    }
    try (Stream<Path> files = Files.list(directory)) {
      return files.filter(Files::isRegularFile)
          .map(p -> parse(p, archived))
          .flatMap(Optional::stream)
          .collect(Collectors.toList());
    } catch (IOException e) {
      throw new LedgerStorageException("Unable to list " + directory, e);
    }
  }

}
