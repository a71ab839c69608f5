package com.codeheadsystems.ledger.manager;

import static com.codeheadsystems.compliance.common.alert.Alerter.details;

import com.codeheadsystems.compliance.common.alert.Alerter;
import com.codeheadsystems.compliance.common.alert.Severity;
import com.codeheadsystems.compliance.common.exception.ComplianceException;
import com.codeheadsystems.compliance.common.utilities.DigestUtilities;
import com.codeheadsystems.ledger.codec.SegmentCodec;
import com.codeheadsystems.ledger.exception.ChainIntegrityException;
import com.codeheadsystems.ledger.model.AuditEvent;
import com.codeheadsystems.ledger.model.AuditEventRequest;
import com.codeheadsystems.ledger.model.AuditQuery;
import com.codeheadsystems.ledger.model.EventCategory;
import com.codeheadsystems.ledger.model.ImmutableAuditEvent;
import com.codeheadsystems.ledger.model.ImmutableEventMetadata;
import com.codeheadsystems.ledger.model.ImmutableRetentionStatus;
import com.codeheadsystems.ledger.model.LedgerConfiguration;
import com.codeheadsystems.ledger.model.RetentionPolicy;
import com.codeheadsystems.ledger.model.RetentionStatus;
import com.codeheadsystems.ledger.segment.Segment;
import com.codeheadsystems.ledger.segment.SegmentStore;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Append-only, hash-chained ledger of regulated events, one segment per UTC day.
 *
 * <p>Every event carries the hash of the event before it. Queries re-verify the chain over every segment
 * they touch before filtering, so an edited, dropped or reordered line fails the query instead of being
 * returned. The tail hash is owned here and only moves under the write lock.</p>
 */
@Singleton
public class AuditLedger {

  private static final Logger LOGGER = LoggerFactory.getLogger(AuditLedger.class);
  private static final int EVENT_ID_BYTES = 16;

  private final LedgerConfiguration configuration;
  private final SegmentStore segmentStore;
  private final SegmentCodec segmentCodec;
  private final EventHasher eventHasher;
  private final HighRiskClassifier highRiskClassifier;
  private final Alerter alerter;
  private final Clock clock;
  private final SecureRandom secureRandom;
  private final ReadWriteLock lock = new ReentrantReadWriteLock();
  private volatile String tailHash;

  /**
   * Instantiates a new Audit ledger.
   *
   * @param configuration      the configuration
   * @param segmentStore       the segment store
   * @param segmentCodec       the segment codec
   * @param eventHasher        the event hasher
   * @param highRiskClassifier the high risk classifier
   * @param alerter            the alerter
   * @param clock              the clock
   * @param secureRandom       the secure random
   */
  @Inject
  public AuditLedger(final LedgerConfiguration configuration,
                     final SegmentStore segmentStore,
                     final SegmentCodec segmentCodec,
                     final EventHasher eventHasher,
                     final HighRiskClassifier highRiskClassifier,
                     final Alerter alerter,
                     final Clock clock,
                     final SecureRandom secureRandom) {
    LOGGER.info("AuditLedger({}, {})", configuration.ledgerDirectory(), segmentCodec.getClass().getSimpleName());
    this.configuration = configuration;
    this.segmentStore = segmentStore;
    this.segmentCodec = segmentCodec;
    this.eventHasher = eventHasher;
    this.highRiskClassifier = highRiskClassifier;
    this.alerter = alerter;
    this.clock = clock;
    this.secureRandom = secureRandom;
  }

  /**
   * Create the directories and recover the tail hash from the newest segment.
   */
  public void initialize() {
    LOGGER.trace("initialize()");
    lock.writeLock().lock();
    try {
      segmentStore.createDirectories();
      tailHash = recoverTailHash();
      LOGGER.info("Ledger tail hash {}", tailHash);
    } catch (ComplianceException e) {
      throw alerter.alerted("AUDIT_INIT_ERROR", Severity.HIGH, e, details());
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Hash of the last appended event, or the seed hash for an empty ledger.
   *
   * @return the string
   */
  public String tailHash() {
    ensureInitialized();
    return tailHash;
  }

  /**
   * Append an event.
   *
   * @param request the request
   * @return the new event's id.
   */
  public String append(final AuditEventRequest request) {
    LOGGER.trace("append({}, {})", request.category(), request.action().type());
    ensureInitialized();
    final AuditEvent event;
    lock.writeLock().lock();
    try {
      final Instant now = clock.instant();
      final AuditEvent unhashed = ImmutableAuditEvent.builder()
          .id(newEventId())
          .timestamp(now)
          .category(request.category())
          .actor(request.actor())
          .action(request.action())
          .resource(request.resource())
          .subject(request.subject())
          .location(request.location())
          .reason(request.reason())
          .metadata(ImmutableEventMetadata.builder()
              .encryptedAt(now)
              .previousHash(tailHash)
              .hash("")
              .build())
          .build();
      event = ImmutableAuditEvent.copyOf(unhashed)
          .withMetadata(ImmutableEventMetadata.copyOf(unhashed.metadata()).withHash(eventHasher.hash(unhashed)));
      final LocalDate date = dateOf(now);
      segmentStore.rotateIfNeeded(date);
      segmentStore.appendLine(date, segmentCodec.encode(event));
      tailHash = event.metadata().hash();
    } catch (ComplianceException e) {
      throw alerter.alerted("AUDIT_APPEND_ERROR", Severity.HIGH, e,
          details("category", request.category(), "action", request.action().type()));
    } finally {
      lock.writeLock().unlock();
    }
    if (highRiskClassifier.isHighRisk(event)) {
      alerter.raise("HIGH_RISK_EVENT", Severity.HIGH, details(
          "eventId", event.id(),
          "category", event.category(),
          "action", event.action().type(),
          "outcome", event.action().outcome(),
          "actorId", event.actor().id(),
          "resourceType", event.resource().type(),
          "resourceId", event.resource().id()));
    }
    return event.id();
  }

  /**
   * Events in the window that match every filter, newest first, with later appends first on equal
   * timestamps. The chain of every segment the window touches is verified before anything is returned.
   *
   * @param query the query
   * @return the list
   */
  public List<AuditEvent> query(final AuditQuery query) {
    LOGGER.trace("query({})", query);
    ensureInitialized();
    lock.readLock().lock();
    try {
      final List<Segment> all = segmentStore.listSegments();
      final List<Segment> earlier = new ArrayList<>();
      final List<Segment> selected = new ArrayList<>();
      for (Segment segment : all) {
        if (segment.date().isBefore(query.firstDate())) {
          earlier.add(segment);
        } else if (!segment.date().isAfter(query.lastDate())) {
          selected.add(segment);
        }
      }
      final String anchor = lastHash(earlier).orElse(eventHasher.seedHash());
      final List<AuditEvent> chain = new ArrayList<>();
      for (Segment segment : selected) {
        chain.addAll(decodeAll(segment));
      }
      verifyChain(anchor, chain);
      final List<AuditEvent> matched = chain.stream()
          .filter(query::matches)
          .collect(Collectors.toList());
      // Reverse chain order first; the stable sort then keeps later appends ahead on equal timestamps.
      Collections.reverse(matched);
      matched.sort(Comparator.comparing(AuditEvent::timestamp).reversed());
      return matched;
    } catch (ChainIntegrityException e) {
      throw alerter.alerted("AUDIT_CHAIN_BROKEN", Severity.CRITICAL, e,
          details("from", query.from(), "to", query.to()));
    } catch (ComplianceException e) {
      throw alerter.alerted("AUDIT_QUERY_ERROR", Severity.HIGH, e,
          details("from", query.from(), "to", query.to()));
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Move every active segment older than the archival cutoff of each category it holds.
   *
   * @return names of the archived segments.
   */
  public List<String> archiveDueSegments() {
    LOGGER.trace("archiveDueSegments()");
    ensureInitialized();
    final List<String> archived = new ArrayList<>();
    lock.writeLock().lock();
    try {
      final LocalDate today = dateOf(clock.instant());
      for (Segment segment : segmentStore.listSegments()) {
        if (segment.archived() || !isPast(segment, today, RetentionPolicy::archiveAfter)) {
          continue;
        }
        final Segment moved = segmentStore.archive(segment);
        archived.add(moved.name());
        LOGGER.info("Archived segment {}", moved.name());
        alerter.raise("AUDIT_SEGMENT_ARCHIVED", Severity.LOW,
            details("segment", moved.name(), "date", moved.date()));
      }
    } catch (ComplianceException e) {
      throw alerter.alerted("AUDIT_ARCHIVE_ERROR", Severity.HIGH, e, details("archived", archived.size()));
    } finally {
      lock.writeLock().unlock();
    }
    return archived;
  }

  /**
   * Events of the category dated before the returned day are eligible for deletion.
   *
   * @param category the category
   * @return the local date
   */
  public LocalDate deletionBoundary(final EventCategory category) {
    final RetentionPolicy policy = configuration.retentionPolicies().get(category);
    if (policy == null) {
      return LocalDate.MIN;
    }
    return dateOf(clock.instant()).minusDays(policy.deleteAfter().toDays());
  }

  /**
   * Segment counts for reporting.
   *
   * @return the retention status
   */
  public RetentionStatus retentionStatus() {
    LOGGER.trace("retentionStatus()");
    ensureInitialized();
    lock.readLock().lock();
    try {
      final LocalDate today = dateOf(clock.instant());
      int active = 0;
      int archived = 0;
      int pendingArchival = 0;
      int pendingDeletion = 0;
      for (Segment segment : segmentStore.listSegments()) {
        if (segment.archived()) {
          archived++;
        } else {
          active++;
          if (isPast(segment, today, RetentionPolicy::archiveAfter)) {
            pendingArchival++;
          }
        }
        if (isPast(segment, today, RetentionPolicy::deleteAfter)) {
          pendingDeletion++;
        }
      }
      return ImmutableRetentionStatus.builder()
          .activeSegments(active)
          .archivedSegments(archived)
          .segmentsPendingArchival(pendingArchival)
          .segmentsPendingDeletion(pendingDeletion)
          .build();
    } finally {
      lock.readLock().unlock();
    }
  }

  // True when the segment is older than the cutoff of every category it holds. A category without a
  // policy is never past its cutoff; an empty segment must be past the cutoff of every policy.
  private boolean isPast(final Segment segment,
                         final LocalDate today,
                         final Function<RetentionPolicy, Duration> period) {
    final Set<EventCategory> categories = EnumSet.noneOf(EventCategory.class);
    decodeAll(segment).forEach(e -> categories.add(e.category()));
    if (categories.isEmpty()) {
      categories.addAll(configuration.retentionPolicies().keySet());
    }
    for (EventCategory category : categories) {
      final RetentionPolicy policy = configuration.retentionPolicies().get(category);
      if (policy == null || !segment.date().isBefore(today.minusDays(period.apply(policy).toDays()))) {
        return false;
      }
    }
    return !categories.isEmpty();
  }

  private void verifyChain(final String anchor, final List<AuditEvent> chain) {
    String previous = anchor;
    for (AuditEvent event : chain) {
      if (!event.metadata().previousHash().equals(previous)) {
        throw new ChainIntegrityException("Event " + event.id() + " does not link to the event before it");
      }
      final String hash = eventHasher.hash(event);
      if (!hash.equals(event.metadata().hash())) {
        throw new ChainIntegrityException("Event " + event.id() + " content does not match its hash");
      }
      previous = hash;
    }
  }

  private List<AuditEvent> decodeAll(final Segment segment) {
    final List<String> lines = segmentStore.readLines(segment);
    final List<AuditEvent> events = new ArrayList<>(lines.size());
    for (int i = 0; i < lines.size(); i++) {
      try {
        events.add(segmentCodec.decode(lines.get(i)));
      } catch (ChainIntegrityException e) {
        throw new ChainIntegrityException("Line " + (i + 1) + " of " + segment.name() + " is corrupt", e);
      }
    }
    return events;
  }

  // Hash of the last event in the newest non-empty segment of the list.
  private Optional<String> lastHash(final List<Segment> segments) {
    for (int i = segments.size() - 1; i >= 0; i--) {
      final List<String> lines = segmentStore.readLines(segments.get(i));
      if (!lines.isEmpty()) {
        return Optional.of(segmentCodec.decode(lines.get(lines.size() - 1)).metadata().hash());
      }
    }
    return Optional.empty();
  }

  private String recoverTailHash() {
    return lastHash(segmentStore.listSegments()).orElse(eventHasher.seedHash());
  }

  private void ensureInitialized() {
    if (tailHash == null) {
      initialize();
    }
  }

  private String newEventId() {
    final byte[] bytes = new byte[EVENT_ID_BYTES];
    secureRandom.nextBytes(bytes);
    return DigestUtilities.encode.apply(bytes);
  }

  private static LocalDate dateOf(final Instant instant) {
    return LocalDate.ofInstant(instant, ZoneOffset.UTC);
  }

}
