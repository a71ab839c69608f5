package com.codeheadsystems.ledger.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.codeheadsystems.compliance.common.alert.AlertSink;
import com.codeheadsystems.compliance.common.alert.Alerter;
import com.codeheadsystems.compliance.common.alert.Severity;
import com.codeheadsystems.compliance.common.json.ObjectMapperFactory;
import com.codeheadsystems.compliance.common.utilities.DigestUtilities;
import com.codeheadsystems.ledger.codec.JsonSegmentCodec;
import com.codeheadsystems.ledger.exception.ChainIntegrityException;
import com.codeheadsystems.ledger.model.ActionOutcome;
import com.codeheadsystems.ledger.model.ActionType;
import com.codeheadsystems.ledger.model.AuditEvent;
import com.codeheadsystems.ledger.model.AuditQuery;
import com.codeheadsystems.ledger.model.EventCategory;
import com.codeheadsystems.ledger.model.ImmutableActor;
import com.codeheadsystems.ledger.model.ImmutableAuditAction;
import com.codeheadsystems.ledger.model.ImmutableAuditQuery;
import com.codeheadsystems.ledger.model.ImmutableLedgerConfiguration;
import com.codeheadsystems.ledger.model.LedgerConfiguration;
import com.codeheadsystems.ledger.model.RetentionStatus;
import com.codeheadsystems.ledger.segment.SegmentStore;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AuditLedgerTest {

  private static final LocalDate DAY = LocalDate.parse("2026-03-01");
  private static final Instant MORNING = Instant.parse("2026-03-01T09:00:00Z");

  @TempDir Path directory;
  @Mock private AlertSink alertSink;

  private MutableClock clock;

  @BeforeEach
  void setup() {
    clock = new MutableClock(MORNING);
  }

  private LedgerConfiguration configuration(final long maxSegmentBytes) {
    return ImmutableLedgerConfiguration.builder()
        .ledgerDirectory(directory.toString())
        .maxSegmentBytes(maxSegmentBytes)
        .build();
  }

  private AuditLedger ledger(final LedgerConfiguration configuration) {
    final AuditLedger ledger = new AuditLedger(configuration,
        new SegmentStore(configuration, clock),
        new JsonSegmentCodec(ObjectMapperFactory.objectMapper()),
        new EventHasher(ObjectMapperFactory.canonicalObjectMapper()),
        new HighRiskClassifier(configuration),
        new Alerter(alertSink),
        clock,
        new SecureRandom());
    ledger.initialize();
    return ledger;
  }

  private AuditLedger ledger() {
    return ledger(configuration(LedgerConfiguration.DEFAULT_MAX_SEGMENT_BYTES));
  }

  private Path canonical(final LocalDate date) {
    return directory.resolve("audit-" + date + ".log");
  }

  private List<Path> files(final Path dir) throws IOException {
    try (Stream<Path> stream = Files.list(dir)) {
      return stream.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
    }
  }

  @Test
  void emptyLedger_tailIsSeed() {
    assertThat(ledger().tailHash()).isEqualTo(DigestUtilities.sha256("initial"));
    assertThat(Files.isDirectory(directory.resolve("archive"))).isTrue();
  }

  @Test
  void append_threeEventsQueriedNewestFirst() {
    final AuditLedger ledger = ledger();
    final List<String> ids = new ArrayList<>();
    for (int i = 0; i < 3; i++) {
      ids.add(ledger.append(Requests.request(EventCategory.SYSTEM_OPERATION)));
      clock.advance(Duration.ofMinutes(1));
    }

    final List<AuditEvent> events = ledger.query(AuditQuery.days(DAY, DAY).build());

    assertThat(events).extracting(AuditEvent::id).containsExactly(ids.get(2), ids.get(1), ids.get(0));
    assertThat(events.get(2).metadata().previousHash()).isEqualTo(DigestUtilities.sha256("initial"));
    assertThat(events.get(1).metadata().previousHash()).isEqualTo(events.get(2).metadata().hash());
    assertThat(events.get(0).metadata().previousHash()).isEqualTo(events.get(1).metadata().hash());
    assertThat(ledger.tailHash()).isEqualTo(events.get(0).metadata().hash());
    assertThat(events.get(0).metadata().encryptedAt()).isEqualTo(events.get(0).timestamp());
  }

  @Test
  void query_sameTimestampReturnsLaterAppendsFirst() {
    final AuditLedger ledger = ledger();
    final List<String> ids = new ArrayList<>();
    for (int i = 0; i < 3; i++) {
      ids.add(ledger.append(Requests.request(EventCategory.SYSTEM_OPERATION)));
    }

    assertThat(ledger.query(AuditQuery.days(DAY, DAY).build()))
        .extracting(AuditEvent::id).containsExactly(ids.get(2), ids.get(1), ids.get(0));
  }

  @Test
  void append_decimalDetailsStillVerify() {
    final AuditLedger ledger = ledger();
    final String id = ledger.append(Requests.builder(EventCategory.SYSTEM_OPERATION, ActionType.UPDATE,
            ActionOutcome.SUCCESS)
        .action(ImmutableAuditAction.builder()
            .type(ActionType.UPDATE)
            .outcome(ActionOutcome.SUCCESS)
            .putDetails("amount", new BigDecimal("100"))
            .putDetails("rate", new BigDecimal("1.10"))
            .build())
        .build());
    clock.advance(Duration.ofMinutes(1));
    ledger.append(Requests.request(EventCategory.SYSTEM_OPERATION));

    final List<AuditEvent> events = ledger.query(AuditQuery.days(DAY, DAY).build());

    assertThat(events).hasSize(2);
    assertThat(events.get(1).id()).isEqualTo(id);
    assertThat(events.get(1).action().details()).containsEntry("amount", 100).containsEntry("rate", 1.1);
    verify(alertSink, never()).raiseAlert(eq("AUDIT_CHAIN_BROKEN"), any(), anyMap());
  }

  @Test
  void append_concurrentWritersShareOneChain() throws Exception {
    final AuditLedger ledger = ledger();
    final int writers = 8;
    final int appendsPerWriter = 25;
    final ExecutorService executor = Executors.newFixedThreadPool(writers);
    final CountDownLatch go = new CountDownLatch(1);
    final List<Future<?>> futures = new ArrayList<>();
    try {
      for (int w = 0; w < writers; w++) {
        futures.add(executor.submit(() -> {
          go.await();
          for (int i = 0; i < appendsPerWriter; i++) {
            ledger.append(Requests.request(EventCategory.SYSTEM_OPERATION));
          }
          return null;
        }));
      }
      go.countDown();
      for (Future<?> future : futures) {
        future.get(30, TimeUnit.SECONDS);
      }
    } finally {
      executor.shutdownNow();
    }

    final List<AuditEvent> events = ledger.query(AuditQuery.days(DAY, DAY).build());

    assertThat(events).hasSize(writers * appendsPerWriter);
    assertThat(events).extracting(AuditEvent::id).doesNotHaveDuplicates();
    assertThat(events.get(0).metadata().hash()).isEqualTo(ledger.tailHash());
    assertThat(events.get(events.size() - 1).metadata().previousHash())
        .isEqualTo(DigestUtilities.sha256("initial"));
    for (int i = 0; i < events.size() - 1; i++) {
      assertThat(events.get(i).metadata().previousHash()).isEqualTo(events.get(i + 1).metadata().hash());
    }
  }

  @Test
  void query_filtersAfterVerifyingWholeSegment() {
    final AuditLedger ledger = ledger();
    ledger.append(Requests.request(EventCategory.SYSTEM_OPERATION));
    final String access = ledger.append(Requests.builder(
        EventCategory.DATA_ACCESS, ActionType.READ, ActionOutcome.SUCCESS).actor(
        ImmutableActor.builder().id("doctor").role("MD").build()).build());
    ledger.append(Requests.request(EventCategory.SYSTEM_OPERATION));

    assertThat(ledger.query(AuditQuery.days(DAY, DAY).category(EventCategory.DATA_ACCESS).build()))
        .extracting(AuditEvent::id).containsExactly(access);
    assertThat(ledger.query(AuditQuery.days(DAY, DAY).actorId("doctor").build()))
        .extracting(AuditEvent::id).containsExactly(access);
    assertThat(ledger.query(AuditQuery.days(DAY, DAY).subjectId("patient-1").build())).hasSize(3);
    assertThat(ledger.query(AuditQuery.days(DAY, DAY).resourceId("other").build())).isEmpty();
    assertThat(ledger.query(AuditQuery.days(DAY, DAY).actionType(ActionType.DELETE).build())).isEmpty();
  }

  @Test
  void query_timeWindowWithinDay() {
    final AuditLedger ledger = ledger();
    ledger.append(Requests.request(EventCategory.SYSTEM_OPERATION));
    clock.advance(Duration.ofHours(2));
    final String later = ledger.append(Requests.request(EventCategory.SYSTEM_OPERATION));

    assertThat(ledger.query(ImmutableAuditQuery.builder()
        .from(MORNING.plus(Duration.ofHours(1)))
        .to(MORNING.plus(Duration.ofHours(3)))
        .build()))
        .extracting(AuditEvent::id).containsExactly(later);
  }

  @Test
  void query_emptyRange() {
    final AuditLedger ledger = ledger();
    ledger.append(Requests.request(EventCategory.SYSTEM_OPERATION));

    assertThat(ledger.query(AuditQuery.days(DAY.plusDays(5), DAY.plusDays(6)).build())).isEmpty();
  }

  @Test
  void query_tamperedLine() throws IOException {
    final AuditLedger ledger = ledger();
    for (int i = 0; i < 3; i++) {
      ledger.append(Requests.request(EventCategory.SYSTEM_OPERATION));
    }
    final List<String> lines = Files.readAllLines(canonical(DAY));
    lines.set(1, lines.get(1).replace("record-1", "record-2"));
    Files.write(canonical(DAY), lines, StandardCharsets.UTF_8);

    assertThatExceptionOfType(ChainIntegrityException.class)
        .isThrownBy(() -> ledger.query(AuditQuery.days(DAY, DAY).build()));
    verify(alertSink).raiseAlert(eq("AUDIT_CHAIN_BROKEN"), eq(Severity.CRITICAL), anyMap());
  }

  @Test
  void query_flippedByteAnywhereInLine() throws IOException {
    final AuditLedger ledger = ledger();
    ledger.append(Requests.request(EventCategory.SYSTEM_OPERATION));
    ledger.append(Requests.request(EventCategory.SYSTEM_OPERATION));
    final byte[] original = Files.readAllBytes(canonical(DAY));
    final int secondLineStart = new String(original, StandardCharsets.UTF_8).indexOf('\n') + 1;

    for (int offset = secondLineStart; offset < original.length - 1; offset += 7) {
      final byte[] tampered = original.clone();
      tampered[offset] ^= 0x01;
      Files.write(canonical(DAY), tampered);
      assertThatExceptionOfType(ChainIntegrityException.class)
          .as("flip at %d", offset)
          .isThrownBy(() -> ledger.query(AuditQuery.days(DAY, DAY).build()));
    }
  }

  @Test
  void query_removedLine() throws IOException {
    final AuditLedger ledger = ledger();
    for (int i = 0; i < 3; i++) {
      ledger.append(Requests.request(EventCategory.SYSTEM_OPERATION));
    }
    final List<String> lines = Files.readAllLines(canonical(DAY));
    lines.remove(1);
    Files.write(canonical(DAY), lines, StandardCharsets.UTF_8);

    assertThatExceptionOfType(ChainIntegrityException.class)
        .isThrownBy(() -> ledger.query(AuditQuery.days(DAY, DAY).build()));
  }

  @Test
  void query_reorderedLines() throws IOException {
    final AuditLedger ledger = ledger();
    for (int i = 0; i < 3; i++) {
      ledger.append(Requests.request(EventCategory.SYSTEM_OPERATION));
    }
    final List<String> lines = Files.readAllLines(canonical(DAY));
    final String first = lines.remove(0);
    lines.add(1, first);
    Files.write(canonical(DAY), lines, StandardCharsets.UTF_8);

    assertThatExceptionOfType(ChainIntegrityException.class)
        .isThrownBy(() -> ledger.query(AuditQuery.days(DAY, DAY).build()));
  }

  @Test
  void query_laterDayAnchorsOnEarlierSegment() {
    final AuditLedger ledger = ledger();
    ledger.append(Requests.request(EventCategory.SYSTEM_OPERATION));
    clock.advance(Duration.ofDays(1));
    final String next = ledger.append(Requests.request(EventCategory.SYSTEM_OPERATION));

    assertThat(ledger.query(AuditQuery.days(DAY.plusDays(1), DAY.plusDays(1)).build()))
        .extracting(AuditEvent::id).containsExactly(next);
    assertThat(ledger.query(AuditQuery.days(DAY, DAY.plusDays(1)).build())).hasSize(2);
  }

  @Test
  void segmentRotation_keepsChainAcrossBoundary() throws IOException {
    final AuditLedger ledger = ledger(configuration(1024));
    int appended = 0;
    while (files(directory).size() < 2) {
      ledger.append(Requests.request(EventCategory.SYSTEM_OPERATION));
      clock.advance(Duration.ofSeconds(1));
      appended++;
    }
    ledger.append(Requests.request(EventCategory.SYSTEM_OPERATION));
    appended++;

    final List<Path> segments = files(directory);
    assertThat(segments).hasSize(2);
    assertThat(segments).anyMatch(p -> p.getFileName().toString().matches("audit-2026-03-01-\\d+\\.log"));
    assertThat(segments).contains(canonical(DAY));
    assertThat(Files.readAllLines(canonical(DAY))).hasSize(2);
    assertThat(ledger.query(AuditQuery.days(DAY, DAY).build())).hasSize(appended);
  }

  @Test
  void initialize_recoversTailHash() {
    final AuditLedger first = ledger();
    first.append(Requests.request(EventCategory.SYSTEM_OPERATION));
    final String tail = first.tailHash();

    final AuditLedger second = ledger();
    assertThat(second.tailHash()).isEqualTo(tail);
    second.append(Requests.request(EventCategory.SYSTEM_OPERATION));
    assertThat(second.query(AuditQuery.days(DAY, DAY).build())).hasSize(2);
  }

  @Test
  void append_highRiskAlerts() {
    final AuditLedger ledger = ledger();
    ledger.append(Requests.request(EventCategory.SYSTEM_OPERATION));
    verify(alertSink, never()).raiseAlert(anyString(), eq(Severity.HIGH), anyMap());

    ledger.append(Requests.request(EventCategory.DATA_ACCESS));
    verify(alertSink).raiseAlert(eq("HIGH_RISK_EVENT"), eq(Severity.HIGH), anyMap());
  }

  @Test
  void archiveDueSegments_movesOnlyWhenEveryCategoryIsDue() throws IOException {
    final AuditLedger ledger = ledger();
    final LocalDate old = DAY.minusDays(400);
    final LocalDate mixed = DAY.minusDays(200);
    final LocalDate authOnly = DAY.minusDays(199);
    clock.set(old.atTime(12, 0).toInstant(ZoneOffset.UTC));
    ledger.append(Requests.request(EventCategory.DATA_ACCESS));
    clock.set(mixed.atTime(12, 0).toInstant(ZoneOffset.UTC));
    ledger.append(Requests.request(EventCategory.AUTHENTICATION));
    ledger.append(Requests.request(EventCategory.DATA_ACCESS));
    clock.set(authOnly.atTime(12, 0).toInstant(ZoneOffset.UTC));
    ledger.append(Requests.request(EventCategory.AUTHENTICATION));
    clock.set(MORNING);
    ledger.append(Requests.request(EventCategory.DATA_ACCESS));

    final RetentionStatus before = ledger.retentionStatus();
    assertThat(before.activeSegments()).isEqualTo(4);
    assertThat(before.segmentsPendingArchival()).isEqualTo(2);

    assertThat(ledger.archiveDueSegments())
        .containsExactlyInAnyOrder("audit-" + old + ".log", "audit-" + authOnly + ".log");
    assertThat(files(directory.resolve("archive"))).hasSize(2);
    assertThat(Files.exists(canonical(mixed))).isTrue();
    verify(alertSink, times(2))
        .raiseAlert(eq("AUDIT_SEGMENT_ARCHIVED"), eq(Severity.LOW), anyMap());

    final RetentionStatus after = ledger.retentionStatus();
    assertThat(after.activeSegments()).isEqualTo(2);
    assertThat(after.archivedSegments()).isEqualTo(2);
    assertThat(after.segmentsPendingArchival()).isZero();
    assertThat(after.segmentsPendingDeletion()).isZero();

    assertThat(ledger.query(AuditQuery.days(old, DAY).build())).hasSize(5);
    assertThat(ledger.query(AuditQuery.days(DAY, DAY).build())).hasSize(1);
  }

  @Test
  void deletionBoundary() {
    final AuditLedger ledger = ledger();
    assertThat(ledger.deletionBoundary(EventCategory.DATA_ACCESS)).isEqualTo(DAY.minusDays(365 * 6));
    assertThat(ledger.deletionBoundary(EventCategory.AUTHENTICATION)).isEqualTo(DAY.minusDays(365 * 2));
  }

  @Test
  void retentionStatus_pendingDeletion() {
    final AuditLedger ledger = ledger();
    clock.set(DAY.minusDays(800).atTime(1, 0).toInstant(ZoneOffset.UTC));
    ledger.append(Requests.request(EventCategory.SYSTEM_OPERATION));
    clock.set(MORNING);

    assertThat(ledger.retentionStatus().segmentsPendingDeletion()).isEqualTo(1);
  }

}
