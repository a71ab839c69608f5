package com.codeheadsystems.compliance.manager;

import static com.codeheadsystems.compliance.common.alert.Alerter.details;

import com.codeheadsystems.backup.manager.SecureBackupManager;
import com.codeheadsystems.backup.model.BackupConfig;
import com.codeheadsystems.backup.model.BackupConfiguration;
import com.codeheadsystems.backup.model.BackupMetadata;
import com.codeheadsystems.backup.model.VerificationStatus;
import com.codeheadsystems.compliance.common.alert.Alerter;
import com.codeheadsystems.compliance.common.alert.Severity;
import com.codeheadsystems.compliance.common.exception.ComplianceException;
import com.codeheadsystems.compliance.common.utilities.DigestUtilities;
import com.codeheadsystems.compliance.dao.ComplianceReportDao;
import com.codeheadsystems.compliance.model.AccessControlSection;
import com.codeheadsystems.compliance.model.AssessmentCriteria;
import com.codeheadsystems.compliance.model.AuditTrailSection;
import com.codeheadsystems.compliance.model.ComplianceConfiguration;
import com.codeheadsystems.compliance.model.ComplianceReport;
import com.codeheadsystems.compliance.model.ComplianceViolation;
import com.codeheadsystems.compliance.model.EncryptionSection;
import com.codeheadsystems.compliance.model.ImmutableAccessControlSection;
import com.codeheadsystems.compliance.model.ImmutableAuditTrailSection;
import com.codeheadsystems.compliance.model.ImmutableComplianceReport;
import com.codeheadsystems.compliance.model.ImmutableComplianceViolation;
import com.codeheadsystems.compliance.model.ImmutableEncryptionSection;
import com.codeheadsystems.compliance.model.ImmutableReportSummary;
import com.codeheadsystems.compliance.model.ImmutableRetentionSection;
import com.codeheadsystems.compliance.model.RetentionSection;
import com.codeheadsystems.compliance.model.RiskLevel;
import com.codeheadsystems.compliance.model.ViolationType;
import com.codeheadsystems.keys.manager.KeyLifecycleManager;
import com.codeheadsystems.keys.model.EncryptionKey;
import com.codeheadsystems.keys.model.KeyPurpose;
import com.codeheadsystems.ledger.manager.AuditLedger;
import com.codeheadsystems.ledger.model.ActionOutcome;
import com.codeheadsystems.ledger.model.ActionType;
import com.codeheadsystems.ledger.model.AuditEvent;
import com.codeheadsystems.ledger.model.ImmutableAuditQuery;
import com.codeheadsystems.ledger.model.RetentionStatus;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Assesses a reporting period against the ledger, the key store and the backup store, and writes the
 * result to the reports directory.
 */
@Singleton
public class ComplianceReporter {

  /**
   * Detail value that marks a READ failure as an access the actor was not entitled to.
   */
  public static final String UNAUTHORIZED = "UNAUTHORIZED";
  /**
   * Alert raised for every HIGH or CRITICAL finding.
   */
  public static final String VIOLATION_ALERT = "COMPLIANCE_VIOLATION";

  private static final Logger LOGGER = LoggerFactory.getLogger(ComplianceReporter.class);
  private static final double AUDIT_WEIGHT = 0.25;
  private static final double RETENTION_WEIGHT = 0.25;
  private static final double ACCESS_WEIGHT = 0.30;
  private static final double ENCRYPTION_WEIGHT = 0.20;

  private final AuditLedger auditLedger;
  private final KeyLifecycleManager keyLifecycleManager;
  private final SecureBackupManager secureBackupManager;
  private final BackupConfiguration backupConfiguration;
  private final AssessmentCriteria criteria;
  private final ComplianceReportDao complianceReportDao;
  private final Alerter alerter;
  private final Clock clock;
  private final SecureRandom secureRandom;

  /**
   * Instantiates a new Compliance reporter.
   *
   * @param configuration       the configuration
   * @param auditLedger         the audit ledger
   * @param keyLifecycleManager the key lifecycle manager
   * @param secureBackupManager the secure backup manager
   * @param complianceReportDao the compliance report dao
   * @param alerter             the alerter
   * @param clock               the clock
   * @param secureRandom        the secure random
   */
  @Inject
  public ComplianceReporter(final ComplianceConfiguration configuration,
                            final AuditLedger auditLedger,
                            final KeyLifecycleManager keyLifecycleManager,
                            final SecureBackupManager secureBackupManager,
                            final ComplianceReportDao complianceReportDao,
                            final Alerter alerter,
                            final Clock clock,
                            final SecureRandom secureRandom) {
    LOGGER.info("ComplianceReporter({})", configuration.reportsDirectory());
    this.auditLedger = auditLedger;
    this.keyLifecycleManager = keyLifecycleManager;
    this.secureBackupManager = secureBackupManager;
    this.backupConfiguration = configuration.backups();
    this.criteria = configuration.assessmentCriteria();
    this.complianceReportDao = complianceReportDao;
    this.alerter = alerter;
    this.clock = clock;
    this.secureRandom = secureRandom;
  }

  /**
   * Create the reports directory.
   */
  public void initialize() {
    LOGGER.trace("initialize()");
    try {
      complianceReportDao.createDirectories();
    } catch (ComplianceException e) {
      throw alerter.alerted("COMPLIANCE_REPORT_INIT_ERROR", Severity.HIGH, e, details());
    }
  }

  /**
   * Assess the period, persist the report and alert on every high risk finding.
   *
   * @param from first instant of the period.
   * @param to   last instant of the period, inclusive.
   * @return the report as written.
   */
  public ComplianceReport generateReport(final Instant from, final Instant to) {
    LOGGER.trace("generateReport({}, {})", from, to);
    if (to.isBefore(from)) {
      throw new IllegalArgumentException("Report period ends before it starts: " + from + " - " + to);
    }
    try {
      final List<AuditEvent> events = auditLedger.query(ImmutableAuditQuery.builder().from(from).to(to).build());
      final List<BackupMetadata> backups = secureBackupManager.listBackups();
      final AuditTrailSection auditTrails = auditTrails(events, backups, from, to);
      final RetentionSection retention = retention(auditLedger.retentionStatus());
      final AccessControlSection accessControl = accessControl(events);
      final EncryptionSection encryption = encryption(keyLifecycleManager.activeKeys(), backups);

      final double score = auditScore(auditTrails) * AUDIT_WEIGHT
          + retentionScore(retention) * RETENTION_WEIGHT
          + accessScore(accessControl) * ACCESS_WEIGHT
          + encryptionScore(encryption) * ENCRYPTION_WEIGHT;
      final int totalViolations = auditTrails.violations().size() + retention.violations().size()
          + accessControl.violations().size() + encryption.violations().size();

      final ComplianceReport report = ImmutableComplianceReport.builder()
          .id(newId())
          .timestamp(clock.instant())
          .periodStart(from)
          .periodEnd(to)
          .summary(ImmutableReportSummary.builder()
              .totalEvents(events.size())
              .totalViolations(totalViolations)
              .complianceScore(score)
              .riskLevel(RiskLevel.of(score))
              .build())
          .auditTrails(auditTrails)
          .retention(retention)
          .accessControl(accessControl)
          .encryption(encryption)
          .recommendations(recommendations(auditTrails, retention, accessControl, encryption))
          .build();
      complianceReportDao.save(report);
      LOGGER.info("Report {} for {} - {}: score {} ({}), {} violations",
          report.id(), from, to, score, report.summary().riskLevel(), totalViolations);
      report.violations().stream()
          .filter(ComplianceViolation::isHighRisk)
          .forEach(v -> alerter.raise(VIOLATION_ALERT, Severity.HIGH,
              details("violationType", v.type(), "description", v.description(), "details", v.details())));
      return report;
    } catch (ComplianceException e) {
      throw alerter.alerted("COMPLIANCE_REPORT_ERROR", Severity.HIGH, e, details("period", from + " - " + to));
    }
  }

  private AuditTrailSection auditTrails(final List<AuditEvent> events,
                                        final List<BackupMetadata> backups,
                                        final Instant from,
                                        final Instant to) {
    final Set<String> audited = events.stream()
        .filter(e -> e.action().type() == ActionType.CREATE)
        .filter(e -> "CREATE_BACKUP".equals(e.action().details().get("operation")))
        .map(e -> e.resource().id())
        .collect(Collectors.toSet());
    final List<ComplianceViolation> violations = new ArrayList<>();
    int missing = 0;
    for (BackupMetadata backup : backups) {
      if (backup.timestamp().isBefore(from) || backup.timestamp().isAfter(to)
          || backup.verificationStatus() == VerificationStatus.FAILURE || audited.contains(backup.id())) {
        continue;
      }
      missing++;
      violations.add(violation(ViolationType.MISSING_AUDIT, Severity.HIGH, "Missing required audit trail",
          details("backupId", backup.id(), "dataType", backup.dataType(), "timestamp", backup.timestamp().toString())));
    }
    int incomplete = 0;
    for (AuditEvent event : events) {
      if (isBlank(event.actor().id()) || isBlank(event.actor().role()) || isBlank(event.resource().type())) {
        incomplete++;
        violations.add(violation(ViolationType.INCOMPLETE_AUDIT, Severity.MEDIUM, "Incomplete audit trail",
            eventDetails(event)));
      }
    }
    return ImmutableAuditTrailSection.builder()
        .totalAudits(events.size())
        .missingAudits(missing)
        .incompleteAudits(incomplete)
        .violations(violations)
        .build();
  }

  private RetentionSection retention(final RetentionStatus status) {
    final List<ComplianceViolation> violations = new ArrayList<>();
    if (status.segmentsPendingArchival() > criteria.maxPendingArchival()) {
      violations.add(violation(ViolationType.RETENTION_VIOLATION, Severity.MEDIUM,
          "Excessive records pending archival",
          details("pendingArchival", status.segmentsPendingArchival(), "threshold", criteria.maxPendingArchival())));
    }
    if (status.segmentsPendingDeletion() > criteria.maxPendingDeletion()) {
      violations.add(violation(ViolationType.RETENTION_VIOLATION, Severity.HIGH,
          "Excessive records pending deletion",
          details("pendingDeletion", status.segmentsPendingDeletion(), "threshold", criteria.maxPendingDeletion())));
    }
    return ImmutableRetentionSection.builder()
        .totalSegments(status.activeSegments() + status.archivedSegments())
        .pendingArchival(status.segmentsPendingArchival())
        .pendingDeletion(status.segmentsPendingDeletion())
        .violations(violations)
        .build();
  }

  private AccessControlSection accessControl(final List<AuditEvent> events) {
    final List<ComplianceViolation> violations = new ArrayList<>();
    int reads = 0;
    int unauthorized = 0;
    int emergency = 0;
    for (AuditEvent event : events) {
      final ActionType type = event.action().type();
      if (type == ActionType.READ) {
        reads++;
        if (event.action().outcome() == ActionOutcome.FAILURE
            && UNAUTHORIZED.equals(event.action().details().get("reason"))) {
          unauthorized++;
          violations.add(violation(ViolationType.UNAUTHORIZED_ACCESS, Severity.HIGH,
              "Unauthorized access detected", eventDetails(event)));
        }
      } else if (type == ActionType.EMERGENCY_ACCESS) {
        emergency++;
        violations.add(violation(ViolationType.EMERGENCY_ACCESS, Severity.MEDIUM,
            "Emergency access detected", eventDetails(event)));
      }
    }
    return ImmutableAccessControlSection.builder()
        .totalAccesses(reads)
        .unauthorizedAccesses(unauthorized)
        .emergencyAccesses(emergency)
        .violations(violations)
        .build();
  }

  private EncryptionSection encryption(final Map<KeyPurpose, EncryptionKey> activeKeys,
                                       final List<BackupMetadata> backups) {
    final Instant now = clock.instant();
    final List<ComplianceViolation> violations = new ArrayList<>();
    int overdue = 0;
    for (Map.Entry<KeyPurpose, EncryptionKey> entry : activeKeys.entrySet()) {
      final EncryptionKey key = entry.getValue();
      if (key.isDue(now)) {
        overdue++;
        violations.add(violation(ViolationType.KEY_ROTATION_OVERDUE, Severity.HIGH, "Key rotation overdue",
            details("keyId", key.id(), "purpose", entry.getKey(), "expiresAt", key.expiresAt().toString())));
      }
    }
    final Map<String, BackupConfig> configs = backupConfiguration.backupConfigs();
    int unencrypted = 0;
    int failed = 0;
    for (BackupMetadata backup : backups) {
      final BackupConfig config = configs.get(backup.dataType());
      if (config != null && config.encryptionRequired() && backup.encryptionKeyId().isEmpty()) {
        unencrypted++;
        violations.add(violation(ViolationType.UNENCRYPTED_DATA, Severity.HIGH, "Backup stored without encryption",
            details("backupId", backup.id(), "dataType", backup.dataType())));
      }
      if (backup.verificationStatus() == VerificationStatus.FAILURE) {
        failed++;
        violations.add(violation(ViolationType.BACKUP_FAILURE, Severity.HIGH, "Backup failed verification",
            details("backupId", backup.id(), "dataType", backup.dataType())));
      }
    }
    return ImmutableEncryptionSection.builder()
        .activeKeys(activeKeys.size())
        .overdueKeys(overdue)
        .totalBackups(backups.size())
        .unencryptedBackups(unencrypted)
        .failedBackups(failed)
        .violations(violations)
        .build();
  }

  private List<String> recommendations(final AuditTrailSection auditTrails,
                                       final RetentionSection retention,
                                       final AccessControlSection accessControl,
                                       final EncryptionSection encryption) {
    final List<String> list = new ArrayList<>();
    if (auditTrails.missingAudits() > 0) {
      list.add("Implement comprehensive audit logging for all missing audit points");
    }
    if (auditTrails.incompleteAudits() > 0) {
      list.add("Review and complete all incomplete audit trails with required fields");
    }
    if (retention.pendingArchival() > 0) {
      list.add("Process pending archival records to maintain compliance with retention policies");
    }
    if (retention.pendingDeletion() > 0) {
      list.add("Review and process records pending deletion according to retention policies");
    }
    if (accessControl.unauthorizedAccesses() > 0) {
      list.add("Investigate and address all unauthorized access attempts");
    }
    if (accessControl.emergencyAccesses() > criteria.maxEmergencyAccesses()) {
      list.add("Review emergency access procedures and implement additional controls");
    }
    if (encryption.unencryptedBackups() > 0) {
      list.add("Encrypt all unencrypted records and implement encryption verification");
    }
    if (encryption.overdueKeys() > 0) {
      list.add("Rotate overdue encryption keys and check the rotation schedule");
    }
    if (encryption.failedBackups() > 0) {
      list.add("Investigate failed backups and take a fresh verified backup");
    }
    return list;
  }

  private static double auditScore(final AuditTrailSection section) {
    return floor(100 - section.missingAudits() * 10.0 - section.incompleteAudits() * 5.0);
  }

  private static double retentionScore(final RetentionSection section) {
    return floor(100 - section.pendingArchival() * 0.1 - section.pendingDeletion() * 0.2);
  }

  private double accessScore(final AccessControlSection section) {
    final int excessEmergency = Math.max(0, section.emergencyAccesses() - criteria.maxEmergencyAccesses());
    return floor(100 - section.unauthorizedAccesses() * 20.0 - excessEmergency * 5.0);
  }

  private static double encryptionScore(final EncryptionSection section) {
    return floor(100 - (section.overdueKeys() + section.unencryptedBackups() + section.failedBackups()) * 10.0);
  }

  private static double floor(final double score) {
    return Math.max(0, score);
  }

  private ComplianceViolation violation(final ViolationType type,
                                        final Severity severity,
                                        final String description,
                                        final Map<String, Object> violationDetails) {
    return ImmutableComplianceViolation.builder()
        .id(newId())
        .timestamp(clock.instant())
        .type(type)
        .severity(severity)
        .description(description)
        .details(violationDetails)
        .build();
  }

  private static Map<String, Object> eventDetails(final AuditEvent event) {
    final Function<String, String> orNone = s -> isBlank(s) ? "<missing>" : s;
    return details(
        "eventId", event.id(),
        "timestamp", event.timestamp().toString(),
        "actorId", orNone.apply(event.actor().id()),
        "resourceType", orNone.apply(event.resource().type()),
        "resourceId", event.resource().id());
  }

  private static boolean isBlank(final String value) {
    return value == null || value.isBlank();
  }

  private String newId() {
    final byte[] bytes = new byte[16];
    secureRandom.nextBytes(bytes);
    return DigestUtilities.encode.apply(bytes);
  }

}
