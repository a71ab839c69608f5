package com.codeheadsystems.compliance.dagger;

import com.codeheadsystems.backup.dagger.BackupModule;
import com.codeheadsystems.backup.manager.SecureBackupManager;
import com.codeheadsystems.compliance.ComplianceService;
import com.codeheadsystems.compliance.common.dagger.CommonModule;
import com.codeheadsystems.compliance.manager.ComplianceReporter;
import com.codeheadsystems.compliance.model.ComplianceConfiguration;
import com.codeheadsystems.keys.manager.KeyLifecycleManager;
import com.codeheadsystems.ledger.dagger.LedgerModule;
import com.codeheadsystems.ledger.manager.AuditLedger;
import dagger.Component;
import javax.inject.Singleton;

/**
 * One instance of every component per process.
 */
@Singleton
@Component(modules = {ComplianceModule.class, CommonModule.class, LedgerModule.class, BackupModule.class})
public interface ComplianceComponent {

  /**
   * Component with the log-backed alert sink, the system clock and no scheduled backup sources.
   *
   * @param configuration the configuration
   * @return the compliance component
   */
  static ComplianceComponent instance(final ComplianceConfiguration configuration) {
    return DaggerComplianceComponent.builder().complianceModule(new ComplianceModule(configuration)).build();
  }

  /**
   * Component with caller supplied process collaborators.
   *
   * @param configuration the configuration
   * @param commonModule  the common module
   * @param backupModule  the backup module
   * @return the compliance component
   */
  static ComplianceComponent instance(final ComplianceConfiguration configuration,
                                      final CommonModule commonModule,
                                      final BackupModule backupModule) {
    return DaggerComplianceComponent.builder()
        .complianceModule(new ComplianceModule(configuration))
        .commonModule(commonModule)
        .backupModule(backupModule)
        .build();
  }

  /**
   * Compliance service.
   *
   * @return the compliance service
   */
  ComplianceService complianceService();

  /**
   * Audit ledger.
   *
   * @return the audit ledger
   */
  AuditLedger auditLedger();

  /**
   * Key lifecycle manager.
   *
   * @return the key lifecycle manager
   */
  KeyLifecycleManager keyLifecycleManager();

  /**
   * Secure backup manager.
   *
   * @return the secure backup manager
   */
  SecureBackupManager secureBackupManager();

  /**
   * Compliance reporter.
   *
   * @return the compliance reporter
   */
  ComplianceReporter complianceReporter();

}
