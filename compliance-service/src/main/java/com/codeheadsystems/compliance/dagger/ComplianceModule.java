package com.codeheadsystems.compliance.dagger;

import com.codeheadsystems.backup.model.BackupConfiguration;
import com.codeheadsystems.compliance.model.ComplianceConfiguration;
import com.codeheadsystems.keys.model.KeyLifecycleConfiguration;
import com.codeheadsystems.ledger.model.LedgerConfiguration;
import dagger.Module;
import dagger.Provides;
import javax.inject.Singleton;

/**
 * Hands each component its slice of the process configuration.
 */
@Module
public class ComplianceModule {

  private final ComplianceConfiguration configuration;

  /**
   * Instantiates a new Compliance module.
   *
   * @param configuration the configuration
   */
  public ComplianceModule(final ComplianceConfiguration configuration) {
    this.configuration = configuration;
  }

  /**
   * Configuration compliance configuration.
   *
   * @return the compliance configuration
   */
  @Provides
  @Singleton
  public ComplianceConfiguration configuration() {
    return configuration;
  }

  /**
   * Ledger configuration.
   *
   * @return the ledger configuration
   */
  @Provides
  @Singleton
  public LedgerConfiguration ledgerConfiguration() {
    return configuration.ledger();
  }

  /**
   * Key lifecycle configuration.
   *
   * @return the key lifecycle configuration
   */
  @Provides
  @Singleton
  public KeyLifecycleConfiguration keyLifecycleConfiguration() {
    return configuration.keys();
  }

  /**
   * Backup configuration.
   *
   * @return the backup configuration
   */
  @Provides
  @Singleton
  public BackupConfiguration backupConfiguration() {
    return configuration.backups();
  }

}
