package com.codeheadsystems.backup.dagger;

import com.codeheadsystems.backup.manager.BackupSourceProvider;
import dagger.Module;
import dagger.Provides;
import javax.inject.Singleton;

/**
 * Supplies the hook scheduled backups enumerate their sources through.
 */
@Module
public class BackupModule {

  private final BackupSourceProvider backupSourceProvider;

  /**
   * Instantiates a new Backup module whose scheduled runs find nothing to back up.
   */
  public BackupModule() {
    this(BackupSourceProvider.NONE);
  }

  /**
   * Instantiates a new Backup module.
   *
   * @param backupSourceProvider the backup source provider
   */
  public BackupModule(final BackupSourceProvider backupSourceProvider) {
    this.backupSourceProvider = backupSourceProvider;
  }

  /**
   * Backup source provider.
   *
   * @return the backup source provider
   */
  @Provides
  @Singleton
  BackupSourceProvider backupSourceProvider() {
    return backupSourceProvider;
  }

}
