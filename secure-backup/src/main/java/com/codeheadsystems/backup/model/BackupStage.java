package com.codeheadsystems.backup.model;

/**
 * Pipeline stages, used to tag failures.
 */
public enum BackupStage {
  SOURCE,
  COMPRESS,
  ENCRYPT,
  HASH,
  PERSIST,
  VERIFY,
  RESTORE_TEST
}
