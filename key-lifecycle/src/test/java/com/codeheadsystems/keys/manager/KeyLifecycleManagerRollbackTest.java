package com.codeheadsystems.keys.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.codeheadsystems.compliance.common.alert.AlertSink;
import com.codeheadsystems.compliance.common.alert.Alerter;
import com.codeheadsystems.compliance.common.alert.Severity;
import com.codeheadsystems.compliance.common.scheduler.ScheduledTask;
import com.codeheadsystems.compliance.common.scheduler.Scheduler;
import com.codeheadsystems.keys.dao.EncryptionKeyDao;
import com.codeheadsystems.keys.exception.KeyStorageException;
import com.codeheadsystems.keys.model.EncryptionKey;
import com.codeheadsystems.keys.model.ImmutableKeyLifecycleConfiguration;
import com.codeheadsystems.keys.model.KeyLifecycleConfiguration;
import com.codeheadsystems.keys.model.KeyPurpose;
import com.codeheadsystems.keys.model.KeyStatus;
import java.io.IOException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class KeyLifecycleManagerRollbackTest {

  private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

  @Mock private EncryptionKeyDao dao;
  @Mock private Scheduler scheduler;
  @Mock private ScheduledTask scheduledTask;
  @Mock private AlertSink alertSink;
  @Captor private ArgumentCaptor<EncryptionKey> keyCaptor;
  @Captor private ArgumentCaptor<Runnable> runnableCaptor;

  private KeyLifecycleManager initializedManager() {
    final KeyLifecycleConfiguration configuration = ImmutableKeyLifecycleConfiguration.builder()
        .keysDirectory("/unused")
        .build();
    when(dao.loadAll()).thenReturn(List.of());
    when(scheduler.schedule(any(), any())).thenReturn(scheduledTask);
    final KeyLifecycleManager manager = new KeyLifecycleManager(configuration, dao, new SecureRandom(),
        Clock.fixed(T0, ZoneOffset.UTC), scheduler, new Alerter(alertSink));
    manager.initialize();
    return manager;
  }

  @Test
  void rotateKey_backupFailureRestoresPreviousKey() {
    final KeyLifecycleManager manager = initializedManager();
    final EncryptionKey current = manager.getActiveKey(KeyPurpose.PHI_ENCRYPTION);
    when(dao.writeBackup(any(), any())).thenThrow(new KeyStorageException("disk full", new IOException()));

    assertThatExceptionOfType(KeyStorageException.class)
        .isThrownBy(() -> manager.rotateKey(KeyPurpose.PHI_ENCRYPTION));

    assertThat(manager.getActiveKey(KeyPurpose.PHI_ENCRYPTION)).isEqualTo(current);
    verify(dao, atLeastOnce()).save(keyCaptor.capture());
    final List<EncryptionKey> saves = keyCaptor.getAllValues();
    final EncryptionKey demotedFresh = saves.get(saves.size() - 2);
    assertThat(demotedFresh.version()).isEqualTo(2);
    assertThat(demotedFresh.status()).isEqualTo(KeyStatus.EXPIRED);
    assertThat(saves.get(saves.size() - 1)).isEqualTo(current);
    verify(alertSink).raiseAlert(eq("KEY_BACKUP_ERROR"), eq(Severity.HIGH), anyMap());
    verify(alertSink).raiseAlert(eq("KEY_ROTATION_ERROR"), eq(Severity.HIGH), anyMap());
  }

  @Test
  void scheduledRotation_failureAlertsAndIsNotRearmed() {
    final KeyLifecycleManager manager = initializedManager();
    verify(scheduler, times(KeyPurpose.values().length)).schedule(any(), runnableCaptor.capture());
    final List<EncryptionKey> before = List.copyOf(manager.activeKeys().values());
    doThrow(new KeyStorageException("disk full", new IOException())).when(dao).save(any());

    runnableCaptor.getAllValues().get(0).run();

    verify(alertSink).raiseAlert(eq("KEY_ROTATION_SCHEDULE_ERROR"), eq(Severity.HIGH), anyMap());
    verify(scheduler, times(KeyPurpose.values().length)).schedule(any(), any());
    verify(scheduledTask, never()).cancel();
    assertThat(manager.activeKeys().values()).containsExactlyInAnyOrderElementsOf(before);
  }

}
