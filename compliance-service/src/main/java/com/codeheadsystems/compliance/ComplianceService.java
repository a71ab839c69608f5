package com.codeheadsystems.compliance;

import com.codeheadsystems.backup.manager.SecureBackupManager;
import com.codeheadsystems.compliance.common.scheduler.Scheduler;
import com.codeheadsystems.compliance.configuration.ConfigurationLoader;
import com.codeheadsystems.compliance.dagger.ComplianceComponent;
import com.codeheadsystems.compliance.manager.ComplianceReporter;
import com.codeheadsystems.compliance.model.ComplianceConfiguration;
import com.codeheadsystems.keys.manager.KeyLifecycleManager;
import com.codeheadsystems.ledger.manager.AuditLedger;
import java.nio.file.Paths;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Starts and stops the components in dependency order. Keys come first since sealed ledger segments
 * need them to be read, and the ledger comes before backups since every backup is audited.
 */
@Singleton
public class ComplianceService {

  private static final Logger LOGGER = LoggerFactory.getLogger(ComplianceService.class);

  private final KeyLifecycleManager keyLifecycleManager;
  private final AuditLedger auditLedger;
  private final SecureBackupManager secureBackupManager;
  private final ComplianceReporter complianceReporter;
  private final Scheduler scheduler;
  private final AtomicBoolean running = new AtomicBoolean(false);
  private volatile CountDownLatch stopped = new CountDownLatch(0);

  /**
   * Instantiates a new Compliance service.
   *
   * @param keyLifecycleManager the key lifecycle manager
   * @param auditLedger         the audit ledger
   * @param secureBackupManager the secure backup manager
   * @param complianceReporter  the compliance reporter
   * @param scheduler           the scheduler
   */
  @Inject
  public ComplianceService(final KeyLifecycleManager keyLifecycleManager,
                           final AuditLedger auditLedger,
                           final SecureBackupManager secureBackupManager,
                           final ComplianceReporter complianceReporter,
                           final Scheduler scheduler) {
    LOGGER.info("ComplianceService()");
    this.keyLifecycleManager = keyLifecycleManager;
    this.auditLedger = auditLedger;
    this.secureBackupManager = secureBackupManager;
    this.complianceReporter = complianceReporter;
    this.scheduler = scheduler;
  }

  /**
   * Run the world. The timer threads are daemons, so the main thread holds the process open until the
   * shutdown hook has stopped the service.
   *
   * @param args the configuration file.
   * @throws InterruptedException if interrupted while waiting for shutdown.
   */
  public static void main(final String[] args) throws InterruptedException {
    LOGGER.info("main({})", (Object) args);
    if (args.length != 1) {
      throw new IllegalArgumentException("Usage: ComplianceService <configuration.json>");
    }
    final ComplianceConfiguration configuration = new ConfigurationLoader().load(Paths.get(args[0]));
    final ComplianceService service = ComplianceComponent.instance(configuration).complianceService();
    Runtime.getRuntime().addShutdownHook(new Thread(service::stop, "compliance-shutdown"));
    service.start();
    service.awaitStop();
    LOGGER.info("main(): stopped");
  }

  /**
   * Initialize every component and arm the timers. Calling it twice is a no-op.
   */
  public void start() {
    if (!running.compareAndSet(false, true)) {
      LOGGER.warn("start(): already running");
      return;
    }
    LOGGER.info("start()");
    stopped = new CountDownLatch(1);
    try {
      keyLifecycleManager.initialize();
      auditLedger.initialize();
      secureBackupManager.initialize();
      complianceReporter.initialize();
      secureBackupManager.scheduleBackups();
    } catch (RuntimeException e) {
      LOGGER.error("Startup failed, stopping", e);
      stop();
      throw e;
    }
  }

  /**
   * Cancel timers, clear scratch space and stop the timer threads.
   */
  public void stop() {
    if (!running.compareAndSet(true, false)) {
      return;
    }
    LOGGER.info("stop()");
    try {
      try {
        secureBackupManager.cleanup();
      } catch (RuntimeException e) {
        LOGGER.warn("Backup cleanup failed", e);
      }
      keyLifecycleManager.cleanup();
      scheduler.shutdown();
    } finally {
      stopped.countDown();
    }
  }

  /**
   * Block until {@link #stop()} completes. Returns at once when the service is not running.
   *
   * @throws InterruptedException if interrupted while waiting.
   */
  public void awaitStop() throws InterruptedException {
    stopped.await();
  }

  /**
   * Is running.
   *
   * @return the boolean
   */
  public boolean isRunning() {
    return running.get();
  }

}
