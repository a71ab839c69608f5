package com.codeheadsystems.compliance.common.scheduler;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scheduler backed by a single timer thread that only hands work to a small, bounded worker pool where the
 * blocking file I/O of rotations and backups happens.
 */
@Singleton
public class ExecutorScheduler implements Scheduler {

  private static final Logger LOGGER = LoggerFactory.getLogger(ExecutorScheduler.class);
  private static final int DEFAULT_WORKERS = 2;

  private final ScheduledExecutorService timer;
  private final ExecutorService workers;

  /**
   * Instantiates a new Executor scheduler with the default worker count.
   */
  public ExecutorScheduler() {
    this(DEFAULT_WORKERS);
  }

  /**
   * Instantiates a new Executor scheduler.
   *
   * @param workerThreads the number of worker threads
   */
  public ExecutorScheduler(final int workerThreads) {
    LOGGER.info("ExecutorScheduler(workers={})", workerThreads);
    this.timer = Executors.newSingleThreadScheduledExecutor(daemon("compliance-timer"));
    this.workers = Executors.newFixedThreadPool(workerThreads, daemon("compliance-io"));
  }

  private static ThreadFactory daemon(final String prefix) {
    final AtomicInteger counter = new AtomicInteger();
    return r -> {
      final Thread thread = new Thread(r, prefix + "-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
  }

  @Override
  public ScheduledTask schedule(final Duration delay, final Runnable task) {
    final long millis = Math.max(0L, delay.toMillis());
    LOGGER.trace("schedule({}ms)", millis);
    final Handle handle = new Handle();
    handle.future = timer.schedule(() -> workers.execute(() -> {
      if (handle.cancelled.get()) {
        return;
      }
      try {
        task.run();
      } catch (RuntimeException e) {
        LOGGER.error("Scheduled task failed", e);
      }
    }), millis, TimeUnit.MILLISECONDS);
    return handle;
  }

  @Override
  public void shutdown() {
    LOGGER.info("shutdown()");
    timer.shutdownNow();
    workers.shutdown();
    try {
      if (!workers.awaitTermination(30, TimeUnit.SECONDS)) {
        workers.shutdownNow();
      }
    } catch (InterruptedException e) {
      workers.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  private static class Handle implements ScheduledTask {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private volatile ScheduledFuture<?> future;

    @Override
    public void cancel() {
      cancelled.set(true);
      final ScheduledFuture<?> f = future;
      if (f != null) {
        f.cancel(false);
      }
    }

    @Override
    public boolean isCancelled() {
      return cancelled.get();
    }
  }
}
