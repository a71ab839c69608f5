package com.codeheadsystems.compliance.common.scheduler;

import java.time.Duration;

/**
 * Arms one-shot timers. Task bodies run off the timer thread so a slow rotation or backup never delays
 * another timer.
 */
public interface Scheduler {

  /**
   * Run the task once after the delay. A zero or negative delay means as soon as possible.
   *
   * @param delay the delay
   * @param task  the task
   * @return a handle that can cancel the task before it starts.
   */
  ScheduledTask schedule(Duration delay, Runnable task);

  /**
   * Cancel everything still pending and release the threads.
   */
  void shutdown();

}
