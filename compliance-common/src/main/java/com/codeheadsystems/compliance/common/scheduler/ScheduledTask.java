package com.codeheadsystems.compliance.common.scheduler;

/**
 * Handle to a pending timer.
 */
public interface ScheduledTask {

  /**
   * Cancel the task. A task that has already started runs to completion.
   */
  void cancel();

  /**
   * Is cancelled boolean.
   *
   * @return true if cancel() was called.
   */
  boolean isCancelled();

}
