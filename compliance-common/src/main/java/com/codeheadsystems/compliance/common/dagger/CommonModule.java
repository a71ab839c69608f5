package com.codeheadsystems.compliance.common.dagger;

import com.codeheadsystems.compliance.common.alert.AlertSink;
import com.codeheadsystems.compliance.common.alert.Slf4jAlertSink;
import com.codeheadsystems.compliance.common.json.ObjectMapperFactory;
import com.codeheadsystems.compliance.common.scheduler.ExecutorScheduler;
import com.codeheadsystems.compliance.common.scheduler.Scheduler;
import com.fasterxml.jackson.databind.ObjectMapper;
import dagger.Module;
import dagger.Provides;
import java.security.SecureRandom;
import java.time.Clock;
import javax.inject.Named;
import javax.inject.Singleton;

/**
 * Process-wide collaborators: clock, randomness, JSON, timers and the alert sink.
 */
@Module
public class CommonModule {

  /**
   * Qualifier for the sorted, hash-stable object mapper.
   */
  public static final String CANONICAL = "canonicalObjectMapper";

  private final AlertSink alertSink;
  private final Clock clock;

  /**
   * Instantiates a new Common module that alerts through the log and uses the UTC system clock.
   */
  public CommonModule() {
    this(new Slf4jAlertSink(), Clock.systemUTC());
  }

  /**
   * Instantiates a new Common module.
   *
   * @param alertSink the alert sink
   * @param clock     the clock
   */
  public CommonModule(final AlertSink alertSink, final Clock clock) {
    this.alertSink = alertSink;
    this.clock = clock;
  }

  /**
   * Clock clock.
   *
   * @return the clock
   */
  @Provides
  @Singleton
  Clock clock() {
    return clock;
  }

  /**
   * Secure random secure random.
   *
   * @return the secure random
   */
  @Provides
  @Singleton
  SecureRandom secureRandom() {
    return new SecureRandom();
  }

  /**
   * Alert sink alert sink.
   *
   * @return the alert sink
   */
  @Provides
  @Singleton
  AlertSink alertSink() {
    return alertSink;
  }

  /**
   * Object mapper object mapper.
   *
   * @return the object mapper
   */
  @Provides
  @Singleton
  ObjectMapper objectMapper() {
    return ObjectMapperFactory.objectMapper();
  }

  /**
   * Canonical object mapper object mapper.
   *
   * @return the object mapper
   */
  @Provides
  @Singleton
  @Named(CANONICAL)
  ObjectMapper canonicalObjectMapper() {
    return ObjectMapperFactory.canonicalObjectMapper();
  }

  /**
   * Scheduler scheduler.
   *
   * @return the scheduler
   */
  @Provides
  @Singleton
  Scheduler scheduler() {
    return new ExecutorScheduler();
  }

}
