package com.codeheadsystems.compliance.common.alert;

import java.util.Map;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Alert sink that writes alerts to a dedicated logger. Used when nothing else is wired in.
 */
@Singleton
public class Slf4jAlertSink implements AlertSink {

  private static final Logger LOGGER = LoggerFactory.getLogger("compliance.alerts");

  /**
   * Instantiates a new Slf4j alert sink.
   */
  @Inject
  public Slf4jAlertSink() {
    LOGGER.info("Slf4jAlertSink()");
  }

  @Override
  public void raiseAlert(final String kind, final Severity severity, final Map<String, Object> details) {
    switch (severity) {
      case CRITICAL, HIGH -> LOGGER.error("[{}] {} {}", severity, kind, details);
      case MEDIUM -> LOGGER.warn("[{}] {} {}", severity, kind, details);
      default -> LOGGER.info("[{}] {} {}", severity, kind, details);
    }
  }
}
