package com.codeheadsystems.compliance.common.alert;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Front door to the {@link AlertSink}. A failing sink is logged and never allowed to abort the operation
 * that raised the alert.
 */
@Singleton
public class Alerter {

  private static final Logger LOGGER = LoggerFactory.getLogger(Alerter.class);

  private final AlertSink alertSink;

  /**
   * Instantiates a new Alerter.
   *
   * @param alertSink the alert sink
   */
  @Inject
  public Alerter(final AlertSink alertSink) {
    LOGGER.info("Alerter({})", alertSink);
    this.alertSink = alertSink;
  }

  /**
   * Builds an ordered details map from alternating keys and values. Null values are recorded as the string
   * "null" so sinks never see a null.
   *
   * @param keyValues key, value, key, value...
   * @return the map.
   */
  public static Map<String, Object> details(final Object... keyValues) {
    if (keyValues.length % 2 != 0) {
      throw new IllegalArgumentException("details requires key/value pairs");
    }
    final Map<String, Object> map = new LinkedHashMap<>();
    for (int i = 0; i < keyValues.length; i += 2) {
      final Object value = keyValues[i + 1];
      map.put(String.valueOf(keyValues[i]), value == null ? "null" : value);
    }
    return map;
  }

  /**
   * Raise an alert.
   *
   * @param kind     the kind
   * @param severity the severity
   * @param details  the details
   */
  public void raise(final String kind, final Severity severity, final Map<String, Object> details) {
    LOGGER.trace("raise({}, {})", kind, severity);
    try {
      alertSink.raiseAlert(kind, severity, Collections.unmodifiableMap(new LinkedHashMap<>(details)));
    } catch (RuntimeException e) {
      LOGGER.error("Alert sink failed while raising {} ({}): {}", kind, severity, details, e);
    }
  }

  /**
   * Raise an alert describing the exception and hand the exception back so the caller can rethrow it
   * unchanged: {@code throw alerter.alerted(...)}.
   *
   * @param kind      the kind
   * @param severity  the severity
   * @param exception the exception being propagated
   * @param details   extra details, the error message is added under "error"
   * @param <E>       the exception type
   * @return the same exception.
   */
  public <E extends RuntimeException> E alerted(final String kind,
                                                final Severity severity,
                                                final E exception,
                                                final Map<String, Object> details) {
    final Map<String, Object> withError = new LinkedHashMap<>(details);
    withError.put("error", String.valueOf(exception.getMessage()));
    raise(kind, severity, withError);
    return exception;
  }

}
