package com.codeheadsystems.compliance.common.alert;

import java.util.Map;

/**
 * Destination for named alerts. Whether this is the console, a SIEM or a ticketing system is up to the
 * implementation; callers treat it as fire-and-forget.
 *
 * <p>Implementations must be thread-safe.</p>
 */
public interface AlertSink {

  /**
   * Records an alert.
   *
   * @param kind     the alert name, e.g. AUDIT_CHAIN_BROKEN.
   * @param severity the severity.
   * @param details  structured details. Never contains key material.
   */
  void raiseAlert(String kind, Severity severity, Map<String, Object> details);

}
