package com.codeheadsystems.ledger.manager;

import com.codeheadsystems.ledger.model.ActionOutcome;
import com.codeheadsystems.ledger.model.AuditEvent;
import com.codeheadsystems.ledger.model.LedgerConfiguration;
import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * High risk when the category or the action type is on the configured list, the action failed, or the
 * details flag an emergency.
 */
@Singleton
public class HighRiskClassifier {

  private final LedgerConfiguration configuration;

  /**
   * Instantiates a new High risk classifier.
   *
   * @param configuration the configuration
   */
  @Inject
  public HighRiskClassifier(final LedgerConfiguration configuration) {
    this.configuration = configuration;
  }

  /**
   * Is high risk boolean.
   *
   * @param event the event
   * @return the boolean
   */
  public boolean isHighRisk(final AuditEvent event) {
    return configuration.highRiskCategories().contains(event.category())
        || configuration.highRiskActions().contains(event.action().type())
        || event.action().outcome() == ActionOutcome.FAILURE
        || Boolean.TRUE.equals(event.action().details().get("emergency"));
  }

}
