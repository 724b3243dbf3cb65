package com.fraud.analytics.messaging;

import com.fraud.analytics.domain.RiskVerdict;

import java.util.List;

/**
 * Hands a report's top alerts to whatever delivers them (dashboards, case management,
 * auto-hold). Publishing must not fail the analysis that produced the alerts.
 */
public interface AlertPublisher {

    void publish(List<RiskVerdict> alerts);
}
