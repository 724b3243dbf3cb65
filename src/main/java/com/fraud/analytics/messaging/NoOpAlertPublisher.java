package com.fraud.analytics.messaging;

import com.fraud.analytics.domain.RiskVerdict;

import java.util.List;

/**
 * Default publisher when Kafka delivery is disabled.
 */
public class NoOpAlertPublisher implements AlertPublisher {

    @Override
    public void publish(List<RiskVerdict> alerts) {
        // delivery disabled
    }
}
