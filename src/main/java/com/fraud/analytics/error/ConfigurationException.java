package com.fraud.analytics.error;

/**
 * Malformed configuration (weights not summing to 1, non-positive learning rate or epochs, ...).
 * Raised before any computation starts.
 */
public class ConfigurationException extends FraudAnalyticsException {

    public ConfigurationException(String message) {
        super(message);
    }
}
