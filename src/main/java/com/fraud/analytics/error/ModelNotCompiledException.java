package com.fraud.analytics.error;

/**
 * Inference or training was requested before the classifier's weights were initialised or loaded.
 */
public class ModelNotCompiledException extends FraudAnalyticsException {

    public ModelNotCompiledException(String message) {
        super(message);
    }
}
