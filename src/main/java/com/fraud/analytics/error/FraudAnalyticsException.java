package com.fraud.analytics.error;

/**
 * Base type for failures raised by the analytics core.
 */
public abstract class FraudAnalyticsException extends RuntimeException {

    protected FraudAnalyticsException(String message) {
        super(message);
    }

    protected FraudAnalyticsException(String message, Throwable cause) {
        super(message, cause);
    }
}
