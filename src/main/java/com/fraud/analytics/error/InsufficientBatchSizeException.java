package com.fraud.analytics.error;

/**
 * Thrown when a batch is too small for even the basic statistics (no amounts at all).
 * Smaller shortfalls are flagged on the profile instead.
 */
public class InsufficientBatchSizeException extends FraudAnalyticsException {

    public InsufficientBatchSizeException(String message) {
        super(message);
    }
}
