package com.fraud.analytics.error;

public class InsufficientTrainingDataException extends FraudAnalyticsException {

    public InsufficientTrainingDataException(String message) {
        super(message);
    }
}
