package com.fraud.analytics.error;

import lombok.Getter;

/**
 * A transaction record is missing its amount or timestamp, or one of them cannot be parsed.
 * The pipeline catches this per record and reports the record as skipped.
 */
@Getter
public class InvalidRecordException extends FraudAnalyticsException {

    private final String recordId;
    private final String reason;

    public InvalidRecordException(String recordId, String reason) {
        super("Invalid record " + recordId + ": " + reason);
        this.recordId = recordId;
        this.reason = reason;
    }
}
