package com.fraud.analytics.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Raw transaction as handed over by the ingestion side. Nothing here is validated yet:
 * amount and timestamp are kept as text so that malformed values can be reported
 * per record instead of failing the whole batch.
 */
@Value
@Builder
@Jacksonized
public class TransactionRecord {

    String id;
    /** Decimal amount, e.g. "125.40". Numbers in JSON are accepted as-is. */
    String amount;
    /** ISO-8601 instant, offset date-time, local date-time (read as UTC) or date. */
    String timestamp;
    String account;
    String vendor;
    String description;
}
