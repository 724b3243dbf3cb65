package com.fraud.analytics.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A record excluded from the batch, with the reason it failed validation.
 */
@Value
@Builder
@Jacksonized
public class SkippedRecord {

    String recordId;
    /** Position in the submitted batch, for records without an id. */
    int index;
    String reason;
}
