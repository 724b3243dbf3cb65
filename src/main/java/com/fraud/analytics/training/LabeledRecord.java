package com.fraud.analytics.training;

import com.fraud.analytics.classifier.FraudLabel;
import com.fraud.analytics.domain.TransactionRecord;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A raw transaction with its known class, as used for supervised training.
 */
@Value
@Builder
@Jacksonized
public class LabeledRecord {

    TransactionRecord transaction;
    FraudLabel label;
}
