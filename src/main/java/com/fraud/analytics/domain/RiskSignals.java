package com.fraud.analytics.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Per-transaction inputs to the risk scorer, each in [0,1].
 */
@Value
@Builder
@Jacksonized
public class RiskSignals {

    double amountRisk;
    double timingRisk;
    double patternRisk;
    boolean outlierFlag;
    double outlierScore;
    /** Null when the classifier could not be consulted (rule-only score). */
    Double classifierProbability;

    public boolean hasClassifierSignal() {
        return classifierProbability != null;
    }
}
