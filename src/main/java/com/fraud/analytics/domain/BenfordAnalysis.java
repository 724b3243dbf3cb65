package com.fraud.analytics.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * First-digit distribution of a batch compared against Benford's Law.
 * Digit maps are keyed 1..9 in ascending order.
 */
@Value
@Builder
@Jacksonized
public class BenfordAnalysis {

    /** Amounts that contributed a leading digit (non-zero, sign stripped). */
    int sampleSize;
    Map<Integer, Long> observedCounts;
    Map<Integer, Double> observedDistribution;
    Map<Integer, Double> expectedDistribution;
    double chiSquare;
    /** Sum of absolute differences between observed and expected frequencies. */
    double deviationScore;
    BenfordCompliance compliance;
    boolean lowConfidence;
}
