package com.fraud.analytics.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * Distributional statistics over the amounts of one batch. Population statistics throughout.
 * Write-once per batch; a different batch gets a new profile.
 */
@Value
@Builder
@Jacksonized
public class BatchProfile {

    int count;
    double sum;
    double min;
    double max;
    double mean;
    double median;
    double variance;
    double standardDeviation;
    double coefficientOfVariation;
    /** 0 when {@link #sampleSizeInsufficient}. */
    double skewness;
    /** Excess kurtosis; 0 when {@link #sampleSizeInsufficient}. */
    double kurtosis;
    /** True below 4 amounts: skewness and kurtosis were not computed. */
    boolean sampleSizeInsufficient;
    int positiveCount;
    int negativeCount;
    /** Keys p10, p25, p50, p75, p90, p95, p99 in that order. */
    Map<String, Double> percentiles;
    /** First quartile of absolute amounts, used by the IQR outlier method. */
    double absoluteQ1;
    /** Third quartile of absolute amounts, used by the IQR outlier method. */
    double absoluteQ3;
    BenfordAnalysis benfordsAnalysis;

    public double absoluteIqr() {
        return absoluteQ3 - absoluteQ1;
    }
}
