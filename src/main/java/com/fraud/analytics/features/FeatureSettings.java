package com.fraud.analytics.features;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.time.MonthDay;
import java.util.List;

/**
 * Tunables for feature extraction. Defaults match {@code fraud.analytics.features.*}.
 */
@Value
@Builder
public class FeatureSettings {

    @Builder.Default
    double microThreshold = 0.10;
    @Builder.Default
    double velocityCeilingPerHour = 10.0;
    @Builder.Default
    int duplicateCeiling = 5;
    /** z-score at which the outlier method flags; the z feature saturates at twice this. */
    @Builder.Default
    double zScoreThreshold = 3.0;
    @Builder.Default
    double thresholdProximityBand = 100.0;
    @Builder.Default
    List<BigDecimal> approvalThresholds = List.of(
            new BigDecimal("1000"), new BigDecimal("2500"), new BigDecimal("5000"),
            new BigDecimal("10000"), new BigDecimal("25000"), new BigDecimal("50000"));
    @Builder.Default
    List<String> suspiciousTerms = List.of(
            "cash", "reimburse", "personal", "loan", "advance", "consulting", "miscellaneous",
            "misc", "adjustment", "correction", "reversal", "bonus", "retainer", "test");
    @Singular
    List<MonthDay> holidays;

    public static FeatureSettings defaults() {
        return FeatureSettings.builder()
                .holiday(MonthDay.of(1, 1))
                .holiday(MonthDay.of(7, 4))
                .holiday(MonthDay.of(12, 24))
                .holiday(MonthDay.of(12, 25))
                .holiday(MonthDay.of(12, 31))
                .build();
    }
}
