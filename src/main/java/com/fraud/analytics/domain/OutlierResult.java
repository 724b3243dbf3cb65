package com.fraud.analytics.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of both outlier methods for one amount. Scores are normalised to [0,1].
 */
@Value
@Builder
public class OutlierResult {

    double zScore;
    boolean zScoreFlag;
    double zScoreOutlierScore;
    boolean iqrFlag;
    double iqrOutlierScore;
    /** max(zScoreOutlierScore, iqrOutlierScore). */
    double score;
    OutlierSeverity severity;

    public boolean isOutlier() {
        return zScoreFlag || iqrFlag;
    }

    public static OutlierResult none() {
        return OutlierResult.builder().severity(OutlierSeverity.NONE).build();
    }
}
