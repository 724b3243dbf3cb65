package com.fraud.analytics.outlier;

import com.fraud.analytics.domain.BatchProfile;
import com.fraud.analytics.domain.OutlierResult;
import com.fraud.analytics.domain.OutlierSeverity;

/**
 * Flags an amount as a statistical outlier against its batch profile. Two independent methods:
 * <ul>
 *   <li>z-score: {@code |amount - mean| / stddev} above the threshold; never flags a batch with zero spread</li>
 *   <li>IQR: |amount| outside {@code [Q1 - k*IQR, Q3 + k*IQR]} on absolute-amount quartiles</li>
 * </ul>
 * The combined score is the larger of the two normalised scores.
 */
public class OutlierDetector {

    private final double zScoreThreshold;
    private final double iqrMultiplier;

    public OutlierDetector(double zScoreThreshold, double iqrMultiplier) {
        if (zScoreThreshold <= 0 || iqrMultiplier <= 0) {
            throw new IllegalArgumentException("Outlier thresholds must be positive");
        }
        this.zScoreThreshold = zScoreThreshold;
        this.iqrMultiplier = iqrMultiplier;
    }

    public OutlierDetector() {
        this(3.0, 1.5);
    }

    public OutlierResult detect(double amount, BatchProfile profile) {
        double zScore = 0.0;
        boolean zFlag = false;
        double zOutlierScore = 0.0;
        if (profile.getStandardDeviation() > 0.0) {
            zScore = Math.abs(amount - profile.getMean()) / profile.getStandardDeviation();
            zFlag = zScore > zScoreThreshold;
            // 0.5 right at the threshold, saturating at twice the threshold
            zOutlierScore = zFlag ? clamp(zScore / (2 * zScoreThreshold)) : 0.0;
        }

        double abs = Math.abs(amount);
        double q1 = profile.getAbsoluteQ1();
        double q3 = profile.getAbsoluteQ3();
        double iqr = q3 - q1;
        double lower = q1 - iqrMultiplier * iqr;
        double upper = q3 + iqrMultiplier * iqr;
        double distance = 0.0;
        if (abs > upper) distance = abs - upper;
        else if (abs < lower) distance = lower - abs;
        boolean iqrFlag = distance > 0.0;
        double iqrOutlierScore = 0.0;
        if (iqrFlag) {
            iqrOutlierScore = iqr > 0.0 ? clamp(distance / iqr) : 1.0;
        }

        double score = Math.max(zOutlierScore, iqrOutlierScore);
        return OutlierResult.builder()
                .zScore(zScore)
                .zScoreFlag(zFlag)
                .zScoreOutlierScore(zOutlierScore)
                .iqrFlag(iqrFlag)
                .iqrOutlierScore(iqrOutlierScore)
                .score(score)
                .severity(OutlierSeverity.fromScore(score))
                .build();
    }

    private static double clamp(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }
}
