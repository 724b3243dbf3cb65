package com.fraud.analytics.scoring;

import com.fraud.analytics.domain.FeatureVector;
import com.fraud.analytics.domain.OutlierResult;
import com.fraud.analytics.domain.OutlierSeverity;
import com.fraud.analytics.domain.RiskLevel;
import com.fraud.analytics.domain.RiskSignals;
import com.fraud.analytics.domain.RiskVerdict;
import com.fraud.analytics.features.Feature;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link RiskScorer}: signal derivation, weighting, banding and reasoning.
 */
class RiskScorerTest {

    private final RiskScorer scorer = new RiskScorer();

    @Test
    void weightedScoreWithClassifierSignal() {
        RiskSignals signals = signals(0.8, 0.2, 1.0, 0.0, 0.0);

        RiskVerdict verdict = scorer.score("tx-1", signals);

        assertThat(scorer.rawScore(signals)).isCloseTo(56.0, within(1e-9));
        assertThat(verdict.getRiskScore()).isEqualTo(56);
        assertThat(verdict.getRiskLevel()).isEqualTo(RiskLevel.MEDIUM);
        assertThat(verdict.getTransactionId()).isEqualTo("tx-1");
        assertThat(verdict.getReasoning()).containsExactly(
                "classifier fraud probability 0.80",
                "suspicious amount pattern (micro, fractional or just below an approval threshold)");
    }

    @Test
    void scoreStaysWithinBoundsForSaturatedSignals() {
        assertThat(scorer.score("max", signals(1.0, 1.0, 1.0, 1.0, 1.0)).getRiskScore()).isEqualTo(100);
        assertThat(scorer.score("min", signals(0.0, 0.0, 0.0, 0.0, 0.0)).getRiskScore()).isZero();
        assertThat(scorer.rawScore(signals(7.0, 3.0, 2.0, 9.0, 4.0))).isCloseTo(100.0, within(1e-9));
        assertThat(scorer.rawScore(signals(-1.0, -3.0, -2.0, -9.0, -4.0))).isZero();
    }

    @Test
    void ruleOnlyScoreUsesRedistributedWeights() {
        RiskSignals signals = RiskSignals.builder().amountRisk(1.0).build();

        RiskVerdict verdict = scorer.score("tx-2", signals);

        assertThat(scorer.rawScore(signals)).isCloseTo(100 * 0.25 / 0.65, within(1e-9));
        assertThat(verdict.getRiskScore()).isEqualTo(38);
        assertThat(verdict.getRiskLevel()).isEqualTo(RiskLevel.LOW);
        assertThat(verdict.getReasoning()).contains("rule-only score: classifier unavailable");
    }

    @Test
    void quietTransactionHasNoIndicators() {
        RiskVerdict verdict = scorer.score("tx-3", signals(0.1, 0.0, 0.1, 0.0, 0.0));

        assertThat(verdict.getRiskLevel()).isEqualTo(RiskLevel.MINIMAL);
        assertThat(verdict.getReasoning()).containsExactly(RiskScorer.NO_INDICATORS);
    }

    @Test
    void outlierTimingAndPatternReasons() {
        RiskVerdict verdict = scorer.score("tx-4", signals(0.2, 0.9, 0.0, 0.8, 0.7));

        assertThat(verdict.getReasoning()).containsExactly(
                "statistical outlier detected",
                "unusual transaction timing",
                "suspicious behavioural pattern (duplicates, velocity or description terms)");
    }

    @Test
    void levelBandsFollowScoreBoundaries() {
        assertThat(RiskLevel.fromScore(19)).isEqualTo(RiskLevel.MINIMAL);
        assertThat(RiskLevel.fromScore(20)).isEqualTo(RiskLevel.LOW);
        assertThat(RiskLevel.fromScore(40)).isEqualTo(RiskLevel.MEDIUM);
        assertThat(RiskLevel.fromScore(59)).isEqualTo(RiskLevel.MEDIUM);
        assertThat(RiskLevel.fromScore(60)).isEqualTo(RiskLevel.HIGH);
        assertThat(RiskLevel.fromScore(79)).isEqualTo(RiskLevel.HIGH);
        assertThat(RiskLevel.fromScore(80)).isEqualTo(RiskLevel.CRITICAL);
    }

    @Test
    void microAmountDrivesAmountRisk() {
        FeatureVector features = features(Map.of(
                Feature.MICRO_AMOUNT, 1.0,
                Feature.FRACTIONAL_MANIPULATION, 0.8,
                Feature.BUSINESS_HOURS, 1.0));

        RiskSignals signals = scorer.deriveSignals(0.005, features, OutlierResult.none(), 0.9);

        assertThat(signals.getAmountRisk()).isEqualTo(1.0);
        assertThat(signals.getPatternRisk()).isEqualTo(0.8);
        assertThat(signals.getTimingRisk()).isZero();
        assertThat(signals.getClassifierProbability()).isEqualTo(0.9);
        assertThat(signals.isOutlierFlag()).isFalse();
    }

    @Test
    void quarterEndAfterHoursTiming() {
        FeatureVector features = features(Map.of(
                Feature.MONTH_END, 1.0,
                Feature.QUARTER_END, 1.0));

        RiskSignals signals = scorer.deriveSignals(120.0, features, OutlierResult.none(), null);

        assertThat(signals.getTimingRisk()).isEqualTo(0.35);
        assertThat(signals.hasClassifierSignal()).isFalse();
    }

    @Test
    void largeRoundAmountAndThresholdProximity() {
        FeatureVector round = features(Map.of(Feature.ROUND_NUMBER, 0.9, Feature.BUSINESS_HOURS, 1.0));
        FeatureVector nearThreshold = features(Map.of(Feature.THRESHOLD_PROXIMITY, 1.0, Feature.BUSINESS_HOURS, 1.0));

        assertThat(scorer.deriveSignals(5000.0, round, OutlierResult.none(), null).getAmountRisk())
                .isCloseTo(0.45, within(1e-12));
        assertThat(scorer.deriveSignals(50.0, round, OutlierResult.none(), null).getAmountRisk()).isZero();
        assertThat(scorer.deriveSignals(4950.0, nearThreshold, OutlierResult.none(), null).getAmountRisk())
                .isCloseTo(0.8, within(1e-12));
    }

    @Test
    void outlierResultIsCarriedIntoSignals() {
        OutlierResult outlier = OutlierResult.builder()
                .zScoreFlag(true)
                .score(0.9)
                .severity(OutlierSeverity.SEVERE)
                .build();

        RiskSignals signals = scorer.deriveSignals(90_000.0, features(Map.of()), outlier, 0.3);

        assertThat(signals.isOutlierFlag()).isTrue();
        assertThat(signals.getOutlierScore()).isEqualTo(0.9);
    }

    private static RiskSignals signals(double classifier, double outlier, double amount, double timing, double pattern) {
        return RiskSignals.builder()
                .classifierProbability(classifier)
                .outlierScore(outlier)
                .outlierFlag(outlier > 0)
                .amountRisk(amount)
                .timingRisk(timing)
                .patternRisk(pattern)
                .build();
    }

    private static FeatureVector features(Map<Feature, Double> values) {
        double[] v = new double[Feature.COUNT];
        values.forEach((feature, value) -> v[feature.ordinal()] = value);
        return new FeatureVector("tx", v);
    }
}
