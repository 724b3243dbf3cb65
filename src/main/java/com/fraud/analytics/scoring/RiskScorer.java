package com.fraud.analytics.scoring;

import com.fraud.analytics.domain.FeatureVector;
import com.fraud.analytics.domain.OutlierResult;
import com.fraud.analytics.domain.RiskLevel;
import com.fraud.analytics.domain.RiskSignals;
import com.fraud.analytics.domain.RiskVerdict;
import com.fraud.analytics.features.Feature;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Folds the per-transaction signals into a 0-100 risk score, a severity band and a
 * reasoning list. Without a classifier signal the score is rule-only, using
 * {@link RiskWeights#withoutClassifier()}.
 */
@Slf4j
public class RiskScorer {

    static final double AMOUNT_REASON_THRESHOLD = 0.5;
    static final double TIMING_REASON_THRESHOLD = 0.5;
    static final double PATTERN_REASON_THRESHOLD = 0.5;
    static final double OUTLIER_REASON_THRESHOLD = 0.25;
    static final double CLASSIFIER_REASON_THRESHOLD = 0.5;
    static final String NO_INDICATORS = "no significant risk indicators";

    private static final double LARGE_ROUND_AMOUNT = 1000.0;

    private final RiskWeights weights;
    private final RiskWeights ruleOnlyWeights;

    public RiskScorer(RiskWeights weights) {
        this.weights = weights;
        this.ruleOnlyWeights = weights.withoutClassifier();
    }

    public RiskScorer() {
        this(RiskWeights.defaults());
    }

    public RiskWeights getWeights() {
        return weights;
    }

    /**
     * Derive the amount, timing and pattern signals from a feature vector.
     *
     * @param amount                the transaction amount, used for the large-round-amount rule
     * @param classifierProbability null for a rule-only verdict
     */
    public RiskSignals deriveSignals(double amount, FeatureVector features, OutlierResult outlier,
                                     Double classifierProbability) {
        double roundLarge = Math.abs(amount) >= LARGE_ROUND_AMOUNT ? 0.5 * features.get(Feature.ROUND_NUMBER) : 0.0;
        double amountRisk = max(
                features.get(Feature.MICRO_AMOUNT),
                features.get(Feature.FRACTIONAL_MANIPULATION),
                0.8 * features.get(Feature.THRESHOLD_PROXIMITY),
                roundLarge);

        double periodEnd = features.get(Feature.QUARTER_END) > 0
                ? 0.35 * features.get(Feature.QUARTER_END)
                : 0.2 * features.get(Feature.MONTH_END);
        double afterHours = features.get(Feature.BUSINESS_HOURS) > 0 ? 0.0 : 0.1;
        double timingRisk = max(
                features.get(Feature.UNUSUAL_HOUR),
                0.3 * features.get(Feature.WEEKEND),
                0.4 * features.get(Feature.HOLIDAY),
                periodEnd,
                afterHours);

        double patternRisk = max(
                features.get(Feature.FRACTIONAL_MANIPULATION),
                features.get(Feature.DUPLICATE_AMOUNT),
                features.get(Feature.DESCRIPTION_RISK),
                features.get(Feature.ACCOUNT_VELOCITY));

        return RiskSignals.builder()
                .amountRisk(clamp(amountRisk))
                .timingRisk(clamp(timingRisk))
                .patternRisk(clamp(patternRisk))
                .outlierFlag(outlier.isOutlier())
                .outlierScore(clamp(outlier.getScore()))
                .classifierProbability(classifierProbability != null ? clamp(classifierProbability) : null)
                .build();
    }

    /**
     * Weighted score in [0,100] before rounding. Signals outside [0,1] are clamped.
     */
    public double rawScore(RiskSignals signals) {
        RiskWeights w = signals.hasClassifierSignal() ? weights : ruleOnlyWeights;
        double classifier = signals.hasClassifierSignal() ? clamp(signals.getClassifierProbability()) : 0.0;
        double combined = w.getClassifier() * classifier
                + w.getOutlier() * clamp(signals.getOutlierScore())
                + w.getAmount() * clamp(signals.getAmountRisk())
                + w.getTiming() * clamp(signals.getTimingRisk())
                + w.getPattern() * clamp(signals.getPatternRisk());
        return Math.max(0.0, Math.min(100.0, combined * 100.0));
    }

    public RiskVerdict score(String transactionId, RiskSignals signals) {
        int score = (int) Math.round(rawScore(signals));
        RiskLevel level = RiskLevel.fromScore(score);
        List<String> reasoning = reasoning(signals);
        log.debug("Scored transaction {}: score={} level={}", transactionId, score, level);
        return RiskVerdict.builder()
                .transactionId(transactionId)
                .riskScore(score)
                .riskLevel(level)
                .signals(signals)
                .reasoning(reasoning)
                .build();
    }

    List<String> reasoning(RiskSignals signals) {
        List<String> reasons = new ArrayList<>();
        if (signals.hasClassifierSignal() && signals.getClassifierProbability() > CLASSIFIER_REASON_THRESHOLD) {
            reasons.add(String.format(Locale.ROOT, "classifier fraud probability %.2f",
                    signals.getClassifierProbability()));
        }
        if (signals.getOutlierScore() > OUTLIER_REASON_THRESHOLD) {
            reasons.add("statistical outlier detected");
        }
        if (signals.getAmountRisk() > AMOUNT_REASON_THRESHOLD) {
            reasons.add("suspicious amount pattern (micro, fractional or just below an approval threshold)");
        }
        if (signals.getTimingRisk() > TIMING_REASON_THRESHOLD) {
            reasons.add("unusual transaction timing");
        }
        if (signals.getPatternRisk() > PATTERN_REASON_THRESHOLD) {
            reasons.add("suspicious behavioural pattern (duplicates, velocity or description terms)");
        }
        if (!signals.hasClassifierSignal()) {
            reasons.add("rule-only score: classifier unavailable");
        }
        if (reasons.isEmpty()) {
            reasons.add(NO_INDICATORS);
        }
        return List.copyOf(reasons);
    }

    private static double max(double first, double... rest) {
        double m = first;
        for (double v : rest) m = Math.max(m, v);
        return m;
    }

    private static double clamp(double v) {
        if (Double.isNaN(v)) return 0.0;
        return Math.max(0.0, Math.min(1.0, v));
    }
}
