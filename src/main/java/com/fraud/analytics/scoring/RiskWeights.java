package com.fraud.analytics.scoring;

import com.fraud.analytics.error.ConfigurationException;
import lombok.Value;

/**
 * Weights of the five risk signals. They must each lie in [0,1] and sum to 1.
 */
@Value
public class RiskWeights {

    private static final double SUM_TOLERANCE = 1e-6;

    double classifier;
    double outlier;
    double amount;
    double timing;
    double pattern;

    public RiskWeights(double classifier, double outlier, double amount, double timing, double pattern) {
        check("classifier", classifier);
        check("outlier", outlier);
        check("amount", amount);
        check("timing", timing);
        check("pattern", pattern);
        double sum = classifier + outlier + amount + timing + pattern;
        if (Math.abs(sum - 1.0) > SUM_TOLERANCE) {
            throw new ConfigurationException("Risk weights must sum to 1, got " + sum);
        }
        this.classifier = classifier;
        this.outlier = outlier;
        this.amount = amount;
        this.timing = timing;
        this.pattern = pattern;
    }

    public static RiskWeights defaults() {
        return new RiskWeights(0.35, 0.15, 0.25, 0.10, 0.15);
    }

    /**
     * Weights for a rule-only score: the classifier share is spread over the other four
     * signals in proportion to their own weights.
     */
    public RiskWeights withoutClassifier() {
        double rest = outlier + amount + timing + pattern;
        if (rest <= 0.0) {
            return new RiskWeights(0.0, 0.25, 0.25, 0.25, 0.25);
        }
        return new RiskWeights(0.0, outlier / rest, amount / rest, timing / rest, pattern / rest);
    }

    private static void check(String name, double weight) {
        if (!Double.isFinite(weight) || weight < 0.0 || weight > 1.0) {
            throw new ConfigurationException("Risk weight '" + name + "' must be in [0,1], got " + weight);
        }
    }
}
