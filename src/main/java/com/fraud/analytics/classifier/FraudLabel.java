package com.fraud.analytics.classifier;

/**
 * Classes of the multi-class model, in output-unit order.
 */
public enum FraudLabel {
    LEGITIMATE,
    SUSPICIOUS,
    FRAUDULENT;

    public double[] oneHot() {
        double[] v = new double[values().length];
        v[ordinal()] = 1.0;
        return v;
    }

    /**
     * Label vector for a model with {@code outputs} units; a single-unit model only
     * distinguishes fraudulent from everything else.
     */
    public double[] labelVector(int outputs) {
        if (outputs == 1) return new double[]{this == FRAUDULENT ? 1.0 : 0.0};
        if (outputs != values().length) {
            throw new IllegalArgumentException("No label encoding for a model with " + outputs + " outputs");
        }
        return oneHot();
    }
}
