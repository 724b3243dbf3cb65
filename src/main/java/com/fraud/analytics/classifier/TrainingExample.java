package com.fraud.analytics.classifier;

import lombok.Value;

@Value
public class TrainingExample {

    double[] features;
    double[] label;

    public TrainingExample(double[] features, double[] label) {
        this.features = features.clone();
        this.label = label.clone();
    }

    public static TrainingExample of(double[] features, FraudLabel label, int outputs) {
        return new TrainingExample(features, label.labelVector(outputs));
    }

    /** Arg-max of the label vector; for a single-unit label, 1 when above 0.5. */
    public int labelClass() {
        if (label.length == 1) return label[0] > 0.5 ? 1 : 0;
        int best = 0;
        for (int i = 1; i < label.length; i++) {
            if (label[i] > label[best]) best = i;
        }
        return best;
    }
}
