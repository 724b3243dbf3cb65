package com.fraud.analytics.classifier;

import lombok.Value;

/**
 * Output of one forward pass.
 */
@Value
public class Prediction {

    double[] output;
    /** Arg-max of the output (0 for a single-unit model). */
    int prediction;
    /** Largest output value. */
    double confidence;

    public static Prediction of(double[] output) {
        int best = 0;
        for (int i = 1; i < output.length; i++) {
            if (output[i] > output[best]) best = i;
        }
        return new Prediction(output.clone(), best, output[best]);
    }

    public double[] getOutput() {
        return output.clone();
    }
}
