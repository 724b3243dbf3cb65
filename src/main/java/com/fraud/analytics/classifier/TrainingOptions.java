package com.fraud.analytics.classifier;

import com.fraud.analytics.error.ConfigurationException;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Hyper-parameters of one training run.
 */
@Value
@Builder(toBuilder = true)
public class TrainingOptions {

    int epochs;
    double learningRate;
    /** Examples per gradient update; 1 is plain per-example gradient descent. */
    @Builder.Default
    int batchSize = 16;
    /** Validation accuracy is measured every this many epochs (and after the last one). */
    @Builder.Default
    int validationInterval = 10;
    /** Seeds the per-epoch shuffle. */
    @Builder.Default
    long seed = 42L;
    /** Optional wall-clock budget; training stops after the epoch in which it runs out. */
    Duration timeBudget;

    public void validate() {
        if (epochs <= 0) throw new ConfigurationException("epochs must be > 0, got " + epochs);
        if (!(learningRate > 0) || Double.isInfinite(learningRate)) {
            throw new ConfigurationException("learningRate must be > 0, got " + learningRate);
        }
        if (batchSize <= 0) throw new ConfigurationException("batchSize must be > 0, got " + batchSize);
        if (validationInterval <= 0) {
            throw new ConfigurationException("validationInterval must be > 0, got " + validationInterval);
        }
        if (timeBudget != null && (timeBudget.isNegative() || timeBudget.isZero())) {
            throw new ConfigurationException("timeBudget must be positive");
        }
    }
}
