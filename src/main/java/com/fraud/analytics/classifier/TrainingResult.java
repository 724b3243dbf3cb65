package com.fraud.analytics.classifier;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

@Value
@Builder
@Jacksonized
public class TrainingResult {

    int epochsRequested;
    int epochsCompleted;
    /** Mean training loss (MSE) per completed epoch. */
    List<Double> lossHistory;
    /** Validation accuracy keyed by epoch number (1-based); empty without a validation set. */
    Map<Integer, Double> validationAccuracy;
    /** Best validation accuracy seen, or null without a validation set. */
    Double bestValidationAccuracy;
    /** True when the cancellation token or time budget stopped training early. */
    boolean stoppedEarly;

    public double initialLoss() {
        return lossHistory.isEmpty() ? Double.NaN : lossHistory.get(0);
    }

    public double finalLoss() {
        return lossHistory.isEmpty() ? Double.NaN : lossHistory.get(lossHistory.size() - 1);
    }
}
