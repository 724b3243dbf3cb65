package com.fraud.analytics.api;

import com.fraud.analytics.classifier.TrainingOptions;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * Training configuration. Omitted values fall back to the configured bootstrap settings.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrainingParametersDto {

    @Positive(message = "epochs must be > 0")
    @Max(value = 10_000, message = "epochs must be <= 10000")
    private Integer epochs;

    @Positive(message = "learningRate must be > 0")
    private Double learningRate;

    @Positive(message = "batchSize must be > 0")
    private Integer batchSize;

    @DecimalMin(value = "0.0", message = "validationSplit must be in [0,1)")
    @DecimalMax(value = "1.0", inclusive = false, message = "validationSplit must be in [0,1)")
    private Double validationSplit;

    private Long seed;

    @Positive(message = "timeBudgetSeconds must be > 0")
    private Long timeBudgetSeconds;

    TrainingOptions toOptions(TrainingOptions defaults) {
        TrainingOptions.TrainingOptionsBuilder builder = defaults.toBuilder();
        if (epochs != null) builder.epochs(epochs);
        if (learningRate != null) builder.learningRate(learningRate);
        if (batchSize != null) builder.batchSize(batchSize);
        if (seed != null) builder.seed(seed);
        if (timeBudgetSeconds != null) builder.timeBudget(Duration.ofSeconds(timeBudgetSeconds));
        return builder.build();
    }

    double validationSplitOr(double fallback) {
        return validationSplit != null ? validationSplit : fallback;
    }
}
