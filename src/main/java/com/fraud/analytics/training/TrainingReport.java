package com.fraud.analytics.training;

import com.fraud.analytics.classifier.EvaluationMetrics;
import com.fraud.analytics.classifier.TrainingResult;
import com.fraud.analytics.domain.SkippedRecord;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class TrainingReport {

    int trainingSize;
    int validationSize;
    List<SkippedRecord> skippedRecords;
    TrainingResult training;
    /** Metrics on the held-out split; null when no validation split was requested. */
    EvaluationMetrics evaluation;
}
