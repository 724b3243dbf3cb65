package com.fraud.analytics.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Consolidated result of one pipeline run. Contains no wall-clock values, so identical input
 * and configuration always produce an identical report.
 */
@Value
@Builder
@Jacksonized
public class AnalysisReport {

    AnalysisStatus status;
    int inputSize;
    /** Valid records actually scored: inputSize minus skipped. */
    int batchSize;
    List<SkippedRecord> skippedRecords;
    /** Highest risk first; ties broken by transaction id. */
    List<RiskVerdict> verdicts;
    BatchSummary summary;
    BatchProfile profile;
    List<String> recommendations;
    /** False when scores were computed rule-only. */
    boolean classifierUsed;

    public static AnalysisReport noValidRecords(int inputSize, List<SkippedRecord> skipped) {
        Map<RiskLevel, Integer> counts = new EnumMap<>(RiskLevel.class);
        for (RiskLevel level : RiskLevel.values()) counts.put(level, 0);
        return AnalysisReport.builder()
                .status(AnalysisStatus.NO_VALID_RECORDS)
                .inputSize(inputSize)
                .batchSize(0)
                .skippedRecords(List.copyOf(skipped))
                .verdicts(List.of())
                .summary(BatchSummary.builder()
                        .outlierCount(0)
                        .severityCounts(counts)
                        .topAlerts(List.of())
                        .build())
                .recommendations(List.of("No valid records to analyse; check the skipped records for data quality issues"))
                .classifierUsed(false)
                .build();
    }
}
