package com.fraud.analytics.audit;

import com.fraud.analytics.domain.AnalysisReport;
import com.fraud.analytics.domain.RiskLevel;
import com.fraud.analytics.training.TrainingReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Audit trail of analysis and model runs. Lines carry counts and keys only, never
 * account identifiers or descriptions.
 */
@Slf4j
@Component
public class AnalysisAuditLogger {

    public void logAnalysis(String cacheKey, AnalysisReport report, boolean cacheHit) {
        log.info("[AUDIT] ANALYSIS key={} status={} input={} scored={} skipped={} high={} critical={} classifier={} cached={}",
                cacheKey,
                report.getStatus(),
                report.getInputSize(),
                report.getBatchSize(),
                report.getSkippedRecords().size(),
                report.getSummary().getSeverityCounts().getOrDefault(RiskLevel.HIGH, 0),
                report.getSummary().getSeverityCounts().getOrDefault(RiskLevel.CRITICAL, 0),
                report.isClassifierUsed(),
                cacheHit);
    }

    public void logTraining(String source, TrainingReport report) {
        log.info("[AUDIT] MODEL_TRAINING source={} examples={} validation={} skipped={} epochs={}/{} finalLoss={} accuracy={}",
                source,
                report.getTrainingSize(),
                report.getValidationSize(),
                report.getSkippedRecords().size(),
                report.getTraining().getEpochsCompleted(),
                report.getTraining().getEpochsRequested(),
                report.getTraining().finalLoss(),
                report.getEvaluation() != null ? report.getEvaluation().getAccuracy() : null);
    }

    public void logModelExport() {
        log.info("[AUDIT] MODEL_EXPORT");
    }

    public void logModelImport(int inputSize, int layers) {
        log.info("[AUDIT] MODEL_IMPORT inputSize={} layers={}", inputSize, layers);
    }
}
