package com.fraud.analytics.training;

import com.fraud.analytics.audit.AnalysisAuditLogger;
import com.fraud.analytics.classifier.Classifier;
import com.fraud.analytics.config.FraudAnalyticsProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Trains the classifier on synthetic data at start-up so the service does not begin rule-only.
 * Disable with {@code fraud.analytics.classifier.bootstrap.enabled=false}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "fraud.analytics.classifier.bootstrap.enabled", havingValue = "true", matchIfMissing = true)
public class ModelBootstrapper implements ApplicationRunner {

    private final ModelTrainingService trainingService;
    private final Classifier classifier;
    private final FraudAnalyticsProperties properties;
    private final AnalysisAuditLogger auditLogger;

    @Override
    public void run(ApplicationArguments args) {
        if (classifier.isCompiled()) {
            log.info("Classifier already has weights, skipping bootstrap training");
            return;
        }
        int examples = properties.getClassifier().getBootstrap().getExamples();
        TrainingReport report = trainingService.trainSynthetic(examples, trainingService.defaultOptions(),
                trainingService.defaultValidationSplit());
        auditLogger.logTraining("bootstrap", report);
        log.info("Classifier bootstrapped on {} synthetic examples, validation accuracy={}", examples,
                report.getEvaluation() != null ? report.getEvaluation().getAccuracy() : null);
    }
}
