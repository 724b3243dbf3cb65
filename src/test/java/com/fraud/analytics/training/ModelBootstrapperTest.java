package com.fraud.analytics.training;

import com.fraud.analytics.audit.AnalysisAuditLogger;
import com.fraud.analytics.classifier.Classifier;
import com.fraud.analytics.classifier.TrainingOptions;
import com.fraud.analytics.config.FraudAnalyticsProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link ModelBootstrapper}.
 */
@ExtendWith(MockitoExtension.class)
class ModelBootstrapperTest {

    @Mock
    private ModelTrainingService trainingService;
    @Mock
    private Classifier classifier;
    @Mock
    private AnalysisAuditLogger auditLogger;

    private final FraudAnalyticsProperties properties = new FraudAnalyticsProperties();
    private ModelBootstrapper bootstrapper;

    @BeforeEach
    void setUp() {
        bootstrapper = new ModelBootstrapper(trainingService, classifier, properties, auditLogger);
    }

    @Test
    void trainsOnSyntheticDataWhenNoModelIsLoaded() {
        TrainingOptions options = TrainingOptions.builder().epochs(3).learningRate(0.05).build();
        TrainingReport report = TrainingReport.builder().trainingSize(480).validationSize(120)
                .skippedRecords(List.of()).build();
        properties.getClassifier().getBootstrap().setExamples(600);
        when(classifier.isCompiled()).thenReturn(false);
        when(trainingService.defaultOptions()).thenReturn(options);
        when(trainingService.defaultValidationSplit()).thenReturn(0.2);
        when(trainingService.trainSynthetic(600, options, 0.2)).thenReturn(report);

        bootstrapper.run(null);

        verify(trainingService).trainSynthetic(600, options, 0.2);
        verify(auditLogger).logTraining("bootstrap", report);
    }

    @Test
    void skipsWhenModelIsAlreadyLoaded() {
        when(classifier.isCompiled()).thenReturn(true);

        bootstrapper.run(null);

        verify(trainingService, never()).trainSynthetic(anyInt(), any(), anyDouble());
        verify(auditLogger, never()).logTraining(eq("bootstrap"), any());
    }
}
