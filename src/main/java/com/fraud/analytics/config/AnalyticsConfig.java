package com.fraud.analytics.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fraud.analytics.cache.NoOpReportCache;
import com.fraud.analytics.cache.ReportCache;
import com.fraud.analytics.cache.ReportCacheKeys;
import com.fraud.analytics.classifier.Activation;
import com.fraud.analytics.classifier.Classifier;
import com.fraud.analytics.classifier.ClassifierArchitecture;
import com.fraud.analytics.classifier.FraudLabel;
import com.fraud.analytics.classifier.ModelSnapshotCodec;
import com.fraud.analytics.error.ConfigurationException;
import com.fraud.analytics.features.FeatureExtractor;
import com.fraud.analytics.features.FeatureSettings;
import com.fraud.analytics.messaging.AlertPublisher;
import com.fraud.analytics.messaging.NoOpAlertPublisher;
import com.fraud.analytics.outlier.OutlierDetector;
import com.fraud.analytics.pipeline.FraudAnalysisPipeline;
import com.fraud.analytics.pipeline.RecommendationBuilder;
import com.fraud.analytics.pipeline.RecordValidator;
import com.fraud.analytics.profile.BatchProfiler;
import com.fraud.analytics.scoring.RiskScorer;
import com.fraud.analytics.scoring.RiskWeights;
import com.fraud.analytics.training.SyntheticDataGenerator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.MonthDay;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Wires the analytics core from {@link FraudAnalyticsProperties}. The core classes carry no
 * Spring annotations; everything is assembled here.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(FraudAnalyticsProperties.class)
public class AnalyticsConfig {

    @Bean
    public FeatureSettings featureSettings(FraudAnalyticsProperties properties) {
        FraudAnalyticsProperties.Features f = properties.getFeatures();
        if (!(f.getMicroThreshold() > 0) || !(f.getVelocityCeilingPerHour() > 0) || f.getDuplicateCeiling() <= 0) {
            throw new ConfigurationException("fraud.analytics.features thresholds must be positive");
        }
        FeatureSettings.FeatureSettingsBuilder builder = FeatureSettings.builder()
                .microThreshold(f.getMicroThreshold())
                .velocityCeilingPerHour(f.getVelocityCeilingPerHour())
                .duplicateCeiling(f.getDuplicateCeiling())
                .zScoreThreshold(properties.getOutlier().getZscoreThreshold())
                .thresholdProximityBand(f.getThresholdProximityBand())
                .approvalThresholds(f.getApprovalThresholds())
                .suspiciousTerms(f.getSuspiciousTerms());
        for (String holiday : f.getHolidays()) {
            try {
                builder.holiday(MonthDay.parse("--" + holiday.trim()));
            } catch (DateTimeParseException e) {
                throw new ConfigurationException("Holiday '" + holiday + "' is not in MM-dd form");
            }
        }
        return builder.build();
    }

    @Bean
    public FeatureExtractor featureExtractor(FeatureSettings featureSettings) {
        return new FeatureExtractor(featureSettings);
    }

    @Bean
    public BatchProfiler batchProfiler() {
        return new BatchProfiler();
    }

    @Bean
    public OutlierDetector outlierDetector(FraudAnalyticsProperties properties) {
        FraudAnalyticsProperties.Outlier o = properties.getOutlier();
        if (!(o.getZscoreThreshold() > 0) || !(o.getIqrMultiplier() > 0)) {
            throw new ConfigurationException("fraud.analytics.outlier thresholds must be positive");
        }
        return new OutlierDetector(o.getZscoreThreshold(), o.getIqrMultiplier());
    }

    @Bean
    public RiskScorer riskScorer(FraudAnalyticsProperties properties) {
        FraudAnalyticsProperties.Weights w = properties.getScoring().getWeights();
        RiskWeights weights = new RiskWeights(w.getClassifier(), w.getOutlier(), w.getAmount(), w.getTiming(), w.getPattern());
        log.info("Risk weights: classifier={} outlier={} amount={} timing={} pattern={}",
                weights.getClassifier(), weights.getOutlier(), weights.getAmount(), weights.getTiming(), weights.getPattern());
        return new RiskScorer(weights);
    }

    @Bean
    public ClassifierArchitecture classifierArchitecture(FraudAnalyticsProperties properties) {
        FraudAnalyticsProperties.ClassifierSettings c = properties.getClassifier();
        String mode = c.getMode() == null ? "" : c.getMode().trim().toLowerCase(Locale.ROOT);
        switch (mode) {
            case "multi-class":
                return ClassifierArchitecture.withHiddenLayers(c.getHiddenLayers(), FraudLabel.values().length, Activation.SOFTMAX);
            case "binary":
                return ClassifierArchitecture.withHiddenLayers(c.getHiddenLayers(), 1, Activation.SIGMOID);
            default:
                throw new ConfigurationException("fraud.analytics.classifier.mode must be 'multi-class' or 'binary', got '"
                        + c.getMode() + "'");
        }
    }

    /**
     * Starts without weights: until a model is trained or imported, analyses are rule-only.
     */
    @Bean
    public Classifier classifier(ClassifierArchitecture classifierArchitecture) {
        return new Classifier(classifierArchitecture);
    }

    @Bean
    public ModelSnapshotCodec modelSnapshotCodec() {
        return new ModelSnapshotCodec();
    }

    @Bean
    public RecordValidator recordValidator() {
        return new RecordValidator();
    }

    @Bean
    public SyntheticDataGenerator syntheticDataGenerator(FraudAnalyticsProperties properties) {
        return new SyntheticDataGenerator(properties.getClassifier().getSeed());
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService analysisExecutor(FraudAnalyticsProperties properties) {
        int parallelism = properties.getPipeline().getParallelism();
        if (parallelism <= 0) {
            throw new ConfigurationException("fraud.analytics.pipeline.parallelism must be > 0, got " + parallelism);
        }
        return Executors.newFixedThreadPool(parallelism, new CustomizableThreadFactory("fraud-analysis-"));
    }

    @Bean
    public FraudAnalysisPipeline fraudAnalysisPipeline(RecordValidator recordValidator,
                                                       FeatureExtractor featureExtractor,
                                                       BatchProfiler batchProfiler,
                                                       OutlierDetector outlierDetector,
                                                       RiskScorer riskScorer,
                                                       Classifier classifier,
                                                       ExecutorService analysisExecutor,
                                                       FraudAnalyticsProperties properties) {
        int topAlerts = properties.getPipeline().getTopAlerts();
        if (topAlerts < 0) {
            throw new ConfigurationException("fraud.analytics.pipeline.top-alerts must be >= 0, got " + topAlerts);
        }
        return new FraudAnalysisPipeline(recordValidator, featureExtractor, batchProfiler, outlierDetector,
                riskScorer, classifier, analysisExecutor, new RecommendationBuilder(), topAlerts);
    }

    @Bean
    public ReportCacheKeys reportCacheKeys(ObjectMapper objectMapper, FraudAnalyticsProperties properties,
                                           ModelSnapshotCodec modelSnapshotCodec) {
        return new ReportCacheKeys(objectMapper, properties, modelSnapshotCodec);
    }

    /** Alerts stay in the recent-alerts store only. */
    @Bean
    @ConditionalOnProperty(name = "fraud.analytics.alerts.kafka.enabled", havingValue = "false", matchIfMissing = true)
    public AlertPublisher noOpAlertPublisher() {
        return new NoOpAlertPublisher();
    }

    /** Every analysis is computed afresh. */
    @Bean
    @ConditionalOnProperty(name = "fraud.analytics.cache.enabled", havingValue = "false", matchIfMissing = true)
    public ReportCache noOpReportCache() {
        return new NoOpReportCache();
    }
}
