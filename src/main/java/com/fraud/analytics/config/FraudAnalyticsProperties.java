package com.fraud.analytics.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Everything under {@code fraud.analytics.*}. Values are checked when the beans that use them
 * are built; bad weights or training parameters fail start-up with a ConfigurationException.
 */
@Data
@ConfigurationProperties(prefix = "fraud.analytics")
public class FraudAnalyticsProperties {

    private Features features = new Features();
    private Outlier outlier = new Outlier();
    private Scoring scoring = new Scoring();
    private ClassifierSettings classifier = new ClassifierSettings();
    private Pipeline pipeline = new Pipeline();
    private Cache cache = new Cache();
    private Alerts alerts = new Alerts();

    @Data
    public static class Features {
        // Amounts at or below a tenth of this score 1.0 on the micro-amount feature
        private double microThreshold = 0.10;
        private double velocityCeilingPerHour = 10.0;
        private int duplicateCeiling = 5;
        private double thresholdProximityBand = 100.0;
        private List<BigDecimal> approvalThresholds = new ArrayList<>(List.of(
                new BigDecimal("1000"), new BigDecimal("2500"), new BigDecimal("5000"),
                new BigDecimal("10000"), new BigDecimal("25000"), new BigDecimal("50000")));
        private List<String> suspiciousTerms = new ArrayList<>(List.of(
                "cash", "reimburse", "personal", "loan", "advance", "consulting", "miscellaneous",
                "misc", "adjustment", "correction", "reversal", "bonus", "retainer", "test"));
        // MM-dd
        private List<String> holidays = new ArrayList<>(List.of("01-01", "07-04", "12-24", "12-25", "12-31"));
    }

    @Data
    public static class Outlier {
        private double zscoreThreshold = 3.0;
        private double iqrMultiplier = 1.5;
    }

    @Data
    public static class Scoring {
        private Weights weights = new Weights();
    }

    @Data
    public static class Weights {
        private double classifier = 0.35;
        private double outlier = 0.15;
        private double amount = 0.25;
        private double timing = 0.10;
        private double pattern = 0.15;
    }

    @Data
    public static class ClassifierSettings {
        // binary or multi-class
        private String mode = "multi-class";
        private List<Integer> hiddenLayers = new ArrayList<>(List.of(32, 16, 8));
        private long seed = 42L;
        private Bootstrap bootstrap = new Bootstrap();
    }

    @Data
    public static class Bootstrap {
        // Train on synthetic data at start-up so the first analysis has a classifier signal
        private boolean enabled = true;
        private int examples = 600;
        private int epochs = 60;
        private double learningRate = 0.05;
        private int batchSize = 16;
        private double validationSplit = 0.2;
    }

    @Data
    public static class Pipeline {
        private int parallelism = Math.max(2, Runtime.getRuntime().availableProcessors());
        private int topAlerts = 10;
    }

    @Data
    public static class Cache {
        private boolean enabled = false;
        private long ttlMinutes = 60;
    }

    @Data
    public static class Alerts {
        private Kafka kafka = new Kafka();
    }

    @Data
    public static class Kafka {
        private boolean enabled = false;
        private String topic = "fraud-risk-alerts";
    }
}
