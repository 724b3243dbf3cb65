package com.fraud.analytics.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fraud.analytics.classifier.Activation;
import com.fraud.analytics.classifier.Classifier;
import com.fraud.analytics.classifier.ClassifierArchitecture;
import com.fraud.analytics.classifier.LayerSpec;
import com.fraud.analytics.classifier.ModelParameters;
import com.fraud.analytics.domain.AnalysisReport;
import com.fraud.analytics.domain.AnalysisStatus;
import com.fraud.analytics.domain.RiskLevel;
import com.fraud.analytics.domain.RiskVerdict;
import com.fraud.analytics.domain.SkippedRecord;
import com.fraud.analytics.domain.TransactionRecord;
import com.fraud.analytics.features.Feature;
import com.fraud.analytics.features.FeatureExtractor;
import com.fraud.analytics.features.FeatureSettings;
import com.fraud.analytics.outlier.OutlierDetector;
import com.fraud.analytics.profile.BatchProfiler;
import com.fraud.analytics.scoring.RiskScorer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.AbstractExecutorService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link FraudAnalysisPipeline} over whole batches: record handling, ordering,
 * reproducibility and the micro-skimming scenario.
 */
class FraudAnalysisPipelineTest {

    private static final Instant MONDAY_MORNING = Instant.parse("2024-06-10T09:00:00Z");

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final FeatureExtractor featureExtractor = new FeatureExtractor(FeatureSettings.defaults());
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void microAmountsAreDisproportionatelyHighRisk() {
        List<TransactionRecord> batch = microSkimmingBatch();
        Set<String> microIds = batch.stream()
                .filter(r -> new BigDecimal(r.getAmount()).compareTo(new BigDecimal("0.01")) <= 0)
                .map(TransactionRecord::getId)
                .collect(Collectors.toSet());
        assertThat(microIds).hasSize(22);

        double microIndicator = batch.stream()
                .filter(r -> microIds.contains(r.getId()))
                .mapToDouble(r -> featureExtractor.extract(new RecordValidator().validate(r, 0)).get(Feature.MICRO_AMOUNT))
                .average()
                .orElseThrow();
        assertThat(microIndicator).isGreaterThan(0.7);

        AnalysisReport report = pipeline(microClassifier(), 10).analyze(batch);

        assertThat(report.getStatus()).isEqualTo(AnalysisStatus.OK);
        assertThat(report.getBatchSize()).isEqualTo(150);
        assertThat(report.isClassifierUsed()).isTrue();
        double microAlertShare = alertShare(report.getVerdicts(), microIds, true);
        double majorityAlertShare = alertShare(report.getVerdicts(), microIds, false);
        assertThat(microAlertShare).isGreaterThan(0.8);
        assertThat(microAlertShare).isGreaterThan(majorityAlertShare + 0.5);
        assertThat(report.getSummary().getTopAlerts()).hasSize(10)
                .allSatisfy(v -> assertThat(microIds).contains(v.getTransactionId()));
        assertThat(report.getRecommendations())
                .anyMatch(r -> r.contains("micro-amount transaction(s) detected"));
    }

    @Test
    void identicalBatchesGiveByteIdenticalReports() throws Exception {
        List<TransactionRecord> batch = microSkimmingBatch();
        FraudAnalysisPipeline pipeline = pipeline(microClassifier(), 10);

        String first = objectMapper.writeValueAsString(pipeline.analyze(batch));
        String second = objectMapper.writeValueAsString(pipeline.analyze(batch));

        assertThat(second).isEqualTo(first);
    }

    @Test
    void reportDoesNotDependOnParallelism() throws Exception {
        List<TransactionRecord> batch = microSkimmingBatch();
        ExecutorService single = Executors.newSingleThreadExecutor();
        try {
            FraudAnalysisPipeline sequential = new FraudAnalysisPipeline(new RecordValidator(), featureExtractor,
                    new BatchProfiler(), new OutlierDetector(), new RiskScorer(), microClassifier(), single,
                    new RecommendationBuilder(), 10);

            assertThat(objectMapper.writeValueAsString(sequential.analyze(batch)))
                    .isEqualTo(objectMapper.writeValueAsString(pipeline(microClassifier(), 10).analyze(batch)));
        } finally {
            single.shutdownNow();
        }
    }

    @Test
    void verdictsAreOrderedByDescendingScore() {
        AnalysisReport report = pipeline(microClassifier(), 10).analyze(microSkimmingBatch());

        assertThat(report.getVerdicts()).isSortedAccordingTo(
                Comparator.comparingInt(RiskVerdict::getRiskScore).reversed().thenComparing(RiskVerdict::getTransactionId));
        int total = report.getSummary().getSeverityCounts().values().stream().mapToInt(Integer::intValue).sum();
        assertThat(total).isEqualTo(report.getBatchSize());
    }

    @Test
    void invalidRecordsAreSkippedAndReported() {
        List<TransactionRecord> batch = new ArrayList<>(Arrays.asList(
                record("a", "120.00", "2024-06-10T10:00:00Z"),
                record("b", null, "2024-06-10T10:05:00Z"),
                null,
                record("c", "abc", "2024-06-10T10:10:00Z"),
                record("d", "75.10", "2024-06-10T10:20:00Z"),
                record("e", "18.00", "not-a-date")));

        AnalysisReport report = pipeline(null, 10).analyze(batch);

        assertThat(report.getStatus()).isEqualTo(AnalysisStatus.OK);
        assertThat(report.getInputSize()).isEqualTo(6);
        assertThat(report.getBatchSize()).isEqualTo(2);
        assertThat(report.getVerdicts()).hasSize(2);
        assertThat(report.getSkippedRecords()).extracting(SkippedRecord::getIndex).containsExactly(1, 2, 3, 5);
        assertThat(report.getSkippedRecords()).extracting(SkippedRecord::getReason).containsExactly(
                "missing amount", "empty record", "non-numeric amount 'abc'", "unparseable timestamp 'not-a-date'");
        assertThat(report.getSkippedRecords().get(0).getRecordId()).isEqualTo("b");
    }

    @Test
    void amountsOutsideDoubleRangeAreSkippedWithoutPoisoningTheProfile() {
        List<TransactionRecord> batch = List.of(
                record("huge", "1e400", "2024-06-10T10:00:00Z"),
                record("overflow", "1E+999999999", "2024-06-10T10:01:00Z"),
                record("n1", "120.00", "2024-06-10T10:02:00Z"),
                record("n2", "80.50", "2024-06-10T10:03:00Z"),
                record("n3", "99.99", "2024-06-10T10:04:00Z"),
                record("n4", "150.25", "2024-06-10T10:05:00Z"),
                record("n5", "101.00", "2024-06-10T10:06:00Z"));

        AnalysisReport report = pipeline(null, 10).analyze(batch);

        assertThat(report.getStatus()).isEqualTo(AnalysisStatus.OK);
        assertThat(report.getBatchSize()).isEqualTo(5);
        assertThat(report.getSkippedRecords()).extracting(SkippedRecord::getRecordId).containsExactly("huge", "overflow");
        assertThat(report.getSkippedRecords()).extracting(SkippedRecord::getReason)
                .allSatisfy(reason -> assertThat(reason).startsWith("amount out of range"));
        assertThat(Double.isFinite(report.getProfile().getMean())).isTrue();
        assertThat(Double.isFinite(report.getProfile().getStandardDeviation())).isTrue();
        assertThat(Double.isFinite(report.getProfile().getSkewness())).isTrue();
    }

    @Test
    void modelChangeDuringRunDoesNotMixModelsInOneReport() {
        Classifier classifier = biasOnlyClassifier(-10.0);
        SwapAfterFirstTask swapping = new SwapAfterFirstTask(classifier, biasOnlyClassifier(10.0).snapshot());
        FraudAnalysisPipeline pipeline = new FraudAnalysisPipeline(new RecordValidator(), featureExtractor,
                new BatchProfiler(), new OutlierDetector(), new RiskScorer(), classifier, swapping,
                new RecommendationBuilder(), 10);
        List<TransactionRecord> batch = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            batch.add(record("tx-" + i, String.valueOf(100 + i), "2024-06-10T10:0" + i + ":00Z"));
        }

        AnalysisReport report = pipeline.analyze(batch);

        assertThat(swapping.swapped).isTrue();
        assertThat(report.isClassifierUsed()).isTrue();
        assertThat(report.getVerdicts())
                .extracting(v -> v.getSignals().getClassifierProbability())
                .hasSize(5)
                .allSatisfy(p -> assertThat(p).isLessThan(0.001));
        // the next run sees the new model
        assertThat(pipeline.analyze(batch).getVerdicts())
                .allSatisfy(v -> assertThat(v.getSignals().getClassifierProbability()).isGreaterThan(0.999));
    }

    @Test
    void explicitModelIsUsedInsteadOfClassifierState() {
        Classifier classifier = biasOnlyClassifier(-10.0);
        List<TransactionRecord> batch = List.of(
                record("a", "100", "2024-06-10T10:00:00Z"),
                record("b", "250", "2024-06-10T10:05:00Z"));

        AnalysisReport withModel = pipeline(classifier, 10).analyze(batch, biasOnlyClassifier(10.0).snapshot());
        AnalysisReport ruleOnly = pipeline(classifier, 10).analyze(batch, null);

        assertThat(withModel.getVerdicts())
                .allSatisfy(v -> assertThat(v.getSignals().getClassifierProbability()).isGreaterThan(0.999));
        assertThat(ruleOnly.isClassifierUsed()).isFalse();
    }

    @Test
    void batchWithoutValidRecordsHasNoValidRecordsStatus() {
        AnalysisReport report = pipeline(null, 10).analyze(List.of(
                record("x", null, "2024-06-10T10:00:00Z"),
                record("y", "5", null)));

        assertThat(report.getStatus()).isEqualTo(AnalysisStatus.NO_VALID_RECORDS);
        assertThat(report.getBatchSize()).isZero();
        assertThat(report.getVerdicts()).isEmpty();
        assertThat(report.getSkippedRecords()).hasSize(2);
        assertThat(report.getProfile()).isNull();
    }

    @Test
    void emptyBatchHasNoValidRecordsStatus() {
        assertThat(pipeline(null, 10).analyze(List.of()).getStatus()).isEqualTo(AnalysisStatus.NO_VALID_RECORDS);
    }

    @Test
    void missingClassifierGivesRuleOnlyVerdicts() {
        AnalysisReport report = pipeline(null, 10).analyze(microSkimmingBatch());

        assertThat(report.isClassifierUsed()).isFalse();
        assertThat(report.getVerdicts()).allSatisfy(v -> {
            assertThat(v.getSignals().hasClassifierSignal()).isFalse();
            assertThat(v.getReasoning()).contains("rule-only score: classifier unavailable");
        });
    }

    @Test
    void uncompiledClassifierGivesRuleOnlyVerdicts() {
        Classifier uncompiled = new Classifier(ClassifierArchitecture.multiClass());

        AnalysisReport report = pipeline(uncompiled, 10).analyze(microSkimmingBatch());

        assertThat(report.isClassifierUsed()).isFalse();
        assertThat(report.getVerdicts()).allSatisfy(v -> assertThat(v.getSignals().hasClassifierSignal()).isFalse());
    }

    @Test
    void topAlertsRespectLimit() {
        AnalysisReport report = pipeline(microClassifier(), 3).analyze(microSkimmingBatch());

        assertThat(report.getSummary().getTopAlerts()).hasSize(3)
                .allSatisfy(v -> assertThat(v.getRiskLevel().isAlert()).isTrue());
        assertThat(report.getSummary().getTopAlerts()).containsExactlyElementsOf(report.getVerdicts().subList(0, 3));
    }

    @Test
    void negativeAlertLimitIsRejected() {
        assertThatThrownBy(() -> pipeline(null, -1)).isInstanceOf(IllegalArgumentException.class);
    }

    private FraudAnalysisPipeline pipeline(Classifier classifier, int topAlerts) {
        return new FraudAnalysisPipeline(new RecordValidator(), featureExtractor, new BatchProfiler(),
                new OutlierDetector(), new RiskScorer(), classifier, executor, new RecommendationBuilder(), topAlerts);
    }

    /**
     * Single sigmoid unit keyed on the micro-amount feature: about 0.99 for a micro amount,
     * under 0.01 otherwise.
     */
    private static Classifier microClassifier() {
        List<LayerSpec> layers = List.of(LayerSpec.of(1, Activation.SIGMOID));
        double[][][] weights = new double[1][Feature.COUNT][1];
        weights[0][Feature.MICRO_AMOUNT.ordinal()][0] = 10.0;
        double[][] biases = {{-5.0}};
        Classifier classifier = new Classifier(new ClassifierArchitecture(Feature.COUNT, layers));
        classifier.load(new ModelParameters(Feature.COUNT, layers, weights, biases));
        return classifier;
    }

    /**
     * Single sigmoid unit with zero weights: the fraud probability is sigmoid(bias) for every input.
     */
    private static Classifier biasOnlyClassifier(double bias) {
        List<LayerSpec> layers = List.of(LayerSpec.of(1, Activation.SIGMOID));
        Classifier classifier = new Classifier(new ClassifierArchitecture(Feature.COUNT, layers));
        classifier.load(new ModelParameters(Feature.COUNT, layers, new double[1][Feature.COUNT][1], new double[][]{{bias}}));
        return classifier;
    }

    /**
     * Runs tasks on the calling thread and loads another model into the classifier right
     * after the first task.
     */
    private static final class SwapAfterFirstTask extends AbstractExecutorService {

        private final Classifier classifier;
        private final ModelParameters replacement;
        private boolean swapped;

        SwapAfterFirstTask(Classifier classifier, ModelParameters replacement) {
            this.classifier = classifier;
            this.replacement = replacement;
        }

        @Override
        public void execute(Runnable command) {
            command.run();
            if (!swapped) {
                swapped = true;
                classifier.load(replacement);
            }
        }

        @Override
        public void shutdown() {
        }

        @Override
        public List<Runnable> shutdownNow() {
            return List.of();
        }

        @Override
        public boolean isShutdown() {
            return false;
        }

        @Override
        public boolean isTerminated() {
            return false;
        }

        @Override
        public boolean awaitTermination(long timeout, TimeUnit unit) {
            return true;
        }
    }

    /**
     * 150 weekday transactions: 22 (about 15%) micro amounts in [0.0001, 0.01], the rest in [1, 1000].
     */
    private static List<TransactionRecord> microSkimmingBatch() {
        Random random = new Random(20240610L);
        List<TransactionRecord> batch = new ArrayList<>();
        for (int i = 0; i < 150; i++) {
            BigDecimal amount = i < 22
                    ? BigDecimal.valueOf(1 + 4L * i, 4)
                    : BigDecimal.valueOf(100 + random.nextInt(99_900), 2);
            batch.add(TransactionRecord.builder()
                    .id(String.format("tx-%03d", i))
                    .amount(amount.toPlainString())
                    .timestamp(MONDAY_MORNING.plus(3L * i, ChronoUnit.MINUTES).toString())
                    .account("acct-" + (i % 30))
                    .vendor("vendor-" + (i % 12))
                    .description("Invoice payment")
                    .build());
        }
        return batch;
    }

    private static double alertShare(List<RiskVerdict> verdicts, Set<String> microIds, boolean micro) {
        List<RiskVerdict> group = verdicts.stream()
                .filter(v -> microIds.contains(v.getTransactionId()) == micro)
                .collect(Collectors.toList());
        long alerts = group.stream().filter(v -> v.getRiskLevel() == RiskLevel.HIGH || v.getRiskLevel() == RiskLevel.CRITICAL).count();
        return (double) alerts / group.size();
    }

    private static TransactionRecord record(String id, String amount, String timestamp) {
        return TransactionRecord.builder().id(id).amount(amount).timestamp(timestamp).build();
    }
}
