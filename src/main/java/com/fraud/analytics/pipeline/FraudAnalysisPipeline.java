package com.fraud.analytics.pipeline;

import com.fraud.analytics.classifier.Classifier;
import com.fraud.analytics.classifier.ModelParameters;
import com.fraud.analytics.domain.AnalysisReport;
import com.fraud.analytics.domain.AnalysisStatus;
import com.fraud.analytics.domain.BatchProfile;
import com.fraud.analytics.domain.BatchSummary;
import com.fraud.analytics.domain.FeatureVector;
import com.fraud.analytics.domain.OutlierResult;
import com.fraud.analytics.domain.RiskLevel;
import com.fraud.analytics.domain.RiskSignals;
import com.fraud.analytics.domain.RiskVerdict;
import com.fraud.analytics.domain.SkippedRecord;
import com.fraud.analytics.domain.Transaction;
import com.fraud.analytics.domain.TransactionRecord;
import com.fraud.analytics.error.InvalidRecordException;
import com.fraud.analytics.features.BatchActivity;
import com.fraud.analytics.features.Feature;
import com.fraud.analytics.features.FeatureExtractor;
import com.fraud.analytics.outlier.OutlierDetector;
import com.fraud.analytics.profile.BatchProfiler;
import com.fraud.analytics.scoring.RiskScorer;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.stream.Collectors;

/**
 * Runs a batch through validation, profiling, feature extraction, outlier detection,
 * classifier inference and risk scoring, and assembles the report.
 * <p>
 * The batch profile and activity are computed once, before any per-transaction work;
 * after that each transaction is scored independently on the executor. Every transaction of
 * a batch is scored against one copy of the model parameters taken before scoring starts, so
 * training or a model import during the run cannot mix two models into one report.
 */
@Slf4j
public class FraudAnalysisPipeline {

    private final RecordValidator validator;
    private final FeatureExtractor featureExtractor;
    private final BatchProfiler profiler;
    private final OutlierDetector outlierDetector;
    private final RiskScorer riskScorer;
    private final Classifier classifier;
    private final ExecutorService executor;
    private final RecommendationBuilder recommendations;
    private final int topAlertLimit;

    /**
     * @param classifier may be null; verdicts are then rule-only
     */
    public FraudAnalysisPipeline(RecordValidator validator,
                                 FeatureExtractor featureExtractor,
                                 BatchProfiler profiler,
                                 OutlierDetector outlierDetector,
                                 RiskScorer riskScorer,
                                 Classifier classifier,
                                 ExecutorService executor,
                                 RecommendationBuilder recommendations,
                                 int topAlertLimit) {
        if (topAlertLimit < 0) {
            throw new IllegalArgumentException("topAlertLimit must be >= 0");
        }
        this.validator = validator;
        this.featureExtractor = featureExtractor;
        this.profiler = profiler;
        this.outlierDetector = outlierDetector;
        this.riskScorer = riskScorer;
        this.classifier = classifier;
        this.executor = executor;
        this.recommendations = recommendations;
        this.topAlertLimit = topAlertLimit;
    }

    /**
     * Analyse against the classifier's current parameters, or rule-only while it has none.
     */
    public AnalysisReport analyze(List<TransactionRecord> records) {
        ModelParameters model = classifier != null ? classifier.currentParameters().orElse(null) : null;
        return analyze(records, model);
    }

    /**
     * @param model parameters to score with; null for a rule-only run
     */
    public AnalysisReport analyze(List<TransactionRecord> records, ModelParameters model) {
        List<TransactionRecord> input = records != null ? records : List.of();
        List<Transaction> transactions = new ArrayList<>();
        List<SkippedRecord> skipped = new ArrayList<>();
        for (int i = 0; i < input.size(); i++) {
            TransactionRecord record = input.get(i);
            try {
                if (record == null) {
                    throw new InvalidRecordException("record-" + i, "empty record");
                }
                transactions.add(validator.validate(record, i));
            } catch (InvalidRecordException e) {
                log.warn("Skipping record {} at index {}: {}", e.getRecordId(), i, e.getReason());
                skipped.add(SkippedRecord.builder()
                        .recordId(record != null ? record.getId() : null)
                        .index(i)
                        .reason(e.getReason())
                        .build());
            }
        }

        if (transactions.isEmpty()) {
            log.warn("No valid records in batch of {} ({} skipped)", input.size(), skipped.size());
            return AnalysisReport.noValidRecords(input.size(), skipped);
        }

        BatchProfile profile = profiler.profile(transactions.stream()
                .map(Transaction::amountValue)
                .collect(Collectors.toList()));
        BatchActivity activity = BatchActivity.of(transactions);
        Classifier scoringModel = model != null ? Classifier.of(model) : null;
        if (scoringModel == null) {
            log.warn("Classifier unavailable; scoring batch of {} rule-only", transactions.size());
        }

        List<CompletableFuture<ScoredTransaction>> futures = new ArrayList<>(transactions.size());
        for (Transaction tx : transactions) {
            futures.add(CompletableFuture.supplyAsync(() -> score(tx, profile, activity, scoringModel), executor));
        }
        List<ScoredTransaction> scored = new ArrayList<>(futures.size());
        try {
            for (CompletableFuture<ScoredTransaction> future : futures) {
                scored.add(future.join());
            }
        } catch (CompletionException e) {
            futures.forEach(f -> f.cancel(true));
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }

        boolean allUsedClassifier = scored.stream().allMatch(s -> s.verdict.getSignals().hasClassifierSignal());
        List<RiskVerdict> verdicts = scored.stream()
                .map(s -> s.verdict)
                .sorted(Comparator.comparingInt(RiskVerdict::getRiskScore).reversed()
                        .thenComparing(RiskVerdict::getTransactionId))
                .collect(Collectors.toList());

        Map<RiskLevel, Integer> severityCounts = new EnumMap<>(RiskLevel.class);
        for (RiskLevel level : RiskLevel.values()) severityCounts.put(level, 0);
        for (RiskVerdict verdict : verdicts) severityCounts.merge(verdict.getRiskLevel(), 1, Integer::sum);

        List<RiskVerdict> topAlerts = verdicts.stream()
                .filter(v -> v.getRiskLevel().isAlert())
                .limit(topAlertLimit)
                .collect(Collectors.toList());
        int outlierCount = (int) scored.stream().filter(s -> s.outlier.isOutlier()).count();
        int microCount = (int) scored.stream().filter(s -> s.microScore >= RecommendationBuilder.MICRO_INDICATOR).count();

        BatchSummary summary = BatchSummary.builder()
                .benfordsAnalysis(profile.getBenfordsAnalysis())
                .outlierCount(outlierCount)
                .severityCounts(severityCounts)
                .topAlerts(List.copyOf(topAlerts))
                .build();

        log.info("Analysed batch: input={} scored={} skipped={} alerts={} outliers={} classifier={}",
                input.size(), verdicts.size(), skipped.size(),
                severityCounts.get(RiskLevel.HIGH) + severityCounts.get(RiskLevel.CRITICAL),
                outlierCount, allUsedClassifier);

        return AnalysisReport.builder()
                .status(AnalysisStatus.OK)
                .inputSize(input.size())
                .batchSize(transactions.size())
                .skippedRecords(List.copyOf(skipped))
                .verdicts(List.copyOf(verdicts))
                .summary(summary)
                .profile(profile)
                .recommendations(recommendations.build(profile, severityCounts, outlierCount, microCount, verdicts.size()))
                .classifierUsed(allUsedClassifier)
                .build();
    }

    private ScoredTransaction score(Transaction tx, BatchProfile profile, BatchActivity activity, Classifier model) {
        FeatureVector features = featureExtractor.extract(tx, profile, activity);
        OutlierResult outlier = outlierDetector.detect(tx.amountValue(), profile);
        Double probability = model != null ? model.fraudProbability(features.toArray()) : null;
        RiskSignals signals = riskScorer.deriveSignals(tx.amountValue(), features, outlier, probability);
        RiskVerdict verdict = riskScorer.score(tx.getId(), signals);
        return new ScoredTransaction(verdict, outlier, features.get(Feature.MICRO_AMOUNT));
    }

    private static final class ScoredTransaction {
        final RiskVerdict verdict;
        final OutlierResult outlier;
        final double microScore;

        ScoredTransaction(RiskVerdict verdict, OutlierResult outlier, double microScore) {
            this.verdict = verdict;
            this.outlier = outlier;
            this.microScore = microScore;
        }
    }
}
