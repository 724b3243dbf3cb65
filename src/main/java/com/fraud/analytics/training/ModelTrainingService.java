package com.fraud.analytics.training;

import com.fraud.analytics.classifier.Classifier;
import com.fraud.analytics.classifier.EvaluationMetrics;
import com.fraud.analytics.classifier.TrainingExample;
import com.fraud.analytics.classifier.TrainingOptions;
import com.fraud.analytics.classifier.TrainingResult;
import com.fraud.analytics.config.FraudAnalyticsProperties;
import com.fraud.analytics.domain.BatchProfile;
import com.fraud.analytics.domain.SkippedRecord;
import com.fraud.analytics.domain.Transaction;
import com.fraud.analytics.error.ConfigurationException;
import com.fraud.analytics.error.InsufficientTrainingDataException;
import com.fraud.analytics.error.InvalidRecordException;
import com.fraud.analytics.features.BatchActivity;
import com.fraud.analytics.features.FeatureExtractor;
import com.fraud.analytics.pipeline.RecordValidator;
import com.fraud.analytics.profile.BatchProfiler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;

/**
 * Supervised training of the shared classifier from labelled records. Features are extracted
 * exactly as the pipeline does, with the labelled set itself as the batch context.
 * Training runs are explicit and never part of an analysis run.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ModelTrainingService {

    private final Classifier classifier;
    private final RecordValidator validator;
    private final FeatureExtractor featureExtractor;
    private final BatchProfiler profiler;
    private final FraudAnalyticsProperties properties;

    /**
     * Options from {@code fraud.analytics.classifier.bootstrap.*}, seeded with the classifier seed.
     */
    public TrainingOptions defaultOptions() {
        FraudAnalyticsProperties.Bootstrap b = properties.getClassifier().getBootstrap();
        return TrainingOptions.builder()
                .epochs(b.getEpochs())
                .learningRate(b.getLearningRate())
                .batchSize(b.getBatchSize())
                .seed(properties.getClassifier().getSeed())
                .build();
    }

    public double defaultValidationSplit() {
        return properties.getClassifier().getBootstrap().getValidationSplit();
    }

    public TrainingReport train(List<LabeledRecord> records, TrainingOptions options, double validationSplit) {
        return train(records, options, validationSplit, () -> false);
    }

    /**
     * @param validationSplit share of the examples held out for validation, in [0,1)
     * @param cancelled       polled after every epoch
     */
    public TrainingReport train(List<LabeledRecord> records, TrainingOptions options, double validationSplit,
                                BooleanSupplier cancelled) {
        options.validate();
        if (!(validationSplit >= 0.0 && validationSplit < 1.0)) {
            throw new ConfigurationException("validationSplit must be in [0,1), got " + validationSplit);
        }
        if (records == null || records.isEmpty()) {
            throw new InsufficientTrainingDataException("No labelled records supplied");
        }

        List<Transaction> transactions = new ArrayList<>();
        List<LabeledRecord> kept = new ArrayList<>();
        List<SkippedRecord> skipped = new ArrayList<>();
        for (int i = 0; i < records.size(); i++) {
            LabeledRecord record = records.get(i);
            if (record == null || record.getTransaction() == null || record.getLabel() == null) {
                skipped.add(SkippedRecord.builder().index(i).reason("missing transaction or label").build());
                continue;
            }
            try {
                transactions.add(validator.validate(record.getTransaction(), i));
                kept.add(record);
            } catch (InvalidRecordException e) {
                log.warn("Skipping training record {} at index {}: {}", e.getRecordId(), i, e.getReason());
                skipped.add(SkippedRecord.builder()
                        .recordId(record.getTransaction().getId())
                        .index(i)
                        .reason(e.getReason())
                        .build());
            }
        }
        if (transactions.isEmpty()) {
            throw new InsufficientTrainingDataException("None of the " + records.size() + " labelled records is valid");
        }

        BatchProfile profile = profiler.profile(transactions.stream()
                .map(Transaction::amountValue)
                .collect(Collectors.toList()));
        BatchActivity activity = BatchActivity.of(transactions);
        int outputs = classifier.getArchitecture().outputSize();
        List<TrainingExample> examples = new ArrayList<>(transactions.size());
        for (int i = 0; i < transactions.size(); i++) {
            double[] features = featureExtractor.extract(transactions.get(i), profile, activity).toArray();
            examples.add(TrainingExample.of(features, kept.get(i).getLabel(), outputs));
        }

        List<TrainingExample> shuffled = new ArrayList<>(examples);
        Collections.shuffle(shuffled, new Random(options.getSeed()));
        int validationSize = validationSize(shuffled.size(), validationSplit);
        List<TrainingExample> validation = shuffled.subList(0, validationSize);
        List<TrainingExample> training = shuffled.subList(validationSize, shuffled.size());

        classifier.compileIfAbsent(options.getSeed());
        log.info("Training classifier: examples={} validation={} skipped={} epochs={} learningRate={}",
                training.size(), validation.size(), skipped.size(), options.getEpochs(), options.getLearningRate());
        TrainingResult result = classifier.train(training, validation, options, cancelled);
        EvaluationMetrics evaluation = validation.isEmpty() ? null : classifier.evaluate(validation);

        return TrainingReport.builder()
                .trainingSize(training.size())
                .validationSize(validation.size())
                .skippedRecords(List.copyOf(skipped))
                .training(result)
                .evaluation(evaluation)
                .build();
    }

    /**
     * Train on freshly generated synthetic data.
     */
    public TrainingReport trainSynthetic(int count, TrainingOptions options, double validationSplit) {
        List<LabeledRecord> records = new SyntheticDataGenerator(options.getSeed()).generate(count);
        return train(records, options, validationSplit);
    }

    static int validationSize(int total, double split) {
        if (split <= 0.0 || total < 2) return 0;
        int size = (int) Math.round(total * split);
        return Math.max(1, Math.min(total - 1, size));
    }
}
