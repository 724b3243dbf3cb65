package com.fraud.analytics.api;

import com.fraud.analytics.audit.AnalysisAuditLogger;
import com.fraud.analytics.cache.ReportCache;
import com.fraud.analytics.cache.ReportCacheKeys;
import com.fraud.analytics.classifier.Classifier;
import com.fraud.analytics.classifier.ModelParameters;
import com.fraud.analytics.classifier.ModelSnapshotCodec;
import com.fraud.analytics.classifier.TrainingOptions;
import com.fraud.analytics.domain.AnalysisReport;
import com.fraud.analytics.domain.RiskVerdict;
import com.fraud.analytics.messaging.AlertPublisher;
import com.fraud.analytics.pipeline.FraudAnalysisPipeline;
import com.fraud.analytics.training.ModelTrainingService;
import com.fraud.analytics.training.SyntheticDataGenerator;
import com.fraud.analytics.training.TrainingReport;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * REST API for batch analysis and classifier management.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/fraud")
@RequiredArgsConstructor
@Tag(name = "Fraud analytics", description = "Batch risk analysis, classifier training and recent alerts")
public class FraudAnalysisController {

    static final String CACHE_HEADER = "X-Report-Cache";

    private final FraudAnalysisPipeline pipeline;
    private final ModelTrainingService trainingService;
    private final Classifier classifier;
    private final ModelSnapshotCodec snapshotCodec;
    private final ReportCache reportCache;
    private final ReportCacheKeys cacheKeys;
    private final AlertPublisher alertPublisher;
    private final RecentAlertsStore recentAlertsStore;
    private final SyntheticDataGenerator syntheticDataGenerator;
    private final AnalysisAuditLogger auditLogger;

    @PostMapping("/analyze")
    @Operation(summary = "Analyse a transaction batch",
            description = "Scores every valid record 0-100 and returns verdicts, batch profile, summary and recommendations. "
                    + "Invalid records are listed in skippedRecords; an all-invalid batch returns status no_valid_records.")
    public ResponseEntity<AnalysisReport> analyze(@Valid @RequestBody AnalyzeRequestDto request) {
        // one copy of the model for both the key and the run
        ModelParameters model = classifier.currentParameters().orElse(null);
        String key = cacheKeys.keyFor(request.getTransactions(), model);
        Optional<AnalysisReport> cached = reportCache.get(key);
        if (cached.isPresent()) {
            auditLogger.logAnalysis(key, cached.get(), true);
            return ResponseEntity.ok().header(CACHE_HEADER, "HIT").body(cached.get());
        }

        AnalysisReport report = pipeline.analyze(request.getTransactions(), model);
        reportCache.put(key, report);
        List<RiskVerdict> alerts = report.getSummary().getTopAlerts();
        if (!alerts.isEmpty()) {
            recentAlertsStore.addAll(alerts);
            alertPublisher.publish(alerts);
        }
        auditLogger.logAnalysis(key, report, false);
        return ResponseEntity.ok().header(CACHE_HEADER, "MISS").body(report);
    }

    @PostMapping("/model/train")
    @Operation(summary = "Train the classifier on labelled records",
            description = "Runs gradient-descent training; omitted options use the configured bootstrap settings")
    public ResponseEntity<TrainingReport> train(@Valid @RequestBody TrainRequestDto request) {
        TrainingParametersDto params = request.getOptions() != null ? request.getOptions() : new TrainingParametersDto();
        TrainingOptions options = params.toOptions(trainingService.defaultOptions());
        TrainingReport report = trainingService.train(request.getRecords(), options,
                params.validationSplitOr(trainingService.defaultValidationSplit()));
        auditLogger.logTraining("labelled", report);
        return ResponseEntity.ok(report);
    }

    @PostMapping("/model/train/synthetic")
    @Operation(summary = "Train the classifier on synthetic data",
            description = "Generates legitimate, threshold-evasion and micro-skimming examples and trains on them")
    public ResponseEntity<TrainingReport> trainSynthetic(
            @RequestParam(defaultValue = "600") int count,
            @Valid @RequestBody(required = false) TrainingParametersDto params) {
        if (count < 10 || count > 100_000) {
            throw new IllegalArgumentException("count must be between 10 and 100000");
        }
        TrainingParametersDto p = params != null ? params : new TrainingParametersDto();
        TrainingReport report = trainingService.trainSynthetic(count, p.toOptions(trainingService.defaultOptions()),
                p.validationSplitOr(trainingService.defaultValidationSplit()));
        auditLogger.logTraining("synthetic", report);
        return ResponseEntity.ok(report);
    }

    @GetMapping(value = "/model", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Export the model", description = "Layer layout and every weight and bias as JSON; 409 when no model is loaded")
    public ResponseEntity<String> exportModel() {
        String json = snapshotCodec.write(classifier.snapshot());
        auditLogger.logModelExport();
        return ResponseEntity.ok().contentType(MediaType.APPLICATION_JSON).body(json);
    }

    @PutMapping(value = "/model", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Import a model", description = "Replaces the classifier weights with a previously exported snapshot")
    public ResponseEntity<Map<String, Object>> importModel(@RequestBody String snapshotJson) {
        ModelParameters parameters = snapshotCodec.read(snapshotJson);
        classifier.load(parameters);
        log.info("Model imported: inputSize={} layers={}", parameters.getInputSize(), parameters.getLayers().size());
        auditLogger.logModelImport(parameters.getInputSize(), parameters.getLayers().size());
        return ResponseEntity.ok(Map.of(
                "status", "loaded",
                "inputSize", parameters.getInputSize(),
                "layers", parameters.getLayers().size()));
    }

    @GetMapping("/alerts")
    @Operation(summary = "List recent alerts", description = "Recent HIGH and CRITICAL verdicts (in-memory; last 100)")
    public ResponseEntity<List<RiskVerdict>> listAlerts(@RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(recentAlertsStore.getRecent(Math.max(0, limit)));
    }

    @GetMapping(value = "/demo/training-data", produces = "text/csv")
    @Operation(summary = "Generate synthetic training data (CSV)",
            description = "Seeded labelled transactions (legitimate, suspicious, fraudulent) for local experiments")
    public ResponseEntity<String> getTrainingData(@RequestParam(defaultValue = "200") int rows) {
        if (rows < 10 || rows > 10_000) {
            return ResponseEntity.badRequest().body("rows must be between 10 and 10000");
        }
        String csv = SyntheticDataGenerator.toCsv(syntheticDataGenerator.generate(rows));
        log.info("Training data generated: {} rows", rows);
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.parseMediaType("text/csv"));
        headers.set(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=fraud_training_data.csv");
        return ResponseEntity.ok().headers(headers).body(csv);
    }
}
