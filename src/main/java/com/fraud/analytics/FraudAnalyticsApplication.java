package com.fraud.analytics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the fraud risk analytics service:
 * <ul>
 *   <li>Batch analysis: features, profile with Benford's Law test, outliers, classifier, risk score</li>
 *   <li>Feed-forward classifier, trained on labelled or synthetic data, exportable as JSON</li>
 *   <li>Optional Redis report cache and Kafka alert publishing</li>
 *   <li>REST API and OpenAPI docs at /swagger-ui/index.html</li>
 * </ul>
 */
@SpringBootApplication
public class FraudAnalyticsApplication {

    public static void main(String[] args) {
        SpringApplication.run(FraudAnalyticsApplication.class, args);
    }
}
