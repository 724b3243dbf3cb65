package com.fraud.analytics.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI fraudAnalyticsOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Fraud Risk Analytics API")
                        .version("0.1.0")
                        .description(
                                "Statistical fraud-risk analysis of transaction batches.\n\n" +
                                "**Analysis pipeline:**\n" +
                                "1. Validate records; invalid ones are reported in `skippedRecords`\n" +
                                "2. Profile the batch (moments, percentiles, Benford's Law test)\n" +
                                "3. Extract 20 features per transaction and flag z-score / IQR outliers\n" +
                                "4. Classifier fraud probability (rule-only when no model is loaded)\n" +
                                "5. Weighted risk score 0-100 banded MINIMAL / LOW / MEDIUM / HIGH / CRITICAL\n\n" +
                                "Train with `POST /api/v1/fraud/model/train` or `/model/train/synthetic`; " +
                                "export and import weights with `GET` / `PUT /api/v1/fraud/model`.")
                        .contact(new Contact().name("Fraud Analytics Team")));
    }
}
