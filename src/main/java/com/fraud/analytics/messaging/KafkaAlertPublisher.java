package com.fraud.analytics.messaging;

import com.fraud.analytics.domain.RiskVerdict;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Publishes each top alert to the fraud alert topic, keyed by transaction id so that
 * repeated alerts for one transaction land on the same partition.
 */
@Slf4j
@RequiredArgsConstructor
public class KafkaAlertPublisher implements AlertPublisher {

    private final KafkaTemplate<String, RiskVerdict> fraudAlertKafkaTemplate;
    private final String topic;

    @Override
    public void publish(List<RiskVerdict> alerts) {
        for (RiskVerdict alert : alerts) {
            try {
                CompletableFuture<SendResult<String, RiskVerdict>> future =
                        fraudAlertKafkaTemplate.send(topic, alert.getTransactionId(), alert);
                future.whenComplete((result, ex) -> {
                    if (ex != null) log.error("Failed to send fraud alert for transaction {}", alert.getTransactionId(), ex);
                    else log.debug("Sent fraud alert for transaction {} partition={}", alert.getTransactionId(),
                            result != null ? result.getRecordMetadata().partition() : null);
                });
            } catch (RuntimeException e) {
                log.error("Could not hand fraud alert for transaction {} to Kafka: {}", alert.getTransactionId(), e.getMessage());
            }
        }
    }
}
