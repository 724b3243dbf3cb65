package com.fraud.analytics.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fraud.analytics.domain.RiskVerdict;
import com.fraud.analytics.messaging.AlertPublisher;
import com.fraud.analytics.messaging.KafkaAlertPublisher;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.kafka.support.serializer.JsonSerializer;

import java.util.HashMap;
import java.util.Map;

/**
 * Kafka producer for fraud alerts (RiskVerdict as JSON). Only active with
 * {@code fraud.analytics.alerts.kafka.enabled=true}.
 */
@Configuration
@ConditionalOnProperty(name = "fraud.analytics.alerts.kafka.enabled", havingValue = "true")
public class KafkaConfig {

    @Value("${spring.kafka.bootstrap-servers:localhost:9092}")
    private String bootstrapServers;

    @Bean(name = "fraudAlertKafkaObjectMapper")
    public ObjectMapper fraudAlertKafkaObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public ProducerFactory<String, RiskVerdict> fraudAlertProducerFactory(
            @Qualifier("fraudAlertKafkaObjectMapper") ObjectMapper objectMapper) {
        Map<String, Object> props = new HashMap<>();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, JsonSerializer.class);
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        JsonSerializer<RiskVerdict> serializer = new JsonSerializer<>(objectMapper);
        serializer.setAddTypeInfo(false);
        return new DefaultKafkaProducerFactory<>(props, new StringSerializer(), serializer);
    }

    @Bean
    public KafkaTemplate<String, RiskVerdict> fraudAlertKafkaTemplate(
            ProducerFactory<String, RiskVerdict> fraudAlertProducerFactory) {
        return new KafkaTemplate<>(fraudAlertProducerFactory);
    }

    @Bean
    public AlertPublisher kafkaAlertPublisher(KafkaTemplate<String, RiskVerdict> fraudAlertKafkaTemplate,
                                              FraudAnalyticsProperties properties) {
        return new KafkaAlertPublisher(fraudAlertKafkaTemplate, properties.getAlerts().getKafka().getTopic());
    }
}
