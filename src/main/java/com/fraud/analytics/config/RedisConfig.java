package com.fraud.analytics.config;

import com.fraud.analytics.cache.AnalysisReportRedisSerializer;
import com.fraud.analytics.cache.RedisReportCache;
import com.fraud.analytics.cache.ReportCache;
import com.fraud.analytics.domain.AnalysisReport;
import com.fraud.analytics.error.ConfigurationException;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import java.time.Duration;

/**
 * Redis-backed report cache, active with {@code fraud.analytics.cache.enabled=true}.
 */
@Configuration
@ConditionalOnProperty(name = "fraud.analytics.cache.enabled", havingValue = "true")
public class RedisConfig {

    /** resilience4j.circuitbreaker.instances.* entry guarding Redis calls. */
    static final String CIRCUIT_BREAKER = "reportCache";

    @Bean
    public RedisTemplate<String, AnalysisReport> analysisReportRedisTemplate(
            RedisConnectionFactory connectionFactory) {
        RedisTemplate<String, AnalysisReport> template = new RedisTemplate<>();
        template.setConnectionFactory(connectionFactory);
        template.setKeySerializer(new StringRedisSerializer());
        template.setValueSerializer(new AnalysisReportRedisSerializer());
        template.afterPropertiesSet();
        return template;
    }

    @Bean
    public ReportCache redisReportCache(RedisTemplate<String, AnalysisReport> analysisReportRedisTemplate,
                                        FraudAnalyticsProperties properties,
                                        CircuitBreakerRegistry circuitBreakerRegistry) {
        long ttlMinutes = properties.getCache().getTtlMinutes();
        if (ttlMinutes <= 0) {
            throw new ConfigurationException("fraud.analytics.cache.ttl-minutes must be > 0, got " + ttlMinutes);
        }
        return new RedisReportCache(analysisReportRedisTemplate, Duration.ofMinutes(ttlMinutes),
                circuitBreakerRegistry.circuitBreaker(CIRCUIT_BREAKER));
    }
}
