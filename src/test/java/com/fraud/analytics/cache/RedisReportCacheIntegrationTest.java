package com.fraud.analytics.cache;

import com.fraud.analytics.domain.AnalysisReport;
import com.fraud.analytics.domain.AnalysisStatus;
import com.fraud.analytics.domain.SkippedRecord;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.StringRedisSerializer;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration test: report cache against a real Redis (Testcontainers). Skipped when Docker
 * is not available.
 */
@Tag("integration")
@Testcontainers(disabledWithoutDocker = true)
class RedisReportCacheIntegrationTest {

    @Container
    static GenericContainer<?> redis = new GenericContainer<>(DockerImageName.parse("redis:7-alpine"))
            .withExposedPorts(6379);

    private static LettuceConnectionFactory connectionFactory;
    private static RedisTemplate<String, AnalysisReport> template;

    @BeforeAll
    static void connect() {
        connectionFactory = new LettuceConnectionFactory(
                new RedisStandaloneConfiguration(redis.getHost(), redis.getMappedPort(6379)));
        connectionFactory.afterPropertiesSet();
        connectionFactory.start();
        template = new RedisTemplate<>();
        template.setConnectionFactory(connectionFactory);
        template.setKeySerializer(new StringRedisSerializer());
        template.setValueSerializer(new AnalysisReportRedisSerializer());
        template.afterPropertiesSet();
    }

    @AfterAll
    static void disconnect() {
        connectionFactory.destroy();
    }

    @Test
    void storedReportIsReadBackUnderPrefixedKeyWithTtl() {
        RedisReportCache cache = new RedisReportCache(template, Duration.ofMinutes(5), CircuitBreaker.ofDefaults("reportCache"));
        AnalysisReport report = AnalysisReport.noValidRecords(1, List.of(
                SkippedRecord.builder().recordId("tx-1").index(0).reason("missing amount").build()));

        cache.put("abc", report);
        Optional<AnalysisReport> restored = cache.get("abc");

        assertThat(restored).isPresent();
        assertThat(restored.get().getStatus()).isEqualTo(AnalysisStatus.NO_VALID_RECORDS);
        assertThat(restored.get().getSkippedRecords()).containsExactlyElementsOf(report.getSkippedRecords());
        Long ttlSeconds = template.getExpire(RedisReportCache.KEY_PREFIX + "abc");
        assertThat(ttlSeconds).isNotNull().isBetween(1L, 300L);
    }

    @Test
    void unknownKeyIsAMiss() {
        RedisReportCache cache = new RedisReportCache(template, Duration.ofMinutes(5), CircuitBreaker.ofDefaults("reportCache"));

        assertThat(cache.get("never-stored")).isEmpty();
    }
}
