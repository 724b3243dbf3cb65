package com.fraud.analytics.cache;

import com.fraud.analytics.domain.AnalysisReport;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.SerializationException;

import java.time.Duration;
import java.util.Optional;

/**
 * Report cache in Redis with a fixed TTL. Fail-open: when Redis is down or an entry
 * cannot be read, the caller just recomputes the report.
 * <p>
 * Calls go through a circuit breaker; while it is open Redis is not contacted at all and
 * every lookup is a miss.
 */
@Slf4j
public class RedisReportCache implements ReportCache {

    static final String KEY_PREFIX = "fraud:report:";

    private final RedisTemplate<String, AnalysisReport> redisTemplate;
    private final Duration ttl;
    private final CircuitBreaker circuitBreaker;

    public RedisReportCache(RedisTemplate<String, AnalysisReport> redisTemplate, Duration ttl,
                            CircuitBreaker circuitBreaker) {
        this.redisTemplate = redisTemplate;
        this.ttl = ttl;
        this.circuitBreaker = circuitBreaker;
    }

    @Override
    public Optional<AnalysisReport> get(String key) {
        try {
            AnalysisReport cached = circuitBreaker.executeSupplier(
                    () -> redisTemplate.opsForValue().get(KEY_PREFIX + key));
            if (cached != null) {
                log.debug("Report cache hit for key={}", key);
                return Optional.of(cached);
            }
        } catch (CallNotPermittedException e) {
            log.debug("Report cache circuit open, skipping lookup for key={}", key);
        } catch (SerializationException e) {
            log.error("Cached report for key={} cannot be read (schema change?); recomputing. "
                    + "Consider clearing {}* entries after deployment.", key, KEY_PREFIX, e);
        } catch (RuntimeException e) {
            log.warn("Report cache read failed for key={} (Redis unavailable), recomputing: {}", key, e.getMessage());
        }
        return Optional.empty();
    }

    @Override
    public void put(String key, AnalysisReport report) {
        try {
            circuitBreaker.executeRunnable(() -> redisTemplate.opsForValue().set(KEY_PREFIX + key, report, ttl));
            log.debug("Stored report for key={} ttl={}", key, ttl);
        } catch (CallNotPermittedException e) {
            log.debug("Report cache circuit open, not storing key={}", key);
        } catch (RuntimeException e) {
            log.warn("Report cache write failed for key={}: {}", key, e.getMessage());
        }
    }
}
