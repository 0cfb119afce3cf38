package dev.blogpulse.config;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.util.retry.Retry;

import java.time.Duration;

/**
 * Timeouts and retry strategy.
 * <p>
 * Ingestion stages get a short timeout and no retry: a slow store must not hold the beacon.
 * Admin queries get a longer timeout and a backoff retry on transient errors.
 */
@Component
@Getter
@Slf4j
public class ResilienceConfig {

    private final Duration trackingStageTimeout;
    private final Duration queryTimeout;
    private final Duration redisTimeout;
    private final int queryRetryMaxAttempts;
    private final Duration queryRetryMinBackoff;
    private final Duration queryRetryMaxBackoff;

    public ResilienceConfig(
            @Value("${resilience.tracking.stage-timeout-ms:2000}") long trackingStageTimeoutMs,
            @Value("${resilience.query.timeout-seconds:10}") long queryTimeoutSeconds,
            @Value("${resilience.query.retry-max-attempts:2}") int queryRetryMaxAttempts,
            @Value("${resilience.query.retry-min-backoff-ms:100}") long queryRetryMinBackoffMs,
            @Value("${resilience.query.retry-max-backoff-ms:1000}") long queryRetryMaxBackoffMs,
            @Value("${resilience.redis.timeout-ms:500}") long redisTimeoutMs) {
        this.trackingStageTimeout = Duration.ofMillis(trackingStageTimeoutMs);
        this.queryTimeout = Duration.ofSeconds(queryTimeoutSeconds);
        this.redisTimeout = Duration.ofMillis(redisTimeoutMs);
        this.queryRetryMaxAttempts = queryRetryMaxAttempts;
        this.queryRetryMinBackoff = Duration.ofMillis(queryRetryMinBackoffMs);
        this.queryRetryMaxBackoff = Duration.ofMillis(queryRetryMaxBackoffMs);
        log.info("Resilience configured: stageTimeout={}, queryTimeout={}", trackingStageTimeout, queryTimeout);
    }

    public static ResilienceConfig defaults() {
        return new ResilienceConfig(2000, 10, 2, 100, 1000, 500);
    }

    /**
     * Backoff with jitter for read-only report queries.
     */
    public Retry queryRetry() {
        return Retry.backoff(queryRetryMaxAttempts, queryRetryMinBackoff)
                .maxBackoff(queryRetryMaxBackoff)
                .jitter(0.5)
                .filter(ResilienceConfig::isTransient)
                .doBeforeRetry(signal -> log.warn("Retrying report query, attempt {}/{}: {}",
                        signal.totalRetries() + 1, queryRetryMaxAttempts, signal.failure().getMessage()));
    }

    static boolean isTransient(Throwable throwable) {
        String message = throwable.getMessage();
        if (message == null) {
            return false;
        }
        String lower = message.toLowerCase();
        return lower.contains("connection")
                || lower.contains("timeout")
                || lower.contains("temporarily unavailable")
                || lower.contains("too many connections")
                || lower.contains("deadlock");
    }
}
