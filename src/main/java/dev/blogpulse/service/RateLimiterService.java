package dev.blogpulse.service;

import dev.blogpulse.config.RateLimitPolicy;
import dev.blogpulse.config.ResilienceConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fixed-window request counter keyed by bucket (route class + client).
 * <p>
 * Counts live in Redis ({@code INCR} + {@code EXPIRE}) so all instances share a budget. When Redis
 * is not configured or fails, a per-instance in-memory window takes over. A circuit breaker
 * skips Redis for a while after repeated failures so requests stop waiting on the timeout.
 */
@Service
@Slf4j
public class RateLimiterService {

    static final String KEY_PREFIX = "ratelimit:";

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final Clock clock;
    private final Duration redisTimeout;
    private final CircuitBreaker redisBreaker;

    private record WindowEntry(AtomicLong count, Instant resetAt) {}
    private final ConcurrentHashMap<String, WindowEntry> localWindows = new ConcurrentHashMap<>();

    public RateLimiterService(
            @Autowired(required = false) ReactiveRedisTemplate<String, String> redisTemplate,
            Clock clock,
            ResilienceConfig resilience) {
        this.redisTemplate = redisTemplate;
        this.clock = clock;
        this.redisTimeout = resilience.getRedisTimeout();
        CircuitBreakerConfig cbConfig = CircuitBreakerConfig.custom()
                .failureRateThreshold(50)
                .waitDurationInOpenState(Duration.ofSeconds(30))
                .slidingWindowSize(10)
                .minimumNumberOfCalls(5)
                .build();
        this.redisBreaker = CircuitBreaker.of("ratelimit-redis", cbConfig);
    }

    /**
     * Count one request against {@code bucketKey} and decide whether it fits the policy.
     */
    public Mono<RateLimitDecision> allow(String bucketKey, RateLimitPolicy policy) {
        if (redisTemplate == null) {
            return Mono.fromSupplier(() -> allowLocally(bucketKey, policy));
        }
        String key = KEY_PREFIX + bucketKey;
        return Mono.defer(() -> redisTemplate.opsForValue().increment(key))
                .flatMap(count -> ensureExpiry(key, count, policy.window())
                        .map(ttl -> decide(count, policy, clock.instant().plus(ttl))))
                .timeout(redisTimeout)
                .transformDeferred(CircuitBreakerOperator.of(redisBreaker))
                .onErrorResume(e -> {
                    log.warn("Rate limiter Redis unavailable ({}), using in-memory window: {}",
                            e.getClass().getSimpleName(), e.getMessage());
                    return Mono.fromSupplier(() -> allowLocally(bucketKey, policy));
                });
    }

    /**
     * Returns the remaining TTL of the window, setting it when this request opened the window or
     * when an earlier EXPIRE was lost and the key has no TTL.
     */
    private Mono<Duration> ensureExpiry(String key, long count, Duration window) {
        if (count == 1) {
            return redisTemplate.expire(key, window).thenReturn(window);
        }
        return redisTemplate.getExpire(key)
                .filter(ttl -> !ttl.isZero() && !ttl.isNegative())
                .switchIfEmpty(Mono.defer(() -> redisTemplate.expire(key, window).thenReturn(window)));
    }

    RateLimitDecision allowLocally(String bucketKey, RateLimitPolicy policy) {
        Instant now = clock.instant();
        WindowEntry entry = localWindows.compute(bucketKey, (k, existing) -> {
            if (existing == null || !existing.resetAt().isAfter(now)) {
                return new WindowEntry(new AtomicLong(1), now.plus(policy.window()));
            }
            existing.count().incrementAndGet();
            return existing;
        });
        return decide(entry.count().get(), policy, entry.resetAt());
    }

    private static RateLimitDecision decide(long count, RateLimitPolicy policy, Instant resetAt) {
        int limit = policy.maxRequests();
        return new RateLimitDecision(count <= limit, limit, Math.max(0, limit - count), resetAt);
    }

    /**
     * Drop expired in-memory windows every 5 minutes.
     */
    @Scheduled(fixedRate = 300_000)
    public void cleanupExpiredWindows() {
        Instant now = clock.instant();
        int before = localWindows.size();
        localWindows.entrySet().removeIf(e -> !e.getValue().resetAt().isAfter(now));
        int removed = before - localWindows.size();
        if (removed > 0) {
            log.debug("Removed {} expired in-memory rate limit windows", removed);
        }
    }

    CircuitBreaker.State redisBreakerState() {
        return redisBreaker.getState();
    }

    int localWindowCount() {
        return localWindows.size();
    }
}
