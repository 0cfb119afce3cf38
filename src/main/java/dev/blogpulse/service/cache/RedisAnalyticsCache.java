package dev.blogpulse.service.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.blogpulse.dto.AnalyticsCacheStats;
import dev.blogpulse.metrics.TrackingMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.ScanOptions;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Supplier;

/**
 * Cache shared by all instances. Values are stored as JSON strings under {@value #PREFIX};
 * pattern invalidation uses SCAN, never KEYS.
 */
@Slf4j
public class RedisAnalyticsCache implements AnalyticsCache {

    static final String PREFIX = "analytics::";

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;
    private final TrackingMetrics metrics;
    private final Duration redisTimeout;

    public RedisAnalyticsCache(ReactiveRedisTemplate<String, String> redisTemplate, ObjectMapper objectMapper,
                               TrackingMetrics metrics, Duration redisTimeout) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.redisTimeout = redisTimeout;
    }

    @Override
    public <T> Mono<T> getOrCompute(String key, Duration ttl, Class<T> type, Supplier<Mono<T>> compute) {
        String redisKey = PREFIX + key;
        return redisTemplate.opsForValue().get(redisKey)
                .timeout(redisTimeout)
                .flatMap(json -> deserialize(json, type, key))
                .doOnNext(v -> log.trace("Analytics cache hit: {}", key))
                .onErrorResume(e -> {
                    log.warn("Analytics cache read failed for {}: {}", key, e.getMessage());
                    metrics.cacheFailure("read");
                    return Mono.empty();
                })
                .switchIfEmpty(Mono.defer(() -> compute.get()
                        .flatMap(value -> store(redisKey, value, ttl).thenReturn(value))));
    }

    private <T> Mono<T> deserialize(String json, Class<T> type, String key) {
        try {
            return Mono.just(objectMapper.readValue(json, type));
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable cache entry {}: {}", key, e.getMessage());
            return Mono.empty();
        }
    }

    private Mono<Boolean> store(String redisKey, Object value, Duration ttl) {
        String json;
        try {
            json = objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize value for {}: {}", redisKey, e.getMessage());
            return Mono.just(false);
        }
        return redisTemplate.opsForValue().set(redisKey, json, ttl)
                .timeout(redisTimeout)
                .onErrorResume(e -> {
                    log.warn("Analytics cache write failed for {}: {}", redisKey, e.getMessage());
                    metrics.cacheFailure("write");
                    return Mono.just(false);
                });
    }

    @Override
    public Mono<Long> invalidate(String keyOrPattern) {
        Mono<Long> removal = AnalyticsCache.isPattern(keyOrPattern)
                ? deleteByPattern(PREFIX + keyOrPattern)
                : redisTemplate.delete(PREFIX + keyOrPattern);
        return removal
                .doOnNext(count -> log.debug("Invalidated {} analytics cache entries for {}", count, keyOrPattern))
                .onErrorResume(e -> {
                    log.warn("Analytics cache invalidation failed for {}: {}", keyOrPattern, e.getMessage());
                    metrics.cacheFailure("invalidate");
                    return Mono.just(0L);
                });
    }

    private Mono<Long> deleteByPattern(String pattern) {
        return redisTemplate.scan(ScanOptions.scanOptions().match(pattern).count(100).build())
                .collectList()
                .flatMap(keys -> keys.isEmpty()
                        ? Mono.just(0L)
                        : redisTemplate.delete(keys.toArray(new String[0])));
    }

    @Override
    public Mono<AnalyticsCacheStats> stats() {
        return redisTemplate.scan(ScanOptions.scanOptions().match(PREFIX + "*").count(100).build())
                .map(k -> AnalyticsCache.topicOf(k.substring(PREFIX.length())))
                .collectList()
                .map(topics -> {
                    Map<String, Long> byTopic = new TreeMap<>();
                    topics.forEach(t -> byTopic.merge(t, 1L, Long::sum));
                    return AnalyticsCacheStats.builder()
                            .backend("redis")
                            .totalEntries(topics.size())
                            .entriesByTopic(byTopic)
                            .build();
                });
    }
}
