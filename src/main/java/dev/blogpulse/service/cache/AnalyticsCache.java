package dev.blogpulse.service.cache;

import dev.blogpulse.dto.AnalyticsCacheStats;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Read-through cache for aggregate report results.
 * <p>
 * Writers invalidate the topics their write can change; entries also expire after their TTL.
 * A failing cache never fails a read: the value is computed and returned uncached.
 */
public interface AnalyticsCache {

    /**
     * Return the cached value for {@code key}, or run {@code compute}, cache its result for
     * {@code ttl} and return it. An empty compute result is not cached.
     */
    <T> Mono<T> getOrCompute(String key, Duration ttl, Class<T> type, Supplier<Mono<T>> compute);

    /**
     * Remove one key, or every key matching a glob such as {@code traffic:*}.
     *
     * @return number of entries removed
     */
    Mono<Long> invalidate(String keyOrPattern);

    Mono<AnalyticsCacheStats> stats();

    static boolean isPattern(String keyOrPattern) {
        return keyOrPattern.indexOf('*') >= 0 || keyOrPattern.indexOf('?') >= 0;
    }

    static String topicOf(String key) {
        int colon = key.indexOf(':');
        return colon > 0 ? key.substring(0, colon) : key;
    }
}
