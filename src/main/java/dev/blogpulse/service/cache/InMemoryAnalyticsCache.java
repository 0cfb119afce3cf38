package dev.blogpulse.service.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import dev.blogpulse.dto.AnalyticsCacheStats;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Single-instance cache backed by Caffeine with a TTL per entry.
 * Used when Redis is not configured ({@code spring.cache.type != redis}).
 */
@Slf4j
public class InMemoryAnalyticsCache implements AnalyticsCache {

    private record Entry(Object value, Duration ttl) {}

    private final Cache<String, Entry> cache;

    public InMemoryAnalyticsCache(long maximumSize) {
        this(maximumSize, Ticker.systemTicker());
    }

    public InMemoryAnalyticsCache(long maximumSize, Ticker ticker) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .ticker(ticker)
                .expireAfter(new Expiry<String, Entry>() {
                    @Override
                    public long expireAfterCreate(String key, Entry entry, long currentTime) {
                        return entry.ttl().toNanos();
                    }

                    @Override
                    public long expireAfterUpdate(String key, Entry entry, long currentTime, long currentDuration) {
                        return entry.ttl().toNanos();
                    }

                    @Override
                    public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
                        return currentDuration;
                    }
                })
                .build();
    }

    @Override
    public <T> Mono<T> getOrCompute(String key, Duration ttl, Class<T> type, Supplier<Mono<T>> compute) {
        return Mono.defer(() -> {
            Entry cached = cache.getIfPresent(key);
            if (cached != null && type.isInstance(cached.value())) {
                log.trace("Analytics cache hit: {}", key);
                return Mono.just(type.cast(cached.value()));
            }
            return compute.get()
                    .doOnNext(value -> cache.put(key, new Entry(value, ttl)));
        });
    }

    @Override
    public Mono<Long> invalidate(String keyOrPattern) {
        return Mono.fromSupplier(() -> {
            if (!AnalyticsCache.isPattern(keyOrPattern)) {
                boolean present = cache.asMap().remove(keyOrPattern) != null;
                return present ? 1L : 0L;
            }
            Pattern regex = globToRegex(keyOrPattern);
            List<String> matches = cache.asMap().keySet().stream()
                    .filter(k -> regex.matcher(k).matches())
                    .toList();
            cache.invalidateAll(matches);
            long removed = matches.size();
            log.debug("Invalidated {} analytics cache entries for {}", removed, keyOrPattern);
            return removed;
        });
    }

    @Override
    public Mono<AnalyticsCacheStats> stats() {
        return Mono.fromSupplier(() -> {
            cache.cleanUp();
            Map<String, Long> byTopic = new TreeMap<>();
            cache.asMap().keySet().forEach(k -> byTopic.merge(AnalyticsCache.topicOf(k), 1L, Long::sum));
            long total = byTopic.values().stream().mapToLong(Long::longValue).sum();
            return AnalyticsCacheStats.builder()
                    .backend("caffeine")
                    .totalEntries(total)
                    .entriesByTopic(byTopic)
                    .build();
        });
    }

    static Pattern globToRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        for (char c : glob.toCharArray()) {
            switch (c) {
                case '*' -> regex.append(".*");
                case '?' -> regex.append('.');
                default -> regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return Pattern.compile(regex.toString());
    }
}
