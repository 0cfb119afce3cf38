package dev.blogpulse.service.cache;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("InMemoryAnalyticsCache")
class InMemoryAnalyticsCacheTest {

    private static final Duration TTL = Duration.ofSeconds(60);

    private final AtomicLong nanos = new AtomicLong();
    private final InMemoryAnalyticsCache cache = new InMemoryAnalyticsCache(100, nanos::get);

    private String cached(String key, String value) {
        return cache.getOrCompute(key, TTL, String.class, () -> Mono.just(value)).block();
    }

    @Test
    @DisplayName("Should serve the cached value instead of recomputing")
    void hit() {
        AtomicInteger computations = new AtomicInteger();
        for (int i = 0; i < 3; i++) {
            StepVerifier.create(cache.getOrCompute("traffic:summary:last_7_days", TTL, String.class,
                            () -> Mono.fromSupplier(() -> "v" + computations.incrementAndGet())))
                    .expectNext("v1")
                    .verifyComplete();
        }
        assertThat(computations).hasValue(1);
    }

    @Test
    @DisplayName("Should remove only the keys matching a pattern")
    void patternInvalidation() {
        cached("traffic:summary:last_7_days", "a");
        cached("traffic:events:all", "b");
        cached("sessions:recent:50", "c");

        StepVerifier.create(cache.invalidate("traffic:*")).expectNext(2L).verifyComplete();

        StepVerifier.create(cache.stats())
                .assertNext(stats -> {
                    assertThat(stats.getBackend()).isEqualTo("caffeine");
                    assertThat(stats.getTotalEntries()).isEqualTo(1);
                    assertThat(stats.getEntriesByTopic()).containsOnlyKeys("sessions");
                })
                .verifyComplete();
        assertThat(cached("sessions:recent:50", "fresh")).isEqualTo("c");
        assertThat(cached("traffic:summary:last_7_days", "fresh")).isEqualTo("fresh");
    }

    @Test
    @DisplayName("Should remove a single exact key")
    void exactInvalidation() {
        cached("dashboard:overview", "x");

        StepVerifier.create(cache.invalidate("dashboard:overview")).expectNext(1L).verifyComplete();
        StepVerifier.create(cache.invalidate("dashboard:overview")).expectNext(0L).verifyComplete();
    }

    @Test
    @DisplayName("Should expire entries after their TTL")
    void expiry() {
        cached("dashboard:overview", "old");
        nanos.addAndGet(Duration.ofSeconds(61).toNanos());

        assertThat(cached("dashboard:overview", "new")).isEqualTo("new");
    }

    @Test
    @DisplayName("Should not cache an empty result")
    void emptyNotCached() {
        StepVerifier.create(cache.getOrCompute("blog-analytics:post:1", TTL, String.class, Mono::empty))
                .verifyComplete();

        assertThat(cached("blog-analytics:post:1", "now")).isEqualTo("now");
    }

    @Test
    @DisplayName("Should translate globs to anchored regexes")
    void globs() {
        assertThat(InMemoryAnalyticsCache.globToRegex("traffic:*").matcher("traffic:summary:x").matches()).isTrue();
        assertThat(InMemoryAnalyticsCache.globToRegex("traffic:*").matcher("old-traffic:x").matches()).isFalse();
        assertThat(InMemoryAnalyticsCache.globToRegex("a?c").matcher("abc").matches()).isTrue();
        assertThat(InMemoryAnalyticsCache.globToRegex("a.c").matcher("abc").matches()).isFalse();
    }
}
