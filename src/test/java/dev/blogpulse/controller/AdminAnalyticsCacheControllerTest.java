package dev.blogpulse.controller;

import dev.blogpulse.dto.AnalyticsCacheStats;
import dev.blogpulse.service.cache.AnalyticsCache;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AdminAnalyticsCacheControllerTest {

    @Mock
    private AnalyticsCache analyticsCache;

    @InjectMocks
    private AdminAnalyticsCacheController controller;

    @Nested
    @DisplayName("GET /api/v1/admin/analytics-cache/stats")
    class GetCacheStats {

        @Test
        @DisplayName("Should return cache statistics")
        void shouldReturnCacheStats() {
            AnalyticsCacheStats stats = AnalyticsCacheStats.builder()
                    .backend("caffeine")
                    .totalEntries(3)
                    .entriesByTopic(Map.of("traffic", 2L, "sessions", 1L))
                    .build();
            when(analyticsCache.stats()).thenReturn(Mono.just(stats));

            StepVerifier.create(controller.getCacheStats())
                    .assertNext(response -> {
                        assertThat(response.getStatusCode().value()).isEqualTo(200);
                        assertThat(response.getBody()).isNotNull();
                        assertThat(response.getBody().getTotalEntries()).isEqualTo(3);
                        assertThat(response.getBody().getBackend()).isEqualTo("caffeine");
                    })
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("DELETE /api/v1/admin/analytics-cache")
    class Invalidate {

        @Test
        @DisplayName("Should invalidate the matching entries")
        void shouldInvalidatePattern() {
            when(analyticsCache.invalidate("traffic:*")).thenReturn(Mono.just(2L));

            StepVerifier.create(controller.invalidate("traffic:*"))
                    .assertNext(response -> {
                        assertThat(response.getStatusCode().value()).isEqualTo(200);
                        Map<String, Object> body = response.getBody();
                        assertThat(body).containsEntry("message", "Analytics cache invalidated");
                        assertThat(body).containsEntry("pattern", "traffic:*");
                        assertThat(body).containsEntry("entriesRemoved", 2L);
                    })
                    .verifyComplete();
        }
    }
}
