package dev.blogpulse.service;

import dev.blogpulse.config.AnalyticsCacheProperties;
import dev.blogpulse.config.ResilienceConfig;
import dev.blogpulse.dto.PageViewResponse;
import dev.blogpulse.dto.TimeRange;
import dev.blogpulse.dto.TrafficEventsPage;
import dev.blogpulse.dto.TrafficSummary;
import dev.blogpulse.entity.SourceCategory;
import dev.blogpulse.repository.PageViewEventRepository;
import dev.blogpulse.repository.TrafficReportRepository;
import dev.blogpulse.service.cache.AnalyticsCache;
import dev.blogpulse.service.cache.CacheTopics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

@Service
@RequiredArgsConstructor
@Slf4j
public class TrafficQueryService {

    public static final int DEFAULT_RANGE_DAYS = 7;
    public static final int TOP_REFERRERS = 5;

    private final TrafficReportRepository reportRepository;
    private final PageViewEventRepository pageViewEventRepository;
    private final AnalyticsCache analyticsCache;
    private final AnalyticsCacheProperties cacheProperties;
    private final ResilienceConfig resilience;
    private final Clock clock;

    /**
     * Page views per source and the most frequent "other" referrers, cached per range.
     */
    public Mono<TrafficSummary> summary(String range) {
        TimeRange timeRange = TimeRange.parse(range, DEFAULT_RANGE_DAYS);
        return analyticsCache.getOrCompute(CacheTopics.trafficSummary(timeRange.key()), cacheProperties.getTtl(),
                TrafficSummary.class, () -> computeSummary(timeRange));
    }

    private Mono<TrafficSummary> computeSummary(TimeRange range) {
        return Mono.defer(() -> {
            LocalDateTime now = LocalDateTime.now(clock);
            LocalDateTime since = now.minus(range.window());
            log.debug("Computing traffic summary for {}", range.label());
            return Mono.zip(
                            reportRepository.countPageViewsBySource(since),
                            reportRepository.topOtherReferrers(since, TOP_REFERRERS))
                    .map(tuple -> {
                        Map<String, Long> bySource = withAllCategories(tuple.getT1());
                        return TrafficSummary.builder()
                                .range(range.label())
                                .generatedAt(now)
                                .totalPageViews(bySource.values().stream().mapToLong(Long::longValue).sum())
                                .bySource(bySource)
                                .topOtherReferrers(tuple.getT2())
                                .build();
                    });
        }).timeout(resilience.getQueryTimeout()).retryWhen(resilience.queryRetry());
    }

    /**
     * Raw events of the window, newest first, filtered by source and a referrer substring.
     * {@code range} takes precedence over {@code days}.
     */
    public Mono<TrafficEventsPage> events(String source, String ref, Integer days, String range, int limit, int offset) {
        TimeRange timeRange = range != null && !range.isBlank()
                ? TimeRange.parse(range, DEFAULT_RANGE_DAYS)
                : TimeRange.ofDays(days != null ? days : DEFAULT_RANGE_DAYS);
        String sourceFilter = source == null || source.isBlank() ? null : source.trim().toLowerCase(Locale.ROOT);
        String refFilter = ref == null || ref.isBlank() ? null : escapeLike(ref.trim());
        int safeLimit = Math.max(1, Math.min(SessionQueryService.MAX_LIMIT, limit));
        int safeOffset = Math.max(0, offset);

        return Mono.defer(() -> {
            LocalDateTime since = LocalDateTime.now(clock).minus(timeRange.window());
            return Mono.zip(
                    pageViewEventRepository.findFiltered(since, sourceFilter, refFilter, safeLimit, safeOffset)
                            .map(PageViewResponse::from)
                            .collectList(),
                    reportRepository.countPageViewsBySource(since));
        }).map(tuple -> TrafficEventsPage.builder()
                        .events(tuple.getT1())
                        .bySource(withAllCategories(tuple.getT2()))
                        .range(timeRange.label())
                        .limit(safeLimit)
                        .offset(safeOffset)
                        .build())
                .timeout(resilience.getQueryTimeout())
                .retryWhen(resilience.queryRetry());
    }

    static Map<String, Long> withAllCategories(Map<String, Long> counts) {
        Map<String, Long> result = new LinkedHashMap<>();
        for (SourceCategory category : SourceCategory.values()) {
            result.put(category.value(), counts.getOrDefault(category.value(), 0L));
        }
        counts.forEach((key, value) -> result.putIfAbsent(key, value));
        return result;
    }

    private static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}
