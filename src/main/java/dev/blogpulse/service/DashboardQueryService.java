package dev.blogpulse.service;

import dev.blogpulse.config.AnalyticsCacheProperties;
import dev.blogpulse.config.ResilienceConfig;
import dev.blogpulse.config.TrackingProperties;
import dev.blogpulse.dto.DashboardOverview;
import dev.blogpulse.metrics.TrackingMetrics;
import dev.blogpulse.repository.PageViewEventRepository;
import dev.blogpulse.repository.TrackingSessionRepository;
import dev.blogpulse.repository.TrafficReportRepository;
import dev.blogpulse.repository.VisitorRepository;
import dev.blogpulse.service.cache.AnalyticsCache;
import dev.blogpulse.service.cache.CacheTopics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Headline numbers for the admin overview page.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DashboardQueryService {

    private final VisitorRepository visitorRepository;
    private final TrackingSessionRepository sessionRepository;
    private final PageViewEventRepository pageViewEventRepository;
    private final TrafficReportRepository trafficReportRepository;
    private final AnalyticsCache analyticsCache;
    private final AnalyticsCacheProperties cacheProperties;
    private final TrackingProperties trackingProperties;
    private final ResilienceConfig resilience;
    private final TrackingMetrics metrics;
    private final Clock clock;

    public Mono<DashboardOverview> overview() {
        return analyticsCache.getOrCompute(CacheTopics.DASHBOARD_OVERVIEW, cacheProperties.getTtl(),
                DashboardOverview.class, this::computeOverview);
    }

    private Mono<DashboardOverview> computeOverview() {
        return Mono.defer(() -> {
            LocalDateTime now = LocalDateTime.now(clock);
            LocalDateTime dayAgo = now.minusHours(24);
            LocalDateTime weekAgo = now.minusDays(7);
            return Mono.zip(
                            visitorRepository.count(),
                            visitorRepository.countCreatedSince(dayAgo),
                            sessionRepository.countStartedSince(dayAgo),
                            pageViewEventRepository.countSince(dayAgo),
                            sessionRepository.countActive(now.minus(trackingProperties.getSessionTimeout())),
                            trafficReportRepository.countSessionsBySource(weekAgo),
                            trafficReportRepository.topOtherReferrers(weekAgo, TrafficQueryService.TOP_REFERRERS))
                    .map(tuple -> {
                        metrics.setActiveSessions(tuple.getT5());
                        return DashboardOverview.builder()
                                .generatedAt(now)
                                .totalVisitors(tuple.getT1())
                                .newVisitors24h(tuple.getT2())
                                .sessions24h(tuple.getT3())
                                .pageViews24h(tuple.getT4())
                                .activeSessions(tuple.getT5())
                                .sessionsBySource7d(TrafficQueryService.withAllCategories(tuple.getT6()))
                                .topOtherReferrers7d(tuple.getT7())
                                .build();
                    });
        }).timeout(resilience.getQueryTimeout()).retryWhen(resilience.queryRetry());
    }
}
