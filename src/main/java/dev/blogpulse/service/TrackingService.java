package dev.blogpulse.service;

import dev.blogpulse.config.ResilienceConfig;
import dev.blogpulse.config.TrackingProperties;
import dev.blogpulse.dto.EngagementEventRequest;
import dev.blogpulse.entity.PageViewEvent;
import dev.blogpulse.entity.SourceCategory;
import dev.blogpulse.metrics.TrackingMetrics;
import dev.blogpulse.repository.PageViewEventRepository;
import dev.blogpulse.service.cache.AnalyticsCache;
import dev.blogpulse.service.cache.CacheTopics;
import dev.blogpulse.util.Attribution;
import dev.blogpulse.util.SourceAttributor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;

/**
 * Ingestion pipeline behind the tracking endpoints: attribution, visitor, session, event log and
 * cache invalidation.
 * <p>
 * Tracking is fire-and-forget for the browser. Each stage has its own timeout and error boundary,
 * and the returned {@link Mono} never errors. When the visitor or session stage fails the beacon is
 * still written to the traffic log without a session.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TrackingService {

    private final VisitorService visitorService;
    private final SessionTrackingService sessionTrackingService;
    private final EngagementService engagementService;
    private final PageViewEventRepository pageViewEventRepository;
    private final AnalyticsCache analyticsCache;
    private final TrackingProperties properties;
    private final ResilienceConfig resilience;
    private final TrackingMetrics metrics;
    private final Clock clock;

    /**
     * Process a page view beacon.
     *
     * @return the visitor id to store in the visitor cookie, or empty when the visitor could not be resolved
     */
    public Mono<String> trackPageView(Beacon beacon) {
        LocalDateTime now = LocalDateTime.now(clock);
        Attribution firstContact = SourceAttributor.classify(
                beacon.referrer(), beacon.sourceHint(), properties.getSiteOrigin(), true);

        return stage("visitor", visitorService.identify(
                        beacon.visitorToken(), firstContact, beacon.path(), beacon.userId(), now))
                .flatMap(identity -> stage("session", sessionTrackingService.recordPageView(toPageView(identity, beacon, now)))
                        .flatMap(result -> {
                            if (result.duplicate()) {
                                metrics.beaconDeduplicated();
                                return Mono.just(identity.visitorId());
                            }
                            return logPageView(beacon, result.sessionId(), result.attribution(), now)
                                    .thenReturn(identity.visitorId());
                        })
                        .switchIfEmpty(Mono.defer(() -> logPageView(beacon, null, firstContact, now)
                                .thenReturn(identity.visitorId()))))
                .switchIfEmpty(Mono.defer(() -> logPageView(beacon, null, firstContact, now).then(Mono.<String>empty())))
                .onErrorResume(e -> {
                    log.error("Unexpected tracking failure for path {}", beacon.path(), e);
                    metrics.stageFailure("pipeline");
                    return Mono.empty();
                });
    }

    /**
     * Explicit end of the visitor's current session.
     */
    public Mono<Void> endSession(String visitorToken) {
        if (!VisitorService.isValidToken(visitorToken)) {
            return Mono.empty();
        }
        LocalDateTime now = LocalDateTime.now(clock);
        return stage("session_end", sessionTrackingService.endSession(visitorToken, now))
                .filter(Boolean::booleanValue)
                .flatMap(ended -> invalidate(CacheTopics.SESSIONS_ALL, CacheTopics.DASHBOARD_ALL))
                .onErrorResume(e -> {
                    log.error("Unexpected failure ending session", e);
                    metrics.stageFailure("pipeline");
                    return Mono.empty();
                })
                .then();
    }

    /**
     * Record a reader engagement event for a post. Source and session come from the visitor's
     * active session; without one the referrer and the payload's {@code source} hint are classified.
     */
    public Mono<Void> trackEngagement(Long postId, EngagementEventRequest request, String visitorToken,
                                      String refererHeader) {
        LocalDateTime now = LocalDateTime.now(clock);
        String visitorId = VisitorService.isValidToken(visitorToken) ? visitorToken : null;
        Map<String, Object> data = request.getEventData() != null ? request.getEventData() : Map.of();

        return stage("session_lookup", sessionTrackingService.findActiveSession(visitorId, now))
                .map(session -> new EngagementContext(visitorId, session.getId().toString(),
                        SourceCategory.fromValue(session.getSource()).orElse(SourceCategory.OTHER), now))
                .switchIfEmpty(Mono.fromSupplier(() -> {
                    Object hint = data.get("source");
                    Attribution attribution = SourceAttributor.classify(refererHeader,
                            hint != null ? hint.toString() : null, properties.getSiteOrigin(), true);
                    String sessionId = data.get("session_id") != null ? data.get("session_id").toString() : null;
                    return new EngagementContext(visitorId, sessionId, attribution.category(), now);
                }))
                .flatMap(context -> stage("engagement",
                        engagementService.recordEvent(postId, request.getEventType(), data, context)))
                .onErrorResume(e -> {
                    log.error("Unexpected engagement tracking failure for post {}", postId, e);
                    metrics.stageFailure("pipeline");
                    return Mono.empty();
                })
                .then();
    }

    private PageView toPageView(VisitorIdentity identity, Beacon beacon, LocalDateTime now) {
        return new PageView(identity.visitorId(), beacon.userId(), beacon.path(), beacon.referrer(),
                beacon.sourceHint(), beacon.userAgent(), beacon.ip(), now);
    }

    private Mono<Void> logPageView(Beacon beacon, UUID sessionId, Attribution attribution, LocalDateTime now) {
        PageViewEvent event = PageViewEvent.builder()
                .sessionId(sessionId)
                .occurredAt(now)
                .path(beacon.path())
                .referrer(beacon.referrer())
                .source(attribution.category().value())
                .ip(beacon.ip())
                .userAgent(beacon.userAgent())
                .build();
        return stage("event_log", pageViewEventRepository.save(event))
                .doOnNext(saved -> {
                    metrics.beaconAccepted();
                    log.debug("Page view {} logged (session={}, source={})",
                            beacon.path(), sessionId, event.getSource());
                })
                .then(invalidate(CacheTopics.TRAFFIC_ALL, CacheTopics.SESSIONS_ALL, CacheTopics.DASHBOARD_ALL));
    }

    private Mono<Void> invalidate(String... patterns) {
        return stage("cache", Flux.fromArray(patterns)
                .flatMap(analyticsCache::invalidate)
                .then(Mono.just(true)))
                .then();
    }

    /**
     * Error boundary of one pipeline stage: a failure or timeout is logged, counted and turned into empty.
     */
    private <T> Mono<T> stage(String name, Mono<T> work) {
        return work
                .timeout(resilience.getTrackingStageTimeout())
                .onErrorResume(e -> {
                    log.warn("Tracking stage '{}' failed, continuing: {}", name, e.toString());
                    metrics.stageFailure(name);
                    return Mono.empty();
                });
    }
}
