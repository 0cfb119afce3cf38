package dev.blogpulse.service;

import dev.blogpulse.config.AnalyticsCacheProperties;
import dev.blogpulse.config.ResilienceConfig;
import dev.blogpulse.config.TrackingProperties;
import dev.blogpulse.dto.PageViewResponse;
import dev.blogpulse.dto.SessionPage;
import dev.blogpulse.dto.SessionResponse;
import dev.blogpulse.entity.TrackingSession;
import dev.blogpulse.exception.ResourceNotFoundException;
import dev.blogpulse.repository.PageViewEventRepository;
import dev.blogpulse.repository.TrackingSessionRepository;
import dev.blogpulse.service.cache.AnalyticsCache;
import dev.blogpulse.service.cache.CacheTopics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class SessionQueryService {

    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 200;

    private final TrackingSessionRepository sessionRepository;
    private final PageViewEventRepository pageViewEventRepository;
    private final AnalyticsCache analyticsCache;
    private final AnalyticsCacheProperties cacheProperties;
    private final TrackingProperties trackingProperties;
    private final ResilienceConfig resilience;
    private final Clock clock;

    /**
     * Sessions newest first. The unfiltered first page is served from the cache.
     */
    public Mono<SessionPage> listSessions(String source, String userId, String visitorId, int limit, int offset) {
        int safeLimit = Math.max(1, Math.min(MAX_LIMIT, limit));
        int safeOffset = Math.max(0, offset);
        String sourceFilter = blankToNull(source) != null ? source.trim().toLowerCase(Locale.ROOT) : null;
        String userFilter = blankToNull(userId);
        String visitorFilter = blankToNull(visitorId);

        Mono<SessionPage> query = Mono.defer(() -> {
            LocalDateTime now = LocalDateTime.now(clock);
            return sessionRepository.findFiltered(sourceFilter, userFilter, visitorFilter, safeLimit, safeOffset)
                    .map(session -> SessionResponse.from(session, now, trackingProperties.getSessionTimeout()))
                    .collectList()
                    .map(sessions -> SessionPage.builder()
                            .sessions(sessions)
                            .limit(safeLimit)
                            .offset(safeOffset)
                            .build());
        }).timeout(resilience.getQueryTimeout()).retryWhen(resilience.queryRetry());

        boolean unfilteredFirstPage = sourceFilter == null && userFilter == null && visitorFilter == null && safeOffset == 0;
        if (!unfilteredFirstPage) {
            return query;
        }
        return analyticsCache.getOrCompute(CacheTopics.SESSIONS_RECENT + ":" + safeLimit,
                cacheProperties.getTtl(), SessionPage.class, () -> query);
    }

    public Mono<SessionResponse> getSession(UUID sessionId) {
        return findSession(sessionId)
                .flatMap(session -> pageViewEventRepository.countBySessionId(sessionId)
                        .defaultIfEmpty(0L)
                        .map(count -> {
                            SessionResponse response = SessionResponse.from(session, LocalDateTime.now(clock),
                                    trackingProperties.getSessionTimeout());
                            response.setUserAgent(session.getUserAgent());
                            response.setIp(session.getIp());
                            response.setEventsCount(count);
                            return response;
                        }));
    }

    /** The session's page views in arrival order. */
    public Mono<List<PageViewResponse>> getSessionEvents(UUID sessionId) {
        return findSession(sessionId)
                .flatMap(session -> pageViewEventRepository.findBySessionIdOrdered(sessionId)
                        .map(PageViewResponse::from)
                        .collectList());
    }

    private Mono<TrackingSession> findSession(UUID sessionId) {
        return sessionRepository.findById(sessionId)
                .timeout(resilience.getQueryTimeout())
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Session", sessionId)));
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
