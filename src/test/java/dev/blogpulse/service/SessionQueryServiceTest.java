package dev.blogpulse.service;

import dev.blogpulse.config.AnalyticsCacheProperties;
import dev.blogpulse.config.ResilienceConfig;
import dev.blogpulse.config.TrackingProperties;
import dev.blogpulse.entity.PageViewEvent;
import dev.blogpulse.entity.SessionState;
import dev.blogpulse.entity.TrackingSession;
import dev.blogpulse.exception.ResourceNotFoundException;
import dev.blogpulse.repository.PageViewEventRepository;
import dev.blogpulse.repository.TrackingSessionRepository;
import dev.blogpulse.service.cache.InMemoryAnalyticsCache;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("SessionQueryService")
class SessionQueryServiceTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 3, 1, 10, 0);

    @Mock
    private TrackingSessionRepository sessionRepository;

    @Mock
    private PageViewEventRepository pageViewEventRepository;

    private SessionQueryService service;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);
        service = new SessionQueryService(sessionRepository, pageViewEventRepository, new InMemoryAnalyticsCache(100),
                AnalyticsCacheProperties.defaults(), TrackingProperties.defaults(), ResilienceConfig.defaults(), clock);
    }

    private static TrackingSession session(LocalDateTime lastSeen) {
        return TrackingSession.builder()
                .id(UUID.randomUUID())
                .visitorId("v1")
                .source("google")
                .landingPath("/")
                .startedAt(lastSeen.minusMinutes(10))
                .lastSeenAt(lastSeen)
                .pageCount(3)
                .userAgent("Mozilla/5.0")
                .ip("203.0.113.0")
                .newRecord(false)
                .build();
    }

    @Test
    @DisplayName("Should derive state and duration for each session")
    void listDerivesState() {
        TrackingSession active = session(NOW.minusMinutes(5));
        TrackingSession idle = session(NOW.minusHours(2));
        when(sessionRepository.findFiltered("google", null, null, 50, 0L)).thenReturn(Flux.just(active, idle));

        StepVerifier.create(service.listSessions(" Google ", null, "", 50, 0))
                .assertNext(page -> {
                    assertThat(page.getSessions()).hasSize(2);
                    assertThat(page.getSessions().get(0).getState()).isEqualTo(SessionState.ACTIVE);
                    assertThat(page.getSessions().get(1).getState()).isEqualTo(SessionState.ENDED);
                    assertThat(page.getSessions().get(0).getDurationSeconds()).isEqualTo(600L);
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("Should serve the unfiltered first page from the cache")
    void firstPageCached() {
        when(sessionRepository.findFiltered(null, null, null, 20, 0L)).thenReturn(Flux.just(session(NOW)));

        service.listSessions(null, null, null, 20, 0).block();
        service.listSessions(null, null, null, 20, 0).block();

        verify(sessionRepository, times(1)).findFiltered(null, null, null, 20, 0L);
    }

    @Test
    @DisplayName("Should clamp the page size")
    void clampsLimit() {
        when(sessionRepository.findFiltered(any(), any(), any(), anyInt(), anyLong())).thenReturn(Flux.empty());

        StepVerifier.create(service.listSessions(null, "user-1", null, 10_000, -5))
                .assertNext(page -> {
                    assertThat(page.getLimit()).isEqualTo(SessionQueryService.MAX_LIMIT);
                    assertThat(page.getOffset()).isZero();
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("Should include device details and the event count in the detail view")
    void detail() {
        TrackingSession stored = session(NOW.minusMinutes(1));
        when(sessionRepository.findById(stored.getId())).thenReturn(Mono.just(stored));
        when(pageViewEventRepository.countBySessionId(stored.getId())).thenReturn(Mono.just(3L));

        StepVerifier.create(service.getSession(stored.getId()))
                .assertNext(response -> {
                    assertThat(response.getEventsCount()).isEqualTo(3L);
                    assertThat(response.getUserAgent()).isEqualTo("Mozilla/5.0");
                    assertThat(response.getIp()).isEqualTo("203.0.113.0");
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("Should fail with not found for an unknown session")
    void unknownSession() {
        UUID id = UUID.randomUUID();
        when(sessionRepository.findById(id)).thenReturn(Mono.empty());

        StepVerifier.create(service.getSession(id)).expectError(ResourceNotFoundException.class).verify();
    }

    @Test
    @DisplayName("Should list the session's page views")
    void events() {
        TrackingSession stored = session(NOW);
        PageViewEvent first = PageViewEvent.builder().id(1L).sessionId(stored.getId()).path("/").occurredAt(NOW).build();
        PageViewEvent second = PageViewEvent.builder().id(2L).sessionId(stored.getId()).path("/blog").occurredAt(NOW).build();
        when(sessionRepository.findById(stored.getId())).thenReturn(Mono.just(stored));
        when(pageViewEventRepository.findBySessionIdOrdered(stored.getId())).thenReturn(Flux.just(first, second));

        StepVerifier.create(service.getSessionEvents(stored.getId()))
                .assertNext(events -> assertThat(events).hasSize(2))
                .verifyComplete();
    }
}
