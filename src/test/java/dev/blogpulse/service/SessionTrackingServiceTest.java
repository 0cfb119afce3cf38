package dev.blogpulse.service;

import dev.blogpulse.config.TrackingProperties;
import dev.blogpulse.entity.TrackingSession;
import dev.blogpulse.repository.TrackingSessionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.LocalDateTime;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("SessionTrackingService")
class SessionTrackingServiceTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 3, 1, 10, 0);
    private static final String VISITOR = "7f1c2b9e-4d1a-4c5e-9a7b-3e2f1d0c9b8a";

    @Mock
    private TrackingSessionRepository sessionRepository;

    @Mock
    private InteractionDeduplicationService deduplicationService;

    private SessionTrackingService service;

    @BeforeEach
    void setUp() {
        service = new SessionTrackingService(sessionRepository, deduplicationService, TrackingProperties.defaults());
    }

    private static PageView view(String path, String referrer, String hint) {
        return new PageView(VISITOR, null, path, referrer, hint, "Mozilla/5.0", "203.0.113.0", NOW);
    }

    private static TrackingSession openSession(LocalDateTime lastSeen, String source) {
        return TrackingSession.builder()
                .id(UUID.randomUUID())
                .visitorId(VISITOR)
                .source(source)
                .landingPath("/")
                .startedAt(lastSeen.minusMinutes(1))
                .lastSeenAt(lastSeen)
                .newRecord(false)
                .build();
    }

    private void freshView() {
        when(deduplicationService.claimPageView(any(), any())).thenReturn(Mono.just(true));
    }

    private void saveEchoes() {
        when(sessionRepository.save(any(TrackingSession.class)))
                .thenAnswer(inv -> Mono.just(inv.getArgument(0)));
    }

    @Nested
    @DisplayName("recordPageView")
    class RecordPageView {

        @Test
        @DisplayName("Should start a session attributed to the first view")
        void firstViewStartsSession() {
            freshView();
            saveEchoes();
            when(sessionRepository.findLatestByVisitorId(VISITOR)).thenReturn(Mono.empty());

            StepVerifier.create(service.recordPageView(view("/blog/a", "https://www.google.com/", null)))
                    .assertNext(result -> {
                        assertThat(result.newSession()).isTrue();
                        assertThat(result.duplicate()).isFalse();
                        assertThat(result.sessionSource()).isEqualTo("google");
                    })
                    .verifyComplete();

            ArgumentCaptor<TrackingSession> captor = ArgumentCaptor.forClass(TrackingSession.class);
            verify(sessionRepository).save(captor.capture());
            assertThat(captor.getValue().getLandingPath()).isEqualTo("/blog/a");
            assertThat(captor.getValue().getStartedAt()).isEqualTo(NOW);
            assertThat(captor.getValue().getPageCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should continue the session when the gap is within the timeout")
        void shortGapContinues() {
            freshView();
            TrackingSession session = openSession(NOW.minusMinutes(5), "instagram");
            when(sessionRepository.findLatestByVisitorId(VISITOR)).thenReturn(Mono.just(session));
            when(sessionRepository.touch(session.getId(), null, NOW)).thenReturn(Mono.just(1L));

            StepVerifier.create(service.recordPageView(view("/blog/b", "https://www.google.com/", "fb")))
                    .assertNext(result -> {
                        assertThat(result.sessionId()).isEqualTo(session.getId());
                        assertThat(result.newSession()).isFalse();
                        assertThat(result.sessionSource()).isEqualTo("instagram");
                    })
                    .verifyComplete();
            verify(sessionRepository, never()).save(any());
        }

        @Test
        @DisplayName("Should end an idle session at its last activity and start a new one")
        void longGapStartsNewSession() {
            freshView();
            saveEchoes();
            LocalDateTime lastSeen = NOW.minusMinutes(40);
            TrackingSession stale = openSession(lastSeen, "google");
            when(sessionRepository.findLatestByVisitorId(VISITOR)).thenReturn(Mono.just(stale));
            when(sessionRepository.markEnded(stale.getId(), lastSeen)).thenReturn(Mono.just(1L));

            StepVerifier.create(service.recordPageView(view("/blog/c", null, "ig")))
                    .assertNext(result -> {
                        assertThat(result.newSession()).isTrue();
                        assertThat(result.sessionId()).isNotEqualTo(stale.getId());
                        assertThat(result.sessionSource()).isEqualTo("instagram");
                    })
                    .verifyComplete();
            verify(sessionRepository).markEnded(stale.getId(), lastSeen);
        }

        @Test
        @DisplayName("Should never reactivate an explicitly ended session")
        void endedSessionIsNotReused() {
            freshView();
            saveEchoes();
            TrackingSession ended = openSession(NOW.minusMinutes(1), "direct");
            ended.setEndedAt(NOW.minusMinutes(1));
            when(sessionRepository.findLatestByVisitorId(VISITOR)).thenReturn(Mono.just(ended));

            StepVerifier.create(service.recordPageView(view("/", null, null)))
                    .assertNext(result -> assertThat(result.newSession()).isTrue())
                    .verifyComplete();
            verify(sessionRepository, never()).markEnded(any(), any());
        }

        @Test
        @DisplayName("Should drop a duplicate view without touching any session")
        void duplicateView() {
            when(deduplicationService.claimPageView(VISITOR, "/")).thenReturn(Mono.just(false));

            StepVerifier.create(service.recordPageView(view("/", null, null)))
                    .assertNext(result -> {
                        assertThat(result.duplicate()).isTrue();
                        assertThat(result.sessionId()).isNull();
                    })
                    .verifyComplete();
            verifyNoInteractions(sessionRepository);
        }

        @Test
        @DisplayName("Should start a new session when the active one was ended concurrently")
        void touchLostRace() {
            freshView();
            saveEchoes();
            TrackingSession session = openSession(NOW.minusMinutes(2), "direct");
            when(sessionRepository.findLatestByVisitorId(VISITOR)).thenReturn(Mono.just(session));
            when(sessionRepository.touch(session.getId(), null, NOW)).thenReturn(Mono.just(0L));

            StepVerifier.create(service.recordPageView(view("/", null, null)))
                    .assertNext(result -> assertThat(result.newSession()).isTrue())
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should join the session a concurrent request started first")
        void joinsConcurrentStart() {
            freshView();
            TrackingSession winner = openSession(NOW, "google");
            when(sessionRepository.findLatestByVisitorId(VISITOR)).thenReturn(Mono.empty(), Mono.just(winner));
            when(sessionRepository.save(any(TrackingSession.class)))
                    .thenReturn(Mono.error(new DataIntegrityViolationException("uq_user_sessions_open_visitor")));
            when(sessionRepository.touch(winner.getId(), null, NOW)).thenReturn(Mono.just(1L));

            StepVerifier.create(service.recordPageView(view("/", null, null)))
                    .assertNext(result -> {
                        assertThat(result.sessionId()).isEqualTo(winner.getId());
                        assertThat(result.newSession()).isFalse();
                        assertThat(result.sessionSource()).isEqualTo("google");
                    })
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("endSession")
    class EndSession {

        @Test
        @DisplayName("Should end the active session")
        void endsActive() {
            TrackingSession session = openSession(NOW.minusMinutes(3), "direct");
            when(sessionRepository.findLatestByVisitorId(VISITOR)).thenReturn(Mono.just(session));
            when(sessionRepository.markEnded(session.getId(), NOW)).thenReturn(Mono.just(1L));

            StepVerifier.create(service.endSession(VISITOR, NOW)).expectNext(true).verifyComplete();
        }

        @Test
        @DisplayName("Should do nothing when the session already timed out")
        void idleSession() {
            TrackingSession session = openSession(NOW.minusMinutes(31), "direct");
            when(sessionRepository.findLatestByVisitorId(VISITOR)).thenReturn(Mono.just(session));

            StepVerifier.create(service.endSession(VISITOR, NOW)).expectNext(false).verifyComplete();
            verify(sessionRepository, never()).markEnded(any(), any());
        }

        @Test
        @DisplayName("Should ignore requests without a visitor")
        void noVisitor() {
            StepVerifier.create(service.endSession(null, NOW)).expectNext(false).verifyComplete();
            verifyNoInteractions(sessionRepository);
        }
    }
}
