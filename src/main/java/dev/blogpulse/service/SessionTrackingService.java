package dev.blogpulse.service;

import dev.blogpulse.config.TrackingProperties;
import dev.blogpulse.entity.SessionState;
import dev.blogpulse.entity.TrackingSession;
import dev.blogpulse.repository.TrackingSessionRepository;
import dev.blogpulse.util.Attribution;
import dev.blogpulse.util.SourceAttributor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

/**
 * Groups a visitor's page views into sessions.
 * <p>
 * Per visitor: no session, then ACTIVE, then ENDED (explicit end or inactivity), and a later
 * beacon starts a fresh session. An ENDED session is never reactivated. The state is derived
 * with {@link SessionState#of}; nothing sweeps sessions in the background.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionTrackingService {

    private final TrackingSessionRepository sessionRepository;
    private final InteractionDeduplicationService deduplicationService;
    private final TrackingProperties properties;

    public Mono<SessionResult> recordPageView(PageView view) {
        return deduplicationService.claimPageView(view.visitorId(), view.path())
                .flatMap(fresh -> {
                    if (!fresh) {
                        log.debug("Duplicate page view {} for visitor {} dropped", view.path(), view.visitorId());
                        return Mono.just(SessionResult.duplicateView());
                    }
                    return latestSession(view.visitorId())
                            .flatMap(latest -> {
                                TrackingSession session = latest.orElse(null);
                                if (isActive(session, view.occurredAt())) {
                                    return continueSession(session, view);
                                }
                                return closeStale(session).then(startSession(view));
                            });
                });
    }

    /**
     * Explicit departure. Ends the visitor's active session, if any.
     *
     * @return true when a session was ended
     */
    public Mono<Boolean> endSession(String visitorId, LocalDateTime now) {
        return findActiveSession(visitorId, now)
                .flatMap(session -> sessionRepository.markEnded(session.getId(), now))
                .map(updated -> updated > 0)
                .defaultIfEmpty(false)
                .doOnNext(ended -> {
                    if (ended) {
                        log.debug("Session ended by client for visitor {}", visitorId);
                    }
                });
    }

    /** The visitor's session, only when it is still ACTIVE at {@code now}. */
    public Mono<TrackingSession> findActiveSession(String visitorId, LocalDateTime now) {
        if (visitorId == null) {
            return Mono.empty();
        }
        return sessionRepository.findLatestByVisitorId(visitorId)
                .filter(session -> isActive(session, now));
    }

    private Mono<Optional<TrackingSession>> latestSession(String visitorId) {
        return sessionRepository.findLatestByVisitorId(visitorId)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty());
    }

    private Mono<SessionResult> continueSession(TrackingSession session, PageView view) {
        Attribution attribution = attribute(view, false);
        return sessionRepository.touch(session.getId(), view.userId(), view.occurredAt())
                .flatMap(updated -> {
                    if (updated == 0) {
                        // ended between our read and the update
                        return startSession(view);
                    }
                    return Mono.just(new SessionResult(session.getId(), false, session.getSource(), attribution, false));
                });
    }

    private Mono<Void> closeStale(TrackingSession session) {
        if (session == null || session.getEndedAt() != null) {
            return Mono.empty();
        }
        log.debug("Closing idle session {} at its last activity", session.getId());
        return sessionRepository.markEnded(session.getId(), session.getLastSeenAt()).then();
    }

    private Mono<SessionResult> startSession(PageView view) {
        Attribution attribution = attribute(view, true);
        TrackingSession session = TrackingSession.builder()
                .id(UUID.randomUUID())
                .visitorId(view.visitorId())
                .userId(view.userId())
                .source(attribution.category().value())
                .landingPath(view.path())
                .userAgent(view.userAgent())
                .ip(view.ip())
                .startedAt(view.occurredAt())
                .lastSeenAt(view.occurredAt())
                .pageCount(1)
                .build();
        return sessionRepository.save(session)
                .map(saved -> {
                    log.debug("Session {} started for visitor {} (source={})",
                            saved.getId(), view.visitorId(), saved.getSource());
                    return new SessionResult(saved.getId(), true, saved.getSource(), attribution, false);
                })
                // one open session per visitor is enforced by a partial unique index
                .onErrorResume(DataIntegrityViolationException.class, e -> joinConcurrentSession(view));
    }

    private Mono<SessionResult> joinConcurrentSession(PageView view) {
        log.debug("Concurrent session start for visitor {}, joining the winner", view.visitorId());
        return sessionRepository.findLatestByVisitorId(view.visitorId())
                .filter(session -> isActive(session, view.occurredAt()))
                .flatMap(session -> sessionRepository.touch(session.getId(), view.userId(), view.occurredAt())
                        .thenReturn(new SessionResult(session.getId(), false, session.getSource(),
                                attribute(view, false), false)))
                .switchIfEmpty(Mono.error(new IllegalStateException(
                        "No open session for visitor " + view.visitorId() + " after start conflict")));
    }

    private Attribution attribute(PageView view, boolean firstPageView) {
        return SourceAttributor.classify(view.referrer(), view.sourceHint(), properties.getSiteOrigin(), firstPageView);
    }

    private boolean isActive(TrackingSession session, LocalDateTime now) {
        return SessionState.of(session, now, properties.getSessionTimeout()) == SessionState.ACTIVE;
    }
}
