package dev.blogpulse.repository;

import dev.blogpulse.entity.TrackingSession;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.UUID;

@Repository
public interface TrackingSessionRepository extends ReactiveCrudRepository<TrackingSession, UUID> {

    @Query("""
            SELECT * FROM user_sessions
            WHERE visitor_id = :visitorId
            ORDER BY last_seen_at DESC, started_at DESC
            LIMIT 1
            """)
    Mono<TrackingSession> findLatestByVisitorId(String visitorId);

    /**
     * Extend a session in place. {@code source} and {@code landing_path} are not touched.
     *
     * @return 0 when the session was ended concurrently
     */
    @Modifying
    @Query("""
            UPDATE user_sessions
            SET last_seen_at = :now,
                page_count = page_count + 1,
                user_id = COALESCE(user_id, CAST(:userId AS TEXT))
            WHERE id = :id AND ended_at IS NULL
            """)
    Mono<Long> touch(UUID id, String userId, LocalDateTime now);

    @Modifying
    @Query("UPDATE user_sessions SET ended_at = COALESCE(ended_at, :endedAt) WHERE id = :id")
    Mono<Long> markEnded(UUID id, LocalDateTime endedAt);

    @Query("""
            SELECT * FROM user_sessions
            WHERE (CAST(:source AS TEXT) IS NULL OR source = :source)
              AND (CAST(:userId AS TEXT) IS NULL OR user_id = :userId)
              AND (CAST(:visitorId AS TEXT) IS NULL OR visitor_id = :visitorId)
            ORDER BY started_at DESC
            LIMIT :limit OFFSET :offset
            """)
    Flux<TrackingSession> findFiltered(String source, String userId, String visitorId, int limit, long offset);

    @Query("""
            SELECT COUNT(*) FROM user_sessions
            WHERE ended_at IS NULL AND last_seen_at >= :idleCutoff
            """)
    Mono<Long> countActive(LocalDateTime idleCutoff);

    @Query("SELECT COUNT(*) FROM user_sessions WHERE started_at >= :since")
    Mono<Long> countStartedSince(LocalDateTime since);
}
