package dev.blogpulse.repository;

import dev.blogpulse.entity.PageViewEvent;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.UUID;

@Repository
public interface PageViewEventRepository extends ReactiveCrudRepository<PageViewEvent, Long> {

    @Query("SELECT * FROM page_view_events WHERE session_id = :sessionId ORDER BY occurred_at, id")
    Flux<PageViewEvent> findBySessionIdOrdered(UUID sessionId);

    @Query("SELECT COUNT(*) FROM page_view_events WHERE session_id = :sessionId")
    Mono<Long> countBySessionId(UUID sessionId);

    @Query("SELECT COUNT(*) FROM page_view_events WHERE occurred_at >= :since")
    Mono<Long> countSince(LocalDateTime since);

    @Query("""
            SELECT * FROM page_view_events
            WHERE occurred_at >= :since
              AND (CAST(:source AS TEXT) IS NULL OR source = :source)
              AND (CAST(:ref AS TEXT) IS NULL OR referrer ILIKE '%' || :ref || '%')
            ORDER BY occurred_at DESC, id DESC
            LIMIT :limit OFFSET :offset
            """)
    Flux<PageViewEvent> findFiltered(LocalDateTime since, String source, String ref, int limit, long offset);
}
