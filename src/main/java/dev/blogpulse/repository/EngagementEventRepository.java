package dev.blogpulse.repository;

import dev.blogpulse.entity.EngagementEvent;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

@Repository
public interface EngagementEventRepository extends ReactiveCrudRepository<EngagementEvent, Long> {

    @Query("""
            SELECT COUNT(*) FROM blog_engagement_events
            WHERE post_id = :postId AND event_type = :eventType
              AND occurred_at >= :from AND occurred_at < :to
            """)
    Mono<Long> countByTypeBetween(Long postId, String eventType, LocalDateTime from, LocalDateTime to);

    @Query("""
            SELECT COUNT(*) FROM blog_engagement_events
            WHERE post_id = :postId AND event_type = 'scroll_checkpoint' AND metric_value = 100
              AND occurred_at >= :from AND occurred_at < :to
            """)
    Mono<Long> countCompletionsBetween(Long postId, LocalDateTime from, LocalDateTime to);
}
