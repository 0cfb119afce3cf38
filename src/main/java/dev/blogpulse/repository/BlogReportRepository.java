package dev.blogpulse.repository;

import dev.blogpulse.dto.TimelinePoint;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Aggregate queries over the raw engagement log ({@code blog_engagement_events}).
 */
public interface BlogReportRepository {

    /**
     * Reader mix of one post's view events. A visitor counts as new when its row was created
     * within 30 minutes before the view.
     */
    record AudienceCounts(long totalVisitors, long newVisitors, long anonymousViews,
                          long registeredViews, long uniqueUsers) {
    }

    record PostViews(Long postId, long views) {
    }

    Mono<AudienceCounts> audience(Long postId);

    /** Time-on-page samples per bucket label ({@code 0-30s}, {@code 30s-1m}, ...). */
    Mono<Map<String, Long>> timeOnPageBuckets(Long postId);

    Mono<Map<String, Long>> countByEventType(Long postId);

    /** One point per day with activity since {@code since}, oldest first. */
    Flux<TimelinePoint> dailyTimeline(Long postId, LocalDateTime since);

    /** Views since {@code since} across all posts. */
    Mono<Long> countViewsSince(LocalDateTime since);

    Flux<PostViews> topPostsByViewsSince(LocalDateTime since, int limit);
}
