package dev.blogpulse.repository;

import dev.blogpulse.dto.TimelinePoint;
import lombok.RequiredArgsConstructor;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

@Repository
@RequiredArgsConstructor
public class BlogReportRepositoryImpl implements BlogReportRepository {

    private final DatabaseClient databaseClient;

    @Override
    public Mono<AudienceCounts> audience(Long postId) {
        return databaseClient.sql("""
                SELECT COUNT(DISTINCT e.visitor_id) AS total_visitors,
                       COUNT(DISTINCT e.visitor_id) FILTER (
                           WHERE v.created_at >= e.occurred_at - INTERVAL '30 minutes') AS new_visitors,
                       COUNT(*) FILTER (WHERE v.user_id IS NULL) AS anonymous_views,
                       COUNT(*) FILTER (WHERE v.user_id IS NOT NULL) AS registered_views,
                       COUNT(DISTINCT v.user_id) AS unique_users
                FROM blog_engagement_events e
                LEFT JOIN visitors v ON v.id = e.visitor_id
                WHERE e.post_id = :postId AND e.event_type = 'view'
                """)
                .bind("postId", postId)
                .map((row, meta) -> new AudienceCounts(
                        longValue(row.get("total_visitors", Long.class)),
                        longValue(row.get("new_visitors", Long.class)),
                        longValue(row.get("anonymous_views", Long.class)),
                        longValue(row.get("registered_views", Long.class)),
                        longValue(row.get("unique_users", Long.class))))
                .one()
                .defaultIfEmpty(new AudienceCounts(0, 0, 0, 0, 0));
    }

    @Override
    public Mono<Map<String, Long>> timeOnPageBuckets(Long postId) {
        return databaseClient.sql("""
                SELECT CASE
                           WHEN metric_value < 30 THEN '0-30s'
                           WHEN metric_value < 60 THEN '30s-1m'
                           WHEN metric_value < 120 THEN '1-2m'
                           WHEN metric_value < 300 THEN '2-5m'
                           ELSE '5m+'
                       END AS bucket,
                       COUNT(*) AS cnt
                FROM blog_engagement_events
                WHERE post_id = :postId AND event_type = 'time_on_page' AND metric_value IS NOT NULL
                GROUP BY bucket
                """)
                .bind("postId", postId)
                .map((row, meta) -> Map.entry(row.get("bucket", String.class), row.get("cnt", Long.class)))
                .all()
                .collect(HashMap::new, (map, entry) -> map.put(entry.getKey(), entry.getValue()));
    }

    @Override
    public Mono<Map<String, Long>> countByEventType(Long postId) {
        return databaseClient.sql("""
                SELECT event_type, COUNT(*) AS cnt
                FROM blog_engagement_events
                WHERE post_id = :postId
                GROUP BY event_type
                """)
                .bind("postId", postId)
                .map((row, meta) -> Map.entry(row.get("event_type", String.class), row.get("cnt", Long.class)))
                .all()
                .collect(HashMap::new, (map, entry) -> map.put(entry.getKey(), entry.getValue()));
    }

    @Override
    public Flux<TimelinePoint> dailyTimeline(Long postId, LocalDateTime since) {
        return databaseClient.sql("""
                SELECT CAST(occurred_at AS DATE) AS day,
                       COUNT(*) FILTER (WHERE event_type = 'view') AS views,
                       COUNT(DISTINCT visitor_id) FILTER (WHERE event_type = 'view') AS unique_visitors,
                       COUNT(*) FILTER (WHERE event_type = 'scroll_checkpoint' AND metric_value = 100) AS completions,
                       AVG(metric_value) FILTER (WHERE event_type = 'time_on_page') AS avg_time,
                       COUNT(*) FILTER (WHERE event_type = 'share') AS shares,
                       COUNT(*) FILTER (WHERE event_type = 'newsletter_signup') AS signups
                FROM blog_engagement_events
                WHERE post_id = :postId AND occurred_at >= :since
                GROUP BY CAST(occurred_at AS DATE)
                ORDER BY day
                """)
                .bind("postId", postId)
                .bind("since", since)
                .map((row, meta) -> {
                    long views = longValue(row.get("views", Long.class));
                    long completions = longValue(row.get("completions", Long.class));
                    Number avgTime = row.get("avg_time", Number.class);
                    return TimelinePoint.builder()
                            .date(row.get("day", LocalDate.class))
                            .views(views)
                            .uniqueVisitors(longValue(row.get("unique_visitors", Long.class)))
                            .completions(completions)
                            .engagementRate(views > 0 ? Math.min(1.0, (double) completions / views) : 0.0)
                            .avgTimeOnPage(avgTime != null ? avgTime.doubleValue() : 0.0)
                            .shares(longValue(row.get("shares", Long.class)))
                            .newsletterSignups(longValue(row.get("signups", Long.class)))
                            .build();
                })
                .all();
    }

    @Override
    public Mono<Long> countViewsSince(LocalDateTime since) {
        return databaseClient.sql("""
                SELECT COUNT(*) AS cnt FROM blog_engagement_events
                WHERE event_type = 'view' AND occurred_at >= :since
                """)
                .bind("since", since)
                .map((row, meta) -> longValue(row.get("cnt", Long.class)))
                .one()
                .defaultIfEmpty(0L);
    }

    @Override
    public Flux<PostViews> topPostsByViewsSince(LocalDateTime since, int limit) {
        return databaseClient.sql("""
                SELECT post_id, COUNT(*) AS cnt
                FROM blog_engagement_events
                WHERE event_type = 'view' AND occurred_at >= :since
                GROUP BY post_id
                ORDER BY cnt DESC
                LIMIT :limit
                """)
                .bind("since", since)
                .bind("limit", limit)
                .map((row, meta) -> new PostViews(row.get("post_id", Long.class), longValue(row.get("cnt", Long.class))))
                .all();
    }

    private static long longValue(Long value) {
        return value != null ? value : 0L;
    }
}
