package dev.blogpulse.repository;

import dev.blogpulse.dto.ReferrerCount;
import lombok.RequiredArgsConstructor;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Repository
@RequiredArgsConstructor
public class TrafficReportRepositoryImpl implements TrafficReportRepository {

    private final DatabaseClient databaseClient;

    @Override
    public Mono<Map<String, Long>> countPageViewsBySource(LocalDateTime since) {
        return groupCount("""
                SELECT COALESCE(source, 'other') AS source, COUNT(*) AS cnt
                FROM page_view_events
                WHERE occurred_at >= :since
                GROUP BY COALESCE(source, 'other')
                """, since);
    }

    @Override
    public Mono<Map<String, Long>> countSessionsBySource(LocalDateTime since) {
        return groupCount("""
                SELECT COALESCE(source, 'other') AS source, COUNT(*) AS cnt
                FROM user_sessions
                WHERE started_at >= :since
                GROUP BY COALESCE(source, 'other')
                """, since);
    }

    @Override
    public Mono<List<ReferrerCount>> topOtherReferrers(LocalDateTime since, int limit) {
        return databaseClient.sql("""
                SELECT referrer, COUNT(*) AS cnt
                FROM page_view_events
                WHERE occurred_at >= :since AND source = 'other'
                  AND referrer IS NOT NULL AND referrer <> ''
                GROUP BY referrer
                ORDER BY cnt DESC, referrer
                LIMIT :limit
                """)
                .bind("since", since)
                .bind("limit", limit)
                .map((row, meta) -> ReferrerCount.builder()
                        .referrer(row.get("referrer", String.class))
                        .count(row.get("cnt", Long.class))
                        .build())
                .all()
                .collectList();
    }

    private Mono<Map<String, Long>> groupCount(String sql, LocalDateTime since) {
        return databaseClient.sql(sql)
                .bind("since", since)
                .map((row, meta) -> Map.entry(row.get("source", String.class), row.get("cnt", Long.class)))
                .all()
                .collect(HashMap::new, (map, entry) -> map.put(entry.getKey(), entry.getValue()));
    }
}
