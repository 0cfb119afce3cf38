package dev.blogpulse.repository;

import dev.blogpulse.entity.SourceCategory;
import lombok.RequiredArgsConstructor;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Set;
import java.util.stream.Collectors;

@Repository
@RequiredArgsConstructor
public class EngagementCounterRepositoryImpl implements EngagementCounterRepository {

    // Column names are spliced into SQL, so only these are accepted.
    static final Set<String> COUNTER_COLUMNS = Set.of(
            "scroll_25_percent", "scroll_50_percent", "scroll_75_percent", "scroll_100_percent",
            "total_shares", "twitter_shares", "facebook_shares", "linkedin_shares", "copy_link_shares",
            "cta_clicks", "outbound_clicks", "newsletter_signups");

    private static final String ENSURE_ROW = """
            INSERT INTO blog_post_analytics (post_id, last_updated_at)
            VALUES (:postId, :now)
            ON CONFLICT (post_id) DO NOTHING
            """;

    private static final String RECORD_VIEW = """
            UPDATE blog_post_analytics
            SET total_views = total_views + 1,
                unique_visitors = unique_visitors + :uniqueIncrement,
                %1$s = %1$s + 1,
                first_view_at = COALESCE(first_view_at, :now),
                last_view_at = :now,
                last_updated_at = :now
            WHERE post_id = :postId
            """;

    // Every right-hand side reads the pre-update row, so n is the old sample count.
    private static final String RECORD_TIME_SAMPLE = """
            UPDATE blog_post_analytics
            SET avg_time_on_page = avg_time_on_page + (:sample - avg_time_on_page) / (time_samples + 1),
                time_samples = time_samples + 1,
                total_time_spent = total_time_spent + :seconds,
                last_updated_at = :now
            WHERE post_id = :postId
            """;

    private static final String RESET = """
            UPDATE blog_post_analytics
            SET total_views = 0, unique_visitors = 0,
                scroll_25_percent = 0, scroll_50_percent = 0, scroll_75_percent = 0, scroll_100_percent = 0,
                total_shares = 0, twitter_shares = 0, facebook_shares = 0, linkedin_shares = 0,
                copy_link_shares = 0, cta_clicks = 0, outbound_clicks = 0, newsletter_signups = 0,
                source_direct = 0, source_google = 0, source_instagram = 0, source_facebook = 0,
                source_youtube = 0, source_other = 0,
                time_samples = 0, avg_time_on_page = 0, total_time_spent = 0,
                first_view_at = NULL, last_view_at = NULL, last_updated_at = :now
            WHERE post_id = :postId
            """;

    private final DatabaseClient databaseClient;

    @Override
    public Mono<Void> ensureRow(Long postId, LocalDateTime now) {
        return databaseClient.sql(ENSURE_ROW)
                .bind("postId", postId)
                .bind("now", now)
                .fetch()
                .rowsUpdated()
                .then();
    }

    @Override
    public Mono<Long> recordView(Long postId, SourceCategory source, boolean uniqueVisitor, LocalDateTime now) {
        return databaseClient.sql(RECORD_VIEW.formatted(sourceColumn(source)))
                .bind("uniqueIncrement", uniqueVisitor ? 1 : 0)
                .bind("now", now)
                .bind("postId", postId)
                .fetch()
                .rowsUpdated();
    }

    @Override
    public Mono<Long> increment(Long postId, Collection<String> counterColumns, LocalDateTime now) {
        if (counterColumns.isEmpty()) {
            return Mono.just(0L);
        }
        for (String column : counterColumns) {
            if (!COUNTER_COLUMNS.contains(column)) {
                return Mono.error(new IllegalArgumentException("Not a counter column: " + column));
            }
        }
        String assignments = counterColumns.stream()
                .distinct()
                .map(c -> c + " = " + c + " + 1")
                .collect(Collectors.joining(", "));
        return databaseClient.sql("UPDATE blog_post_analytics SET " + assignments
                        + ", last_updated_at = :now WHERE post_id = :postId")
                .bind("now", now)
                .bind("postId", postId)
                .fetch()
                .rowsUpdated();
    }

    @Override
    public Mono<Long> recordTimeSample(Long postId, long seconds, LocalDateTime now) {
        return databaseClient.sql(RECORD_TIME_SAMPLE)
                .bind("sample", (double) seconds)
                .bind("seconds", seconds)
                .bind("now", now)
                .bind("postId", postId)
                .fetch()
                .rowsUpdated();
    }

    @Override
    public Mono<Long> reset(Long postId, LocalDateTime now) {
        return databaseClient.sql(RESET)
                .bind("now", now)
                .bind("postId", postId)
                .fetch()
                .rowsUpdated();
    }

    static String sourceColumn(SourceCategory source) {
        return "source_" + (source != null ? source : SourceCategory.OTHER).value();
    }
}
