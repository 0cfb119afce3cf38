package dev.blogpulse.repository;

import dev.blogpulse.dto.ReferrerCount;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Aggregate queries over the raw traffic log and sessions.
 */
public interface TrafficReportRepository {

    /** Page views per stored source value since {@code since}. Categories without views are absent. */
    Mono<Map<String, Long>> countPageViewsBySource(LocalDateTime since);

    Mono<Map<String, Long>> countSessionsBySource(LocalDateTime since);

    /** Raw referrers of page views attributed to {@code other}, most frequent first. */
    Mono<List<ReferrerCount>> topOtherReferrers(LocalDateTime since, int limit);
}
