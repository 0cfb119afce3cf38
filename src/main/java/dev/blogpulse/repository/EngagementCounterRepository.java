package dev.blogpulse.repository;

import dev.blogpulse.entity.SourceCategory;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.Collection;

/**
 * Atomic write side of {@code blog_post_analytics}. Every method is a single statement that
 * increments in place, so concurrent beacons for the same post never lose updates.
 */
public interface EngagementCounterRepository {

    /** Create the stats row for a post if it does not exist yet. */
    Mono<Void> ensureRow(Long postId, LocalDateTime now);

    Mono<Long> recordView(Long postId, SourceCategory source, boolean uniqueVisitor, LocalDateTime now);

    /**
     * Add one to each named counter column.
     *
     * @throws IllegalArgumentException when a column is not a counter of the stats table
     */
    Mono<Long> increment(Long postId, Collection<String> counterColumns, LocalDateTime now);

    /** Fold one time-on-page sample into the running mean. */
    Mono<Long> recordTimeSample(Long postId, long seconds, LocalDateTime now);

    Mono<Long> reset(Long postId, LocalDateTime now);
}
