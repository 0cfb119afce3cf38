package dev.blogpulse.repository;

import dev.blogpulse.entity.Visitor;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

/**
 * Visitor rows are only created through {@link #insertIfAbsent}; there is no statement that
 * updates {@code first_source}.
 */
@Repository
public interface VisitorRepository extends ReactiveCrudRepository<Visitor, String> {

    /**
     * @return 1 when this call created the row, 0 when another request got there first
     */
    @Modifying
    @Query("""
            INSERT INTO visitors (id, first_source, first_referrer, landing_path, user_id, created_at, last_seen_at)
            VALUES (:id, :firstSource, :firstReferrer, :landingPath, :userId, :now, :now)
            ON CONFLICT (id) DO NOTHING
            """)
    Mono<Long> insertIfAbsent(String id, String firstSource, String firstReferrer, String landingPath,
                              String userId, LocalDateTime now);

    @Modifying
    @Query("""
            UPDATE visitors
            SET last_seen_at = :now, user_id = COALESCE(user_id, CAST(:userId AS TEXT))
            WHERE id = :id
            """)
    Mono<Long> touch(String id, String userId, LocalDateTime now);

    @Query("SELECT COUNT(*) FROM visitors WHERE created_at >= :since")
    Mono<Long> countCreatedSince(LocalDateTime since);
}
