package dev.blogpulse.repository;

import dev.blogpulse.entity.PostEngagementStat;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

/**
 * Read side of {@code blog_post_analytics}. Writes go through {@link EngagementCounterRepository}.
 */
@Repository
public interface PostEngagementStatRepository extends ReactiveCrudRepository<PostEngagementStat, Long> {

    @Query("SELECT * FROM blog_post_analytics WHERE total_views > 0")
    Flux<PostEngagementStat> findAllViewed();
}
