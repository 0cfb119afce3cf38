package dev.blogpulse.repository;

import dev.blogpulse.entity.BlogPost;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface BlogPostRepository extends ReactiveCrudRepository<BlogPost, Long> {
}
