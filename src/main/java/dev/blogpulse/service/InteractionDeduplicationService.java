package dev.blogpulse.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import dev.blogpulse.config.ResilienceConfig;
import dev.blogpulse.config.TrackingProperties;
import dev.blogpulse.metrics.TrackingMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.stereotype.Service;
import org.springframework.util.DigestUtils;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Best-effort duplicate suppression for beacons: repeated page views of the same path,
 * repeat readers of a post, and repeated scroll checkpoints of one page view.
 * <p>
 * A claim is a {@code SET NX} with TTL in Redis. Without Redis, or when Redis fails, claims are
 * kept in a local Caffeine map, so a duplicate may slip through across instances. Counting stays
 * approximate; a lost claim never blocks the beacon.
 */
@Service
@Slf4j
public class InteractionDeduplicationService {

    private static final String PAGE_VIEW_PREFIX = "dedupe:pv:";
    private static final String POST_VISITOR_PREFIX = "dedupe:post_visitor:";
    private static final String SCROLL_PREFIX = "dedupe:scroll:";

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final TrackingProperties properties;
    private final TrackingMetrics metrics;
    private final Clock clock;
    private final Duration redisTimeout;

    private final Cache<String, Instant> localClaims;

    public InteractionDeduplicationService(
            @Autowired(required = false) ReactiveRedisTemplate<String, String> redisTemplate,
            TrackingProperties properties,
            TrackingMetrics metrics,
            Clock clock,
            ResilienceConfig resilience) {
        this.redisTemplate = redisTemplate;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
        this.redisTimeout = resilience.getRedisTimeout();
        this.localClaims = Caffeine.newBuilder()
                .maximumSize(100_000)
                .expireAfterWrite(longest(properties))
                .build();
        if (redisTemplate == null) {
            log.info("Beacon deduplication is node-local (Redis not configured)");
        }
    }

    /**
     * @return true when this is the first view of {@code path} by the visitor within the dedupe window
     */
    public Mono<Boolean> claimPageView(String visitorId, String path) {
        return claim(PAGE_VIEW_PREFIX + visitorId + ":" + hash(path), properties.getPageViewDedupeWindow(), "page_view");
    }

    /**
     * @return true when the visitor has not been counted for this post within the visitor-seen TTL
     */
    public Mono<Boolean> claimPostVisitor(Long postId, String visitorKey) {
        return claim(POST_VISITOR_PREFIX + postId + ":" + hash(visitorKey), properties.getVisitorSeenTtl(), "post_visitor");
    }

    /**
     * @return true the first time a page view reports crossing {@code threshold}
     */
    public Mono<Boolean> claimScrollCheckpoint(Long postId, String viewKey, int threshold) {
        return claim(SCROLL_PREFIX + postId + ":" + hash(viewKey) + ":" + threshold, properties.getScrollKeyTtl(), "scroll");
    }

    private Mono<Boolean> claim(String key, Duration ttl, String kind) {
        Mono<Boolean> claimed;
        if (redisTemplate == null) {
            claimed = Mono.fromSupplier(() -> claimLocally(key, ttl));
        } else {
            claimed = redisTemplate.opsForValue()
                    .setIfAbsent(key, "1", ttl)
                    .timeout(redisTimeout)
                    .defaultIfEmpty(true)
                    .onErrorResume(e -> {
                        log.warn("Dedupe check failed in Redis, using local claims: {}", e.getMessage());
                        return Mono.fromSupplier(() -> claimLocally(key, ttl));
                    });
        }
        return claimed.doOnNext(fresh -> {
            if (!fresh) {
                metrics.dedupeHit(kind);
            }
        });
    }

    boolean claimLocally(String key, Duration ttl) {
        Instant now = clock.instant();
        AtomicBoolean claimed = new AtomicBoolean(false);
        localClaims.asMap().compute(key, (k, expiresAt) -> {
            if (expiresAt != null && expiresAt.isAfter(now)) {
                return expiresAt;
            }
            claimed.set(true);
            return now.plus(ttl);
        });
        return claimed.get();
    }

    // Keys stay short and raw paths or tokens never land in Redis.
    private static String hash(String value) {
        return DigestUtils.md5DigestAsHex((value == null ? "" : value).getBytes(StandardCharsets.UTF_8));
    }

    private static Duration longest(TrackingProperties properties) {
        Duration longest = properties.getPageViewDedupeWindow();
        if (properties.getVisitorSeenTtl().compareTo(longest) > 0) {
            longest = properties.getVisitorSeenTtl();
        }
        if (properties.getScrollKeyTtl().compareTo(longest) > 0) {
            longest = properties.getScrollKeyTtl();
        }
        return longest;
    }
}
