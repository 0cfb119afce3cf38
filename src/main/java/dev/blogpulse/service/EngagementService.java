package dev.blogpulse.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.blogpulse.config.TrackingProperties;
import dev.blogpulse.entity.EngagementEvent;
import dev.blogpulse.entity.EngagementEventType;
import dev.blogpulse.entity.SharePlatform;
import dev.blogpulse.entity.SourceCategory;
import dev.blogpulse.exception.ResourceNotFoundException;
import dev.blogpulse.metrics.TrackingMetrics;
import dev.blogpulse.repository.BlogPostRepository;
import dev.blogpulse.repository.EngagementCounterRepository;
import dev.blogpulse.repository.EngagementEventRepository;
import dev.blogpulse.service.cache.AnalyticsCache;
import dev.blogpulse.service.cache.CacheTopics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Folds reader engagement events into the per-post counters and the raw event log.
 * <p>
 * Counter updates are single in-place statements. Unknown posts and unknown event types are
 * ignored without error.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EngagementService {

    static final int[] SCROLL_THRESHOLDS = {25, 50, 75, 100};

    private final BlogPostRepository blogPostRepository;
    private final EngagementCounterRepository counterRepository;
    private final EngagementEventRepository eventRepository;
    private final InteractionDeduplicationService deduplicationService;
    private final AnalyticsCache analyticsCache;
    private final TrackingProperties properties;
    private final TrackingMetrics metrics;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * @return true when the event changed the post's statistics
     */
    public Mono<Boolean> recordEvent(Long postId, String rawEventType, Map<String, Object> payload,
                                     EngagementContext context) {
        EngagementEventType type = EngagementEventType.fromValue(rawEventType).orElse(null);
        if (type == null || postId == null) {
            log.debug("Ignoring engagement event {} for post {}", rawEventType, postId);
            metrics.engagementIgnored();
            return Mono.just(false);
        }
        Map<String, Object> data = withImpliedFields(rawEventType, payload);

        return blogPostRepository.existsById(postId)
                .flatMap(exists -> {
                    if (!exists) {
                        log.debug("Engagement event for unknown post {} ignored", postId);
                        metrics.engagementIgnored();
                        return Mono.just(false);
                    }
                    if (type.isLogOnly()) {
                        return append(postId, type, data, context).thenReturn(false);
                    }
                    return counterRepository.ensureRow(postId, context.occurredAt())
                            .then(Mono.defer(() -> apply(postId, type, data, context)))
                            .flatMap(applied -> applied
                                    ? append(postId, type, data, context).then(invalidate(postId)).thenReturn(true)
                                    : Mono.just(false));
                })
                .doOnNext(applied -> {
                    if (applied) {
                        metrics.engagementAccepted();
                    }
                });
    }

    /**
     * Administrative reset: every counter of the post goes back to zero. The raw event log is kept.
     */
    public Mono<Void> resetStats(Long postId) {
        LocalDateTime now = LocalDateTime.now(clock);
        return blogPostRepository.existsById(postId)
                .flatMap(exists -> exists
                        ? counterRepository.ensureRow(postId, now).then(counterRepository.reset(postId, now))
                        : Mono.error(new ResourceNotFoundException("Blog post", postId)))
                .doOnNext(rows -> log.info("Engagement statistics reset for post {}", postId))
                .then(invalidate(postId));
    }

    private Mono<Boolean> apply(Long postId, EngagementEventType type, Map<String, Object> data,
                                EngagementContext context) {
        LocalDateTime now = context.occurredAt();
        return switch (type) {
            case VIEW -> recordView(postId, context);
            case SCROLL_CHECKPOINT -> recordScroll(postId, data, context);
            case SHARE -> {
                List<String> columns = new ArrayList<>(List.of("total_shares"));
                SharePlatform.fromValue(stringValue(data.get("platform")))
                        .ifPresent(platform -> columns.add(platform.column()));
                yield counterRepository.increment(postId, columns, now).thenReturn(true);
            }
            case CTA_CLICK -> counterRepository.increment(postId, List.of("cta_clicks"), now).thenReturn(true);
            case OUTBOUND_CLICK -> counterRepository.increment(postId, List.of("outbound_clicks"), now).thenReturn(true);
            case NEWSLETTER_SIGNUP -> counterRepository.increment(postId, List.of("newsletter_signups"), now).thenReturn(true);
            case TIME_ON_PAGE -> {
                Long seconds = timeSample(data);
                yield seconds == null
                        ? Mono.just(false)
                        : counterRepository.recordTimeSample(postId, seconds, now).thenReturn(true);
            }
            case TIME_MILESTONE -> Mono.just(false);
        };
    }

    private Mono<Boolean> recordView(Long postId, EngagementContext context) {
        String visitorKey = context.visitorId() != null ? context.visitorId() : context.sessionId();
        Mono<Boolean> unique = visitorKey != null
                ? deduplicationService.claimPostVisitor(postId, visitorKey)
                : Mono.just(false);
        SourceCategory source = context.source() != null ? context.source() : SourceCategory.OTHER;
        return unique.flatMap(isUnique -> counterRepository.recordView(postId, source, isUnique, context.occurredAt()))
                .thenReturn(true);
    }

    private Mono<Boolean> recordScroll(Long postId, Map<String, Object> data, EngagementContext context) {
        Integer threshold = scrollThreshold(numberValue(data.get("depth")));
        if (threshold == null) {
            return Mono.just(false);
        }
        String column = "scroll_" + threshold + "_percent";
        String viewKey = stringValue(data.get("view_id"));
        if (viewKey == null) {
            viewKey = context.sessionId();
        }
        if (viewKey == null) {
            return counterRepository.increment(postId, List.of(column), context.occurredAt()).thenReturn(true);
        }
        return deduplicationService.claimScrollCheckpoint(postId, viewKey, threshold)
                .flatMap(first -> first
                        ? counterRepository.increment(postId, List.of(column), context.occurredAt()).thenReturn(true)
                        : Mono.just(false));
    }

    private Mono<Void> append(Long postId, EngagementEventType type, Map<String, Object> data,
                              EngagementContext context) {
        Integer metricValue = switch (type) {
            case SCROLL_CHECKPOINT -> scrollThreshold(numberValue(data.get("depth")));
            case TIME_ON_PAGE, TIME_MILESTONE -> {
                Long seconds = timeSample(data);
                yield seconds != null ? seconds.intValue() : null;
            }
            default -> null;
        };
        String label = switch (type) {
            case SHARE -> stringValue(data.get("platform"));
            case CTA_CLICK -> {
                String ctaId = stringValue(data.get("cta_id"));
                yield ctaId != null ? ctaId : stringValue(data.get("cta_name"));
            }
            default -> null;
        };
        EngagementEvent event = EngagementEvent.builder()
                .postId(postId)
                .sessionId(context.sessionId())
                .visitorId(context.visitorId())
                .eventType(type.value())
                .metricValue(metricValue)
                .label(truncate(label, 64))
                .eventData(toJson(data))
                .occurredAt(context.occurredAt())
                .build();
        return eventRepository.save(event).then();
    }

    private Mono<Void> invalidate(Long postId) {
        return Flux.just(CacheTopics.blogPost(postId), CacheTopics.BLOG_OVERVIEW, CacheTopics.BLOG_LEADERBOARD)
                .flatMap(analyticsCache::invalidate)
                .then();
    }

    /**
     * A bare {@code copy_link} event is a share on the copy-link platform.
     */
    private static Map<String, Object> withImpliedFields(String rawEventType, Map<String, Object> payload) {
        Map<String, Object> data = payload != null ? payload : Map.of();
        if ("copy_link".equalsIgnoreCase(rawEventType.trim()) && data.get("platform") == null) {
            Map<String, Object> withPlatform = new HashMap<>(data);
            withPlatform.put("platform", "copy_link");
            return withPlatform;
        }
        return data;
    }

    /**
     * Floors a reported depth to the checkpoint it crossed. Above 100 clamps to 100; below 25 is no checkpoint.
     */
    static Integer scrollThreshold(Double depth) {
        if (depth == null || depth.isNaN() || depth < SCROLL_THRESHOLDS[0]) {
            return null;
        }
        int clamped = (int) Math.min(100, Math.floor(depth));
        Integer threshold = null;
        for (int t : SCROLL_THRESHOLDS) {
            if (clamped >= t) {
                threshold = t;
            }
        }
        return threshold;
    }

    private Long timeSample(Map<String, Object> data) {
        Double seconds = numberValue(data.get("seconds"));
        if (seconds == null) {
            seconds = numberValue(data.get("time_on_page"));
        }
        if (seconds == null || seconds.isNaN()) {
            return null;
        }
        return Math.max(0L, Math.min(properties.getMaxTimeSampleSeconds(), Math.round(seconds)));
    }

    private String toJson(Map<String, Object> data) {
        if (data.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize engagement payload: {}", e.getMessage());
            return null;
        }
    }

    static Double numberValue(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return Double.parseDouble(text.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static String stringValue(Object value) {
        if (value == null) {
            return null;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }

    private static String truncate(String value, int max) {
        return value != null && value.length() > max ? value.substring(0, max) : value;
    }
}
