package dev.blogpulse.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.blogpulse.config.TrackingProperties;
import dev.blogpulse.entity.EngagementEvent;
import dev.blogpulse.entity.PostEngagementStat;
import dev.blogpulse.entity.SourceCategory;
import dev.blogpulse.exception.ResourceNotFoundException;
import dev.blogpulse.metrics.TrackingMetrics;
import dev.blogpulse.repository.BlogPostRepository;
import dev.blogpulse.repository.EngagementCounterRepository;
import dev.blogpulse.repository.EngagementEventRepository;
import dev.blogpulse.service.cache.AnalyticsCache;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("EngagementService")
class EngagementServiceTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 3, 1, 10, 0);
    private static final EngagementContext READER =
            new EngagementContext("visitor-1", "session-1", SourceCategory.GOOGLE, NOW);

    @Mock
    private BlogPostRepository blogPostRepository;

    @Mock
    private EngagementCounterRepository counterRepository;

    @Mock
    private EngagementEventRepository eventRepository;

    @Mock
    private InteractionDeduplicationService deduplicationService;

    @Mock
    private AnalyticsCache analyticsCache;

    private SimpleMeterRegistry registry;
    private EngagementService service;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        service = newService(counterRepository);
        lenient().when(blogPostRepository.existsById(1L)).thenReturn(Mono.just(true));
        lenient().when(counterRepository.ensureRow(eq(1L), any())).thenReturn(Mono.empty());
        lenient().when(eventRepository.save(any(EngagementEvent.class)))
                .thenAnswer(inv -> Mono.just(inv.getArgument(0)));
        lenient().when(analyticsCache.invalidate(anyString())).thenReturn(Mono.just(1L));
    }

    private EngagementService newService(EngagementCounterRepository counters) {
        Clock clock = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);
        return new EngagementService(blogPostRepository, counters, eventRepository, deduplicationService,
                analyticsCache, TrackingProperties.defaults(), new TrackingMetrics(registry), new ObjectMapper(), clock);
    }

    @Nested
    @DisplayName("ignored events")
    class Ignored {

        @Test
        @DisplayName("Should ignore an unknown event type")
        void unknownType() {
            StepVerifier.create(service.recordEvent(1L, "hover", Map.of(), READER))
                    .expectNext(false)
                    .verifyComplete();
            verifyNoInteractions(counterRepository);
            assertThat(registry.counter("tracking.engagement.events", "outcome", "ignored").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should ignore events for a post that does not exist")
        void unknownPost() {
            when(blogPostRepository.existsById(99L)).thenReturn(Mono.just(false));

            StepVerifier.create(service.recordEvent(99L, "view", Map.of(), READER))
                    .expectNext(false)
                    .verifyComplete();
            verifyNoInteractions(counterRepository, eventRepository, analyticsCache);
        }
    }

    @Nested
    @DisplayName("view")
    class View {

        @Test
        @DisplayName("Should count a unique reader and the session source")
        void uniqueView() {
            when(deduplicationService.claimPostVisitor(1L, "visitor-1")).thenReturn(Mono.just(true));
            when(counterRepository.recordView(1L, SourceCategory.GOOGLE, true, NOW)).thenReturn(Mono.just(1L));

            StepVerifier.create(service.recordEvent(1L, "view", null, READER))
                    .expectNext(true)
                    .verifyComplete();

            verify(analyticsCache).invalidate("blog-analytics:post:1");
            verify(analyticsCache).invalidate("blog-analytics:overview");
            verify(analyticsCache).invalidate("blog-analytics:leaderboard");
        }

        @Test
        @DisplayName("Should count a repeat reader as a view only")
        void repeatView() {
            when(deduplicationService.claimPostVisitor(1L, "visitor-1")).thenReturn(Mono.just(false));
            when(counterRepository.recordView(1L, SourceCategory.GOOGLE, false, NOW)).thenReturn(Mono.just(1L));

            StepVerifier.create(service.recordEvent(1L, "view", Map.of(), READER))
                    .expectNext(true)
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should fall back to the session id and the other source")
        void anonymousReader() {
            EngagementContext anonymous = new EngagementContext(null, "session-9", null, NOW);
            when(deduplicationService.claimPostVisitor(1L, "session-9")).thenReturn(Mono.just(true));
            when(counterRepository.recordView(1L, SourceCategory.OTHER, true, NOW)).thenReturn(Mono.just(1L));

            StepVerifier.create(service.recordEvent(1L, "view", Map.of(), anonymous))
                    .expectNext(true)
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("scroll_checkpoint")
    class Scroll {

        @Test
        @DisplayName("Should floor the depth to the crossed checkpoint")
        void floorsDepth() {
            when(deduplicationService.claimScrollCheckpoint(1L, "session-1", 75)).thenReturn(Mono.just(true));
            when(counterRepository.increment(1L, List.of("scroll_75_percent"), NOW)).thenReturn(Mono.just(1L));

            StepVerifier.create(service.recordEvent(1L, "scroll_checkpoint", Map.of("depth", 80), READER))
                    .expectNext(true)
                    .verifyComplete();

            ArgumentCaptor<EngagementEvent> captor = ArgumentCaptor.forClass(EngagementEvent.class);
            verify(eventRepository).save(captor.capture());
            assertThat(captor.getValue().getMetricValue()).isEqualTo(75);
            assertThat(captor.getValue().getEventType()).isEqualTo("scroll_checkpoint");
        }

        @Test
        @DisplayName("Should count each checkpoint once per page view")
        void repeatedCheckpoint() {
            when(deduplicationService.claimScrollCheckpoint(1L, "view-42", 50)).thenReturn(Mono.just(false));

            StepVerifier.create(service.recordEvent(1L, "scroll_milestone",
                            Map.of("depth", "55", "view_id", "view-42"), READER))
                    .expectNext(false)
                    .verifyComplete();
            verify(counterRepository, never()).increment(anyLong(), any(), any());
            verify(eventRepository, never()).save(any());
        }

        @Test
        @DisplayName("Should ignore depths below the first checkpoint")
        void shallowDepth() {
            StepVerifier.create(service.recordEvent(1L, "scroll_checkpoint", Map.of("depth", 10), READER))
                    .expectNext(false)
                    .verifyComplete();
            verifyNoInteractions(deduplicationService);
        }
    }

    @Test
    @DisplayName("Should count a share on the total and the platform column")
    void share() {
        when(counterRepository.increment(1L, List.of("total_shares", "twitter_shares"), NOW)).thenReturn(Mono.just(1L));

        StepVerifier.create(service.recordEvent(1L, "share", Map.of("platform", "x"), READER))
                .expectNext(true)
                .verifyComplete();
    }

    @Test
    @DisplayName("Should count a share on an unknown platform on the total only")
    void shareUnknownPlatform() {
        when(counterRepository.increment(1L, List.of("total_shares"), NOW)).thenReturn(Mono.just(1L));

        StepVerifier.create(service.recordEvent(1L, "share", Map.of("platform", "mastodon"), READER))
                .expectNext(true)
                .verifyComplete();
    }

    @Test
    @DisplayName("Should clamp time samples to the configured maximum")
    void timeOnPageClamped() {
        when(counterRepository.recordTimeSample(1L, 14_400L, NOW)).thenReturn(Mono.just(1L));

        StepVerifier.create(service.recordEvent(1L, "time_on_page", Map.of("seconds", 1_000_000), READER))
                .expectNext(true)
                .verifyComplete();
    }

    @Test
    @DisplayName("Should ignore a time sample without a number")
    void timeOnPageMissing() {
        StepVerifier.create(service.recordEvent(1L, "exit", Map.of("seconds", "soon"), READER))
                .expectNext(false)
                .verifyComplete();
        verify(counterRepository, never()).recordTimeSample(anyLong(), anyLong(), any());
    }

    @Test
    @DisplayName("Should count a bare copy_link event as a copy-link share")
    void copyLink() {
        when(counterRepository.increment(1L, List.of("total_shares", "copy_link_shares"), NOW))
                .thenReturn(Mono.just(1L));

        StepVerifier.create(service.recordEvent(1L, "copy_link", null, READER))
                .expectNext(true)
                .verifyComplete();

        ArgumentCaptor<EngagementEvent> captor = ArgumentCaptor.forClass(EngagementEvent.class);
        verify(eventRepository).save(captor.capture());
        assertThat(captor.getValue().getEventType()).isEqualTo("share");
        assertThat(captor.getValue().getLabel()).isEqualTo("copy_link");
    }

    @Test
    @DisplayName("Should label a CTA click by cta_name when cta_id is missing")
    void ctaClickByName() {
        when(counterRepository.increment(1L, List.of("cta_clicks"), NOW)).thenReturn(Mono.just(1L));

        StepVerifier.create(service.recordEvent(1L, "cta_click", Map.of("cta_name", "newsletter-footer"), READER))
                .expectNext(true)
                .verifyComplete();

        ArgumentCaptor<EngagementEvent> captor = ArgumentCaptor.forClass(EngagementEvent.class);
        verify(eventRepository).save(captor.capture());
        assertThat(captor.getValue().getLabel()).isEqualTo("newsletter-footer");
    }

    @Test
    @DisplayName("Should log time milestones without folding them into the average")
    void timeMilestoneLoggedOnly() {
        StepVerifier.create(service.recordEvent(1L, "time_milestone", Map.of("seconds", 30), READER))
                .expectNext(false)
                .verifyComplete();

        ArgumentCaptor<EngagementEvent> captor = ArgumentCaptor.forClass(EngagementEvent.class);
        verify(eventRepository).save(captor.capture());
        assertThat(captor.getValue().getEventType()).isEqualTo("time_milestone");
        assertThat(captor.getValue().getMetricValue()).isEqualTo(30);
        verifyNoInteractions(counterRepository, analyticsCache);
    }

    @Test
    @DisplayName("Should count one time sample per reader despite milestones")
    void oneSamplePerReader() {
        InMemoryCounters counters = new InMemoryCounters();
        EngagementService fresh = newService(counters);

        for (int seconds : new int[] {10, 30, 60, 120, 300}) {
            fresh.recordEvent(1L, "time_milestone", Map.of("seconds", seconds), READER).block();
        }
        fresh.recordEvent(1L, "exit", Map.of("time_on_page", 300), READER).block();

        PostEngagementStat stat = counters.snapshot();
        assertThat(stat.getTimeSamples()).isEqualTo(1);
        assertThat(stat.getAvgTimeOnPage()).isEqualTo(300.0);
        assertThat(stat.getTotalTimeSpent()).isEqualTo(300);
    }

    @Test
    @DisplayName("Should never decrease any counter")
    void countersAreMonotonic() {
        InMemoryCounters counters = new InMemoryCounters();
        EngagementService monotonic = newService(counters);
        lenient().when(deduplicationService.claimPostVisitor(any(), any())).thenReturn(Mono.just(true));
        lenient().when(deduplicationService.claimScrollCheckpoint(any(), any(), anyInt()))
                .thenReturn(Mono.just(true));

        Random random = new Random(7);
        List<String> types = List.of("view", "scroll_checkpoint", "share", "cta_click", "time_on_page",
                "time_milestone", "copy_link", "newsletter_signup", "outbound_click", "bogus");
        List<String> platforms = List.of("twitter", "facebook", "linkedin", "copy_link", "other");

        PostEngagementStat previous = counters.snapshot();
        for (int i = 0; i < 300; i++) {
            String type = types.get(random.nextInt(types.size()));
            Map<String, Object> payload = Map.of(
                    "depth", random.nextInt(130),
                    "platform", platforms.get(random.nextInt(platforms.size())),
                    "seconds", random.nextInt(20_000),
                    "view_id", "view-" + random.nextInt(5));
            monotonic.recordEvent(1L, type, payload, READER).block();

            PostEngagementStat current = counters.snapshot();
            assertThat(current.getTotalViews()).isGreaterThanOrEqualTo(previous.getTotalViews());
            assertThat(current.getUniqueVisitors()).isGreaterThanOrEqualTo(previous.getUniqueVisitors());
            assertThat(current.getScroll25Percent()).isGreaterThanOrEqualTo(previous.getScroll25Percent());
            assertThat(current.getScroll50Percent()).isGreaterThanOrEqualTo(previous.getScroll50Percent());
            assertThat(current.getScroll75Percent()).isGreaterThanOrEqualTo(previous.getScroll75Percent());
            assertThat(current.getScroll100Percent()).isGreaterThanOrEqualTo(previous.getScroll100Percent());
            assertThat(current.getTotalShares()).isGreaterThanOrEqualTo(previous.getTotalShares());
            assertThat(current.getCtaClicks()).isGreaterThanOrEqualTo(previous.getCtaClicks());
            assertThat(current.getOutboundClicks()).isGreaterThanOrEqualTo(previous.getOutboundClicks());
            assertThat(current.getNewsletterSignups()).isGreaterThanOrEqualTo(previous.getNewsletterSignups());
            assertThat(current.getTimeSamples()).isGreaterThanOrEqualTo(previous.getTimeSamples());
            assertThat(current.getAvgTimeOnPage()).isBetween(0.0, 14_400.0);
            previous = current;
        }
        assertThat(previous.getTotalViews()).isPositive();
    }

    @Test
    @DisplayName("Should report full completion for a single read to the end")
    void singleReadToTheEnd() {
        InMemoryCounters counters = new InMemoryCounters();
        EngagementService fresh = newService(counters);
        when(deduplicationService.claimPostVisitor(any(), any())).thenReturn(Mono.just(true));
        when(deduplicationService.claimScrollCheckpoint(any(), any(), anyInt())).thenReturn(Mono.just(true));

        fresh.recordEvent(1L, "view", Map.of(), READER).block();
        fresh.recordEvent(1L, "scroll_checkpoint", Map.of("depth", 100), READER).block();

        PostEngagementStat stat = counters.snapshot();
        assertThat(stat.getTotalViews()).isEqualTo(1);
        assertThat(stat.getScroll100Percent()).isEqualTo(1);
        assertThat(EngagementScoreCalculator.defaults().engagementRate(stat)).isEqualTo(1.0);
    }

    @Nested
    @DisplayName("resetStats")
    class Reset {

        @Test
        @DisplayName("Should zero the counters and drop cached reports")
        void resets() {
            when(counterRepository.reset(eq(1L), any())).thenReturn(Mono.just(1L));

            StepVerifier.create(service.resetStats(1L)).verifyComplete();

            verify(counterRepository).reset(eq(1L), any());
            verify(analyticsCache).invalidate("blog-analytics:post:1");
        }

        @Test
        @DisplayName("Should fail with not found for an unknown post")
        void unknownPost() {
            when(blogPostRepository.existsById(5L)).thenReturn(Mono.just(false));

            StepVerifier.create(service.resetStats(5L))
                    .expectError(ResourceNotFoundException.class)
                    .verify();
        }
    }

    @Test
    @DisplayName("Should map raw depths to checkpoints")
    void scrollThresholds() {
        assertThat(EngagementService.scrollThreshold(null)).isNull();
        assertThat(EngagementService.scrollThreshold(24.9)).isNull();
        assertThat(EngagementService.scrollThreshold(25.0)).isEqualTo(25);
        assertThat(EngagementService.scrollThreshold(99.9)).isEqualTo(75);
        assertThat(EngagementService.scrollThreshold(100.0)).isEqualTo(100);
        assertThat(EngagementService.scrollThreshold(250.0)).isEqualTo(100);
        assertThat(EngagementService.numberValue("12.5")).isEqualTo(12.5);
        assertThat(EngagementService.numberValue("x")).isNull();
    }

    /**
     * Counter store that applies the same arithmetic as the SQL statements.
     */
    private static final class InMemoryCounters implements EngagementCounterRepository {

        private final PostEngagementStat stat = PostEngagementStat.builder().postId(1L).build();

        synchronized PostEngagementStat snapshot() {
            return stat.toBuilder().build();
        }

        @Override
        public Mono<Void> ensureRow(Long postId, LocalDateTime now) {
            return Mono.empty();
        }

        @Override
        public synchronized Mono<Long> recordView(Long postId, SourceCategory source, boolean uniqueVisitor,
                                                  LocalDateTime now) {
            stat.setTotalViews(stat.getTotalViews() + 1);
            if (uniqueVisitor) {
                stat.setUniqueVisitors(stat.getUniqueVisitors() + 1);
            }
            return Mono.just(1L);
        }

        @Override
        public synchronized Mono<Long> increment(Long postId, Collection<String> columns, LocalDateTime now) {
            for (String column : columns) {
                switch (column) {
                    case "scroll_25_percent" -> stat.setScroll25Percent(stat.getScroll25Percent() + 1);
                    case "scroll_50_percent" -> stat.setScroll50Percent(stat.getScroll50Percent() + 1);
                    case "scroll_75_percent" -> stat.setScroll75Percent(stat.getScroll75Percent() + 1);
                    case "scroll_100_percent" -> stat.setScroll100Percent(stat.getScroll100Percent() + 1);
                    case "total_shares" -> stat.setTotalShares(stat.getTotalShares() + 1);
                    case "cta_clicks" -> stat.setCtaClicks(stat.getCtaClicks() + 1);
                    case "outbound_clicks" -> stat.setOutboundClicks(stat.getOutboundClicks() + 1);
                    case "newsletter_signups" -> stat.setNewsletterSignups(stat.getNewsletterSignups() + 1);
                    default -> {
                        // per-platform share columns are not tracked here
                    }
                }
            }
            return Mono.just(1L);
        }

        @Override
        public synchronized Mono<Long> recordTimeSample(Long postId, long seconds, LocalDateTime now) {
            long n = stat.getTimeSamples();
            stat.setAvgTimeOnPage(stat.getAvgTimeOnPage() + (seconds - stat.getAvgTimeOnPage()) / (n + 1));
            stat.setTimeSamples(n + 1);
            stat.setTotalTimeSpent(stat.getTotalTimeSpent() + seconds);
            return Mono.just(1L);
        }

        @Override
        public Mono<Long> reset(Long postId, LocalDateTime now) {
            throw new UnsupportedOperationException();
        }
    }
}
