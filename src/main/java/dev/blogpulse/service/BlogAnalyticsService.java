package dev.blogpulse.service;

import dev.blogpulse.config.AnalyticsCacheProperties;
import dev.blogpulse.config.ResilienceConfig;
import dev.blogpulse.dto.AudienceResponse;
import dev.blogpulse.dto.BlogAnalyticsOverview;
import dev.blogpulse.dto.HeatmapResponse;
import dev.blogpulse.dto.Leaderboard;
import dev.blogpulse.dto.PostAnalyticsResponse;
import dev.blogpulse.dto.PostRanking;
import dev.blogpulse.dto.TimeRange;
import dev.blogpulse.dto.TimelinePoint;
import dev.blogpulse.entity.BlogPost;
import dev.blogpulse.entity.EngagementEventType;
import dev.blogpulse.entity.PostEngagementStat;
import dev.blogpulse.entity.SourceCategory;
import dev.blogpulse.exception.ResourceNotFoundException;
import dev.blogpulse.repository.BlogPostRepository;
import dev.blogpulse.repository.BlogReportRepository;
import dev.blogpulse.repository.EngagementEventRepository;
import dev.blogpulse.repository.PostEngagementStatRepository;
import dev.blogpulse.service.cache.AnalyticsCache;
import dev.blogpulse.service.cache.CacheTopics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.ToDoubleFunction;

/**
 * Per-post engagement reports for the admin dashboard. Derived metrics come from
 * {@link EngagementScoreCalculator}; nothing derived is read from storage.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BlogAnalyticsService {

    public static final int DEFAULT_TIMELINE_DAYS = 30;
    public static final int LEADERBOARD_SIZE = 10;
    // posts with fewer views are left out of the ratio-based rankings
    public static final long MIN_VIEWS_FOR_RATIOS = 10;
    private static final int TREND_DAYS = 30;

    private static final List<String> TIME_BUCKETS = List.of("0-30s", "30s-1m", "1-2m", "2-5m", "5m+");
    private static final List<EngagementEventType> CLICK_EVENTS = List.of(
            EngagementEventType.CTA_CLICK, EngagementEventType.OUTBOUND_CLICK,
            EngagementEventType.SHARE, EngagementEventType.NEWSLETTER_SIGNUP);

    private final BlogPostRepository blogPostRepository;
    private final PostEngagementStatRepository statRepository;
    private final EngagementEventRepository eventRepository;
    private final BlogReportRepository reportRepository;
    private final EngagementScoreCalculator scoreCalculator;
    private final AnalyticsCache analyticsCache;
    private final AnalyticsCacheProperties cacheProperties;
    private final ResilienceConfig resilience;
    private final Clock clock;

    public Mono<PostAnalyticsResponse> postAnalytics(Long postId) {
        return analyticsCache.getOrCompute(CacheTopics.blogPost(postId), cacheProperties.getTtl(),
                PostAnalyticsResponse.class, () -> computePostAnalytics(postId));
    }

    private Mono<PostAnalyticsResponse> computePostAnalytics(Long postId) {
        return findPost(postId)
                .flatMap(post -> Mono.zip(statFor(postId), trends(postId))
                        .map(tuple -> toResponse(post, tuple.getT1(), tuple.getT2())))
                .timeout(resilience.getQueryTimeout())
                .retryWhen(resilience.queryRetry());
    }

    public Mono<AudienceResponse> audience(Long postId) {
        return findPost(postId)
                .flatMap(post -> Mono.zip(reportRepository.audience(postId), statFor(postId)))
                .map(tuple -> {
                    BlogReportRepository.AudienceCounts counts = tuple.getT1();
                    return AudienceResponse.builder()
                            .totalVisitors(counts.totalVisitors())
                            .newVisitors(counts.newVisitors())
                            .returningVisitors(Math.max(0, counts.totalVisitors() - counts.newVisitors()))
                            .trafficSources(sources(tuple.getT2()))
                            .anonymousViews(counts.anonymousViews())
                            .registeredViews(counts.registeredViews())
                            .uniqueUsers(counts.uniqueUsers())
                            .build();
                })
                .timeout(resilience.getQueryTimeout());
    }

    /**
     * Where readers stop scrolling, how long they stay and what they click.
     */
    public Mono<HeatmapResponse> heatmap(Long postId) {
        return findPost(postId)
                .flatMap(post -> Mono.zip(statFor(postId), reportRepository.timeOnPageBuckets(postId),
                        reportRepository.countByEventType(postId)))
                .map(tuple -> {
                    Map<String, Long> time = new LinkedHashMap<>();
                    TIME_BUCKETS.forEach(bucket -> time.put(bucket, tuple.getT2().getOrDefault(bucket, 0L)));
                    Map<String, Long> clicks = new LinkedHashMap<>();
                    CLICK_EVENTS.forEach(type -> clicks.put(type.value(), tuple.getT3().getOrDefault(type.value(), 0L)));
                    return HeatmapResponse.builder()
                            .scrollDistribution(scrollDistribution(tuple.getT1()))
                            .timeDistribution(time)
                            .clickEvents(clicks)
                            .build();
                })
                .timeout(resilience.getQueryTimeout());
    }

    public Mono<List<TimelinePoint>> timeline(Long postId, Integer days) {
        TimeRange range = TimeRange.ofDays(days != null ? days : DEFAULT_TIMELINE_DAYS);
        return findPost(postId)
                .flatMap(post -> reportRepository
                        .dailyTimeline(postId, LocalDateTime.now(clock).minus(range.window()))
                        .collectList())
                .timeout(resilience.getQueryTimeout());
    }

    public Mono<BlogAnalyticsOverview> overview() {
        return analyticsCache.getOrCompute(CacheTopics.BLOG_OVERVIEW, cacheProperties.getTtl(),
                BlogAnalyticsOverview.class, this::computeOverview);
    }

    private Mono<BlogAnalyticsOverview> computeOverview() {
        return Mono.defer(() -> {
            LocalDateTime weekAgo = LocalDateTime.now(clock).minusDays(7);
            return Mono.zip(
                    blogPostRepository.count(),
                    statRepository.findAllViewed().collectList(),
                    reportRepository.countViewsSince(weekAgo),
                    topPostsSince(weekAgo));
        }).map(tuple -> {
            List<PostEngagementStat> stats = tuple.getT2();
            return BlogAnalyticsOverview.builder()
                    .totalPosts(tuple.getT1())
                    .totalViews(stats.stream().mapToLong(PostEngagementStat::getTotalViews).sum())
                    .totalShares(stats.stream().mapToLong(PostEngagementStat::getTotalShares).sum())
                    .totalSignups(stats.stream().mapToLong(PostEngagementStat::getNewsletterSignups).sum())
                    .avgTimeOnPage(EngagementScoreCalculator.round2(stats.stream()
                            .filter(s -> s.getTimeSamples() > 0)
                            .mapToDouble(PostEngagementStat::getAvgTimeOnPage)
                            .average().orElse(0.0)))
                    .avgEngagementRate(EngagementScoreCalculator.round2(stats.stream()
                            .mapToDouble(scoreCalculator::engagementRate)
                            .average().orElse(0.0)))
                    .views7d(tuple.getT3())
                    .topPostsWeek(tuple.getT4())
                    .build();
        }).timeout(resilience.getQueryTimeout()).retryWhen(resilience.queryRetry());
    }

    private Mono<List<PostRanking>> topPostsSince(LocalDateTime since) {
        return reportRepository.topPostsByViewsSince(since, 5)
                .collectList()
                .flatMap(top -> blogPostRepository.findAllById(top.stream().map(BlogReportRepository.PostViews::postId).toList())
                        .collectMap(BlogPost::getId, Function.identity())
                        .map(posts -> top.stream()
                                .map(entry -> ranking(posts.get(entry.postId()), entry.postId(), entry.views(), entry.views()))
                                .toList()));
    }

    public Mono<Leaderboard> leaderboard() {
        return analyticsCache.getOrCompute(CacheTopics.BLOG_LEADERBOARD, cacheProperties.getTtl(),
                Leaderboard.class, this::computeLeaderboard);
    }

    private Mono<Leaderboard> computeLeaderboard() {
        return statRepository.findAllViewed()
                .collectList()
                .flatMap(stats -> blogPostRepository.findAllById(stats.stream().map(PostEngagementStat::getPostId).toList())
                        .collectMap(BlogPost::getId, Function.identity())
                        .map(posts -> Leaderboard.builder()
                                .mostViewed(rank(stats, posts, s -> true, s -> s.getTotalViews()))
                                .highestEngagement(rank(stats, posts, this::hasEnoughViews, scoreCalculator::score))
                                .mostShared(rank(stats, posts, s -> s.getTotalShares() > 0, s -> s.getTotalShares()))
                                .longestReadTime(rank(stats, posts, this::hasEnoughViews, PostEngagementStat::getAvgTimeOnPage))
                                .bestConversion(rank(stats, posts, s -> s.getNewsletterSignups() > 0,
                                        scoreCalculator::conversionRate))
                                .build()))
                .timeout(resilience.getQueryTimeout())
                .retryWhen(resilience.queryRetry());
    }

    private boolean hasEnoughViews(PostEngagementStat stat) {
        return stat.getTotalViews() >= MIN_VIEWS_FOR_RATIOS;
    }

    private List<PostRanking> rank(List<PostEngagementStat> stats, Map<Long, BlogPost> posts,
                                   Predicate<PostEngagementStat> eligible, ToDoubleFunction<PostEngagementStat> metric) {
        return stats.stream()
                .filter(eligible)
                .sorted(Comparator.comparingDouble(metric).reversed()
                        .thenComparing(PostEngagementStat::getPostId))
                .limit(LEADERBOARD_SIZE)
                .map(stat -> ranking(posts.get(stat.getPostId()), stat.getPostId(),
                        metric.applyAsDouble(stat), stat.getTotalViews()))
                .toList();
    }

    private PostRanking ranking(BlogPost post, Long postId, double value, long views) {
        return PostRanking.builder()
                .postId(postId)
                .title(post != null ? post.getTitle() : "Unknown")
                .slug(post != null ? post.getSlug() : null)
                .value(EngagementScoreCalculator.round2(value))
                .totalViews(views)
                .build();
    }

    private PostAnalyticsResponse toResponse(BlogPost post, PostEngagementStat stat, String[] trends) {
        Map<String, Long> shares = new LinkedHashMap<>();
        shares.put("twitter", stat.getTwitterShares());
        shares.put("facebook", stat.getFacebookShares());
        shares.put("linkedin", stat.getLinkedinShares());
        shares.put("copy_link", stat.getCopyLinkShares());
        return PostAnalyticsResponse.builder()
                .postId(post.getId())
                .title(post.getTitle())
                .slug(post.getSlug())
                .totalViews(stat.getTotalViews())
                .uniqueVisitors(stat.getUniqueVisitors())
                .scroll25Percent(stat.getScroll25Percent())
                .scroll50Percent(stat.getScroll50Percent())
                .scroll75Percent(stat.getScroll75Percent())
                .scroll100Percent(stat.getScroll100Percent())
                .totalShares(stat.getTotalShares())
                .sharesByPlatform(shares)
                .ctaClicks(stat.getCtaClicks())
                .outboundClicks(stat.getOutboundClicks())
                .newsletterSignups(stat.getNewsletterSignups())
                .sources(sources(stat))
                .avgTimeOnPage(EngagementScoreCalculator.round2(stat.getAvgTimeOnPage()))
                .totalTimeSpent(stat.getTotalTimeSpent())
                .avgScrollDepth(EngagementScoreCalculator.round2(scoreCalculator.avgScrollDepth(stat)))
                .engagementRate(EngagementScoreCalculator.round2(scoreCalculator.engagementRate(stat)))
                .engagementScore(scoreCalculator.score(stat))
                .firstViewAt(stat.getFirstViewAt())
                .lastViewAt(stat.getLastViewAt())
                .viewsTrend(trends[0])
                .engagementTrend(trends[1])
                .build();
    }

    /**
     * Views and completion rate of the last 30 days against the 30 days before.
     */
    private Mono<String[]> trends(Long postId) {
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime currentStart = now.minusDays(TREND_DAYS);
        LocalDateTime previousStart = currentStart.minusDays(TREND_DAYS);
        String view = EngagementEventType.VIEW.value();
        return Mono.zip(
                eventRepository.countByTypeBetween(postId, view, currentStart, now),
                eventRepository.countByTypeBetween(postId, view, previousStart, currentStart),
                eventRepository.countCompletionsBetween(postId, currentStart, now),
                eventRepository.countCompletionsBetween(postId, previousStart, currentStart)
        ).map(t -> {
            double currentRate = t.getT1() > 0 ? (double) t.getT3() / t.getT1() : 0.0;
            double previousRate = t.getT2() > 0 ? (double) t.getT4() / t.getT2() : 0.0;
            return new String[]{
                    formatTrend(t.getT1(), t.getT2()),
                    formatTrend(currentRate, previousRate)
            };
        });
    }

    static String formatTrend(double current, double previous) {
        if (previous <= 0) {
            return "0%";
        }
        double change = Math.round((current - previous) / previous * 1000.0) / 10.0;
        if (change == 0) {
            return "0%";
        }
        return String.format(Locale.ROOT, "%+.1f%%", change);
    }

    /**
     * Readers per deepest checkpoint reached. Counters are cumulative, so each bucket is the
     * difference to the next threshold.
     */
    static Map<String, Long> scrollDistribution(PostEngagementStat stat) {
        Map<String, Long> buckets = new LinkedHashMap<>();
        buckets.put("0-25%", Math.max(0, stat.getTotalViews() - stat.getScroll25Percent()));
        buckets.put("25-50%", Math.max(0, stat.getScroll25Percent() - stat.getScroll50Percent()));
        buckets.put("50-75%", Math.max(0, stat.getScroll50Percent() - stat.getScroll75Percent()));
        buckets.put("75-100%", Math.max(0, stat.getScroll75Percent() - stat.getScroll100Percent()));
        buckets.put("100%", Math.max(0, stat.getScroll100Percent()));
        return buckets;
    }

    private static Map<String, Long> sources(PostEngagementStat stat) {
        Map<String, Long> sources = new LinkedHashMap<>();
        for (SourceCategory category : SourceCategory.values()) {
            sources.put(category.value(), stat.sourceCount(category));
        }
        return sources;
    }

    private Mono<BlogPost> findPost(Long postId) {
        return blogPostRepository.findById(postId)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Blog post", postId)));
    }

    private Mono<PostEngagementStat> statFor(Long postId) {
        return statRepository.findById(postId)
                .defaultIfEmpty(PostEngagementStat.builder().postId(postId).build());
    }
}
