package dev.blogpulse.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Rolling per-post counters. Rows are only ever mutated through the atomic statements in
 * {@link dev.blogpulse.repository.EngagementCounterRepository}; this class is the read model.
 * Scroll counters are cumulative: a reader reaching 100% has also crossed 25, 50 and 75.
 */
@Table("blog_post_analytics")
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PostEngagementStat {

    @Id
    @Column("post_id")
    private Long postId;

    @Column("total_views")
    @Builder.Default
    private long totalViews = 0;

    @Column("unique_visitors")
    @Builder.Default
    private long uniqueVisitors = 0;

    @Column("scroll_25_percent")
    @Builder.Default
    private long scroll25Percent = 0;

    @Column("scroll_50_percent")
    @Builder.Default
    private long scroll50Percent = 0;

    @Column("scroll_75_percent")
    @Builder.Default
    private long scroll75Percent = 0;

    @Column("scroll_100_percent")
    @Builder.Default
    private long scroll100Percent = 0;

    @Column("total_shares")
    @Builder.Default
    private long totalShares = 0;

    @Column("twitter_shares")
    @Builder.Default
    private long twitterShares = 0;

    @Column("facebook_shares")
    @Builder.Default
    private long facebookShares = 0;

    @Column("linkedin_shares")
    @Builder.Default
    private long linkedinShares = 0;

    @Column("copy_link_shares")
    @Builder.Default
    private long copyLinkShares = 0;

    @Column("cta_clicks")
    @Builder.Default
    private long ctaClicks = 0;

    @Column("outbound_clicks")
    @Builder.Default
    private long outboundClicks = 0;

    @Column("newsletter_signups")
    @Builder.Default
    private long newsletterSignups = 0;

    @Column("source_direct")
    @Builder.Default
    private long sourceDirect = 0;

    @Column("source_google")
    @Builder.Default
    private long sourceGoogle = 0;

    @Column("source_instagram")
    @Builder.Default
    private long sourceInstagram = 0;

    @Column("source_facebook")
    @Builder.Default
    private long sourceFacebook = 0;

    @Column("source_youtube")
    @Builder.Default
    private long sourceYoutube = 0;

    @Column("source_other")
    @Builder.Default
    private long sourceOther = 0;

    @Column("time_samples")
    @Builder.Default
    private long timeSamples = 0;

    @Column("avg_time_on_page")
    @Builder.Default
    private double avgTimeOnPage = 0;

    @Column("total_time_spent")
    @Builder.Default
    private long totalTimeSpent = 0;

    @Column("first_view_at")
    private LocalDateTime firstViewAt;

    @Column("last_view_at")
    private LocalDateTime lastViewAt;

    @Column("last_updated_at")
    private LocalDateTime lastUpdatedAt;

    public long sourceCount(SourceCategory category) {
        return switch (category) {
            case DIRECT -> sourceDirect;
            case GOOGLE -> sourceGoogle;
            case INSTAGRAM -> sourceInstagram;
            case FACEBOOK -> sourceFacebook;
            case YOUTUBE -> sourceYoutube;
            case OTHER -> sourceOther;
        };
    }
}
