package dev.blogpulse.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Counters of one post plus the metrics derived from them on read.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PostAnalyticsResponse {
    private Long postId;
    private String title;
    private String slug;

    private long totalViews;
    private long uniqueVisitors;
    private long scroll25Percent;
    private long scroll50Percent;
    private long scroll75Percent;
    private long scroll100Percent;
    private long totalShares;
    private Map<String, Long> sharesByPlatform;
    private long ctaClicks;
    private long outboundClicks;
    private long newsletterSignups;
    private Map<String, Long> sources;
    private double avgTimeOnPage;
    private long totalTimeSpent;

    private double avgScrollDepth;
    private double engagementRate;
    private double engagementScore;

    private LocalDateTime firstViewAt;
    private LocalDateTime lastViewAt;

    // "+12.5%" style, last 30 days against the 30 before
    private String viewsTrend;
    private String engagementTrend;
}
