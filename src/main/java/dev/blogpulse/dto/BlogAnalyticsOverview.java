package dev.blogpulse.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BlogAnalyticsOverview {
    private long totalPosts;
    private long totalViews;
    private long totalShares;
    private long totalSignups;
    private double avgTimeOnPage;
    private double avgEngagementRate;
    private long views7d;
    private List<PostRanking> topPostsWeek;
}
