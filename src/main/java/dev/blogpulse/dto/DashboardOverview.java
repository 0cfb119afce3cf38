package dev.blogpulse.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DashboardOverview {
    private LocalDateTime generatedAt;
    private long totalVisitors;
    private long newVisitors24h;
    private long sessions24h;
    private long pageViews24h;
    private long activeSessions;
    private Map<String, Long> sessionsBySource7d;
    private List<ReferrerCount> topOtherReferrers7d;
}
