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
public class TrafficSummary {
    private String range;
    private LocalDateTime generatedAt;
    private long totalPageViews;
    // page views per source category, every category present
    private Map<String, Long> bySource;
    private List<ReferrerCount> topOtherReferrers;
}
