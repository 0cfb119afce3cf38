package dev.blogpulse.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AudienceResponse {
    private long totalVisitors;
    private long newVisitors;
    private long returningVisitors;
    private Map<String, Long> trafficSources;
    private long anonymousViews;
    private long registeredViews;
    private long uniqueUsers;
}
