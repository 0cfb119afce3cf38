package dev.blogpulse.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Filtered page of raw traffic events plus unfiltered per-source counts for the same window.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrafficEventsPage {
    private List<PageViewResponse> events;
    private Map<String, Long> bySource;
    private String range;
    private int limit;
    private int offset;
}
