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
public class AnalyticsCacheStats {
    private String backend;
    private long totalEntries;
    // entries per topic prefix (text before the first ':')
    private Map<String, Long> entriesByTopic;
}
