package dev.blogpulse.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Bucketed distributions. Maps keep bucket order ("0-25%", "25-50%", ...).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HeatmapResponse {
    private Map<String, Long> scrollDistribution;
    private Map<String, Long> timeDistribution;
    private Map<String, Long> clickEvents;
}
