package dev.blogpulse.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EngagementEventRequest {

    @JsonProperty("event_type")
    private String eventType;

    // depth, seconds, platform, view_id, session_id, cta_id ...
    @JsonProperty("event_data")
    private Map<String, Object> eventData;
}
