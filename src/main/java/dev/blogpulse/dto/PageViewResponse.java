package dev.blogpulse.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import dev.blogpulse.entity.PageViewEvent;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * One row of the session event log or of the traffic event list.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PageViewResponse {
    private Long id;
    private UUID sessionId;
    private LocalDateTime occurredAt;
    private String path;
    private String referrer;
    private String source;
    private String userAgent;
    private String ip;

    public static PageViewResponse from(PageViewEvent event) {
        return PageViewResponse.builder()
                .id(event.getId())
                .sessionId(event.getSessionId())
                .occurredAt(event.getOccurredAt())
                .path(event.getPath())
                .referrer(event.getReferrer())
                .source(event.getSource())
                .userAgent(event.getUserAgent())
                .ip(event.getIp())
                .build();
    }
}
