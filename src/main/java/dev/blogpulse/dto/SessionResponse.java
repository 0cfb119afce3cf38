package dev.blogpulse.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import dev.blogpulse.entity.SessionState;
import dev.blogpulse.entity.TrackingSession;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Session as shown on the admin dashboard. {@code eventsCount}, {@code userAgent} and {@code ip}
 * are only filled in on the detail view.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SessionResponse {
    private UUID id;
    private String visitorId;
    private String userId;
    private String source;
    private String landingPath;
    private String userAgent;
    private String ip;
    private LocalDateTime startedAt;
    private LocalDateTime lastSeenAt;
    private LocalDateTime endedAt;
    private Integer pageCount;
    private SessionState state;
    private Long durationSeconds;
    private Long eventsCount;

    public static SessionResponse from(TrackingSession session, LocalDateTime now, Duration inactivityTimeout) {
        SessionState state = SessionState.of(session, now, inactivityTimeout);
        LocalDateTime end = session.getEndedAt() != null ? session.getEndedAt() : session.getLastSeenAt();
        Long duration = session.getStartedAt() != null && end != null
                ? Math.max(0, Duration.between(session.getStartedAt(), end).toSeconds())
                : null;
        return SessionResponse.builder()
                .id(session.getId())
                .visitorId(session.getVisitorId())
                .userId(session.getUserId())
                .source(session.getSource())
                .landingPath(session.getLandingPath())
                .startedAt(session.getStartedAt())
                .lastSeenAt(session.getLastSeenAt())
                .endedAt(session.getEndedAt())
                .pageCount(session.getPageCount())
                .state(state)
                .durationSeconds(duration)
                .build();
    }
}
