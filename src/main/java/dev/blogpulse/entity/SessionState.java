package dev.blogpulse.entity;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Lifecycle of a {@link TrackingSession}. Never stored: derived from
 * {@code ended_at} and {@code last_seen_at} at read time.
 */
public enum SessionState {
    ACTIVE,
    ENDED;

    /**
     * A session is ENDED when it was closed explicitly or when it has been idle
     * for longer than {@code inactivityTimeout}. A null session has no state.
     */
    public static SessionState of(TrackingSession session, LocalDateTime now, Duration inactivityTimeout) {
        if (session == null) {
            return null;
        }
        if (session.getEndedAt() != null) {
            return ENDED;
        }
        LocalDateTime lastSeen = session.getLastSeenAt() != null ? session.getLastSeenAt() : session.getStartedAt();
        if (lastSeen == null) {
            return ENDED;
        }
        return Duration.between(lastSeen, now).compareTo(inactivityTimeout) > 0 ? ENDED : ACTIVE;
    }
}
