package dev.blogpulse.service;

import dev.blogpulse.util.Attribution;

import java.util.UUID;

/**
 * Outcome of {@link SessionTrackingService#recordPageView}.
 *
 * @param sessionId     session the view was counted in; null when it was dropped as a duplicate
 * @param newSession    true when this view started the session
 * @param sessionSource source locked on the session at its start
 * @param attribution   attribution of this individual view
 * @param duplicate     true when the same path was already seen inside the dedupe window
 */
public record SessionResult(UUID sessionId, boolean newSession, String sessionSource,
                            Attribution attribution, boolean duplicate) {

    public static SessionResult duplicateView() {
        return new SessionResult(null, false, null, null, true);
    }
}
