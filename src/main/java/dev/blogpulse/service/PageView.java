package dev.blogpulse.service;

import java.time.LocalDateTime;

/**
 * One accepted page view beacon, already truncated and resolved to a visitor.
 */
public record PageView(String visitorId, String userId, String path, String referrer, String sourceHint,
                       String userAgent, String ip, LocalDateTime occurredAt) {
}
