package dev.blogpulse.service;

import dev.blogpulse.entity.SourceCategory;

import java.time.LocalDateTime;

/**
 * Who sent an engagement event. Any of the ids may be null when tracking cookies are missing.
 *
 * @param source traffic source of the reader's session, counted on {@code view}
 */
public record EngagementContext(String visitorId, String sessionId, SourceCategory source, LocalDateTime occurredAt) {
}
