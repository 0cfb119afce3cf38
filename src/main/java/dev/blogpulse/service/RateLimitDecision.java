package dev.blogpulse.service;

import java.time.Duration;
import java.time.Instant;

/**
 * Outcome of one limiter check, carrying what the {@code X-RateLimit-*} headers need.
 */
public record RateLimitDecision(boolean allowed, int limit, long remaining, Instant resetAt) {

    public Duration retryAfter(Instant now) {
        Duration wait = Duration.between(now, resetAt);
        return wait.isNegative() ? Duration.ZERO : wait;
    }
}
