package dev.blogpulse.config;

import java.time.Duration;

/**
 * Budget of one route class: at most {@code maxRequests} per fixed {@code window}.
 */
public record RateLimitPolicy(int maxRequests, Duration window) {

    public RateLimitPolicy {
        if (maxRequests < 1) {
            throw new IllegalArgumentException("maxRequests must be positive");
        }
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive");
        }
    }
}
