package dev.blogpulse.config;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per route class budgets. {@code rate-limit.enabled=false} turns the limiter into a
 * pass-through for deployments where a reverse proxy already limits.
 */
@Component
@Slf4j
public class RateLimitConfig {

    @Getter
    private final boolean enabled;

    private final Map<RouteClass, RateLimitPolicy> policies = new EnumMap<>(RouteClass.class);

    public RateLimitConfig(
            @Value("${rate-limit.enabled:true}") boolean enabled,
            @Value("${rate-limit.tracking.max-requests:500}") int trackingMax,
            @Value("${rate-limit.tracking.window-minutes:15}") long trackingWindow,
            @Value("${rate-limit.admin.max-requests:30}") int adminMax,
            @Value("${rate-limit.admin.window-minutes:15}") long adminWindow,
            @Value("${rate-limit.admin-mutation.max-requests:10}") int adminMutationMax,
            @Value("${rate-limit.admin-mutation.window-minutes:15}") long adminMutationWindow,
            @Value("${rate-limit.global.max-requests:200}") int globalMax,
            @Value("${rate-limit.global.window-minutes:15}") long globalWindow) {
        this.enabled = enabled;
        policies.put(RouteClass.TRACKING, new RateLimitPolicy(trackingMax, Duration.ofMinutes(trackingWindow)));
        policies.put(RouteClass.ADMIN, new RateLimitPolicy(adminMax, Duration.ofMinutes(adminWindow)));
        policies.put(RouteClass.ADMIN_MUTATION,
                new RateLimitPolicy(adminMutationMax, Duration.ofMinutes(adminMutationWindow)));
        policies.put(RouteClass.GLOBAL, new RateLimitPolicy(globalMax, Duration.ofMinutes(globalWindow)));
        log.info("Rate limiting {}: {}", enabled ? "enabled" : "disabled (pass-through)", policies);
    }

    public static RateLimitConfig defaults(boolean enabled) {
        return new RateLimitConfig(enabled, 500, 15, 30, 15, 10, 15, 200, 15);
    }

    public RateLimitPolicy policyFor(RouteClass routeClass) {
        return policies.get(routeClass);
    }
}
