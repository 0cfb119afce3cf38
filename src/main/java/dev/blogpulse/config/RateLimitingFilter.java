package dev.blogpulse.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.blogpulse.dto.TrackResponse;
import dev.blogpulse.exception.ErrorResponse;
import dev.blogpulse.metrics.TrackingMetrics;
import dev.blogpulse.service.RateLimitDecision;
import dev.blogpulse.service.RateLimiterService;
import dev.blogpulse.util.IpAddressExtractor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;

/**
 * Gate in front of every route. Over-budget tracking beacons are dropped with the normal
 * {@code {"success":true}} body so the page never sees an error; every other route class
 * gets a 429 with {@code Retry-After}.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
@Slf4j
public class RateLimitingFilter implements WebFilter {

    private final RateLimiterService rateLimiter;
    private final RateLimitConfig config;
    private final TrackingMetrics metrics;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public RateLimitingFilter(RateLimiterService rateLimiter, RateLimitConfig config,
                              TrackingMetrics metrics, ObjectMapper objectMapper, Clock clock) {
        this.rateLimiter = rateLimiter;
        this.config = config;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String path = exchange.getRequest().getPath().value();
        if (!config.isEnabled() || path.startsWith("/actuator/health")) {
            return chain.filter(exchange);
        }

        RouteClass routeClass = RouteClass.resolve(path, exchange.getRequest().getMethod());
        String clientIp = IpAddressExtractor.extractClientIp(exchange);
        String bucketKey = routeClass.tag() + ":" + clientIp;

        return rateLimiter.allow(bucketKey, config.policyFor(routeClass))
                .flatMap(decision -> {
                    writeHeaders(exchange, decision);
                    if (decision.allowed()) {
                        return chain.filter(exchange);
                    }
                    metrics.rateLimitRejected(routeClass.tag());
                    if (routeClass == RouteClass.TRACKING) {
                        log.debug("Tracking beacon dropped for IP {} (budget exhausted)", clientIp);
                        metrics.beaconRateLimited();
                        return writeJson(exchange, HttpStatus.OK, TrackResponse.ok());
                    }
                    log.warn("Rate limit exceeded for IP: {}, class: {}, path: {}", clientIp, routeClass, path);
                    return reject(exchange, decision, path);
                });
    }

    private void writeHeaders(ServerWebExchange exchange, RateLimitDecision decision) {
        HttpHeaders headers = exchange.getResponse().getHeaders();
        headers.set("X-RateLimit-Limit", String.valueOf(decision.limit()));
        headers.set("X-RateLimit-Remaining", String.valueOf(decision.remaining()));
        headers.set("X-RateLimit-Reset", String.valueOf(decision.resetAt().toEpochMilli()));
    }

    private Mono<Void> reject(ServerWebExchange exchange, RateLimitDecision decision, String path) {
        Instant now = clock.instant();
        long retryAfterSeconds = Math.max(1, decision.retryAfter(now).toSeconds());
        exchange.getResponse().getHeaders().set(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfterSeconds));
        ErrorResponse body = ErrorResponse.builder()
                .timestamp(LocalDateTime.now(clock))
                .status(HttpStatus.TOO_MANY_REQUESTS.value())
                .error("Too Many Requests")
                .message("Rate limit exceeded. Retry in " + retryAfterSeconds + " seconds")
                .path(path)
                .build();
        return writeJson(exchange, HttpStatus.TOO_MANY_REQUESTS, body);
    }

    private Mono<Void> writeJson(ServerWebExchange exchange, HttpStatus status, Object body) {
        exchange.getResponse().setStatusCode(status);
        exchange.getResponse().getHeaders().setContentType(MediaType.APPLICATION_JSON);
        byte[] bytes;
        try {
            bytes = objectMapper.writeValueAsBytes(body);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize rate limit response: {}", e.getMessage());
            bytes = ("{\"status\":" + status.value() + "}").getBytes(StandardCharsets.UTF_8);
        }
        DataBuffer buffer = exchange.getResponse().bufferFactory().wrap(bytes);
        return exchange.getResponse().writeWith(Mono.just(buffer));
    }
}
