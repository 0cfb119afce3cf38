package dev.blogpulse.controller;

import dev.blogpulse.config.TrackingProperties;
import dev.blogpulse.dto.EngagementEventRequest;
import dev.blogpulse.dto.TrackRequest;
import dev.blogpulse.dto.TrackResponse;
import dev.blogpulse.service.Beacon;
import dev.blogpulse.service.TrackingService;
import dev.blogpulse.util.IpAddressExtractor;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpCookie;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.ReactiveSecurityContextHolder;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.util.Optional;

/**
 * Public beacon endpoints. Every call answers {@code 200 {"success":true}}, including malformed
 * bodies and failures inside the pipeline, so tracking can never break a page.
 */
@RestController
@RequestMapping("/api/v1/track")
@RequiredArgsConstructor
@Tag(name = "Tracking", description = "Page view and engagement beacons")
@Slf4j
public class TrackingController {

    static final int MAX_PATH_LENGTH = 512;
    static final int MAX_REFERRER_LENGTH = 2048;
    static final int MAX_SOURCE_LENGTH = 64;

    private final TrackingService trackingService;
    private final TrackingProperties properties;

    @PostMapping
    @Operation(summary = "Track page view", description = "Record a page view and refresh the visitor cookie")
    public Mono<TrackResponse> track(@RequestBody(required = false) Mono<TrackRequest> body,
                                     ServerWebExchange exchange) {
        ServerHttpRequest request = exchange.getRequest();
        String visitorToken = visitorToken(request);

        return readBody(body, new TrackRequest())
                .zipWith(currentUserId())
                .flatMap(tuple -> {
                    TrackRequest track = tuple.getT1();
                    String referrer = track.hasReferrer()
                            ? track.getReferrer()
                            : request.getHeaders().getFirst(HttpHeaders.REFERER);
                    Beacon beacon = new Beacon(
                            visitorToken,
                            tuple.getT2().orElse(null),
                            normalizePath(track.getPath()),
                            truncate(referrer, MAX_REFERRER_LENGTH),
                            truncate(track.getSource(), MAX_SOURCE_LENGTH),
                            IpAddressExtractor.userAgent(request),
                            IpAddressExtractor.anonymizeIp(IpAddressExtractor.extractClientIp(request)));
                    return trackingService.trackPageView(beacon);
                })
                .doOnNext(visitorId -> exchange.getResponse().addCookie(visitorCookie(visitorId)))
                .thenReturn(TrackResponse.ok());
    }

    @PostMapping("/end")
    @Operation(summary = "End session", description = "Close the visitor's active session")
    public Mono<TrackResponse> end(ServerWebExchange exchange) {
        return trackingService.endSession(visitorToken(exchange.getRequest()))
                .thenReturn(TrackResponse.ok());
    }

    @PostMapping("/blog/{postId}/engagement")
    @Operation(summary = "Track engagement", description = "Record a reader engagement event for a blog post")
    public Mono<TrackResponse> engagement(@PathVariable String postId,
                                          @RequestBody(required = false) Mono<EngagementEventRequest> body,
                                          ServerWebExchange exchange) {
        Long id = parsePostId(postId);
        if (id == null) {
            log.debug("Ignoring engagement beacon for invalid post id '{}'", postId);
            return Mono.just(TrackResponse.ok());
        }
        ServerHttpRequest request = exchange.getRequest();
        return readBody(body, new EngagementEventRequest())
                .flatMap(event -> trackingService.trackEngagement(id, event, visitorToken(request),
                        truncate(request.getHeaders().getFirst(HttpHeaders.REFERER), MAX_REFERRER_LENGTH)))
                .thenReturn(TrackResponse.ok());
    }

    private <T> Mono<T> readBody(Mono<T> body, T fallback) {
        if (body == null) {
            return Mono.just(fallback);
        }
        return body
                .onErrorResume(e -> {
                    log.debug("Unreadable beacon body: {}", e.getMessage());
                    return Mono.empty();
                })
                .defaultIfEmpty(fallback);
    }

    private Mono<Optional<String>> currentUserId() {
        return ReactiveSecurityContextHolder.getContext()
                .map(SecurityContext::getAuthentication)
                .filter(auth -> auth.isAuthenticated() && !(auth instanceof AnonymousAuthenticationToken))
                .map(Authentication::getName)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty());
    }

    private String visitorToken(ServerHttpRequest request) {
        HttpCookie cookie = request.getCookies().getFirst(properties.getVisitorCookieName());
        return cookie != null ? cookie.getValue() : null;
    }

    private ResponseCookie visitorCookie(String visitorId) {
        return ResponseCookie.from(properties.getVisitorCookieName(), visitorId)
                .path("/")
                .httpOnly(true)
                .secure(properties.isVisitorCookieSecure())
                .sameSite("Lax")
                .maxAge(properties.getVisitorCookieMaxAge())
                .build();
    }

    static String normalizePath(String path) {
        if (path == null || path.isBlank()) {
            return "/";
        }
        return truncate(path.trim(), MAX_PATH_LENGTH);
    }

    static String truncate(String value, int max) {
        if (value == null) {
            return null;
        }
        return value.length() > max ? value.substring(0, max) : value;
    }

    private static Long parsePostId(String raw) {
        try {
            long id = Long.parseLong(raw);
            return id > 0 ? id : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
