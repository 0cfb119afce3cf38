package dev.blogpulse.security;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpCookie;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.ReactiveSecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Set;

/**
 * Turns a bearer token (header or {@code access_token} cookie) into an authentication.
 * <p>
 * On tracking routes a bad token is ignored and the beacon is processed anonymously;
 * anywhere else it is answered with 401.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JwtAuthenticationFilter implements WebFilter {

    static final String ACCESS_TOKEN_COOKIE = "access_token";
    static final String TRACKING_PATH_PREFIX = "/api/v1/track";

    /** Roles the auth service may issue. Anything else is rejected. */
    private static final Set<String> ALLOWED_ROLES = Set.of("ADMIN", "DEV", "EDITOR", "VIEWER");

    private final JwtTokenProvider tokenProvider;

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String jwt = getJwtFromRequest(exchange);
        if (!StringUtils.hasText(jwt)) {
            return chain.filter(exchange);
        }

        String path = exchange.getRequest().getPath().value();
        boolean tracking = path.startsWith(TRACKING_PATH_PREFIX);
        var validation = tokenProvider.validateAndParseClaims(jwt);

        if (!validation.valid()) {
            if (tracking) {
                return chain.filter(exchange);
            }
            log.warn("Access denied: {} for path: {}", validation.error(), path);
            return unauthorizedResponse(exchange, validation.error());
        }

        String subject = validation.claims().getSubject();
        String role = validation.claims().get("role", String.class);
        if (role == null || !ALLOWED_ROLES.contains(role)) {
            if (tracking) {
                return chain.filter(exchange);
            }
            log.warn("Access denied: invalid role '{}' for subject: {}", role, subject);
            return unauthorizedResponse(exchange, "Invalid role");
        }

        log.debug("Authenticated {} with role {}", subject, role);
        var auth = new UsernamePasswordAuthenticationToken(
                subject, null, Collections.singleton(new SimpleGrantedAuthority("ROLE_" + role)));
        return chain.filter(exchange)
                .contextWrite(ReactiveSecurityContextHolder.withAuthentication(auth));
    }

    private String getJwtFromRequest(ServerWebExchange exchange) {
        String bearerToken = exchange.getRequest().getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
        if (StringUtils.hasText(bearerToken) && bearerToken.startsWith("Bearer ")) {
            return bearerToken.substring(7);
        }
        HttpCookie cookie = exchange.getRequest().getCookies().getFirst(ACCESS_TOKEN_COOKIE);
        if (cookie != null && StringUtils.hasText(cookie.getValue())) {
            return cookie.getValue();
        }
        return null;
    }

    private Mono<Void> unauthorizedResponse(ServerWebExchange exchange, String message) {
        exchange.getResponse().setStatusCode(HttpStatus.UNAUTHORIZED);
        exchange.getResponse().getHeaders().setContentType(MediaType.APPLICATION_JSON);
        String safeMessage = message.replace("\\", "\\\\").replace("\"", "\\\"");
        String body = "{\"error\":\"Unauthorized\",\"message\":\"" + safeMessage + "\"}";
        DataBuffer buffer = exchange.getResponse().bufferFactory()
                .wrap(body.getBytes(StandardCharsets.UTF_8));
        return exchange.getResponse().writeWith(Mono.just(buffer));
    }
}
