package dev.blogpulse.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.MalformedJwtException;
import io.jsonwebtoken.UnsupportedJwtException;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;

/**
 * Verifies access tokens issued by the blog's auth service. This service never issues tokens.
 */
@Component
@Slf4j
public class JwtTokenProvider {

    /** HS512 needs a 512-bit key. */
    static final int MIN_SECRET_LENGTH = 64;

    private final JwtParser jwtParser;

    public JwtTokenProvider(@Value("${jwt.secret}") String secret,
                            @Value("${jwt.issuer:portfolio-blog}") String issuer,
                            @Value("${jwt.audience:portfolio-blog-api}") String audience) {
        if (secret == null || secret.length() < MIN_SECRET_LENGTH) {
            throw new IllegalStateException(String.format(
                    "JWT secret must be at least %d characters for HS512. Current length: %d",
                    MIN_SECRET_LENGTH, secret == null ? 0 : secret.length()));
        }
        SecretKey key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.jwtParser = Jwts.parser()
                .verifyWith(key)
                .requireIssuer(issuer)
                .requireAudience(audience)
                .build();
        log.info("JWT verification configured: issuer={}, audience={}", issuer, audience);
    }

    public record TokenValidationResult(boolean valid, boolean expired, Claims claims, String error) {
        public static TokenValidationResult success(Claims claims) {
            return new TokenValidationResult(true, false, claims, null);
        }

        public static TokenValidationResult expired(String message) {
            return new TokenValidationResult(false, true, null, message);
        }

        public static TokenValidationResult invalid(String message) {
            return new TokenValidationResult(false, false, null, message);
        }
    }

    /**
     * Check signature, issuer, audience and expiry in one pass.
     */
    public TokenValidationResult validateAndParseClaims(String token) {
        try {
            Claims claims = jwtParser.parseSignedClaims(token).getPayload();
            return TokenValidationResult.success(claims);
        } catch (ExpiredJwtException e) {
            log.debug("JWT token expired: {}", e.getMessage());
            return TokenValidationResult.expired("Token expired");
        } catch (MalformedJwtException e) {
            log.warn("JWT token malformed: {}", e.getMessage());
            return TokenValidationResult.invalid("Malformed token");
        } catch (UnsupportedJwtException e) {
            log.warn("JWT token uses unsupported features: {}", e.getMessage());
            return TokenValidationResult.invalid("Unsupported token format");
        } catch (JwtException e) {
            log.warn("JWT validation failed: {}", e.getMessage());
            return TokenValidationResult.invalid("Invalid token");
        } catch (IllegalArgumentException e) {
            log.warn("JWT token is null or empty: {}", e.getMessage());
            return TokenValidationResult.invalid("Empty or null token");
        }
    }
}
