package dev.blogpulse.service;

import dev.blogpulse.entity.Visitor;
import dev.blogpulse.repository.VisitorRepository;
import dev.blogpulse.util.Attribution;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Resolves the anonymous visitor behind a beacon.
 * <p>
 * Creation is {@code INSERT ... ON CONFLICT DO NOTHING} keyed by the client token; a request that
 * loses a creation race reads the winner's row. {@code first_source} is written by the insert only.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VisitorService {

    private final VisitorRepository visitorRepository;

    /**
     * @param clientToken visitor cookie value, may be null or garbage
     * @param attribution attribution of this beacon, stored as first source if the visitor is created
     */
    public Mono<VisitorIdentity> identify(String clientToken, Attribution attribution, String landingPath,
                                          String userId, LocalDateTime now) {
        if (!isValidToken(clientToken)) {
            return create(UUID.randomUUID().toString(), attribution, landingPath, userId, now);
        }
        return visitorRepository.findById(clientToken)
                .flatMap(visitor -> visitorRepository.touch(visitor.getId(), userId, now)
                        .thenReturn(existing(visitor)))
                // Unknown but well-formed token: the row was purged, keep the cookie id.
                .switchIfEmpty(Mono.defer(() -> create(clientToken, attribution, landingPath, userId, now)));
    }

    private Mono<VisitorIdentity> create(String visitorId, Attribution attribution, String landingPath,
                                         String userId, LocalDateTime now) {
        String firstSource = attribution.category().value();
        return visitorRepository.insertIfAbsent(visitorId, firstSource, attribution.referrer(), landingPath, userId, now)
                .flatMap(inserted -> {
                    if (inserted > 0) {
                        log.debug("New visitor {} from {}", visitorId, firstSource);
                        return Mono.just(new VisitorIdentity(visitorId, true, firstSource));
                    }
                    log.debug("Visitor {} created concurrently, using existing row", visitorId);
                    return visitorRepository.findById(visitorId)
                            .map(this::existing)
                            .defaultIfEmpty(new VisitorIdentity(visitorId, false, firstSource));
                });
    }

    private VisitorIdentity existing(Visitor visitor) {
        return new VisitorIdentity(visitor.getId(), false, visitor.getFirstSource());
    }

    static boolean isValidToken(String token) {
        if (token == null || token.length() != 36) {
            return false;
        }
        try {
            UUID.fromString(token);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
