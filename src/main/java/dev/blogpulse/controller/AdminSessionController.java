package dev.blogpulse.controller;

import dev.blogpulse.dto.PageViewResponse;
import dev.blogpulse.dto.SessionPage;
import dev.blogpulse.dto.SessionResponse;
import dev.blogpulse.service.SessionQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/admin/sessions")
@RequiredArgsConstructor
@Validated
@PreAuthorize("hasRole('ADMIN')")
@Tag(name = "Admin - Sessions", description = "Visitor session browsing")
@SecurityRequirement(name = "Bearer Authentication")
@Slf4j
public class AdminSessionController {

    private final SessionQueryService sessionQueryService;

    @GetMapping
    @Operation(summary = "List sessions", description = "Sessions newest first, filtered by source, user or visitor")
    public Mono<SessionPage> listSessions(
            @RequestParam(required = false) String source,
            @RequestParam(name = "user_id", required = false) String userId,
            @RequestParam(name = "visitor_id", required = false) String visitorId,
            @RequestParam(defaultValue = "50") @Min(1) @Max(200) int limit,
            @RequestParam(defaultValue = "0") @Min(0) int offset) {
        log.debug("Listing sessions: source={}, limit={}, offset={}", source, limit, offset);
        return sessionQueryService.listSessions(source, userId, visitorId, limit, offset);
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get session", description = "Session detail with derived state and event count")
    public Mono<SessionResponse> getSession(@PathVariable UUID id) {
        return sessionQueryService.getSession(id);
    }

    @GetMapping("/{id}/events")
    @Operation(summary = "Get session events", description = "Page views of the session in arrival order")
    public Mono<List<PageViewResponse>> getSessionEvents(@PathVariable UUID id) {
        return sessionQueryService.getSessionEvents(id);
    }
}
