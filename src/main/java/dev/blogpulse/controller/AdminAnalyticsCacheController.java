package dev.blogpulse.controller;

import dev.blogpulse.dto.AnalyticsCacheStats;
import dev.blogpulse.service.cache.AnalyticsCache;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/admin/analytics-cache")
@RequiredArgsConstructor
@Validated
@PreAuthorize("hasRole('ADMIN')")
@Tag(name = "Admin - Analytics Cache", description = "Report cache management endpoints")
@SecurityRequirement(name = "Bearer Authentication")
@Slf4j
public class AdminAnalyticsCacheController {

    private final AnalyticsCache analyticsCache;

    @GetMapping("/stats")
    @Operation(summary = "Get cache statistics", description = "Current entry counts by topic")
    public Mono<ResponseEntity<AnalyticsCacheStats>> getCacheStats() {
        log.debug("Fetching analytics cache stats");
        return analyticsCache.stats()
                .map(ResponseEntity::ok);
    }

    @DeleteMapping
    @Operation(summary = "Invalidate cache entries", description = "Remove one key or every key matching a glob, all entries by default")
    public Mono<ResponseEntity<Map<String, Object>>> invalidate(
            @RequestParam(defaultValue = "*") @Size(max = 128) @Pattern(regexp = "[A-Za-z0-9:_*?\\-]+") String pattern) {
        log.info("Invalidating analytics cache: pattern={}", pattern);
        return analyticsCache.invalidate(pattern)
                .map(count -> ResponseEntity.ok(Map.of(
                        "message", "Analytics cache invalidated",
                        "pattern", pattern,
                        "entriesRemoved", count
                )));
    }
}
