package dev.blogpulse.controller;

import dev.blogpulse.dto.TrafficEventsPage;
import dev.blogpulse.dto.TrafficSummary;
import dev.blogpulse.service.TrafficQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/admin/traffic")
@RequiredArgsConstructor
@Validated
@PreAuthorize("hasRole('ADMIN')")
@Tag(name = "Admin - Traffic", description = "Traffic sources and raw page view log")
@SecurityRequirement(name = "Bearer Authentication")
public class AdminTrafficController {

    private final TrafficQueryService trafficQueryService;

    @GetMapping("/summary")
    @Operation(summary = "Traffic summary", description = "Page views per source and top external referrers")
    public Mono<TrafficSummary> summary(@RequestParam(required = false) String range) {
        return trafficQueryService.summary(range);
    }

    @GetMapping("/events")
    @Operation(summary = "Traffic events", description = "Page views newest first with per-source counts")
    public Mono<TrafficEventsPage> events(
            @RequestParam(required = false) String source,
            @RequestParam(required = false) String ref,
            @RequestParam(required = false) @Min(1) @Max(365) Integer days,
            @RequestParam(required = false) String range,
            @RequestParam(defaultValue = "50") @Min(1) @Max(200) int limit,
            @RequestParam(defaultValue = "0") @Min(0) int offset) {
        return trafficQueryService.events(source, ref, days, range, limit, offset);
    }
}
