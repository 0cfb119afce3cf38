package dev.blogpulse.controller;

import dev.blogpulse.dto.DashboardOverview;
import dev.blogpulse.service.DashboardQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/admin/dashboard")
@RequiredArgsConstructor
@PreAuthorize("hasRole('ADMIN')")
@Tag(name = "Admin - Dashboard", description = "Traffic overview")
@SecurityRequirement(name = "Bearer Authentication")
public class AdminDashboardController {

    private final DashboardQueryService dashboardQueryService;

    @GetMapping("/overview")
    @Operation(summary = "Dashboard overview", description = "Visitors, sessions and page views for the last day and week")
    public Mono<DashboardOverview> overview() {
        return dashboardQueryService.overview();
    }
}
