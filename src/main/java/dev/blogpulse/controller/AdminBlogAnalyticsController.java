package dev.blogpulse.controller;

import dev.blogpulse.dto.AudienceResponse;
import dev.blogpulse.dto.BlogAnalyticsOverview;
import dev.blogpulse.dto.HeatmapResponse;
import dev.blogpulse.dto.Leaderboard;
import dev.blogpulse.dto.PostAnalyticsResponse;
import dev.blogpulse.dto.TimelinePoint;
import dev.blogpulse.service.BlogAnalyticsService;
import dev.blogpulse.service.EngagementService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/admin/blog-analytics")
@RequiredArgsConstructor
@Validated
@PreAuthorize("hasRole('ADMIN')")
@Tag(name = "Admin - Blog Analytics", description = "Per-post engagement reports")
@SecurityRequirement(name = "Bearer Authentication")
@Slf4j
public class AdminBlogAnalyticsController {

    private final BlogAnalyticsService blogAnalyticsService;
    private final EngagementService engagementService;

    @GetMapping
    @Operation(summary = "Blog overview", description = "Totals across all posts plus top performers")
    public Mono<BlogAnalyticsOverview> overview() {
        return blogAnalyticsService.overview();
    }

    @GetMapping("/leaderboard")
    @Operation(summary = "Leaderboard", description = "Posts ranked by views, engagement, shares and time on page")
    public Mono<Leaderboard> leaderboard() {
        return blogAnalyticsService.leaderboard();
    }

    @GetMapping("/{postId}")
    @Operation(summary = "Post analytics", description = "Counters, derived rates, score and trends for one post")
    public Mono<PostAnalyticsResponse> postAnalytics(@PathVariable @Min(1) Long postId) {
        return blogAnalyticsService.postAnalytics(postId);
    }

    @GetMapping("/{postId}/audience")
    @Operation(summary = "Post audience", description = "New versus returning readers and traffic sources")
    public Mono<AudienceResponse> audience(@PathVariable @Min(1) Long postId) {
        return blogAnalyticsService.audience(postId);
    }

    @GetMapping("/{postId}/heatmap")
    @Operation(summary = "Post heatmap", description = "Scroll, time-on-page and click distributions")
    public Mono<HeatmapResponse> heatmap(@PathVariable @Min(1) Long postId) {
        return blogAnalyticsService.heatmap(postId);
    }

    @GetMapping("/{postId}/timeline")
    @Operation(summary = "Post timeline", description = "Daily views, unique readers and engagement")
    public Mono<List<TimelinePoint>> timeline(
            @PathVariable @Min(1) Long postId,
            @RequestParam(defaultValue = "30") @Min(1) @Max(365) int days) {
        return blogAnalyticsService.timeline(postId, days);
    }

    @DeleteMapping("/{postId}/stats")
    @Operation(summary = "Reset post statistics", description = "Zero every engagement counter of the post")
    public Mono<ResponseEntity<Map<String, Object>>> resetStats(@PathVariable @Min(1) Long postId) {
        log.info("Resetting engagement statistics: postId={}", postId);
        return engagementService.resetStats(postId)
                .thenReturn(ResponseEntity.ok(Map.of(
                        "message", "Post statistics reset",
                        "postId", postId
                )));
    }
}
