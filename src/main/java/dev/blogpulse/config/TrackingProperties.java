package dev.blogpulse.config;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Settings of the ingestion pipeline: session lifecycle, dedupe windows, cookie and attribution origin.
 */
@Component
@Getter
@Slf4j
public class TrackingProperties {

    private final Duration sessionTimeout;
    private final Duration pageViewDedupeWindow;
    private final Duration visitorSeenTtl;
    private final Duration scrollKeyTtl;
    private final String siteOrigin;
    private final String visitorCookieName;
    private final Duration visitorCookieMaxAge;
    private final boolean visitorCookieSecure;
    private final long maxTimeSampleSeconds;

    public TrackingProperties(
            @Value("${tracking.session.inactivity-timeout-minutes:30}") long sessionTimeoutMinutes,
            @Value("${tracking.dedupe.page-view-window-ms:2000}") long pageViewDedupeWindowMs,
            @Value("${tracking.dedupe.visitor-seen-ttl-hours:24}") long visitorSeenTtlHours,
            @Value("${tracking.dedupe.scroll-key-ttl-hours:24}") long scrollKeyTtlHours,
            @Value("${tracking.site-origin:http://localhost:3000}") String siteOrigin,
            @Value("${tracking.cookie.name:ps_vid}") String visitorCookieName,
            @Value("${tracking.cookie.max-age-days:30}") long visitorCookieMaxAgeDays,
            @Value("${tracking.cookie.secure:false}") boolean visitorCookieSecure,
            @Value("${tracking.engagement.max-time-sample-seconds:14400}") long maxTimeSampleSeconds) {
        this.sessionTimeout = Duration.ofMinutes(sessionTimeoutMinutes);
        this.pageViewDedupeWindow = Duration.ofMillis(pageViewDedupeWindowMs);
        this.visitorSeenTtl = Duration.ofHours(visitorSeenTtlHours);
        this.scrollKeyTtl = Duration.ofHours(scrollKeyTtlHours);
        this.siteOrigin = siteOrigin;
        this.visitorCookieName = visitorCookieName;
        this.visitorCookieMaxAge = Duration.ofDays(visitorCookieMaxAgeDays);
        this.visitorCookieSecure = visitorCookieSecure;
        this.maxTimeSampleSeconds = maxTimeSampleSeconds;
        log.info("Tracking configured: sessionTimeout={}, siteOrigin={}", sessionTimeout, siteOrigin);
    }

    /** Defaults matching application.yml, for tests and tools that build services by hand. */
    public static TrackingProperties defaults() {
        return new TrackingProperties(30, 2000, 24, 24, "http://localhost:3000", "ps_vid", 30, false, 14400);
    }
}
