package dev.blogpulse.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters for the ingestion pipeline. Swallowed stage failures are only
 * visible here and in the logs, so every catch site reports to this class.
 */
@Component
public class TrackingMetrics {

    private final MeterRegistry meterRegistry;
    private final AtomicLong activeSessions = new AtomicLong(0);

    private final Counter beaconsAccepted;
    private final Counter beaconsDeduplicated;
    private final Counter beaconsDropped;
    private final Counter engagementAccepted;
    private final Counter engagementIgnored;

    public TrackingMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.beaconsAccepted = meterRegistry.counter("tracking.beacons", "outcome", "accepted");
        this.beaconsDeduplicated = meterRegistry.counter("tracking.beacons", "outcome", "deduplicated");
        this.beaconsDropped = meterRegistry.counter("tracking.beacons", "outcome", "rate_limited");
        this.engagementAccepted = meterRegistry.counter("tracking.engagement.events", "outcome", "accepted");
        this.engagementIgnored = meterRegistry.counter("tracking.engagement.events", "outcome", "ignored");
        Gauge.builder("tracking.sessions.active", activeSessions, AtomicLong::get)
                .description("Sessions seen within the inactivity timeout")
                .register(meterRegistry);
    }

    public void beaconAccepted() {
        beaconsAccepted.increment();
    }

    public void beaconDeduplicated() {
        beaconsDeduplicated.increment();
    }

    public void beaconRateLimited() {
        beaconsDropped.increment();
    }

    public void engagementAccepted() {
        engagementAccepted.increment();
    }

    public void engagementIgnored() {
        engagementIgnored.increment();
    }

    /**
     * @param stage pipeline stage that failed, e.g. {@code visitor}, {@code session}, {@code event_log}
     */
    public void stageFailure(String stage) {
        meterRegistry.counter("tracking.stage.failures", "stage", stage).increment();
    }

    /**
     * @param kind {@code page_view}, {@code post_visitor} or {@code scroll}
     */
    public void dedupeHit(String kind) {
        meterRegistry.counter("tracking.dedupe.hits", "kind", kind).increment();
    }

    public void rateLimitRejected(String routeClass) {
        meterRegistry.counter("ratelimit.rejections", "route_class", routeClass).increment();
    }

    public void cacheFailure(String operation) {
        meterRegistry.counter("analytics.cache.failures", "operation", operation).increment();
    }

    public void setActiveSessions(long count) {
        activeSessions.set(count);
    }
}
