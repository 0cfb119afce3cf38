package dev.blogpulse.config;

import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@Getter
public class AnalyticsCacheProperties {

    private final Duration ttl;
    private final long maximumSize;

    public AnalyticsCacheProperties(
            @Value("${analytics.cache.ttl-seconds:60}") long ttlSeconds,
            @Value("${analytics.cache.maximum-size:1000}") long maximumSize) {
        this.ttl = Duration.ofSeconds(ttlSeconds);
        this.maximumSize = maximumSize;
    }

    public static AnalyticsCacheProperties defaults() {
        return new AnalyticsCacheProperties(60, 1000);
    }
}
