package dev.blogpulse.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.blogpulse.metrics.TrackingMetrics;
import dev.blogpulse.service.cache.AnalyticsCache;
import dev.blogpulse.service.cache.InMemoryAnalyticsCache;
import dev.blogpulse.service.cache.RedisAnalyticsCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.ReactiveRedisTemplate;

/**
 * Picks the {@link AnalyticsCache} backend: Redis when {@code spring.cache.type=redis} (the default),
 * a local Caffeine cache otherwise.
 */
@Configuration(proxyBeanMethods = false)
@Slf4j
public class AnalyticsCacheConfig {

    @Bean
    @ConditionalOnProperty(name = "spring.cache.type", havingValue = "redis", matchIfMissing = true)
    public AnalyticsCache redisAnalyticsCache(ReactiveRedisTemplate<String, String> redisTemplate,
                                              ObjectMapper objectMapper,
                                              TrackingMetrics metrics,
                                              ResilienceConfig resilience) {
        log.info("Configuring REDIS analytics cache");
        return new RedisAnalyticsCache(redisTemplate, objectMapper, metrics, resilience.getRedisTimeout());
    }

    @Bean
    @ConditionalOnExpression("'${spring.cache.type:redis}' != 'redis'")
    public AnalyticsCache inMemoryAnalyticsCache(AnalyticsCacheProperties properties) {
        log.info("Configuring in-memory analytics cache (maximumSize={})", properties.getMaximumSize());
        return new InMemoryAnalyticsCache(properties.getMaximumSize());
    }
}
