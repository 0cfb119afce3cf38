package dev.blogpulse.config;

import dev.blogpulse.util.IpAddressExtractor;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Hands the {@code app.trusted-proxies} list to {@link IpAddressExtractor} at startup.
 * Beacon IPs are read from forwarding headers only when the direct peer is on this list
 * (or on one of the extractor's container network prefixes).
 */
@Configuration(proxyBeanMethods = false)
@Slf4j
public class TrustedProxyConfig {

    private final Set<String> trustedProxies;

    public TrustedProxyConfig(@Value("${app.trusted-proxies:127.0.0.1,::1,0:0:0:0:0:0:0:1}") String trustedProxies) {
        this.trustedProxies = parse(trustedProxies);
    }

    @PostConstruct
    public void applyTrustedProxies() {
        IpAddressExtractor.setTrustedProxies(trustedProxies);
        log.info("Beacon IP resolution trusts {} proxy address(es)", trustedProxies.size());
        log.debug("Trusted proxies: {}", trustedProxies);
    }

    /**
     * Comma-separated list; blanks and surrounding whitespace are dropped.
     */
    static Set<String> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Set.of();
        }
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
    }

    Set<String> trustedProxies() {
        return trustedProxies;
    }
}
