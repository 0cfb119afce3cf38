package dev.blogpulse.util;

import org.springframework.http.HttpHeaders;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.server.ServerWebExchange;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Client identity helpers for beacons: IP resolution behind reverse proxies,
 * IP anonymization before storage, and bounded header reads.
 * <p>
 * Proxy headers are honoured only when the direct peer is a trusted proxy, and
 * {@code X-Forwarded-For} is walked right to left so a client cannot spoof its address.
 */
public final class IpAddressExtractor {

    public static final String UNKNOWN = "unknown";

    private static final Pattern IP_PATTERN = Pattern.compile("^[0-9a-fA-F.:]+$");
    private static final int MAX_IP_LENGTH = 45;
    private static final int MAX_USER_AGENT_LENGTH = 512;

    private static volatile Set<String> trustedProxies = Set.of("127.0.0.1", "::1", "0:0:0:0:0:0:0:1");

    /** Container bridge and K8s pod networks. */
    private static final String[] TRUSTED_PREFIXES = {
            "172.17.", "172.18.", "172.19.", "172.20.", "10.42.", "10.43."
    };

    private IpAddressExtractor() {
        // Utility class
    }

    public static void setTrustedProxies(Set<String> proxies) {
        trustedProxies = Set.copyOf(proxies);
    }

    public static String extractClientIp(ServerWebExchange exchange) {
        return extractClientIp(exchange.getRequest());
    }

    /**
     * @return the client IP, or {@value #UNKNOWN} when the peer address is missing
     */
    public static String extractClientIp(ServerHttpRequest request) {
        String remoteIp = Optional.ofNullable(request.getRemoteAddress())
                .map(InetSocketAddress::getAddress)
                .map(InetAddress::getHostAddress)
                .orElse(UNKNOWN);

        if (!isTrustedProxy(remoteIp)) {
            return remoteIp;
        }

        String forwardedFor = request.getHeaders().getFirst("X-Forwarded-For");
        if (forwardedFor != null && !forwardedFor.isBlank()) {
            String[] hops = forwardedFor.split(",");
            for (int i = hops.length - 1; i >= 0; i--) {
                String hop = hops[i].trim();
                if (isValidIp(hop) && !isTrustedProxy(hop)) {
                    return hop;
                }
            }
        }

        String realIp = request.getHeaders().getFirst("X-Real-IP");
        if (isValidIp(realIp)) {
            return realIp.trim();
        }
        return remoteIp;
    }

    /**
     * Zero the last IPv4 octet, or keep only the /64 prefix of an IPv6 address.
     */
    public static String anonymizeIp(String ip) {
        if (ip == null || ip.isBlank() || UNKNOWN.equals(ip)) {
            return UNKNOWN;
        }
        if (ip.contains(".") && !ip.contains(":")) {
            int lastDot = ip.lastIndexOf('.');
            return lastDot > 0 ? ip.substring(0, lastDot) + ".0" : UNKNOWN;
        }
        String[] groups = ip.split(":");
        if (groups.length >= 4) {
            return String.join(":", groups[0], groups[1], groups[2], groups[3]) + "::";
        }
        return UNKNOWN;
    }

    public static String userAgent(ServerHttpRequest request) {
        String agent = request.getHeaders().getFirst(HttpHeaders.USER_AGENT);
        if (agent == null || agent.isBlank()) {
            return null;
        }
        return agent.length() > MAX_USER_AGENT_LENGTH ? agent.substring(0, MAX_USER_AGENT_LENGTH) : agent;
    }

    public static boolean isValidIp(String ip) {
        return ip != null
                && !ip.isBlank()
                && ip.trim().length() <= MAX_IP_LENGTH
                && IP_PATTERN.matcher(ip.trim()).matches();
    }

    private static boolean isTrustedProxy(String ip) {
        if (ip == null || ip.isBlank()) {
            return false;
        }
        if (trustedProxies.contains(ip)) {
            return true;
        }
        for (String prefix : TRUSTED_PREFIXES) {
            if (ip.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }
}
