package dev.blogpulse.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;

import java.net.InetSocketAddress;

import static org.assertj.core.api.Assertions.assertThat;

class IpAddressExtractorTest {

    @Nested
    @DisplayName("extractClientIp")
    class ExtractClientIp {

        @Test
        @DisplayName("Should take the rightmost untrusted hop behind a trusted proxy")
        void rightmostUntrustedHop() {
            MockServerHttpRequest request = MockServerHttpRequest.post("/api/v1/track")
                    .remoteAddress(new InetSocketAddress("127.0.0.1", 8080))
                    .header("X-Forwarded-For", "203.0.113.50, 70.41.3.18, 150.172.238.178")
                    .build();

            assertThat(IpAddressExtractor.extractClientIp(request)).isEqualTo("150.172.238.178");
        }

        @Test
        @DisplayName("Should ignore proxy headers from an untrusted peer")
        void untrustedPeer() {
            MockServerHttpRequest request = MockServerHttpRequest.post("/api/v1/track")
                    .remoteAddress(new InetSocketAddress("198.51.100.7", 5555))
                    .header("X-Forwarded-For", "1.2.3.4")
                    .build();

            assertThat(IpAddressExtractor.extractClientIp(request)).isEqualTo("198.51.100.7");
        }

        @Test
        @DisplayName("Should fall back to X-Real-IP when X-Forwarded-For is garbage")
        void realIpFallback() {
            MockServerHttpRequest request = MockServerHttpRequest.post("/api/v1/track")
                    .remoteAddress(new InetSocketAddress("127.0.0.1", 8080))
                    .header("X-Forwarded-For", "<script>alert(1)</script>")
                    .header("X-Real-IP", "203.0.113.10")
                    .build();

            assertThat(IpAddressExtractor.extractClientIp(request)).isEqualTo("203.0.113.10");
        }
    }

    @Nested
    @DisplayName("anonymizeIp")
    class AnonymizeIp {

        @Test
        @DisplayName("Should zero the last IPv4 octet")
        void ipv4() {
            assertThat(IpAddressExtractor.anonymizeIp("203.0.113.50")).isEqualTo("203.0.113.0");
        }

        @Test
        @DisplayName("Should keep the /64 prefix of an IPv6 address")
        void ipv6() {
            assertThat(IpAddressExtractor.anonymizeIp("2001:db8:85a3:8d3:1319:8a2e:370:7348"))
                    .isEqualTo("2001:db8:85a3:8d3::");
        }

        @Test
        @DisplayName("Should return unknown for missing input")
        void missing() {
            assertThat(IpAddressExtractor.anonymizeIp(null)).isEqualTo(IpAddressExtractor.UNKNOWN);
            assertThat(IpAddressExtractor.anonymizeIp("unknown")).isEqualTo(IpAddressExtractor.UNKNOWN);
        }
    }

    @Test
    @DisplayName("Should truncate long user agents and drop blank ones")
    void userAgent() {
        MockServerHttpRequest longAgent = MockServerHttpRequest.get("/")
                .header(HttpHeaders.USER_AGENT, "x".repeat(2000))
                .build();
        MockServerHttpRequest blankAgent = MockServerHttpRequest.get("/")
                .header(HttpHeaders.USER_AGENT, " ")
                .build();

        assertThat(IpAddressExtractor.userAgent(longAgent)).hasSize(512);
        assertThat(IpAddressExtractor.userAgent(blankAgent)).isNull();
    }
}
