package com.example.docs.common.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;

import java.net.InetSocketAddress;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ClientIpExtractor")
class ClientIpExtractorTest {

    @Test
    @DisplayName("should take the first X-Forwarded-For hop")
    void shouldUseFirstForwardedHop() {
        MockServerHttpRequest request = MockServerHttpRequest.get("/")
                .header("X-Forwarded-For", "198.51.100.4, 10.0.0.2, 10.0.0.3")
                .build();

        assertThat(ClientIpExtractor.extract(request)).isEqualTo("198.51.100.4");
    }

    @Test
    @DisplayName("should fall back to the remote address when the header is not an IP")
    void shouldFallBackToRemoteAddress() {
        MockServerHttpRequest request = MockServerHttpRequest.get("/")
                .header("X-Forwarded-For", "<script>")
                .remoteAddress(new InetSocketAddress("192.0.2.10", 4711))
                .build();

        assertThat(ClientIpExtractor.extract(request)).isEqualTo("192.0.2.10");
    }

    @Test
    @DisplayName("should return null without a request")
    void shouldHandleNullRequest() {
        assertThat(ClientIpExtractor.extract(null)).isNull();
    }

    @Test
    @DisplayName("should accept IPv6 addresses")
    void shouldAcceptIpv6() {
        assertThat(ClientIpExtractor.isValidIp("2001:db8::1")).isTrue();
        assertThat(ClientIpExtractor.isValidIp("not-an-ip")).isFalse();
    }
}
