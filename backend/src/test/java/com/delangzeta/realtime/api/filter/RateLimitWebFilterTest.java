package com.delangzeta.realtime.api.filter;

import org.junit.jupiter.api.Test;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;

import java.net.InetSocketAddress;

import static org.assertj.core.api.Assertions.assertThat;

class RateLimitWebFilterTest {

    @Test
    void firstForwardedAddressWins() {
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/api/v1/sync")
                .header("X-Forwarded-For", " 203.0.113.7 , 10.0.0.1")
                .remoteAddress(new InetSocketAddress("127.0.0.1", 5000)));

        assertThat(RateLimitWebFilter.clientIp(exchange)).isEqualTo("203.0.113.7");
    }

    @Test
    void fallsBackToRemoteAddress() {
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/api/v1/sync")
                .remoteAddress(new InetSocketAddress("127.0.0.1", 5000)));

        assertThat(RateLimitWebFilter.clientIp(exchange)).isEqualTo("127.0.0.1");
    }

    @Test
    void unknownWithoutAnyAddress() {
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/api/v1/sync"));

        assertThat(RateLimitWebFilter.clientIp(exchange)).isEqualTo("unknown");
    }
}
