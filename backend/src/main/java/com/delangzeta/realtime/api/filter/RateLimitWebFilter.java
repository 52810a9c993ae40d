package com.delangzeta.realtime.api.filter;

import com.delangzeta.realtime.api.dto.CodedErrorBody;
import com.delangzeta.realtime.auth.AuthenticatedUser;
import com.delangzeta.realtime.auth.SessionTokenService;
import com.delangzeta.realtime.ratelimit.DistributedRateLimiter;
import com.delangzeta.realtime.ratelimit.RateLimitDecision;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.net.InetSocketAddress;
import java.util.Optional;

/**
 * Limits every request except /health, first per client IP and then per user when a valid token is
 * presented. Runs before {@link AuthWebFilter} so unauthenticated floods are limited too.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RateLimitWebFilter implements WebFilter, Ordered {

    public static final int ORDER = Ordered.HIGHEST_PRECEDENCE + 10;

    static final String RATE_LIMIT_IP = "RATE_LIMIT_IP";
    static final String RATE_LIMIT_USER = "RATE_LIMIT_USER";

    private final DistributedRateLimiter rateLimiter;
    private final SessionTokenService sessionTokenService;
    private final JsonErrorWriter errorWriter;

    @Override
    public int getOrder() {
        return ORDER;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        if (exchange.getRequest().getPath().value().equals("/health")) {
            return chain.filter(exchange);
        }
        String ip = clientIp(exchange);
        return Mono.fromCallable(() -> rateLimiter.checkIp(ip))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(ipDecision -> {
                    addHeaders(exchange, "IP", ipDecision);
                    if (!ipDecision.allowed()) {
                        log.info("IP {} over its request limit", ip);
                        return reject(exchange, "Too many requests from this IP", RATE_LIMIT_IP, ipDecision);
                    }
                    return Mono.fromCallable(() -> checkUser(exchange))
                            .subscribeOn(Schedulers.boundedElastic())
                            .flatMap(userDecision -> {
                                if (userDecision.isEmpty()) {
                                    return chain.filter(exchange);
                                }
                                RateLimitDecision decision = userDecision.get();
                                addHeaders(exchange, "User", decision);
                                if (!decision.allowed()) {
                                    return reject(exchange, "Too many requests for this user", RATE_LIMIT_USER, decision);
                                }
                                return chain.filter(exchange);
                            });
                });
    }

    private Optional<RateLimitDecision> checkUser(ServerWebExchange exchange) {
        Optional<AuthenticatedUser> user = RequestUsers.bearerToken(exchange)
                .flatMap(sessionTokenService::tryAuthenticate);
        user.ifPresent(u -> RequestUsers.set(exchange, u));
        return user.map(u -> rateLimiter.checkUser(u.userId()));
    }

    private Mono<Void> reject(ServerWebExchange exchange, String message, String code, RateLimitDecision decision) {
        long retryAfter = decision.retryAfterSeconds(rateLimiter.nowMs());
        exchange.getResponse().getHeaders().set(HttpHeaders.RETRY_AFTER, Long.toString(retryAfter));
        return errorWriter.write(exchange, HttpStatus.TOO_MANY_REQUESTS, new CodedErrorBody(message, code, retryAfter));
    }

    private static void addHeaders(ServerWebExchange exchange, String suffix, RateLimitDecision decision) {
        HttpHeaders headers = exchange.getResponse().getHeaders();
        headers.set("X-RateLimit-Limit-" + suffix, Integer.toString(decision.limit()));
        headers.set("X-RateLimit-Remaining-" + suffix, Integer.toString(decision.remaining()));
        headers.set("X-RateLimit-Reset-" + suffix, Long.toString(decision.resetEpochSeconds()));
    }

    static String clientIp(ServerWebExchange exchange) {
        String forwarded = exchange.getRequest().getHeaders().getFirst("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.split(",")[0].trim();
        }
        InetSocketAddress remote = exchange.getRequest().getRemoteAddress();
        if (remote == null) {
            return "unknown";
        }
        return remote.getAddress() != null ? remote.getAddress().getHostAddress() : remote.getHostString();
    }
}
