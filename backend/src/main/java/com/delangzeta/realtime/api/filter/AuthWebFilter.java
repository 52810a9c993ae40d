package com.delangzeta.realtime.api.filter;

import com.delangzeta.realtime.api.dto.CodedErrorBody;
import com.delangzeta.realtime.auth.AuthenticationException;
import com.delangzeta.realtime.auth.SessionTokenService;
import lombok.RequiredArgsConstructor;
import org.springframework.core.Ordered;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Optional;

/**
 * Bearer authentication for /api/v1. The blockchain history endpoint accepts anonymous callers.
 */
@Component
@RequiredArgsConstructor
public class AuthWebFilter implements WebFilter, Ordered {

    static final String API_PREFIX = "/api/v1";
    static final String PUBLIC_HISTORY_PATH = "/api/v1/blockchain/events";

    private final SessionTokenService sessionTokenService;
    private final JsonErrorWriter errorWriter;

    @Override
    public int getOrder() {
        return RateLimitWebFilter.ORDER + 10;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        ServerHttpRequest request = exchange.getRequest();
        String path = request.getPath().value();
        if (!path.startsWith(API_PREFIX) || RequestUsers.current(exchange).isPresent()) {
            return chain.filter(exchange);
        }
        Optional<String> token = RequestUsers.bearerToken(exchange);
        boolean optional = HttpMethod.GET.equals(request.getMethod()) && path.equals(PUBLIC_HISTORY_PATH);
        if (token.isEmpty()) {
            return optional
                    ? chain.filter(exchange)
                    : unauthorized(exchange, new AuthenticationException(AuthenticationException.AUTH_REQUIRED,
                    "Authorization token required"));
        }
        return Mono.fromCallable(() -> sessionTokenService.authenticate(token.get()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(user -> {
                    RequestUsers.set(exchange, user);
                    return Boolean.TRUE;
                })
                .onErrorResume(AuthenticationException.class,
                        e -> optional ? Mono.just(Boolean.FALSE) : unauthorized(exchange, e).then(Mono.empty()))
                .flatMap(authenticated -> chain.filter(exchange));
    }

    private Mono<Void> unauthorized(ServerWebExchange exchange, AuthenticationException e) {
        return errorWriter.write(exchange, HttpStatus.UNAUTHORIZED, CodedErrorBody.of(e.getMessage(), e.getCode()));
    }
}
