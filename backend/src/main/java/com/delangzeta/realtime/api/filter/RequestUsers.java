package com.delangzeta.realtime.api.filter;

import com.delangzeta.realtime.auth.AuthenticatedUser;
import com.delangzeta.realtime.auth.AuthenticationException;
import org.springframework.http.HttpHeaders;
import org.springframework.web.server.ServerWebExchange;

import java.util.Optional;

/**
 * Exchange attribute holding the resolved caller, and bearer token extraction.
 */
public final class RequestUsers {

    public static final String ATTRIBUTE = "realtime.authenticatedUser";

    private static final String BEARER = "Bearer ";

    private RequestUsers() {
    }

    public static Optional<String> bearerToken(ServerWebExchange exchange) {
        String header = exchange.getRequest().getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
        if (header == null || !header.regionMatches(true, 0, BEARER, 0, BEARER.length())) {
            return Optional.empty();
        }
        String token = header.substring(BEARER.length()).trim();
        return token.isEmpty() ? Optional.empty() : Optional.of(token);
    }

    public static Optional<AuthenticatedUser> current(ServerWebExchange exchange) {
        return Optional.ofNullable(exchange.getAttribute(ATTRIBUTE));
    }

    /**
     * @throws AuthenticationException AUTH_REQUIRED when no caller was resolved for this exchange
     */
    public static AuthenticatedUser require(ServerWebExchange exchange) {
        return current(exchange).orElseThrow(() -> new AuthenticationException(
                AuthenticationException.AUTH_REQUIRED, "Authorization token required"));
    }

    static void set(ServerWebExchange exchange, AuthenticatedUser user) {
        exchange.getAttributes().put(ATTRIBUTE, user);
    }
}
