package com.delangzeta.realtime.notification.gateway;

import java.util.List;
import java.util.Set;

/**
 * Per-token outcome of one push, in token order.
 */
public record PushResult(List<TokenResult> results) {

    private static final Set<String> UNREGISTERED_ERRORS = Set.of("NotRegistered", "InvalidRegistration");

    public long successCount() {
        return results.stream().filter(TokenResult::success).count();
    }

    public boolean anySucceeded() {
        return results.stream().anyMatch(TokenResult::success);
    }

    /** Tokens the gateway no longer accepts; they should be deactivated. */
    public List<String> unregisteredTokens() {
        return results.stream()
                .filter(r -> !r.success() && r.error() != null && UNREGISTERED_ERRORS.contains(r.error()))
                .map(TokenResult::token)
                .toList();
    }

    public record TokenResult(String token, boolean success, String error) {

        public static TokenResult ok(String token) {
            return new TokenResult(token, true, null);
        }

        public static TokenResult failed(String token, String error) {
            return new TokenResult(token, false, error);
        }
    }
}
