package com.delangzeta.realtime.auth;

import com.delangzeta.realtime.domain.SessionToken;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Resolves opaque bearer tokens issued by the external login flow. Lookups are cached briefly; expiry is
 * checked on every call so a cached session still lapses on time.
 */
@Service
@RequiredArgsConstructor
public class SessionTokenService {

    private final Clock clock;
    private final SessionLookup lookup;

    /**
     * @throws AuthenticationException INVALID_TOKEN for unknown tokens, TOKEN_EXPIRED for lapsed ones
     */
    public AuthenticatedUser authenticate(String token) {
        if (token == null || token.isBlank()) {
            throw new AuthenticationException(AuthenticationException.AUTH_REQUIRED, "Authorization token required");
        }
        SessionToken session = lookup.find(token)
                .orElseThrow(() -> new AuthenticationException(AuthenticationException.INVALID_TOKEN, "Invalid token"));
        if (session.getExpiresAt() != null && !session.getExpiresAt().isAfter(Instant.now(clock))) {
            throw new AuthenticationException(AuthenticationException.TOKEN_EXPIRED, "Token expired");
        }
        return new AuthenticatedUser(session.getUserId(), session.getWalletAddress(), session.getPermissions());
    }

    /** Best-effort resolution used where authentication is optional. */
    public Optional<AuthenticatedUser> tryAuthenticate(String token) {
        try {
            return Optional.of(authenticate(token));
        } catch (AuthenticationException e) {
            return Optional.empty();
        }
    }
}
