package com.delangzeta.realtime.auth;

import com.delangzeta.realtime.config.CaffeineConfig;
import com.delangzeta.realtime.domain.SessionToken;
import com.delangzeta.realtime.domain.SessionTokenRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Cached session reads. Unknown tokens are not cached, so a freshly issued token works immediately.
 */
@Component
@RequiredArgsConstructor
public class SessionLookup {

    private final SessionTokenRepository repository;

    @Cacheable(cacheNames = CaffeineConfig.SESSION_TOKEN_CACHE, unless = "#result == null")
    public Optional<SessionToken> find(String token) {
        return repository.findById(token);
    }
}
