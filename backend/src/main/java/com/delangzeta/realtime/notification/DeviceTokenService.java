package com.delangzeta.realtime.notification;

import com.delangzeta.realtime.domain.DeviceToken;
import com.delangzeta.realtime.domain.DeviceTokenRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Device tokens per user. Tokens are never deleted, only deactivated.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeviceTokenService {

    private final DeviceTokenRepository repository;
    private final Clock clock;

    public DeviceToken register(String userId, String token, Map<String, Object> deviceInfo) {
        Instant now = Instant.now(clock);
        DeviceToken dt = repository.findById(DeviceToken.idOf(userId, token)).orElseGet(DeviceToken::new);
        dt.setId(DeviceToken.idOf(userId, token));
        dt.setUserId(userId);
        dt.setToken(token);
        dt.setDeviceInfo(deviceInfo == null ? Map.of() : deviceInfo);
        dt.setActive(true);
        dt.setRegisteredAt(now);
        dt.setLastUsed(now);
        dt.setUnregisteredAt(null);
        return repository.save(dt);
    }

    /**
     * @return false when the token was never registered for this user
     */
    public boolean unregister(String userId, String token) {
        return repository.findById(DeviceToken.idOf(userId, token))
                .map(dt -> {
                    deactivate(dt);
                    return true;
                })
                .orElse(false);
    }

    public List<String> activeTokens(String userId) {
        return repository.findByUserIdAndActiveTrue(userId).stream()
                .map(DeviceToken::getToken)
                .toList();
    }

    /** Called with tokens the push gateway rejected as unregistered. */
    public void deactivate(String userId, Collection<String> tokens) {
        List<DeviceToken> found = repository.findByUserIdAndTokenIn(userId, tokens);
        found.stream().filter(DeviceToken::isActive).forEach(this::deactivate);
        log.info("Deactivated {} stale device token(s) for {}", found.size(), userId);
    }

    private void deactivate(DeviceToken dt) {
        dt.setActive(false);
        dt.setUnregisteredAt(Instant.now(clock));
        repository.save(dt);
    }
}
