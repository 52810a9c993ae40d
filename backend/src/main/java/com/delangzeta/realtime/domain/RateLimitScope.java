package com.delangzeta.realtime.domain;

import java.util.Locale;

/**
 * Identity kind a rate-limit counter belongs to.
 */
public enum RateLimitScope {
    USER,
    IP;

    /** Counter document id: {@code user_<identifier>} or {@code ip_<identifier>}. */
    public String counterId(String identifier) {
        return name().toLowerCase(Locale.ROOT) + "_" + identifier;
    }
}
