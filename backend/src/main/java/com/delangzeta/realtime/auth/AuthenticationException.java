package com.delangzeta.realtime.auth;

import lombok.Getter;

/**
 * Missing, unknown or expired bearer token. Rendered as 401 with {@link #getCode()}.
 */
@Getter
public class AuthenticationException extends RuntimeException {

    public static final String AUTH_REQUIRED = "AUTH_REQUIRED";
    public static final String INVALID_TOKEN = "INVALID_TOKEN";
    public static final String TOKEN_EXPIRED = "TOKEN_EXPIRED";

    private final String code;

    public AuthenticationException(String code, String message) {
        super(message);
        this.code = code;
    }
}
