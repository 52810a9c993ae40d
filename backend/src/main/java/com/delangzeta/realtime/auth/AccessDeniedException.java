package com.delangzeta.realtime.auth;

/**
 * Authenticated caller lacks a permission. Rendered as 403 INSUFFICIENT_PERMISSIONS.
 */
public class AccessDeniedException extends RuntimeException {

    public static final String INSUFFICIENT_PERMISSIONS = "INSUFFICIENT_PERMISSIONS";

    public AccessDeniedException(String message) {
        super(message);
    }
}
