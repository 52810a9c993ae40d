package com.delangzeta.realtime.auth;

import java.util.List;

public record AuthenticatedUser(String userId, String walletAddress, List<String> permissions) {

    public static final String ADMIN = "admin";

    public AuthenticatedUser {
        permissions = permissions == null ? List.of() : List.copyOf(permissions);
    }

    public boolean hasPermission(String permission) {
        return permissions.contains(permission);
    }
}
