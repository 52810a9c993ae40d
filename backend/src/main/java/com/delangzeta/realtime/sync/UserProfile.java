package com.delangzeta.realtime.sync;

public record UserProfile(String userId, boolean validator, String role) {

    public boolean isAdmin() {
        return "admin".equals(role);
    }
}
