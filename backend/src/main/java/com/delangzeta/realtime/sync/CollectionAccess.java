package com.delangzeta.realtime.sync;

public enum CollectionAccess {
    /** Rows carry userId; callers only see their own. */
    USER_OWNED,
    PUBLIC,
    VALIDATOR_ONLY,
    ADMIN_ONLY,
    /** Not exposed through sync at all. */
    NONE
}
