package com.delangzeta.realtime.sync;

public enum ChangeType {
    ADDED("added"),
    MODIFIED("modified"),
    REMOVED("removed");

    private final String wireName;

    ChangeType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
