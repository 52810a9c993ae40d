package com.delangzeta.realtime.domain;

public enum PrivacyLevel {
    PUBLIC,
    PRIVATE,
    ANONYMOUS
}
