package com.delangzeta.realtime.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 401/403/429 body. {@code retryAfter} (seconds) is only present on 429.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CodedErrorBody(String error, String code, Long retryAfter) {

    public static CodedErrorBody of(String error, String code) {
        return new CodedErrorBody(error, code, null);
    }
}
