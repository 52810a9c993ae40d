package com.delangzeta.realtime.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Map;

/**
 * Body for 400, 404 and 5xx: error code, message, ISO-8601 timestamp. {@code fields} lists every rejected
 * request field on validation failures and is omitted otherwise.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorBody(String error, String message, Instant timestamp, Map<String, String> fields) {

    public static ErrorBody of(String error, String message) {
        return new ErrorBody(error, message, Instant.now(), null);
    }

    public static ErrorBody invalidFields(String error, String message, Map<String, String> fields) {
        return new ErrorBody(error, message, Instant.now(), fields.isEmpty() ? null : Map.copyOf(fields));
    }
}
