package com.waypoint.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Envelope returned to the orchestration layer by every tool operation.
 *
 * @param status  {@code success} or {@code error}.
 * @param message Human-readable outcome.
 * @param payload Typed payload; {@code null} for error results.
 * @param <T>     Payload type.
 */
public record ToolResult<T>(
        @JsonProperty("status") Status status,
        @JsonProperty("message") String message,
        @JsonProperty("payload") T payload) {

    public enum Status {
        SUCCESS, ERROR;

        @JsonValue
        public String wireName() {
            return name().toLowerCase();
        }
    }

    public static <T> ToolResult<T> success(String message, T payload) {
        return new ToolResult<>(Status.SUCCESS, message, payload);
    }

    public static <T> ToolResult<T> error(String message) {
        return new ToolResult<>(Status.ERROR, message, null);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }
}
