package com.williamcallahan.film_rating_aggregator.service.gateway;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Result of one gateway attempt. The retry loop decides what to do next from {@link #type()} alone.
 *
 * @param type classification of the attempt
 * @param attempt 1-based attempt number
 * @param statusCode HTTP status, null when no response was received
 * @param body parsed body, only set on SUCCESS
 * @param rawBody body text as received, only set on SUCCESS
 * @param detail short description for logs and error messages
 * @param cause underlying failure, if any
 */
public record GatewayOutcome(
    Type type,
    int attempt,
    Integer statusCode,
    JsonNode body,
    String rawBody,
    String detail,
    Throwable cause
) {
    public enum Type {
        SUCCESS,
        RATE_LIMITED,
        CLIENT_ERROR,
        SERVER_ERROR,
        TRANSPORT_ERROR,
        PARSE_ERROR
    }

    public static GatewayOutcome success(int attempt, int statusCode, JsonNode body, String rawBody) {
        return new GatewayOutcome(Type.SUCCESS, attempt, statusCode, body, rawBody, "HTTP " + statusCode, null);
    }

    /**
     * Classifies a non-2xx status.
     */
    public static GatewayOutcome forErrorStatus(int attempt, int statusCode) {
        Type type;
        if (statusCode == 429) {
            type = Type.RATE_LIMITED;
        } else if (statusCode >= 500) {
            type = Type.SERVER_ERROR;
        } else {
            type = Type.CLIENT_ERROR;
        }
        return new GatewayOutcome(type, attempt, statusCode, null, null, "HTTP " + statusCode, null);
    }

    public static GatewayOutcome throttled(int attempt, Throwable cause) {
        return new GatewayOutcome(Type.RATE_LIMITED, attempt, null, null, null, "client-side rate limit", cause);
    }

    public static GatewayOutcome parseError(int attempt, int statusCode, Throwable cause) {
        return new GatewayOutcome(Type.PARSE_ERROR, attempt, statusCode, null, null,
            "HTTP " + statusCode + " with non-JSON body", cause);
    }

    public static GatewayOutcome transportError(int attempt, Throwable cause) {
        String detail = cause == null ? "transport failure"
            : cause.getClass().getSimpleName() + (cause.getMessage() != null ? ": " + cause.getMessage() : "");
        return new GatewayOutcome(Type.TRANSPORT_ERROR, attempt, null, null, null, detail, cause);
    }

    public boolean isSuccess() {
        return type == Type.SUCCESS;
    }
}
