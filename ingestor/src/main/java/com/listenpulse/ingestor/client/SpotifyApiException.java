package com.listenpulse.ingestor.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.time.Duration;

/**
 * Non-success response from the Web API or the accounts service, tagged with an
 * {@link ApiErrorKind}. Plain {@link IOException}s from the same clients mean the
 * request never got a response.
 */
public class SpotifyApiException extends IOException {

    private static final ObjectMapper ERROR_MAPPER = new ObjectMapper();

    private final ApiErrorKind kind;
    private final int statusCode;
    private final Duration retryAfter;

    public SpotifyApiException(ApiErrorKind kind, int statusCode, String message, Duration retryAfter) {
        super(message);
        this.kind = kind;
        this.statusCode = statusCode;
        this.retryAfter = retryAfter;
    }

    /**
     * Builds the exception from a raw error response. Understands both the Web API
     * shape ({@code {"error": {"status", "message"}}}) and the OAuth shape
     * ({@code {"error": "invalid_grant", "error_description"}}).
     */
    public static SpotifyApiException fromResponse(int statusCode, String body, Duration retryAfter) {
        ApiErrorKind kind = ApiErrorKind.fromStatus(statusCode);
        String detail = null;

        if (body != null && !body.isBlank()) {
            try {
                JsonNode root = ERROR_MAPPER.readTree(body);
                JsonNode error = root.path("error");
                if (error.isObject()) {
                    detail = error.path("message").asText(null);
                } else if (error.isTextual()) {
                    if ("invalid_grant".equals(error.asText())) {
                        kind = ApiErrorKind.INVALID_GRANT;
                    }
                    String description = root.path("error_description").asText(null);
                    detail = description != null ? error.asText() + ": " + description : error.asText();
                }
            } catch (IOException e) {
                detail = body.length() > 200 ? body.substring(0, 200) : body;
            }
        }

        String message = "Spotify API error " + statusCode + " (" + kind + ")"
                + (detail != null ? ": " + detail : "");
        return new SpotifyApiException(kind, statusCode, message, retryAfter);
    }

    public ApiErrorKind kind() {
        return kind;
    }

    public int statusCode() {
        return statusCode;
    }

    /**
     * Delay requested by the provider's {@code Retry-After} header, or {@code null}.
     */
    public Duration retryAfter() {
        return retryAfter;
    }
}
