package com.listenpulse.ingestor.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;

/**
 * OAuth token pair as persisted in the credential blob. The layout matches the
 * provider client library's token cache so an existing cache file can seed it.
 *
 * <p>{@code expires_at} is epoch seconds and is always computed from the
 * issuer's {@code expires_in} at the moment the token was issued.</p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Credential(
        @JsonProperty("access_token") String accessToken,
        @JsonProperty("token_type") String tokenType,
        @JsonProperty("scope") String scope,
        @JsonProperty("expires_in") long expiresIn,
        @JsonProperty("refresh_token") String refreshToken,
        @JsonProperty("expires_at") long expiresAtEpochSecond
) {

    /**
     * Builds a credential from a token endpoint response. The token endpoint may
     * omit {@code refresh_token} on refresh, in which case the previous one stays valid.
     */
    public static Credential issued(TokenResponse response, Instant issuedAt, String previousRefreshToken) {
        String refreshToken = response.refreshToken() != null && !response.refreshToken().isBlank()
                ? response.refreshToken()
                : previousRefreshToken;
        return new Credential(
                response.accessToken(),
                response.tokenType(),
                response.scope(),
                response.expiresIn(),
                refreshToken,
                issuedAt.getEpochSecond() + response.expiresIn());
    }

    @JsonIgnore
    public Instant expiresAt() {
        return Instant.ofEpochSecond(expiresAtEpochSecond);
    }

    /**
     * True when the access token is expired at {@code now}, or will be within {@code skew}.
     */
    public boolean expiredAt(Instant now, Duration skew) {
        return !now.plus(skew).isBefore(expiresAt());
    }

    @JsonIgnore
    public boolean hasRefreshToken() {
        return refreshToken != null && !refreshToken.isBlank();
    }

    @Override
    public String toString() {
        return "Credential[tokenType=" + tokenType + ", scope=" + scope
                + ", expiresAt=" + expiresAt() + ", refreshToken=" + (hasRefreshToken() ? "present" : "absent") + "]";
    }
}
