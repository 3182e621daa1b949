package com.listenpulse.ingestor.auth;

import com.listenpulse.ingestor.client.SpotifyAccountsClient;
import com.listenpulse.ingestor.client.SpotifyApiException;
import com.listenpulse.ingestor.error.AuthBootstrapRequiredException;
import com.listenpulse.ingestor.error.AuthExpiredUnrecoverableException;
import com.listenpulse.ingestor.error.IngestionException;
import com.listenpulse.ingestor.error.StorageWriteFailedException;
import com.listenpulse.ingestor.error.TransientNetworkException;
import com.listenpulse.ingestor.model.Credential;
import com.listenpulse.ingestor.model.TokenResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Owns the token lifecycle for one execution and hands out access tokens that are
 * valid for the next call.
 *
 * <p>States move NO_CREDENTIALS -> VALID through the initial authorization
 * exchange, and VALID -> EXPIRED -> REFRESHING -> VALID through the refresh grant.
 * A rejected refresh token moves to FAILED, which is terminal for the execution:
 * every later call fails immediately without touching the network.</p>
 *
 * <p>Any newly issued credential is written to the {@link CredentialStore} before
 * the token is returned. If that write fails the run is aborted, because a
 * refreshed token that only lives in this process is lost when it exits.</p>
 */
public class AuthManager implements AccessTokenProvider {

    private static final Logger logger = LoggerFactory.getLogger(AuthManager.class);

    static final Duration EXPIRY_SKEW = Duration.ofSeconds(60);

    private final CredentialStore credentialStore;
    private final SpotifyAccountsClient accountsClient;
    private final Clock clock;
    private final String authorizationCode;
    private final String bootstrapRefreshToken;

    private AuthState state = AuthState.NO_CREDENTIALS;
    private boolean storeConsulted;
    private Credential current;
    private IngestionException failure;

    public AuthManager(CredentialStore credentialStore, SpotifyAccountsClient accountsClient) {
        this(credentialStore, accountsClient, Clock.systemUTC(), null, null);
    }

    /**
     * @param authorizationCode     one-time code used when no credentials are stored, may be {@code null}
     * @param bootstrapRefreshToken refresh token used when no credentials are stored, may be {@code null}
     */
    public AuthManager(CredentialStore credentialStore, SpotifyAccountsClient accountsClient, Clock clock,
                       String authorizationCode, String bootstrapRefreshToken) {
        this.credentialStore = credentialStore;
        this.accountsClient = accountsClient;
        this.clock = clock;
        this.authorizationCode = authorizationCode;
        this.bootstrapRefreshToken = bootstrapRefreshToken;
    }

    @Override
    public synchronized String ensureValidToken() throws IngestionException {
        if (state == AuthState.FAILED) {
            throw failure;
        }

        if (!storeConsulted) {
            current = loadStoredCredential().orElse(null);
            storeConsulted = true;
            state = current != null ? AuthState.VALID : AuthState.NO_CREDENTIALS;
        }

        if (current == null) {
            current = bootstrap();
        }

        if (current.expiredAt(clock.instant(), EXPIRY_SKEW)) {
            state = AuthState.EXPIRED;
            logger.info("Access token expired at {}, refreshing", current.expiresAt());
            current = refresh(current);
        }

        state = AuthState.VALID;
        return current.accessToken();
    }

    @Override
    public synchronized void invalidateAccessToken() {
        if (current != null && state != AuthState.FAILED) {
            current = new Credential(current.accessToken(), current.tokenType(), current.scope(),
                    current.expiresIn(), current.refreshToken(), 0L);
            state = AuthState.EXPIRED;
            logger.warn("Access token rejected by the provider; it will be refreshed before the next call");
        }
    }

    public synchronized AuthState state() {
        return state;
    }

    // -------------------------------------------------------------------------
    // Loading and bootstrap
    // -------------------------------------------------------------------------

    private Optional<Credential> loadStoredCredential() {
        try {
            return credentialStore.load();
        } catch (IOException | RuntimeException e) {
            logger.warn("Could not load stored credentials, treating as absent: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private Credential bootstrap() throws IngestionException {
        if (!isBlank(authorizationCode)) {
            logger.info("No stored credentials; exchanging configured authorization code");
            TokenResponse response;
            try {
                response = accountsClient.exchangeAuthorizationCode(authorizationCode);
            } catch (SpotifyApiException e) {
                throw translateBootstrapFailure(e);
            } catch (IOException e) {
                throw new TransientNetworkException("Authorization code exchange failed: " + e.getMessage(), e);
            }
            Credential issued = Credential.issued(response, clock.instant(), null);
            persist(issued);
            return issued;
        }

        if (!isBlank(bootstrapRefreshToken)) {
            logger.info("No stored credentials; bootstrapping from configured refresh token");
            return new Credential(null, "Bearer", null, 0L, bootstrapRefreshToken, 0L);
        }

        throw fail(new AuthBootstrapRequiredException(
                "No stored credentials and no SPOTIFY_AUTH_CODE or SPOTIFY_REFRESH_TOKEN configured. "
                        + "Authorize at " + accountsClient.authorizeUrl()
                        + " and set SPOTIFY_AUTH_CODE to the returned code."));
    }

    private IngestionException translateBootstrapFailure(SpotifyApiException e) {
        return switch (e.kind()) {
            case RATE_LIMITED, SERVER_ERROR ->
                    new TransientNetworkException("Authorization code exchange failed: " + e.getMessage(), e);
            case INVALID_GRANT, UNAUTHORIZED, FORBIDDEN, NOT_FOUND, CLIENT_ERROR ->
                    fail(new AuthBootstrapRequiredException("Authorization code was rejected (" + e.getMessage()
                            + "). Authorize again at " + accountsClient.authorizeUrl()));
        };
    }

    // -------------------------------------------------------------------------
    // Refresh
    // -------------------------------------------------------------------------

    private Credential refresh(Credential expired) throws IngestionException {
        if (!expired.hasRefreshToken()) {
            throw fail(new AuthExpiredUnrecoverableException(
                    "Access token expired and no refresh token is stored; re-authorization required"));
        }

        state = AuthState.REFRESHING;
        TokenResponse response;
        try {
            response = accountsClient.refresh(expired.refreshToken());
        } catch (SpotifyApiException e) {
            throw translateRefreshFailure(e);
        } catch (IOException e) {
            state = AuthState.EXPIRED;
            throw new TransientNetworkException("Token refresh failed: " + e.getMessage(), e);
        }

        Credential refreshed = Credential.issued(response, clock.instant(), expired.refreshToken());
        persist(refreshed);
        logger.info("Access token refreshed, valid until {}", refreshed.expiresAt());
        return refreshed;
    }

    private IngestionException translateRefreshFailure(SpotifyApiException e) {
        return switch (e.kind()) {
            case RATE_LIMITED, SERVER_ERROR -> {
                state = AuthState.EXPIRED;
                yield new TransientNetworkException("Token refresh failed: " + e.getMessage(), e);
            }
            case INVALID_GRANT, UNAUTHORIZED, FORBIDDEN, NOT_FOUND, CLIENT_ERROR ->
                    fail(new AuthExpiredUnrecoverableException(
                            "Refresh token was rejected (" + e.getMessage() + "); re-authorization required", e));
        };
    }

    private void persist(Credential credential) throws StorageWriteFailedException {
        try {
            credentialStore.save(credential);
        } catch (IOException | RuntimeException e) {
            logger.error("Failed to persist newly issued credentials", e);
            throw new StorageWriteFailedException(
                    "Newly issued credentials could not be persisted; aborting so the token is not lost", e);
        }
    }

    private IngestionException fail(IngestionException cause) {
        state = AuthState.FAILED;
        failure = cause;
        logger.error("Authorization failed: {}", cause.getMessage());
        return cause;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
