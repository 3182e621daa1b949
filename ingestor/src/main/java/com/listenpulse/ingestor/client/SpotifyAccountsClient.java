package com.listenpulse.ingestor.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.listenpulse.ingestor.config.ObjectMappers;
import com.listenpulse.ingestor.model.TokenResponse;
import okhttp3.Credentials;
import okhttp3.FormBody;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Client for the OAuth token endpoint of the accounts service: authorization-code
 * exchange and refresh-token grant. Nothing here is retried; a failed token call
 * is reported to the caller as-is.
 */
public class SpotifyAccountsClient {

    private static final Logger logger = LoggerFactory.getLogger(SpotifyAccountsClient.class);

    static final String DEFAULT_BASE_URL = "https://accounts.spotify.com";
    public static final String SCOPE = "user-read-recently-played";

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final HttpUrl baseUrl;
    private final String clientId;
    private final String clientSecret;
    private final String redirectUri;

    public SpotifyAccountsClient(String clientId, String clientSecret, String redirectUri) {
        this(clientId, clientSecret, redirectUri, DEFAULT_BASE_URL, SpotifyApiClient.defaultHttpClient());
    }

    public SpotifyAccountsClient(String clientId, String clientSecret, String redirectUri,
                                 String baseUrl, OkHttpClient httpClient) {
        this.clientId = clientId;
        this.clientSecret = clientSecret;
        this.redirectUri = redirectUri;
        this.baseUrl = HttpUrl.get(baseUrl);
        this.httpClient = httpClient;
        this.objectMapper = ObjectMappers.create();
    }

    /**
     * Exchanges a one-time authorization code for a token pair.
     * Endpoint: POST /api/token (grant_type=authorization_code)
     */
    public TokenResponse exchangeAuthorizationCode(String code) throws IOException {
        FormBody form = new FormBody.Builder()
                .add("grant_type", "authorization_code")
                .add("code", code)
                .add("redirect_uri", redirectUri)
                .build();
        return postTokenRequest(form);
    }

    /**
     * Mints a new access token from a refresh token.
     * Endpoint: POST /api/token (grant_type=refresh_token)
     */
    public TokenResponse refresh(String refreshToken) throws IOException {
        FormBody form = new FormBody.Builder()
                .add("grant_type", "refresh_token")
                .add("refresh_token", refreshToken)
                .build();
        return postTokenRequest(form);
    }

    /**
     * URL an operator opens in a browser to grant access; the provider redirects
     * back to the configured redirect URI with the authorization code.
     */
    public String authorizeUrl() {
        return baseUrl.newBuilder()
                .addPathSegments("authorize")
                .addQueryParameter("client_id", clientId)
                .addQueryParameter("response_type", "code")
                .addQueryParameter("redirect_uri", redirectUri)
                .addQueryParameter("scope", SCOPE)
                .build()
                .toString();
    }

    TokenResponse postTokenRequest(FormBody form) throws IOException {
        Request request = new Request.Builder()
                .url(baseUrl.newBuilder().addPathSegments("api/token").build())
                .header("Authorization", Credentials.basic(clientId, clientSecret))
                .post(form)
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            String json = body != null ? body.string() : null;
            logger.info("Spotify accounts {} {}", response.code(), request.url().encodedPath());

            if (!response.isSuccessful()) {
                throw SpotifyApiException.fromResponse(response.code(), json,
                        SpotifyApiClient.parseRetryAfter(response.header("Retry-After")));
            }
            if (json == null || json.isBlank()) {
                throw new IOException("Empty token response from " + request.url().encodedPath());
            }

            TokenResponse token = objectMapper.readValue(json, TokenResponse.class);
            if (token.accessToken() == null || token.expiresIn() <= 0) {
                throw new IOException("Token response is missing access_token or expires_in");
            }
            return token;
        }
    }
}
