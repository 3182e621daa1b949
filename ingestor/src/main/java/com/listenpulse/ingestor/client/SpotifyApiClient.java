package com.listenpulse.ingestor.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.listenpulse.ingestor.config.ObjectMappers;
import com.listenpulse.ingestor.model.RecentlyPlayedResponse;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Spotify Web API client for the recently-played feed, with exponential backoff
 * retry on rate limiting, server errors and dropped connections.
 *
 * <p>Thread-safe: the underlying {@link OkHttpClient} and {@link ObjectMapper}
 * are both thread-safe, and this class holds no mutable per-request state.
 * The access token is passed per call so that callers always hand over a token
 * they have just validated.</p>
 */
public class SpotifyApiClient {

    private static final Logger logger = LoggerFactory.getLogger(SpotifyApiClient.class);

    static final String DEFAULT_BASE_URL = "https://api.spotify.com/v1";
    public static final int PAGE_LIMIT = 50;
    private static final long INITIAL_BACKOFF_MS = 1_000;
    static final long MAX_BACKOFF_MS = 30_000;
    static final int MAX_RETRIES = 4; // 1s, 2s, 4s, 8s

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final HttpUrl baseUrl;
    private final long initialBackoffMs;

    public SpotifyApiClient() {
        this(DEFAULT_BASE_URL, defaultHttpClient());
    }

    public SpotifyApiClient(String baseUrl, OkHttpClient httpClient) {
        this(baseUrl, httpClient, INITIAL_BACKOFF_MS);
    }

    // Visible for testing
    SpotifyApiClient(String baseUrl, OkHttpClient httpClient, long initialBackoffMs) {
        this.baseUrl = HttpUrl.get(baseUrl);
        this.httpClient = httpClient;
        this.initialBackoffMs = initialBackoffMs;
        this.objectMapper = ObjectMappers.create();
    }

    static OkHttpClient defaultHttpClient() {
        return new OkHttpClient.Builder()
                .connectTimeout(30, TimeUnit.SECONDS)
                .readTimeout(30, TimeUnit.SECONDS)
                .writeTimeout(30, TimeUnit.SECONDS)
                .build();
    }

    // -------------------------------------------------------------------------
    // Public API endpoint methods
    // -------------------------------------------------------------------------

    /**
     * Fetches one page of the user's listening history.
     * Endpoint: GET /me/player/recently-played?limit={limit}&after={after}
     *
     * @param after epoch milliseconds; only plays strictly after it are returned.
     *              {@code null} returns the most recent plays.
     */
    public RecentlyPlayedResponse getRecentlyPlayed(String accessToken, int limit, Long after)
            throws IOException, InterruptedException {
        Request request = buildRequest(recentlyPlayedUrl(limit, after), accessToken);
        String json = executeWithRetry(request);
        return objectMapper.readValue(json, RecentlyPlayedResponse.class);
    }

    HttpUrl recentlyPlayedUrl(int limit, Long after) {
        HttpUrl.Builder builder = baseUrl.newBuilder()
                .addPathSegments("me/player/recently-played")
                .addQueryParameter("limit", String.valueOf(Math.min(limit, PAGE_LIMIT)));
        if (after != null) {
            builder.addQueryParameter("after", String.valueOf(after));
        }
        return builder.build();
    }

    Request buildRequest(HttpUrl url, String accessToken) {
        return new Request.Builder()
                .url(url)
                .header("Authorization", "Bearer " + accessToken)
                .header("Accept", "application/json")
                .build();
    }

    // -------------------------------------------------------------------------
    // Core HTTP execution with retries
    // -------------------------------------------------------------------------

    /**
     * Executes a request, retrying 429 and 5xx responses and I/O failures with
     * exponential backoff. A 429 waits for the provider's Retry-After when given;
     * a Retry-After longer than {@link #MAX_BACKOFF_MS} is not waited for and the
     * failure is thrown at once.
     *
     * @throws SpotifyApiException for any non-success response that is not retried,
     *                             or the last retryable one once retries are exhausted
     * @throws IOException         when the connection fails on every attempt
     */
    String executeWithRetry(Request request) throws IOException, InterruptedException {
        long backoffMs = initialBackoffMs;

        for (int attempt = 0; ; attempt++) {
            boolean lastAttempt = attempt >= MAX_RETRIES;

            final Response response;
            try {
                response = httpClient.newCall(request).execute();
            } catch (IOException e) {
                if (lastAttempt) {
                    throw e;
                }
                logger.warn("Request to {} failed: {}. Retrying in {}ms (attempt {}/{})",
                        request.url().encodedPath(), e.getMessage(), backoffMs, attempt + 1, MAX_RETRIES);
                Thread.sleep(backoffMs);
                backoffMs = Math.min(backoffMs * 2, MAX_BACKOFF_MS);
                continue;
            }

            try (Response r = response) {
                int statusCode = r.code();
                logger.info("Spotify API {} {}", statusCode, request.url());

                if (statusCode == 429 || isRetryableServerError(statusCode)) {
                    SpotifyApiException failure = SpotifyApiException.fromResponse(
                            statusCode, bodyOrNull(r), parseRetryAfter(r.header("Retry-After")));
                    if (lastAttempt) {
                        throw failure;
                    }
                    long waitMs = getRetryWaitMs(r, backoffMs);
                    if (waitMs > MAX_BACKOFF_MS) {
                        logger.warn("Received {} from {} with Retry-After {}ms, above the {}ms limit. Giving up",
                                statusCode, request.url().encodedPath(), waitMs, MAX_BACKOFF_MS);
                        throw failure;
                    }
                    logger.warn("Received {} from {}. Retrying in {}ms (attempt {}/{})",
                            statusCode, request.url().encodedPath(), waitMs, attempt + 1, MAX_RETRIES);
                    Thread.sleep(waitMs);
                    backoffMs = Math.min(backoffMs * 2, MAX_BACKOFF_MS);
                    continue;
                }

                if (!r.isSuccessful()) {
                    throw SpotifyApiException.fromResponse(statusCode, bodyOrNull(r), null);
                }

                String body = bodyOrNull(r);
                if (body == null) {
                    throw new IOException("Empty response body from " + request.url().encodedPath());
                }
                return body;
            }
        }
    }

    static boolean isRetryableServerError(int statusCode) {
        return statusCode == 500 || statusCode == 502 || statusCode == 503 || statusCode == 504;
    }

    /**
     * Determines wait time for retries. Uses Retry-After header if present,
     * otherwise falls back to exponential backoff.
     */
    long getRetryWaitMs(Response response, long backoffMs) {
        Duration retryAfter = parseRetryAfter(response.header("Retry-After"));
        return retryAfter != null ? retryAfter.toMillis() : backoffMs;
    }

    static Duration parseRetryAfter(String header) {
        if (header == null || header.isBlank()) {
            return null;
        }
        try {
            return Duration.ofSeconds(Math.max(Long.parseLong(header.trim()), 0));
        } catch (NumberFormatException e) {
            logger.debug("Ignoring non-numeric Retry-After: {}", header);
            return null;
        }
    }

    private static String bodyOrNull(Response response) throws IOException {
        ResponseBody body = response.body();
        return body != null ? body.string() : null;
    }
}
