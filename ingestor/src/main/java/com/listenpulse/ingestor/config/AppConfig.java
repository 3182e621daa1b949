package com.listenpulse.ingestor.config;

import io.github.cdimascio.dotenv.Dotenv;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * Configuration management class that reads environment variables
 * and .env file settings using dotenv-java. Validates required
 * variables on startup.
 */
public class AppConfig {

    private static final Logger logger = LoggerFactory.getLogger(AppConfig.class);

    public static final String BACKEND_S3 = "s3";
    public static final String BACKEND_LOCAL = "local";

    static final int DEFAULT_MAX_PAGES = 10;
    static final String DEFAULT_LOCAL_DATA_DIR = "data";

    private final String spotifyClientId;
    private final String spotifyClientSecret;
    private final String spotifyRedirectUri;
    private final String storageBackend;
    private final String s3Bucket;
    private final String awsRegion;
    private final String localDataDir;
    private final String authorizationCode;
    private final String bootstrapRefreshToken;
    private final Instant initialWatermark;
    private final int maxPages;

    public AppConfig() {
        Dotenv dotenv = Dotenv.configure()
                .ignoreIfMissing()
                .load();

        this.spotifyClientId = resolve(dotenv, "SPOTIFY_CLIENT_ID");
        this.spotifyClientSecret = resolve(dotenv, "SPOTIFY_CLIENT_SECRET");
        this.spotifyRedirectUri = resolve(dotenv, "SPOTIFY_REDIRECT_URI");
        this.storageBackend = normalizeBackend(resolveOptional(dotenv, "STORAGE_BACKEND"));
        this.s3Bucket = resolve(dotenv, "S3_BUCKET");
        this.awsRegion = resolveOptional(dotenv, "AWS_REGION");
        String dataDir = resolveOptional(dotenv, "LOCAL_DATA_DIR");
        this.localDataDir = isBlank(dataDir) ? DEFAULT_LOCAL_DATA_DIR : dataDir;
        this.authorizationCode = resolveOptional(dotenv, "SPOTIFY_AUTH_CODE");
        this.bootstrapRefreshToken = resolveOptional(dotenv, "SPOTIFY_REFRESH_TOKEN");
        this.initialWatermark = parseInstant("INITIAL_WATERMARK", resolveOptional(dotenv, "INITIAL_WATERMARK"));
        this.maxPages = parsePositiveInt("MAX_PAGES", resolveOptional(dotenv, "MAX_PAGES"), DEFAULT_MAX_PAGES);

        validate();

        logger.info("Configuration loaded: storageBackend={}, bucket={}, localDataDir={}, maxPages={}",
                storageBackend, s3Bucket, localDataDir, maxPages);
    }

    /**
     * Constructor for testing. Accepts values directly.
     */
    public AppConfig(String spotifyClientId, String spotifyClientSecret, String spotifyRedirectUri,
                     String storageBackend, String s3Bucket, String localDataDir) {
        this.spotifyClientId = spotifyClientId;
        this.spotifyClientSecret = spotifyClientSecret;
        this.spotifyRedirectUri = spotifyRedirectUri;
        this.storageBackend = normalizeBackend(storageBackend);
        this.s3Bucket = s3Bucket;
        this.awsRegion = null;
        this.localDataDir = isBlank(localDataDir) ? DEFAULT_LOCAL_DATA_DIR : localDataDir;
        this.authorizationCode = null;
        this.bootstrapRefreshToken = null;
        this.initialWatermark = null;
        this.maxPages = DEFAULT_MAX_PAGES;

        validate();
    }

    private void validate() {
        StringBuilder missing = new StringBuilder();
        if (isBlank(spotifyClientId)) missing.append("SPOTIFY_CLIENT_ID ");
        if (isBlank(spotifyClientSecret)) missing.append("SPOTIFY_CLIENT_SECRET ");
        if (isBlank(spotifyRedirectUri)) missing.append("SPOTIFY_REDIRECT_URI ");
        if (BACKEND_S3.equals(storageBackend) && isBlank(s3Bucket)) missing.append("S3_BUCKET ");

        if (!missing.isEmpty()) {
            throw new IllegalStateException(
                    "Missing required environment variables: " + missing.toString().trim());
        }

        if (!BACKEND_S3.equals(storageBackend) && !BACKEND_LOCAL.equals(storageBackend)) {
            throw new IllegalStateException(
                    "STORAGE_BACKEND must be 's3' or 'local', got: " + storageBackend);
        }
    }

    private static String normalizeBackend(String value) {
        return isBlank(value) ? BACKEND_S3 : value.trim().toLowerCase(Locale.ROOT);
    }

    static Instant parseInstant(String key, String value) {
        if (isBlank(value)) {
            return null;
        }
        try {
            return Instant.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalStateException(key + " must be an ISO-8601 instant, got: " + value, e);
        }
    }

    static int parsePositiveInt(String key, String value, int defaultValue) {
        if (isBlank(value)) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed < 1) {
                throw new IllegalStateException(key + " must be at least 1, got: " + value);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new IllegalStateException(key + " must be an integer, got: " + value, e);
        }
    }

    private static String resolve(Dotenv dotenv, String key) {
        String envValue = System.getenv(key);
        if (envValue != null && !envValue.isBlank()) {
            return envValue;
        }
        String dotenvValue = dotenv.get(key);
        return dotenvValue != null ? dotenvValue : "";
    }

    private static String resolveOptional(Dotenv dotenv, String key) {
        String envValue = System.getenv(key);
        if (envValue != null && !envValue.isBlank()) {
            return envValue;
        }
        return dotenv.get(key);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public String getSpotifyClientId() {
        return spotifyClientId;
    }

    public String getSpotifyClientSecret() {
        return spotifyClientSecret;
    }

    public String getSpotifyRedirectUri() {
        return spotifyRedirectUri;
    }

    public String getStorageBackend() {
        return storageBackend;
    }

    public String getS3Bucket() {
        return s3Bucket;
    }

    public String getAwsRegion() {
        return awsRegion;
    }

    public String getLocalDataDir() {
        return localDataDir;
    }

    public String getAuthorizationCode() {
        return authorizationCode;
    }

    public String getBootstrapRefreshToken() {
        return bootstrapRefreshToken;
    }

    public Instant getInitialWatermark() {
        return initialWatermark;
    }

    public int getMaxPages() {
        return maxPages;
    }
}
