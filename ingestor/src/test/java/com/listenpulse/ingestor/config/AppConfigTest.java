package com.listenpulse.ingestor.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link AppConfig} validation logic.
 */
class AppConfigTest {

    @Test
    @DisplayName("Test constructor creates config with valid values")
    void validConfig() {
        AppConfig config = new AppConfig("client-id", "client-secret", "http://localhost:8888/callback",
                "s3", "my-bucket", null);

        assertEquals("client-id", config.getSpotifyClientId());
        assertEquals("client-secret", config.getSpotifyClientSecret());
        assertEquals("http://localhost:8888/callback", config.getSpotifyRedirectUri());
        assertEquals(AppConfig.BACKEND_S3, config.getStorageBackend());
        assertEquals("my-bucket", config.getS3Bucket());
        assertEquals("data", config.getLocalDataDir());
        assertEquals(AppConfig.DEFAULT_MAX_PAGES, config.getMaxPages());
        assertNull(config.getInitialWatermark());
    }

    @Test
    @DisplayName("Storage backend defaults to s3 and is case-insensitive")
    void backendDefaultsAndNormalizes() {
        assertEquals(AppConfig.BACKEND_S3,
                new AppConfig("id", "secret", "uri", null, "bucket", null).getStorageBackend());
        assertEquals(AppConfig.BACKEND_LOCAL,
                new AppConfig("id", "secret", "uri", " LOCAL ", null, "/tmp/listen").getStorageBackend());
    }

    @Test
    @DisplayName("Local backend does not require S3_BUCKET")
    void localBackend_noBucketNeeded() {
        AppConfig config = new AppConfig("id", "secret", "uri", "local", "", "/tmp/listen");

        assertEquals("/tmp/listen", config.getLocalDataDir());
    }

    @Test
    @DisplayName("Throws when S3_BUCKET is missing for the s3 backend")
    void s3Backend_missingBucket_throws() {
        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> new AppConfig("id", "secret", "uri", "s3", "", null));

        assertTrue(ex.getMessage().contains("S3_BUCKET"));
    }

    @Test
    @DisplayName("Throws on unknown storage backend")
    void unknownBackend_throws() {
        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> new AppConfig("id", "secret", "uri", "gcs", "bucket", null));

        assertTrue(ex.getMessage().contains("STORAGE_BACKEND"));
    }

    @Test
    @DisplayName("Throws with all missing vars listed in message")
    void allMissing_listsAllVars() {
        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> new AppConfig("", " ", null, "s3", null, null));

        String msg = ex.getMessage();
        assertTrue(msg.contains("SPOTIFY_CLIENT_ID"));
        assertTrue(msg.contains("SPOTIFY_CLIENT_SECRET"));
        assertTrue(msg.contains("SPOTIFY_REDIRECT_URI"));
        assertTrue(msg.contains("S3_BUCKET"));
    }

    @Test
    @DisplayName("parseInstant accepts ISO-8601 and treats blank as unset")
    void parseInstant() {
        assertEquals(Instant.parse("2025-01-01T00:00:00Z"),
                AppConfig.parseInstant("INITIAL_WATERMARK", "2025-01-01T00:00:00Z"));
        assertNull(AppConfig.parseInstant("INITIAL_WATERMARK", "  "));
        assertThrows(IllegalStateException.class,
                () -> AppConfig.parseInstant("INITIAL_WATERMARK", "yesterday"));
    }

    @Test
    @DisplayName("parsePositiveInt falls back to default and rejects zero or garbage")
    void parsePositiveInt() {
        assertEquals(10, AppConfig.parsePositiveInt("MAX_PAGES", null, 10));
        assertEquals(3, AppConfig.parsePositiveInt("MAX_PAGES", "3", 10));
        assertThrows(IllegalStateException.class, () -> AppConfig.parsePositiveInt("MAX_PAGES", "0", 10));
        assertThrows(IllegalStateException.class, () -> AppConfig.parsePositiveInt("MAX_PAGES", "ten", 10));
    }
}
