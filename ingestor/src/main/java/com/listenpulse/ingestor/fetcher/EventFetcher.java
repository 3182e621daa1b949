package com.listenpulse.ingestor.fetcher;

import com.listenpulse.ingestor.auth.AccessTokenProvider;
import com.listenpulse.ingestor.client.ApiErrorKind;
import com.listenpulse.ingestor.client.SpotifyApiClient;
import com.listenpulse.ingestor.client.SpotifyApiException;
import com.listenpulse.ingestor.config.ObjectMappers;
import com.listenpulse.ingestor.error.AuthExpiredUnrecoverableException;
import com.listenpulse.ingestor.error.IngestionException;
import com.listenpulse.ingestor.error.RateLimitedException;
import com.listenpulse.ingestor.error.TransientNetworkException;
import com.listenpulse.ingestor.model.RecentlyPlayedResponse;
import com.listenpulse.ingestor.model.Watermark;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Pulls the listening history forward from a watermark.
 *
 * <p>With a watermark, pages are requested with {@code after} set to the watermark
 * and then to the newest play of the previous page, until a partial page, an empty
 * page or the page cap. Without one, only the most recent page is fetched.</p>
 *
 * <p>Retries for rate limiting and server errors happen inside
 * {@link SpotifyApiClient}; whatever is still failing afterwards is reported here as
 * one of the {@link IngestionException} kinds.</p>
 */
public class EventFetcher {

    private static final Logger logger = LoggerFactory.getLogger(EventFetcher.class);

    public static final int DEFAULT_MAX_PAGES = 10;

    private final SpotifyApiClient apiClient;
    private final AccessTokenProvider tokenProvider;
    private final PlayEventNormalizer normalizer;
    private final int pageLimit;
    private final int maxPages;

    public EventFetcher(SpotifyApiClient apiClient, AccessTokenProvider tokenProvider, int maxPages) {
        this(apiClient, tokenProvider, SpotifyApiClient.PAGE_LIMIT, maxPages);
    }

    // Visible for testing
    EventFetcher(SpotifyApiClient apiClient, AccessTokenProvider tokenProvider, int pageLimit, int maxPages) {
        this.apiClient = apiClient;
        this.tokenProvider = tokenProvider;
        this.normalizer = new PlayEventNormalizer(ObjectMappers.create());
        this.pageLimit = pageLimit;
        this.maxPages = maxPages;
    }

    /**
     * Starts a new page sequence.
     *
     * @param watermark where to resume from, or {@code null} for the bounded first-run window
     */
    public PageStream fetchSince(Watermark watermark) {
        if (watermark == null) {
            logger.info("First run - fetching the most recent {} plays only", pageLimit);
            return new PageStream(this, null, false, pageLimit, 1);
        }
        logger.info("Incremental fetch since {}", watermark.lastPlayedAt());
        return new PageStream(this, watermark.afterParam(), true, pageLimit, maxPages);
    }

    /**
     * One page request. A 401 is answered once by invalidating the access token and
     * asking for a fresh one; a second 401 means the grant itself is no longer usable.
     */
    RecentlyPlayedResponse fetchPage(Long after, int pageNumber) throws IngestionException, InterruptedException {
        boolean tokenRenewed = false;
        while (true) {
            String accessToken = tokenProvider.ensureValidToken();
            try {
                return apiClient.getRecentlyPlayed(accessToken, pageLimit, after);
            } catch (SpotifyApiException e) {
                if (e.kind() == ApiErrorKind.UNAUTHORIZED && !tokenRenewed) {
                    logger.warn("Page {} returned 401, renewing access token once", pageNumber);
                    tokenProvider.invalidateAccessToken();
                    tokenRenewed = true;
                    continue;
                }
                throw translate(e, pageNumber);
            } catch (IOException e) {
                throw new TransientNetworkException(
                        "Fetching page " + pageNumber + " failed: " + e.getMessage(), e);
            }
        }
    }

    static IngestionException translate(SpotifyApiException e, int pageNumber) {
        return switch (e.kind()) {
            case UNAUTHORIZED -> new AuthExpiredUnrecoverableException(
                    "Access token rejected even after renewal on page " + pageNumber, e);
            case FORBIDDEN -> new AuthExpiredUnrecoverableException(
                    "Not permitted to read listening history (is the user-read-recently-played scope granted?)", e);
            case RATE_LIMITED -> new RateLimitedException(
                    "Rate limited on page " + pageNumber + " after retries, try later", e.retryAfter(), e);
            case SERVER_ERROR -> new TransientNetworkException(
                    "Provider unavailable on page " + pageNumber + ": " + e.getMessage(), e);
            case NOT_FOUND, CLIENT_ERROR, INVALID_GRANT -> new TransientNetworkException(
                    "Provider rejected request for page " + pageNumber + ": " + e.getMessage(), e);
        };
    }

    PlayEventNormalizer normalizer() {
        return normalizer;
    }
}
