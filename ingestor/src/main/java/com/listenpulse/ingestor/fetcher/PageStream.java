package com.listenpulse.ingestor.fetcher;

import com.fasterxml.jackson.databind.JsonNode;
import com.listenpulse.ingestor.error.IngestionException;
import com.listenpulse.ingestor.model.PlayEvent;
import com.listenpulse.ingestor.model.RecentlyPlayedResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Lazy, finite, single-use sequence of pages. Each {@link #next()} issues at most
 * one request. Once exhausted (or failed) it stays exhausted; to start over, call
 * {@link EventFetcher#fetchSince} again.
 */
public class PageStream {

    private static final Logger logger = LoggerFactory.getLogger(PageStream.class);

    private final EventFetcher fetcher;
    private final boolean paginate;
    private final int pageLimit;
    private final int maxPages;

    private Long after;
    private int pagesFetched;
    private boolean exhausted;
    private boolean capReached;

    PageStream(EventFetcher fetcher, Long after, boolean paginate, int pageLimit, int maxPages) {
        this.fetcher = fetcher;
        this.after = after;
        this.paginate = paginate;
        this.pageLimit = pageLimit;
        this.maxPages = maxPages;
    }

    /**
     * Fetches the next page.
     *
     * @return the page, or empty once the feed is exhausted
     */
    public Optional<FetchedPage> next() throws IngestionException, InterruptedException {
        if (exhausted) {
            return Optional.empty();
        }
        if (pagesFetched >= maxPages) {
            logger.warn("Reached {} pages in one run, stopping; the next run continues from the new watermark",
                    maxPages);
            capReached = true;
            exhausted = true;
            return Optional.empty();
        }

        int pageNumber = pagesFetched + 1;
        RecentlyPlayedResponse response;
        try {
            response = fetcher.fetchPage(after, pageNumber);
        } catch (IngestionException | InterruptedException e) {
            exhausted = true;
            throw e;
        }
        pagesFetched++;

        List<JsonNode> items = response.itemsOrEmpty();
        if (items.isEmpty()) {
            logger.info("Page {}: no new tracks", pageNumber);
            exhausted = true;
            return Optional.empty();
        }

        List<PlayEvent> events = new ArrayList<>(items.size());
        int malformed = 0;
        for (JsonNode item : items) {
            Optional<PlayEvent> event = fetcher.normalizer().normalize(item);
            if (event.isPresent()) {
                events.add(event.get());
            } else {
                malformed++;
            }
        }
        FetchedPage page = new FetchedPage(pageNumber, events, items.size(), malformed);
        logger.info("Page {}: {} items, {} valid, {} malformed (after={})",
                pageNumber, items.size(), events.size(), malformed, after);

        advance(page, response);
        return Optional.of(page);
    }

    private void advance(FetchedPage page, RecentlyPlayedResponse response) {
        if (!paginate) {
            exhausted = true;
            return;
        }
        if (page.rawItemCount() < pageLimit) {
            logger.info("Page {} was partial ({} < {}), fetched all new tracks",
                    page.pageNumber(), page.rawItemCount(), pageLimit);
            exhausted = true;
            return;
        }

        Long nextAfter = nextAfter(page, response);
        if (nextAfter == null || (after != null && nextAfter <= after)) {
            logger.warn("Page {} did not move the cursor past {}, stopping", page.pageNumber(), after);
            exhausted = true;
            return;
        }
        after = nextAfter;
    }

    /**
     * Newest valid played_at on the page, or the provider's own cursor when no item was usable.
     */
    static Long nextAfter(FetchedPage page, RecentlyPlayedResponse response) {
        Optional<Long> newest = page.events().stream()
                .map(PlayEvent::playedAtTimestamp)
                .max(Long::compare);
        if (newest.isPresent()) {
            return newest.get();
        }
        if (response.cursors() != null && response.cursors().after() != null) {
            try {
                return Long.parseLong(response.cursors().after());
            } catch (NumberFormatException e) {
                logger.warn("Ignoring non-numeric provider cursor: {}", response.cursors().after());
            }
        }
        return null;
    }

    public int pagesFetched() {
        return pagesFetched;
    }

    /**
     * True when the stream stopped because of the page cap, not because the feed ran out.
     */
    public boolean capReached() {
        return capReached;
    }
}
