package com.listenpulse.ingestor.fetcher;

import com.listenpulse.ingestor.model.PlayEvent;

import java.util.List;

/**
 * One provider page after normalization.
 *
 * @param events         valid events in provider order
 * @param rawItemCount   items the provider returned, valid or not
 * @param malformedCount items dropped because they could not be normalized
 */
public record FetchedPage(
        int pageNumber,
        List<PlayEvent> events,
        int rawItemCount,
        int malformedCount
) {

    public FetchedPage {
        events = List.copyOf(events);
    }
}
