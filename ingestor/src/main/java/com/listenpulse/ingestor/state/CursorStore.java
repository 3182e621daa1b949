package com.listenpulse.ingestor.state;

import com.listenpulse.ingestor.model.Watermark;
import com.listenpulse.ingestor.writer.WriteReceipt;

import java.io.IOException;
import java.util.Optional;

/**
 * Durable ingestion watermark.
 *
 * <p>{@link #advance} only accepts a {@link WriteReceipt}, which only the
 * {@link com.listenpulse.ingestor.writer.ObjectWriter} can issue after a batch
 * has been durably written. The watermark therefore cannot move past data that
 * is not in storage yet.</p>
 */
public interface CursorStore {

    /**
     * @return the stored watermark, or empty if nothing has been ingested yet
     * @throws IOException if the state exists but cannot be read or parsed
     */
    Optional<Watermark> loadWatermark() throws IOException;

    /**
     * Moves the watermark to the newest event covered by {@code receipt}.
     *
     * @return the watermark now stored
     */
    Watermark advance(WriteReceipt receipt) throws IOException;
}
