package com.listenpulse.ingestor.storage;

import java.io.IOException;
import java.util.Optional;

/**
 * Key-addressed blob storage used for the output files and both state blobs.
 *
 * <p>Implementations must give read-after-write consistency per key, and
 * {@link #put} must be an atomic replace: a reader sees either the previous
 * content or the complete new content, never a partial object.</p>
 */
public interface ObjectStore {

    /**
     * @return the object content, or empty if no object exists under {@code key}
     * @throws IOException if the store could not be read
     */
    Optional<byte[]> get(String key) throws IOException;

    /**
     * @return whether an object exists under {@code key}
     * @throws IOException if the store could not be queried
     */
    boolean exists(String key) throws IOException;

    /**
     * Creates or atomically replaces the object under {@code key}.
     */
    void put(String key, byte[] content, String contentType) throws IOException;

    /**
     * Human-readable location of {@code key}, for logs and summaries.
     */
    String describe(String key);
}
