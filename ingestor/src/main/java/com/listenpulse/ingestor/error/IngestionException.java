package com.listenpulse.ingestor.error;

/**
 * Base type for every failure that aborts an ingestion run.
 */
public abstract class IngestionException extends Exception {

    protected IngestionException(String message) {
        super(message);
    }

    protected IngestionException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract FailureKind kind();
}
