package com.listenpulse.ingestor.error;

public class StorageWriteFailedException extends IngestionException {

    public StorageWriteFailedException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public FailureKind kind() {
        return FailureKind.STORAGE_WRITE_FAILED;
    }
}
