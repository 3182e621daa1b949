package com.listenpulse.ingestor.error;

public class TransientNetworkException extends IngestionException {

    public TransientNetworkException(String message) {
        super(message);
    }

    public TransientNetworkException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public FailureKind kind() {
        return FailureKind.TRANSIENT_NETWORK;
    }
}
