package com.listenpulse.ingestor.error;

/**
 * No stored credentials and nothing configured to obtain them.
 */
public class AuthBootstrapRequiredException extends IngestionException {

    public AuthBootstrapRequiredException(String message) {
        super(message);
    }

    @Override
    public FailureKind kind() {
        return FailureKind.AUTH_BOOTSTRAP_REQUIRED;
    }
}
