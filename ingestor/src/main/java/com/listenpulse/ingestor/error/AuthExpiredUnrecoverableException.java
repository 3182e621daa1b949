package com.listenpulse.ingestor.error;

/**
 * The provider rejected the refresh token (or the client itself). Requires re-authorization.
 */
public class AuthExpiredUnrecoverableException extends IngestionException {

    public AuthExpiredUnrecoverableException(String message) {
        super(message);
    }

    public AuthExpiredUnrecoverableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public FailureKind kind() {
        return FailureKind.AUTH_EXPIRED_UNRECOVERABLE;
    }
}
