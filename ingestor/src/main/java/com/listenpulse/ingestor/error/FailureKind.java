package com.listenpulse.ingestor.error;

/**
 * Classes of run failure. None of them moves the cursor; only the auth kinds need
 * someone to act before the next scheduled run can succeed.
 */
public enum FailureKind {
    AUTH_BOOTSTRAP_REQUIRED(true),
    AUTH_EXPIRED_UNRECOVERABLE(true),
    TRANSIENT_NETWORK(false),
    RATE_LIMITED(false),
    STORAGE_WRITE_FAILED(false);

    private final boolean operatorRequired;

    FailureKind(boolean operatorRequired) {
        this.operatorRequired = operatorRequired;
    }

    public boolean operatorRequired() {
        return operatorRequired;
    }
}
