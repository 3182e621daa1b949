package com.listenpulse.ingestor.auth;

/**
 * Lifecycle of the access token within one execution.
 */
public enum AuthState {
    NO_CREDENTIALS,
    VALID,
    EXPIRED,
    REFRESHING,
    /** Terminal for the current execution; needs out-of-band re-authorization. */
    FAILED
}
