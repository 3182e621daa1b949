package com.listenpulse.ingestor.orchestrator;

/**
 * What a single execution reports to its scheduler.
 */
public enum RunOutcome {
    INGESTED(0),
    NO_NEW_EVENTS(0),
    /** Nothing was committed; the next scheduled run repeats the same window. */
    RETRY_LATER(1),
    /** Nothing was committed; credentials need operator action first. */
    NEEDS_OPERATOR(2);

    private final int exitCode;

    RunOutcome(int exitCode) {
        this.exitCode = exitCode;
    }

    public int exitCode() {
        return exitCode;
    }

    public boolean isSuccess() {
        return exitCode == 0;
    }
}
