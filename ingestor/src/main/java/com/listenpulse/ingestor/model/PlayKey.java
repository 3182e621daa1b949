package com.listenpulse.ingestor.model;

import java.time.Instant;

/**
 * Identity of a play: the same track played at the same instant is the same event.
 */
public record PlayKey(String trackId, Instant playedAt) {}
