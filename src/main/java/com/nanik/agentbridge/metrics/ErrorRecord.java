package com.nanik.agentbridge.metrics;

import java.time.Instant;

/**
 * One failed invocation kept in a tool's recent-error ring.
 */
public class ErrorRecord {

    private final Instant timestamp;
    private final String message;

    public ErrorRecord(Instant timestamp, String message) {
        this.timestamp = timestamp;
        this.message = message;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getMessage() {
        return message;
    }
}
