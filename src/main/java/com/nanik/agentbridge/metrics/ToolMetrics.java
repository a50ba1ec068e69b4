package com.nanik.agentbridge.metrics;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Lifetime counters for one tool plus a bounded ring of its most recent errors.
 *
 * Not thread-safe; the request loop is the only writer.
 */
public class ToolMetrics {

    public static final int ERROR_CAPACITY = 100;
    public static final int MAX_ERROR_MESSAGE_CHARS = 500;

    private final String toolName;
    private long callCount;
    private long successCount;
    private long errorCount;
    private long totalDurationMillis;
    private Instant lastExecution;
    private final Deque<ErrorRecord> recentErrors = new ArrayDeque<>(ERROR_CAPACITY);

    public ToolMetrics(String toolName) {
        this.toolName = toolName;
    }

    void recordSuccess(long durationMillis, Instant at) {
        record(durationMillis, at);
        successCount++;
    }

    void recordError(long durationMillis, Instant at, String message) {
        record(durationMillis, at);
        errorCount++;
        if (recentErrors.size() == ERROR_CAPACITY) {
            recentErrors.removeFirst();
        }
        String text = message != null ? message : "unknown error";
        if (text.length() > MAX_ERROR_MESSAGE_CHARS) {
            text = text.substring(0, MAX_ERROR_MESSAGE_CHARS);
        }
        recentErrors.addLast(new ErrorRecord(at, text));
    }

    private void record(long durationMillis, Instant at) {
        callCount++;
        totalDurationMillis += Math.max(0, durationMillis);
        lastExecution = at;
    }

    public String getToolName() {
        return toolName;
    }

    public long getCallCount() {
        return callCount;
    }

    public long getSuccessCount() {
        return successCount;
    }

    public long getErrorCount() {
        return errorCount;
    }

    public long getTotalDurationMillis() {
        return totalDurationMillis;
    }

    /**
     * Successful calls over all calls; 0 before the first call.
     */
    public double getSuccessRate() {
        return callCount == 0 ? 0.0 : (double) successCount / callCount;
    }

    public double getAverageDurationMillis() {
        return callCount == 0 ? 0.0 : (double) totalDurationMillis / callCount;
    }

    public Instant getLastExecution() {
        return lastExecution;
    }

    /**
     * Recent errors, oldest first.
     */
    public List<ErrorRecord> getRecentErrors() {
        return new ArrayList<>(recentErrors);
    }
}
