package com.nanik.agentbridge.metrics;

import com.nanik.agentbridge.execution.ExecutionResult;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-tool execution metrics for the lifetime of the bridge.
 *
 * Mutated only from the request loop thread, so no locking is done.
 */
public class MetricsRegistry {

    /** Aggregate error rate above which the bridge reports itself degraded. */
    public static final double DEGRADED_ERROR_RATE = 0.10;

    private final Map<String, ToolMetrics> metrics = new LinkedHashMap<>();
    private final boolean enabled;
    private final Clock clock;

    public MetricsRegistry() {
        this(true, Clock.systemUTC());
    }

    public MetricsRegistry(boolean enabled, Clock clock) {
        this.enabled = enabled;
        this.clock = clock;
    }

    /**
     * Record the result of one invocation.
     */
    public void record(String toolName, ExecutionResult result) {
        record(toolName, result.isSuccess(), result.getDurationMillis(), result.getMessage());
    }

    /**
     * Record one invocation.
     *
     * @param errorMessage kept in the recent-error ring when {@code success} is false
     */
    public void record(String toolName, boolean success, long durationMillis, String errorMessage) {
        if (!enabled) {
            return;
        }
        ToolMetrics tool = metrics.computeIfAbsent(toolName, ToolMetrics::new);
        if (success) {
            tool.recordSuccess(durationMillis, clock.instant());
        } else {
            tool.recordError(durationMillis, clock.instant(), errorMessage);
        }
    }

    /**
     * Metrics for one tool, or null if it was never called.
     */
    public ToolMetrics getToolMetrics(String toolName) {
        return metrics.get(toolName);
    }

    public Map<String, ToolMetrics> getAll() {
        return Collections.unmodifiableMap(metrics);
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Aggregate health derived from the current counters.
     */
    public HealthReport healthReport() {
        long totalCalls = 0;
        long totalErrors = 0;
        for (ToolMetrics tool : metrics.values()) {
            totalCalls += tool.getCallCount();
            totalErrors += tool.getErrorCount();
        }
        double errorRate = totalCalls == 0 ? 0.0 : (double) totalErrors / totalCalls;
        String status = errorRate > DEGRADED_ERROR_RATE ? HealthReport.DEGRADED : HealthReport.HEALTHY;
        List<ToolMetrics> tools = new ArrayList<>(metrics.values());
        return new HealthReport(status, totalCalls, totalErrors, errorRate, clock.instant(), tools);
    }
}
