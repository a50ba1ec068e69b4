package com.nanik.agentbridge.metrics;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time health view returned by {@code health_check}.
 *
 * {
 *   "status": "healthy",
 *   "totalCalls": 3,
 *   "totalErrors": 0,
 *   "errorRate": 0.0,
 *   "timestamp": "2024-01-01T00:00:00Z",
 *   "tools": {
 *     "watch_collect": {"callCount": 3, "successCount": 3, "successRate": 1.0, ...}
 *   }
 * }
 */
public class HealthReport {

    public static final String HEALTHY = "healthy";
    public static final String DEGRADED = "degraded";

    private final String status;
    private final long totalCalls;
    private final long totalErrors;
    private final double errorRate;
    private final Instant timestamp;
    private final List<ToolMetrics> tools;

    HealthReport(String status, long totalCalls, long totalErrors, double errorRate,
                 Instant timestamp, List<ToolMetrics> tools) {
        this.status = status;
        this.totalCalls = totalCalls;
        this.totalErrors = totalErrors;
        this.errorRate = errorRate;
        this.timestamp = timestamp;
        this.tools = tools;
    }

    public String getStatus() {
        return status;
    }

    public long getTotalCalls() {
        return totalCalls;
    }

    public long getTotalErrors() {
        return totalErrors;
    }

    public double getErrorRate() {
        return errorRate;
    }

    public List<ToolMetrics> getTools() {
        return tools;
    }

    public JsonObject toJson() {
        JsonObject result = new JsonObject();
        result.addProperty("status", status);
        result.addProperty("totalCalls", totalCalls);
        result.addProperty("totalErrors", totalErrors);
        result.addProperty("errorRate", errorRate);
        result.addProperty("timestamp", timestamp.toString());

        JsonObject toolsObj = new JsonObject();
        for (ToolMetrics tool : tools) {
            JsonObject toolObj = new JsonObject();
            toolObj.addProperty("callCount", tool.getCallCount());
            toolObj.addProperty("successCount", tool.getSuccessCount());
            toolObj.addProperty("errorCount", tool.getErrorCount());
            toolObj.addProperty("successRate", tool.getSuccessRate());
            toolObj.addProperty("averageDurationMs", tool.getAverageDurationMillis());
            toolObj.addProperty("totalDurationMs", tool.getTotalDurationMillis());
            if (tool.getLastExecution() != null) {
                toolObj.addProperty("lastExecution", tool.getLastExecution().toString());
            }
            JsonArray errors = new JsonArray();
            for (ErrorRecord error : tool.getRecentErrors()) {
                JsonObject errorObj = new JsonObject();
                errorObj.addProperty("timestamp", error.getTimestamp().toString());
                errorObj.addProperty("message", error.getMessage());
                errors.add(errorObj);
            }
            toolObj.add("recentErrors", errors);
            toolsObj.add(tool.getToolName(), toolObj);
        }
        result.add("tools", toolsObj);
        return result;
    }
}
