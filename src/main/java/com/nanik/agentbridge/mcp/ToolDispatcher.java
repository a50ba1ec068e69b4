package com.nanik.agentbridge.mcp;

import com.google.gson.JsonObject;
import com.nanik.agentbridge.execution.AgentExecutor;
import com.nanik.agentbridge.execution.ExecutionRequest;
import com.nanik.agentbridge.execution.ExecutionResult;
import com.nanik.agentbridge.metrics.MetricsRegistry;
import com.nanik.agentbridge.tools.ToolDescriptor;
import com.nanik.agentbridge.validation.ParameterValidator;
import com.nanik.agentbridge.validation.ValidationOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * Runs one tool call: validate, execute, record metrics.
 */
public class ToolDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ToolDispatcher.class);

    private final ToolRegistry toolRegistry;
    private final ParameterValidator validator;
    private final AgentExecutor executor;
    private final MetricsRegistry metrics;

    public ToolDispatcher(ToolRegistry toolRegistry, ParameterValidator validator,
                          AgentExecutor executor, MetricsRegistry metrics) {
        this.toolRegistry = toolRegistry;
        this.validator = validator;
        this.executor = executor;
        this.metrics = metrics;
    }

    public boolean hasTool(String name) {
        return toolRegistry.hasTool(name);
    }

    /**
     * Dispatch a call to a registered tool.
     *
     * @param toolName a name for which {@link #hasTool} is true
     * @param rawArguments arguments as received
     * @return exactly one result; never null
     */
    public ExecutionResult dispatch(String toolName, JsonObject rawArguments) {
        ToolDescriptor tool = toolRegistry.getTool(toolName);
        if (tool == null) {
            throw new IllegalArgumentException("Unknown tool: " + toolName);
        }

        log.info("Executing tool: {}", toolName);
        long start = System.nanoTime();
        ExecutionRequest request = new ExecutionRequest(toolName, rawArguments, null);

        ExecutionResult result;
        ValidationOutcome outcome = validator.validate(tool, rawArguments);
        if (!outcome.isValid()) {
            log.warn("Validation failed for {}: {}", toolName, outcome.getFailure().getMessage());
            long elapsed = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            result = ExecutionResult.validationError(outcome.getFailure(), elapsed);
        } else {
            result = executor.run(request.withValidatedArguments(outcome.getArguments()), tool);
        }

        metrics.record(toolName, result);
        log.info("Tool {} finished: {} in {}ms", toolName, result.getOutcome().getWireName(),
            result.getDurationMillis());
        return result;
    }

    public MetricsRegistry getMetrics() {
        return metrics;
    }
}
