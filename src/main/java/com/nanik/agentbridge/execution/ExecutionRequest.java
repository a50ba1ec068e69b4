package com.nanik.agentbridge.execution;

import com.google.gson.JsonObject;

/**
 * One invocation of a tool: the caller's raw arguments and the validated
 * arguments actually handed to the agent.
 */
public class ExecutionRequest {

    private final String toolName;
    private final JsonObject rawArguments;
    private final JsonObject validatedArguments;

    public ExecutionRequest(String toolName, JsonObject rawArguments, JsonObject validatedArguments) {
        this.toolName = toolName;
        this.rawArguments = rawArguments != null ? rawArguments : new JsonObject();
        this.validatedArguments = validatedArguments;
    }

    public String getToolName() {
        return toolName;
    }

    public JsonObject getRawArguments() {
        return rawArguments;
    }

    /**
     * Null until validation succeeded.
     */
    public JsonObject getValidatedArguments() {
        return validatedArguments;
    }

    public ExecutionRequest withValidatedArguments(JsonObject arguments) {
        return new ExecutionRequest(toolName, rawArguments, arguments);
    }

    @Override
    public String toString() {
        return "ExecutionRequest{tool='" + toolName + "', arguments=" + rawArguments + "}";
    }
}
