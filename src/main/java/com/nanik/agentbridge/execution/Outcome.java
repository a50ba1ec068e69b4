package com.nanik.agentbridge.execution;

/**
 * Outcome tag of an {@link ExecutionResult}.
 */
public enum Outcome {
    SUCCESS("success"),
    VALIDATION_ERROR("validation_error"),
    TIMEOUT("timeout"),
    AGENT_FAILURE("agent_failure"),
    MALFORMED_OUTPUT("malformed_output");

    private final String wireName;

    Outcome(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public boolean isSuccess() {
        return this == SUCCESS;
    }
}
