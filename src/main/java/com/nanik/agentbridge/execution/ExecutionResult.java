package com.nanik.agentbridge.execution;

import com.google.gson.JsonElement;
import com.nanik.agentbridge.validation.ValidationFailure;

/**
 * Result of one tool invocation. Every {@link ExecutionRequest} produces
 * exactly one of these; failures are values, not exceptions.
 */
public class ExecutionResult {

    private final Outcome outcome;
    private final JsonElement payload;
    private final String message;
    private final long durationMillis;
    private final Integer exitCode;
    private final ValidationFailure validationFailure;
    private final ProcessState processState;

    private ExecutionResult(Outcome outcome, JsonElement payload, String message, long durationMillis,
                            Integer exitCode, ValidationFailure validationFailure, ProcessState processState) {
        this.outcome = outcome;
        this.payload = payload;
        this.message = message;
        this.durationMillis = durationMillis;
        this.exitCode = exitCode;
        this.validationFailure = validationFailure;
        this.processState = processState;
    }

    /**
     * Agent exited 0 and printed well-formed JSON.
     */
    public static ExecutionResult success(JsonElement payload, long durationMillis, int exitCode) {
        return new ExecutionResult(Outcome.SUCCESS, payload, null, durationMillis, exitCode, null,
            ProcessState.COMPLETED);
    }

    /**
     * Arguments were rejected before any process was started.
     */
    public static ExecutionResult validationError(ValidationFailure failure, long durationMillis) {
        return new ExecutionResult(Outcome.VALIDATION_ERROR, null, "Validation error: " + failure.getMessage(),
            durationMillis, null, failure, null);
    }

    /**
     * Agent exceeded its timeout and was terminated.
     */
    public static ExecutionResult timeout(String message, long durationMillis, ProcessState finalState) {
        return new ExecutionResult(Outcome.TIMEOUT, null, message, durationMillis, null, null, finalState);
    }

    /**
     * Agent could not be started or exited with a non-zero code.
     *
     * @param exitCode null when no process ran
     */
    public static ExecutionResult agentFailure(String message, long durationMillis, Integer exitCode) {
        return new ExecutionResult(Outcome.AGENT_FAILURE, null, message, durationMillis, exitCode, null,
            exitCode != null ? ProcessState.COMPLETED : null);
    }

    /**
     * Agent exited 0 but its output was not a JSON document.
     */
    public static ExecutionResult malformedOutput(String message, long durationMillis, int exitCode) {
        return new ExecutionResult(Outcome.MALFORMED_OUTPUT, null, message, durationMillis, exitCode, null,
            ProcessState.COMPLETED);
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public boolean isSuccess() {
        return outcome.isSuccess();
    }

    /**
     * Parsed agent output; only set on success.
     */
    public JsonElement getPayload() {
        return payload;
    }

    /**
     * Diagnostic text; null on success.
     */
    public String getMessage() {
        return message;
    }

    public long getDurationMillis() {
        return durationMillis;
    }

    public Integer getExitCode() {
        return exitCode;
    }

    public ValidationFailure getValidationFailure() {
        return validationFailure;
    }

    /**
     * Final lifecycle state of the agent process, or null when none was spawned.
     */
    public ProcessState getProcessState() {
        return processState;
    }

    @Override
    public String toString() {
        return "ExecutionResult{outcome=" + outcome + ", durationMillis=" + durationMillis
            + ", exitCode=" + exitCode + (message != null ? ", message='" + message + "'" : "") + "}";
    }
}
