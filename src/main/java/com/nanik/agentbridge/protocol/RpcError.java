package com.nanik.agentbridge.protocol;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import com.nanik.agentbridge.execution.ExecutionResult;
import com.nanik.agentbridge.validation.ValidationFailure;

/**
 * JSON-RPC 2.0 error codes and error response structure.
 */
public class RpcError {

    // JSON-RPC 2.0 standard error codes
    public static final int PARSE_ERROR = -32700;      // Invalid JSON
    public static final int INVALID_REQUEST = -32600;  // Invalid Request object
    public static final int METHOD_NOT_FOUND = -32601; // Method or tool does not exist
    public static final int INVALID_PARAMS = -32602;   // Invalid method parameters
    public static final int INTERNAL_ERROR = -32603;   // Internal JSON-RPC error

    // Server error range, one code per agent failure kind
    public static final int AGENT_TIMEOUT = -32001;
    public static final int AGENT_FAILURE = -32002;
    public static final int MALFORMED_OUTPUT = -32003;

    private final int code;
    private final String message;
    private final JsonElement data;

    public RpcError(int code, String message) {
        this(code, message, null);
    }

    public RpcError(int code, String message, JsonElement data) {
        this.code = code;
        this.message = message;
        this.data = data;
    }

    public int getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public JsonElement getData() {
        return data;
    }

    public static RpcError parseError(String details) {
        return new RpcError(PARSE_ERROR, "Parse error", text(details));
    }

    public static RpcError invalidRequest(String details) {
        return new RpcError(INVALID_REQUEST, "Invalid Request", text(details));
    }

    public static RpcError methodNotFound(String method) {
        return new RpcError(METHOD_NOT_FOUND, "Method not found: " + method);
    }

    public static RpcError unknownTool(String tool, Iterable<String> available) {
        JsonObject data = new JsonObject();
        data.addProperty("tool", tool);
        JsonArray names = new JsonArray();
        for (String name : available) {
            names.add(name);
        }
        data.add("availableTools", names);
        return new RpcError(METHOD_NOT_FOUND, "Unknown tool: " + tool, data);
    }

    public static RpcError invalidParams(String details) {
        return new RpcError(INVALID_PARAMS, "Invalid params", text(details));
    }

    public static RpcError internalError(Throwable t) {
        return new RpcError(INTERNAL_ERROR, "Internal error", text(t.getClass().getSimpleName() + ": " + t.getMessage()));
    }

    /**
     * Error for a failed tool invocation; {@code data} identifies the failure kind.
     */
    public static RpcError fromResult(String tool, ExecutionResult result) {
        JsonObject data = new JsonObject();
        data.addProperty("kind", result.getOutcome().getWireName());
        data.addProperty("tool", tool);
        data.addProperty("durationMs", result.getDurationMillis());
        if (result.getExitCode() != null) {
            data.addProperty("exitCode", result.getExitCode());
        }
        if (result.getProcessState() != null) {
            data.addProperty("processState", result.getProcessState().name());
        }
        ValidationFailure failure = result.getValidationFailure();
        if (failure != null) {
            data.addProperty("field", failure.getField());
            data.addProperty("rule", failure.getRule());
        }

        switch (result.getOutcome()) {
            case VALIDATION_ERROR:
                return new RpcError(INVALID_PARAMS, result.getMessage(), data);
            case TIMEOUT:
                return new RpcError(AGENT_TIMEOUT, result.getMessage(), data);
            case AGENT_FAILURE:
                return new RpcError(AGENT_FAILURE, result.getMessage(), data);
            case MALFORMED_OUTPUT:
                return new RpcError(MALFORMED_OUTPUT, result.getMessage(), data);
            default:
                throw new IllegalArgumentException("Not an error result: " + result.getOutcome());
        }
    }

    public JsonObject toJson() {
        JsonObject obj = new JsonObject();
        obj.addProperty("code", code);
        obj.addProperty("message", message);
        if (data != null) {
            obj.add("data", data);
        }
        return obj;
    }

    private static JsonElement text(String details) {
        return details != null ? new JsonPrimitive(details) : null;
    }

    @Override
    public String toString() {
        return "RpcError{code=" + code + ", message='" + message + "', data=" + data + "}";
    }
}
