package com.nanik.agentbridge.protocol;

import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;

/**
 * Represents a JSON-RPC 2.0 response message.
 *
 * Success response:
 * {
 *   "jsonrpc": "2.0",
 *   "id": 1,
 *   "result": {...}
 * }
 *
 * Error response:
 * {
 *   "jsonrpc": "2.0",
 *   "id": 1,
 *   "error": {
 *     "code": -32600,
 *     "message": "Invalid Request",
 *     "data": "optional details"
 *   }
 * }
 */
public class RpcResponse {

    public static final String JSONRPC_VERSION = "2.0";

    private final JsonElement id;
    private final JsonElement result;
    private final RpcError error;

    private RpcResponse(JsonElement id, JsonElement result, RpcError error) {
        this.id = id;
        this.result = result;
        this.error = error;
    }

    /**
     * Create a success response.
     */
    public static RpcResponse success(JsonElement id, JsonElement result) {
        return new RpcResponse(id, result != null ? result : new JsonObject(), null);
    }

    /**
     * Create an error response.
     */
    public static RpcResponse error(JsonElement id, RpcError error) {
        return new RpcResponse(id, null, error);
    }

    public JsonElement getId() {
        return id;
    }

    public JsonElement getResult() {
        return result;
    }

    public RpcError getError() {
        return error;
    }

    public boolean isError() {
        return error != null;
    }

    /**
     * Envelope as a JSON tree; a missing id is written as null.
     */
    public JsonObject toJson() {
        JsonObject obj = new JsonObject();
        obj.addProperty("jsonrpc", JSONRPC_VERSION);
        obj.add("id", id != null ? id : JsonNull.INSTANCE);
        if (error != null) {
            obj.add("error", error.toJson());
        } else {
            obj.add("result", result);
        }
        return obj;
    }

    @Override
    public String toString() {
        if (error != null) {
            return "RpcResponse{id=" + id + ", error=" + error + "}";
        }
        return "RpcResponse{id=" + id + ", result=" + result + "}";
    }
}
