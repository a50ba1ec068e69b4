package com.nanik.agentbridge.protocol;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/**
 * One inbound record, in either framing.
 *
 * Envelope:
 * {
 *   "jsonrpc": "2.0",
 *   "id": 1,           // Can be string, number, or null (notification)
 *   "method": "tools/call",
 *   "params": {"name": "watch_collect", "arguments": {...}}
 * }
 *
 * Legacy:
 * {
 *   "tool": "watch_collect",
 *   "params": {...}
 * }
 */
public class RpcRequest {

    private final Framing framing;
    private final String jsonrpc;
    private final JsonElement id;
    private final String method;
    private final String tool;
    private final JsonElement params;

    private RpcRequest(Framing framing, String jsonrpc, JsonElement id, String method, String tool,
                       JsonElement params) {
        this.framing = framing;
        this.jsonrpc = jsonrpc;
        this.id = id;
        this.method = method;
        this.tool = tool;
        this.params = params;
    }

    public static RpcRequest envelope(String jsonrpc, JsonElement id, String method, JsonElement params) {
        return new RpcRequest(Framing.ENVELOPE, jsonrpc, id, method, null, params);
    }

    public static RpcRequest legacy(String tool, JsonElement params) {
        return new RpcRequest(Framing.LEGACY, null, null, null, tool, params);
    }

    public Framing getFraming() {
        return framing;
    }

    public String getJsonrpc() {
        return jsonrpc;
    }

    public JsonElement getId() {
        return id;
    }

    /**
     * Wire method name; null for legacy records.
     */
    public String getMethod() {
        return method;
    }

    /**
     * Tool name of a legacy record; null for envelopes.
     */
    public String getTool() {
        return tool;
    }

    /**
     * Raw params member, which may be absent or of any JSON type.
     */
    public JsonElement getRawParams() {
        return params;
    }

    /**
     * Params as an object; empty when absent or not an object.
     */
    public JsonObject getParams() {
        return hasObjectParams() ? params.getAsJsonObject() : new JsonObject();
    }

    public boolean hasObjectParams() {
        return params != null && params.isJsonObject();
    }

    /**
     * Check if this is a notification (no id = no response expected).
     */
    public boolean isNotification() {
        return framing == Framing.ENVELOPE && (id == null || id.isJsonNull());
    }

    /**
     * Validate the envelope.
     * @return null if valid, error message if invalid
     */
    public String validate() {
        if (framing == Framing.LEGACY) {
            return null;
        }
        if (jsonrpc != null && !jsonrpc.equals("2.0")) {
            return "jsonrpc must be exactly \"2.0\"";
        }
        if (method == null || method.isEmpty()) {
            return "method is required";
        }
        if (params != null && !params.isJsonNull() && !params.isJsonObject()) {
            return "params must be an object";
        }
        return null;
    }

    /**
     * Get a string parameter from params.
     */
    public String getStringParam(String name) {
        JsonObject obj = getParams();
        if (!obj.has(name)) {
            return null;
        }
        JsonElement elem = obj.get(name);
        return elem.isJsonPrimitive() ? elem.getAsString() : null;
    }

    /**
     * Get a parameter of any type from params.
     */
    public JsonElement getParam(String name) {
        return getParams().get(name);
    }

    @Override
    public String toString() {
        if (framing == Framing.LEGACY) {
            return "RpcRequest{legacy tool='" + tool + "', params=" + params + "}";
        }
        return "RpcRequest{id=" + id + ", method='" + method + "', params=" + params + "}";
    }
}
