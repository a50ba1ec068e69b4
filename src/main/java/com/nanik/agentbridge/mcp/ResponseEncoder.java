package com.nanik.agentbridge.mcp;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.nanik.agentbridge.protocol.RpcResponse;

/**
 * Serializes responses in either framing and hands them to the transport.
 */
public class ResponseEncoder {

    public static final String STATUS_SUCCESS = "success";
    public static final String STATUS_ERROR = "error";

    private final StdioTransport transport;
    private final Gson gson;

    public ResponseEncoder(StdioTransport transport) {
        this.transport = transport;
        this.gson = new GsonBuilder()
            .serializeNulls()
            .disableHtmlEscaping()
            .create();
    }

    /**
     * Write an envelope response.
     *
     * @return false if the peer is gone
     */
    public boolean write(RpcResponse response) {
        return transport.send(gson.toJson(response.toJson()));
    }

    /**
     * Write a bare legacy response object.
     *
     * @return false if the peer is gone
     */
    public boolean writeLegacy(JsonObject response) {
        return transport.send(gson.toJson(response));
    }

    /**
     * MCP tool result wrapping an agent payload:
     * {
     *   "content": [{"type": "text", "text": "<payload as JSON>"}],
     *   "structuredContent": {...},
     *   "isError": false
     * }
     * structuredContent is present only for object payloads.
     */
    public JsonObject toolCallResult(JsonElement payload) {
        JsonObject result = new JsonObject();
        JsonArray contentArray = new JsonArray();
        JsonObject contentObj = new JsonObject();
        contentObj.addProperty("type", "text");
        contentObj.addProperty("text", gson.toJson(payload));
        contentArray.add(contentObj);
        result.add("content", contentArray);
        if (payload != null && payload.isJsonObject()) {
            result.add("structuredContent", payload);
        }
        result.addProperty("isError", false);
        return result;
    }

    /**
     * {"status": "success", "result": ...}
     */
    public static JsonObject legacySuccess(JsonElement result) {
        JsonObject obj = new JsonObject();
        obj.addProperty("status", STATUS_SUCCESS);
        obj.add("result", result);
        return obj;
    }

    /**
     * {"status": "error", "error": "..."}
     */
    public static JsonObject legacyError(String message) {
        JsonObject obj = new JsonObject();
        obj.addProperty("status", STATUS_ERROR);
        obj.addProperty("error", message);
        return obj;
    }
}
