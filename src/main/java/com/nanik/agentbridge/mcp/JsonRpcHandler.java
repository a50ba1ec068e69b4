package com.nanik.agentbridge.mcp;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.nanik.agentbridge.protocol.JsonDepth;
import com.nanik.agentbridge.protocol.RpcError;
import com.nanik.agentbridge.protocol.RpcRequest;
import com.nanik.agentbridge.protocol.RpcResponse;

/**
 * Handles record parsing and response sending for both framings.
 */
public class JsonRpcHandler {

    private final ResponseEncoder encoder;

    public JsonRpcHandler(ResponseEncoder encoder) {
        this.encoder = encoder;
    }

    /**
     * Parse one input line into a request.
     *
     * A record carrying {@code method} is an envelope, even if it also has
     * {@code tool}; anything else is treated as a legacy record.
     *
     * @param line The raw JSON line
     * @return ParseResult containing either request or error response
     */
    public ParseResult parseRequest(String line) {
        JsonElement parsed;
        try {
            parsed = JsonParser.parseString(line);
        } catch (JsonParseException e) {
            return ParseResult.error(RpcResponse.error(null, RpcError.parseError(e.getMessage())));
        }

        if (parsed == null || !parsed.isJsonObject()) {
            return ParseResult.error(RpcResponse.error(null, RpcError.parseError("Expected a JSON object")));
        }
        if (JsonDepth.exceeds(parsed, JsonDepth.MAX_RECORD_DEPTH)) {
            return ParseResult.error(RpcResponse.error(null,
                RpcError.invalidRequest("Record nesting exceeds " + JsonDepth.MAX_RECORD_DEPTH + " levels")));
        }
        JsonObject obj = parsed.getAsJsonObject();

        if (obj.has("method")) {
            return parseEnvelope(obj);
        }

        String tool = stringMember(obj, "tool");
        return ParseResult.success(RpcRequest.legacy(tool, obj.get("params")));
    }

    private ParseResult parseEnvelope(JsonObject obj) {
        JsonElement id = obj.get("id");
        if (!isValidId(id)) {
            return ParseResult.error(RpcResponse.error(null,
                RpcError.invalidRequest("id must be a string, a number or null")));
        }
        JsonElement methodElem = obj.get("method");
        if (!isString(methodElem)) {
            return ParseResult.error(RpcResponse.error(id, RpcError.invalidRequest("method must be a string")));
        }

        String jsonrpc = null;
        if (obj.has("jsonrpc")) {
            JsonElement versionElem = obj.get("jsonrpc");
            jsonrpc = isString(versionElem) ? versionElem.getAsString() : versionElem.toString();
        }

        RpcRequest request = RpcRequest.envelope(jsonrpc, id, methodElem.getAsString(), obj.get("params"));
        String validationError = request.validate();
        if (validationError != null) {
            return ParseResult.error(RpcResponse.error(id, RpcError.invalidRequest(validationError)));
        }
        return ParseResult.success(request);
    }

    /**
     * Send a success response, unless the request is a notification.
     */
    public boolean sendSuccess(RpcRequest request, JsonElement result) {
        if (request.isNotification()) {
            return true;
        }
        return encoder.write(RpcResponse.success(request.getId(), result));
    }

    /**
     * Send an error response. Errors are sent even for notifications.
     */
    public boolean sendError(JsonElement id, RpcError error) {
        return encoder.write(RpcResponse.error(id, error));
    }

    public boolean send(RpcResponse response) {
        return encoder.write(response);
    }

    public boolean sendLegacy(JsonObject response) {
        return encoder.writeLegacy(response);
    }

    private static boolean isString(JsonElement elem) {
        return elem != null && elem.isJsonPrimitive() && elem.getAsJsonPrimitive().isString();
    }

    private static boolean isValidId(JsonElement id) {
        if (id == null || id.isJsonNull()) {
            return true;
        }
        return id.isJsonPrimitive() && !id.getAsJsonPrimitive().isBoolean();
    }

    private static String stringMember(JsonObject obj, String name) {
        JsonElement elem = obj.get(name);
        return isString(elem) ? elem.getAsString() : null;
    }

    /**
     * Result of parsing a request.
     */
    public static class ParseResult {
        private final RpcRequest request;
        private final RpcResponse errorResponse;

        private ParseResult(RpcRequest request, RpcResponse errorResponse) {
            this.request = request;
            this.errorResponse = errorResponse;
        }

        public static ParseResult success(RpcRequest request) {
            return new ParseResult(request, null);
        }

        public static ParseResult error(RpcResponse errorResponse) {
            return new ParseResult(null, errorResponse);
        }

        public boolean isSuccess() {
            return request != null;
        }

        public RpcRequest getRequest() {
            return request;
        }

        public RpcResponse getErrorResponse() {
            return errorResponse;
        }
    }
}
