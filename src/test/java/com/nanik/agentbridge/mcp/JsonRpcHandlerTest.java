package com.nanik.agentbridge.mcp;

import com.nanik.agentbridge.protocol.Framing;
import com.nanik.agentbridge.protocol.JsonDepth;
import com.nanik.agentbridge.protocol.RpcError;
import com.nanik.agentbridge.protocol.RpcRequest;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;

final class JsonRpcHandlerTest {

    private final JsonRpcHandler handler = new JsonRpcHandler(
            new ResponseEncoder(new StdioTransport(new ByteArrayInputStream(new byte[0]), new ByteArrayOutputStream())));

    @Test
    void parsesEnvelope() {
        JsonRpcHandler.ParseResult result = handler.parseRequest(
                "{\"jsonrpc\":\"2.0\",\"id\":3,\"method\":\"tools/call\",\"params\":{\"name\":\"watch_collect\"}}");

        Assertions.assertTrue(result.isSuccess());
        RpcRequest request = result.getRequest();
        Assertions.assertEquals(Framing.ENVELOPE, request.getFraming());
        Assertions.assertEquals("tools/call", request.getMethod());
        Assertions.assertEquals("watch_collect", request.getStringParam("name"));
        Assertions.assertFalse(request.isNotification());
    }

    @Test
    void parsesLegacyRecord() {
        RpcRequest request = handler.parseRequest("{\"tool\":\"watch_collect\",\"params\":{\"sources\":[]}}")
                .getRequest();

        Assertions.assertEquals(Framing.LEGACY, request.getFraming());
        Assertions.assertEquals("watch_collect", request.getTool());
        Assertions.assertTrue(request.hasObjectParams());
        Assertions.assertFalse(request.isNotification());
    }

    @Test
    void rejectsNonStringMethod() {
        JsonRpcHandler.ParseResult result = handler.parseRequest("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":7}");

        Assertions.assertFalse(result.isSuccess());
        Assertions.assertEquals(RpcError.INVALID_REQUEST, result.getErrorResponse().getError().getCode());
    }

    @Test
    void rejectsNonObjectRecords() {
        for (String line : new String[] {"42", "\"text\"", "null", "{\"a\":1} trailing", "{broken"}) {
            JsonRpcHandler.ParseResult result = handler.parseRequest(line);
            Assertions.assertFalse(result.isSuccess(), line);
            Assertions.assertEquals(RpcError.PARSE_ERROR, result.getErrorResponse().getError().getCode(), line);
            Assertions.assertNull(result.getErrorResponse().getId());
        }
    }

    @Test
    void rejectsStructuredIds() {
        for (String id : new String[] {"{\"a\":1}", "[1]", "false"}) {
            JsonRpcHandler.ParseResult result = handler.parseRequest(
                    "{\"jsonrpc\":\"2.0\",\"id\":" + id + ",\"method\":\"tools/list\"}");
            Assertions.assertFalse(result.isSuccess(), id);
            Assertions.assertEquals(RpcError.INVALID_REQUEST, result.getErrorResponse().getError().getCode(), id);
            Assertions.assertNull(result.getErrorResponse().getId(), id);
        }
        for (String id : new String[] {"7", "\"req-1\"", "null"}) {
            Assertions.assertTrue(handler.parseRequest(
                    "{\"jsonrpc\":\"2.0\",\"id\":" + id + ",\"method\":\"tools/list\"}").isSuccess(), id);
        }
    }

    @Test
    void rejectsRecordsNestedTooDeeply() {
        String nested = "[".repeat(JsonDepth.MAX_RECORD_DEPTH) + "]".repeat(JsonDepth.MAX_RECORD_DEPTH);

        JsonRpcHandler.ParseResult result = handler.parseRequest("{\"tool\":\"x\",\"params\":" + nested + "}");

        Assertions.assertFalse(result.isSuccess());
        Assertions.assertEquals(RpcError.INVALID_REQUEST, result.getErrorResponse().getError().getCode());
    }
}
