package com.nanik.agentbridge.protocol;

import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class RpcRequestTest {

    @Test
    void versionIsOptionalButMustBeExact() {
        Assertions.assertNull(RpcRequest.envelope(null, new JsonPrimitive(1), "tools/list", null).validate());
        Assertions.assertNull(RpcRequest.envelope("2.0", new JsonPrimitive(1), "tools/list", null).validate());
        Assertions.assertNotNull(RpcRequest.envelope("2", new JsonPrimitive(1), "tools/list", null).validate());
    }

    @Test
    void paramsMustBeAnObjectWhenPresent() {
        Assertions.assertNull(RpcRequest.envelope("2.0", null, "x", JsonNull.INSTANCE).validate());
        Assertions.assertEquals("params must be an object",
                RpcRequest.envelope("2.0", null, "x", new JsonPrimitive("p")).validate());
        Assertions.assertEquals("method is required", RpcRequest.envelope("2.0", null, "", null).validate());
    }

    @Test
    void missingOrNullIdMeansNotification() {
        Assertions.assertTrue(RpcRequest.envelope("2.0", null, "x", null).isNotification());
        Assertions.assertTrue(RpcRequest.envelope("2.0", JsonNull.INSTANCE, "x", null).isNotification());
        Assertions.assertFalse(RpcRequest.envelope("2.0", new JsonPrimitive("a"), "x", null).isNotification());
        Assertions.assertFalse(RpcRequest.legacy("watch_collect", null).isNotification());
    }

    @Test
    void resolvesMethodsByWireName() {
        Assertions.assertEquals(Method.INITIALIZED, Method.fromWireName("notifications/initialized"));
        Assertions.assertEquals(Method.INITIALIZED, Method.fromWireName("initialized"));
        Assertions.assertEquals(Method.TOOLS_CALL, Method.fromWireName("tools/call"));
        Assertions.assertNull(Method.fromWireName("shutdown"));
        Assertions.assertNull(Method.fromWireName(null));
    }

    @Test
    void errorResponseWritesNullId() {
        JsonObject json = RpcResponse.error(null, RpcError.parseError("bad")).toJson();

        Assertions.assertEquals("2.0", json.get("jsonrpc").getAsString());
        Assertions.assertTrue(json.get("id").isJsonNull());
        Assertions.assertEquals(RpcError.PARSE_ERROR, json.getAsJsonObject("error").get("code").getAsInt());
        Assertions.assertFalse(json.has("result"));
    }
}
