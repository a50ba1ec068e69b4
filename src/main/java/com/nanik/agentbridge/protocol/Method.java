package com.nanik.agentbridge.protocol;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Methods the bridge understands, resolved from their wire names through a
 * fixed lookup table.
 */
public enum Method {
    INITIALIZE("initialize"),
    INITIALIZED("notifications/initialized", "initialized"),
    TOOLS_LIST("tools/list"),
    TOOLS_CALL("tools/call"),
    HEALTH_CHECK("health_check");

    private static final Map<String, Method> BY_WIRE_NAME;

    static {
        Map<String, Method> table = new HashMap<>();
        for (Method method : values()) {
            for (String name : method.wireNames) {
                table.put(name, method);
            }
        }
        BY_WIRE_NAME = Collections.unmodifiableMap(table);
    }

    private final String[] wireNames;

    Method(String... wireNames) {
        this.wireNames = wireNames;
    }

    /**
     * @return the method, or null if the name is unknown
     */
    public static Method fromWireName(String name) {
        return name != null ? BY_WIRE_NAME.get(name) : null;
    }

    public String getWireName() {
        return wireNames[0];
    }
}
