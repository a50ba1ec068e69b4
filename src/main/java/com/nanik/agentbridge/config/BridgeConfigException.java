package com.nanik.agentbridge.config;

/**
 * Raised when the bridge configuration cannot be read or is inconsistent.
 */
public class BridgeConfigException extends Exception {

    public BridgeConfigException(String message) {
        super(message);
    }

    public BridgeConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
