package com.nanik.agentbridge.protocol;

/**
 * Wire shape of an inbound record and of the answer it receives.
 */
public enum Framing {
    /** JSON-RPC 2.0 envelope: {"jsonrpc", "id", "method", "params"}. */
    ENVELOPE,
    /** Bare {"tool", "params"} record answered with {"status", "result"|"error"}. */
    LEGACY
}
