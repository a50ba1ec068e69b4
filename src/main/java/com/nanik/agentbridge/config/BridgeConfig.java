package com.nanik.agentbridge.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable bridge configuration, built once at startup by
 * {@link BridgeConfigLoader} and passed explicitly to the components that
 * need it.
 */
public class BridgeConfig {

    private final Path workspace;
    private final int maxParamLength;
    private final int maxPayloadLength;
    private final boolean collectMetrics;
    private final Duration killGrace;
    private final Map<String, String> environment;
    private final Map<String, AgentSettings> agents;
    private final String source;

    public BridgeConfig(Path workspace, int maxParamLength, int maxPayloadLength, boolean collectMetrics,
                        Duration killGrace, Map<String, String> environment,
                        Map<String, AgentSettings> agents, String source) {
        this.workspace = workspace;
        this.maxParamLength = maxParamLength;
        this.maxPayloadLength = maxPayloadLength;
        this.collectMetrics = collectMetrics;
        this.killGrace = killGrace;
        this.environment = Collections.unmodifiableMap(new LinkedHashMap<>(environment));
        this.agents = Collections.unmodifiableMap(new LinkedHashMap<>(agents));
        this.source = source;
    }

    /**
     * Workspace root; agents run with it as their working directory.
     */
    public Path getWorkspace() {
        return workspace;
    }

    /**
     * Maximum length of any single string argument.
     */
    public int getMaxParamLength() {
        return maxParamLength;
    }

    /**
     * Maximum length of the serialized argument mapping.
     */
    public int getMaxPayloadLength() {
        return maxPayloadLength;
    }

    public boolean isCollectMetrics() {
        return collectMetrics;
    }

    /**
     * Time a timed-out agent gets between graceful termination and force kill.
     */
    public Duration getKillGrace() {
        return killGrace;
    }

    /**
     * Variables overlaid on the inherited environment of every agent.
     */
    public Map<String, String> getEnvironment() {
        return environment;
    }

    /**
     * Configured agents in declaration order.
     */
    public Map<String, AgentSettings> getAgents() {
        return agents;
    }

    /**
     * Human readable origin of this configuration, for logging.
     */
    public String getSource() {
        return source;
    }

    @Override
    public String toString() {
        return "BridgeConfig{workspace=" + workspace + ", agents=" + agents.keySet() + ", source=" + source + "}";
    }
}
