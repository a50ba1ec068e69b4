package com.nanik.agentbridge.config;

import com.nanik.agentbridge.execution.AgentConfig;

/**
 * A configured agent: its published name and description plus launch settings.
 */
public class AgentSettings {

    private final String name;
    private final String description;
    private final AgentConfig agentConfig;

    public AgentSettings(String name, String description, AgentConfig agentConfig) {
        this.name = name;
        this.description = description;
        this.agentConfig = agentConfig;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public AgentConfig getAgentConfig() {
        return agentConfig;
    }
}
