package com.nanik.agentbridge.tools;

import com.google.gson.JsonObject;
import com.nanik.agentbridge.execution.AgentConfig;
import com.nanik.agentbridge.validation.ValidationRule;

import java.util.List;
import java.util.Objects;

/**
 * Static description of one callable agent.
 *
 * The name, description and input schema are what {@code tools/list}
 * publishes:
 * {
 *   "name": "label_github_issue",
 *   "description": "GitHub Issue Labeler Agent",
 *   "inputSchema": {
 *     "type": "object",
 *     "properties": {
 *       "repo_name": {"type": "string", "description": "..."},
 *       ...
 *     },
 *     "required": ["repo_name", "issue_number"]
 *   }
 * }
 * The validation rules and agent configuration stay on the bridge side.
 */
public class ToolDescriptor {

    private final String name;
    private final String description;
    private final JsonObject inputSchema;
    private final List<ValidationRule> rules;
    private final AgentConfig agentConfig;

    public ToolDescriptor(String name, String description, JsonObject inputSchema,
                          List<ValidationRule> rules, AgentConfig agentConfig) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("tool name cannot be empty");
        }
        this.name = name;
        this.description = description != null ? description : name;
        this.inputSchema = Objects.requireNonNull(inputSchema, "inputSchema").deepCopy();
        this.rules = List.copyOf(rules);
        this.agentConfig = Objects.requireNonNull(agentConfig, "agentConfig");
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Copy of the JSON Schema describing the tool's arguments.
     */
    public JsonObject getInputSchema() {
        return inputSchema.deepCopy();
    }

    public List<ValidationRule> getRules() {
        return rules;
    }

    public AgentConfig getAgentConfig() {
        return agentConfig;
    }

    @Override
    public String toString() {
        return "ToolDescriptor{name='" + name + "', agent=" + agentConfig + "}";
    }
}
