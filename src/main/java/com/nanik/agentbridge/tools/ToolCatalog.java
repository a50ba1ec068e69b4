package com.nanik.agentbridge.tools;

import com.google.gson.JsonObject;
import com.nanik.agentbridge.config.AgentSettings;
import com.nanik.agentbridge.config.BridgeConfig;
import com.nanik.agentbridge.execution.AgentConfig;
import com.nanik.agentbridge.validation.ParameterValidator;
import com.nanik.agentbridge.validation.ValidationRule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Builds the tool descriptors for the configured agents.
 *
 * The four ADK agents have a known argument shape; any other configured agent
 * is published with an open schema and only the canonical field rules.
 */
public final class ToolCatalog {

    public static final String LABEL_GITHUB_ISSUE = "label_github_issue";
    public static final String WATCH_COLLECT = "watch_collect";
    public static final String ANALYSE_WATCH_REPORT = "analyse_watch_report";
    public static final String CURATE_DIGEST = "curate_digest";

    private ToolCatalog() {
    }

    /**
     * One descriptor per configured agent, in configuration order.
     */
    public static List<ToolDescriptor> fromConfig(BridgeConfig config) {
        List<ToolDescriptor> descriptors = new ArrayList<>();
        for (AgentSettings agent : config.getAgents().values()) {
            descriptors.add(describe(agent.getName(), agent.getDescription(), agent.getAgentConfig()));
        }
        return descriptors;
    }

    /**
     * Descriptor for a single agent.
     */
    public static ToolDescriptor describe(String name, String description, AgentConfig agent) {
        JsonObject defaults = agent.getDefaults();
        switch (name) {
            case LABEL_GITHUB_ISSUE:
                return new ToolDescriptor(name, description,
                    new SchemaBuilder()
                        .addPatternString("repo_name", "Repository in owner/repo form", true,
                            ValidationRule.REPO_NAME_PATTERN.pattern(), ValidationRule.REPO_NAME_MAX_LENGTH)
                        .addInteger("issue_number", "Issue number to label", true,
                            ValidationRule.ISSUE_NUMBER_MIN, ValidationRule.ISSUE_NUMBER_MAX)
                        .addBoolean("dry_run", "Compute labels without applying them",
                            !defaults.has("dry_run") || defaults.get("dry_run").getAsBoolean())
                        .build(),
                    List.of(
                        ValidationRule.required("repo_name", "issue_number"),
                        ValidationRule.repoName("repo_name"),
                        ValidationRule.issueNumber("issue_number")),
                    agent);
            case WATCH_COLLECT:
                return new ToolDescriptor(name, description,
                    new SchemaBuilder()
                        .addEnumArray("sources", "Sources to collect from; empty means the configured default",
                            defaults.get("sources"), ParameterValidator.ALLOWED_SOURCES)
                        .addString("output_format", "Report format (markdown, json)", false)
                        .build(),
                    List.of(ValidationRule.enumArray("sources", ParameterValidator.ALLOWED_SOURCES)),
                    agent);
            case ANALYSE_WATCH_REPORT:
                return new ToolDescriptor(name, description,
                    new SchemaBuilder()
                        .addString("report", "Report content to analyse", false)
                        .addString("report_path", "Path of a report file inside the workspace", false)
                        .addString("format", "Output format", false)
                        .build(),
                    List.of(ValidationRule.requireAny("report", "report_path")),
                    agent);
            case CURATE_DIGEST:
                return new ToolDescriptor(name, description,
                    new SchemaBuilder()
                        .addString("format", "Digest format (newsletter, summary)", false)
                        .addString("output", "Output encoding (markdown, html)", false)
                        .build(),
                    Collections.emptyList(),
                    agent);
            default:
                return new ToolDescriptor(name, description, SchemaBuilder.openObject(),
                    Collections.emptyList(), agent);
        }
    }
}
