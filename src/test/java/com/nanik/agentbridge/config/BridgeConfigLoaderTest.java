package com.nanik.agentbridge.config;

import com.nanik.agentbridge.execution.AgentConfig;
import com.nanik.agentbridge.tools.ToolCatalog;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.Map;

final class BridgeConfigLoaderTest {

    @TempDir
    Path dir;

    @Test
    void defaultsDescribeTheFourAgents() throws Exception {
        BridgeConfig config = BridgeConfigLoader.loadDefaults();

        Assertions.assertEquals(List.of(ToolCatalog.LABEL_GITHUB_ISSUE, ToolCatalog.WATCH_COLLECT,
                ToolCatalog.ANALYSE_WATCH_REPORT, ToolCatalog.CURATE_DIGEST), List.copyOf(config.getAgents().keySet()));

        Path home = Paths.get(System.getProperty("user.home"));
        Assertions.assertEquals(home.resolve("adk-workspace").toAbsolutePath().normalize(), config.getWorkspace());
        Assertions.assertEquals(10_000, config.getMaxParamLength());
        Assertions.assertEquals(10_000, config.getMaxPayloadLength());
        Assertions.assertTrue(config.isCollectMetrics());
        Assertions.assertEquals(Duration.ofSeconds(5), config.getKillGrace());
        Assertions.assertEquals(config.getWorkspace().toString(), config.getEnvironment().get("PYTHONPATH"));
        Assertions.assertEquals("defaults", config.getSource());
    }

    @Test
    void defaultAgentSettingsMatchTheAdkLayout() throws Exception {
        BridgeConfig config = BridgeConfigLoader.loadDefaults();
        Path workspace = config.getWorkspace();

        AgentConfig watcher = config.getAgents().get(ToolCatalog.WATCH_COLLECT).getAgentConfig();
        Assertions.assertEquals(workspace.resolve("veille_agent/.venv/bin/python").toString(), watcher.getInterpreter());
        Assertions.assertEquals(workspace.resolve("veille_agent/main.py"), watcher.getScript());
        Assertions.assertEquals(workspace, watcher.getWorkingDirectory());
        Assertions.assertEquals(Duration.ofSeconds(600), watcher.getTimeout());
        Assertions.assertEquals(3, watcher.getDefaults().getAsJsonArray("sources").size());

        AgentConfig labeler = config.getAgents().get(ToolCatalog.LABEL_GITHUB_ISSUE).getAgentConfig();
        Assertions.assertEquals(workspace.resolve("adk-env/bin/python").toString(), labeler.getInterpreter());
        Assertions.assertTrue(labeler.getDefaults().get("dry_run").getAsBoolean());
        Assertions.assertEquals("--issue", labeler.getCliArguments().get("issue_number"));

        Assertions.assertEquals(Duration.ofSeconds(180),
                config.getAgents().get(ToolCatalog.CURATE_DIGEST).getAgentConfig().getTimeout());
    }

    @Test
    void environmentWorkspaceOverridesDefaults() throws Exception {
        BridgeConfig config = BridgeConfigLoader.load(null, Map.of(BridgeConfigLoader.ENV_WORKSPACE, dir.toString()), null);

        Assertions.assertEquals(dir.toAbsolutePath().normalize(), config.getWorkspace());
        Assertions.assertEquals(dir.resolve("github_labeler/main.py").normalize(),
                config.getAgents().get(ToolCatalog.LABEL_GITHUB_ISSUE).getAgentConfig().getScript());
    }

    @Test
    void explicitWorkspaceBeatsEnvironment() throws Exception {
        Path other = Files.createDirectory(dir.resolve("other"));

        BridgeConfig config = BridgeConfigLoader.load(null,
                Map.of(BridgeConfigLoader.ENV_WORKSPACE, dir.toString()), other);

        Assertions.assertEquals(other.toAbsolutePath().normalize(), config.getWorkspace());
        Assertions.assertEquals(other.toString(), config.getEnvironment().get("PYTHONPATH"));
    }

    @Test
    void configFileMergesOverDefaults() throws Exception {
        Path file = write("bridge.json", "{"
                + "\"workspace\":{\"path\":\"" + dir + "\"},"
                + "\"security\":{\"maxParamLength\":500},"
                + "\"performance\":{\"collectMetrics\":false},"
                + "\"execution\":{\"killGraceSeconds\":0.5},"
                + "\"environment\":{\"GITHUB_TOKEN\":\"t0k\"},"
                + "\"agents\":{"
                + "  \"curate_digest\":{\"timeout\":30},"
                + "  \"summarise\":{\"path\":\"summariser/run.py\",\"python\":\"python3\",\"description\":\"Summariser\"}"
                + "}}");

        BridgeConfig config = BridgeConfigLoader.load(file, Map.of(), null);

        Assertions.assertEquals(500, config.getMaxParamLength());
        Assertions.assertEquals(10_000, config.getMaxPayloadLength());
        Assertions.assertFalse(config.isCollectMetrics());
        Assertions.assertEquals(Duration.ofMillis(500), config.getKillGrace());
        Assertions.assertEquals("t0k", config.getEnvironment().get("GITHUB_TOKEN"));
        Assertions.assertEquals(dir.toString(), config.getEnvironment().get("PYTHONPATH"));
        Assertions.assertEquals(file.toString(), config.getSource());

        AgentConfig curator = config.getAgents().get(ToolCatalog.CURATE_DIGEST).getAgentConfig();
        Assertions.assertEquals(Duration.ofSeconds(30), curator.getTimeout());
        Assertions.assertEquals("newsletter", curator.getDefaults().get("format").getAsString());

        AgentSettings summariser = config.getAgents().get("summarise");
        Assertions.assertEquals("Summariser", summariser.getDescription());
        Assertions.assertEquals("python3", summariser.getAgentConfig().getInterpreter());
        Assertions.assertEquals(AgentConfig.DEFAULT_TIMEOUT, summariser.getAgentConfig().getTimeout());
        Assertions.assertEquals(5, config.getAgents().size());
    }

    @Test
    void agentCanOverrideCommandLineFlags() throws Exception {
        Path file = write("flags.json",
                "{\"agents\":{\"label_github_issue\":{\"cliArguments\":{\"issue_number\":\"--number\"}}}}");

        AgentConfig labeler = BridgeConfigLoader.load(file, Map.of(), dir).getAgents()
                .get(ToolCatalog.LABEL_GITHUB_ISSUE).getAgentConfig();

        Assertions.assertEquals(Map.of("issue_number", "--number"), labeler.getCliArguments());
    }

    @Test
    void rejectsNonStringFlags() throws Exception {
        Path file = write("flags.json",
                "{\"agents\":{\"label_github_issue\":{\"cliArguments\":{\"issue_number\":[\"--n\"]}}}}");

        BridgeConfigException e = Assertions.assertThrows(BridgeConfigException.class,
                () -> BridgeConfigLoader.load(file, Map.of(), dir));
        Assertions.assertTrue(e.getMessage().contains("cliArguments.issue_number"));
    }

    @Test
    void rejectsMissingFile() {
        Assertions.assertThrows(BridgeConfigException.class,
                () -> BridgeConfigLoader.load(dir.resolve("absent.json"), Map.of(), null));
    }

    @Test
    void rejectsMalformedFile() throws Exception {
        Path file = write("broken.json", "{\"security\": ");

        Assertions.assertThrows(BridgeConfigException.class, () -> BridgeConfigLoader.load(file, Map.of(), null));
    }

    @Test
    void rejectsInvalidValues() throws Exception {
        Path negative = write("negative.json", "{\"security\":{\"maxPayloadLength\":-1}}");
        Path agentWithoutPath = write("nopath.json", "{\"agents\":{\"x\":{\"description\":\"no path\"}}}");
        Path array = write("array.json", "[1,2]");

        Assertions.assertThrows(BridgeConfigException.class, () -> BridgeConfigLoader.load(negative, Map.of(), null));
        Assertions.assertThrows(BridgeConfigException.class,
                () -> BridgeConfigLoader.load(agentWithoutPath, Map.of(), null));
        Assertions.assertThrows(BridgeConfigException.class, () -> BridgeConfigLoader.load(array, Map.of(), null));
    }

    @Test
    void rejectsTimeoutsBeyondOneDay() throws Exception {
        Path huge = write("huge.json", "{\"agents\":{\"curate_digest\":{\"timeout\":1e300}}}");
        Path oneDay = write("day.json", "{\"agents\":{\"curate_digest\":{\"timeout\":86400}}}");

        BridgeConfigException e = Assertions.assertThrows(BridgeConfigException.class,
                () -> BridgeConfigLoader.load(huge, Map.of(), dir));
        Assertions.assertTrue(e.getMessage().contains("agents.curate_digest.timeout"));
        Assertions.assertEquals(Duration.ofDays(1), BridgeConfigLoader.load(oneDay, Map.of(), dir)
                .getAgents().get(ToolCatalog.CURATE_DIGEST).getAgentConfig().getTimeout());
    }

    @Test
    void resolvesInterpreters() {
        Path workspace = Paths.get("/srv/adk");

        Assertions.assertEquals("/usr/bin/python3", BridgeConfigLoader.resolveInterpreter(workspace, "/usr/bin/python3"));
        Assertions.assertEquals("/srv/adk/env/bin/python", BridgeConfigLoader.resolveInterpreter(workspace, "env/bin/python"));
        Assertions.assertEquals("python3", BridgeConfigLoader.resolveInterpreter(workspace, "python3"));
    }

    private Path write(String name, String content) throws Exception {
        Path file = dir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }
}
