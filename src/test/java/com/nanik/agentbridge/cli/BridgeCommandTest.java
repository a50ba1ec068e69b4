package com.nanik.agentbridge.cli;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.nanik.agentbridge.StubAgents;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

final class BridgeCommandTest {

    @TempDir
    Path workspace;

    private Path configFile;
    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();
    private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();

    @BeforeEach
    void setUp() throws Exception {
        StubAgents.script(workspace, "echo", StubAgents.ECHO);
        StubAgents.script(workspace, "fail", StubAgents.FAIL_WITH_STDERR);
        configFile = workspace.resolve("bridge.json");
        Files.writeString(configFile, "{\"agents\":{"
                + "\"watch_collect\":{\"path\":\"echo.sh\",\"python\":\"/bin/sh\"},"
                + "\"curate_digest\":{\"path\":\"fail.sh\",\"python\":\"/bin/sh\"}"
                + "}}", StandardCharsets.UTF_8);
    }

    @Test
    void runsOneToolAndPrintsTheResult() {
        int code = execute("", "watch_collect", "{\"sources\":[\"npm\"]}",
                "--config", configFile.toString(), "--workspace", workspace.toString());

        Assertions.assertEquals(0, code, err.toString());
        JsonObject response = printed();
        Assertions.assertEquals("success", response.get("status").getAsString());
        JsonObject result = response.getAsJsonObject("result");
        Assertions.assertEquals("npm", result.getAsJsonArray("sources").get(0).getAsString());
        Assertions.assertEquals("markdown", result.get("output_format").getAsString());
        Assertions.assertEquals(0, stdout.size());
    }

    @Test
    void argumentsDefaultToAnEmptyObject() {
        int code = execute("", "watch_collect", "--config", configFile.toString(), "--workspace", workspace.toString());

        Assertions.assertEquals(0, code);
        Assertions.assertEquals(3, printed().getAsJsonObject("result").getAsJsonArray("sources").size());
    }

    @Test
    void exitsWithOneWhenTheAgentFails() {
        int code = execute("", "curate_digest", "{}",
                "--config", configFile.toString(), "--workspace", workspace.toString());

        Assertions.assertEquals(1, code);
        Assertions.assertEquals("error", printed().get("status").getAsString());
        Assertions.assertEquals("boom", printed().get("error").getAsString());
    }

    @Test
    void exitsWithOneOnInvalidJsonArguments() {
        int code = execute("", "watch_collect", "{not json",
                "--config", configFile.toString(), "--workspace", workspace.toString());

        Assertions.assertEquals(1, code);
        Assertions.assertTrue(printed().get("error").getAsString().startsWith("Invalid JSON parameters"));
    }

    @Test
    void exitsWithOneOnNonObjectArguments() {
        int code = execute("", "watch_collect", "[1]",
                "--config", configFile.toString(), "--workspace", workspace.toString());

        Assertions.assertEquals(1, code);
    }

    @Test
    void exitsWithOneForUnknownTool() {
        int code = execute("", "nope", "{}", "--config", configFile.toString(), "--workspace", workspace.toString());

        Assertions.assertEquals(1, code);
        Assertions.assertTrue(printed().get("error").getAsString().startsWith("Unknown tool 'nope'"));
    }

    @Test
    void exitsWithTwoWhenConfigurationIsUnreadable() {
        int code = execute("", "watch_collect", "--config", workspace.resolve("missing.json").toString());

        Assertions.assertEquals(2, code);
        Assertions.assertTrue(err.toString().contains("Configuration error"));
    }

    @Test
    void servesStdioWithoutToolName() {
        String input = "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"initialize\"}\n"
                + "{\"tool\":\"watch_collect\",\"params\":{}}\n";

        int code = execute(input, "--config", configFile.toString(), "--workspace", workspace.toString());

        Assertions.assertEquals(0, code);
        String[] lines = stdout.toString(StandardCharsets.UTF_8).split("\n");
        Assertions.assertEquals(2, lines.length);
        Assertions.assertEquals("2024-11-05", JsonParser.parseString(lines[0]).getAsJsonObject()
                .getAsJsonObject("result").get("protocolVersion").getAsString());
        Assertions.assertEquals("success", JsonParser.parseString(lines[1]).getAsJsonObject()
                .get("status").getAsString());
        Assertions.assertEquals("", out.toString());
    }

    private int execute(String input, String... args) {
        BridgeCommand command = new BridgeCommand(
                new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)), stdout, Map.of());
        CommandLine cli = new CommandLine(command);
        cli.setOut(new PrintWriter(out, true));
        cli.setErr(new PrintWriter(err, true));
        return cli.execute(args);
    }

    private JsonObject printed() {
        return JsonParser.parseString(out.toString()).getAsJsonObject();
    }
}
