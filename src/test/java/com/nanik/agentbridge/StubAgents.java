package com.nanik.agentbridge;

import com.google.gson.JsonObject;
import com.nanik.agentbridge.execution.AgentConfig;
import com.nanik.agentbridge.tools.ToolCatalog;
import com.nanik.agentbridge.tools.ToolDescriptor;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Shell scripts standing in for ADK agents in tests.
 */
public final class StubAgents {

    public static final String SHELL = "/bin/sh";

    /** Echoes its stdin document back. */
    public static final String ECHO = "cat";
    public static final String SLEEP = "exec sleep 30";
    public static final String IGNORE_TERM = "trap '' TERM\nsleep 30";
    public static final String NOT_JSON = "cat > /dev/null\necho 'this is not json'";
    public static final String EMPTY_OUTPUT = "cat > /dev/null\nexit 0";
    public static final String TWO_DOCUMENTS = "cat > /dev/null\necho '{\"a\":1} {\"b\":2}'";
    public static final String FAIL_WITH_STDERR = "cat > /dev/null\necho 'boom' >&2\nexit 3";
    public static final String FAIL_SILENTLY = "cat > /dev/null\nexit 4";
    public static final String IGNORE_STDIN = "echo '{\"ok\":true}'";
    public static final String COUNT_ARGS = "cat > /dev/null\nprintf '{\"argc\":%d}' $#";

    private StubAgents() {
    }

    public static Path script(Path dir, String name, String body) throws IOException {
        Path script = dir.resolve(name + ".sh");
        Files.writeString(script, "#!/bin/sh\n" + body + "\n", StandardCharsets.UTF_8);
        return script;
    }

    public static AgentConfig agent(Path dir, Path script, Duration timeout) {
        return agent(dir, script, timeout, new JsonObject());
    }

    public static AgentConfig agent(Path dir, Path script, Duration timeout, JsonObject defaults) {
        return AgentConfig.builder()
                .interpreter(SHELL)
                .script(script)
                .workingDirectory(dir)
                .timeout(timeout)
                .defaults(defaults)
                .build();
    }

    public static ToolDescriptor tool(Path dir, String name, String body) throws IOException {
        return tool(dir, name, body, Duration.ofSeconds(10), new JsonObject());
    }

    public static ToolDescriptor tool(Path dir, String name, String body, Duration timeout, JsonObject defaults)
            throws IOException {
        Path script = script(dir, name, body);
        return ToolCatalog.describe(name, "Stub " + name, agent(dir, script, timeout, defaults));
    }
}
