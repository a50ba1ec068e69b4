package com.nanik.agentbridge.execution;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.MalformedJsonException;
import com.nanik.agentbridge.config.BridgeConfig;
import com.nanik.agentbridge.tools.ToolDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs one agent process per invocation.
 *
 * The validated arguments go to the agent as a single JSON document on stdin,
 * which is closed right after. The agent's stdout must hold exactly one JSON
 * document; stderr is only logged and used for failure diagnostics. A
 * wall-clock timeout covers the whole cycle from spawn to exit, after which
 * the process tree is terminated and, if it lingers past the grace window,
 * force killed.
 */
public class AgentExecutor {

    private static final Logger log = LoggerFactory.getLogger(AgentExecutor.class);

    public static final int MAX_DIAGNOSTIC_CHARS = 2000;
    public static final Duration DEFAULT_KILL_GRACE = Duration.ofSeconds(5);

    private static final Duration OUTPUT_DRAIN_TIMEOUT = Duration.ofSeconds(2);

    private final Map<String, String> environment;
    private final Duration killGrace;
    private final Gson gson;

    public AgentExecutor(BridgeConfig config) {
        this(config.getEnvironment(), config.getKillGrace());
    }

    public AgentExecutor(Map<String, String> environment, Duration killGrace) {
        this.environment = Collections.unmodifiableMap(new LinkedHashMap<>(environment));
        this.killGrace = killGrace != null ? killGrace : DEFAULT_KILL_GRACE;
        this.gson = new GsonBuilder().disableHtmlEscaping().create();
    }

    /**
     * Execute a validated request.
     *
     * @param request request whose validated arguments are set
     * @param tool descriptor of the tool being invoked
     * @return the result; never null and never thrown
     */
    public ExecutionResult run(ExecutionRequest request, ToolDescriptor tool) {
        long start = System.nanoTime();
        AgentConfig agent = tool.getAgentConfig();
        JsonObject arguments = request.getValidatedArguments() != null
            ? request.getValidatedArguments()
            : new JsonObject();

        String problem = preflight(agent);
        if (problem != null) {
            log.error("Agent {} cannot start: {}", tool.getName(), problem);
            return ExecutionResult.agentFailure(problem, elapsedMillis(start), null);
        }

        List<String> command = buildCommand(agent, arguments);
        log.info("Executing agent {}: {}", tool.getName(), String.join(" ", command));

        ProcessBuilder builder = new ProcessBuilder(command);
        if (agent.getWorkingDirectory() != null) {
            builder.directory(agent.getWorkingDirectory().toFile());
        }
        builder.environment().putAll(environment);

        AgentProcess process;
        try {
            process = AgentProcess.start(builder, tool.getName());
        } catch (IOException e) {
            log.error("Failed to start agent {}", tool.getName(), e);
            return ExecutionResult.agentFailure("Failed to start agent: " + e.getMessage(),
                elapsedMillis(start), null);
        }

        try {
            return supervise(process, tool.getName(), agent, arguments, start);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.kill();
            log.warn("Bridge interrupted while running agent {}", tool.getName());
            return ExecutionResult.agentFailure("Agent execution interrupted", elapsedMillis(start), null);
        }
    }

    /**
     * Command line for an agent: interpreter, script, then the projected
     * argument flags. Booleans become bare flags when true, arrays are joined
     * with commas, objects are not projected.
     */
    public static List<String> buildCommand(AgentConfig agent, JsonObject arguments) {
        List<String> command = new ArrayList<>();
        command.add(agent.getInterpreter());
        command.add(agent.getScript().toString());

        for (Map.Entry<String, String> flag : agent.getCliArguments().entrySet()) {
            JsonElement value = arguments.get(flag.getKey());
            if (value == null || value.isJsonNull() || value.isJsonObject()) {
                continue;
            }
            if (value.isJsonPrimitive() && value.getAsJsonPrimitive().isBoolean()) {
                if (value.getAsBoolean()) {
                    command.add(flag.getValue());
                }
                continue;
            }
            command.add(flag.getValue());
            command.add(value.isJsonArray() ? joinArray(value.getAsJsonArray()) : value.getAsString());
        }
        return command;
    }

    /**
     * Parse text that must contain exactly one well-formed JSON document.
     */
    static JsonElement parseDocument(Gson gson, String text) throws IOException {
        JsonReader reader = new JsonReader(new StringReader(text));
        reader.setLenient(false);
        JsonElement element = gson.getAdapter(JsonElement.class).read(reader);
        if (reader.peek() != JsonToken.END_DOCUMENT) {
            throw new MalformedJsonException("Trailing content after JSON document");
        }
        return element;
    }

    private ExecutionResult supervise(AgentProcess process, String toolName, AgentConfig agent,
                                      JsonObject arguments, long start) throws InterruptedException {
        long deadline = start + agent.getTimeout().toNanos();

        process.sendInput(gson.toJson(arguments).getBytes(StandardCharsets.UTF_8));
        if (!process.awaitInput(remaining(deadline))) {
            log.warn("Agent {} did not read its input before the deadline", toolName);
            return timedOut(process, toolName, agent, start);
        }
        if (!process.isInputDelivered()) {
            log.debug("Agent {} closed stdin early", toolName);
        }

        if (!process.awaitExit(remaining(deadline))) {
            return timedOut(process, toolName, agent, start);
        }

        if (!process.awaitOutput(OUTPUT_DRAIN_TIMEOUT)) {
            log.warn("Agent {} exited but its output is still open; using what was collected", toolName);
        }
        long duration = elapsedMillis(start);
        int exitCode = process.exitCode();
        String stderr = process.stderr();
        logDiagnostics(toolName, stderr);

        if (exitCode != 0) {
            String diagnostics = stderr.isBlank()
                ? "Process failed with code " + exitCode
                : truncate(stderr.strip(), MAX_DIAGNOSTIC_CHARS);
            log.error("Agent {} failed with exit code {}", toolName, exitCode);
            return ExecutionResult.agentFailure(diagnostics, duration, exitCode);
        }

        if (process.isStdoutTruncated()) {
            log.warn("Agent {} output exceeded {} bytes", toolName, AgentProcess.MAX_STDOUT_BYTES);
            return ExecutionResult.malformedOutput("Agent output exceeded " + AgentProcess.MAX_STDOUT_BYTES
                + " bytes", duration, exitCode);
        }

        try {
            JsonElement payload = parseDocument(gson, process.stdout());
            log.info("Agent {} completed successfully in {} ms", toolName, duration);
            return ExecutionResult.success(payload, duration, exitCode);
        } catch (IOException | JsonParseException | IllegalStateException e) {
            log.warn("Agent {} returned invalid JSON: {}", toolName, e.getMessage());
            return ExecutionResult.malformedOutput("Agent returned invalid JSON: " + e.getMessage(),
                duration, exitCode);
        }
    }

    private ExecutionResult timedOut(AgentProcess process, String toolName, AgentConfig agent, long start)
            throws InterruptedException {
        process.terminate(killGrace);
        process.awaitOutput(OUTPUT_DRAIN_TIMEOUT);
        logDiagnostics(toolName, process.stderr());
        String message = "Agent execution timed out after " + describe(agent.getTimeout());
        log.error("Agent {} timed out (pid {}, final state {})", toolName, process.pid(), process.getState());
        return ExecutionResult.timeout(message, elapsedMillis(start), process.getState());
    }

    private static Duration remaining(long deadlineNanos) {
        return Duration.ofNanos(Math.max(0, deadlineNanos - System.nanoTime()));
    }

    /**
     * @return null when the agent can be launched, the reason otherwise
     */
    private static String preflight(AgentConfig agent) {
        if (!Files.isRegularFile(agent.getScript())) {
            return "Agent script not found: " + agent.getScript();
        }
        String interpreter = agent.getInterpreter();
        if (interpreter.contains("/")) {
            Path path = Paths.get(interpreter);
            if (!Files.isExecutable(path)) {
                return "Interpreter not found: " + path;
            }
        }
        return null;
    }

    private static void logDiagnostics(String toolName, String stderr) {
        if (!stderr.isBlank()) {
            log.debug("Agent {} stderr:\n{}", toolName, stderr.strip());
        }
    }

    private static String joinArray(JsonArray array) {
        List<String> parts = new ArrayList<>();
        for (JsonElement member : array) {
            if (member.isJsonPrimitive()) {
                parts.add(member.getAsString());
            }
        }
        return String.join(",", parts);
    }

    static String truncate(String text, int maxChars) {
        if (text.length() <= maxChars) {
            return text;
        }
        return text.substring(0, maxChars) + "...";
    }

    private static String describe(Duration timeout) {
        long millis = timeout.toMillis();
        return millis % 1000 == 0 ? (millis / 1000) + "s" : millis + "ms";
    }

    private static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }
}
