package com.nanik.agentbridge.config;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.nanik.agentbridge.execution.AgentConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds a {@link BridgeConfig} from the bundled defaults, an optional JSON
 * file and environment overrides.
 *
 * Later sources win: defaults, then the file (merged key by key), then
 * {@code ADK_WORKSPACE}, then an explicit workspace override.
 */
public final class BridgeConfigLoader {

    public static final String DEFAULTS_RESOURCE = "/agent-bridge-defaults.json";
    public static final String ENV_WORKSPACE = "ADK_WORKSPACE";

    private static final Logger log = LoggerFactory.getLogger(BridgeConfigLoader.class);

    private BridgeConfigLoader() {
    }

    /**
     * Bundled defaults only.
     */
    public static BridgeConfig loadDefaults() throws BridgeConfigException {
        return load(null, Map.of(), null);
    }

    /**
     * Load the configuration.
     *
     * @param configFile optional JSON file merged over the defaults
     * @param env process environment used for overrides
     * @param workspaceOverride optional workspace path taking precedence over everything else
     */
    public static BridgeConfig load(Path configFile, Map<String, String> env, Path workspaceOverride)
            throws BridgeConfigException {
        JsonObject root = readDefaults();
        String source = "defaults";

        if (configFile != null) {
            merge(root, readFile(configFile));
            source = configFile.toString();
        }

        JsonObject workspace = section(root, "workspace");
        String envWorkspace = env.get(ENV_WORKSPACE);
        if (envWorkspace != null && !envWorkspace.isBlank()) {
            workspace.addProperty("path", envWorkspace);
        }
        if (workspaceOverride != null) {
            workspace.addProperty("path", workspaceOverride.toString());
        }
        return materialize(root, source);
    }

    /**
     * Recursively merge {@code override} into {@code base}; objects merge by key,
     * everything else replaces.
     */
    static void merge(JsonObject base, JsonObject override) {
        for (Map.Entry<String, JsonElement> entry : override.entrySet()) {
            JsonElement current = base.get(entry.getKey());
            if (current != null && current.isJsonObject() && entry.getValue().isJsonObject()) {
                merge(current.getAsJsonObject(), entry.getValue().getAsJsonObject());
            } else {
                base.add(entry.getKey(), entry.getValue().deepCopy());
            }
        }
    }

    /**
     * Expand a leading {@code ~} to the user's home directory.
     */
    static Path expandPath(String raw) {
        if (raw.equals("~") || raw.startsWith("~/")) {
            return Paths.get(System.getProperty("user.home") + raw.substring(1));
        }
        return Paths.get(raw);
    }

    /**
     * Resolve an interpreter setting against the workspace. Bare commands such
     * as {@code python3} are left for PATH lookup.
     */
    static String resolveInterpreter(Path workspace, String interpreter) {
        Path candidate = expandPath(interpreter);
        if (candidate.isAbsolute()) {
            return candidate.toString();
        }
        if (interpreter.contains("/")) {
            return workspace.resolve(candidate).toString();
        }
        return interpreter;
    }

    private static BridgeConfig materialize(JsonObject root, String source) throws BridgeConfigException {
        JsonObject workspaceSection = section(root, "workspace");
        Path workspace = expandPath(requireString(workspaceSection, "path", "workspace")).toAbsolutePath().normalize();
        String defaultPython = optionalString(workspaceSection, "python", "workspace", "python3");

        JsonObject security = section(root, "security");
        int maxParamLength = positiveInt(security, "maxParamLength", "security");
        int maxPayloadLength = positiveInt(security, "maxPayloadLength", "security");

        boolean collectMetrics = optionalBoolean(section(root, "performance"), "collectMetrics", true);

        double graceSeconds = positiveNumber(section(root, "execution"), "killGraceSeconds", "execution");
        Duration killGrace = Duration.ofMillis(Math.round(graceSeconds * 1000));

        Map<String, String> environment = new LinkedHashMap<>();
        environment.put("PYTHONPATH", workspace.toString());
        for (Map.Entry<String, JsonElement> entry : section(root, "environment").entrySet()) {
            if (!entry.getValue().isJsonPrimitive()) {
                throw new BridgeConfigException("environment." + entry.getKey() + " must be a string");
            }
            environment.put(entry.getKey(), entry.getValue().getAsString());
        }

        Map<String, AgentSettings> agents = new LinkedHashMap<>();
        for (Map.Entry<String, JsonElement> entry : section(root, "agents").entrySet()) {
            if (!entry.getValue().isJsonObject()) {
                throw new BridgeConfigException("agents." + entry.getKey() + " must be an object");
            }
            agents.put(entry.getKey(),
                agentSettings(entry.getKey(), entry.getValue().getAsJsonObject(), workspace, defaultPython));
        }

        BridgeConfig config = new BridgeConfig(workspace, maxParamLength, maxPayloadLength, collectMetrics,
            killGrace, environment, agents, source);
        log.debug("Loaded configuration: {}", config);
        return config;
    }

    private static AgentSettings agentSettings(String name, JsonObject agent, Path workspace, String defaultPython)
            throws BridgeConfigException {
        String where = "agents." + name;
        String script = requireString(agent, "path", where);
        String python = optionalString(agent, "python", where, defaultPython);
        String description = optionalString(agent, "description", where, name);

        AgentConfig.Builder builder = AgentConfig.builder()
            .interpreter(resolveInterpreter(workspace, python))
            .script(workspace.resolve(expandPath(script)).normalize())
            .workingDirectory(workspace);

        if (agent.has("timeout")) {
            double seconds = positiveNumber(agent, "timeout", where);
            if (seconds > AgentConfig.MAX_TIMEOUT.getSeconds()) {
                throw new BridgeConfigException(where + ".timeout must be at most "
                    + AgentConfig.MAX_TIMEOUT.getSeconds() + " seconds");
            }
            builder.timeout(Duration.ofMillis(Math.round(seconds * 1000)));
        }
        if (agent.has("defaults")) {
            if (!agent.get("defaults").isJsonObject()) {
                throw new BridgeConfigException(where + ".defaults must be an object");
            }
            builder.defaults(agent.getAsJsonObject("defaults"));
        }
        if (agent.has("cliArguments")) {
            if (!agent.get("cliArguments").isJsonObject()) {
                throw new BridgeConfigException(where + ".cliArguments must be an object");
            }
            JsonObject cliArguments = agent.getAsJsonObject("cliArguments");
            Map<String, String> flags = new LinkedHashMap<>();
            for (String field : cliArguments.keySet()) {
                flags.put(field, requireString(cliArguments, field, where + ".cliArguments"));
            }
            builder.cliArguments(flags);
        }
        return new AgentSettings(name, description, builder.build());
    }

    private static JsonObject readDefaults() throws BridgeConfigException {
        InputStream in = BridgeConfigLoader.class.getResourceAsStream(DEFAULTS_RESOURCE);
        if (in == null) {
            throw new BridgeConfigException("Missing bundled defaults " + DEFAULTS_RESOURCE);
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return JsonParser.parseReader(reader).getAsJsonObject();
        } catch (IOException | JsonParseException | IllegalStateException e) {
            throw new BridgeConfigException("Unreadable bundled defaults: " + e.getMessage(), e);
        }
    }

    private static JsonObject readFile(Path configFile) throws BridgeConfigException {
        if (!Files.isRegularFile(configFile)) {
            throw new BridgeConfigException("Configuration file not found: " + configFile);
        }
        try (Reader reader = Files.newBufferedReader(configFile, StandardCharsets.UTF_8)) {
            JsonElement parsed = JsonParser.parseReader(reader);
            if (!parsed.isJsonObject()) {
                throw new BridgeConfigException("Configuration root must be an object: " + configFile);
            }
            return parsed.getAsJsonObject();
        } catch (IOException | JsonParseException e) {
            throw new BridgeConfigException("Could not load config from " + configFile + ": " + e.getMessage(), e);
        }
    }

    private static JsonObject section(JsonObject root, String name) throws BridgeConfigException {
        JsonElement element = root.get(name);
        if (element == null || element.isJsonNull()) {
            JsonObject empty = new JsonObject();
            root.add(name, empty);
            return empty;
        }
        if (!element.isJsonObject()) {
            throw new BridgeConfigException(name + " must be an object");
        }
        return element.getAsJsonObject();
    }

    private static String requireString(JsonObject obj, String key, String where) throws BridgeConfigException {
        JsonElement value = obj.get(key);
        if (value == null || !value.isJsonPrimitive() || !value.getAsJsonPrimitive().isString()) {
            throw new BridgeConfigException(where + "." + key + " must be a string");
        }
        return value.getAsString();
    }

    private static String optionalString(JsonObject obj, String key, String where, String fallback)
            throws BridgeConfigException {
        return obj.has(key) ? requireString(obj, key, where) : fallback;
    }

    private static boolean optionalBoolean(JsonObject obj, String key, boolean fallback) throws BridgeConfigException {
        JsonElement value = obj.get(key);
        if (value == null) {
            return fallback;
        }
        if (!value.isJsonPrimitive() || !value.getAsJsonPrimitive().isBoolean()) {
            throw new BridgeConfigException(key + " must be a boolean");
        }
        return value.getAsBoolean();
    }

    private static double positiveNumber(JsonObject obj, String key, String where) throws BridgeConfigException {
        JsonElement value = obj.get(key);
        if (value == null || !value.isJsonPrimitive() || !value.getAsJsonPrimitive().isNumber()
                || value.getAsDouble() <= 0) {
            throw new BridgeConfigException(where + "." + key + " must be a positive number");
        }
        return value.getAsDouble();
    }

    private static int positiveInt(JsonObject obj, String key, String where) throws BridgeConfigException {
        double value = positiveNumber(obj, key, where);
        if (value != Math.rint(value) || value > Integer.MAX_VALUE) {
            throw new BridgeConfigException(where + "." + key + " must be a positive integer");
        }
        return (int) value;
    }
}
