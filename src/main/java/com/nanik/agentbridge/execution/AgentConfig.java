package com.nanik.agentbridge.execution;

import com.google.gson.JsonObject;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * How to launch one agent: interpreter, script, working directory, timeout,
 * the arguments projected onto its command line and its default arguments.
 */
public class AgentConfig {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(300);
    public static final Duration MAX_TIMEOUT = Duration.ofDays(1);

    /** Argument fields passed as command-line flags unless an agent overrides them. */
    public static final Map<String, String> DEFAULT_CLI_ARGUMENTS;

    static {
        Map<String, String> flags = new LinkedHashMap<>();
        flags.put("issue_number", "--issue");
        flags.put("repo_name", "--repo");
        flags.put("dry_run", "--dry-run");
        DEFAULT_CLI_ARGUMENTS = Collections.unmodifiableMap(flags);
    }

    private final String interpreter;
    private final Path script;
    private final Path workingDirectory;
    private final Duration timeout;
    private final Map<String, String> cliArguments;
    private final JsonObject defaults;

    private AgentConfig(Builder builder) {
        this.interpreter = Objects.requireNonNull(builder.interpreter, "interpreter");
        this.script = Objects.requireNonNull(builder.script, "script");
        this.workingDirectory = builder.workingDirectory;
        this.timeout = builder.timeout != null ? builder.timeout : DEFAULT_TIMEOUT;
        this.cliArguments = Collections.unmodifiableMap(new LinkedHashMap<>(builder.cliArguments));
        this.defaults = builder.defaults != null ? builder.defaults.deepCopy() : new JsonObject();
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive: " + timeout);
        }
        if (timeout.compareTo(MAX_TIMEOUT) > 0) {
            throw new IllegalArgumentException("timeout must be at most " + MAX_TIMEOUT + ": " + timeout);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Interpreter command: an absolute path, a path relative to the
     * working directory, or a bare command looked up on PATH.
     */
    public String getInterpreter() {
        return interpreter;
    }

    public Path getScript() {
        return script;
    }

    /**
     * Working directory of the agent process, or null to inherit the bridge's.
     */
    public Path getWorkingDirectory() {
        return workingDirectory;
    }

    public Duration getTimeout() {
        return timeout;
    }

    /**
     * Argument field name to command-line flag, in emission order.
     */
    public Map<String, String> getCliArguments() {
        return cliArguments;
    }

    /**
     * Copy of the default argument values.
     */
    public JsonObject getDefaults() {
        return defaults.deepCopy();
    }

    @Override
    public String toString() {
        return "AgentConfig{interpreter='" + interpreter + "', script=" + script
            + ", timeout=" + timeout + "}";
    }

    public static class Builder {
        private String interpreter;
        private Path script;
        private Path workingDirectory;
        private Duration timeout;
        private Map<String, String> cliArguments = DEFAULT_CLI_ARGUMENTS;
        private JsonObject defaults;

        public Builder interpreter(String interpreter) {
            this.interpreter = interpreter;
            return this;
        }

        public Builder script(Path script) {
            this.script = script;
            return this;
        }

        public Builder workingDirectory(Path workingDirectory) {
            this.workingDirectory = workingDirectory;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder cliArguments(Map<String, String> cliArguments) {
            this.cliArguments = cliArguments;
            return this;
        }

        public Builder defaults(JsonObject defaults) {
            this.defaults = defaults;
            return this;
        }

        public AgentConfig build() {
            return new AgentConfig(this);
        }
    }
}
