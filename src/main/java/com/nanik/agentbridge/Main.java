package com.nanik.agentbridge;

import com.nanik.agentbridge.cli.BridgeCommand;
import picocli.CommandLine;

import java.util.Locale;

public final class Main {

    static final String ENV_LOG_LEVEL = "BRIDGE_LOG_LEVEL";
    static final String ENV_LOG_FILE = "BRIDGE_LOG_FILE";
    static final String PROP_LOG_LEVEL = "org.slf4j.simpleLogger.defaultLogLevel";
    static final String PROP_LOG_FILE = "org.slf4j.simpleLogger.logFile";

    private Main() {
    }

    public static void main(String[] args) {
        // must run before the first logger is created
        configureLogging();
        int code = new CommandLine(new BridgeCommand()).execute(args);
        System.exit(code);
    }

    static void configureLogging() {
        String level = System.getenv(ENV_LOG_LEVEL);
        if (level != null && !level.isBlank() && System.getProperty(PROP_LOG_LEVEL) == null) {
            System.setProperty(PROP_LOG_LEVEL, toSimpleLoggerLevel(level));
        }
        String file = System.getenv(ENV_LOG_FILE);
        if (file != null && !file.isBlank() && System.getProperty(PROP_LOG_FILE) == null) {
            System.setProperty(PROP_LOG_FILE, file);
        }
    }

    /**
     * Map common level names (including WARNING and CRITICAL) onto slf4j-simple's.
     */
    static String toSimpleLoggerLevel(String level) {
        String normalized = level.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "warning":
                return "warn";
            case "critical":
            case "fatal":
                return "error";
            case "trace":
            case "debug":
            case "info":
            case "warn":
            case "error":
            case "off":
                return normalized;
            default:
                return "info";
        }
    }
}
