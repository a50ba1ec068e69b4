package com.nanik.agentbridge.cli;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.nanik.agentbridge.config.BridgeConfig;
import com.nanik.agentbridge.config.BridgeConfigException;
import com.nanik.agentbridge.config.BridgeConfigLoader;
import com.nanik.agentbridge.mcp.RequestRouter;
import com.nanik.agentbridge.mcp.ResponseEncoder;
import com.nanik.agentbridge.mcp.StdioTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command line entry: either serve MCP over stdio or run one tool and print the result.
 */
@Command(
        name = "agent-bridge",
        mixinStandardHelpOptions = true,
        version = "agent-bridge " + RequestRouter.SERVER_VERSION,
        description = "Expose ADK agent scripts as MCP tools over stdio, or run one tool directly"
)
public final class BridgeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(BridgeCommand.class);

    static final String STDIO_MARKER = "-";
    static final int EXIT_CONFIG_ERROR = 2;

    @Parameters(index = "0", arity = "0..1", description = "Tool to run once; omit or '-' to serve over stdio")
    String toolName;

    @Parameters(index = "1", arity = "0..1", defaultValue = "{}", description = "Tool arguments as a JSON object")
    String jsonArguments;

    @Option(names = {"--config"}, description = "JSON configuration file merged over the built-in defaults")
    Path configFile;

    @Option(names = {"--workspace"}, description = "Workspace root; overrides ADK_WORKSPACE and the config file")
    Path workspace;

    @Spec
    CommandSpec spec;

    private final InputStream in;
    private final OutputStream out;
    private final Map<String, String> environment;

    public BridgeCommand() {
        this(System.in, new FileOutputStream(FileDescriptor.out), System.getenv());
    }

    BridgeCommand(InputStream in, OutputStream out, Map<String, String> environment) {
        this.in = in;
        this.out = out;
        this.environment = environment;
    }

    @Override
    public Integer call() {
        BridgeConfig config;
        try {
            config = BridgeConfigLoader.load(configFile, environment, workspace);
        } catch (BridgeConfigException e) {
            log.error("Configuration error: {}", e.getMessage());
            spec.commandLine().getErr().println("Configuration error: " + e.getMessage());
            return EXIT_CONFIG_ERROR;
        }
        log.debug("Loaded {}", config);

        RequestRouter router = RequestRouter.create(config, new StdioTransport(in, out));
        if (toolName == null || STDIO_MARKER.equals(toolName)) {
            return router.run();
        }
        return runOnce(router);
    }

    private int runOnce(RequestRouter router) {
        Gson gson = new GsonBuilder()
                .setPrettyPrinting()
                .serializeNulls()
                .disableHtmlEscaping()
                .create();
        PrintWriter writer = spec.commandLine().getOut();

        JsonElement arguments;
        try {
            arguments = JsonParser.parseString(jsonArguments);
        } catch (JsonParseException e) {
            writer.println(gson.toJson(ResponseEncoder.legacyError("Invalid JSON parameters: " + e.getMessage())));
            writer.flush();
            return 1;
        }
        if (!arguments.isJsonObject()) {
            writer.println(gson.toJson(ResponseEncoder.legacyError("Invalid JSON parameters: expected an object")));
            writer.flush();
            return 1;
        }

        JsonObject response = router.dispatchLegacy(toolName, arguments);
        writer.println(gson.toJson(response));
        writer.flush();
        return ResponseEncoder.STATUS_SUCCESS.equals(response.get("status").getAsString()) ? 0 : 1;
    }
}
