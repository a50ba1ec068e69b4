package com.nanik.agentbridge.mcp;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.nanik.agentbridge.config.BridgeConfig;
import com.nanik.agentbridge.execution.AgentExecutor;
import com.nanik.agentbridge.execution.ExecutionResult;
import com.nanik.agentbridge.metrics.MetricsRegistry;
import com.nanik.agentbridge.protocol.Framing;
import com.nanik.agentbridge.protocol.Method;
import com.nanik.agentbridge.protocol.RpcError;
import com.nanik.agentbridge.protocol.RpcRequest;
import com.nanik.agentbridge.tools.ToolCatalog;
import com.nanik.agentbridge.tools.ToolDescriptor;
import com.nanik.agentbridge.validation.ParameterValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * MCP request loop for the agent bridge.
 *
 * Reads one record per line, answers it in the framing it arrived in and
 * keeps going until the input ends or the client stops reading.
 */
public class RequestRouter {

    private static final Logger log = LoggerFactory.getLogger(RequestRouter.class);

    public static final String PROTOCOL_VERSION = "2024-11-05";
    public static final String SERVER_NAME = "agent-bridge";
    public static final String SERVER_VERSION = "1.0.0";
    public static final String SERVER_DESCRIPTION = "Bridge between MCP clients and ADK agent scripts";

    private final StdioTransport transport;
    private final JsonRpcHandler rpcHandler;
    private final ResponseEncoder encoder;
    private final ToolRegistry toolRegistry;
    private final ToolDispatcher dispatcher;

    public RequestRouter(StdioTransport transport, ToolRegistry toolRegistry, ToolDispatcher dispatcher) {
        this.transport = transport;
        this.encoder = new ResponseEncoder(transport);
        this.rpcHandler = new JsonRpcHandler(encoder);
        this.toolRegistry = toolRegistry;
        this.dispatcher = dispatcher;
    }

    /**
     * Wire a router from configuration.
     */
    public static RequestRouter create(BridgeConfig config, StdioTransport transport) {
        ToolRegistry registry = new ToolRegistry(ToolCatalog.fromConfig(config));
        ToolDispatcher dispatcher = new ToolDispatcher(
            registry,
            new ParameterValidator(config.getMaxParamLength(), config.getMaxPayloadLength()),
            new AgentExecutor(config),
            new MetricsRegistry(config.isCollectMetrics(), Clock.systemUTC()));
        return new RequestRouter(transport, registry, dispatcher);
    }

    /**
     * Serve until end of input or until the peer closes the output.
     *
     * @return process exit status: 0 on a normal stop, 1 if input could not be read
     */
    public int run() {
        log.info("Starting {} v{} with {} tools", SERVER_NAME, SERVER_VERSION, toolRegistry.size());

        int status = 0;
        while (true) {
            String message;
            try {
                message = transport.readMessage();
            } catch (IOException e) {
                log.error("Error reading input", e);
                status = 1;
                break;
            }
            if (message == null) {
                log.info("End of input");
                break;
            }
            handleMessage(message);
            if (transport.isClosed()) {
                break;
            }
        }

        log.info("Bridge stopped");
        return status;
    }

    /**
     * Handle one incoming record.
     */
    void handleMessage(String message) {
        JsonRpcHandler.ParseResult parseResult = rpcHandler.parseRequest(message);

        if (!parseResult.isSuccess()) {
            log.warn("Rejected record: {}", parseResult.getErrorResponse().getError().getMessage());
            rpcHandler.send(parseResult.getErrorResponse());
            return;
        }

        RpcRequest request = parseResult.getRequest();
        try {
            if (request.getFraming() == Framing.LEGACY) {
                log.debug("Received legacy call: {}", request.getTool());
                rpcHandler.sendLegacy(dispatchLegacy(request.getTool(), request.getRawParams()));
            } else {
                log.debug("Received: {}", request.getMethod());
                handleEnvelope(request);
            }
        } catch (RuntimeException | StackOverflowError e) {
            String target = request.getFraming() == Framing.LEGACY ? request.getTool() : request.getMethod();
            log.error("Error processing {}", target, e);
            if (request.getFraming() == Framing.LEGACY) {
                rpcHandler.sendLegacy(ResponseEncoder.legacyError("Internal error: " + e.getMessage()));
            } else {
                rpcHandler.sendError(request.getId(), RpcError.internalError(e));
            }
        }
    }

    private void handleEnvelope(RpcRequest request) {
        Method method = Method.fromWireName(request.getMethod());
        if (method == null) {
            rpcHandler.sendError(request.getId(), RpcError.methodNotFound(request.getMethod()));
            return;
        }

        switch (method) {
            case INITIALIZE:
                handleInitialize(request);
                break;
            case INITIALIZED:
                log.info("Client confirmed initialization");
                break;
            case TOOLS_LIST:
                handleToolsList(request);
                break;
            case TOOLS_CALL:
                handleToolsCall(request);
                break;
            case HEALTH_CHECK:
                rpcHandler.sendSuccess(request, dispatcher.getMetrics().healthReport().toJson());
                break;
            default:
                rpcHandler.sendError(request.getId(), RpcError.methodNotFound(request.getMethod()));
                break;
        }
    }

    /**
     * Handle initialize request. Repeating it returns the same descriptor.
     */
    private void handleInitialize(RpcRequest request) {
        JsonObject result = new JsonObject();
        result.addProperty("protocolVersion", PROTOCOL_VERSION);

        JsonObject serverInfo = new JsonObject();
        serverInfo.addProperty("name", SERVER_NAME);
        serverInfo.addProperty("version", SERVER_VERSION);
        serverInfo.addProperty("description", SERVER_DESCRIPTION);
        result.add("serverInfo", serverInfo);

        JsonObject capabilities = new JsonObject();
        capabilities.add("tools", new JsonObject());
        result.add("capabilities", capabilities);

        rpcHandler.sendSuccess(request, result);
        log.info("Initialized with protocol version {}", PROTOCOL_VERSION);
    }

    private void handleToolsList(RpcRequest request) {
        JsonObject result = new JsonObject();
        JsonArray toolsArray = new JsonArray();

        for (ToolDescriptor tool : toolRegistry.getAllDescriptors()) {
            JsonObject toolObj = new JsonObject();
            toolObj.addProperty("name", tool.getName());
            toolObj.addProperty("description", tool.getDescription());
            toolObj.add("inputSchema", tool.getInputSchema());
            toolsArray.add(toolObj);
        }

        result.add("tools", toolsArray);
        rpcHandler.sendSuccess(request, result);
    }

    private void handleToolsCall(RpcRequest request) {
        String toolName = request.getStringParam("name");
        if (toolName == null || toolName.isEmpty()) {
            rpcHandler.sendError(request.getId(), RpcError.invalidParams("Missing 'name' parameter"));
            return;
        }

        if (!dispatcher.hasTool(toolName)) {
            log.warn("Unknown tool requested: {}", toolName);
            rpcHandler.sendError(request.getId(), RpcError.unknownTool(toolName, toolRegistry.getToolNames()));
            return;
        }

        JsonElement arguments = request.getParam("arguments");
        if (arguments != null && !arguments.isJsonNull() && !arguments.isJsonObject()) {
            rpcHandler.sendError(request.getId(), RpcError.invalidParams("'arguments' must be an object"));
            return;
        }
        JsonObject toolArgs = arguments != null && arguments.isJsonObject()
            ? arguments.getAsJsonObject()
            : new JsonObject();

        ExecutionResult result = dispatcher.dispatch(toolName, toolArgs);
        if (result.isSuccess()) {
            rpcHandler.sendSuccess(request, encoder.toolCallResult(result.getPayload()));
        } else {
            rpcHandler.sendError(request.getId(), RpcError.fromResult(toolName, result));
        }
    }

    /**
     * Answer a legacy {@code {tool, params}} call.
     *
     * @return {"status": "success", "result": ...} or {"status": "error", "error": "..."}
     */
    public JsonObject dispatchLegacy(String tool, JsonElement params) {
        if (tool == null || tool.isEmpty()) {
            return ResponseEncoder.legacyError("Missing 'tool' in request");
        }
        if (params != null && !params.isJsonNull() && !params.isJsonObject()) {
            return ResponseEncoder.legacyError("params must be an object");
        }

        if (Method.HEALTH_CHECK.getWireName().equals(tool) && !dispatcher.hasTool(tool)) {
            return ResponseEncoder.legacySuccess(dispatcher.getMetrics().healthReport().toJson());
        }

        if (!dispatcher.hasTool(tool)) {
            List<String> available = new ArrayList<>(toolRegistry.getToolNames());
            available.add(Method.HEALTH_CHECK.getWireName());
            log.warn("Unknown tool requested: {}", tool);
            return ResponseEncoder.legacyError("Unknown tool '" + tool + "'. Available tools: " + available);
        }

        JsonObject arguments = params != null && params.isJsonObject() ? params.getAsJsonObject() : new JsonObject();
        ExecutionResult result = dispatcher.dispatch(tool, arguments);
        if (result.isSuccess()) {
            return ResponseEncoder.legacySuccess(result.getPayload());
        }
        return ResponseEncoder.legacyError(result.getMessage());
    }

    public ToolRegistry getToolRegistry() {
        return toolRegistry;
    }

    public MetricsRegistry getMetrics() {
        return dispatcher.getMetrics();
    }
}
