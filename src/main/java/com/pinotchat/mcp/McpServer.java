package com.pinotchat.mcp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.pinotchat.mcp.config.CliUtils;
import com.pinotchat.mcp.config.ConfigParams;
import com.pinotchat.mcp.config.ResourceManager;
import com.pinotchat.mcp.config.ResourceManager.ErrorMessages;
import com.pinotchat.mcp.filter.ConfigurationException;
import com.pinotchat.mcp.filter.FilterStore;
import com.pinotchat.mcp.filter.ReloadResult;
import com.pinotchat.mcp.filter.UnauthorizedAccessException;
import com.pinotchat.mcp.pinot.PinotApiException;
import com.pinotchat.mcp.pinot.PinotClient;
import com.pinotchat.mcp.pinot.QueryExecutionException;
import com.pinotchat.mcp.pinot.QueryResult;
import com.pinotchat.mcp.prompts.PromptService;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.net.BindException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * MCP server exposing Apache Pinot through tools and prompts.
 * Implements the Model Context Protocol over stdio (line-delimited JSON-RPC) or HTTP.
 *
 * <p>Every tool that touches a table or schema goes through {@link PinotClient}, which enforces the
 * table allow-list before any request is sent to the cluster. Tool failures are reported as tool
 * results with {@code isError} set, so the assistant can read them. Protocol failures are JSON-RPC errors.
 */
public class McpServer {
    private static final Logger logger = LoggerFactory.getLogger(McpServer.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    final PinotClient pinotClient;
    private final PromptService promptService;
    private final Map<String, Object> serverInfo;

    // Lifecycle management
    private enum ServerState {
        UNINITIALIZED,
        INITIALIZING,
        INITIALIZED,
        SHUTDOWN
    }

    private volatile ServerState serverState = ServerState.UNINITIALIZED;
    private ObjectNode clientCapabilities = null;

    /**
     * Creates a new MCP server for the configured cluster.
     *
     * @param configParams Pinot configuration
     * @param filterStore Allow-list loaded at startup
     */
    public McpServer(ConfigParams configParams, FilterStore filterStore) {
        this.pinotClient = createPinotClient(configParams, filterStore);
        this.promptService = new PromptService();
        this.serverInfo = createServerInfo();
    }

    /**
     * Creates a new MCP server with an existing client. Useful for testing.
     *
     * @param pinotClient Pre-configured Pinot client
     */
    public McpServer(PinotClient pinotClient) {
        this.pinotClient = pinotClient;
        this.promptService = new PromptService();
        this.serverInfo = createServerInfo();
    }

    /**
     * Factory method for creating the Pinot client.
     * Can be overridden in subclasses for custom client wiring.
     */
    protected PinotClient createPinotClient(ConfigParams configParams, FilterStore filterStore) {
        return new PinotClient(configParams, filterStore);
    }

    /**
     * Starts the server in HTTP mode on the specified address and port.
     * Creates HTTP endpoints for MCP requests (/mcp) and health checks (/health).
     * Blocks the calling thread until the server is stopped.
     *
     * @param bindAddress The address to bind to
     * @param listenPort The port number to listen on
     * @throws IOException if the server cannot be started (e.g., port already in use)
     */
    public void startHttpMode(String bindAddress, int listenPort) throws IOException {
        logger.info("Starting Pinot MCP Server in HTTP mode on {}:{}...", bindAddress, listenPort);

        HttpServer httpServer = null;
        try {
            httpServer = createHttpServer(bindAddress, listenPort);
            httpServer.start();

            logger.info("MCP endpoint: http://{}:{}/mcp", bindAddress, listenPort);
            logger.info("Health check: http://{}:{}/health", bindAddress, listenPort);

            try {
                Thread.currentThread().join();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.info("Server interrupted, shutting down...");
            }
        } catch (BindException e) {
            logger.error("{}\n{}", ResourceManager.getErrorMessage(ErrorMessages.STARTUP_PORT_INUSE, listenPort),
                    ResourceManager.getErrorMessage(ErrorMessages.STARTUP_SOLUTIONS, listenPort));
            throw new IOException(ResourceManager.getErrorMessage(ErrorMessages.STARTUP_PORT_INUSE, listenPort), e);
        } finally {
            if (httpServer != null) {
                httpServer.stop(5);
                logger.info("HTTP server stopped");
            }
        }
    }

    /**
     * Binds the HTTP transport without starting it.
     */
    HttpServer createHttpServer(String bindAddress, int listenPort) throws IOException {
        HttpServer httpServer = HttpServer.create(new InetSocketAddress(bindAddress, listenPort), 0);
        httpServer.createContext("/mcp", new McpHttpHandler(this));
        httpServer.createContext("/health", new HealthCheckHandler(this));
        httpServer.setExecutor(null);
        return httpServer;
    }

    /**
     * Processes an MCP request and returns the appropriate response.
     *
     * @param requestNode The parsed JSON-RPC request
     * @return JSON response node, or null for notifications (requests without id)
     */
    protected JsonNode handleRequest(JsonNode requestNode) {
        String requestMethod = requestNode.path("method").asText();
        JsonNode requestParams = requestNode.path("params");

        boolean isNotification = !requestNode.has("id");
        JsonNode requestId = isNotification ? null : requestNode.get("id");

        logger.debug("Handling request: method={}, id={}, isNotification={}, state={}",
                requestMethod, requestId, isNotification, serverState);

        try {
            enforceLifecycleRules(requestMethod);
            JsonNode resultNode = executeMethod(requestMethod, requestParams);

            return isNotification ? null : createSuccessResponse(resultNode, requestId);
        } catch (Exception e) {
            return handleRequestException(e, requestMethod, isNotification, requestId);
        }
    }

    private void enforceLifecycleRules(String requestMethod) {
        if (serverState == ServerState.SHUTDOWN) {
            throw new IllegalStateException("Server is shut down");
        }
        if (serverState == ServerState.UNINITIALIZED && !requestMethod.equals("initialize")
                && !requestMethod.equals("ping")) {
            throw new IllegalStateException("Server not initialized. Send 'initialize' first.");
        }
        if (serverState == ServerState.INITIALIZING && !requestMethod.equals("notifications/initialized")
                && !requestMethod.equals("ping")) {
            throw new IllegalStateException("Server is initializing. Send 'notifications/initialized' first.");
        }
    }

    private JsonNode executeMethod(String requestMethod, JsonNode requestParams) {
        return switch (requestMethod) {
            case "initialize" -> handleInitialize(requestParams);
            case "notifications/initialized" -> handleNotificationInitialized();
            case "ping" -> handlePing();
            case "tools/list" -> handleListTools();
            case "tools/call" -> handleCallTool(requestParams);
            case "prompts/list" -> promptService.listPrompts();
            case "prompts/get" -> promptService.getPrompt(requestParams.path("name").asText());
            default -> throw new MethodNotFoundException(requestMethod);
        };
    }

    private JsonNode handleRequestException(Exception theException, String requestMethod, boolean isNotification,
                                            JsonNode requestId) {
        if (isNotification) {
            logger.warn("Error in notification {}: {}", requestMethod, theException.getMessage());
            return null;
        }

        if (theException instanceof MethodNotFoundException) {
            logger.warn("Method not found: {}", requestMethod);
            return createErrorResponse("method_not_found", theException.getMessage(), requestId);
        }
        if (theException instanceof IllegalStateException) {
            logger.warn("Lifecycle violation: {}", theException.getMessage());
            return createErrorResponse("invalid_request", theException.getMessage(), requestId);
        }
        if (theException instanceof IllegalArgumentException) {
            logger.warn("Invalid request parameters: {}", theException.getMessage());
            return createErrorResponse("invalid_params", theException.getMessage(), requestId);
        }

        logger.error("Unexpected error handling request", theException);
        return createErrorResponse("internal_error", "Internal error: " + theException.getMessage(), requestId);
    }

    private JsonNode handleInitialize(JsonNode requestParams) {
        if (serverState != ServerState.UNINITIALIZED) {
            throw new IllegalStateException("Server already initialized or in wrong state: " + serverState);
        }

        if (requestParams.has("capabilities") && requestParams.get("capabilities").isObject()) {
            clientCapabilities = (ObjectNode) requestParams.get("capabilities");
            logger.debug("Client capabilities: {}", clientCapabilities);
        }

        String clientProtocolVersion = requestParams.path("protocolVersion").asText("unknown");
        if (!clientProtocolVersion.equals(CliUtils.PROTOCOL_VERSION)) {
            logger.warn("Protocol version mismatch. Client: {}, Server: {}. Offering server version.",
                    clientProtocolVersion, CliUtils.PROTOCOL_VERSION);
        }

        serverState = ServerState.INITIALIZING;
        logger.info("Server initializing...");

        ObjectNode resultNode = objectMapper.createObjectNode();
        resultNode.put("protocolVersion", CliUtils.PROTOCOL_VERSION);
        resultNode.set("capabilities", createCapabilities());
        resultNode.set("serverInfo", objectMapper.valueToTree(serverInfo));
        return resultNode;
    }

    private JsonNode handleNotificationInitialized() {
        if (serverState != ServerState.INITIALIZING) {
            throw new IllegalStateException(
                    "Received 'initialized' notification but server is not in INITIALIZING state: " + serverState);
        }
        serverState = ServerState.INITIALIZED;
        logger.info("Server initialized and ready for operation");
        return null;
    }

    private JsonNode handlePing() {
        return objectMapper.createObjectNode();
    }

    /**
     * Handles the tools/list MCP method.
     */
    private JsonNode handleListTools() {
        ArrayNode toolsNode = objectMapper.createArrayNode();
        for (ToolKind toolKind : ToolKind.values()) {
            toolsNode.add(describeTool(toolKind));
        }
        ObjectNode resultNode = objectMapper.createObjectNode();
        resultNode.set("tools", toolsNode);
        return resultNode;
    }

    private static ObjectNode describeTool(ToolKind toolKind) {
        ObjectNode toolNode = objectMapper.createObjectNode();
        toolNode.put("name", toolKind.toolName());
        toolNode.put("description", toolKind.description());

        ObjectNode inputSchema = objectMapper.createObjectNode();
        inputSchema.put("type", "object");
        ObjectNode properties = objectMapper.createObjectNode();
        ArrayNode requiredNode = objectMapper.createArrayNode();
        for (ToolKind.ToolArgument argument : toolKind.arguments()) {
            ObjectNode property = objectMapper.createObjectNode();
            property.put("type", argument.type());
            property.put("description", argument.description());
            properties.set(argument.name(), property);
            if (argument.required()) {
                requiredNode.add(argument.name());
            }
        }
        inputSchema.set("properties", properties);
        inputSchema.set("required", requiredNode);
        toolNode.set("inputSchema", inputSchema);
        return toolNode;
    }

    /**
     * Handles the tools/call MCP method.
     *
     * @param paramsNode Parameters containing tool name and arguments
     * @return Tool result: one text content item and the {@code isError} flag
     * @throws IllegalArgumentException if the tool is unknown
     */
    JsonNode handleCallTool(JsonNode paramsNode) {
        String toolName = paramsNode.path("name").asText();
        JsonNode arguments = paramsNode.path("arguments");
        ToolKind toolKind = ToolKind.fromToolName(toolName).orElseThrow(() -> new IllegalArgumentException(
                ResourceManager.getErrorMessage(ErrorMessages.TOOL_UNKNOWN, toolName)));

        try {
            return createToolResult(executeTool(toolKind, arguments), false);
        } catch (QueryExecutionException | PinotApiException | ConfigurationException
                 | UnauthorizedAccessException | IllegalArgumentException e) {
            return toolFailure(toolName, e);
        }
    }

    JsonNode executeTool(ToolKind toolKind, JsonNode args)
            throws QueryExecutionException, PinotApiException, ConfigurationException {
        return switch (toolKind) {
            case TEST_CONNECTION -> pinotClient.testConnection();
            case READ_QUERY -> execReadQuery(args);
            case LIST_TABLES -> objectMapper.valueToTree(pinotClient.listTables());
            case TABLE_DETAILS -> pinotClient.getTableDetail(requiredText(args, "tableName"));
            case SEGMENT_LIST -> pinotClient.getSegments(requiredText(args, "tableName"));
            case SEGMENT_METADATA_DETAILS -> pinotClient.getSegmentMetadataDetail(requiredText(args, "tableName"));
            case INDEX_COLUMN_DETAILS -> pinotClient.getIndexColumnDetail(
                    requiredText(args, "tableName"), requiredText(args, "segmentName"));
            case TABLECONFIG_SCHEMA_DETAILS -> pinotClient.getTableConfigSchemaDetail(requiredText(args, "tableName"));
            case GET_SCHEMA -> pinotClient.getSchema(requiredText(args, "schemaName"));
            case CREATE_SCHEMA -> pinotClient.createSchema(requiredJsonText(args, "schemaJson"),
                    optionalBoolean(args, "override", true), optionalBoolean(args, "force", false));
            case UPDATE_SCHEMA -> pinotClient.updateSchema(requiredText(args, "schemaName"),
                    requiredJsonText(args, "schemaJson"),
                    optionalBoolean(args, "reload", false), optionalBoolean(args, "force", false));
            case GET_TABLE_CONFIG -> pinotClient.getTableConfig(requiredText(args, "tableName"),
                    optionalText(args, "tableType"));
            case CREATE_TABLE_CONFIG -> pinotClient.createTableConfig(requiredJsonText(args, "tableConfigJson"),
                    optionalText(args, "validationTypesToSkip"));
            case UPDATE_TABLE_CONFIG -> pinotClient.updateTableConfig(requiredText(args, "tableName"),
                    requiredJsonText(args, "tableConfigJson"), optionalText(args, "validationTypesToSkip"));
            case RELOAD_TABLE_FILTERS -> execReloadTableFilters(args);
        };
    }

    private JsonNode execReadQuery(JsonNode args) throws QueryExecutionException {
        String queryText = optionalText(args, "query");
        if (queryText == null || queryText.isBlank()) {
            throw new IllegalArgumentException(ResourceManager.getErrorMessage(ErrorMessages.QUERY_EMPTY));
        }
        int maxQueryLength = pinotClient.getConfigParams().maxQueryLength();
        if (queryText.length() > maxQueryLength) {
            throw new IllegalArgumentException(
                    ResourceManager.getErrorMessage(ErrorMessages.QUERY_TOO_LONG, maxQueryLength));
        }
        if (!SecurityUtils.isSelectQuery(queryText)) {
            throw new IllegalArgumentException(ResourceManager.getErrorMessage(ErrorMessages.QUERY_NOT_SELECT));
        }

        QueryResult queryResult = pinotClient.executeQuery(queryText);
        logger.info("Query returned {} rows in {}ms", queryResult.rowCount(), queryResult.executionTimeMs());
        return objectMapper.valueToTree(queryResult.allRows());
    }

    private JsonNode execReloadTableFilters(JsonNode args) throws ConfigurationException {
        ReloadResult reloadResult = pinotClient.reloadFilters(optionalText(args, "filePath"));
        ObjectNode resultNode = objectMapper.createObjectNode();
        resultNode.put("status", "success");
        resultNode.put("oldCount", reloadResult.oldCount());
        resultNode.put("newCount", reloadResult.newCount());
        resultNode.put("unrestricted", reloadResult.unrestricted());
        return resultNode;
    }

    private JsonNode toolFailure(String toolName, Exception e) {
        logger.warn("Tool {} failed: {}", toolName, e.getMessage());
        return createToolResult(new TextNode("Error: " + e.getMessage()), true);
    }

    private static JsonNode createToolResult(JsonNode payload, boolean isError) {
        String text;
        if (payload.isTextual()) {
            text = payload.asText();
        } else {
            try {
                text = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(payload);
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Cannot serialize tool result", e);
            }
        }

        ObjectNode textContent = objectMapper.createObjectNode();
        textContent.put("type", "text");
        textContent.put("text", text);
        ArrayNode contentNode = objectMapper.createArrayNode();
        contentNode.add(textContent);

        ObjectNode responseNode = objectMapper.createObjectNode();
        responseNode.set("content", contentNode);
        responseNode.put("isError", isError);
        return responseNode;
    }

    static String requiredText(JsonNode args, String name) {
        String value = optionalText(args, name);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(ResourceManager.getErrorMessage(ErrorMessages.ARGUMENT_MISSING, name));
        }
        return value;
    }

    static String optionalText(JsonNode args, String name) {
        JsonNode valueNode = args.path(name);
        if (valueNode.isMissingNode() || valueNode.isNull()) {
            return null;
        }
        return valueNode.asText();
    }

    /**
     * Accepts either a JSON string or an inline JSON object for arguments that carry a document.
     */
    static String requiredJsonText(JsonNode args, String name) {
        JsonNode valueNode = args.path(name);
        if (valueNode.isObject()) {
            return valueNode.toString();
        }
        return requiredText(args, name);
    }

    static boolean optionalBoolean(JsonNode args, String name, boolean defaultValue) {
        JsonNode valueNode = args.path(name);
        if (valueNode.isBoolean()) {
            return valueNode.booleanValue();
        }
        if (valueNode.isTextual()) {
            return Boolean.parseBoolean(valueNode.asText());
        }
        return defaultValue;
    }

    /**
     * Starts the server in stdio mode. Reads JSON-RPC requests from stdin, one per line,
     * and writes responses to stdout until stdin is closed.
     *
     * @throws IOException if stdin cannot be read
     */
    public void startStdioMode() throws IOException {
        logger.info("Starting Pinot MCP Server in stdio mode...");

        try (BufferedReader bufferedReader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
             PrintWriter printWriter = new PrintWriter(System.out, true, StandardCharsets.UTF_8)) {
            String currLine;
            while ((currLine = bufferedReader.readLine()) != null) {
                if (!currLine.isBlank()) {
                    processStdioRequest(currLine, printWriter);
                }
            }
        }

        logger.info("Pinot MCP Server stopped.");
    }

    void processStdioRequest(String requestLine, PrintWriter printWriter) throws JsonProcessingException {
        JsonNode requestNode;
        try {
            requestNode = objectMapper.readTree(requestLine);
        } catch (JsonProcessingException e) {
            logger.warn("Unparseable request: {}", SecurityUtils.truncateString(requestLine, 100));
            printWriter.println(objectMapper.writeValueAsString(
                    createErrorResponse("parse_error", "Parse error: " + e.getOriginalMessage(), null)));
            return;
        }

        JsonNode responseNode = handleRequest(requestNode);
        if (responseNode != null) {
            printWriter.println(objectMapper.writeValueAsString(responseNode));
        }
    }

    private ObjectNode createCapabilities() {
        ObjectNode capabilitiesNode = objectMapper.createObjectNode();

        ObjectNode toolsNode = objectMapper.createObjectNode();
        toolsNode.put("listChanged", false);
        capabilitiesNode.set("tools", toolsNode);

        ObjectNode promptsNode = objectMapper.createObjectNode();
        promptsNode.put("listChanged", false);
        capabilitiesNode.set("prompts", promptsNode);

        return capabilitiesNode;
    }

    private Map<String, Object> createServerInfo() {
        Map<String, Object> infoMap = new LinkedHashMap<>();
        infoMap.put("name", CliUtils.SERVER_NAME);
        infoMap.put("version", CliUtils.SERVER_VERSION);
        infoMap.put("description", CliUtils.SERVER_DESCRIPTION);
        return infoMap;
    }

    private JsonNode createSuccessResponse(JsonNode resultNode, JsonNode requestId) {
        ObjectNode responseNode = objectMapper.createObjectNode();
        responseNode.put("jsonrpc", "2.0");
        responseNode.set("result", resultNode);
        setRespId(requestId, responseNode);
        return responseNode;
    }

    /**
     * Creates a JSON-RPC error response with the specified error details.
     *
     * @param code Error code string (mapped to numeric codes)
     * @param message Error message description
     * @param requestId The request ID from the original request
     * @return JSON-RPC error response
     */
    static JsonNode createErrorResponse(String code, String message, JsonNode requestId) {
        ObjectNode responseNode = objectMapper.createObjectNode();
        responseNode.put("jsonrpc", "2.0");

        ObjectNode errorNode = objectMapper.createObjectNode();
        errorNode.put("code", getErrorCode(code));
        errorNode.put("message", message);
        responseNode.set("error", errorNode);
        setRespId(requestId, responseNode);
        return responseNode;
    }

    // The id is echoed exactly, string or number
    private static void setRespId(JsonNode requestId, ObjectNode responseNode) {
        if (requestId == null) {
            responseNode.putNull("id");
        } else {
            responseNode.set("id", requestId);
        }
    }

    static int getErrorCode(String codeString) {
        return switch (codeString) {
            case "parse_error" -> -32700;
            case "invalid_request" -> -32600;
            case "method_not_found" -> -32601;
            case "invalid_params" -> -32602;
            default -> -32603;
        };
    }

    String getServerState() {
        return serverState.toString();
    }

    /**
     * Gracefully shuts down the server and releases the driver connection.
     * Safe to call multiple times.
     */
    public void shutdown() {
        if (serverState == ServerState.SHUTDOWN) {
            return;
        }
        logger.info("Shutting down MCP server...");
        serverState = ServerState.SHUTDOWN;
        pinotClient.close();
        logger.info("MCP server shutdown complete");
    }

    private static final class MethodNotFoundException extends RuntimeException {
        MethodNotFoundException(String method) {
            super("Method not found: " + method);
        }
    }

    /**
     * Main entry point. Loads configuration and the table allow-list, then serves stdio or HTTP.
     *
     * @param args Command line arguments for configuration
     */
    public static void main(String[] args) {
        if (CliUtils.handleHelpAndVersion(args)) {
            System.exit(0);
        }

        ConfigParams configParams;
        FilterStore filterStore;
        try {
            configParams = CliUtils.loadConfiguration(args);
        } catch (IOException | IllegalArgumentException e) {
            logger.error(ResourceManager.getErrorMessage(ErrorMessages.CONFIG_ERROR_TITLE, e.getMessage()));
            System.exit(2);
            return;
        }
        try {
            filterStore = FilterStore.fromFile(configParams.tableFilterFile());
        } catch (ConfigurationException e) {
            logger.error(ResourceManager.getErrorMessage(ErrorMessages.FILTER_LOAD_FAILED,
                    configParams.tableFilterFile(), e.getMessage()));
            System.exit(2);
            return;
        }
        logger.info("Loaded configuration: {}", configParams);

        McpServer mcpServer = new McpServer(configParams, filterStore);
        Runtime.getRuntime().addShutdownHook(new Thread(mcpServer::shutdown));

        try {
            if (CliUtils.isHttpMode(args)) {
                mcpServer.startHttpMode(CliUtils.getBindAddress(args), CliUtils.getHttpPort(args));
            } else {
                mcpServer.startStdioMode();
            }
        } catch (IOException e) {
            logger.error("Failed to start server: {}", e.getMessage());
            System.exit(1);
        }
    }
}
