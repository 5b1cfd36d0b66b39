package com.pinotchat.mcp.pinot;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pinotchat.mcp.config.ConfigParams;
import com.pinotchat.mcp.config.ResourceManager;
import com.pinotchat.mcp.filter.AccessValidator;
import com.pinotchat.mcp.filter.ConfigurationException;
import com.pinotchat.mcp.filter.FilterSet;
import com.pinotchat.mcp.filter.FilterStore;
import com.pinotchat.mcp.filter.RegexTableReferenceExtractor;
import com.pinotchat.mcp.filter.ReloadResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Entry point used by the tool layer. Every operation that names a table or schema is checked
 * against the allow-list before any request leaves the process.
 */
public class PinotClient implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(PinotClient.class);
    private static final Logger securityLogger = LoggerFactory.getLogger("SECURITY." + PinotClient.class.getName());
    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static final int SAMPLE_TABLE_COUNT = 5;

    private final ConfigParams configParams;
    private final AccessValidator accessValidator;
    private final PinotQueryEngine queryEngine;
    private final PinotControllerClient controllerClient;
    private final ConnectionManager connectionManager;

    /**
     * Wires the production collaborators.
     *
     * @param configParams Pinot configuration
     * @param filterStore Active allow-list
     */
    public PinotClient(ConfigParams configParams, FilterStore filterStore) {
        this.configParams = configParams;
        this.accessValidator = new AccessValidator(filterStore, new RegexTableReferenceExtractor(),
                configParams.filterFailClosed());
        this.connectionManager = new ConnectionManager(new DriverConnectionFactory(configParams));
        this.queryEngine = new PinotQueryEngine(accessValidator, new BrokerHttpExecutor(configParams),
                new DriverQueryExecutor(connectionManager, configParams));
        this.controllerClient = new PinotControllerClient(configParams);
    }

    /**
     * Creates a client with injected collaborators. Useful for testing.
     */
    public PinotClient(ConfigParams configParams, AccessValidator accessValidator, PinotQueryEngine queryEngine,
                       PinotControllerClient controllerClient, ConnectionManager connectionManager) {
        this.configParams = configParams;
        this.accessValidator = accessValidator;
        this.queryEngine = queryEngine;
        this.controllerClient = controllerClient;
        this.connectionManager = connectionManager;
    }

    public QueryResult executeQuery(String query) throws QueryExecutionException {
        return queryEngine.execute(query);
    }

    public void validateName(String name) {
        accessValidator.validateName(name);
    }

    /**
     * Reloads the allow-list.
     *
     * @param sourcePath Filter file, or null to reuse the configured PINOT_TABLE_FILTER_FILE
     * @return Pattern counts before and after
     * @throws ConfigurationException if no path is available or the file is missing or malformed
     */
    public ReloadResult reloadFilters(String sourcePath) throws ConfigurationException {
        String effectivePath = sourcePath != null && !sourcePath.isBlank() ? sourcePath : configParams.tableFilterFile();
        if (effectivePath == null || effectivePath.isBlank()) {
            throw new ConfigurationException(
                    ResourceManager.getErrorMessage(ResourceManager.ErrorMessages.FILTER_FILE_NOT_CONFIGURED));
        }

        try {
            ReloadResult reloadResult = accessValidator.getFilterStore().reload(effectivePath);
            securityLogger.info("SECURITY_EVENT: FILTER_RELOADED - path={}, oldCount={}, newCount={}",
                    effectivePath, reloadResult.oldCount(), reloadResult.newCount());
            return reloadResult;
        } catch (ConfigurationException e) {
            securityLogger.warn("SECURITY_EVENT: FILTER_RELOAD_FAILED - path={}, reason={}", effectivePath, e.getMessage());
            throw e;
        }
    }

    /**
     * @return Table names from the controller that the allow-list permits, in controller order
     */
    public List<String> listTables() throws PinotApiException {
        return accessValidator.filterNames(controllerClient.listTables());
    }

    public JsonNode getTableDetail(String tableName) throws PinotApiException {
        validateName(tableName);
        return controllerClient.getTableSize(tableName);
    }

    public JsonNode getSegments(String tableName) throws PinotApiException {
        validateName(tableName);
        return controllerClient.getSegments(tableName);
    }

    public JsonNode getSegmentMetadataDetail(String tableName) throws PinotApiException {
        validateName(tableName);
        return controllerClient.getSegmentMetadata(tableName);
    }

    public JsonNode getIndexColumnDetail(String tableName, String segmentName) throws PinotApiException {
        validateName(tableName);
        return controllerClient.getIndexColumnDetails(tableName, segmentName);
    }

    public JsonNode getTableConfigSchemaDetail(String tableName) throws PinotApiException {
        validateName(tableName);
        return controllerClient.getTableConfigs(tableName);
    }

    public JsonNode getSchema(String schemaName) throws PinotApiException {
        validateName(schemaName);
        return controllerClient.getSchema(schemaName);
    }

    /**
     * Creates a schema after checking the {@code schemaName} field inside the JSON.
     */
    public JsonNode createSchema(String schemaJson, boolean override, boolean force) throws PinotApiException {
        String schemaName = requiredField(parseJson(schemaJson, "schemaJson"), "schemaName", "schemaJson");
        validateName(schemaName);
        return controllerClient.createSchema(schemaJson, override, force);
    }

    public JsonNode updateSchema(String schemaName, String schemaJson, boolean reload, boolean force)
            throws PinotApiException {
        validateName(schemaName);
        parseJson(schemaJson, "schemaJson");
        return controllerClient.updateSchema(schemaName, schemaJson, reload, force);
    }

    public JsonNode getTableConfig(String tableName, String tableType) throws PinotApiException {
        validateName(tableName);
        return controllerClient.getTableConfig(tableName, tableType);
    }

    /**
     * Creates a table config after checking its {@code tableName}, without the type suffix.
     */
    public JsonNode createTableConfig(String tableConfigJson, String validationTypesToSkip) throws PinotApiException {
        String tableName = requiredField(parseJson(tableConfigJson, "tableConfigJson"), "tableName", "tableConfigJson");
        validateName(stripTableTypeSuffix(tableName));
        return controllerClient.createTableConfig(tableConfigJson, validationTypesToSkip);
    }

    public JsonNode updateTableConfig(String tableName, String tableConfigJson, String validationTypesToSkip)
            throws PinotApiException {
        validateName(stripTableTypeSuffix(tableName));
        parseJson(tableConfigJson, "tableConfigJson");
        return controllerClient.updateTableConfig(tableName, tableConfigJson, validationTypesToSkip);
    }

    /**
     * Runs connection diagnostics. Each check records its own outcome; nothing is thrown.
     *
     * @return Diagnostic report with the configuration (without secrets) and per-check results
     */
    public ObjectNode testConnection() {
        ObjectNode result = objectMapper.createObjectNode();
        result.put("connection_test", false);
        result.put("query_test", false);
        result.put("tables_test", false);
        result.putNull("error");
        result.set("config", describeConfig());

        List<String> errors = new ArrayList<>();
        try {
            connectionManager.get();
            result.put("connection_test", true);
        } catch (PinotConnectionException e) {
            errors.add("driver: " + e.getMessage());
        }

        try {
            QueryResult queryResult = queryEngine.executeValidated("SELECT 1 AS test_column");
            result.put("query_test", true);
            result.set("query_result", objectMapper.valueToTree(queryResult.allRows()));
        } catch (QueryExecutionException e) {
            errors.add("query: " + e.getMessage());
        }

        try {
            List<String> tables = listTables();
            result.put("tables_test", true);
            result.put("tables_count", tables.size());
            result.set("sample_tables",
                    objectMapper.valueToTree(tables.subList(0, Math.min(SAMPLE_TABLE_COUNT, tables.size()))));
        } catch (PinotApiException e) {
            errors.add("tables: " + e.getMessage());
        }

        if (!errors.isEmpty()) {
            result.put("error", String.join("; ", errors));
            logger.error("Connection test failed: {}", errors);
        }
        return result;
    }

    private ObjectNode describeConfig() {
        FilterSet filterSet = accessValidator.getFilterStore().current();
        ObjectNode config = objectMapper.createObjectNode();
        config.put("broker_host", configParams.brokerHost());
        config.put("broker_port", configParams.brokerPort());
        config.put("broker_scheme", configParams.brokerScheme());
        config.put("controller_url", configParams.controllerUrl());
        config.put("database", configParams.database());
        config.put("use_msqe", configParams.useMsqe());
        config.put("has_token", configParams.token() != null || configParams.tokenFilename() != null);
        config.put("has_username", configParams.username() != null);
        config.put("table_filter", filterSet.isUnrestricted() ? "disabled" : filterSet.size() + " pattern(s)");
        ObjectNode timeouts = objectMapper.createObjectNode();
        timeouts.put("connection", configParams.connectionTimeoutSeconds());
        timeouts.put("request", configParams.requestTimeoutSeconds());
        timeouts.put("query", configParams.queryTimeoutSeconds());
        config.set("timeout_config", timeouts);
        return config;
    }

    static String stripTableTypeSuffix(String tableName) {
        for (String suffix : List.of("_OFFLINE", "_REALTIME")) {
            if (tableName.endsWith(suffix)) {
                return tableName.substring(0, tableName.length() - suffix.length());
            }
        }
        return tableName;
    }

    private static JsonNode parseJson(String json, String argumentName) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException(
                    ResourceManager.getErrorMessage(ResourceManager.ErrorMessages.ARGUMENT_MISSING, argumentName));
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(ResourceManager.getErrorMessage(
                    ResourceManager.ErrorMessages.ARGUMENT_INVALID_JSON, argumentName, e.getOriginalMessage()), e);
        }
    }

    private static String requiredField(JsonNode jsonNode, String fieldName, String argumentName) {
        JsonNode fieldNode = jsonNode.path(fieldName);
        if (!fieldNode.isTextual() || fieldNode.asText().isBlank()) {
            throw new IllegalArgumentException(argumentName + " must contain a non-empty '" + fieldName + "' field");
        }
        return fieldNode.asText();
    }

    public AccessValidator getAccessValidator() {
        return accessValidator;
    }

    public ConfigParams getConfigParams() {
        return configParams;
    }

    @Override
    public void close() {
        connectionManager.close();
        logger.info("Pinot client closed");
    }
}
