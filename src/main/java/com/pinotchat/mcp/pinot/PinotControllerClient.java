package com.pinotchat.mcp.pinot;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pinotchat.mcp.config.ConfigParams;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Thin client for the Pinot controller REST API. Performs no access checks of its own.
 */
public class PinotControllerClient {
    private static final Logger logger = LoggerFactory.getLogger(PinotControllerClient.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static final String[] TABLE_TYPE_SUFFIXES = {"REALTIME", "OFFLINE"};

    private final PinotRestClient restClient;
    private final String controllerUrl;

    public PinotControllerClient(ConfigParams configParams) {
        this(new PinotRestClient(configParams));
    }

    PinotControllerClient(PinotRestClient restClient) {
        this.restClient = restClient;
        this.controllerUrl = restClient.getConfigParams().controllerUrl();
    }

    public List<String> listTables() throws PinotApiException {
        JsonNode response = getJson(PinotEndpoints.TABLES);
        List<String> tables = new ArrayList<>();
        for (JsonNode tableNode : response.path("tables")) {
            tables.add(tableNode.asText());
        }
        return tables;
    }

    public JsonNode getTableSize(String tableName) throws PinotApiException {
        return getJson(String.format(PinotEndpoints.TABLE_SIZE_API_TEMPLATE, encode(tableName)));
    }

    public JsonNode getSegments(String tableName) throws PinotApiException {
        return getJson(String.format(PinotEndpoints.SEGMENTS_API_TEMPLATE, encode(tableName)));
    }

    public JsonNode getSegmentMetadata(String tableName) throws PinotApiException {
        return getJson(String.format(PinotEndpoints.SEGMENT_METADATA_API_TEMPLATE, encode(tableName)));
    }

    /**
     * Looks the segment up under the realtime table first, then the offline one.
     *
     * @throws PinotApiException if neither table type has the segment
     */
    public JsonNode getIndexColumnDetails(String tableName, String segmentName) throws PinotApiException {
        PinotApiException lastFailure = null;
        for (String typeSuffix : TABLE_TYPE_SUFFIXES) {
            String path = String.format(PinotEndpoints.SEGMENT_DETAIL_API_TEMPLATE,
                    encode(tableName), typeSuffix, encode(segmentName));
            try {
                return getJson(path);
            } catch (PinotApiException e) {
                logger.debug("Index column details not found under {}: {}", typeSuffix, e.getMessage());
                lastFailure = e;
            }
        }
        throw new PinotApiException("Index column detail not found for segment " + segmentName
                + " of table " + tableName, lastFailure);
    }

    public JsonNode getTableConfigs(String tableName) throws PinotApiException {
        return getJson(String.format(PinotEndpoints.TABLE_CONFIGS_API_TEMPLATE, encode(tableName)));
    }

    public JsonNode getSchema(String schemaName) throws PinotApiException {
        return getJson(String.format(PinotEndpoints.SCHEMA_API_TEMPLATE, encode(schemaName)));
    }

    public JsonNode createSchema(String schemaJson, boolean override, boolean force) throws PinotApiException {
        String url = controllerUrl + "/" + PinotEndpoints.SCHEMAS + "?override=" + override + "&force=" + force;
        return toJson(restClient.post(url, schemaJson));
    }

    public JsonNode updateSchema(String schemaName, String schemaJson, boolean reload, boolean force)
            throws PinotApiException {
        String url = controllerUrl + "/" + String.format(PinotEndpoints.SCHEMA_API_TEMPLATE, encode(schemaName))
                + "?reload=" + reload + "&force=" + force;
        return toJson(restClient.put(url, schemaJson));
    }

    /**
     * Fetches a table config, narrowed to the requested table type section when one is given.
     */
    public JsonNode getTableConfig(String tableName, String tableType) throws PinotApiException {
        String path = String.format(PinotEndpoints.TABLE_API_TEMPLATE, encode(tableName));
        if (tableType != null && !tableType.isBlank()) {
            String normalizedType = tableType.trim().toUpperCase();
            JsonNode response = getJson(path + "?type=" + encode(normalizedType));
            JsonNode typedSection = response.path(normalizedType);
            return typedSection.isMissingNode() ? response : typedSection;
        }
        return getJson(path);
    }

    public JsonNode createTableConfig(String tableConfigJson, String validationTypesToSkip) throws PinotApiException {
        String url = controllerUrl + "/" + PinotEndpoints.TABLES + validationQuery(validationTypesToSkip);
        return toJson(restClient.post(url, tableConfigJson));
    }

    public JsonNode updateTableConfig(String tableName, String tableConfigJson, String validationTypesToSkip)
            throws PinotApiException {
        String url = controllerUrl + "/" + String.format(PinotEndpoints.TABLE_API_TEMPLATE, encode(tableName))
                + validationQuery(validationTypesToSkip);
        return toJson(restClient.put(url, tableConfigJson));
    }

    private JsonNode getJson(String path) throws PinotApiException {
        String url = controllerUrl + "/" + path;
        logger.debug("Fetching {}", url);
        return toJson(restClient.get(url));
    }

    /**
     * Parses a controller response; plain-text bodies are wrapped in a success envelope.
     */
    static JsonNode toJson(String responseBody) {
        if (responseBody == null || responseBody.isBlank()) {
            ObjectNode envelope = objectMapper.createObjectNode();
            envelope.put("status", "success");
            envelope.put("message", "Request completed with an empty response");
            return envelope;
        }
        try {
            return objectMapper.readTree(responseBody);
        } catch (JsonProcessingException e) {
            ObjectNode envelope = objectMapper.createObjectNode();
            envelope.put("status", "success");
            envelope.put("message", "Controller returned a non-JSON response");
            envelope.put("response_body", responseBody);
            return envelope;
        }
    }

    private static String validationQuery(String validationTypesToSkip) {
        if (validationTypesToSkip == null || validationTypesToSkip.isBlank()) {
            return "";
        }
        return "?validationTypesToSkip=" + encode(validationTypesToSkip.trim());
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
