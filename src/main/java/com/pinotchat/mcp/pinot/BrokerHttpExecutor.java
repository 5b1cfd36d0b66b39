package com.pinotchat.mcp.pinot;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pinotchat.mcp.SecurityUtils;
import com.pinotchat.mcp.config.ConfigParams;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Primary query path: a single stateless POST to the broker's {@code /query/sql} endpoint.
 * A transport error, a non-2xx status or a non-empty {@code exceptions} field is a failure.
 */
public class BrokerHttpExecutor {
    private static final Logger logger = LoggerFactory.getLogger(BrokerHttpExecutor.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final PinotRestClient restClient;

    public BrokerHttpExecutor(ConfigParams configParams) {
        this(new PinotRestClient(configParams));
    }

    BrokerHttpExecutor(PinotRestClient restClient) {
        this.restClient = restClient;
    }

    /**
     * Runs a query on the broker.
     *
     * @param query Query text, sent unmodified
     * @return Rows keyed by column name; empty when the response has no result table
     * @throws PinotApiException on any failure
     */
    public QueryResult execute(String query) throws PinotApiException {
        long startTime = System.currentTimeMillis();
        ConfigParams configParams = restClient.getConfigParams();
        String brokerUrl = configParams.brokerUrl() + "/" + PinotEndpoints.QUERY_SQL;
        logger.debug("Executing query via HTTP: {}", SecurityUtils.truncateString(query, 100));

        String responseBody = restClient.post(brokerUrl, buildPayload(query, configParams));

        JsonNode resultData;
        try {
            resultData = objectMapper.readTree(responseBody);
        } catch (JsonProcessingException e) {
            throw new PinotApiException("Broker returned invalid JSON: " + e.getOriginalMessage(), e);
        }
        if (resultData == null || !resultData.isObject()) {
            throw new PinotApiException("Broker returned an unexpected response: "
                    + SecurityUtils.truncateString(responseBody, 200), null);
        }

        JsonNode exceptions = resultData.path("exceptions");
        if (exceptions.isArray() && !exceptions.isEmpty()) {
            throw new PinotApiException("Query error: " + exceptions, null);
        }

        JsonNode resultTable = resultData.path("resultTable");
        if (resultTable.isMissingNode() || resultTable.isNull()) {
            logger.warn("No resultTable in response, returning empty result");
            return QueryResult.empty(System.currentTimeMillis() - startTime);
        }

        List<String> columns = new ArrayList<>();
        for (JsonNode columnName : resultTable.path("dataSchema").path("columnNames")) {
            columns.add(columnName.asText());
        }

        List<Map<String, Object>> rows = new ArrayList<>();
        for (JsonNode rowNode : resultTable.path("rows")) {
            Map<String, Object> row = new LinkedHashMap<>();
            Iterator<JsonNode> values = rowNode.elements();
            for (String column : columns) {
                if (!values.hasNext()) {
                    break;
                }
                row.put(column, objectMapper.convertValue(values.next(), Object.class));
            }
            rows.add(row);
        }

        logger.debug("HTTP query executed successfully, returned {} rows", rows.size());
        return new QueryResult(columns, rows, System.currentTimeMillis() - startTime);
    }

    static String buildPayload(String query, ConfigParams configParams) {
        String queryOptions = "timeoutMs=" + (configParams.queryTimeoutSeconds() * 1000L);
        if (configParams.useMsqe()) {
            queryOptions += ";useMultistageEngine=true";
        }
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("sql", query);
        payload.put("queryOptions", queryOptions);
        return payload.toString();
    }
}
