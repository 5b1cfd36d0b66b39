package com.pinotchat.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pinotchat.mcp.filter.FilterSet;
import com.pinotchat.mcp.pinot.PinotApiException;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;

import java.io.IOException;

/**
 * Health check handler on {@code GET /health}. Reports controller reachability and the filter mode.
 */
class HealthCheckHandler implements HttpHandler {
    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final McpServer mcpServer;

    HealthCheckHandler(McpServer mcpServer) {
        this.mcpServer = mcpServer;
    }

    @Override
    public void handle(HttpExchange httpExchange) throws IOException {
        try {
            ObjectNode healthResponse = objectMapper.createObjectNode();
            healthResponse.put("status", "healthy");
            healthResponse.put("server", "Pinot MCP Server");
            healthResponse.put("timestamp", System.currentTimeMillis());
            healthResponse.put("state", mcpServer.getServerState());

            FilterSet filterSet = mcpServer.pinotClient.getAccessValidator().getFilterStore().current();
            healthResponse.put("table_filter", filterSet.isUnrestricted() ? "disabled" : filterSet.size() + " pattern(s)");

            try {
                mcpServer.pinotClient.listTables();
                healthResponse.put("controller", "connected");
            } catch (PinotApiException e) {
                healthResponse.put("controller", "error: " + e.getMessage());
            }

            McpHttpHandler.sendJson(httpExchange, 200, healthResponse);
        } finally {
            httpExchange.close();
        }
    }
}
