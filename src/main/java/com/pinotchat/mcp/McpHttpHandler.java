package com.pinotchat.mcp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * HTTP handler for MCP requests on {@code POST /mcp}.
 */
class McpHttpHandler implements HttpHandler {
    private static final Logger logger = LoggerFactory.getLogger(McpHttpHandler.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final McpServer mcpServer;

    McpHttpHandler(McpServer mcpServer) {
        this.mcpServer = mcpServer;
    }

    @Override
    public void handle(HttpExchange httpExchange) throws IOException {
        try {
            setCorsHeaders(httpExchange);

            if ("OPTIONS".equals(httpExchange.getRequestMethod())) {
                httpExchange.sendResponseHeaders(200, -1);
                return;
            }
            if (!"POST".equals(httpExchange.getRequestMethod())) {
                sendJson(httpExchange, 405, McpServer.createErrorResponse("invalid_request",
                        "Method not allowed. Use POST.", null));
                return;
            }

            String requestBody = readRequestBody(httpExchange);
            logger.debug("Received HTTP request: {}", SecurityUtils.truncateString(requestBody, 200));

            JsonNode requestNode;
            try {
                requestNode = objectMapper.readTree(requestBody);
            } catch (JsonProcessingException e) {
                sendJson(httpExchange, 400, McpServer.createErrorResponse("parse_error",
                        "Parse error: " + e.getOriginalMessage(), null));
                return;
            }
            if (requestNode == null || !requestNode.isObject()) {
                sendJson(httpExchange, 400, McpServer.createErrorResponse("invalid_request",
                        "Request body must be a JSON-RPC object", null));
                return;
            }

            JsonNode responseNode = mcpServer.handleRequest(requestNode);
            if (responseNode == null) {
                // Notification
                httpExchange.sendResponseHeaders(204, -1);
            } else {
                sendJson(httpExchange, 200, responseNode);
            }
        } finally {
            httpExchange.close();
        }
    }

    private static void setCorsHeaders(HttpExchange httpExchange) {
        httpExchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
        httpExchange.getResponseHeaders().set("Access-Control-Allow-Methods", "POST, OPTIONS");
        httpExchange.getResponseHeaders().set("Access-Control-Allow-Headers", "Content-Type");
    }

    static void sendJson(HttpExchange httpExchange, int statusCode, JsonNode bodyNode) throws IOException {
        byte[] responseBytes = objectMapper.writeValueAsBytes(bodyNode);
        httpExchange.getResponseHeaders().set("Content-Type", "application/json");
        httpExchange.sendResponseHeaders(statusCode, responseBytes.length);
        try (OutputStream outputStream = httpExchange.getResponseBody()) {
            outputStream.write(responseBytes);
        }
    }

    private static String readRequestBody(HttpExchange httpExchange) throws IOException {
        try (InputStream inputStream = httpExchange.getRequestBody()) {
            return new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
