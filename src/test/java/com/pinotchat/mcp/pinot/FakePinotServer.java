package com.pinotchat.mcp.pinot;

import com.sun.net.httpserver.Headers;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-process stand-in for a Pinot broker or controller. Responses are keyed by
 * "METHOD /path?query"; unknown keys answer 404.
 */
class FakePinotServer implements AutoCloseable {
    record RecordedRequest(String method, String pathAndQuery, Headers headers, String body) {
    }

    private record CannedResponse(int status, String body) {
    }

    private final HttpServer httpServer;
    private final Map<String, CannedResponse> responses = new ConcurrentHashMap<>();
    private final List<RecordedRequest> requests = new CopyOnWriteArrayList<>();

    FakePinotServer() throws IOException {
        httpServer = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
        httpServer.createContext("/", this::handle);
        httpServer.start();
    }

    FakePinotServer respond(String method, String pathAndQuery, int status, String body) {
        responses.put(method + " " + pathAndQuery, new CannedResponse(status, body));
        return this;
    }

    int port() {
        return httpServer.getAddress().getPort();
    }

    String baseUrl() {
        return "http://localhost:" + port();
    }

    List<RecordedRequest> requests() {
        return requests;
    }

    RecordedRequest lastRequest() {
        return requests.get(requests.size() - 1);
    }

    private void handle(HttpExchange exchange) throws IOException {
        try {
            String pathAndQuery = exchange.getRequestURI().getRawPath()
                    + (exchange.getRequestURI().getRawQuery() != null ? "?" + exchange.getRequestURI().getRawQuery() : "");
            String body;
            try (InputStream inputStream = exchange.getRequestBody()) {
                body = new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
            }
            requests.add(new RecordedRequest(exchange.getRequestMethod(), pathAndQuery, exchange.getRequestHeaders(), body));

            CannedResponse response = responses.getOrDefault(exchange.getRequestMethod() + " " + pathAndQuery,
                    new CannedResponse(404, "{\"code\":404,\"error\":\"not found\"}"));
            byte[] bytes = response.body().getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(response.status(), bytes.length == 0 ? -1 : bytes.length);
            if (bytes.length > 0) {
                try (OutputStream outputStream = exchange.getResponseBody()) {
                    outputStream.write(bytes);
                }
            }
        } finally {
            exchange.close();
        }
    }

    @Override
    public void close() {
        httpServer.stop(0);
    }
}
