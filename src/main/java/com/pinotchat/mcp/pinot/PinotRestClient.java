package com.pinotchat.mcp.pinot;

import com.pinotchat.mcp.config.ConfigParams;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * Sends JSON requests to the Pinot broker and controller with the configured authentication headers.
 * Credentials are resolved per request.
 */
class PinotRestClient {
    private static final Logger logger = LoggerFactory.getLogger(PinotRestClient.class);

    private final ConfigParams configParams;
    private final HttpClient httpClient;

    PinotRestClient(ConfigParams configParams) {
        this(configParams, HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(configParams.connectionTimeoutSeconds()))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build());
    }

    PinotRestClient(ConfigParams configParams, HttpClient httpClient) {
        this.configParams = configParams;
        this.httpClient = httpClient;
    }

    String get(String url) throws PinotApiException {
        return send("GET", url, null);
    }

    String post(String url, String body) throws PinotApiException {
        return send("POST", url, body);
    }

    String put(String url, String body) throws PinotApiException {
        return send("PUT", url, body);
    }

    /**
     * @return The response body of a 2xx response
     * @throws PinotApiException on transport failure or any other status
     */
    String send(String method, String url, String body) throws PinotApiException {
        URI requestUri;
        try {
            requestUri = URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new PinotApiException("Invalid URL " + url + ": " + e.getMessage(), e);
        }

        HttpRequest.Builder requestBuilder = HttpRequest.newBuilder()
                .uri(requestUri)
                .timeout(Duration.ofSeconds(configParams.requestTimeoutSeconds()));

        Map<String, String> headers = AuthCredentials.resolve(configParams).toHttpHeaders(configParams.database());
        headers.forEach(requestBuilder::header);

        HttpRequest.BodyPublisher publisher = body == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(body);
        requestBuilder.method(method, publisher);

        HttpResponse<String> response;
        try {
            response = httpClient.send(requestBuilder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            logger.error("HTTP request failed for {}: {}", url, e.getMessage());
            throw new PinotApiException("HTTP request failed for " + url + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PinotApiException("HTTP request interrupted for " + url, e);
        }

        int statusCode = response.statusCode();
        if (statusCode < 200 || statusCode >= 300) {
            logger.error("HTTP request to {} returned status {}", url, statusCode);
            throw new PinotApiException(url, statusCode, response.body());
        }
        return response.body();
    }

    ConfigParams getConfigParams() {
        return configParams;
    }
}
