package com.pinotchat.mcp.pinot;

/**
 * Thrown when a Pinot REST call fails, either at the transport level or with a non-success status.
 */
public class PinotApiException extends Exception {
    private final int statusCode;
    private final String responseBody;

    public PinotApiException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
        this.responseBody = null;
    }

    public PinotApiException(String url, int statusCode, String responseBody) {
        super(String.format("Unexpected response status %d from %s: %s", statusCode, url, responseBody));
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    /**
     * @return HTTP status, or -1 when no response was received
     */
    public int getStatusCode() {
        return statusCode;
    }

    public String getResponseBody() {
        return responseBody;
    }
}
