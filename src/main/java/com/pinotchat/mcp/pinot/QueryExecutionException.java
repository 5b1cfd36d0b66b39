package com.pinotchat.mcp.pinot;

/**
 * Thrown when a query failed on both the broker HTTP path and the driver path.
 * The message contains both failure reasons.
 */
public class QueryExecutionException extends Exception {
    private final String httpError;
    private final String driverError;

    public QueryExecutionException(String httpError, String driverError, Throwable driverCause) {
        super(String.format("Query failed on both execution paths. HTTP: %s, Driver: %s", httpError, driverError),
                driverCause);
        this.httpError = httpError;
        this.driverError = driverError;
    }

    public String getHttpError() {
        return httpError;
    }

    public String getDriverError() {
        return driverError;
    }
}
