package com.pinotchat.mcp.pinot;

import com.pinotchat.mcp.SecurityUtils;
import com.pinotchat.mcp.filter.AccessValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;

/**
 * Validates a query against the allow-list, then runs it on the broker over HTTP and falls back
 * to the driver connection when that fails. Nothing is retried beyond the single fallback.
 */
public class PinotQueryEngine {
    private static final Logger logger = LoggerFactory.getLogger(PinotQueryEngine.class);

    private final AccessValidator accessValidator;
    private final BrokerHttpExecutor httpExecutor;
    private final DriverQueryExecutor driverExecutor;

    public PinotQueryEngine(AccessValidator accessValidator, BrokerHttpExecutor httpExecutor,
                            DriverQueryExecutor driverExecutor) {
        this.accessValidator = accessValidator;
        this.httpExecutor = httpExecutor;
        this.driverExecutor = driverExecutor;
    }

    /**
     * Executes a read query.
     *
     * @param query SQL text
     * @return Rows from whichever path succeeded first
     * @throws com.pinotchat.mcp.filter.UnauthorizedAccessException if the query references a table
     *         outside the allow-list; no network call is made in that case
     * @throws QueryExecutionException if both paths fail
     */
    public QueryResult execute(String query) throws QueryExecutionException {
        accessValidator.validateQuery(query);
        return executeValidated(query);
    }

    /**
     * Runs the two execution paths without consulting the allow-list. Used for queries that
     * reference no table, such as connection diagnostics.
     */
    QueryResult executeValidated(String query) throws QueryExecutionException {
        logger.debug("Executing query: {}", SecurityUtils.truncateString(query, 100));

        String httpError;
        try {
            return httpExecutor.execute(query);
        } catch (PinotApiException | RuntimeException e) {
            httpError = describe(e);
            logger.warn("HTTP query failed: {}, trying driver fallback", httpError);
        }

        try {
            return driverExecutor.execute(query);
        } catch (SQLException | RuntimeException e) {
            String driverError = describe(e);
            logger.error("Both HTTP and driver queries failed. HTTP: {}, Driver: {}", httpError, driverError);
            throw new QueryExecutionException(httpError, driverError, e);
        }
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
