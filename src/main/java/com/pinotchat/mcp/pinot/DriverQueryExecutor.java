package com.pinotchat.mcp.pinot;

import com.pinotchat.mcp.SecurityUtils;
import com.pinotchat.mcp.config.ConfigParams;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fallback query path over the managed driver connection.
 * Each query leases the shared connection; a failed query invalidates it so the next query
 * starts from a fresh one.
 */
public class DriverQueryExecutor {
    private static final Logger logger = LoggerFactory.getLogger(DriverQueryExecutor.class);

    private final ConnectionManager connectionManager;
    private final String database;
    private final int queryTimeoutSeconds;

    public DriverQueryExecutor(ConnectionManager connectionManager, ConfigParams configParams) {
        this(connectionManager, configParams.database(), configParams.queryTimeoutSeconds());
    }

    DriverQueryExecutor(ConnectionManager connectionManager, String database, int queryTimeoutSeconds) {
        this.connectionManager = connectionManager;
        this.database = database;
        this.queryTimeoutSeconds = queryTimeoutSeconds;
    }

    /**
     * @param query Query text as submitted; rewritten by {@link QueryPreprocessor} before execution
     * @return Rows keyed by column label
     * @throws SQLException if the connection or the query fails
     */
    public QueryResult execute(String query) throws SQLException {
        long startTime = System.currentTimeMillis();
        String finalQuery = QueryPreprocessor.preprocess(query, database, queryTimeoutSeconds);
        logger.debug("Executing query via driver: {}", SecurityUtils.truncateString(finalQuery, 100));

        Connection dbConn = connectionManager.acquire();
        try (Statement statement = dbConn.createStatement()) {
            applyQueryTimeout(statement);
            try (ResultSet resultSet = statement.executeQuery(finalQuery)) {
                QueryResult queryResult = materialize(resultSet, startTime);
                logger.debug("Driver query executed successfully, returned {} rows", queryResult.rowCount());
                return queryResult;
            }
        } catch (SQLException | RuntimeException e) {
            logger.error("Driver query execution failed: {}", e.getMessage());
            connectionManager.invalidate(dbConn);
            throw e;
        } finally {
            connectionManager.release(dbConn);
        }
    }

    private void applyQueryTimeout(Statement statement) throws SQLException {
        try {
            statement.setQueryTimeout(queryTimeoutSeconds);
        } catch (SQLFeatureNotSupportedException e) {
            // The OPTION hint in the query text still applies
            logger.debug("Driver does not support statement timeouts: {}", e.getMessage());
        }
    }

    static QueryResult materialize(ResultSet resultSet, long startTime) throws SQLException {
        ResultSetMetaData metaData = resultSet.getMetaData();
        int columnCount = metaData.getColumnCount();

        List<String> columns = new ArrayList<>(columnCount);
        for (int i = 1; i <= columnCount; i++) {
            columns.add(metaData.getColumnLabel(i));
        }

        List<Map<String, Object>> rows = new ArrayList<>();
        while (resultSet.next()) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 1; i <= columnCount; i++) {
                row.put(columns.get(i - 1), resultSet.getObject(i));
            }
            rows.add(row);
        }
        return new QueryResult(columns, rows, System.currentTimeMillis() - startTime);
    }
}
