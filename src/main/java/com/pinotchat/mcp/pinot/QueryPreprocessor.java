package com.pinotchat.mcp.pinot;

import com.pinotchat.mcp.SecurityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites query text for the driver path: strips the configured database qualifier and appends a
 * timeout option when the query does not carry one.
 */
final class QueryPreprocessor {
    private static final Logger logger = LoggerFactory.getLogger(QueryPreprocessor.class);

    private QueryPreprocessor() {
    }

    /**
     * @param query Query text as submitted
     * @param database Configured database, empty for none
     * @param queryTimeoutSeconds Timeout used for the OPTION hint
     * @return The query to send through the driver
     */
    static String preprocess(String query, String database, int queryTimeoutSeconds) {
        String processed = query;
        if (database != null && !database.isEmpty() && processed.contains(database + ".")) {
            processed = processed.replace(database + ".", "");
            logger.debug("Removed database prefix, query now: {}", SecurityUtils.truncateString(processed, 100));
        }

        String upperQuery = processed.toUpperCase();
        if (!upperQuery.contains("SET TIMEOUTMS") && !upperQuery.contains("OPTION")) {
            long timeoutMs = queryTimeoutSeconds * 1000L;
            processed = stripTrailingSemicolons(processed.strip());
            processed = processed + " OPTION(timeoutMs=" + timeoutMs + ")";
            logger.debug("Added timeout option: {}ms", timeoutMs);
        }
        return processed;
    }

    private static String stripTrailingSemicolons(String query) {
        int end = query.length();
        while (end > 0 && query.charAt(end - 1) == ';') {
            end--;
        }
        return query.substring(0, end);
    }
}
