package com.pinotchat.mcp.pinot;

import java.util.List;
import java.util.Map;

/**
 * Immutable result of a Pinot query.
 *
 * @param allColumns Column names in result order
 * @param allRows Rows keyed by column name, iteration order matching {@code allColumns}
 * @param executionTimeMs Wall-clock time spent on the path that produced the result
 */
public record QueryResult(List<String> allColumns, List<Map<String, Object>> allRows, long executionTimeMs) {
    public QueryResult {
        if (allColumns == null) {
            throw new IllegalArgumentException("Columns cannot be null");
        }
        if (allRows == null) {
            throw new IllegalArgumentException("Rows cannot be null");
        }
        if (executionTimeMs < 0) {
            throw new IllegalArgumentException("Execution time cannot be negative");
        }
        allColumns = List.copyOf(allColumns);
        allRows = List.copyOf(allRows);
    }

    public static QueryResult empty(long executionTimeMs) {
        return new QueryResult(List.of(), List.of(), executionTimeMs);
    }

    public int rowCount() {
        return allRows.size();
    }

    public boolean isEmpty() {
        return allRows.isEmpty();
    }
}
