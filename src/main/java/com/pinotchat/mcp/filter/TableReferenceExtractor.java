package com.pinotchat.mcp.filter;

import java.util.Set;

/**
 * Finds the table names a SQL statement reads from.
 * Implementations are best-effort: they never throw and return an empty set when
 * nothing recognizable is found. Schema and database qualifiers are stripped.
 */
public interface TableReferenceExtractor {
    /**
     * Extracts the bare table names referenced by a query.
     *
     * @param query Raw SQL text (may be null)
     * @return De-duplicated table names in order of first appearance, case preserved
     */
    Set<String> extract(String query);
}
