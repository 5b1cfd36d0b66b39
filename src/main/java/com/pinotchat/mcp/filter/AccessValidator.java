package com.pinotchat.mcp.filter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Checks queries and single table or schema names against the active allow-list.
 */
public class AccessValidator {
    private static final Logger logger = LoggerFactory.getLogger(AccessValidator.class);
    private static final Logger securityLogger = LoggerFactory.getLogger("SECURITY." + AccessValidator.class.getName());

    private final FilterStore filterStore;
    private final TableReferenceExtractor extractor;
    private final boolean failClosed;

    public AccessValidator(FilterStore filterStore) {
        this(filterStore, new RegexTableReferenceExtractor(), false);
    }

    /**
     * @param filterStore Source of the active allow-list
     * @param extractor Table reference extractor used for query text
     * @param failClosed Reject queries with no recognizable table reference while filtering is on
     */
    public AccessValidator(FilterStore filterStore, TableReferenceExtractor extractor, boolean failClosed) {
        if (filterStore == null || extractor == null) {
            throw new IllegalArgumentException("Filter store and extractor cannot be null");
        }
        this.filterStore = filterStore;
        this.extractor = extractor;
        this.failClosed = failClosed;
    }

    /**
     * Validates every table referenced by a query.
     *
     * @param query SQL text
     * @throws UnauthorizedAccessException listing every referenced table outside the allow-list
     */
    public void validateQuery(String query) {
        FilterSet filterSet = filterStore.current();
        if (filterSet.isUnrestricted()) {
            return;
        }

        Set<String> tableNames = extractor.extract(query);
        if (tableNames.isEmpty()) {
            if (failClosed) {
                logSecurityEvent("QUERY_REJECTED", "no table reference found while filtering is active");
                throw new UnauthorizedAccessException(List.of("<unknown>"), filterSet.patterns());
            }
            logger.debug("No table references found in query, allowing");
            return;
        }

        List<String> unauthorized = new ArrayList<>();
        for (String tableName : tableNames) {
            if (!filterSet.allows(tableName)) {
                unauthorized.add(tableName);
            }
        }
        if (!unauthorized.isEmpty()) {
            logSecurityEvent("QUERY_REJECTED", "tables=" + unauthorized);
            throw new UnauthorizedAccessException(unauthorized, filterSet.patterns());
        }
    }

    /**
     * Validates a single table or schema name.
     *
     * @param name Table or schema name
     * @throws UnauthorizedAccessException if the name is outside the allow-list
     */
    public void validateName(String name) {
        FilterSet filterSet = filterStore.current();
        if (!filterSet.allows(name)) {
            logSecurityEvent("NAME_REJECTED", "name=" + name);
            throw new UnauthorizedAccessException(List.of(String.valueOf(name)), filterSet.patterns());
        }
    }

    /**
     * @param name Table or schema name
     * @return true if the name is currently allowed
     */
    public boolean isAllowed(String name) {
        return filterStore.current().allows(name);
    }

    /**
     * Keeps only allowed names, preserving order.
     */
    public List<String> filterNames(List<String> names) {
        FilterSet filterSet = filterStore.current();
        if (filterSet.isUnrestricted()) {
            return names;
        }
        List<String> allowed = new ArrayList<>();
        for (String name : names) {
            if (filterSet.allows(name)) {
                allowed.add(name);
            }
        }
        return allowed;
    }

    public FilterStore getFilterStore() {
        return filterStore;
    }

    private void logSecurityEvent(String event, String details) {
        securityLogger.warn("SECURITY_EVENT: {} - {}", event, details);
    }
}
