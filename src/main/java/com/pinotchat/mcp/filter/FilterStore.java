package com.pinotchat.mcp.filter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Holds the active table allow-list and replaces it atomically on reload.
 *
 * <p>The filter source is a YAML document with an {@code included_tables} list of glob patterns:
 * <pre>
 * included_tables:
 *   - prod_*
 *   - events_20??
 * </pre>
 * A missing or empty list means no filtering. Readers never block: {@link #current()} returns
 * whichever revision was published last. Reloads are serialized by a single lock and publish
 * the new revision only after it has been parsed completely, so a failed reload leaves the
 * previous revision untouched.
 */
public class FilterStore {
    private static final Logger logger = LoggerFactory.getLogger(FilterStore.class);
    private static final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    static final String INCLUDED_TABLES_KEY = "included_tables";

    private final ReentrantLock reloadLock = new ReentrantLock();
    private volatile FilterSet activeFilterSet;

    /**
     * Creates a store with filtering disabled.
     */
    public FilterStore() {
        this(FilterSet.unrestricted());
    }

    /**
     * Creates a store with an initial revision.
     *
     * @param initialFilterSet The revision to start with
     */
    public FilterStore(FilterSet initialFilterSet) {
        if (initialFilterSet == null) {
            throw new IllegalArgumentException("Initial filter set cannot be null");
        }
        this.activeFilterSet = initialFilterSet;
    }

    /**
     * Creates a store from a filter file, or an unrestricted store when no file is configured.
     *
     * @param sourcePath Path to the YAML filter file (null or blank for no filtering)
     * @return A populated filter store
     * @throws ConfigurationException if the configured file is missing or malformed
     */
    public static FilterStore fromFile(String sourcePath) throws ConfigurationException {
        if (sourcePath == null || sourcePath.isBlank()) {
            logger.debug("No table filter file specified");
            return new FilterStore();
        }
        FilterStore filterStore = new FilterStore();
        filterStore.reload(sourcePath);
        return filterStore;
    }

    /**
     * @return The active revision, never a partially updated one
     */
    public FilterSet current() {
        return activeFilterSet;
    }

    /**
     * Reads the filter source and makes it the active revision.
     *
     * @param sourcePath Path to the YAML filter file
     * @return Pattern counts before and after the reload
     * @throws ConfigurationException if the file does not exist or cannot be parsed; the
     *         active revision is unchanged in that case
     */
    public ReloadResult reload(String sourcePath) throws ConfigurationException {
        reloadLock.lock();
        try {
            FilterSet newFilterSet = parse(sourcePath);
            FilterSet oldFilterSet = activeFilterSet;
            activeFilterSet = newFilterSet;

            if (newFilterSet.isUnrestricted()) {
                logger.info("Table filter set but no tables listed, including all tables.");
            } else {
                logger.info("{} table pattern(s) active after reloading {}", newFilterSet.size(), sourcePath);
            }
            return new ReloadResult(oldFilterSet.size(), newFilterSet.size(), newFilterSet.isUnrestricted());
        } finally {
            reloadLock.unlock();
        }
    }

    /**
     * Parses a filter file without touching the active revision.
     *
     * @param sourcePath Path to the YAML filter file
     * @return The parsed revision
     * @throws ConfigurationException if the file is missing, unreadable or malformed
     */
    static FilterSet parse(String sourcePath) throws ConfigurationException {
        if (sourcePath == null || sourcePath.isBlank()) {
            throw new ConfigurationException("Table filter file path cannot be empty");
        }

        Path filterPath = Paths.get(sourcePath);
        if (!Files.exists(filterPath)) {
            throw new ConfigurationException(String.format(
                    "Table filter file not found: %s. Please check PINOT_TABLE_FILTER_FILE configuration.", sourcePath));
        }
        if (!Files.isRegularFile(filterPath)) {
            throw new ConfigurationException("Table filter path is not a file: " + sourcePath);
        }

        JsonNode rootNode;
        try {
            rootNode = yamlMapper.readTree(filterPath.toFile());
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Invalid YAML syntax in " + sourcePath + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read filter file " + sourcePath + ": " + e.getMessage(), e);
        }

        if (rootNode == null || rootNode.isMissingNode() || rootNode.isNull()) {
            logger.warn("Empty table filter configuration file: {}", sourcePath);
            return FilterSet.unrestricted();
        }
        if (!rootNode.isObject()) {
            throw new ConfigurationException("Table filter file must contain a mapping with '"
                    + INCLUDED_TABLES_KEY + "': " + sourcePath);
        }

        JsonNode includedTables = rootNode.path(INCLUDED_TABLES_KEY);
        if (includedTables.isMissingNode() || includedTables.isNull()) {
            return FilterSet.unrestricted();
        }
        if (!includedTables.isArray()) {
            throw new ConfigurationException("'" + INCLUDED_TABLES_KEY + "' must be a list of table patterns in "
                    + sourcePath);
        }

        List<String> patterns = new ArrayList<>();
        for (JsonNode patternNode : includedTables) {
            if (!patternNode.isTextual() || patternNode.asText().isBlank()) {
                throw new ConfigurationException(String.format(
                        "Invalid table pattern %s in %s: patterns must be non-empty strings", patternNode, sourcePath));
            }
            patterns.add(patternNode.asText().trim());
        }
        return FilterSet.of(patterns);
    }
}
