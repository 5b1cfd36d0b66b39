package com.pinotchat.mcp;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Tools exposed through {@code tools/list} and dispatched by {@code tools/call}.
 */
public enum ToolKind {
    TEST_CONNECTION("test_connection",
            "Test the Pinot connection and return diagnostics: configuration summary without secrets, "
                    + "driver probe, a SELECT 1 through the query engine and a sample of tables."),
    READ_QUERY("read_query",
            "Execute a read-only SELECT query on Pinot. Every table the query references must be allowed "
                    + "by the table filter.",
            ToolArgument.required("query", "string", "SQL SELECT (or WITH) query to execute")),
    LIST_TABLES("list_tables",
            "List the Pinot tables allowed by the table filter."),
    TABLE_DETAILS("table_details",
            "Get table size details.",
            ToolArgument.required("tableName", "string", "Table name")),
    SEGMENT_LIST("segment_list",
            "List segments for a table.",
            ToolArgument.required("tableName", "string", "Table name")),
    SEGMENT_METADATA_DETAILS("segment_metadata_details",
            "Get metadata for the segments of a table.",
            ToolArgument.required("tableName", "string", "Table name")),
    INDEX_COLUMN_DETAILS("index_column_details",
            "Get index and column details for a segment. The REALTIME table is tried before the OFFLINE one.",
            ToolArgument.required("tableName", "string", "Table name without type suffix"),
            ToolArgument.required("segmentName", "string", "Segment name")),
    TABLECONFIG_SCHEMA_DETAILS("tableconfig_schema_details",
            "Get the table config and schema of a table.",
            ToolArgument.required("tableName", "string", "Table name")),
    GET_SCHEMA("get_schema",
            "Fetch a schema by name.",
            ToolArgument.required("schemaName", "string", "Schema name")),
    CREATE_SCHEMA("create_schema",
            "Create a new schema. The schemaName inside the JSON must be allowed by the table filter.",
            ToolArgument.required("schemaJson", "string", "Schema definition as a JSON string"),
            ToolArgument.optional("override", "boolean", "Override an existing schema (default true)"),
            ToolArgument.optional("force", "boolean", "Force the operation (default false)")),
    UPDATE_SCHEMA("update_schema",
            "Update an existing schema.",
            ToolArgument.required("schemaName", "string", "Schema name"),
            ToolArgument.required("schemaJson", "string", "Schema definition as a JSON string"),
            ToolArgument.optional("reload", "boolean", "Reload the table after the update (default false)"),
            ToolArgument.optional("force", "boolean", "Force the operation (default false)")),
    GET_TABLE_CONFIG("get_table_config",
            "Get the configuration of a table, optionally narrowed to OFFLINE or REALTIME.",
            ToolArgument.required("tableName", "string", "Table name"),
            ToolArgument.optional("tableType", "string", "OFFLINE or REALTIME")),
    CREATE_TABLE_CONFIG("create_table_config",
            "Create a table configuration. The tableName inside the JSON must be allowed by the table filter.",
            ToolArgument.required("tableConfigJson", "string", "Table configuration as a JSON string"),
            ToolArgument.optional("validationTypesToSkip", "string", "Validation types to skip, e.g. ALL")),
    UPDATE_TABLE_CONFIG("update_table_config",
            "Update a table configuration.",
            ToolArgument.required("tableName", "string", "Table name"),
            ToolArgument.required("tableConfigJson", "string", "Table configuration as a JSON string"),
            ToolArgument.optional("validationTypesToSkip", "string", "Validation types to skip, e.g. ALL")),
    RELOAD_TABLE_FILTERS("reload_table_filters",
            "Reload the table filter allow-list without restarting the server.",
            ToolArgument.optional("filePath", "string",
                    "Filter file to load; defaults to PINOT_TABLE_FILTER_FILE"));

    private final String toolName;
    private final String description;
    private final List<ToolArgument> arguments;

    ToolKind(String toolName, String description, ToolArgument... arguments) {
        this.toolName = toolName;
        this.description = description;
        this.arguments = List.of(arguments);
    }

    public String toolName() {
        return toolName;
    }

    public String description() {
        return description;
    }

    public List<ToolArgument> arguments() {
        return arguments;
    }

    public static Optional<ToolKind> fromToolName(String toolName) {
        return Arrays.stream(values())
                .filter(kind -> kind.toolName.equals(toolName))
                .findFirst();
    }

    /**
     * One property of a tool's input schema.
     */
    public record ToolArgument(String name, String type, String description, boolean required) {
        static ToolArgument required(String name, String type, String description) {
            return new ToolArgument(name, type, description, true);
        }

        static ToolArgument optional(String name, String type, String description) {
            return new ToolArgument(name, type, description, false);
        }
    }
}
