package com.pinotchat.mcp.pinot;

/**
 * Relative paths of the Pinot broker and controller REST APIs.
 */
final class PinotEndpoints {
    static final String QUERY_SQL = "query/sql";

    static final String TABLES = "tables";
    static final String TABLE_API_TEMPLATE = "tables/%s";
    static final String TABLE_SIZE_API_TEMPLATE = "tables/%s/size";
    static final String SEGMENTS_API_TEMPLATE = "segments/%s";
    static final String SEGMENT_METADATA_API_TEMPLATE = "segments/%s/metadata";
    static final String SEGMENT_DETAIL_API_TEMPLATE = "segments/%s_%s/%s/metadata?columns=*";
    static final String TABLE_CONFIGS_API_TEMPLATE = "tableConfigs/%s";
    static final String SCHEMAS = "schemas";
    static final String SCHEMA_API_TEMPLATE = "schemas/%s";

    private PinotEndpoints() {
    }
}
