package com.pinotchat.mcp.config;

/**
 * Pinot connection and server configuration.
 * Immutable, validated on construction, secrets masked in {@link #toString()}.
 *
 * @param controllerUrl Base URL of the Pinot controller (e.g. "http://localhost:9000")
 * @param brokerHost Broker host name
 * @param brokerPort Broker port
 * @param brokerScheme Broker scheme, "http" or "https"
 * @param username Basic auth user name (may be null)
 * @param password Basic auth password (may be null)
 * @param token Authorization header value sent verbatim (may be null)
 * @param tokenFilename File holding the token, re-read whenever credentials are resolved (may be null)
 * @param database Pinot database name, empty for the default database
 * @param useMsqe Whether queries run on the multi-stage engine
 * @param requestTimeoutSeconds HTTP read timeout
 * @param connectionTimeoutSeconds HTTP connect timeout
 * @param queryTimeoutSeconds Query timeout hint passed to the broker
 * @param tableFilterFile YAML allow-list file (may be null for no filtering)
 * @param filterFailClosed Whether queries without a recognizable table reference are denied while filtering
 * @param jdbcDriver Driver class used by the fallback query path
 * @param jdbcUrl Driver URL used by the fallback query path
 * @param maxQueryLength Maximum accepted query length
 */
public record ConfigParams(
        String controllerUrl,
        String brokerHost,
        int brokerPort,
        String brokerScheme,
        String username,
        String password,
        String token,
        String tokenFilename,
        String database,
        boolean useMsqe,
        int requestTimeoutSeconds,
        int connectionTimeoutSeconds,
        int queryTimeoutSeconds,
        String tableFilterFile,
        boolean filterFailClosed,
        String jdbcDriver,
        String jdbcUrl,
        int maxQueryLength
) {
    public static final String DEFAULT_CONTROLLER_URL = "http://localhost:9000";
    public static final String DEFAULT_BROKER_HOST = "localhost";
    public static final int DEFAULT_BROKER_PORT = 8000;
    public static final String DEFAULT_BROKER_SCHEME = "http";
    public static final String DEFAULT_JDBC_DRIVER = "org.apache.pinot.client.PinotDriver";
    public static final int DEFAULT_TIMEOUT_SECONDS = 60;
    public static final int DEFAULT_MAX_QUERY_LENGTH = 10000;

    public ConfigParams {
        if (controllerUrl == null || controllerUrl.trim().isEmpty()) {
            throw new IllegalArgumentException("Controller URL cannot be null or empty");
        }
        if (brokerHost == null || brokerHost.trim().isEmpty()) {
            throw new IllegalArgumentException("Broker host cannot be null or empty");
        }
        if (brokerPort <= 0 || brokerPort > 65535) {
            throw new IllegalArgumentException("Broker port must be between 1 and 65535");
        }
        if (!"http".equals(brokerScheme) && !"https".equals(brokerScheme)) {
            throw new IllegalArgumentException("Broker scheme must be http or https");
        }
        if (requestTimeoutSeconds <= 0 || connectionTimeoutSeconds <= 0) {
            throw new IllegalArgumentException("Request and connection timeouts must be positive");
        }
        if (queryTimeoutSeconds <= 0) {
            throw new IllegalArgumentException("Query timeout must be positive");
        }
        if (jdbcDriver == null || jdbcDriver.trim().isEmpty()) {
            throw new IllegalArgumentException("JDBC driver cannot be null or empty");
        }
        if (maxQueryLength <= 0) {
            throw new IllegalArgumentException("Max query length must be positive");
        }
        if (controllerUrl.endsWith("/")) {
            controllerUrl = controllerUrl.substring(0, controllerUrl.length() - 1);
        }
        if (database == null) {
            database = "";
        }
        if (jdbcUrl == null || jdbcUrl.isBlank()) {
            jdbcUrl = deriveJdbcUrl(controllerUrl, brokerHost, brokerPort);
        }
    }

    /**
     * Creates a configuration for a local cluster with every optional setting at its default.
     *
     * @param controllerUrl Controller base URL
     * @param brokerHost Broker host
     * @param brokerPort Broker port
     * @return A ConfigParams instance with default settings
     */
    public static ConfigParams defaultConfig(String controllerUrl, String brokerHost, int brokerPort) {
        return new ConfigParams(
                controllerUrl, brokerHost, brokerPort, DEFAULT_BROKER_SCHEME,
                null, null, null, null, "", false,
                DEFAULT_TIMEOUT_SECONDS, DEFAULT_TIMEOUT_SECONDS, DEFAULT_TIMEOUT_SECONDS,
                null, false, DEFAULT_JDBC_DRIVER, null, DEFAULT_MAX_QUERY_LENGTH
        );
    }

    /**
     * @return Broker base URL, e.g. "http://localhost:8000"
     */
    public String brokerUrl() {
        return brokerScheme + "://" + brokerHost + ":" + brokerPort;
    }

    public boolean hasDatabase() {
        return !database.isEmpty();
    }

    public boolean hasTableFilter() {
        return tableFilterFile != null && !tableFilterFile.isBlank();
    }

    /**
     * Builds {@code jdbc:pinot://<controller host:port>?brokers=<broker host:port>}.
     */
    static String deriveJdbcUrl(String controllerUrl, String brokerHost, int brokerPort) {
        String controllerAddress = controllerUrl.replaceFirst("^[a-zA-Z][a-zA-Z0-9+.-]*://", "");
        int pathStart = controllerAddress.indexOf('/');
        if (pathStart >= 0) {
            controllerAddress = controllerAddress.substring(0, pathStart);
        }
        return "jdbc:pinot://" + controllerAddress + "?brokers=" + brokerHost + ":" + brokerPort;
    }

    /**
     * Masks credentials in URLs and secret-looking values for logging.
     *
     * @param inputValue Value that may contain a secret
     * @return The value with secret parts replaced by "***"
     */
    static String maskSensitive(String inputValue) {
        if (inputValue == null || inputValue.trim().isEmpty()) {
            return inputValue;
        }

        String maskedValue = inputValue.replaceAll("(?i)(password|pwd|token)=([^;&]+)", "$1=***");
        maskedValue = maskedValue.replaceAll("://([^:/]+):([^@]+)@", "://$1:***@");

        if (inputValue.length() > 8 && !inputValue.contains("://") && !inputValue.contains("=")) {
            maskedValue = inputValue.substring(0, 2) + "***" + inputValue.substring(inputValue.length() - 2);
        }
        return maskedValue;
    }

    @Override
    public String toString() {
        return String.format("PinotConfig{controller='%s', broker='%s', username='%s', password='%s', token='%s', "
                        + "database='%s', useMsqe=%s, tableFilterFile='%s', jdbcUrl='%s'}",
                maskSensitive(controllerUrl), brokerUrl(), username,
                password == null ? null : "***",
                token == null ? null : maskSensitive(token),
                database, useMsqe, tableFilterFile, maskSensitive(jdbcUrl));
    }
}
