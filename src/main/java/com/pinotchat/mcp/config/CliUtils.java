package com.pinotchat.mcp.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.FileReader;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.sql.Driver;
import java.sql.DriverManager;
import java.util.Enumeration;
import java.util.HashMap;
import java.util.Map;

/**
 * Utility class for handling command line interface operations.
 * Provides argument parsing, help display, version information and configuration loading.
 */
public class CliUtils {
    private static final Logger logger = LoggerFactory.getLogger(CliUtils.class);
    public static final String SERVER_NAME = "PinotChat";
    public static final String SERVER_VERSION = "1.0.0";
    public static final String SERVER_DESCRIPTION = "MCP server for Apache Pinot with table allow-list enforcement";
    public static final String PROTOCOL_VERSION = "2025-06-18";

    private CliUtils() {
    }

    /**
     * Maps short form arguments to their long form equivalents.
     *
     * @return Map of short form to long form argument names
     */
    static Map<String, String> getShortFormMapping() {
        Map<String, String> shortToLong = new HashMap<>();

        shortToLong.put("h", "help");
        shortToLong.put("v", "version");

        // Server mode
        shortToLong.put("c", "config_file");
        shortToLong.put("m", "http_mode");
        shortToLong.put("b", "bind_address");
        shortToLong.put("p", "http_port");

        // Pinot cluster
        shortToLong.put("C", "pinot_controller_url");
        shortToLong.put("B", "pinot_broker_url");
        shortToLong.put("H", "pinot_broker_host");
        shortToLong.put("P", "pinot_broker_port");
        shortToLong.put("S", "pinot_broker_scheme");
        shortToLong.put("u", "pinot_username");
        shortToLong.put("w", "pinot_password");
        shortToLong.put("T", "pinot_token");
        shortToLong.put("d", "pinot_database");

        // Query and filtering
        shortToLong.put("q", "pinot_query_timeout");
        shortToLong.put("f", "pinot_table_filter_file");
        shortToLong.put("M", "max_query_length");

        return shortToLong;
    }

    /**
     * Parses command line arguments into a key-value map.
     * Supports both short form (-h) and long form (--help) arguments.
     * Handles both key=value and key value formats for both forms.
     * Converts keys to uppercase for consistent lookup.
     *
     * @param args Command line arguments array
     * @return Map of uppercase keys to values
     */
    public static Map<String, String> parseArgs(String[] args) {
        Map<String, String> argsMap = new HashMap<>();
        Map<String, String> shortToLong = getShortFormMapping();

        for (int i = 0; i < args.length; i++) {
            String currArg = args[i];
            String key = null;
            String value = null;

            if (currArg.startsWith("--")) {
                String argWithoutPrefix = currArg.substring(2);

                if (argWithoutPrefix.contains("=")) {
                    String[] argParts = argWithoutPrefix.split("=", 2);
                    key = argParts[0];
                    value = argParts[1];
                } else {
                    key = argWithoutPrefix;

                    // Next argument is the value unless it is another option
                    if (i + 1 < args.length && !args[i + 1].startsWith("-")) {
                        value = args[i + 1];
                        i++;
                    } else {
                        value = "true";
                    }
                }
            } else if (currArg.startsWith("-") && currArg.length() > 1) {
                String shortArg = currArg.substring(1);

                if (shortArg.contains("=")) {
                    String[] argParts = shortArg.split("=", 2);
                    key = shortToLong.get(argParts[0]);
                    value = argParts[1];
                } else {
                    key = shortToLong.get(shortArg);

                    if (i + 1 < args.length && !args[i + 1].startsWith("-")) {
                        value = args[i + 1];
                        i++;
                    } else {
                        value = "true";
                    }
                }
            }

            if (key != null) {
                argsMap.put(key.toUpperCase(), value);
            }
        }

        return argsMap;
    }

    /**
     * Checks for help and version arguments and handles them.
     *
     * @param args Command line arguments
     * @return true if help or version was displayed (caller should exit), false otherwise
     */
    public static boolean handleHelpAndVersion(String[] args) {
        for (String arg : args) {
            if ("--help".equals(arg) || "-h".equals(arg)) {
                displayHelp();
                return true;
            }
            if ("--version".equals(arg) || "-v".equals(arg)) {
                displayVersion();
                return true;
            }
        }
        return false;
    }

    static void displayHelp() {
        System.out.println(SERVER_NAME);
        System.out.println("Usage: java -jar pinotchat-" + SERVER_VERSION + ".jar [OPTIONS]");
        System.out.println();
        System.out.println("ARGUMENT FORMATS:");
        System.out.println("  -k=value  or  --key=value     (no spaces around =)");
        System.out.println("  -k value  or  --key value     (space-separated)");
        System.out.println("  -k        or  --key           (flags, defaults to true)");
        System.out.println();
        System.out.println("OPTIONS:");
        System.out.println("  -h, --help                          Show this help message and exit");
        System.out.println("  -v, --version                       Show version information and exit");
        System.out.println("  -c, --config_file=<path>            Load KEY=VALUE configuration from file");
        System.out.println("  -m, --http_mode=<true|false>        Run in HTTP mode (default: false, uses stdio)");
        System.out.println("  -b, --bind_address=<address>        HTTP bind address (default: localhost)");
        System.out.println("  -p, --http_port=<port>              HTTP port number (default: 8080)");
        System.out.println();
        System.out.println("PINOT CLUSTER:");
        System.out.println("  -C, --pinot_controller_url=<url>    Controller URL (default: http://localhost:9000)");
        System.out.println("  -B, --pinot_broker_url=<url>        Broker URL, supplies host/port/scheme defaults");
        System.out.println("  -H, --pinot_broker_host=<host>      Broker host (default: localhost)");
        System.out.println("  -P, --pinot_broker_port=<port>      Broker port (default: 8000)");
        System.out.println("  -S, --pinot_broker_scheme=<scheme>  Broker scheme (default: http)");
        System.out.println("  -u, --pinot_username=<user>         Basic auth user name");
        System.out.println("  -w, --pinot_password=<password>     Basic auth password");
        System.out.println("  -T, --pinot_token=<token>           Authorization header value");
        System.out.println("      --pinot_token_filename=<path>   File holding the token");
        System.out.println("  -d, --pinot_database=<name>         Database name");
        System.out.println("      --pinot_use_msqe=<true|false>   Use the multi-stage query engine (default: false)");
        System.out.println();
        System.out.println("QUERY AND FILTERING:");
        System.out.println("  -q, --pinot_query_timeout=<sec>     Query timeout (default: 60)");
        System.out.println("      --pinot_request_timeout=<sec>   HTTP read timeout (default: 60)");
        System.out.println("      --pinot_connection_timeout=<sec> HTTP connect timeout (default: 60)");
        System.out.println("  -f, --pinot_table_filter_file=<path> YAML allow-list of table patterns");
        System.out.println("      --pinot_filter_fail_closed=<true|false> Deny queries without table references");
        System.out.println("      --pinot_jdbc_driver=<class>     Fallback driver class");
        System.out.println("      --pinot_jdbc_url=<url>          Fallback driver URL");
        System.out.println("  -M, --max_query_length=<chars>      Max query length (default: 10000)");
        System.out.println();
        System.out.println("EXAMPLES:");
        System.out.println("  java -jar pinotchat-" + SERVER_VERSION + ".jar -B https://broker.example.com -T \"Bearer abc\"");
        System.out.println("  java -jar pinotchat-" + SERVER_VERSION + ".jar -m -p 9090 -f filters.yaml");
    }

    static void displayVersion() {
        System.out.println(SERVER_NAME + " v" + SERVER_VERSION);
        System.out.println(SERVER_DESCRIPTION);
        System.out.println("MCP Protocol Version: " + PROTOCOL_VERSION);
        System.out.println("Java Version: " + System.getProperty("java.version"));
        System.out.println("Java Vendor: " + System.getProperty("java.vendor"));
        System.out.println();
        System.out.println("Fallback driver: " + describeDriver(ConfigParams.DEFAULT_JDBC_DRIVER));
        System.out.println("\nFeatures:");
        System.out.println(" - Broker HTTP queries with driver fallback");
        System.out.println(" - Hot-reloadable table allow-list");
        System.out.println(" - Both stdio and HTTP transport modes");
    }

    /**
     * Describes a driver class if it is on the classpath.
     */
    static String describeDriver(String driverClass) {
        try {
            Class.forName(driverClass);
        } catch (ClassNotFoundException e) {
            return driverClass + " (not on classpath, build with -Ppinot-jdbc)";
        }
        Enumeration<Driver> drivers = DriverManager.getDrivers();
        while (drivers.hasMoreElements()) {
            Driver driver = drivers.nextElement();
            if (driver.getClass().getName().equals(driverClass)) {
                return String.format("%s v%d.%d", driverClass, driver.getMajorVersion(), driver.getMinorVersion());
            }
        }
        return driverClass;
    }

    /**
     * Loads configuration from command line arguments, config file, environment variables and system properties.
     * Uses priority order: CLI args (--pinot_broker_host) > config file > environment variables (PINOT_BROKER_HOST)
     * > system properties (-Dpinot.broker.host=) > defaults.
     *
     * @param args Command line arguments
     * @return Configured ConfigParams instance
     * @throws IOException if the config file cannot be read
     * @throws NumberFormatException if numeric parameters cannot be parsed
     */
    public static ConfigParams loadConfiguration(String[] args) throws IOException {
        Map<String, String> cliArgs = parseArgs(args);

        Map<String, String> fileConfig = null;
        String configFile = getConfigValue("CONFIG_FILE", null, cliArgs, null);
        if (configFile != null) {
            try {
                fileConfig = loadConfigFile(configFile);
                logger.info("Configuration file loaded: {}", configFile);
            } catch (IOException e) {
                logger.error("Failed to load configuration file: {}", configFile, e);
                throw new IOException("Failed to load configuration file: " + configFile, e);
            }
        }

        BrokerAddress broker = resolveBroker(cliArgs, fileConfig);

        return new ConfigParams(
                getConfigValue("PINOT_CONTROLLER_URL", ConfigParams.DEFAULT_CONTROLLER_URL, cliArgs, fileConfig),
                broker.host(), broker.port(), broker.scheme(),
                getConfigValue("PINOT_USERNAME", null, cliArgs, fileConfig),
                getConfigValue("PINOT_PASSWORD", null, cliArgs, fileConfig),
                emptyToNull(getConfigValue("PINOT_TOKEN", null, cliArgs, fileConfig)),
                emptyToNull(getConfigValue("PINOT_TOKEN_FILENAME", null, cliArgs, fileConfig)),
                getConfigValue("PINOT_DATABASE", "", cliArgs, fileConfig),
                Boolean.parseBoolean(getConfigValue("PINOT_USE_MSQE", "false", cliArgs, fileConfig)),
                Integer.parseInt(getConfigValue("PINOT_REQUEST_TIMEOUT", "60", cliArgs, fileConfig)),
                Integer.parseInt(getConfigValue("PINOT_CONNECTION_TIMEOUT", "60", cliArgs, fileConfig)),
                Integer.parseInt(getConfigValue("PINOT_QUERY_TIMEOUT", "60", cliArgs, fileConfig)),
                emptyToNull(getConfigValue("PINOT_TABLE_FILTER_FILE", null, cliArgs, fileConfig)),
                Boolean.parseBoolean(getConfigValue("PINOT_FILTER_FAIL_CLOSED", "false", cliArgs, fileConfig)),
                getConfigValue("PINOT_JDBC_DRIVER", ConfigParams.DEFAULT_JDBC_DRIVER, cliArgs, fileConfig),
                emptyToNull(getConfigValue("PINOT_JDBC_URL", null, cliArgs, fileConfig)),
                Integer.parseInt(getConfigValue("MAX_QUERY_LENGTH",
                        String.valueOf(ConfigParams.DEFAULT_MAX_QUERY_LENGTH), cliArgs, fileConfig)));
    }

    record BrokerAddress(String host, int port, String scheme) {
    }

    /**
     * Resolves broker host, port and scheme. PINOT_BROKER_URL supplies the defaults and the
     * individual settings override it, with a warning when they disagree.
     */
    static BrokerAddress resolveBroker(Map<String, String> cliArgs, Map<String, String> fileConfig) {
        String brokerUrl = emptyToNull(getConfigValue("PINOT_BROKER_URL", null, cliArgs, fileConfig));
        BrokerAddress urlDefaults = brokerUrl != null
                ? parseBrokerUrl(brokerUrl)
                : new BrokerAddress(ConfigParams.DEFAULT_BROKER_HOST, ConfigParams.DEFAULT_BROKER_PORT,
                        ConfigParams.DEFAULT_BROKER_SCHEME);

        String hostOverride = getConfigValue("PINOT_BROKER_HOST", null, cliArgs, fileConfig);
        String portOverride = getConfigValue("PINOT_BROKER_PORT", null, cliArgs, fileConfig);
        String schemeOverride = getConfigValue("PINOT_BROKER_SCHEME", null, cliArgs, fileConfig);

        String host = hostOverride != null ? hostOverride : urlDefaults.host();
        int port = portOverride != null ? Integer.parseInt(portOverride) : urlDefaults.port();
        String scheme = schemeOverride != null ? schemeOverride : urlDefaults.scheme();

        if (brokerUrl != null) {
            if (hostOverride != null && !hostOverride.equals(urlDefaults.host())) {
                logger.warn("PINOT_BROKER_HOST='{}' overrides host '{}' from PINOT_BROKER_URL", host, urlDefaults.host());
            }
            if (portOverride != null && port != urlDefaults.port()) {
                logger.warn("PINOT_BROKER_PORT='{}' overrides port '{}' from PINOT_BROKER_URL", port, urlDefaults.port());
            }
            if (schemeOverride != null && !schemeOverride.equals(urlDefaults.scheme())) {
                logger.warn("PINOT_BROKER_SCHEME='{}' overrides scheme '{}' from PINOT_BROKER_URL",
                        scheme, urlDefaults.scheme());
            }
        }
        return new BrokerAddress(host, port, scheme);
    }

    /**
     * Parses a broker URL into its parts. An unparseable URL falls back to localhost:80 over http.
     */
    static BrokerAddress parseBrokerUrl(String brokerUrl) {
        try {
            URI uri = new URI(brokerUrl);
            if (uri.getScheme() == null && uri.getRawAuthority() == null) {
                throw new URISyntaxException(brokerUrl, "Invalid URL format");
            }
            String scheme = uri.getScheme() != null ? uri.getScheme().toLowerCase() : "http";
            String host = uri.getHost() != null ? uri.getHost() : "localhost";
            int port = uri.getPort() > 0 ? uri.getPort() : ("https".equals(scheme) ? 443 : 80);
            return new BrokerAddress(host, port, scheme);
        } catch (URISyntaxException e) {
            logger.warn("Failed to parse PINOT_BROKER_URL '{}': {}. Using defaults.", brokerUrl, e.getMessage());
            return new BrokerAddress("localhost", 80, "http");
        }
    }

    public static boolean isHttpMode(String[] args) {
        Map<String, String> cliArgs = parseArgs(args);
        return Boolean.parseBoolean(getConfigValue("HTTP_MODE", "false", cliArgs, null));
    }

    public static String getBindAddress(String[] args) {
        Map<String, String> cliArgs = parseArgs(args);
        return getConfigValue("BIND_ADDRESS", "localhost", cliArgs, null);
    }

    public static int getHttpPort(String[] args) {
        Map<String, String> cliArgs = parseArgs(args);
        return Integer.parseInt(getConfigValue("HTTP_PORT", "8080", cliArgs, null));
    }

    /**
     * Gets a configuration value using the priority order:
     * CLI args > config file > env vars > system properties > default.
     *
     * @param varName Config parameter name (uppercase)
     * @param defaultValue Default value if not found in any source
     * @param cliArgs Parsed command line arguments
     * @param fileConfig Configuration from file (can be null if no config file)
     * @return The configuration value from the highest priority source
     */
    static String getConfigValue(String varName, String defaultValue, Map<String, String> cliArgs,
                                 Map<String, String> fileConfig) {
        String cliValue = cliArgs.get(varName.toUpperCase());
        if (cliValue != null) {
            return cliValue;
        }

        if (fileConfig != null) {
            String fileValue = fileConfig.get(varName.toUpperCase());
            if (fileValue != null) {
                return fileValue;
            }
        }

        String envValue = System.getenv(varName);
        if (envValue != null) {
            return envValue;
        }

        // pinot.broker.host for PINOT_BROKER_HOST
        String propValue = System.getProperty(varName.toLowerCase().replace('_', '.'));
        if (propValue != null) {
            return propValue;
        }

        return defaultValue;
    }

    /**
     * Loads configuration parameters from a file.
     * Each line should be in KEY=VALUE format. Lines starting with # are comments and empty lines are ignored.
     *
     * @param configFilePath Path to the configuration file
     * @return Map of configuration key-value pairs
     * @throws IOException if the file cannot be read
     */
    static Map<String, String> loadConfigFile(String configFilePath) throws IOException {
        Map<String, String> configMap = new HashMap<>();

        try (BufferedReader bufferedReader = new BufferedReader(new FileReader(configFilePath))) {
            String currLine;
            int lineNumber = 0;

            while ((currLine = bufferedReader.readLine()) != null) {
                lineNumber++;
                currLine = currLine.trim();

                if (currLine.isEmpty() || currLine.startsWith("#")) {
                    continue;
                }

                String[] lineParts = currLine.split("=", 2);
                if (lineParts.length != 2) {
                    logger.warn("Invalid config line {} in file {}: {}", lineNumber, configFilePath, currLine);
                    continue;
                }

                String paramKey = lineParts[0].trim().toUpperCase();
                String paramValue = lineParts[1].trim();

                if (paramKey.isEmpty()) {
                    logger.warn("Key cannot be empty. Invalid config on line {} in file {}", lineNumber, configFilePath);
                    continue;
                }

                if ((paramValue.startsWith("\"") && paramValue.endsWith("\"") && paramValue.length() >= 2)
                        || (paramValue.startsWith("'") && paramValue.endsWith("'") && paramValue.length() >= 2)) {
                    paramValue = paramValue.substring(1, paramValue.length() - 1);
                }

                configMap.put(paramKey, paramValue);
                logger.debug("Loaded config: {} = {}", paramKey, isSecretKey(paramKey) ? "***" : paramValue);
            }
        }

        logger.info("Loaded {} configuration parameters from file: {}", configMap.size(), configFilePath);
        return configMap;
    }

    private static boolean isSecretKey(String paramKey) {
        return paramKey.contains("PASSWORD") || paramKey.contains("TOKEN");
    }

    private static String emptyToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
