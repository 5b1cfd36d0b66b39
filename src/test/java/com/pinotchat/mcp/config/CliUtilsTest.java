package com.pinotchat.mcp.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static com.github.stefanbirkner.systemlambda.SystemLambda.restoreSystemProperties;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests argument parsing, help and version output, and configuration loading.
 */
class CliUtilsTest {
    private final ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
    private final PrintStream originalOut = System.out;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        System.setOut(new PrintStream(outputStream));
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
    }

    @Test
    void testShortFormMapping() {
        Map<String, String> mapping = CliUtils.getShortFormMapping();

        assertEquals("help", mapping.get("h"));
        assertEquals("pinot_controller_url", mapping.get("C"));
        assertEquals("pinot_broker_url", mapping.get("B"));
        assertEquals("pinot_table_filter_file", mapping.get("f"));
        assertEquals("http_port", mapping.get("p"));

        for (String key : mapping.keySet()) {
            assertEquals(1, key.length(), "Short form key should be single character: " + key);
        }
        for (String value : mapping.values()) {
            assertTrue(value.matches("[a-z_]+"), "Unexpected parameter name: " + value);
        }
    }

    @Test
    void testParseArgsLongAndShortForms() {
        String[] args = {"--pinot_broker_host=broker1", "--pinot_broker_port", "8099", "-f=filters.yaml", "-d", "sales"};
        Map<String, String> result = CliUtils.parseArgs(args);

        assertEquals("broker1", result.get("PINOT_BROKER_HOST"));
        assertEquals("8099", result.get("PINOT_BROKER_PORT"));
        assertEquals("filters.yaml", result.get("PINOT_TABLE_FILTER_FILE"));
        assertEquals("sales", result.get("PINOT_DATABASE"));
    }

    @Test
    void testParseArgsFlagsAndUnknownShortForm() {
        Map<String, String> result = CliUtils.parseArgs(new String[]{"-m", "-x", "--pinot_use_msqe"});

        assertEquals("true", result.get("HTTP_MODE"));
        assertEquals("true", result.get("PINOT_USE_MSQE"));
        assertEquals(2, result.size());
    }

    @Test
    void testParseArgsKeepsEqualsInValue() {
        Map<String, String> result = CliUtils.parseArgs(new String[]{"--pinot_token=Bearer a=b=c"});

        assertEquals("Bearer a=b=c", result.get("PINOT_TOKEN"));
    }

    @Test
    void testHandleHelpAndVersion() {
        assertTrue(CliUtils.handleHelpAndVersion(new String[]{"--help"}));
        assertTrue(outputStream.toString().contains("PINOT CLUSTER:"));

        outputStream.reset();
        assertTrue(CliUtils.handleHelpAndVersion(new String[]{"-v"}));
        String versionOutput = outputStream.toString();
        assertTrue(versionOutput.contains(CliUtils.SERVER_NAME + " v" + CliUtils.SERVER_VERSION));
        assertTrue(versionOutput.contains(CliUtils.PROTOCOL_VERSION));

        assertFalse(CliUtils.handleHelpAndVersion(new String[]{"--http_mode"}));
    }

    @Test
    void testDescribeDriverNotOnClasspath() {
        assertTrue(CliUtils.describeDriver("org.example.MissingDriver").contains("not on classpath"));
        assertTrue(CliUtils.describeDriver("org.h2.Driver").startsWith("org.h2.Driver"));
    }

    @Test
    void testLoadConfigurationDefaults() throws IOException {
        ConfigParams configParams = CliUtils.loadConfiguration(new String[]{
                "--pinot_controller_url=http://controller:9000/", "--pinot_broker_host=broker", "--pinot_broker_port=8099"});

        assertEquals("http://controller:9000", configParams.controllerUrl());
        assertEquals("http://broker:8099", configParams.brokerUrl());
        assertEquals(ConfigParams.DEFAULT_JDBC_DRIVER, configParams.jdbcDriver());
        assertEquals("jdbc:pinot://controller:9000?brokers=broker:8099", configParams.jdbcUrl());
    }

    @Test
    void testBrokerUrlSuppliesDefaultsAndIndividualSettingsOverride() throws IOException {
        ConfigParams fromUrl = CliUtils.loadConfiguration(new String[]{"-B", "https://broker.example.com"});
        assertEquals("broker.example.com", fromUrl.brokerHost());
        assertEquals(443, fromUrl.brokerPort());
        assertEquals("https", fromUrl.brokerScheme());

        ConfigParams overridden = CliUtils.loadConfiguration(
                new String[]{"-B", "https://broker.example.com:8443", "--pinot_broker_port=9443"});
        assertEquals("broker.example.com", overridden.brokerHost());
        assertEquals(9443, overridden.brokerPort());
    }

    @Test
    void testParseBrokerUrlFallsBackOnGarbage() {
        CliUtils.BrokerAddress address = CliUtils.parseBrokerUrl("::not a url::");

        assertEquals(new CliUtils.BrokerAddress("localhost", 80, "http"), address);
    }

    @Test
    void testConfigFileAndCliPriority() throws Exception {
        Path configFile = tempDir.resolve("pinot.conf");
        Files.writeString(configFile, String.join("\n",
                "# cluster",
                "PINOT_BROKER_HOST=file-broker",
                "pinot_database=\"analytics\"",
                "PINOT_PASSWORD='s3cret'",
                "not a config line",
                "",
                "PINOT_TABLE_FILTER_FILE=/etc/pinot/filters.yaml"));

        ConfigParams configParams = CliUtils.loadConfiguration(new String[]{
                "-c", configFile.toString(), "--pinot_table_filter_file=/tmp/cli.yaml"});

        assertEquals("file-broker", configParams.brokerHost());
        assertEquals("analytics", configParams.database());
        assertEquals("s3cret", configParams.password());
        assertEquals("/tmp/cli.yaml", configParams.tableFilterFile());
    }

    @Test
    void testMissingConfigFile() {
        String missing = tempDir.resolve("missing.conf").toString();

        IOException exception = assertThrows(IOException.class,
                () -> CliUtils.loadConfiguration(new String[]{"--config_file=" + missing}));
        assertTrue(exception.getMessage().contains(missing));
    }

    @Test
    void testSystemPropertyFallback() throws Exception {
        restoreSystemProperties(() -> {
            System.setProperty("pinot.query.timeout", "15");
            System.setProperty("pinot.filter.fail.closed", "true");

            ConfigParams configParams = CliUtils.loadConfiguration(new String[]{});

            assertEquals(15, configParams.queryTimeoutSeconds());
            assertTrue(configParams.filterFailClosed());
        });
    }

    @Test
    void testInvalidNumberRejected() {
        assertThrows(NumberFormatException.class,
                () -> CliUtils.loadConfiguration(new String[]{"--pinot_query_timeout=soon"}));
    }

    @Test
    void testHttpModeSettings() {
        String[] args = {"-m", "-b", "0.0.0.0", "-p", "9090"};

        assertTrue(CliUtils.isHttpMode(args));
        assertEquals("0.0.0.0", CliUtils.getBindAddress(args));
        assertEquals(9090, CliUtils.getHttpPort(args));
        assertFalse(CliUtils.isHttpMode(new String[]{}));
    }
}
