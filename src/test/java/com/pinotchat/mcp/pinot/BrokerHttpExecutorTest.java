package com.pinotchat.mcp.pinot;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pinotchat.mcp.config.ConfigParams;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BrokerHttpExecutorTest {
    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static final String QUERY_PATH = "/query/sql";

    private FakePinotServer broker;

    @BeforeEach
    void setUp() throws Exception {
        broker = new FakePinotServer();
    }

    @AfterEach
    void tearDown() {
        broker.close();
    }

    @Test
    void testRowsZippedWithColumnNames() throws Exception {
        broker.respond("POST", QUERY_PATH, 200, """
                {"resultTable": {"dataSchema": {"columnNames": ["city", "cnt"], "columnDataTypes": ["STRING", "LONG"]},
                                 "rows": [["Paris", 3], ["Rome", 5]]},
                 "exceptions": []}
                """);

        QueryResult queryResult = new BrokerHttpExecutor(PinotTestConfigs.forServer(broker))
                .execute("SELECT city, COUNT(*) AS cnt FROM trips GROUP BY city");

        assertEquals(List.of("city", "cnt"), queryResult.allColumns());
        assertEquals(2, queryResult.rowCount());
        assertEquals(Map.of("city", "Paris", "cnt", 3), queryResult.allRows().get(0));
        assertEquals(List.of("city", "cnt"), List.copyOf(queryResult.allRows().get(1).keySet()));
    }

    @Test
    void testPayloadCarriesTimeoutAndQueryUnmodified() throws Exception {
        broker.respond("POST", QUERY_PATH, 200, "{\"resultTable\": {\"dataSchema\": {\"columnNames\": []}, \"rows\": []}}");
        String query = "SELECT * FROM mydb.events;";

        new BrokerHttpExecutor(PinotTestConfigs.forServer(broker)).execute(query);

        JsonNode payload = objectMapper.readTree(broker.lastRequest().body());
        assertEquals(query, payload.get("sql").asText());
        assertEquals("timeoutMs=60000", payload.get("queryOptions").asText());
        assertEquals("application/json", broker.lastRequest().headers().getFirst("Content-Type"));
    }

    @Test
    void testMultistageAndDatabaseHeaders() throws Exception {
        broker.respond("POST", QUERY_PATH, 200, "{\"resultTable\": {\"dataSchema\": {\"columnNames\": []}, \"rows\": []}}");
        ConfigParams configParams = PinotTestConfigs.withAuth(broker, null, null, "Bearer abc", "sales", true);

        new BrokerHttpExecutor(configParams).execute("SELECT 1");

        FakePinotServer.RecordedRequest request = broker.lastRequest();
        assertEquals("Bearer abc", request.headers().getFirst("Authorization"));
        assertEquals("sales", request.headers().getFirst("database"));
        assertEquals("timeoutMs=30000;useMultistageEngine=true",
                objectMapper.readTree(request.body()).get("queryOptions").asText());
    }

    @Test
    void testExceptionsFieldIsFailure() {
        broker.respond("POST", QUERY_PATH, 200,
                "{\"exceptions\": [{\"errorCode\": 190, \"message\": \"TableDoesNotExistError\"}]}");

        PinotApiException e = assertThrows(PinotApiException.class,
                () -> new BrokerHttpExecutor(PinotTestConfigs.forServer(broker)).execute("SELECT * FROM missing"));
        assertTrue(e.getMessage().startsWith("Query error:"));
        assertTrue(e.getMessage().contains("TableDoesNotExistError"));
    }

    @Test
    void testMissingResultTableIsEmpty() throws Exception {
        broker.respond("POST", QUERY_PATH, 200, "{\"exceptions\": [], \"numDocsScanned\": 0}");

        QueryResult queryResult = new BrokerHttpExecutor(PinotTestConfigs.forServer(broker)).execute("SELECT 1");

        assertTrue(queryResult.isEmpty());
        assertTrue(queryResult.allColumns().isEmpty());
    }

    @Test
    void testNonSuccessStatusIsFailure() {
        broker.respond("POST", QUERY_PATH, 500, "boom");

        PinotApiException e = assertThrows(PinotApiException.class,
                () -> new BrokerHttpExecutor(PinotTestConfigs.forServer(broker)).execute("SELECT 1"));
        assertEquals(500, e.getStatusCode());
        assertEquals("boom", e.getResponseBody());
    }

    @Test
    void testInvalidJsonIsFailure() {
        broker.respond("POST", QUERY_PATH, 200, "<html>not json</html>");

        assertThrows(PinotApiException.class,
                () -> new BrokerHttpExecutor(PinotTestConfigs.forServer(broker)).execute("SELECT 1"));
    }

    @Test
    void testUnreachableBrokerIsFailure() {
        ConfigParams configParams = PinotTestConfigs.forServer(broker);
        broker.close();

        PinotApiException e = assertThrows(PinotApiException.class,
                () -> new BrokerHttpExecutor(configParams).execute("SELECT 1"));
        assertEquals(-1, e.getStatusCode());
    }
}
