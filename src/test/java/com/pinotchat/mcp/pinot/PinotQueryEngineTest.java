package com.pinotchat.mcp.pinot;

import com.pinotchat.mcp.filter.AccessValidator;
import com.pinotchat.mcp.filter.FilterSet;
import com.pinotchat.mcp.filter.FilterStore;
import com.pinotchat.mcp.filter.UnauthorizedAccessException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.sql.SQLException;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PinotQueryEngineTest {
    private static final String QUERY = "SELECT * FROM prod_events";
    private static final QueryResult ONE_ROW = new QueryResult(List.of("n"), List.of(Map.of("n", 1)), 3);

    @Mock
    private BrokerHttpExecutor mockHttpExecutor;

    @Mock
    private DriverQueryExecutor mockDriverExecutor;

    private PinotQueryEngine engineWithPatterns(List<String> patterns) {
        AccessValidator accessValidator = new AccessValidator(new FilterStore(FilterSet.of(patterns)));
        return new PinotQueryEngine(accessValidator, mockHttpExecutor, mockDriverExecutor);
    }

    @Test
    void testHttpSuccessSkipsDriver() throws Exception {
        when(mockHttpExecutor.execute(QUERY)).thenReturn(ONE_ROW);

        QueryResult queryResult = engineWithPatterns(List.of("prod_*")).execute(QUERY);

        assertSame(ONE_ROW, queryResult);
        verifyNoInteractions(mockDriverExecutor);
    }

    @Test
    void testHttpFailureFallsBackToDriver() throws Exception {
        when(mockHttpExecutor.execute(QUERY)).thenThrow(new PinotApiException("broker 503", null));
        when(mockDriverExecutor.execute(QUERY)).thenReturn(ONE_ROW);

        QueryResult queryResult = engineWithPatterns(List.of("prod_*")).execute(QUERY);

        assertSame(ONE_ROW, queryResult);
    }

    @Test
    void testHttpRuntimeFailureAlsoFallsBack() throws Exception {
        when(mockHttpExecutor.execute(QUERY)).thenThrow(new IllegalStateException("unexpected"));
        when(mockDriverExecutor.execute(QUERY)).thenReturn(ONE_ROW);

        assertSame(ONE_ROW, engineWithPatterns(List.of("prod_*")).execute(QUERY));
    }

    @Test
    void testBothFailuresReported() throws Exception {
        when(mockHttpExecutor.execute(QUERY)).thenThrow(new PinotApiException("connection refused", null));
        SQLException driverFailure = new SQLException("driver timeout");
        when(mockDriverExecutor.execute(QUERY)).thenThrow(driverFailure);

        QueryExecutionException e = assertThrows(QueryExecutionException.class,
                () -> engineWithPatterns(List.of("prod_*")).execute(QUERY));

        assertEquals("connection refused", e.getHttpError());
        assertEquals("driver timeout", e.getDriverError());
        assertTrue(e.getMessage().contains("connection refused"));
        assertTrue(e.getMessage().contains("driver timeout"));
        assertSame(driverFailure, e.getCause());
    }

    @Test
    void testUnauthorizedQueryMakesNoCalls() {
        assertThrows(UnauthorizedAccessException.class,
                () -> engineWithPatterns(List.of("prod_*")).execute("SELECT * FROM dev_table"));

        verifyNoInteractions(mockHttpExecutor, mockDriverExecutor);
    }

    @Test
    void testExecuteValidatedBypassesAllowList() throws Exception {
        when(mockHttpExecutor.execute("SELECT * FROM dev_table")).thenReturn(ONE_ROW);

        assertSame(ONE_ROW, engineWithPatterns(List.of("prod_*")).executeValidated("SELECT * FROM dev_table"));
        verify(mockDriverExecutor, never()).execute(anyString());
    }
}
