package com.pinotchat.mcp;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class SecurityUtilsTest {

    @ParameterizedTest
    @ValueSource(strings = {
            "SELECT * FROM t",
            "select count(*) from t",
            "  \n\tSELECT 1",
            "(SELECT a FROM t) UNION (SELECT a FROM u)",
            "WITH x AS (SELECT 1) SELECT * FROM x",
            "-- comment\nSELECT 1",
            "/* multi\nline */ SELECT 1",
            "-- one\n/* two */\n-- three\nselect 1"
    })
    @DisplayName("isSelectQuery accepts read-only shapes")
    void isSelectQuery_ReadOnly_ReturnsTrue(String queryText) {
        assertTrue(SecurityUtils.isSelectQuery(queryText));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "",
            "INSERT INTO t VALUES (1)",
            "DELETE FROM t",
            "SELECTED FROM t",
            "-- SELECT 1",
            "/* SELECT */ DROP TABLE t",
            "EXPLAIN PLAN FOR SELECT 1"
    })
    @DisplayName("isSelectQuery rejects anything else")
    void isSelectQuery_Other_ReturnsFalse(String queryText) {
        assertFalse(SecurityUtils.isSelectQuery(queryText));
    }

    @Test
    void isSelectQuery_Null_ReturnsFalse() {
        assertFalse(SecurityUtils.isSelectQuery(null));
    }

    @Test
    void truncateString() {
        assertEquals("abc...", SecurityUtils.truncateString("abcdef", 3));
        assertEquals("abc", SecurityUtils.truncateString("abc", 3));
        assertEquals("...", SecurityUtils.truncateString("abc", -1));
        assertNull(SecurityUtils.truncateString(null, 10));
    }
}
