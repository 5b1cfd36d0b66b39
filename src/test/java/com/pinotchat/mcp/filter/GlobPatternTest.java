package com.pinotchat.mcp.filter;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class GlobPatternTest {

    @ParameterizedTest
    @CsvSource({
            "prod_*, prod_users, true",
            "prod_*, prod_, true",
            "prod_*, dev_users, false",
            "prod_*, xprod_users, false",
            "events_20??, events_2024, true",
            "events_20??, events_202, false",
            "events_20??, events_20245, false",
            "table_[abc], table_b, true",
            "table_[abc], table_d, false",
            "table_[!abc], table_d, true",
            "table_[!abc], table_a, false",
            "table_[0-9], table_7, true",
            "table_[0-9], table_x, false",
            "exact, exact, true",
            "exact, Exact, false",
            "*, anything, true"
    })
    void testMatches(String glob, String name, boolean expected) {
        assertEquals(expected, GlobPattern.compile(glob).matches(name));
    }

    @Test
    void testRegexMetacharactersAreLiteral() {
        GlobPattern pattern = GlobPattern.compile("a.b+c");
        assertTrue(pattern.matches("a.b+c"));
        assertFalse(pattern.matches("aXbbc"));
    }

    @Test
    void testUnterminatedClassIsLiteral() {
        GlobPattern pattern = GlobPattern.compile("tbl[ab");
        assertTrue(pattern.matches("tbl[ab"));
        assertFalse(pattern.matches("tbla"));
    }

    @Test
    void testNullNameNeverMatches() {
        assertFalse(GlobPattern.compile("*").matches(null));
    }

    @Test
    void testNullGlobRejected() {
        assertThrows(IllegalArgumentException.class, () -> GlobPattern.compile(null));
    }

    @Test
    void testEqualityUsesGlobText() {
        assertEquals(GlobPattern.compile("prod_*"), GlobPattern.compile("prod_*"));
        assertEquals(GlobPattern.compile("prod_*").hashCode(), GlobPattern.compile("prod_*").hashCode());
        assertNotEquals(GlobPattern.compile("prod_*"), GlobPattern.compile("dev_*"));
        assertEquals("prod_*", GlobPattern.compile("prod_*").glob());
    }
}
