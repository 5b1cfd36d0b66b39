package com.pinotchat.mcp.filter;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class RegexTableReferenceExtractorTest {
    private final RegexTableReferenceExtractor extractor = new RegexTableReferenceExtractor();

    @Nested
    class BasicReferences {
        @Test
        void testSimpleFrom() {
            assertThat(extractor.extract("SELECT * FROM users")).containsExactly("users");
        }

        @Test
        void testJoins() {
            assertThat(extractor.extract(
                    "SELECT * FROM prod_users u LEFT JOIN prod_orders o ON u.id = o.uid INNER JOIN prod_items i ON o.id = i.oid"))
                    .containsExactlyInAnyOrder("prod_users", "prod_orders", "prod_items");
        }

        @Test
        void testCaseInsensitiveKeywords() {
            assertThat(extractor.extract("select count(*) from Events where x = 1")).containsExactly("Events");
        }

        @Test
        void testCommaSeparatedTablesWithAliases() {
            assertThat(extractor.extract("SELECT * FROM a x, b AS y, c WHERE x.id = y.id"))
                    .containsExactlyInAnyOrder("a", "b", "c");
        }

        @Test
        void testQualifiedNameKeepsLastSegment() {
            assertThat(extractor.extract("SELECT * FROM db.schema.orders")).containsExactly("orders");
            assertThat(extractor.extract("SELECT * FROM mydb.orders")).containsExactly("orders");
        }

        @Test
        void testNoTables() {
            assertThat(extractor.extract("SELECT 1")).isEmpty();
            assertThat(extractor.extract("")).isEmpty();
            assertThat(extractor.extract(null)).isEmpty();
        }

        @Test
        void testDuplicatesCollapsed() {
            Set<String> tables = extractor.extract("SELECT * FROM t1 JOIN t1 ON t1.a = t1.b");
            assertThat(tables).containsExactly("t1");
        }
    }

    @Nested
    class QuotingAndComments {
        @Test
        void testDoubleQuotedName() {
            assertThat(extractor.extract("SELECT * FROM \"quoted table\"")).containsExactly("quoted table");
        }

        @Test
        void testBacktickQuotedName() {
            assertThat(extractor.extract("SELECT * FROM `quoted_table`")).containsExactly("quoted_table");
        }

        @Test
        void testLineCommentIgnored() {
            assertThat(extractor.extract("-- FROM fake_table\nSELECT * FROM real_table"))
                    .containsExactly("real_table");
        }

        @Test
        void testBlockCommentIgnored() {
            assertThat(extractor.extract("SELECT * /* FROM hidden */ FROM visible"))
                    .containsExactly("visible");
        }

        @Test
        void testMultilineWhitespace() {
            assertThat(extractor.extract("SELECT *\n\tFROM\n   spaced_table\nWHERE a = 1"))
                    .containsExactly("spaced_table");
        }
    }

    @Nested
    class CommentAndLiteralBoundaries {
        @Test
        void testBlockMarkerInsideLineCommentDoesNotHideNextLine() {
            assertThat(extractor.extract("SELECT * FROM prod_a -- /*\nJOIN secret_t ON 1=1 -- */"))
                    .containsExactlyInAnyOrder("prod_a", "secret_t");
        }

        @Test
        void testLineMarkerInsideStringLiteral() {
            assertThat(extractor.extract("SELECT * FROM prod_a WHERE note = '--' UNION ALL SELECT * FROM secret_t"))
                    .containsExactlyInAnyOrder("prod_a", "secret_t");
        }

        @Test
        void testBlockMarkerInsideStringLiteral() {
            assertThat(extractor.extract("SELECT '/*' AS c FROM prod_a JOIN secret_t ON 1=1 -- */"))
                    .containsExactlyInAnyOrder("prod_a", "secret_t");
        }

        @Test
        void testEscapedQuoteInsideLiteral() {
            assertThat(extractor.extract(
                    "SELECT * FROM prod_a WHERE n = 'it''s -- fine' UNION SELECT * FROM secret_t"))
                    .containsExactlyInAnyOrder("prod_a", "secret_t");
        }

        @Test
        void testLineMarkerInsideQuotedIdentifier() {
            assertThat(extractor.extract("SELECT * FROM \"odd--name\" JOIN t2 ON 1=1"))
                    .containsExactlyInAnyOrder("odd--name", "t2");
        }

        @Test
        void testDoubledQuoteInsideIdentifier() {
            assertThat(extractor.extract("SELECT * FROM \"say \"\"hi\"\"\"")).containsExactly("say \"hi\"");
        }

        @Test
        void testNamesInsideLiteralsAreNotTables() {
            assertThat(extractor.extract("SELECT * FROM prod_a WHERE note = 'FROM secret_t'"))
                    .containsExactly("prod_a");
        }

        @Test
        void testUnterminatedLiteralKeepsRemainingText() {
            assertThat(extractor.extract("SELECT * FROM prod_a WHERE n = 'open FROM secret_t"))
                    .contains("prod_a", "secret_t");
        }
    }

    @Nested
    class CommonTableExpressions {
        @Test
        void testCteNameIsNotATable() {
            assertThat(extractor.extract("WITH recent AS (SELECT * FROM prod_events) SELECT * FROM recent"))
                    .containsExactly("prod_events");
        }

        @Test
        void testChainedCtesWithColumnList() {
            assertThat(extractor.extract("WITH a AS (SELECT * FROM prod_x), b (id) AS (SELECT id FROM a) "
                    + "SELECT * FROM b JOIN prod_y ON 1=1"))
                    .containsExactlyInAnyOrder("prod_x", "prod_y");
        }

        @Test
        void testReferenceInsideOwnBodyIsATable() {
            assertThat(extractor.extract("WITH secret_t AS (SELECT * FROM secret_t) SELECT * FROM secret_t"))
                    .containsExactly("secret_t");
        }

        @Test
        void testCteNameOutsideItsSubqueryIsATable() {
            assertThat(extractor.extract(
                    "SELECT * FROM (WITH s AS (SELECT * FROM prod_a) SELECT * FROM s) sub JOIN s ON 1=1"))
                    .containsExactlyInAnyOrder("prod_a", "s");
        }

        @Test
        void testWithInsideLiteralDefinesNothing() {
            assertThat(extractor.extract("SELECT 'WITH secret_t AS (1)' AS c FROM prod_a JOIN secret_t ON 1=1"))
                    .containsExactlyInAnyOrder("prod_a", "secret_t");
        }

        @Test
        void testWithInsideQuotedIdentifierDefinesNothing() {
            assertThat(extractor.extract("SELECT * FROM \"WITH secret_t AS (x)\" JOIN secret_t ON 1=1"))
                    .contains("secret_t");
        }
    }

    @Nested
    class NestedQueries {
        @Test
        void testSubquery() {
            assertThat(extractor.extract("SELECT * FROM (SELECT id FROM inner_table) sub JOIN outer_table o ON sub.id = o.id"))
                    .containsExactlyInAnyOrder("inner_table", "outer_table");
        }

        @Test
        void testUnion() {
            assertThat(extractor.extract("SELECT a FROM t1 UNION ALL SELECT a FROM t2"))
                    .containsExactlyInAnyOrder("t1", "t2");
        }

        @Test
        void testWhereInSubquery() {
            assertThat(extractor.extract("SELECT * FROM orders WHERE uid IN (SELECT id FROM users)"))
                    .containsExactlyInAnyOrder("orders", "users");
        }
    }

    @Test
    void testCleanCollapsesWhitespaceAndComments() {
        assertThat(RegexTableReferenceExtractor.clean("SELECT  1 -- note\n /* x */ FROM t"))
                .isEqualTo("SELECT 1 FROM t");
        assertThat(RegexTableReferenceExtractor.clean("SELECT 'a -- b', \"c /* d\" FROM t /* e"))
                .isEqualTo("SELECT '', \"c /* d\" FROM t");
    }
}
