package com.pinotchat.mcp.filter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regex-based table reference extractor.
 *
 * <p>Comments and string literal contents are removed and whitespace collapsed first. A single
 * left-to-right scan decides what opens first, so a {@code /*} inside a {@code --} comment, or a
 * {@code --} inside a quoted literal or identifier, is never taken as a comment start. Every
 * {@code FROM} and {@code JOIN} keyword then starts a scan of a table list: a reference (unquoted, {@code "double quoted"}
 * or {@code `backtick quoted`}, optionally qualified as {@code db.schema.table}, of which only
 * {@code table} is kept), an optional alias, and a comma continuation for old-style joins such
 * as {@code FROM a x, b y}.
 *
 * <p>Names defined by a {@code WITH} list are dropped when they are referenced after their own
 * definition and inside the statement or subquery that declares them. A reference inside the
 * CTE body itself still counts as a table.
 *
 * <p>This is not a SQL parser. Nested subqueries and UNIONs are covered because their
 * {@code FROM} clauses are still present in the text.
 */
public class RegexTableReferenceExtractor implements TableReferenceExtractor {
    private static final Logger logger = LoggerFactory.getLogger(RegexTableReferenceExtractor.class);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    // Join modifiers and clause keywords that may directly follow FROM/JOIN
    private static final String NOT_A_TABLE =
            "(?!(?:LEFT|RIGHT|INNER|OUTER|FULL|CROSS|NATURAL|LATERAL|ON|USING|WHERE|GROUP|ORDER|HAVING|LIMIT|"
                    + "SELECT|UNION|EXCEPT|INTERSECT|OPTION)\\b)";

    // Words that end a table entry instead of naming its alias
    private static final String NOT_AN_ALIAS =
            "(?!(?:LEFT|RIGHT|INNER|OUTER|FULL|CROSS|NATURAL|JOIN|ON|USING|WHERE|GROUP|ORDER|HAVING|LIMIT|OFFSET|"
                    + "FETCH|UNION|EXCEPT|INTERSECT|OPTION|WINDOW|QUALIFY|TABLESAMPLE|SET|AS)\\b)";

    private static final String DOUBLE_QUOTED = "\"(?:[^\"]|\"\")+\"";
    private static final String BACKTICK_QUOTED = "`(?:[^`]|``)+`";
    private static final String UNQUOTED = "[A-Za-z_][A-Za-z0-9_$]*";
    private static final String SEGMENT = "(?:" + DOUBLE_QUOTED + "|" + BACKTICK_QUOTED + "|" + UNQUOTED + ")";

    private static final Pattern ANCHOR = Pattern.compile("\\b(?:FROM|JOIN)\\s+", Pattern.CASE_INSENSITIVE);
    private static final Pattern REFERENCE = Pattern.compile(
            NOT_A_TABLE + SEGMENT + "(?:\\s*\\.\\s*" + SEGMENT + ")*", Pattern.CASE_INSENSITIVE);
    private static final Pattern ALIAS = Pattern.compile(
            "\\s+(?:AS\\s+)?" + NOT_AN_ALIAS + SEGMENT, Pattern.CASE_INSENSITIVE);
    private static final Pattern COMMA = Pattern.compile("\\s*,\\s*");
    private static final Pattern SEGMENT_PATTERN = Pattern.compile(SEGMENT);

    private static final Pattern WITH_KEYWORD = Pattern.compile("\\bWITH\\s+(?:RECURSIVE\\s+)?",
            Pattern.CASE_INSENSITIVE);
    // name [ (col, ...) ] AS (
    private static final Pattern CTE_HEAD = Pattern.compile(
            "(" + SEGMENT + ")\\s*(?:\\([^()]*\\)\\s*)?AS\\s*\\(", Pattern.CASE_INSENSITIVE);
    private static final Pattern CTE_SEPARATOR = Pattern.compile("\\s*,\\s*");

    private record TableReference(String name, int position) {
    }

    private record CteScope(String name, int bodyEnd, int scopeEnd) {
        boolean covers(TableReference reference) {
            return name.equals(reference.name()) && reference.position() >= bodyEnd && reference.position() < scopeEnd;
        }
    }

    @Override
    public Set<String> extract(String query) {
        if (query == null || query.isBlank()) {
            return Collections.emptySet();
        }

        Set<String> tableNames = new LinkedHashSet<>();
        try {
            String cleanedSql = clean(query);
            List<TableReference> references = new ArrayList<>();
            Matcher anchorMatcher = ANCHOR.matcher(cleanedSql);
            while (anchorMatcher.find()) {
                scanTableList(cleanedSql, anchorMatcher.end(), references);
            }
            List<CteScope> cteScopes = findCteScopes(cleanedSql);
            for (TableReference reference : references) {
                if (cteScopes.stream().noneMatch(cteScope -> cteScope.covers(reference))) {
                    tableNames.add(reference.name());
                }
            }
        } catch (RuntimeException e) {
            // Keep whatever was found before the failure
            logger.warn("Table extraction stopped early: {}", e.getMessage());
        }

        logger.debug("Extracted tables {} from query", tableNames);
        return Collections.unmodifiableSet(tableNames);
    }

    /**
     * Removes comments, empties string literals and collapses every whitespace run to a single space.
     * Quoted identifiers are copied as written. An unterminated literal or identifier is kept as is.
     *
     * @param query Raw SQL text
     * @return Cleaned SQL text
     */
    static String clean(String query) {
        StringBuilder cleaned = new StringBuilder(query.length());
        int length = query.length();
        int position = 0;
        while (position < length) {
            char current = query.charAt(position);
            char next = position + 1 < length ? query.charAt(position + 1) : '\0';
            if (current == '-' && next == '-') {
                position = lineEnd(query, position + 2);
                cleaned.append(' ');
            } else if (current == '/' && next == '*') {
                int commentEnd = query.indexOf("*/", position + 2);
                position = commentEnd < 0 ? length : commentEnd + 2;
                cleaned.append(' ');
            } else if (current == '\'' || current == '"' || current == '`') {
                int quotedEnd = quotedEnd(query, position);
                if (quotedEnd < 0) {
                    cleaned.append(query, position, length);
                    position = length;
                } else {
                    cleaned.append(current == '\'' ? "''" : query.substring(position, quotedEnd));
                    position = quotedEnd;
                }
            } else {
                cleaned.append(current);
                position++;
            }
        }
        return WHITESPACE.matcher(cleaned).replaceAll(" ").trim();
    }

    private static int lineEnd(String sql, int fromIndex) {
        int position = fromIndex;
        while (position < sql.length() && sql.charAt(position) != '\n' && sql.charAt(position) != '\r') {
            position++;
        }
        return position;
    }

    /**
     * Returns the index just past the quoted run starting at {@code openIndex}, or -1 if it is
     * never closed. A doubled quote character is an escape.
     */
    private static int quotedEnd(String sql, int openIndex) {
        char quote = sql.charAt(openIndex);
        int position = openIndex + 1;
        while (position < sql.length()) {
            if (sql.charAt(position) == quote) {
                if (position + 1 < sql.length() && sql.charAt(position + 1) == quote) {
                    position += 2;
                    continue;
                }
                return position + 1;
            }
            position++;
        }
        return -1;
    }

    private static int skipQuoted(String sql, int openIndex) {
        int quotedEnd = quotedEnd(sql, openIndex);
        return quotedEnd < 0 ? sql.length() : quotedEnd;
    }

    private static boolean[] quotedPositions(String sql) {
        boolean[] quoted = new boolean[sql.length()];
        int position = 0;
        while (position < sql.length()) {
            char current = sql.charAt(position);
            if (current == '\'' || current == '"' || current == '`') {
                int quotedEnd = skipQuoted(sql, position);
                Arrays.fill(quoted, position, quotedEnd, true);
                position = quotedEnd;
            } else {
                position++;
            }
        }
        return quoted;
    }

    private static List<CteScope> findCteScopes(String sql) {
        List<CteScope> cteScopes = new ArrayList<>();
        Matcher withMatcher = WITH_KEYWORD.matcher(sql);
        Matcher headMatcher = CTE_HEAD.matcher(sql);
        Matcher separatorMatcher = CTE_SEPARATOR.matcher(sql);

        boolean[] quoted = quotedPositions(sql);
        while (withMatcher.find()) {
            if (quoted[withMatcher.start()]) {
                continue;
            }
            int scopeEnd = enclosingScopeEnd(sql, withMatcher.start());
            int position = withMatcher.end();
            while (position < sql.length()) {
                headMatcher.region(position, sql.length());
                if (!headMatcher.lookingAt()) {
                    break;
                }
                int bodyEnd = closingParenthesis(sql, headMatcher.end() - 1);
                if (bodyEnd < 0) {
                    break;
                }
                cteScopes.add(new CteScope(unquote(headMatcher.group(1)), bodyEnd, scopeEnd));

                separatorMatcher.region(bodyEnd, sql.length());
                if (!separatorMatcher.lookingAt()) {
                    break;
                }
                position = separatorMatcher.end();
            }
        }
        return cteScopes;
    }

    /**
     * Finds where the statement or parenthesized subquery containing {@code startIndex} ends:
     * the first unmatched closing parenthesis or statement separator at the same depth.
     */
    private static int enclosingScopeEnd(String sql, int startIndex) {
        int depth = 0;
        int position = startIndex;
        while (position < sql.length()) {
            char current = sql.charAt(position);
            if (current == '\'' || current == '"' || current == '`') {
                position = skipQuoted(sql, position);
                continue;
            }
            if (current == '(') {
                depth++;
            } else if (current == ')') {
                if (depth == 0) {
                    return position;
                }
                depth--;
            } else if (current == ';' && depth == 0) {
                return position;
            }
            position++;
        }
        return sql.length();
    }

    /**
     * @return Index just past the parenthesis matching the one at {@code openIndex}, or -1 if unbalanced
     */
    private static int closingParenthesis(String sql, int openIndex) {
        int depth = 0;
        int position = openIndex;
        while (position < sql.length()) {
            char current = sql.charAt(position);
            if (current == '\'' || current == '"' || current == '`') {
                position = skipQuoted(sql, position);
                continue;
            }
            if (current == '(') {
                depth++;
            } else if (current == ')') {
                depth--;
                if (depth == 0) {
                    return position + 1;
                }
            }
            position++;
        }
        return -1;
    }

    private void scanTableList(String sql, int startIndex, List<TableReference> references) {
        Matcher referenceMatcher = REFERENCE.matcher(sql);
        Matcher aliasMatcher = ALIAS.matcher(sql);
        Matcher commaMatcher = COMMA.matcher(sql);

        int position = startIndex;
        while (position < sql.length()) {
            referenceMatcher.region(position, sql.length());
            if (!referenceMatcher.lookingAt()) {
                return;
            }
            references.add(new TableReference(lastSegment(referenceMatcher.group()), referenceMatcher.start()));
            position = referenceMatcher.end();

            aliasMatcher.region(position, sql.length());
            if (aliasMatcher.lookingAt()) {
                position = aliasMatcher.end();
            }

            commaMatcher.region(position, sql.length());
            if (!commaMatcher.lookingAt()) {
                return;
            }
            position = commaMatcher.end();
        }
    }

    /**
     * Returns the unquoted table part of a possibly qualified reference.
     */
    static String lastSegment(String reference) {
        Matcher segmentMatcher = SEGMENT_PATTERN.matcher(reference);
        String lastSegment = reference;
        while (segmentMatcher.find()) {
            lastSegment = segmentMatcher.group();
        }
        return unquote(lastSegment);
    }

    private static String unquote(String segment) {
        if (segment.length() >= 2) {
            char first = segment.charAt(0);
            char last = segment.charAt(segment.length() - 1);
            if ((first == '"' || first == '`') && last == first) {
                String doubled = String.valueOf(first) + first;
                return segment.substring(1, segment.length() - 1).replace(doubled, String.valueOf(first));
            }
        }
        return segment;
    }
}
