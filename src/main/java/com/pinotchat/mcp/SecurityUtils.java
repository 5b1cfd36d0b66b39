package com.pinotchat.mcp;

import java.util.regex.Pattern;

/**
 * Helpers for handling untrusted query text before it is logged or executed.
 */
public final class SecurityUtils {

    private static final Pattern LEADING_COMMENTS = Pattern.compile("^(\\s*(--[^\\n]*(\\n|$)|/\\*.*?\\*/))*\\s*",
            Pattern.DOTALL);
    private static final Pattern READ_ONLY_START = Pattern.compile("^\\(*\\s*(SELECT|WITH)\\b",
            Pattern.CASE_INSENSITIVE);

    private SecurityUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Checks whether a query starts with SELECT or WITH once leading comments and
     * opening parentheses are skipped.
     *
     * @param queryText The query to check (can be null)
     * @return true for a read-only query shape
     */
    public static boolean isSelectQuery(String queryText) {
        if (queryText == null) {
            return false;
        }
        String body = LEADING_COMMENTS.matcher(queryText).replaceFirst("");
        return READ_ONLY_START.matcher(body).find();
    }

    /**
     * Truncates a string to the specified maximum length.
     *
     * @param inputString The string to truncate (can be null)
     * @param maxLength Maximum length allowed
     * @return Truncated string with a trailing ellipsis, or the original if within limit
     */
    public static String truncateString(String inputString, int maxLength) {
        if (maxLength <= 0) {
            maxLength = 0;
        }
        if (inputString == null || inputString.length() <= maxLength) {
            return inputString;
        }
        return inputString.substring(0, maxLength) + "...";
    }
}
