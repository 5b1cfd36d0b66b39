package com.pinotchat.mcp.filter;

import java.util.regex.Pattern;

/**
 * Shell-style glob compiled to a regular expression.
 * Supports {@code *} (any run of characters), {@code ?} (exactly one character) and
 * {@code [...]} character classes with {@code !} negation. Matching is case-sensitive
 * and always covers the whole name.
 */
public final class GlobPattern {
    private final String glob;
    private final Pattern regex;

    private GlobPattern(String glob, Pattern regex) {
        this.glob = glob;
        this.regex = regex;
    }

    /**
     * Compiles a glob pattern.
     *
     * @param glob The glob text (e.g. "prod_*", "events_20??")
     * @return The compiled pattern
     * @throws IllegalArgumentException if the glob is null
     */
    public static GlobPattern compile(String glob) {
        if (glob == null) {
            throw new IllegalArgumentException("Glob pattern cannot be null");
        }
        return new GlobPattern(glob, Pattern.compile(toRegex(glob), Pattern.DOTALL));
    }

    /**
     * Tests whether the complete name matches this pattern.
     *
     * @param name Table or schema name
     * @return true if the name matches
     */
    public boolean matches(String name) {
        return name != null && regex.matcher(name).matches();
    }

    public String glob() {
        return glob;
    }

    static String toRegex(String glob) {
        StringBuilder regexBuilder = new StringBuilder(glob.length() + 8);
        int i = 0;
        while (i < glob.length()) {
            char c = glob.charAt(i);
            switch (c) {
                case '*' -> regexBuilder.append(".*");
                case '?' -> regexBuilder.append('.');
                case '[' -> {
                    int closing = findClassEnd(glob, i);
                    if (closing < 0) {
                        // Unterminated class is a literal bracket
                        regexBuilder.append("\\[");
                    } else {
                        appendCharClass(regexBuilder, glob.substring(i + 1, closing));
                        i = closing;
                    }
                }
                default -> regexBuilder.append(Pattern.quote(String.valueOf(c)));
            }
            i++;
        }
        return regexBuilder.toString();
    }

    private static int findClassEnd(String glob, int openIndex) {
        int j = openIndex + 1;
        if (j < glob.length() && glob.charAt(j) == '!') {
            j++;
        }
        // A ']' right after the opening bracket belongs to the class
        if (j < glob.length() && glob.charAt(j) == ']') {
            j++;
        }
        while (j < glob.length() && glob.charAt(j) != ']') {
            j++;
        }
        return j < glob.length() ? j : -1;
    }

    private static void appendCharClass(StringBuilder regexBuilder, String body) {
        regexBuilder.append('[');
        int start = 0;
        if (body.startsWith("!")) {
            regexBuilder.append('^');
            start = 1;
        }
        for (int k = start; k < body.length(); k++) {
            char c = body.charAt(k);
            if (c == '-' && k > start && k < body.length() - 1) {
                regexBuilder.append('-');
            } else if (Character.isLetterOrDigit(c)) {
                regexBuilder.append(c);
            } else {
                regexBuilder.append('\\').append(c);
            }
        }
        regexBuilder.append(']');
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof GlobPattern that && glob.equals(that.glob);
    }

    @Override
    public int hashCode() {
        return glob.hashCode();
    }

    @Override
    public String toString() {
        return glob;
    }
}
