package com.pinotchat.mcp.filter;

import java.util.ArrayList;
import java.util.List;

/**
 * One immutable revision of the table allow-list.
 * Either an ordered list of glob patterns or the unrestricted sentinel, which allows every table.
 * Revisions are replaced wholesale on reload and never modified.
 */
public final class FilterSet {
    private static final FilterSet UNRESTRICTED = new FilterSet(List.of(), true);

    private final List<String> patterns;
    private final List<GlobPattern> compiledPatterns;
    private final boolean unrestricted;

    private FilterSet(List<String> patterns, boolean unrestricted) {
        this.patterns = List.copyOf(patterns);
        this.unrestricted = unrestricted;

        List<GlobPattern> compiled = new ArrayList<>(patterns.size());
        for (String pattern : this.patterns) {
            compiled.add(GlobPattern.compile(pattern));
        }
        this.compiledPatterns = List.copyOf(compiled);
    }

    /**
     * @return The sentinel that disables filtering
     */
    public static FilterSet unrestricted() {
        return UNRESTRICTED;
    }

    /**
     * Creates a filter set from configured patterns.
     * An empty or null list means no filtering and yields {@link #unrestricted()}.
     *
     * @param patterns Glob patterns in configured order
     * @return A restricted filter set, or the unrestricted sentinel for an empty list
     * @throws IllegalArgumentException if any pattern is null or blank
     */
    public static FilterSet of(List<String> patterns) {
        if (patterns == null || patterns.isEmpty()) {
            return UNRESTRICTED;
        }
        for (String pattern : patterns) {
            if (pattern == null || pattern.isBlank()) {
                throw new IllegalArgumentException("Table patterns cannot be null or blank");
            }
        }
        return new FilterSet(patterns, false);
    }

    public List<String> patterns() {
        return patterns;
    }

    public boolean isUnrestricted() {
        return unrestricted;
    }

    /**
     * @return Number of patterns in this revision, 0 when unrestricted
     */
    public int size() {
        return patterns.size();
    }

    /**
     * Tests a single name against this revision.
     *
     * @param name Table or schema name
     * @return true if unrestricted or the name glob-matches at least one pattern
     */
    public boolean allows(String name) {
        if (unrestricted) {
            return true;
        }
        for (GlobPattern globPattern : compiledPatterns) {
            if (globPattern.matches(name)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof FilterSet that
                && unrestricted == that.unrestricted
                && patterns.equals(that.patterns);
    }

    @Override
    public int hashCode() {
        return 31 * patterns.hashCode() + Boolean.hashCode(unrestricted);
    }

    @Override
    public String toString() {
        return unrestricted ? "FilterSet{unrestricted}" : "FilterSet" + patterns;
    }
}
