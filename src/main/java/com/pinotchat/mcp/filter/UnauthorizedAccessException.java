package com.pinotchat.mcp.filter;

import java.util.List;

/**
 * Thrown when a query or an explicit table/schema name is not covered by the allow-list.
 * Carries every rejected name and the patterns that were active, so one failure gives the
 * operator the complete picture.
 */
public class UnauthorizedAccessException extends SecurityException {
    private final List<String> unauthorizedNames;
    private final List<String> allowedPatterns;

    public UnauthorizedAccessException(List<String> unauthorizedNames, List<String> allowedPatterns) {
        super(buildMessage(unauthorizedNames, allowedPatterns));
        this.unauthorizedNames = List.copyOf(unauthorizedNames);
        this.allowedPatterns = List.copyOf(allowedPatterns);
    }

    public List<String> getUnauthorizedNames() {
        return unauthorizedNames;
    }

    public List<String> getAllowedPatterns() {
        return allowedPatterns;
    }

    private static String buildMessage(List<String> unauthorizedNames, List<String> allowedPatterns) {
        return String.format("Access denied to table(s): %s. Allowed table patterns: %s",
                String.join(", ", unauthorizedNames), String.join(", ", allowedPatterns));
    }
}
