package com.pinotchat.mcp.filter;

/**
 * Thrown when a table filter source is missing or malformed.
 * The previously active filter set stays in effect.
 */
public class ConfigurationException extends Exception {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
