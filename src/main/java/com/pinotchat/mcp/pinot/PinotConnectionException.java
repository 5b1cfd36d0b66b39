package com.pinotchat.mcp.pinot;

import java.sql.SQLException;

/**
 * Thrown when a driver connection cannot be created or fails its liveness probe on creation.
 */
public class PinotConnectionException extends SQLException {
    public PinotConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
