package com.pinotchat.mcp.pinot;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Opens a new driver connection. Called by {@link ConnectionManager} whenever it needs a fresh handle.
 */
@FunctionalInterface
public interface ConnectionFactory {
    Connection create() throws SQLException;
}
