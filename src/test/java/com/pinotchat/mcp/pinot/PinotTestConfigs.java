package com.pinotchat.mcp.pinot;

import com.pinotchat.mcp.config.ConfigParams;

/**
 * Configuration builders shared by the client tests.
 */
final class PinotTestConfigs {
    private PinotTestConfigs() {
    }

    static ConfigParams forServer(FakePinotServer server) {
        return ConfigParams.defaultConfig(server.baseUrl(), "localhost", server.port());
    }

    static ConfigParams withAuth(FakePinotServer server, String username, String password, String token,
                                 String database, boolean useMsqe) {
        return new ConfigParams(server.baseUrl(), "localhost", server.port(), "http",
                username, password, token, null, database, useMsqe,
                5, 5, 30, null, false, ConfigParams.DEFAULT_JDBC_DRIVER, null,
                ConfigParams.DEFAULT_MAX_QUERY_LENGTH);
    }
}
