package com.pinotchat.mcp.pinot;

import com.pinotchat.mcp.config.ConfigParams;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Properties;

/**
 * Opens connections through {@link DriverManager} using the configured driver class and URL.
 * Credentials are resolved again for every connection.
 */
public class DriverConnectionFactory implements ConnectionFactory {
    private static final Logger logger = LoggerFactory.getLogger(DriverConnectionFactory.class);

    private final ConfigParams configParams;

    public DriverConnectionFactory(ConfigParams configParams) {
        this.configParams = configParams;
    }

    @Override
    public Connection create() throws SQLException {
        try {
            Class.forName(configParams.jdbcDriver());
        } catch (ClassNotFoundException e) {
            throw new SQLException("Pinot driver not found on classpath: " + configParams.jdbcDriver(), e);
        }

        AuthCredentials credentials = AuthCredentials.resolve(configParams);
        Properties connectionProps = buildProperties(credentials);

        logger.debug("Creating driver connection to {} with MSQE={}, database='{}', auth={}",
                configParams.jdbcUrl(), configParams.useMsqe(), configParams.database(), credentials);
        return DriverManager.getConnection(configParams.jdbcUrl(), connectionProps);
    }

    /**
     * Maps credentials and query settings onto driver properties.
     */
    Properties buildProperties(AuthCredentials credentials) {
        Properties connectionProps = new Properties();
        if (credentials.isTokenAuth()) {
            connectionProps.setProperty("headers.Authorization", credentials.authorizationHeader());
        } else if (credentials.hasCredentials()) {
            connectionProps.setProperty("user", credentials.username());
            connectionProps.setProperty("password", credentials.password());
        }
        if (configParams.hasDatabase()) {
            connectionProps.setProperty("headers.database", configParams.database());
        }
        if (configParams.useMsqe()) {
            connectionProps.setProperty("useMultistageEngine", "true");
        }
        return connectionProps;
    }
}
