package com.pinotchat.mcp.pinot;

import com.pinotchat.mcp.config.ConfigParams;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Credentials resolved from configuration at one point in time.
 * A configured token wins over basic credentials; a token file is read again on every resolution
 * so rotated tokens are picked up by the next connection.
 *
 * @param username Driver user name ("" when authenticating with a token, null without credentials)
 * @param password Driver password (the token itself when authenticating with a token)
 * @param authorizationHeader Value for the HTTP Authorization header, or null
 */
public record AuthCredentials(String username, String password, String authorizationHeader) {
    private static final Logger logger = LoggerFactory.getLogger(AuthCredentials.class);
    private static final String BEARER_PREFIX = "Bearer ";

    public static AuthCredentials none() {
        return new AuthCredentials(null, null, null);
    }

    /**
     * Resolves the credentials to use right now.
     *
     * @param configParams Pinot configuration
     * @return Token credentials, basic credentials or {@link #none()}
     */
    public static AuthCredentials resolve(ConfigParams configParams) {
        String token = configParams.token();
        if (token == null && configParams.tokenFilename() != null) {
            token = readTokenFile(configParams.tokenFilename());
            if (token == null) {
                logger.warn("Failed to read token from {}, continuing without token", configParams.tokenFilename());
            }
        }

        if (token != null && !token.isBlank()) {
            // Token is sent as-is; the driver receives it as the password with an empty user
            return new AuthCredentials("", token, token);
        }
        if (notBlank(configParams.username()) && notBlank(configParams.password())) {
            String encoded = Base64.getEncoder().encodeToString(
                    (configParams.username() + ":" + configParams.password()).getBytes(StandardCharsets.UTF_8));
            return new AuthCredentials(configParams.username(), configParams.password(), "Basic " + encoded);
        }
        return none();
    }

    public boolean isTokenAuth() {
        return authorizationHeader != null && "".equals(username);
    }

    public boolean hasCredentials() {
        return authorizationHeader != null;
    }

    /**
     * Builds the JSON request headers shared by broker and controller calls.
     *
     * @param database Database name, empty for none
     * @return Header name to value, in a stable order
     */
    public Map<String, String> toHttpHeaders(String database) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("accept", "application/json");
        headers.put("Content-Type", "application/json");
        if (authorizationHeader != null) {
            headers.put("Authorization", authorizationHeader);
        }
        if (database != null && !database.isEmpty()) {
            headers.put("database", database);
        }
        return headers;
    }

    /**
     * Reads a token file, adding the Bearer prefix when it is missing.
     *
     * @return The token, or null if the file is missing, unreadable or empty
     */
    static String readTokenFile(String tokenFilename) {
        Path tokenPath = Paths.get(tokenFilename);
        if (!Files.exists(tokenPath)) {
            logger.error("Token file not found: {}", tokenFilename);
            return null;
        }
        if (!Files.isRegularFile(tokenPath)) {
            logger.error("Token path is not a file: {}", tokenFilename);
            return null;
        }

        String token;
        try {
            token = Files.readString(tokenPath, StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            logger.error("Failed to read token from file {}: {}", tokenFilename, e.getMessage());
            return null;
        }

        if (token.isEmpty()) {
            logger.warn("Token file is empty: {}", tokenFilename);
            return null;
        }
        return token.startsWith(BEARER_PREFIX) ? token : BEARER_PREFIX + token;
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }

    @Override
    public String toString() {
        String mode = !hasCredentials() ? "none" : isTokenAuth() ? "token" : "basic";
        return "AuthCredentials{mode=" + mode + ", username='" + username + "'}";
    }
}
