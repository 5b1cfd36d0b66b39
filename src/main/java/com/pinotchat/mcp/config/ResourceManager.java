package com.pinotchat.mcp.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.text.MessageFormat;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads externalized text (error messages and prompt templates) from YAML files on the classpath.
 *
 * <p>Template formatting failures are propagated as {@link IllegalArgumentException}
 * so broken message files are detected early rather than silently ignored.
 */
public class ResourceManager {
    private static final Logger logger = LoggerFactory.getLogger(ResourceManager.class);
    private static final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    static final String ERROR_MESSAGES_RESOURCE = "error-messages.yaml";
    static final String PROMPTS_RESOURCE = "prompts.yaml";

    // Classpath resources never change while the server runs
    static final Map<String, Map<String, String>> yamlCache = new ConcurrentHashMap<>();

    private ResourceManager() {
    }

    /**
     * Gets an error message formatted with {@link MessageFormat}.
     *
     * @param messageKey The error message template key
     * @param paramsList Parameters for template formatting
     * @return Formatted error message
     * @throws IllegalArgumentException if template formatting fails
     */
    public static String getErrorMessage(String messageKey, Object... paramsList) {
        if (messageKey == null) {
            return "Error message not found: null";
        }

        Map<String, String> errorMessages = loadYamlResource(ERROR_MESSAGES_RESOURCE);
        String template = errorMessages.getOrDefault(messageKey, "Error message not found: " + messageKey);

        try {
            return MessageFormat.format(template, paramsList);
        } catch (IllegalArgumentException e) {
            String errorMsg = String.format("Failed to format error message '%s' with %d parameters: %s",
                    messageKey, paramsList != null ? paramsList.length : 0, e.getMessage());
            logger.error(errorMsg, e);
            throw new IllegalArgumentException(errorMsg, e);
        }
    }

    /**
     * Gets a prompt template verbatim.
     *
     * @param promptKey Prompt key, e.g. "pinot-query.template"
     * @return The template text, or null if it is not defined
     */
    public static String getPromptText(String promptKey) {
        if (promptKey == null) {
            return null;
        }
        return loadYamlResource(PROMPTS_RESOURCE).get(promptKey);
    }

    private static Map<String, String> loadYamlResource(String resourcePath) {
        return yamlCache.computeIfAbsent(resourcePath, ResourceManager::readYamlResource);
    }

    private static Map<String, String> readYamlResource(String resourcePath) {
        Map<String, String> yamlMap = new HashMap<>();
        try (InputStream inputStream = ResourceManager.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                logger.warn("YAML resource file not found: {}", resourcePath);
                return Collections.emptyMap();
            }
            JsonNode rootNode = yamlMapper.readTree(inputStream);
            if (rootNode != null) {
                rootNode.fields().forEachRemaining(entry -> yamlMap.put(entry.getKey(), entry.getValue().asText()));
            }
            logger.debug("Loaded YAML resource file: {} with {} entries", resourcePath, yamlMap.size());
        } catch (IOException e) {
            logger.error("Failed to load YAML resource file: {}", resourcePath, e);
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(yamlMap);
    }

    /**
     * Error message keys
     */
    public static class ErrorMessages {
        public static final String CONFIG_ERROR_TITLE = "config.error.title";
        public static final String STARTUP_PORT_INUSE = "startup.port.inuse";
        public static final String STARTUP_SOLUTIONS = "startup.solutions";
        public static final String FILTER_LOAD_FAILED = "filter.load.failed";
        public static final String QUERY_EMPTY = "query.empty";
        public static final String QUERY_NOT_SELECT = "query.not.select";
        public static final String QUERY_TOO_LONG = "query.too.long";
        public static final String ARGUMENT_MISSING = "argument.missing";
        public static final String ARGUMENT_INVALID_JSON = "argument.invalid.json";
        public static final String FILTER_FILE_NOT_CONFIGURED = "filter.file.not.configured";
        public static final String TOOL_UNKNOWN = "tool.unknown";
        public static final String PROMPT_UNKNOWN = "prompt.unknown";
    }
}
