package com.pinotchat.mcp.prompts;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pinotchat.mcp.config.ResourceManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * MCP prompts service. Prompt text comes from {@code prompts.yaml}.
 */
public class PromptService {
    private static final Logger logger = LoggerFactory.getLogger(PromptService.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    public static final String PINOT_QUERY_PROMPT = "pinot-query";

    /**
     * Lists all available prompts following MCP prompts protocol
     */
    public JsonNode listPrompts() {
        ArrayNode promptsArray = objectMapper.createArrayNode();

        ObjectNode pinotQuery = objectMapper.createObjectNode();
        pinotQuery.put("name", PINOT_QUERY_PROMPT);
        pinotQuery.put("description", ResourceManager.getPromptText(PINOT_QUERY_PROMPT + ".description"));
        pinotQuery.set("arguments", objectMapper.createArrayNode());
        promptsArray.add(pinotQuery);

        ObjectNode result = objectMapper.createObjectNode();
        result.set("prompts", promptsArray);
        logger.debug("Listed {} available prompts", promptsArray.size());
        return result;
    }

    /**
     * Gets a specific prompt following MCP prompts protocol
     *
     * @param name Prompt name
     * @return Prompt with a single user message
     * @throws IllegalArgumentException if the prompt is unknown
     */
    public JsonNode getPrompt(String name) {
        if (!PINOT_QUERY_PROMPT.equals(name)) {
            throw new IllegalArgumentException(
                    ResourceManager.getErrorMessage(ResourceManager.ErrorMessages.PROMPT_UNKNOWN, name));
        }
        logger.info("Getting prompt: {}", name);

        ObjectNode content = objectMapper.createObjectNode();
        content.put("type", "text");
        content.put("text", ResourceManager.getPromptText(PINOT_QUERY_PROMPT + ".template"));

        ObjectNode promptMessage = objectMapper.createObjectNode();
        promptMessage.put("role", "user");
        promptMessage.set("content", content);

        ArrayNode messages = objectMapper.createArrayNode();
        messages.add(promptMessage);

        ObjectNode result = objectMapper.createObjectNode();
        result.put("description", ResourceManager.getPromptText(PINOT_QUERY_PROMPT + ".description"));
        result.set("messages", messages);
        return result;
    }
}
