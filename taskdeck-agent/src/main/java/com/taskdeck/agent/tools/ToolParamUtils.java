package com.taskdeck.agent.tools;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Helpers for reading tool parameters and building tool results and schemas.
 */
public final class ToolParamUtils {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private ToolParamUtils() {
    }

    // --- String param ---

    /**
     * Read a string parameter from the JSON params node.
     *
     * @param params   JSON parameter node
     * @param key      parameter key
     * @param required if true, throws when missing
     * @return trimmed string value, or null if absent and not required
     */
    public static String readStringParam(JsonNode params, String key, boolean required) {
        JsonNode node = params != null ? params.get(key) : null;
        if (node == null || !node.isTextual() || node.asText().isBlank()) {
            if (required)
                throw new IllegalArgumentException(key + " required");
            return null;
        }
        return node.asText().trim();
    }

    public static String readStringParam(JsonNode params, String key) {
        return readStringParam(params, key, false);
    }

    // --- Number param ---

    /**
     * Read an integer parameter, accepting numbers and numeric strings.
     */
    public static Integer readIntegerParam(JsonNode params, String key) {
        JsonNode node = params != null ? params.get(key) : null;
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.asInt();
        }
        if (node.isTextual()) {
            try {
                return (int) Double.parseDouble(node.asText().trim());
            } catch (NumberFormatException ignored) {
                return null;
            }
        }
        return null;
    }

    public static int readIntParam(JsonNode params, String key, int defaultValue) {
        Integer n = readIntegerParam(params, key);
        return n != null ? n : defaultValue;
    }

    // --- Results ---

    /**
     * Serialize a payload as the tool output, keeping the payload as data.
     */
    public static AgentTool.ToolResult jsonResult(Object payload) {
        return AgentTool.ToolResult.ok(toJsonString(payload), payload);
    }

    public static String toJsonString(Object value) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }

    // --- Schema ---

    public static ObjectNode objectSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        schema.putObject("properties");
        return schema;
    }

    public static void addProperty(ObjectNode schema, String key, String type, String description) {
        ObjectNode p = ((ObjectNode) schema.get("properties")).putObject(key);
        p.put("type", type);
        p.put("description", description);
    }

    public static void addEnumProperty(ObjectNode schema, String key, String description, String... values) {
        ObjectNode p = ((ObjectNode) schema.get("properties")).putObject(key);
        p.put("type", "string");
        p.put("description", description);
        ArrayNode e = p.putArray("enum");
        for (String v : values)
            e.add(v);
    }

    public static void require(ObjectNode schema, String... keys) {
        ArrayNode required = schema.putArray("required");
        for (String k : keys)
            required.add(k);
    }
}
