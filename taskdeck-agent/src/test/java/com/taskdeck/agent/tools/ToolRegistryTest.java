package com.taskdeck.agent.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

class ToolRegistryTest {

    private ToolRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ToolRegistry();
    }

    @Test
    void register_addsToolToRegistry() {
        registry.register(new EchoTool("echo"));

        assertEquals(1, registry.size());
        assertTrue(registry.get("echo").isPresent());
    }

    @Test
    void get_unknownTool_returnsEmpty() {
        assertTrue(registry.get("nonexistent").isEmpty());
    }

    @Test
    void registerAll_keepsFirstRegistration() {
        EchoTool first = new EchoTool("echo");
        registry.register(first);
        registry.registerAll(List.of(new EchoTool("echo"), new EchoTool("other")));

        assertEquals(2, registry.size());
        assertSame(first, registry.get("echo").orElseThrow());
    }

    @Test
    void toDefinitions_returnsCorrectStructureInOrder() {
        registry.register(new EchoTool("b_tool"));
        registry.register(new EchoTool("a_tool"));

        List<Map<String, Object>> defs = registry.toDefinitions();
        assertEquals(2, defs.size());

        Map<String, Object> def = defs.get(0);
        assertEquals("b_tool", def.get("name"));
        assertEquals("Echoes its text parameter", def.get("description"));
        ObjectNode schema = (ObjectNode) def.get("input_schema");
        assertEquals("object", schema.get("type").asText());
        assertTrue(schema.get("properties").has("text"));
        assertEquals("text", schema.get("required").get(0).asText());
    }

    @Test
    void readIntegerParam_acceptsNumericStrings() {
        ObjectNode params = ToolParamUtils.objectSchema();
        params.put("limit", "7");
        params.put("bad", "seven");

        assertEquals(7, ToolParamUtils.readIntegerParam(params, "limit"));
        assertNull(ToolParamUtils.readIntegerParam(params, "bad"));
        assertEquals(10, ToolParamUtils.readIntParam(params, "missing", 10));
    }

    @Test
    void readStringParam_requiredMissing_throws() {
        ObjectNode params = ToolParamUtils.objectSchema();
        params.put("title", "   ");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ToolParamUtils.readStringParam(params, "title", true));
        assertEquals("title required", e.getMessage());
        assertNull(ToolParamUtils.readStringParam(params, "title"));
    }

    static class EchoTool implements AgentTool {
        private final String name;

        EchoTool(String name) {
            this.name = name;
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public String getDescription() {
            return "Echoes its text parameter";
        }

        @Override
        public JsonNode getParameterSchema() {
            ObjectNode schema = ToolParamUtils.objectSchema();
            ToolParamUtils.addProperty(schema, "text", "string", "Text to echo");
            ToolParamUtils.require(schema, "text");
            return schema;
        }

        @Override
        public CompletableFuture<ToolResult> execute(ToolContext context) {
            return CompletableFuture.completedFuture(
                    ToolResult.ok(ToolParamUtils.readStringParam(context.getParameters(), "text", true)));
        }
    }
}
