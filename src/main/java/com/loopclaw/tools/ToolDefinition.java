package com.loopclaw.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.LinkedHashMap;
import java.util.Map;

public record ToolDefinition(String name, String description, JsonNode inputSchema, boolean dangerous) {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public Map<String, Object> toSchema() {
        var schema = new LinkedHashMap<String, Object>();
        schema.put("name", name);
        schema.put("description", description);
        schema.put("input_schema", inputSchema != null
                ? MAPPER.convertValue(inputSchema, Map.class)
                : Map.of("type", "object"));
        return schema;
    }
}
