package com.loopclaw.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.ArrayList;
import java.util.Objects;

public record ToolCall(String id, String name, JsonNode input) {

    public ToolCall {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        input = input == null ? JsonNodeFactory.instance.objectNode() : input.deepCopy();
    }

    @Override
    public String toString() {
        var args = new ArrayList<String>();
        input.fields().forEachRemaining(e -> args.add(e.getKey() + "=" + e.getValue()));
        return name + "(" + String.join(", ", args) + ")";
    }
}
