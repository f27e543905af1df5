package com.loopclaw.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Collectors;

public class ListFilesTool implements Tool {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final int MAX_ENTRIES = 500;

    @Override public String name() { return "list_files"; }

    @Override public String description() {
        return "List the entries of a directory inside the working directory";
    }

    @Override public JsonNode inputSchema() {
        return MAPPER.createObjectNode()
                .put("type", "object")
                .<ObjectNode>set("properties",
                        MAPPER.createObjectNode().set("path",
                                MAPPER.createObjectNode()
                                        .put("type", "string")
                                        .put("description", "directory to list, relative to the working directory")))
                .set("required", MAPPER.createArrayNode());
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input) {
        try {
            var dir = WorkspacePaths.resolve(ctx.workDir(), input.path("path").asText("."));
            if (!Files.isDirectory(dir)) {
                return ToolResult.failure(ctx.toolCallId(), "Not a directory: " + input.path("path").asText("."));
            }
            try (var entries = Files.list(dir)) {
                var listing = entries
                        .sorted()
                        .limit(MAX_ENTRIES)
                        .map(ListFilesTool::render)
                        .collect(Collectors.joining("\n"));
                return ToolResult.success(ctx.toolCallId(), listing);
            }
        } catch (SecurityException e) {
            return ToolResult.failure(ctx.toolCallId(), e.getMessage());
        } catch (Exception e) {
            return ToolResult.failure(ctx.toolCallId(), "Cannot list directory: " + e.getMessage());
        }
    }

    private static String render(Path p) {
        var name = p.getFileName().toString();
        return Files.isDirectory(p) ? name + "/" : name;
    }
}
