package com.loopclaw.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.nio.file.Files;

public class FileReadTool implements Tool {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override public String name() { return "file_read"; }

    @Override public String description() {
        return "Read the contents of a file";
    }

    @Override public JsonNode inputSchema() {
        return MAPPER.createObjectNode()
                .put("type", "object")
                .<ObjectNode>set("properties",
                        MAPPER.createObjectNode().set("path",
                                MAPPER.createObjectNode().put("type", "string")))
                .set("required", MAPPER.createArrayNode().add("path"));
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input) {
        var raw = input.path("path").asText("");
        if (raw.isBlank()) return ToolResult.failure(ctx.toolCallId(), "path is required");
        try {
            var file = WorkspacePaths.resolve(ctx.workDir(), raw);
            if (!Files.isRegularFile(file)) {
                return ToolResult.failure(ctx.toolCallId(), "Not a file: " + raw);
            }
            if (Files.size(file) > WorkspacePaths.MAX_FILE_SIZE_BYTES) {
                return ToolResult.failure(ctx.toolCallId(),
                        "File too large: max " + WorkspacePaths.MAX_FILE_SIZE_BYTES + " bytes");
            }
            return ToolResult.success(ctx.toolCallId(), Files.readString(file));
        } catch (SecurityException e) {
            return ToolResult.failure(ctx.toolCallId(), e.getMessage());
        } catch (Exception e) {
            return ToolResult.failure(ctx.toolCallId(), "Cannot read " + raw + ": " + e.getMessage());
        }
    }
}
