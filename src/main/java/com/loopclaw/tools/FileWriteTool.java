package com.loopclaw.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.loopclaw.approval.DangerousOperation;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.StandardOpenOption;

@DangerousOperation(reason = "Creates or overwrites files in the working directory")
public class FileWriteTool implements Tool {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override public String name() { return "file_write"; }

    @Override public String description() {
        return "Write content to a file";
    }

    @Override public JsonNode inputSchema() {
        var props = MAPPER.createObjectNode();
        props.set("path", MAPPER.createObjectNode().put("type", "string"));
        props.set("content", MAPPER.createObjectNode().put("type", "string"));
        return MAPPER.createObjectNode()
                .put("type", "object")
                .<ObjectNode>set("properties", props)
                .set("required", MAPPER.createArrayNode().add("path").add("content"));
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input) {
        var raw = input.path("path").asText("");
        if (raw.isBlank()) return ToolResult.failure(ctx.toolCallId(), "path is required");
        try {
            var target = WorkspacePaths.resolve(ctx.workDir(), raw);
            if (Files.isSymbolicLink(target)) {
                return ToolResult.failure(ctx.toolCallId(), "Target is a symlink");
            }
            var parent = target.getParent();
            if (parent != null) Files.createDirectories(parent);

            var content = input.path("content").asText("");
            try (var out = Files.newOutputStream(
                    target,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.WRITE,
                    LinkOption.NOFOLLOW_LINKS)) {
                out.write(content.getBytes(StandardCharsets.UTF_8));
            }
            return ToolResult.success(ctx.toolCallId(), "Written to " + raw);
        } catch (SecurityException e) {
            return ToolResult.failure(ctx.toolCallId(), e.getMessage());
        } catch (Exception e) {
            return ToolResult.failure(ctx.toolCallId(), "Cannot write " + raw + ": " + e.getMessage());
        }
    }
}
