package com.loopclaw.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class BuiltinToolsTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir
    Path tempDir;

    @Test
    void listFilesMarksDirectories() throws Exception {
        Files.writeString(tempDir.resolve("b.txt"), "b");
        Files.createDirectory(tempDir.resolve("a"));

        var result = new ListFilesTool().execute(ctx(), MAPPER.readTree("{\"path\":\".\"}"));

        assertFalse(result.isError());
        assertEquals("a/\nb.txt", result.output());
        assertEquals("c1", result.toolCallId());
    }

    @Test
    void listFilesDefaultsToWorkDir() throws Exception {
        Files.writeString(tempDir.resolve("only.txt"), "x");
        var result = new ListFilesTool().execute(ctx(), MAPPER.createObjectNode());
        assertEquals("only.txt", result.output());
    }

    @Test
    void listFilesRejectsEscape() throws Exception {
        var result = new ListFilesTool().execute(ctx(), MAPPER.readTree("{\"path\":\"../..\"}"));
        assertTrue(result.isError());
    }

    @Test
    void readsFile() throws Exception {
        Files.writeString(tempDir.resolve("hello.txt"), "hello world");

        var result = new FileReadTool().execute(ctx(), MAPPER.readTree("{\"path\":\"hello.txt\"}"));

        assertFalse(result.isError());
        assertEquals("hello world", result.output());
    }

    @Test
    void readReportsMissingFileAsError() throws Exception {
        var result = new FileReadTool().execute(ctx(), MAPPER.readTree("{\"path\":\"nope.txt\"}"));
        assertTrue(result.isError());
        assertTrue(result.error().contains("nope.txt"));

        var noPath = new FileReadTool().execute(ctx(), MAPPER.createObjectNode());
        assertTrue(noPath.isError());
    }

    @Test
    void writesFileCreatingParents() throws Exception {
        var input = MAPPER.createObjectNode().put("path", "sub/dir/out.txt").put("content", "data");

        var result = new FileWriteTool().execute(ctx(), input);

        assertFalse(result.isError());
        assertEquals("data", Files.readString(tempDir.resolve("sub/dir/out.txt")));
    }

    @Test
    void writeRejectsPathOutsideWorkDir() {
        var input = MAPPER.createObjectNode().put("path", "../escape.txt").put("content", "x");

        var result = new FileWriteTool().execute(ctx(), input);

        assertTrue(result.isError());
        assertFalse(Files.exists(tempDir.getParent().resolve("escape.txt")));
    }

    @Test
    void onlyWriteToolIsDangerous() {
        assertFalse(new ListFilesTool().isDangerous());
        assertFalse(new FileReadTool().isDangerous());
        assertTrue(new FileWriteTool().isDangerous());
    }

    private ToolContext ctx() {
        return new ToolContext("c1", tempDir.toString());
    }
}
