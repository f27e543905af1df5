package com.loopclaw.tools;

public record ToolResult(
    String toolCallId,
    String output,
    String error,
    boolean isError,
    Integer exitCode
) {
    public ToolResult {
        output = output != null ? output : "";
    }

    public static ToolResult success(String toolCallId, String output) {
        return new ToolResult(toolCallId, output, null, false, null);
    }

    public static ToolResult failure(String toolCallId, String error) {
        return new ToolResult(toolCallId, "", error, true, null);
    }

    public ToolResult withExitCode(int code) {
        return new ToolResult(toolCallId, output, error, isError, code);
    }

    /** Text fed back to the model: the output, or the error message on failure. */
    public String content() {
        if (!isError) return output;
        if (error == null || error.isBlank()) return output;
        return output.isEmpty() ? error : output + "\n" + error;
    }
}
