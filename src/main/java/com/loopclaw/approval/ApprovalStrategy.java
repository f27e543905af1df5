package com.loopclaw.approval;

import com.loopclaw.tools.ToolCall;
import com.loopclaw.tools.ToolDefinition;

@FunctionalInterface
public interface ApprovalStrategy {
    boolean approve(ToolCall call, ToolDefinition definition);
}
