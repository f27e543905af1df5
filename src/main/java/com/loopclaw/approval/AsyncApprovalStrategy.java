package com.loopclaw.approval;

import com.loopclaw.tools.ToolCall;
import com.loopclaw.tools.ToolDefinition;

import java.util.concurrent.CompletableFuture;

/**
 * Approval answered later, e.g. by a button press in a chat platform.
 * A future that fails or completes with {@code null} counts as a denial.
 */
@FunctionalInterface
public interface AsyncApprovalStrategy {

    CompletableFuture<Boolean> requestApproval(ToolCall call, ToolDefinition definition);

    default ApprovalStrategy blocking() {
        return (call, definition) -> Boolean.TRUE.equals(requestApproval(call, definition).join());
    }
}
